package com.largomodo.monitorlayout.core.head;

/**
 * Thrown when a new head cannot be created during reconciliation.
 * <p>
 * The rest of the pass is abandoned. Heads already updated keep their new
 * state and untouched heads keep their old one; nothing is rolled back.
 */
public class ResourceExhaustionException extends RuntimeException {

    public ResourceExhaustionException(String message, Throwable cause) {
        super(message, cause);
    }
}
