package com.largomodo.monitorlayout.core.head;

/**
 * Thrown when an output lifecycle call fails or leaves the output in a state
 * that does not match the head it serves.
 * <p>
 * The reconciler logs it and carries on with the other heads; the affected
 * output stays out of sync until the next successful update.
 */
public class OutputManagerException extends RuntimeException {

    public OutputManagerException(String message) {
        super(message);
    }

    public OutputManagerException(String message, Throwable cause) {
        super(message, cause);
    }
}
