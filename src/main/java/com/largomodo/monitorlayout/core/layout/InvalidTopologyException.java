package com.largomodo.monitorlayout.core.layout;

/**
 * Thrown when a client topology cannot be applied at all (missing or duplicate
 * primary, primary away from the client origin, unsupported monitor count, coordinates
 * outside the int range).
 * <p>
 * RuntimeException so validation can fail fast without catch blocks at every
 * call site. The head store is never touched when this is thrown.
 */
public class InvalidTopologyException extends RuntimeException {

    /**
     * @param message which rule the topology broke
     */
    public InvalidTopologyException(String message) {
        super(message);
    }

    public InvalidTopologyException(String message, Throwable cause) {
        super(message, cause);
    }
}
