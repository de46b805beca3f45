package com.extsync.core.incremental;

/**
 * Thrown when incremental sessions cannot be opened for one or more artifacts.
 */
public class IncrementalSessionException extends RuntimeException {
    public IncrementalSessionException(String message) {
        super(message);
    }

    public IncrementalSessionException(String message, Throwable cause) {
        super(message, cause);
    }
}
