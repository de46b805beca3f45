package com.extsync.core.output;

/**
 * Thrown when the build output directory cannot be prepared or cleaned.
 */
public class BuildOutputException extends RuntimeException {
    public BuildOutputException(String message) {
        super(message);
    }

    public BuildOutputException(String message, Throwable cause) {
        super(message, cause);
    }
}
