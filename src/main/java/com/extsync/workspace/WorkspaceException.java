package com.extsync.workspace;

/**
 * Thrown when a workspace cannot be read or watched.
 */
public class WorkspaceException extends RuntimeException {
    public WorkspaceException(String message) {
        super(message);
    }

    public WorkspaceException(String message, Throwable cause) {
        super(message, cause);
    }
}
