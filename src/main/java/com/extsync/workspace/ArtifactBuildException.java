package com.extsync.workspace;

/**
 * Thrown when a directory artifact cannot be bundled.
 */
public class ArtifactBuildException extends RuntimeException {
    public ArtifactBuildException(String message) {
        super(message);
    }

    public ArtifactBuildException(String message, Throwable cause) {
        super(message, cause);
    }
}
