package com.extsync.core.model;

/**
 * Outcome of building a single artifact once.
 *
 * @param handle the artifact handle
 * @param status OK or ERROR
 * @param error  error message, null when the build succeeded
 */
public record BuildResult(String handle, Status status, String error) {

    public enum Status { OK, ERROR }

    public static BuildResult ok(String handle) {
        return new BuildResult(handle, Status.OK, null);
    }

    public static BuildResult error(String handle, String message) {
        return new BuildResult(handle, Status.ERROR, message);
    }

    public boolean isOk() {
        return status == Status.OK;
    }
}
