package com.extsync.core.model;

/**
 * Lifecycle of a dev session. Transitions only move forward.
 */
public enum SessionState {
    NOT_STARTED,
    STARTING,
    READY
}
