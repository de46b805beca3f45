package com.extsync.core.model;

/**
 * Kind of change the reconciler detected for one artifact.
 */
public enum ChangeKind {
    CREATED,
    UPDATED,
    DELETED
}
