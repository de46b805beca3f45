package com.extsync.core.model;

/**
 * One artifact-level change inside a {@link ReconciledBatch}.
 */
public record ArtifactEvent(ChangeKind kind, Artifact artifact) {

    public static ArtifactEvent created(Artifact artifact) {
        return new ArtifactEvent(ChangeKind.CREATED, artifact);
    }

    public static ArtifactEvent updated(Artifact artifact) {
        return new ArtifactEvent(ChangeKind.UPDATED, artifact);
    }

    public static ArtifactEvent deleted(Artifact artifact) {
        return new ArtifactEvent(ChangeKind.DELETED, artifact);
    }
}
