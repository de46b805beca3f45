package com.extsync.core.model;

import java.nio.file.Path;
import java.util.List;

/**
 * Output of one reconciliation step: the new application snapshot plus the
 * artifact changes it implies.
 *
 * @param app        the snapshot that replaces the current one
 * @param events     artifact changes in reconciliation order
 * @param path       the filesystem path that triggered reconciliation
 * @param startNanos {@link System#nanoTime()} captured when the triggering raw event was first observed
 */
public record ReconciledBatch(
    AppSnapshot app,
    List<ArtifactEvent> events,
    Path path,
    long startNanos
) {

    public ReconciledBatch {
        events = List.copyOf(events);
    }

    public boolean isEmpty() {
        return events.isEmpty();
    }

    /**
     * Artifacts that were created or updated and need a build.
     */
    public List<Artifact> affectedArtifacts() {
        return events.stream()
                .filter(e -> e.kind() != ChangeKind.DELETED)
                .map(ArtifactEvent::artifact)
                .toList();
    }

    /**
     * Artifacts that were deleted and whose output must be purged.
     */
    public List<Artifact> removedArtifacts() {
        return events.stream()
                .filter(e -> e.kind() == ChangeKind.DELETED)
                .map(ArtifactEvent::artifact)
                .toList();
    }
}
