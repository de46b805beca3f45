package com.extsync.core.model;

import java.nio.file.Path;
import java.util.List;

/**
 * A processed batch as delivered to session listeners: the reconciled batch
 * plus the build results of its created and updated artifacts.
 */
public record AppEvent(ReconciledBatch batch, List<BuildResult> buildResults) {

    public AppEvent {
        buildResults = List.copyOf(buildResults);
    }

    public AppSnapshot app() {
        return batch.app();
    }

    public List<ArtifactEvent> events() {
        return batch.events();
    }

    public Path path() {
        return batch.path();
    }

    public long startNanos() {
        return batch.startNanos();
    }

    public List<BuildResult> failures() {
        return buildResults.stream().filter(r -> !r.isOk()).toList();
    }
}
