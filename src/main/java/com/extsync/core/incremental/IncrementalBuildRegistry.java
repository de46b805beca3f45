package com.extsync.core.incremental;

import com.extsync.core.model.Artifact;
import com.extsync.core.model.ReconciledBatch;

import java.util.Collection;
import java.util.Optional;

/**
 * Tracks which artifacts have a live incremental build session.
 */
public interface IncrementalBuildRegistry extends AutoCloseable {

    /**
     * Opens sessions for the given artifacts. Called once when a dev session starts,
     * with the eligible artifacts only.
     */
    void createSessions(Collection<Artifact> artifacts);

    /**
     * Reconciles the live sessions with the snapshot carried by {@code batch}.
     */
    void updateSessions(ReconciledBatch batch);

    Optional<IncrementalBuildSession> sessionFor(String handle);

    /**
     * Disposes every live session.
     */
    @Override
    void close();
}
