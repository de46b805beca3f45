package com.extsync.core.incremental;

import com.extsync.core.model.Artifact;

/**
 * Backend that opens incremental build sessions.
 * Implementations: CopyIncrementalSessionFactory (local workspaces).
 */
@FunctionalInterface
public interface IncrementalSessionFactory {

    IncrementalBuildSession open(Artifact artifact, IncrementalSessionOptions options) throws Exception;
}
