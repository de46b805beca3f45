package com.extsync.core.incremental;

/**
 * A live, reusable build session for one artifact.
 * <p>
 * Implementations report their own diagnostics to the output streams they
 * were created with; callers only consume the structured result.
 */
public interface IncrementalBuildSession extends AutoCloseable {

    RebuildResult rebuild() throws Exception;

    /**
     * Releases the session. Must be safe to call more than once.
     */
    @Override
    default void close() {}
}
