package com.extsync.core.model;

import java.nio.file.Path;

/**
 * A buildable unit owned by an application, identified by a stable handle.
 * <p>
 * Instances are produced by the reconciliation collaborator. The session only
 * holds references to them for the duration of a build.
 */
public interface Artifact {

    /**
     * Stable identifier, unique within one {@link AppSnapshot}.
     */
    String handle();

    /**
     * Name of the subdirectory of the build output root that holds this artifact's output.
     */
    default String outputFolderId() {
        return handle();
    }

    /**
     * Whether this artifact is built through a live incremental session instead of a fresh build.
     * Fixed for the lifetime of the instance.
     */
    boolean incremental();

    /**
     * Produces the build output for this artifact.
     *
     * @param options    build parameters for the current session
     * @param outputRoot the shared build output root
     * @throws Exception if the build fails; the message is reported as the artifact's build error
     */
    void buildForBundle(BuildOptions options, Path outputRoot) throws Exception;
}
