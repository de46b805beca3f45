package com.extsync.workspace;

import com.extsync.core.incremental.BuildMessage;
import com.extsync.core.incremental.IncrementalBuildSession;
import com.extsync.core.incremental.IncrementalSessionFactory;
import com.extsync.core.incremental.IncrementalSessionOptions;
import com.extsync.core.incremental.RebuildResult;
import com.extsync.core.model.Artifact;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Incremental sessions for {@link DirectoryArtifact}s: each rebuild copies only the
 * source files whose size or modification time changed since they were last copied
 * and removes output files whose source is gone.
 */
public class CopyIncrementalSessionFactory implements IncrementalSessionFactory {

    @Override
    public IncrementalBuildSession open(Artifact artifact, IncrementalSessionOptions options) {
        if (!(artifact instanceof DirectoryArtifact directoryArtifact)) {
            throw new IllegalArgumentException("Unsupported artifact type for incremental builds: "
                    + artifact.getClass().getSimpleName());
        }
        return new CopySession(directoryArtifact, options.outputRoot().resolve(artifact.outputFolderId()), options);
    }

    static final class CopySession implements IncrementalBuildSession {

        private static final Logger log = LoggerFactory.getLogger(CopySession.class);

        private final DirectoryArtifact artifact;
        private final Path target;
        private final IncrementalSessionOptions options;
        private final Map<String, WorkspaceFiles.FileStamp> copied = new HashMap<>();
        private volatile boolean closed;

        CopySession(DirectoryArtifact artifact, Path target, IncrementalSessionOptions options) {
            this.artifact = artifact;
            this.target = target;
            this.options = options;
        }

        @Override
        public synchronized RebuildResult rebuild() throws IOException {
            if (closed) {
                throw new IllegalStateException("Incremental session for " + artifact.handle() + " is closed");
            }
            if (!Files.isDirectory(artifact.sourceDir())) {
                String message = "Source directory not found: " + artifact.sourceDir();
                options.stderr().println(message);
                return new RebuildResult(List.of(new BuildMessage(message)));
            }
            Files.createDirectories(target);
            int updated = WorkspaceFiles.copyChanged(artifact.sourceDir(), target, copied);
            int removed = WorkspaceFiles.removeOrphans(artifact.sourceDir(), target);
            log.debug("Rebuilt {}: {} copied, {} removed", artifact.handle(), updated, removed);
            options.stdout().println("Rebuilt: " + updated + " updated, " + removed + " removed");
            return RebuildResult.success();
        }

        @Override
        public void close() {
            closed = true;
        }
    }
}
