package com.extsync.workspace;

import com.extsync.core.model.Artifact;
import com.extsync.core.model.BuildOptions;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * An extension living in its own directory. Bundling copies its source tree
 * into the extension's output folder, replacing previous output.
 *
 * @param handle      extension handle
 * @param directory   extension directory
 * @param sourceDir   directory whose files make up the bundle
 * @param incremental whether the extension is built through an incremental session
 */
public record DirectoryArtifact(
    String handle,
    Path directory,
    Path sourceDir,
    boolean incremental
) implements Artifact {

    @Override
    public void buildForBundle(BuildOptions options, Path outputRoot) {
        if (!Files.isDirectory(sourceDir)) {
            throw new ArtifactBuildException("Source directory not found: " + sourceDir);
        }
        Path target = outputRoot.resolve(outputFolderId());
        try {
            WorkspaceFiles.deleteTree(target);
            Files.createDirectories(target);
            int copied = WorkspaceFiles.copyAll(sourceDir, target);
            options.stdout().println("Bundled " + copied + " file" + (copied != 1 ? "s" : "")
                    + " (" + options.environment() + ")");
        } catch (IOException e) {
            throw new ArtifactBuildException("Failed to bundle " + handle + ": " + e.getMessage(), e);
        }
    }
}
