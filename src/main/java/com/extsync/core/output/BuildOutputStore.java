package com.extsync.core.output;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.FileVisitResult;
import java.nio.file.Files;
import java.nio.file.LinkOption;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.SimpleFileVisitor;
import java.nio.file.attribute.BasicFileAttributes;
import java.util.ArrayList;
import java.util.Collection;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Executor;

/**
 * Build output directory of a dev session: one subdirectory per artifact,
 * keyed by the artifact's output folder id.
 *
 * <p>Deletes are forced and idempotent: removing a directory that does not
 * exist is not an error.
 */
public class BuildOutputStore {

    private static final Logger log = LoggerFactory.getLogger(BuildOutputStore.class);

    private final Path root;
    private final Executor executor;

    public BuildOutputStore(Path root, Executor executor) {
        this.root = root;
        this.executor = executor;
    }

    public Path root() {
        return root;
    }

    public Path outputPathFor(String folderId) {
        return root.resolve(folderId);
    }

    /**
     * Deletes any leftover output from a previous session and recreates an empty root.
     *
     * @throws BuildOutputException if the root cannot be removed or created
     */
    public void reset() {
        try {
            if (Files.exists(root)) {
                log.debug("Removing previous build output at {}", root);
                deleteRecursively(root);
            }
            Files.createDirectories(root);
            log.info("Build output directory ready at {}", root);
        } catch (IOException e) {
            throw new BuildOutputException("Failed to prepare build output directory " + root + ": " + e.getMessage(), e);
        }
    }

    /**
     * Removes the output subdirectories of the given folder ids concurrently and waits for all of them.
     *
     * @throws BuildOutputException if any directory exists but cannot be removed
     */
    public void purge(Collection<String> folderIds) {
        if (folderIds.isEmpty()) return;

        var futures = new ArrayList<CompletableFuture<Void>>();
        for (String folderId : folderIds) {
            futures.add(CompletableFuture.runAsync(() -> {
                Path dir = outputPathFor(folderId);
                try {
                    deleteRecursively(dir);
                    log.debug("Purged build output {}", dir);
                } catch (IOException e) {
                    throw new BuildOutputException("Failed to delete build output " + dir + ": " + e.getMessage(), e);
                }
            }, executor));
        }
        try {
            CompletableFuture.allOf(futures.toArray(new CompletableFuture[0])).join();
        } catch (CompletionException e) {
            if (e.getCause() instanceof BuildOutputException boe) throw boe;
            throw new BuildOutputException("Failed to purge build output: " + e.getMessage(), e);
        }
    }

    static void deleteRecursively(Path path) throws IOException {
        if (!Files.exists(path, LinkOption.NOFOLLOW_LINKS)) return;
        Files.walkFileTree(path, new SimpleFileVisitor<>() {
            @Override
            public FileVisitResult visitFile(Path file, BasicFileAttributes attrs) throws IOException {
                Files.deleteIfExists(file);
                return FileVisitResult.CONTINUE;
            }

            @Override
            public FileVisitResult visitFileFailed(Path file, IOException exc) throws IOException {
                if (exc instanceof NoSuchFileException) return FileVisitResult.CONTINUE;
                throw exc;
            }

            @Override
            public FileVisitResult postVisitDirectory(Path dir, IOException exc) throws IOException {
                if (exc != null && !(exc instanceof NoSuchFileException)) throw exc;
                Files.deleteIfExists(dir);
                return FileVisitResult.CONTINUE;
            }
        });
    }
}
