package com.extsync.workspace;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.nio.file.attribute.FileTime;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Stream;

/**
 * File tree helpers shared by directory builds.
 */
final class WorkspaceFiles {

    private WorkspaceFiles() {}

    /**
     * Size and modification time of a copied source file.
     */
    record FileStamp(FileTime modified, long size) {

        static FileStamp of(Path file) throws IOException {
            return new FileStamp(Files.getLastModifiedTime(file), Files.size(file));
        }
    }

    /**
     * Copies every regular file under {@code source} into {@code target}, preserving relative paths.
     *
     * @return number of files copied
     */
    static int copyAll(Path source, Path target) throws IOException {
        return copyChanged(source, target, new HashMap<>());
    }

    /**
     * Copies regular files under {@code source} whose size or modification time differs from the
     * stamp recorded in {@code copied}, keyed by relative path, and records the new stamps.
     * Stamps of files that no longer exist are dropped.
     *
     * @return number of files copied
     */
    static int copyChanged(Path source, Path target, Map<String, FileStamp> copied) throws IOException {
        int count = 0;
        Set<String> seen = new HashSet<>();
        for (Path file : regularFiles(source)) {
            String relative = source.relativize(file).toString();
            seen.add(relative);
            FileStamp stamp = FileStamp.of(file);
            if (stamp.equals(copied.get(relative))) continue;
            Path dest = target.resolve(relative);
            Files.createDirectories(dest.getParent());
            Files.copy(file, dest, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.COPY_ATTRIBUTES);
            copied.put(relative, stamp);
            count++;
        }
        copied.keySet().retainAll(seen);
        return count;
    }

    /**
     * Deletes files under {@code target} that have no counterpart under {@code source}.
     *
     * @return number of files removed
     */
    static int removeOrphans(Path source, Path target) throws IOException {
        if (!Files.isDirectory(target)) return 0;
        int removed = 0;
        for (Path file : regularFiles(target)) {
            Path counterpart = source.resolve(target.relativize(file).toString());
            if (!Files.exists(counterpart)) {
                Files.deleteIfExists(file);
                removed++;
            }
        }
        return removed;
    }

    static void deleteTree(Path root) throws IOException {
        if (!Files.exists(root)) return;
        try (Stream<Path> walk = Files.walk(root)) {
            for (Path p : walk.sorted(Comparator.reverseOrder()).toList()) {
                Files.deleteIfExists(p);
            }
        }
    }

    private static List<Path> regularFiles(Path root) throws IOException {
        try (Stream<Path> walk = Files.walk(root)) {
            return new ArrayList<>(walk.filter(Files::isRegularFile).toList());
        }
    }
}
