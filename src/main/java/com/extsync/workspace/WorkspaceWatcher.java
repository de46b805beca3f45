package com.extsync.workspace;

import com.extsync.core.model.AppSnapshot;
import com.extsync.core.model.ReconciledBatch;
import com.extsync.core.session.ReconciledEventSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.ClosedWatchServiceException;
import java.nio.file.FileSystems;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.WatchEvent;
import java.nio.file.WatchKey;
import java.nio.file.WatchService;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.TimeUnit;
import java.util.stream.Stream;

import static java.nio.file.StandardWatchEventKinds.ENTRY_CREATE;
import static java.nio.file.StandardWatchEventKinds.ENTRY_DELETE;
import static java.nio.file.StandardWatchEventKinds.ENTRY_MODIFY;
import static java.nio.file.StandardWatchEventKinds.OVERFLOW;

/**
 * {@link ReconciledEventSource} over a local workspace, backed by a {@link WatchService}.
 * <p>
 * Raw events are collected until the workspace has been quiet for the configured
 * period, reconciled into one batch, and handed to the subscriber. The watcher
 * waits for each batch to be processed before collecting the next one.
 */
public class WorkspaceWatcher implements ReconciledEventSource {

    private static final Logger log = LoggerFactory.getLogger(WorkspaceWatcher.class);

    private final Path appDirectory;
    private final Path extensionsRoot;
    private final WorkspaceReconciler reconciler;
    private final long quietPeriodMs;
    private final Map<WatchKey, Path> watchedDirs = new ConcurrentHashMap<>();

    private volatile AppSnapshot current;

    public WorkspaceWatcher(AppSnapshot initial, Path extensionsRoot, WorkspaceReconciler reconciler, long quietPeriodMs) {
        this.current = initial;
        this.appDirectory = initial.directory();
        this.extensionsRoot = extensionsRoot;
        this.reconciler = reconciler;
        this.quietPeriodMs = quietPeriodMs;
    }

    @Override
    public Subscription subscribe(BatchHandler handler) {
        WatchService watchService;
        try {
            watchService = FileSystems.getDefault().newWatchService();
            watchedDirs.put(appDirectory.register(watchService, ENTRY_CREATE, ENTRY_DELETE, ENTRY_MODIFY), appDirectory);
            if (Files.isDirectory(extensionsRoot)) {
                registerTree(watchService, extensionsRoot);
            }
        } catch (IOException e) {
            throw new WorkspaceException("Failed to watch " + appDirectory + ": " + e.getMessage(), e);
        }

        Thread thread = new Thread(() -> watchLoop(watchService, handler), "extsync-watcher");
        thread.setDaemon(true);
        thread.start();
        log.info("Watching {} for changes", appDirectory);

        return () -> {
            try {
                watchService.close();
            } catch (IOException e) {
                log.warn("Failed to close watch service: {}", e.getMessage());
            }
            thread.interrupt();
        };
    }

    public AppSnapshot current() {
        return current;
    }

    private void watchLoop(WatchService watchService, BatchHandler handler) {
        try {
            while (!Thread.currentThread().isInterrupted()) {
                WatchKey key = watchService.take();
                long startNanos = System.nanoTime();
                Set<Path> changed = new LinkedHashSet<>();
                collect(watchService, key, changed);

                // Debounce: keep draining until the workspace is quiet
                WatchKey next;
                while ((next = watchService.poll(quietPeriodMs, TimeUnit.MILLISECONDS)) != null) {
                    collect(watchService, next, changed);
                }
                if (changed.isEmpty()) continue;

                try {
                    ReconciledBatch batch = reconciler.reconcile(current, changed, startNanos);
                    current = batch.app();
                    handler.handle(batch).join();
                } catch (WorkspaceException e) {
                    log.error("Failed to reconcile workspace changes: {}", e.getMessage());
                } catch (RuntimeException e) {
                    log.error("Batch handler failed for {}: {}", changed, e.getMessage(), e);
                }
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        } catch (ClosedWatchServiceException e) {
            log.debug("Watch service closed");
        }
        log.info("Stopped watching {}", appDirectory);
    }

    private void collect(WatchService watchService, WatchKey key, Set<Path> changed) {
        Path dir = watchedDirs.get(key);
        for (WatchEvent<?> event : key.pollEvents()) {
            if (event.kind() == OVERFLOW) {
                changed.add(extensionsRoot);
                continue;
            }
            if (dir == null) continue;
            Path path = dir.resolve((Path) event.context());
            if (dir.equals(appDirectory) && !isRelevantRootEntry(path)) continue;

            if (event.kind() == ENTRY_CREATE && Files.isDirectory(path)
                    && (path.startsWith(extensionsRoot) || path.equals(extensionsRoot))) {
                try {
                    registerTree(watchService, path);
                } catch (IOException e) {
                    log.warn("Failed to watch new directory {}: {}", path, e.getMessage());
                }
            }
            changed.add(path);
        }
        if (!key.reset()) {
            watchedDirs.remove(key);
        }
    }

    private boolean isRelevantRootEntry(Path path) {
        return path.equals(extensionsRoot) || path.getFileName().toString().equals(WorkspaceLoader.DOTENV);
    }

    private void registerTree(WatchService watchService, Path root) throws IOException {
        try (Stream<Path> walk = Files.walk(root)) {
            for (Path dir : walk.filter(Files::isDirectory).toList()) {
                watchedDirs.put(dir.register(watchService, ENTRY_CREATE, ENTRY_DELETE, ENTRY_MODIFY), dir);
            }
        }
    }
}
