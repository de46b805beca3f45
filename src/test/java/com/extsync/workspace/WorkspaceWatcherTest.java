package com.extsync.workspace;

import com.extsync.core.model.AppSnapshot;
import com.extsync.core.model.ReconciledBatch;
import com.extsync.core.session.ReconciledEventSource;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;

import static com.extsync.workspace.WorkspaceLoaderTest.extension;
import static org.junit.jupiter.api.Assertions.*;

class WorkspaceWatcherTest {

    @TempDir
    Path appDir;

    private WorkspaceLoader loader;
    private WorkspaceWatcher watcher;
    private ReconciledEventSource.Subscription subscription;
    private final BlockingQueue<ReconciledBatch> batches = new LinkedBlockingQueue<>();

    @BeforeEach
    void setUp() {
        loader = new WorkspaceLoader(new ObjectMapper(), "extensions", "extension.json");
    }

    @AfterEach
    void tearDown() {
        if (subscription != null) subscription.unsubscribe();
    }

    private void watch() {
        AppSnapshot initial = loader.load(appDir);
        watcher = new WorkspaceWatcher(initial, loader.extensionsRoot(appDir), new WorkspaceReconciler(loader), 50);
        subscription = watcher.subscribe(batch -> {
            batches.add(batch);
            return CompletableFuture.completedFuture(null);
        });
    }

    private ReconciledBatch nextNonEmptyBatch() throws InterruptedException {
        long deadline = System.nanoTime() + TimeUnit.SECONDS.toNanos(20);
        while (System.nanoTime() < deadline) {
            ReconciledBatch batch = batches.poll(1, TimeUnit.SECONDS);
            if (batch != null && !batch.isEmpty()) return batch;
        }
        return fail("No batch with extension events was delivered");
    }

    @Test
    void sourceEditProducesUpdate() throws Exception {
        Path ext = extension(appDir, "promo", "{}");
        Path src = Files.createDirectories(ext.resolve("src"));
        Files.writeString(src.resolve("index.js"), "v1");
        watch();

        Files.writeString(src.resolve("index.js"), "v2");

        ReconciledBatch batch = nextNonEmptyBatch();
        assertEquals("promo", batch.events().get(0).artifact().handle());
        assertEquals(batch.app(), watcher.current());
    }

    @Test
    void newExtensionDirectoryIsPickedUp() throws Exception {
        Files.createDirectories(appDir.resolve("extensions"));
        watch();

        extension(appDir, "fresh", "{}");

        ReconciledBatch batch = nextNonEmptyBatch();
        assertEquals(1, batch.affectedArtifacts().size());
        assertEquals("fresh", batch.affectedArtifacts().get(0).handle());
    }

    @Test
    void unsubscribeStopsWatching() throws IOException, InterruptedException {
        Path ext = extension(appDir, "promo", "{}");
        watch();
        subscription.unsubscribe();
        subscription = null;

        Files.writeString(ext.resolve("extension.json"), "{\"handle\": \"renamed\"}");

        assertNull(batches.poll(500, TimeUnit.MILLISECONDS));
    }
}
