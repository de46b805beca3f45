package com.extsync.core.session;

import com.extsync.core.build.BuildDispatcher;
import com.extsync.core.events.SessionEventBus;
import com.extsync.core.incremental.IncrementalBuildRegistry;
import com.extsync.core.incremental.IncrementalSessionException;
import com.extsync.core.logging.MdcContext;
import com.extsync.core.metrics.ExtsyncMetrics;
import com.extsync.core.model.AppEvent;
import com.extsync.core.model.AppSnapshot;
import com.extsync.core.model.Artifact;
import com.extsync.core.model.BuildResult;
import com.extsync.core.model.OutputOptions;
import com.extsync.core.model.ReconciledBatch;
import com.extsync.core.model.SessionState;
import com.extsync.core.output.BuildOutputStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Consumer;

/**
 * Keeps the build output of an application's artifacts in sync with reconciled change batches.
 * <p>
 * {@link #start()} cleans the output root, opens incremental sessions, builds every
 * artifact once and subscribes to the {@link ReconciledEventSource}. Each batch is then
 * processed on a single dedicated thread, so batches never overlap:
 * <ol>
 *   <li>batches without artifact events are dropped</li>
 *   <li>the current snapshot is replaced and incremental sessions are updated</li>
 *   <li>created and updated artifacts are built while deleted artifacts' output is purged</li>
 *   <li>{@link #onEvent} listeners receive the batch with its build results</li>
 * </ol>
 * A failure outside the per-artifact builds is logged and written to stderr; the
 * session keeps listening for further batches.
 */
public class DevSession implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(DevSession.class);

    private final ReconciledEventSource source;
    private final BuildOutputStore store;
    private final IncrementalBuildRegistry registry;
    private final BuildDispatcher dispatcher;
    private final SessionEventBus eventBus;
    private final OutputOptions output;
    private final ExecutorService workers;
    private final ExecutorService batchExecutor;
    private final ExtsyncMetrics metrics;
    private final long shutdownTimeoutSeconds;

    private final AtomicReference<SessionState> state = new AtomicReference<>(SessionState.NOT_STARTED);
    private final AtomicBoolean closed = new AtomicBoolean(false);
    private volatile AppSnapshot app;
    private volatile List<BuildResult> initialBuildResults = List.of();
    private volatile ReconciledEventSource.Subscription subscription;

    public DevSession(AppSnapshot app, ReconciledEventSource source, BuildOutputStore store,
                      IncrementalBuildRegistry registry, BuildDispatcher dispatcher, OutputOptions output,
                      ExecutorService workers, ExtsyncMetrics metrics, long shutdownTimeoutSeconds) {
        this.app = app;
        this.source = source;
        this.store = store;
        this.registry = registry;
        this.dispatcher = dispatcher;
        this.output = output;
        this.workers = workers;
        this.metrics = metrics;
        this.shutdownTimeoutSeconds = shutdownTimeoutSeconds;
        this.eventBus = new SessionEventBus();
        this.batchExecutor = Executors.newSingleThreadExecutor(r -> {
            Thread t = new Thread(r, "extsync-batch");
            t.setDaemon(true);
            return t;
        });
    }

    /**
     * Starts the session. Only the first successful call has effect; calls made while a start
     * is running or after it completed return immediately. A start that fails returns the
     * session to {@link SessionState#NOT_STARTED}, so it can be retried.
     *
     * @throws com.extsync.core.output.BuildOutputException if the output root cannot be prepared
     */
    public void start() {
        if (!state.compareAndSet(SessionState.NOT_STARTED, SessionState.STARTING)) {
            log.debug("Session already {}, ignoring start()", state.get());
            return;
        }
        try {
            store.reset();

            AppSnapshot initial = app;
            try {
                registry.createSessions(initial.incrementalArtifacts());
            } catch (IncrementalSessionException e) {
                log.error("Incremental sessions unavailable, affected artifacts fall back to full builds: {}",
                        e.getMessage());
                output.stderr().println(e.getMessage());
            }

            log.info("Initial build of {} artifacts", initial.artifacts().size());
            List<BuildResult> results = dispatcher.buildAll(initial, initial.artifacts());
            initialBuildResults = results;
            logResults("Initial build", results);

            subscription = source.subscribe(this::handle);
        } catch (RuntimeException e) {
            log.error("Dev session failed to start: {}", e.getMessage());
            state.set(SessionState.NOT_STARTED);
            throw e;
        }

        state.set(SessionState.READY);
        log.info("Dev session ready, build output at {}", store.root());
        eventBus.markReady();
    }

    /**
     * Register a listener invoked once per processed batch that carried artifact events.
     *
     * @return a handle to stop receiving events
     */
    public SessionEventBus.Subscription onEvent(Consumer<AppEvent> listener) {
        return eventBus.onEvent(listener);
    }

    /**
     * Register a listener for the one-time readiness notification. Invoked immediately
     * when the session is already ready.
     */
    public void onStart(Runnable listener) {
        eventBus.onReady(listener);
    }

    public SessionState state() {
        return state.get();
    }

    public AppSnapshot app() {
        return app;
    }

    public Path buildOutputPath() {
        return store.root();
    }

    /**
     * Results of the build performed by {@link #start()}, empty before it ran.
     */
    public List<BuildResult> initialBuildResults() {
        return initialBuildResults;
    }

    /**
     * Queues a batch behind any batch still being processed.
     *
     * @return a future that completes when this batch has been processed
     */
    CompletableFuture<Void> handle(ReconciledBatch batch) {
        try {
            return CompletableFuture.runAsync(() -> processBatch(batch), batchExecutor);
        } catch (RejectedExecutionException e) {
            log.warn("Session closed, dropping batch for {}", batch.path());
            return CompletableFuture.completedFuture(null);
        }
    }

    void processBatch(ReconciledBatch batch) {
        MdcContext.setBatch(String.valueOf(batch.path()));
        long startMs = System.currentTimeMillis();
        try {
            if (batch.isEmpty()) {
                log.debug("Change detected at {}, but no extensions were affected", batch.path());
                if (metrics != null) metrics.recordSkippedBatch();
                return;
            }

            app = batch.app();
            AppSnapshot current = app;
            registry.updateSessions(batch);

            List<Artifact> affected = batch.affectedArtifacts();
            List<String> removed = batch.removedArtifacts().stream().map(Artifact::outputFolderId).toList();

            CompletableFuture<List<BuildResult>> builds =
                    CompletableFuture.supplyAsync(() -> dispatcher.buildAll(current, affected), workers);
            RuntimeException purgeFailure = null;
            try {
                store.purge(removed);
            } catch (RuntimeException e) {
                purgeFailure = e;
            }
            List<BuildResult> results = builds.join();
            if (purgeFailure != null) throw purgeFailure;

            logResults("Rebuild", results);
            long elapsedMs = System.currentTimeMillis() - startMs;
            if (metrics != null) metrics.recordBatch(batch.events().size(), elapsedMs);
            log.info("Processed {} extension events for {} in {}ms", batch.events().size(), batch.path(), elapsedMs);

            eventBus.publish(new AppEvent(batch, results));
        } catch (Exception e) {
            Throwable cause = e instanceof CompletionException && e.getCause() != null ? e.getCause() : e;
            log.error("Error handling event for {}: {}", batch.path(), cause.getMessage(), cause);
            output.stderr().println("Error handling event: " + cause.getMessage());
            if (metrics != null) metrics.recordBatchFailure();
        } finally {
            MdcContext.clear();
        }
    }

    /**
     * Stops listening, waits for the batch in flight and disposes incremental sessions.
     */
    @Override
    public void close() {
        if (!closed.compareAndSet(false, true)) return;
        var sub = subscription;
        if (sub != null) {
            sub.unsubscribe();
        }
        batchExecutor.shutdown();
        try {
            if (!batchExecutor.awaitTermination(shutdownTimeoutSeconds, TimeUnit.SECONDS)) {
                log.warn("Batch still running after {}s, shutting down anyway", shutdownTimeoutSeconds);
                batchExecutor.shutdownNow();
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            batchExecutor.shutdownNow();
        }
        registry.close();
        workers.shutdown();
        log.info("Dev session closed");
    }

    private void logResults(String phase, List<BuildResult> results) {
        long failed = results.stream().filter(r -> !r.isOk()).count();
        for (BuildResult result : results) {
            if (!result.isOk()) {
                log.warn("{} of {} failed: {}", phase, result.handle(), result.error());
            }
        }
        log.info("{} finished: {} ok, {} failed", phase, results.size() - failed, failed);
    }
}
