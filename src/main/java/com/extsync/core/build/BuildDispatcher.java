package com.extsync.core.build;

import com.extsync.core.incremental.IncrementalBuildRegistry;
import com.extsync.core.incremental.IncrementalBuildSession;
import com.extsync.core.incremental.RebuildResult;
import com.extsync.core.metrics.ExtsyncMetrics;
import com.extsync.core.model.AppSnapshot;
import com.extsync.core.model.Artifact;
import com.extsync.core.model.BuildOptions;
import com.extsync.core.model.BuildResult;
import com.extsync.core.model.OutputOptions;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.RejectedExecutionException;

/**
 * Builds artifacts concurrently, one task per artifact, and collects one
 * {@link BuildResult} per artifact.
 *
 * <p>Artifacts with a live incremental session are rebuilt through it; all
 * others get a fresh {@link Artifact#buildForBundle} call into the shared
 * output root. A failing artifact never affects the results of its siblings
 * and {@link #buildAll} never throws because of an artifact.
 */
public class BuildDispatcher {

    private static final Logger log = LoggerFactory.getLogger(BuildDispatcher.class);

    private final IncrementalBuildRegistry registry;
    private final Path outputRoot;
    private final OutputOptions output;
    private final String appUrl;
    private final ExecutorService executor;
    private final ExtsyncMetrics metrics;

    public BuildDispatcher(IncrementalBuildRegistry registry, Path outputRoot, OutputOptions output,
                           String appUrl, ExecutorService executor, ExtsyncMetrics metrics) {
        this.registry = registry;
        this.outputRoot = outputRoot;
        this.output = output;
        this.appUrl = appUrl;
        this.executor = executor;
        this.metrics = metrics;
    }

    BuildDispatcher(IncrementalBuildRegistry registry, Path outputRoot, OutputOptions output, ExecutorService executor) {
        this(registry, outputRoot, output, null, executor, null);
    }

    /**
     * Builds every artifact against {@code app}.
     *
     * @return one result per input artifact, in input order
     */
    public List<BuildResult> buildAll(AppSnapshot app, Collection<? extends Artifact> artifacts) {
        var handles = new ArrayList<String>();
        var futures = new ArrayList<CompletableFuture<BuildResult>>();

        for (Artifact artifact : artifacts) {
            handles.add(artifact.handle());
            try {
                futures.add(CompletableFuture.supplyAsync(() -> buildOne(app, artifact), executor));
            } catch (RejectedExecutionException e) {
                log.error("Build executor rejected {}: {}", artifact.handle(), e.getMessage());
                futures.add(CompletableFuture.completedFuture(
                        BuildResult.error(artifact.handle(), "Build rejected: " + e.getMessage())));
            }
        }

        var results = new ArrayList<BuildResult>(futures.size());
        for (int i = 0; i < futures.size(); i++) {
            try {
                results.add(futures.get(i).join());
            } catch (CompletionException e) {
                Throwable cause = e.getCause() != null ? e.getCause() : e;
                log.error("Unexpected error collecting build result for {}", handles.get(i), cause);
                results.add(BuildResult.error(handles.get(i), messageOf(cause)));
            }
        }
        return results;
    }

    private BuildResult buildOne(AppSnapshot app, Artifact artifact) {
        return OutputScope.run(artifact.handle(), output, scoped -> {
            long startMs = System.currentTimeMillis();
            Optional<IncrementalBuildSession> session = registry.sessionFor(artifact.handle());
            String backend = session.isPresent() ? "incremental" : "bundle";
            BuildResult result;
            try {
                if (session.isPresent()) {
                    RebuildResult rebuild = session.get().rebuild();
                    // Diagnostics were already printed by the incremental backend
                    result = rebuild.hasErrors()
                            ? BuildResult.error(artifact.handle(), rebuild.combinedMessage())
                            : BuildResult.ok(artifact.handle());
                } else {
                    var options = BuildOptions.development(app, scoped.stdout(), scoped.stderr(), appUrl);
                    artifact.buildForBundle(options, outputRoot);
                    result = BuildResult.ok(artifact.handle());
                }
            } catch (Exception e) {
                log.debug("Build of {} failed", artifact.handle(), e);
                result = BuildResult.error(artifact.handle(), messageOf(e));
            }

            long elapsedMs = System.currentTimeMillis() - startMs;
            if (metrics != null) {
                metrics.recordBuild(backend, result.isOk(), elapsedMs);
            }
            log.debug("Built {} via {} in {}ms: {}", artifact.handle(), backend, elapsedMs, result.status());
            return result;
        });
    }

    static String messageOf(Throwable t) {
        return t.getMessage() != null ? t.getMessage() : t.getClass().getSimpleName();
    }
}
