package com.extsync.core.session;

import com.extsync.core.build.BuildDispatcher;
import com.extsync.core.incremental.DefaultIncrementalBuildRegistry;
import com.extsync.core.incremental.IncrementalSessionFactory;
import com.extsync.core.incremental.IncrementalSessionOptions;
import com.extsync.core.metrics.ExtsyncMetrics;
import com.extsync.core.model.AppSnapshot;
import com.extsync.core.model.OutputOptions;
import com.extsync.core.output.BuildOutputStore;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.nio.file.Path;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Assembles a {@link DevSession} with its output store, incremental registry and build dispatcher.
 */
@Component
public class DevSessionFactory {

    private final ExtsyncProperties properties;
    private final ExtsyncMetrics metrics;

    public DevSessionFactory(ExtsyncProperties properties,
                             @Autowired(required = false) ExtsyncMetrics metrics) {
        this.properties = properties;
        this.metrics = metrics;
    }

    public DevSession create(AppSnapshot app, ReconciledEventSource source,
                             IncrementalSessionFactory incrementalFactory, OutputOptions output) {
        Path outputRoot = properties.resolveBuildOutputPath(app.directory());
        String appUrl = properties.resolveAppUrl();

        // Unbounded: one thread per concurrently building artifact
        ExecutorService workers = Executors.newCachedThreadPool(new NamedDaemonThreads("extsync-build-"));

        var store = new BuildOutputStore(outputRoot, workers);
        var registry = new DefaultIncrementalBuildRegistry(incrementalFactory, new IncrementalSessionOptions(
                outputRoot, app.dotEnvVariables(), appUrl, output.stdout(), output.stderr()));
        var dispatcher = new BuildDispatcher(registry, outputRoot, output, appUrl, workers, metrics);
        return new DevSession(app, source, store, registry, dispatcher, output, workers, metrics,
                properties.getShutdownTimeoutSeconds());
    }

    private static final class NamedDaemonThreads implements ThreadFactory {
        private final String prefix;
        private final AtomicInteger counter = new AtomicInteger();

        NamedDaemonThreads(String prefix) {
            this.prefix = prefix;
        }

        @Override
        public Thread newThread(Runnable r) {
            Thread t = new Thread(r, prefix + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        }
    }
}
