package com.extsync.cli;

import com.extsync.core.model.AppEvent;
import com.extsync.core.model.AppSnapshot;
import com.extsync.core.model.OutputOptions;
import com.extsync.core.output.BuildOutputException;
import com.extsync.core.session.DevSession;
import com.extsync.core.session.DevSessionFactory;
import com.extsync.core.session.ExtsyncProperties;
import com.extsync.workspace.CopyIncrementalSessionFactory;
import com.extsync.workspace.WorkspaceException;
import com.extsync.workspace.WorkspaceLoader;
import com.extsync.workspace.WorkspaceReconciler;
import com.extsync.workspace.WorkspaceWatcher;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

import java.nio.file.Path;
import java.util.concurrent.Callable;
import java.util.concurrent.CountDownLatch;

/**
 * CLI command: extsync dev
 * <p>
 * Builds every extension of an application, then watches the workspace and
 * rebuilds affected extensions on each change until interrupted.
 */
@Command(name = "dev", mixinStandardHelpOptions = true,
        description = "Build all extensions and rebuild them as their sources change")
@Component
public class DevCommand implements Callable<Integer> {

    @Option(names = {"--path", "-p"}, description = "Application directory (default: extsync.workspace.directory)")
    private Path path;

    private final WorkspaceLoader loader;
    private final WorkspaceReconciler reconciler;
    private final DevSessionFactory sessionFactory;
    private final ExtsyncProperties properties;

    public DevCommand(WorkspaceLoader loader, WorkspaceReconciler reconciler,
                      DevSessionFactory sessionFactory, ExtsyncProperties properties) {
        this.loader = loader;
        this.reconciler = reconciler;
        this.sessionFactory = sessionFactory;
        this.properties = properties;
    }

    @Override
    public Integer call() {
        ConsoleOutput.printBanner();
        Path appDir = (path != null ? path : Path.of(properties.getWorkspaceDirectory())).toAbsolutePath().normalize();

        AppSnapshot app;
        try {
            app = loader.load(appDir);
        } catch (WorkspaceException e) {
            ConsoleOutput.error(e.getMessage());
            return 1;
        }

        var watcher = new WorkspaceWatcher(app, loader.extensionsRoot(appDir), reconciler, properties.getQuietPeriodMs());
        var stopped = new CountDownLatch(1);
        Runtime.getRuntime().addShutdownHook(new Thread(stopped::countDown, "extsync-shutdown"));

        try (DevSession session = sessionFactory.create(app, watcher, new CopyIncrementalSessionFactory(),
                OutputOptions.system())) {
            session.onStart(() -> ConsoleOutput.success("Ready: " + app.artifacts().size()
                    + " extensions, output at " + session.buildOutputPath()));
            session.onEvent(DevCommand::printEvent);

            ConsoleOutput.info("Building " + app.artifacts().size() + " extensions in " + appDir);
            session.start();
            ConsoleOutput.buildResults(session.initialBuildResults());
            ConsoleOutput.info("Press Ctrl+C to stop.");
            stopped.await();
        } catch (BuildOutputException | WorkspaceException e) {
            ConsoleOutput.error(e.getMessage());
            return 1;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
        return 0;
    }

    static void printEvent(AppEvent event) {
        event.events().forEach(ConsoleOutput::extensionEvent);
        ConsoleOutput.buildResults(event.buildResults());
        long elapsedMs = (System.nanoTime() - event.startNanos()) / 1_000_000;
        ConsoleOutput.batchComplete(event.events().size(), elapsedMs, event.failures().size());
    }
}
