package com.extsync.cli;

import com.extsync.core.model.AppSnapshot;
import com.extsync.core.model.BuildResult;
import com.extsync.core.model.OutputOptions;
import com.extsync.core.output.BuildOutputException;
import com.extsync.core.session.DevSession;
import com.extsync.core.session.DevSessionFactory;
import com.extsync.core.session.ExtsyncProperties;
import com.extsync.core.session.ReconciledEventSource;
import com.extsync.workspace.CopyIncrementalSessionFactory;
import com.extsync.workspace.WorkspaceException;
import com.extsync.workspace.WorkspaceLoader;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

import java.nio.file.Path;
import java.util.List;
import java.util.concurrent.Callable;

/**
 * CLI command: extsync build
 * <p>
 * One-shot clean build of every extension. Exits with 1 when any extension fails.
 */
@Command(name = "build", mixinStandardHelpOptions = true, description = "Build all extensions once")
@Component
public class BuildCommand implements Callable<Integer> {

    @Option(names = {"--path", "-p"}, description = "Application directory (default: extsync.workspace.directory)")
    private Path path;

    private final WorkspaceLoader loader;
    private final DevSessionFactory sessionFactory;
    private final ExtsyncProperties properties;

    public BuildCommand(WorkspaceLoader loader, DevSessionFactory sessionFactory, ExtsyncProperties properties) {
        this.loader = loader;
        this.sessionFactory = sessionFactory;
        this.properties = properties;
    }

    @Override
    public Integer call() {
        ConsoleOutput.printBanner();
        Path appDir = (path != null ? path : Path.of(properties.getWorkspaceDirectory())).toAbsolutePath().normalize();

        List<BuildResult> results;
        Path outputPath;
        try {
            AppSnapshot app = loader.load(appDir);
            ConsoleOutput.info("Building " + app.artifacts().size() + " extensions in " + appDir);
            try (DevSession session = sessionFactory.create(app, ReconciledEventSource.none(),
                    new CopyIncrementalSessionFactory(), OutputOptions.system())) {
                session.start();
                results = session.initialBuildResults();
                outputPath = session.buildOutputPath();
            }
        } catch (WorkspaceException | BuildOutputException e) {
            ConsoleOutput.error(e.getMessage());
            return 1;
        }

        ConsoleOutput.buildResults(results);
        long failed = results.stream().filter(r -> !r.isOk()).count();
        if (failed > 0) {
            ConsoleOutput.error(failed + " of " + results.size() + " extensions failed");
            return 1;
        }
        ConsoleOutput.success("Built " + results.size() + " extensions into " + outputPath);
        return 0;
    }
}
