package com.extsync.cli;

import org.springframework.stereotype.Component;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Spec;

/**
 * Top-level CLI command for extsync.
 * Routes to subcommands: dev, build.
 */
@Command(
        name = "extsync",
        mixinStandardHelpOptions = true,
        version = "extsync 0.1.0",
        description = "Keeps extension build output in sync with their sources",
        subcommands = {
                DevCommand.class,
                BuildCommand.class,
                CommandLine.HelpCommand.class
        }
)
@Component
public class ExtsyncCommand implements Runnable {

    @Spec
    CommandSpec spec;

    @Override
    public void run() {
        ConsoleOutput.printBanner();
        // When no subcommand is given, show usage help
        spec.commandLine().usage(System.out);
    }
}
