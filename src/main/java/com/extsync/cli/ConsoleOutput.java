package com.extsync.cli;

import com.extsync.core.model.ArtifactEvent;
import com.extsync.core.model.BuildResult;
import picocli.CommandLine;

import java.io.PrintStream;
import java.util.List;

/**
 * ANSI-colored terminal output utilities for the extsync CLI.
 */
public class ConsoleOutput {

    private static PrintStream out = System.out;

    private ConsoleOutput() {
        // utility class
    }

    static void redirect(PrintStream stream) {
        out = stream;
    }

    public static void printBanner() {
        out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|bold,fg(yellow) EXTSYNC v0.1.0|@"));
        out.println("──────────────────────────────────");
    }

    public static void info(String message) {
        out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(cyan) [EXTSYNC]|@ " + message));
    }

    public static void success(String message) {
        out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(green) +|@ " + message));
    }

    public static void error(String message) {
        out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(red) x|@ " + message));
    }

    public static void extensionEvent(ArtifactEvent event) {
        String symbol = switch (event.kind()) {
            case CREATED -> "@|fg(green) +|@";
            case UPDATED -> "@|fg(yellow) ~|@";
            case DELETED -> "@|fg(red) -|@";
        };
        out.println(CommandLine.Help.Ansi.AUTO.string(
                "  " + symbol + " " + event.artifact().handle()));
    }

    public static void buildResults(List<BuildResult> results) {
        for (BuildResult result : results) {
            if (result.isOk()) {
                out.println(CommandLine.Help.Ansi.AUTO.string(
                        "  @|fg(green) OK|@    " + result.handle()));
            } else {
                out.println(CommandLine.Help.Ansi.AUTO.string(
                        "  @|fg(red) ERROR|@ " + result.handle() + ": " + result.error()));
            }
        }
    }

    public static void batchComplete(int events, long elapsedMs, int failed) {
        out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(yellow) [BATCH]|@ " + events + " extension event" + (events != 1 ? "s" : "")
                        + " in " + formatDuration(elapsedMs)
                        + (failed > 0 ? ", @|fg(red) " + failed + " failed|@" : "")));
    }

    static String formatDuration(long ms) {
        if (ms < 1000) return ms + "ms";
        long seconds = ms / 1000;
        if (seconds < 60) return seconds + "s";
        return (seconds / 60) + "m " + (seconds % 60) + "s";
    }
}
