package com.extsync.core.model;

import java.io.PrintStream;

/**
 * Human-readable output streams of a session.
 */
public record OutputOptions(PrintStream stdout, PrintStream stderr) {

    public static OutputOptions system() {
        return new OutputOptions(System.out, System.err);
    }
}
