package com.extsync.core.build;

import com.extsync.core.logging.MdcContext;
import com.extsync.core.model.OutputOptions;

import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.util.function.Function;

/**
 * Runs a unit of work with output streams scoped to one artifact.
 * Lines written through the scoped streams are prefixed with {@code [handle] }
 * and the handle is available in the MDC as {@code extension}.
 */
public final class OutputScope {

    private OutputScope() {}

    public static <T> T run(String handle, OutputOptions output, Function<OutputOptions, T> body) {
        String prefix = "[" + handle + "] ";
        MdcContext.setExtension(handle);
        PrintStream stdout = new PrintStream(new PrefixingOutputStream(output.stdout(), prefix), true, StandardCharsets.UTF_8);
        PrintStream stderr = new PrintStream(new PrefixingOutputStream(output.stderr(), prefix), true, StandardCharsets.UTF_8);
        try {
            return body.apply(new OutputOptions(stdout, stderr));
        } finally {
            stdout.close();
            stderr.close();
            MdcContext.clearExtension();
        }
    }
}
