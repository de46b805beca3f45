package com.extsync.core.incremental;

import java.io.PrintStream;
import java.nio.file.Path;
import java.util.Map;

/**
 * Settings shared by all incremental sessions of a dev session.
 *
 * @param outputRoot      build output root
 * @param dotEnvVariables application environment variables
 * @param url             public app URL, empty when unknown
 * @param stdout          session output stream
 * @param stderr          session error stream
 */
public record IncrementalSessionOptions(
    Path outputRoot,
    Map<String, String> dotEnvVariables,
    String url,
    PrintStream stdout,
    PrintStream stderr
) {

    public IncrementalSessionOptions {
        dotEnvVariables = dotEnvVariables == null ? Map.of() : Map.copyOf(dotEnvVariables);
        url = url == null ? "" : url;
    }

    public IncrementalSessionOptions withDotEnvVariables(Map<String, String> variables) {
        return new IncrementalSessionOptions(outputRoot, variables, url, stdout, stderr);
    }
}
