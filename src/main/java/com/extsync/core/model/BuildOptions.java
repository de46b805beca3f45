package com.extsync.core.model;

import java.io.PrintStream;

/**
 * Parameters passed to {@link Artifact#buildForBundle}.
 *
 * @param app         the owning application snapshot
 * @param stdout      output stream scoped to the artifact being built
 * @param stderr      error stream scoped to the artifact being built
 * @param useTasks    whether interactive task progress UI may be used
 * @param environment build environment tag
 * @param appUrl      public URL of the running app, null when unknown
 */
public record BuildOptions(
    AppSnapshot app,
    PrintStream stdout,
    PrintStream stderr,
    boolean useTasks,
    String environment,
    String appUrl
) {

    public static final String DEVELOPMENT = "development";

    public static BuildOptions development(AppSnapshot app, PrintStream stdout, PrintStream stderr, String appUrl) {
        return new BuildOptions(app, stdout, stderr, false, DEVELOPMENT, appUrl);
    }
}
