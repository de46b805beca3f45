package com.extsync.core.session;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.nio.file.Path;

@Component
@ConfigurationProperties(prefix = "extsync")
public class ExtsyncProperties {

    private Session session = new Session();
    private Workspace workspace = new Workspace();

    // -- Session accessors (delegate to nested) --
    public String getBuildOutputPath() { return session.buildOutputPath; }
    public String getAppUrl() { return session.appUrl; }
    public long getShutdownTimeoutSeconds() { return session.shutdownTimeoutSeconds; }

    /**
     * Returns the configured build output root, or {@code <appDirectory>/.extsync/bundle}
     * when none is configured.
     */
    public Path resolveBuildOutputPath(Path appDirectory) {
        if (session.buildOutputPath != null && !session.buildOutputPath.isBlank()) {
            return Path.of(session.buildOutputPath);
        }
        return appDirectory.resolve(".extsync").resolve("bundle");
    }

    /**
     * Returns the public app URL, or null when none is configured.
     */
    public String resolveAppUrl() {
        return session.appUrl != null && !session.appUrl.isBlank() ? session.appUrl : null;
    }

    // -- Workspace accessors (delegate to nested) --
    public String getWorkspaceDirectory() { return workspace.directory; }
    public String getExtensionsDir() { return workspace.extensionsDir; }
    public String getManifestName() { return workspace.manifestName; }
    public long getQuietPeriodMs() { return workspace.quietPeriodMs; }

    public Session getSession() { return session; }
    public void setSession(Session session) { this.session = session; }
    public Workspace getWorkspace() { return workspace; }
    public void setWorkspace(Workspace workspace) { this.workspace = workspace; }

    public static class Session {
        private String buildOutputPath = "";
        private String appUrl = "";
        private long shutdownTimeoutSeconds = 30;

        public String getBuildOutputPath() { return buildOutputPath; }
        public void setBuildOutputPath(String buildOutputPath) { this.buildOutputPath = buildOutputPath; }
        public String getAppUrl() { return appUrl; }
        public void setAppUrl(String appUrl) { this.appUrl = appUrl; }
        public long getShutdownTimeoutSeconds() { return shutdownTimeoutSeconds; }
        public void setShutdownTimeoutSeconds(long shutdownTimeoutSeconds) { this.shutdownTimeoutSeconds = shutdownTimeoutSeconds; }
    }

    public static class Workspace {
        private String directory = ".";
        private String extensionsDir = "extensions";
        private String manifestName = "extension.json";
        private long quietPeriodMs = 200;

        public String getDirectory() { return directory; }
        public void setDirectory(String directory) { this.directory = directory; }
        public String getExtensionsDir() { return extensionsDir; }
        public void setExtensionsDir(String extensionsDir) { this.extensionsDir = extensionsDir; }
        public String getManifestName() { return manifestName; }
        public void setManifestName(String manifestName) { this.manifestName = manifestName; }
        public long getQuietPeriodMs() { return quietPeriodMs; }
        public void setQuietPeriodMs(long quietPeriodMs) { this.quietPeriodMs = quietPeriodMs; }
    }
}
