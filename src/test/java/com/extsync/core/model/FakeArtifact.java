package com.extsync.core.model;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Test artifact that writes a marker file on build, or runs a custom build step.
 */
public class FakeArtifact implements Artifact {

    @FunctionalInterface
    public interface BuildStep {
        void run(BuildOptions options, Path outputRoot) throws Exception;
    }

    private final String handle;
    private final boolean incremental;
    private final BuildStep step;
    private final AtomicInteger builds = new AtomicInteger();
    private final List<BuildOptions> receivedOptions = new CopyOnWriteArrayList<>();

    public FakeArtifact(String handle, boolean incremental, BuildStep step) {
        this.handle = handle;
        this.incremental = incremental;
        this.step = step;
    }

    public static FakeArtifact writing(String handle) {
        return new FakeArtifact(handle, false, (options, root) -> {
            Path dir = Files.createDirectories(root.resolve(handle));
            Files.writeString(dir.resolve("bundle.js"), "// " + handle);
        });
    }

    public static FakeArtifact failing(String handle, String message) {
        return new FakeArtifact(handle, false, (options, root) -> {
            throw new RuntimeException(message);
        });
    }

    public static FakeArtifact incremental(String handle) {
        return new FakeArtifact(handle, true, (options, root) -> {});
    }

    @Override
    public String handle() {
        return handle;
    }

    @Override
    public boolean incremental() {
        return incremental;
    }

    @Override
    public void buildForBundle(BuildOptions options, Path outputRoot) throws Exception {
        builds.incrementAndGet();
        receivedOptions.add(options);
        step.run(options, outputRoot);
    }

    public int buildCount() {
        return builds.get();
    }

    public List<BuildOptions> receivedOptions() {
        return receivedOptions;
    }

    @Override
    public String toString() {
        return "FakeArtifact[" + handle + "]";
    }
}
