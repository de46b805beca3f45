package com.extsync.workspace;

import com.extsync.core.model.AppSnapshot;
import com.extsync.core.model.BuildOptions;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class DirectoryArtifactTest {

    @TempDir
    Path tmp;

    private Path extDir;
    private Path outputRoot;
    private ByteArrayOutputStream stdout;
    private BuildOptions options;

    @BeforeEach
    void setUp() throws IOException {
        extDir = Files.createDirectories(tmp.resolve("app/extensions/banner"));
        outputRoot = tmp.resolve("out");
        stdout = new ByteArrayOutputStream();
        var out = new PrintStream(stdout, true, StandardCharsets.UTF_8);
        options = BuildOptions.development(new AppSnapshot(tmp.resolve("app"), List.of()), out, out, null);
    }

    @Test
    void copiesSourceTreeIntoOutputFolder() throws Exception {
        Path src = Files.createDirectories(extDir.resolve("src/components"));
        Files.writeString(extDir.resolve("src/index.js"), "main");
        Files.writeString(src.resolve("Banner.js"), "banner");
        var artifact = new DirectoryArtifact("banner", extDir, extDir.resolve("src"), false);

        artifact.buildForBundle(options, outputRoot);

        assertEquals("main", Files.readString(outputRoot.resolve("banner/index.js")));
        assertEquals("banner", Files.readString(outputRoot.resolve("banner/components/Banner.js")));
        assertTrue(stdout.toString(StandardCharsets.UTF_8).contains("Bundled 2 files (development)"));
    }

    @Test
    void replacesPreviousOutput() throws Exception {
        Files.createDirectories(extDir.resolve("src"));
        Files.writeString(extDir.resolve("src/index.js"), "main");
        Path stale = Files.createDirectories(outputRoot.resolve("banner")).resolve("stale.js");
        Files.writeString(stale, "old");
        var artifact = new DirectoryArtifact("banner", extDir, extDir.resolve("src"), false);

        artifact.buildForBundle(options, outputRoot);

        assertFalse(Files.exists(stale));
        assertTrue(Files.exists(outputRoot.resolve("banner/index.js")));
    }

    @Test
    void missingSourceFails() {
        var artifact = new DirectoryArtifact("banner", extDir, extDir.resolve("src"), false);

        var e = assertThrows(ArtifactBuildException.class, () -> artifact.buildForBundle(options, outputRoot));
        assertTrue(e.getMessage().startsWith("Source directory not found"));
    }
}
