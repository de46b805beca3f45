package com.extsync.core.session;

import org.junit.jupiter.api.Test;

import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

class ExtsyncPropertiesTest {

    @Test
    void defaultsAreReasonable() {
        var props = new ExtsyncProperties();
        assertEquals("", props.getBuildOutputPath());
        assertEquals(30, props.getShutdownTimeoutSeconds());
        assertEquals(".", props.getWorkspaceDirectory());
        assertEquals("extensions", props.getExtensionsDir());
        assertEquals("extension.json", props.getManifestName());
        assertEquals(200, props.getQuietPeriodMs());
    }

    @Test
    void buildOutputDefaultsUnderAppDirectory() {
        var props = new ExtsyncProperties();
        assertEquals(Path.of("/work/app/.extsync/bundle"), props.resolveBuildOutputPath(Path.of("/work/app")));
    }

    @Test
    void configuredBuildOutputWins() {
        var props = new ExtsyncProperties();
        props.getSession().setBuildOutputPath("/tmp/out");
        assertEquals(Path.of("/tmp/out"), props.resolveBuildOutputPath(Path.of("/work/app")));
    }

    @Test
    void blankAppUrlResolvesToNull() {
        var props = new ExtsyncProperties();
        assertNull(props.resolveAppUrl());
        props.getSession().setAppUrl("  ");
        assertNull(props.resolveAppUrl());
        props.getSession().setAppUrl("https://shop.example.com");
        assertEquals("https://shop.example.com", props.resolveAppUrl());
    }
}
