package com.extsync.core.incremental;

import com.extsync.core.model.AppSnapshot;
import com.extsync.core.model.Artifact;
import com.extsync.core.model.ArtifactEvent;
import com.extsync.core.model.FakeArtifact;
import com.extsync.core.model.ReconciledBatch;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class DefaultIncrementalBuildRegistryTest {

    private static final Path APP_DIR = Path.of("/app");

    /** Opened sessions by handle, in open order. */
    private final Map<String, TrackingSession> opened = new HashMap<>();
    private final List<IncrementalSessionOptions> openOptions = new ArrayList<>();
    private DefaultIncrementalBuildRegistry registry;

    static final class TrackingSession implements IncrementalBuildSession {
        boolean closed;

        @Override
        public RebuildResult rebuild() {
            return RebuildResult.success();
        }

        @Override
        public void close() {
            closed = true;
        }
    }

    @BeforeEach
    void setUp() {
        IncrementalSessionFactory factory = (artifact, options) -> {
            if (artifact.handle().startsWith("broken")) {
                throw new IllegalStateException("cannot start bundler");
            }
            var session = new TrackingSession();
            opened.put(artifact.handle(), session);
            openOptions.add(options);
            return session;
        };
        registry = new DefaultIncrementalBuildRegistry(factory, new IncrementalSessionOptions(
                APP_DIR.resolve("bundle"), Map.of("A", "1"), null, System.out, System.err));
    }

    private static ReconciledBatch batch(List<Artifact> artifacts, Map<String, String> env, ArtifactEvent... events) {
        return new ReconciledBatch(new AppSnapshot(APP_DIR, artifacts, env), List.of(events), APP_DIR, 0L);
    }

    @Nested
    @DisplayName("createSessions")
    class CreateSessionsTests {

        @Test
        @DisplayName("opens sessions for eligible artifacts only")
        void opensEligibleOnly() {
            registry.createSessions(List.of(FakeArtifact.incremental("inc"), FakeArtifact.writing("plain")));

            assertEquals(Set.of("inc"), registry.activeHandles());
            assertTrue(registry.sessionFor("inc").isPresent());
            assertTrue(registry.sessionFor("plain").isEmpty());
        }

        @Test
        @DisplayName("passes session options with an empty url when none is set")
        void passesOptions() {
            registry.createSessions(List.of(FakeArtifact.incremental("inc")));

            assertEquals("", openOptions.get(0).url());
            assertEquals(Map.of("A", "1"), openOptions.get(0).dotEnvVariables());
        }

        @Test
        @DisplayName("opens the remaining sessions before reporting failures")
        void reportsFailuresAfterTryingAll() {
            var ex = assertThrows(IncrementalSessionException.class, () -> registry.createSessions(List.of(
                    FakeArtifact.incremental("broken-one"), FakeArtifact.incremental("fine"))));

            assertTrue(ex.getMessage().contains("broken-one"));
            assertEquals(Set.of("fine"), registry.activeHandles());
        }

        @Test
        @DisplayName("does not reopen an existing session")
        void doesNotReopen() {
            var inc = FakeArtifact.incremental("inc");
            registry.createSessions(List.of(inc));
            var first = opened.get("inc");

            registry.createSessions(List.of(inc));

            assertSame(first, registry.sessionFor("inc").orElseThrow());
        }
    }

    @Nested
    @DisplayName("updateSessions")
    class UpdateSessionsTests {

        @Test
        @DisplayName("opens sessions for created incremental artifacts")
        void opensForCreated() {
            var inc = FakeArtifact.incremental("new");

            registry.updateSessions(batch(List.of(inc), Map.of(), ArtifactEvent.created(inc)));

            assertEquals(Set.of("new"), registry.activeHandles());
        }

        @Test
        @DisplayName("disposes sessions of deleted artifacts")
        void disposesDeleted() {
            var inc = FakeArtifact.incremental("gone");
            registry.createSessions(List.of(inc));

            registry.updateSessions(batch(List.of(), Map.of(), ArtifactEvent.deleted(inc)));

            assertTrue(registry.activeHandles().isEmpty());
            assertTrue(opened.get("gone").closed);
        }

        @Test
        @DisplayName("disposes sessions of artifacts that are no longer eligible")
        void disposesIneligible() {
            registry.createSessions(List.of(FakeArtifact.incremental("ext")));
            var nowPlain = FakeArtifact.writing("ext");

            registry.updateSessions(batch(List.of(nowPlain), Map.of(), ArtifactEvent.updated(nowPlain)));

            assertTrue(registry.sessionFor("ext").isEmpty());
            assertTrue(opened.get("ext").closed);
        }

        @Test
        @DisplayName("opens sessions for artifacts that became eligible")
        void opensNewlyEligible() {
            var nowIncremental = FakeArtifact.incremental("ext");

            registry.updateSessions(batch(List.of(nowIncremental), Map.of(), ArtifactEvent.updated(nowIncremental)));

            assertTrue(registry.sessionFor("ext").isPresent());
        }

        @Test
        @DisplayName("leaves untouched sessions alone")
        void leavesOthersAlone() {
            var kept = FakeArtifact.incremental("kept");
            registry.createSessions(List.of(kept));
            var first = opened.get("kept");
            var other = FakeArtifact.writing("other");

            registry.updateSessions(batch(List.of(kept, other), Map.of(), ArtifactEvent.updated(other)));

            assertSame(first, registry.sessionFor("kept").orElseThrow());
            assertFalse(first.closed);
        }

        @Test
        @DisplayName("reopens the session when an updated artifact's definition changed")
        void reopensOnChangedDefinition() {
            registry.createSessions(List.of(FakeArtifact.incremental("ext")));
            var first = opened.get("ext");
            var redefined = FakeArtifact.incremental("ext");

            registry.updateSessions(batch(List.of(redefined), Map.of(), ArtifactEvent.updated(redefined)));

            assertTrue(first.closed);
            assertNotSame(first, registry.sessionFor("ext").orElseThrow());
            assertSame(opened.get("ext"), registry.sessionFor("ext").orElseThrow());
        }

        @Test
        @DisplayName("keeps the session when an updated artifact's definition is unchanged")
        void keepsSessionForSameDefinition() {
            var inc = FakeArtifact.incremental("ext");
            registry.createSessions(List.of(inc));
            var first = opened.get("ext");

            registry.updateSessions(batch(List.of(inc), Map.of(), ArtifactEvent.updated(inc)));

            assertSame(first, registry.sessionFor("ext").orElseThrow());
            assertFalse(first.closed);
        }

        @Test
        @DisplayName("a session that fails to open does not fail the update")
        void openFailureIsNotFatal() {
            var broken = FakeArtifact.incremental("broken");
            var fine = FakeArtifact.incremental("fine");

            assertDoesNotThrow(() -> registry.updateSessions(batch(List.of(broken, fine), Map.of(),
                    ArtifactEvent.created(broken), ArtifactEvent.created(fine))));

            assertEquals(Set.of("fine"), registry.activeHandles());
        }

        @Test
        @DisplayName("does not retry artifacts the batch does not touch")
        void untouchedArtifactsAreNotReopened() {
            var broken = FakeArtifact.incremental("broken");
            assertThrows(IncrementalSessionException.class, () -> registry.createSessions(List.of(broken)));
            var other = FakeArtifact.writing("other");

            assertDoesNotThrow(() -> registry.updateSessions(
                    batch(List.of(broken, other), Map.of(), ArtifactEvent.updated(other))));

            assertTrue(registry.activeHandles().isEmpty());
        }

        @Test
        @DisplayName("new sessions see the batch's dotenv variables")
        void refreshesDotEnv() {
            var inc = FakeArtifact.incremental("new");

            registry.updateSessions(batch(List.of(inc), Map.of("API_KEY", "xyz"), ArtifactEvent.created(inc)));

            assertEquals(Map.of("API_KEY", "xyz"), openOptions.get(0).dotEnvVariables());
        }
    }

    @Test
    @DisplayName("close disposes every session")
    void closeDisposesAll() {
        registry.createSessions(List.of(FakeArtifact.incremental("a"), FakeArtifact.incremental("b")));

        registry.close();

        assertTrue(registry.activeHandles().isEmpty());
        assertTrue(opened.get("a").closed);
        assertTrue(opened.get("b").closed);
    }
}
