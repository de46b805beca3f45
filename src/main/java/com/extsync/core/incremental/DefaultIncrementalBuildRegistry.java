package com.extsync.core.incremental;

import com.extsync.core.model.AppSnapshot;
import com.extsync.core.model.Artifact;
import com.extsync.core.model.ArtifactEvent;
import com.extsync.core.model.ChangeKind;
import com.extsync.core.model.ReconciledBatch;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.stream.Collectors;

/**
 * Registry of incremental build sessions keyed by artifact handle.
 *
 * <p>Lifecycle:
 * <ol>
 *   <li>Dev session starts: {@link #createSessions} opens a session per eligible artifact</li>
 *   <li>Per batch: {@link #updateSessions} disposes sessions of deleted or no longer eligible
 *       artifacts, then opens or reopens sessions for the created and updated ones</li>
 *   <li>Dev session ends: {@link #close} disposes everything</li>
 * </ol>
 *
 * <p>Each session is kept with the artifact it was opened for. An update whose artifact
 * differs from that one reopens the session, so it never builds a stale definition.
 */
public class DefaultIncrementalBuildRegistry implements IncrementalBuildRegistry {

    private static final Logger log = LoggerFactory.getLogger(DefaultIncrementalBuildRegistry.class);

    private record Entry(Artifact artifact, IncrementalBuildSession session) {}

    private final IncrementalSessionFactory factory;
    private final ConcurrentHashMap<String, Entry> sessions = new ConcurrentHashMap<>();
    private volatile IncrementalSessionOptions options;

    public DefaultIncrementalBuildRegistry(IncrementalSessionFactory factory, IncrementalSessionOptions options) {
        this.factory = factory;
        this.options = options;
    }

    /**
     * @throws IncrementalSessionException after trying every artifact, if any session failed to open
     */
    @Override
    public void createSessions(Collection<Artifact> artifacts) {
        var failures = new ArrayList<String>();
        for (Artifact artifact : artifacts) {
            if (!artifact.incremental()) {
                log.debug("Skipping incremental session for non-incremental artifact {}", artifact.handle());
                continue;
            }
            if (sessions.containsKey(artifact.handle())) continue;
            String failure = open(artifact);
            if (failure != null) failures.add(failure);
        }
        if (!failures.isEmpty()) {
            throw new IncrementalSessionException("Failed to open incremental sessions: " + String.join("; ", failures));
        }
    }

    /**
     * Never throws for a single artifact: a session that fails to open is reported on the
     * session's stderr and its artifact falls back to full builds until it changes again.
     */
    @Override
    public void updateSessions(ReconciledBatch batch) {
        AppSnapshot app = batch.app();
        options = options.withDotEnvVariables(app.dotEnvVariables());

        for (ArtifactEvent event : batch.events()) {
            if (event.kind() == ChangeKind.DELETED) {
                dispose(event.artifact().handle());
            }
        }

        // Sessions whose artifact left the snapshot or lost eligibility
        Set<String> eligible = app.incrementalArtifacts().stream()
                .map(Artifact::handle)
                .collect(Collectors.toSet());
        for (String handle : List.copyOf(sessions.keySet())) {
            if (!eligible.contains(handle)) {
                dispose(handle);
            }
        }

        for (Artifact artifact : batch.affectedArtifacts()) {
            if (!artifact.incremental()) continue;
            Entry existing = sessions.get(artifact.handle());
            if (existing != null) {
                if (existing.artifact().equals(artifact)) continue;
                log.info("Definition of {} changed, reopening its incremental session", artifact.handle());
                dispose(artifact.handle());
            }
            String failure = open(artifact);
            if (failure != null) {
                options.stderr().println("Incremental session unavailable, falling back to full builds: " + failure);
            }
        }
    }

    @Override
    public Optional<IncrementalBuildSession> sessionFor(String handle) {
        return Optional.ofNullable(sessions.get(handle)).map(Entry::session);
    }

    public Set<String> activeHandles() {
        return Set.copyOf(sessions.keySet());
    }

    @Override
    public void close() {
        for (String handle : List.copyOf(sessions.keySet())) {
            dispose(handle);
        }
    }

    /**
     * @return null on success, otherwise a {@code handle: reason} description
     */
    private String open(Artifact artifact) {
        try {
            sessions.put(artifact.handle(), new Entry(artifact, factory.open(artifact, options)));
            log.info("Opened incremental session for {}", artifact.handle());
            return null;
        } catch (Exception e) {
            log.error("Failed to open incremental session for {}: {}", artifact.handle(), e.getMessage());
            return artifact.handle() + ": " + e.getMessage();
        }
    }

    private void dispose(String handle) {
        Entry entry = sessions.remove(handle);
        if (entry == null) return;
        try {
            entry.session().close();
            log.info("Disposed incremental session for {}", handle);
        } catch (Exception e) {
            log.warn("Failed to dispose incremental session for {}: {}", handle, e.getMessage(), e);
        }
    }
}
