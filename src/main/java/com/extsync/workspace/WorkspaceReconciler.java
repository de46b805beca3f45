package com.extsync.workspace;

import com.extsync.core.model.AppSnapshot;
import com.extsync.core.model.Artifact;
import com.extsync.core.model.ArtifactEvent;
import com.extsync.core.model.ReconciledBatch;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Turns raw changed paths into a {@link ReconciledBatch} by reloading the workspace
 * and diffing it against the previous snapshot.
 * <p>
 * An extension is created when its handle is new, deleted when its handle is gone,
 * and updated when its definition changed or one of the changed paths lies inside
 * its directory.
 */
@Component
public class WorkspaceReconciler {

    private static final Logger log = LoggerFactory.getLogger(WorkspaceReconciler.class);

    private final WorkspaceLoader loader;

    public WorkspaceReconciler(WorkspaceLoader loader) {
        this.loader = loader;
    }

    public ReconciledBatch reconcile(AppSnapshot previous, Collection<Path> changedPaths, long startNanos) {
        AppSnapshot next = loader.load(previous.directory());
        Map<String, Artifact> before = byHandle(previous.artifacts());
        Map<String, Artifact> after = byHandle(next.artifacts());

        var events = new ArrayList<ArtifactEvent>();
        for (Artifact artifact : next.artifacts()) {
            Artifact old = before.get(artifact.handle());
            if (old == null) {
                events.add(ArtifactEvent.created(artifact));
            } else if (!old.equals(artifact) || touches(artifact, changedPaths)) {
                events.add(ArtifactEvent.updated(artifact));
            }
        }
        for (Artifact artifact : previous.artifacts()) {
            if (!after.containsKey(artifact.handle())) {
                events.add(ArtifactEvent.deleted(artifact));
            }
        }

        Path trigger = changedPaths.isEmpty() ? previous.directory() : changedPaths.iterator().next();
        log.debug("Reconciled {} changed paths into {} extension events", changedPaths.size(), events.size());
        return new ReconciledBatch(next, events, trigger, startNanos);
    }

    private static boolean touches(Artifact artifact, Collection<Path> changedPaths) {
        if (!(artifact instanceof DirectoryArtifact dir)) return false;
        for (Path path : changedPaths) {
            if (path.startsWith(dir.directory())) return true;
        }
        return false;
    }

    private static Map<String, Artifact> byHandle(List<Artifact> artifacts) {
        var map = new LinkedHashMap<String, Artifact>();
        for (Artifact artifact : artifacts) {
            map.put(artifact.handle(), artifact);
        }
        return map;
    }
}
