package com.extsync.core.model;

import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Point-in-time view of an application and the artifacts it owns.
 *
 * @param directory       application root directory
 * @param artifacts       current artifacts; handles are unique
 * @param dotEnvVariables environment variables loaded for the application (may be empty)
 */
public record AppSnapshot(
    Path directory,
    List<Artifact> artifacts,
    Map<String, String> dotEnvVariables
) {

    public AppSnapshot {
        artifacts = List.copyOf(artifacts);
        dotEnvVariables = dotEnvVariables == null ? Map.of() : Map.copyOf(dotEnvVariables);
    }

    public AppSnapshot(Path directory, List<Artifact> artifacts) {
        this(directory, artifacts, Map.of());
    }

    public Optional<Artifact> findArtifact(String handle) {
        return artifacts.stream().filter(a -> a.handle().equals(handle)).findFirst();
    }

    public List<Artifact> incrementalArtifacts() {
        return artifacts.stream().filter(Artifact::incremental).toList();
    }
}
