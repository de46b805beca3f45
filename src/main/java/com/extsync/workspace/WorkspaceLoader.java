package com.extsync.workspace;

import com.extsync.core.model.AppSnapshot;
import com.extsync.core.model.Artifact;
import com.extsync.core.session.ExtsyncProperties;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Stream;

/**
 * Reads an application directory into an {@link AppSnapshot}.
 * <p>
 * Every direct subdirectory of the extensions directory holding a manifest
 * becomes one {@link DirectoryArtifact}. An optional {@code .env} file in the
 * application root supplies the dotenv variables.
 */
@Component
public class WorkspaceLoader {

    private static final Logger log = LoggerFactory.getLogger(WorkspaceLoader.class);
    static final String DOTENV = ".env";

    private final ObjectMapper objectMapper;
    private final String extensionsDir;
    private final String manifestName;

    public WorkspaceLoader(ObjectMapper objectMapper, ExtsyncProperties properties) {
        this(objectMapper, properties.getExtensionsDir(), properties.getManifestName());
    }

    WorkspaceLoader(ObjectMapper objectMapper, String extensionsDir, String manifestName) {
        this.objectMapper = objectMapper;
        this.extensionsDir = extensionsDir;
        this.manifestName = manifestName;
    }

    public Path extensionsRoot(Path appDirectory) {
        return appDirectory.resolve(extensionsDir);
    }

    public String manifestName() {
        return manifestName;
    }

    /**
     * @throws WorkspaceException if the directory cannot be read, a manifest is invalid,
     *                            or two extensions share a handle
     */
    public AppSnapshot load(Path appDirectory) {
        Path root = extensionsRoot(appDirectory);
        var artifacts = new ArrayList<Artifact>();
        var seen = new HashMap<String, Path>();

        if (Files.isDirectory(root)) {
            List<Path> dirs;
            try (Stream<Path> list = Files.list(root)) {
                dirs = list.filter(Files::isDirectory).sorted().toList();
            } catch (IOException e) {
                throw new WorkspaceException("Failed to list extensions in " + root + ": " + e.getMessage(), e);
            }
            for (Path dir : dirs) {
                Path manifest = dir.resolve(manifestName);
                if (!Files.isRegularFile(manifest)) {
                    log.debug("Skipping {}: no {}", dir, manifestName);
                    continue;
                }
                DirectoryArtifact artifact = readArtifact(dir, manifest);
                Path previous = seen.putIfAbsent(artifact.handle(), dir);
                if (previous != null) {
                    throw new WorkspaceException("Duplicate extension handle '" + artifact.handle()
                            + "' in " + previous + " and " + dir);
                }
                artifacts.add(artifact);
            }
        } else {
            log.warn("Extensions directory {} does not exist", root);
        }

        return new AppSnapshot(appDirectory, artifacts, readDotEnv(appDirectory.resolve(DOTENV)));
    }

    private DirectoryArtifact readArtifact(Path dir, Path manifestFile) {
        ExtensionManifest manifest;
        try {
            manifest = objectMapper.readValue(manifestFile.toFile(), ExtensionManifest.class);
        } catch (IOException e) {
            throw new WorkspaceException("Invalid manifest " + manifestFile + ": " + e.getMessage(), e);
        }
        String handle = manifest.handle() != null && !manifest.handle().isBlank()
                ? manifest.handle() : dir.getFileName().toString();
        String source = manifest.source() != null && !manifest.source().isBlank() ? manifest.source() : "src";
        boolean incremental = Boolean.TRUE.equals(manifest.incremental());
        return new DirectoryArtifact(handle, dir, dir.resolve(source), incremental);
    }

    static Map<String, String> readDotEnv(Path file) {
        if (!Files.isRegularFile(file)) return Map.of();
        List<String> lines;
        try {
            lines = Files.readAllLines(file);
        } catch (IOException e) {
            throw new WorkspaceException("Failed to read " + file + ": " + e.getMessage(), e);
        }
        var variables = new LinkedHashMap<String, String>();
        for (String raw : lines) {
            String line = raw.strip();
            if (line.isEmpty() || line.startsWith("#")) continue;
            int eq = line.indexOf('=');
            if (eq <= 0) continue;
            String key = line.substring(0, eq).strip();
            String value = line.substring(eq + 1).strip();
            if (value.length() >= 2 && (value.startsWith("\"") && value.endsWith("\"")
                    || value.startsWith("'") && value.endsWith("'"))) {
                value = value.substring(1, value.length() - 1);
            }
            variables.put(key, value);
        }
        return variables;
    }
}
