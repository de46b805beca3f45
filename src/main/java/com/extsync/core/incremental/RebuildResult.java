package com.extsync.core.incremental;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Result of one incremental rebuild.
 *
 * @param errors error diagnostics, empty on success
 */
public record RebuildResult(List<BuildMessage> errors) {

    public RebuildResult {
        errors = errors == null ? List.of() : List.copyOf(errors);
    }

    public static RebuildResult success() {
        return new RebuildResult(List.of());
    }

    public boolean hasErrors() {
        return !errors.isEmpty();
    }

    /**
     * All error texts joined by newline.
     */
    public String combinedMessage() {
        return errors.stream().map(BuildMessage::text).collect(Collectors.joining("\n"));
    }
}
