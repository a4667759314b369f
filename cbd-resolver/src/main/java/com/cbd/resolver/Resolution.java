package com.cbd.resolver;

import com.cbd.config.SystemConfig;
import com.cbd.merge.ChangeRecord;

import java.nio.file.Path;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Resolved configuration with the change log and the manifest that produced it. Without a
 * manifest the configuration is the base and the change log is empty.
 */
public record Resolution(SystemConfig config, List<ChangeRecord> changes, Path manifestPath) {

    public Resolution {
        Objects.requireNonNull(config, "config");
        changes = List.copyOf(changes);
    }

    static Resolution unchanged(SystemConfig base) {
        return new Resolution(base, List.of(), null);
    }

    public Optional<Path> manifest() {
        return Optional.ofNullable(manifestPath);
    }

    /** One {@code path: old → new} line per change. */
    public String formatChanges() {
        return changes.stream().map(ChangeRecord::format).collect(Collectors.joining("\n"));
    }
}
