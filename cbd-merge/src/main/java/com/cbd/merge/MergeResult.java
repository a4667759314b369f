package com.cbd.merge;

import com.cbd.config.SystemConfig;

import java.util.List;
import java.util.Objects;

/** Merged configuration and the changes applied, in traversal order. */
public record MergeResult(SystemConfig config, List<ChangeRecord> changes) {

    public MergeResult {
        Objects.requireNonNull(config, "config");
        changes = List.copyOf(changes);
    }
}
