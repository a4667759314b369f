package com.cbd.manifest.load;

import com.cbd.manifest.DeploymentManifest;

import java.nio.file.Path;
import java.util.Objects;

/** A validated manifest and the file it was read from. */
public record LoadedManifest(Path path, DeploymentManifest manifest) {

    public LoadedManifest {
        Objects.requireNonNull(path, "path");
        Objects.requireNonNull(manifest, "manifest");
    }
}
