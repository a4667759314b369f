package com.cbd.manifest.load;

import java.nio.file.Path;

/** Base for failures loading a deployment manifest. Carries the manifest path. */
public class ManifestException extends RuntimeException {

    private final Path path;

    public ManifestException(Path path, String message, Throwable cause) {
        super(message, cause);
        this.path = path;
    }

    public Path getPath() {
        return path;
    }
}
