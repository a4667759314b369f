package com.cbd.manifest.load;

import java.io.IOException;
import java.nio.file.Path;

/** The manifest file exists but could not be read. */
public final class ManifestReadException extends ManifestException {

    public ManifestReadException(Path path, IOException cause) {
        super(path, "Failed to read deployment manifest " + path + ": " + cause.getMessage(), cause);
    }
}
