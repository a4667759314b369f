package com.cbd.manifest.load;

import java.nio.file.Path;

/** The manifest is not well-formed YAML. The message carries the parser's own message. */
public final class ManifestParseException extends ManifestException {

    public ManifestParseException(Path path, String parserMessage, Throwable cause) {
        super(path, "Failed to parse YAML file " + path + ": " + parserMessage, cause);
    }
}
