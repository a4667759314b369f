package com.cbd.manifest.schema;

import java.util.Objects;

/**
 * One validation failure. {@code path} is dotted, with array indexes as segments
 * ({@code vpc.subnetIds.0}); the empty path is the document root.
 */
public record FieldError(String path, String message) {

    public FieldError {
        Objects.requireNonNull(path, "path");
        Objects.requireNonNull(message, "message");
    }

    /** Report line: {@code path: message}, with {@code root} for the empty path. */
    public String format() {
        return (path.isEmpty() ? "root" : path) + ": " + message;
    }
}
