package com.cbd.manifest.load;

import com.cbd.manifest.schema.ValidationResult;

import java.nio.file.Path;

/**
 * Thrown when a manifest fails validation. Carries the full result so callers can report every
 * error; nothing is merged.
 */
public final class ManifestValidationException extends ManifestException {

    private final ValidationResult validationResult;

    public ManifestValidationException(Path path, ValidationResult validationResult) {
        super(path, "Deployment manifest validation failed (" + path + "):\n" + validationResult.formatErrors(), null);
        this.validationResult = validationResult;
    }

    public ValidationResult getValidationResult() {
        return validationResult;
    }
}
