package com.cbd.manifest.schema;

import com.cbd.manifest.DeploymentManifest;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Outcome of manifest validation: either the validated manifest or every error found, in schema
 * order. Never both.
 */
public final class ValidationResult {

    private final DeploymentManifest manifest;
    private final List<FieldError> errors;

    private ValidationResult(DeploymentManifest manifest, List<FieldError> errors) {
        this.manifest = manifest;
        this.errors = Collections.unmodifiableList(new ArrayList<>(errors));
    }

    public static ValidationResult success(DeploymentManifest manifest) {
        return new ValidationResult(Objects.requireNonNull(manifest, "manifest"), List.of());
    }

    public static ValidationResult failure(List<FieldError> errors) {
        if (errors == null || errors.isEmpty()) {
            throw new IllegalArgumentException("A failed validation needs at least one error");
        }
        return new ValidationResult(null, errors);
    }

    public boolean isValid() {
        return manifest != null;
    }

    public Optional<DeploymentManifest> getManifest() {
        return Optional.ofNullable(manifest);
    }

    public List<FieldError> getErrors() {
        return errors;
    }

    /** One {@code path: message} line per error. */
    public String formatErrors() {
        return errors.stream().map(FieldError::format).collect(Collectors.joining("\n"));
    }
}
