package com.cbd.manifest.load;

import com.cbd.manifest.DeploymentManifest;
import com.cbd.manifest.schema.SchemaValidator;
import com.cbd.manifest.schema.ValidationResult;
import com.fasterxml.jackson.databind.JsonNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Objects;
import java.util.Optional;

/**
 * Locates, reads, parses and validates the deployment manifest. Empty when no manifest exists;
 * any failure after that is fatal and nothing is returned.
 */
public final class ManifestLoader {

    private static final Logger log = LoggerFactory.getLogger(ManifestLoader.class);

    private final ManifestLocator locator;
    private final ManifestParser parser;
    private final SchemaValidator validator;

    public ManifestLoader(ManifestLocator locator) {
        this(locator, new ManifestParser(), SchemaValidator.forManifests());
    }

    public ManifestLoader(ManifestLocator locator, ManifestParser parser, SchemaValidator validator) {
        this.locator = Objects.requireNonNull(locator, "locator");
        this.parser = Objects.requireNonNull(parser, "parser");
        this.validator = Objects.requireNonNull(validator, "validator");
    }

    /**
     * @return the validated manifest with its path, or empty when none was found
     * @throws ManifestReadException       when the file cannot be read
     * @throws ManifestParseException      when the file is not well-formed
     * @throws ManifestValidationException when the document breaks one or more rules
     */
    public Optional<LoadedManifest> load() {
        Optional<Path> located = locator.locate();
        if (located.isEmpty()) {
            log.info("No deployment manifest found");
            return Optional.empty();
        }
        Path path = located.get();
        log.info("Loading deployment manifest: {}", path);
        return Optional.of(new LoadedManifest(path, load(path)));
    }

    /** Reads, parses and validates the manifest at {@code path}. */
    public DeploymentManifest load(Path path) {
        String text;
        try {
            text = Files.readString(path, StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new ManifestReadException(path, e);
        }
        JsonNode raw = parser.parse(text, path);
        ValidationResult result = validator.validate(raw);
        if (!result.isValid()) {
            log.error("Deployment manifest validation failed ({} error(s)) in {}", result.getErrors().size(), path);
            throw new ManifestValidationException(path, result);
        }
        log.info("Deployment manifest validated successfully");
        return result.getManifest().orElseThrow();
    }
}
