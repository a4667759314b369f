package com.cbd.manifest.load;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Files;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Finds the deployment manifest. Candidates in priority order: the explicit path (relative paths
 * resolve against the working directory), {@value #PRIMARY_FILE_NAME}, then
 * {@value #ALTERNATE_FILE_NAME}. The first existing candidate wins; a missing manifest is not an
 * error, and an explicit path that is not a valid path is skipped with a warning.
 */
public final class ManifestLocator {

    private static final Logger log = LoggerFactory.getLogger(ManifestLocator.class);

    public static final String ENV_MANIFEST_PATH = "DEPLOYMENT_MANIFEST";
    public static final String PRIMARY_FILE_NAME = "deployment-manifest.yaml";
    public static final String ALTERNATE_FILE_NAME = "deployment-manifest.yml";

    private final Path workingDir;
    private final String explicitPath;

    /**
     * @param workingDir   directory searched for the default file names
     * @param explicitPath explicit manifest path; null or blank means none
     */
    public ManifestLocator(Path workingDir, String explicitPath) {
        this.workingDir = Objects.requireNonNull(workingDir, "workingDir");
        this.explicitPath = explicitPath;
    }

    /** Locator for {@code workingDir} with the explicit path taken from {@value #ENV_MANIFEST_PATH}. */
    public static ManifestLocator fromEnvironment(Path workingDir) {
        return new ManifestLocator(workingDir, System.getenv(ENV_MANIFEST_PATH));
    }

    /** Candidate paths in priority order. */
    public List<Path> candidates() {
        List<Path> candidates = new ArrayList<>(3);
        if (explicitPath != null && !explicitPath.isBlank()) {
            try {
                candidates.add(workingDir.resolve(explicitPath.trim()));
            } catch (InvalidPathException e) {
                log.warn("Ignoring {}={}: {}", ENV_MANIFEST_PATH, explicitPath, e.getMessage());
            }
        }
        candidates.add(workingDir.resolve(PRIMARY_FILE_NAME));
        candidates.add(workingDir.resolve(ALTERNATE_FILE_NAME));
        return candidates;
    }

    public Optional<Path> locate() {
        for (Path candidate : candidates()) {
            if (Files.exists(candidate)) {
                log.debug("Deployment manifest found at {}", candidate);
                return Optional.of(candidate);
            }
        }
        return Optional.empty();
    }
}
