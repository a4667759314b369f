package com.cbd.resolver;

import com.cbd.manifest.load.ManifestLocator;

import java.nio.file.Path;
import java.util.Map;
import java.util.Objects;

/**
 * Settings read from environment variables.
 * <p>
 * DEPLOYMENT_MANIFEST: explicit manifest path (optional). CBD_WORKING_DIR: directory searched for
 * the manifest and against which relative paths resolve (default: current directory).
 * CBD_BASE_CONFIG: base configuration document (default {@value #DEFAULT_BASE_CONFIG}).
 */
public final class ResolverSettings {

    static final String ENV_MANIFEST = ManifestLocator.ENV_MANIFEST_PATH;
    static final String ENV_WORKING_DIR = "CBD_WORKING_DIR";
    static final String ENV_BASE_CONFIG = "CBD_BASE_CONFIG";

    public static final String DEFAULT_BASE_CONFIG = "bin/config.json";

    private final Path workingDir;
    private final String baseConfig;
    private final String manifest;

    private ResolverSettings(Builder b) {
        this.workingDir = b.workingDir != null ? b.workingDir : Path.of("");
        this.baseConfig = b.baseConfig != null && !b.baseConfig.isBlank() ? b.baseConfig.trim() : DEFAULT_BASE_CONFIG;
        this.manifest = b.manifest != null && !b.manifest.isBlank() ? b.manifest.trim() : null;
    }

    public static ResolverSettings fromEnvironment() {
        return fromEnvironment(System.getenv());
    }

    /** Same as {@link #fromEnvironment()} over an explicit variable map. */
    public static ResolverSettings fromEnvironment(Map<String, String> env) {
        String dir = env.get(ENV_WORKING_DIR);
        return builder()
                .workingDir(dir != null && !dir.isBlank() ? Path.of(dir.trim()) : null)
                .baseConfig(env.get(ENV_BASE_CONFIG))
                .manifest(env.get(ENV_MANIFEST))
                .build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public Path getWorkingDir() {
        return workingDir;
    }

    /** Base configuration file, resolved against the working directory. */
    public Path getBaseConfigFile() {
        return workingDir.resolve(baseConfig);
    }

    /** Explicit manifest path as given; null when not set. */
    public String getManifest() {
        return manifest;
    }

    public ManifestLocator manifestLocator() {
        return new ManifestLocator(workingDir, manifest);
    }

    /** Builder seeded with these settings, for command-line overrides. */
    public Builder toBuilder() {
        return builder().workingDir(workingDir).baseConfig(baseConfig).manifest(manifest);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        ResolverSettings that = (ResolverSettings) o;
        return workingDir.equals(that.workingDir)
                && baseConfig.equals(that.baseConfig)
                && Objects.equals(manifest, that.manifest);
    }

    @Override
    public int hashCode() {
        return Objects.hash(workingDir, baseConfig, manifest);
    }

    @Override
    public String toString() {
        return "ResolverSettings{workingDir=" + workingDir + ", baseConfig=" + baseConfig + ", manifest=" + manifest + "}";
    }

    public static final class Builder {
        private Path workingDir;
        private String baseConfig;
        private String manifest;

        private Builder() {
        }

        public Builder workingDir(Path workingDir) {
            this.workingDir = workingDir;
            return this;
        }

        public Builder baseConfig(String baseConfig) {
            this.baseConfig = baseConfig;
            return this;
        }

        public Builder manifest(String manifest) {
            this.manifest = manifest;
            return this;
        }

        public ResolverSettings build() {
            return new ResolverSettings(this);
        }
    }
}
