package com.cbd.resolver;

import com.cbd.config.SystemConfig;
import com.cbd.manifest.load.LoadedManifest;
import com.cbd.manifest.load.ManifestLoader;
import com.cbd.merge.MergeEngine;
import com.cbd.merge.MergeResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;
import java.util.Optional;
import java.util.function.Supplier;

/**
 * Resolves the final configuration: base, then the deployment manifest on top when one exists.
 * Read, parse and validation failures propagate as
 * {@link com.cbd.manifest.load.ManifestException}s and nothing is merged.
 */
public final class ConfigurationResolver {

    private static final Logger log = LoggerFactory.getLogger(ConfigurationResolver.class);

    private final ManifestLoader manifestLoader;
    private final MergeEngine mergeEngine;

    public ConfigurationResolver(ManifestLoader manifestLoader, MergeEngine mergeEngine) {
        this.manifestLoader = Objects.requireNonNull(manifestLoader, "manifestLoader");
        this.mergeEngine = Objects.requireNonNull(mergeEngine, "mergeEngine");
    }

    public static ConfigurationResolver fromSettings(ResolverSettings settings) {
        return new ConfigurationResolver(new ManifestLoader(settings.manifestLocator()), new MergeEngine());
    }

    /**
     * @param loadBase supplies the base configuration; called once
     */
    public Resolution resolve(Supplier<SystemConfig> loadBase) {
        SystemConfig base = Objects.requireNonNull(loadBase.get(), "base configuration");
        Optional<LoadedManifest> loaded = manifestLoader.load();
        if (loaded.isEmpty()) {
            log.info("Using base configuration only");
            return Resolution.unchanged(base);
        }
        MergeResult merged = mergeEngine.merge(base, loaded.get().manifest());
        return new Resolution(merged.config(), merged.changes(), loaded.get().path());
    }
}
