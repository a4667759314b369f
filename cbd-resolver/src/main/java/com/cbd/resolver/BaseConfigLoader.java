package com.cbd.resolver;

import com.cbd.config.SystemConfig;
import com.cbd.config.SystemConfigDefaults;
import com.cbd.config.SystemConfigJson;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Objects;

/**
 * Loads the base configuration document, or the compiled-in defaults when the document does not
 * exist. A document that exists but cannot be read or parsed is an error.
 */
public final class BaseConfigLoader {

    private static final Logger log = LoggerFactory.getLogger(BaseConfigLoader.class);

    private final Path file;

    public BaseConfigLoader(Path file) {
        this.file = Objects.requireNonNull(file, "file");
    }

    /**
     * @throws UncheckedIOException when the file exists but is unreadable or malformed
     */
    public SystemConfig load() {
        if (!Files.isRegularFile(file)) {
            log.info("No base configuration at {}; using compiled-in defaults", file);
            return SystemConfigDefaults.create();
        }
        String json;
        try {
            json = Files.readString(file, StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read base configuration " + file, e);
        }
        SystemConfig config = SystemConfigJson.fromJson(json);
        log.info("Base configuration loaded from {} (prefix={})", file, config.getPrefix());
        return config;
    }

    public Path getFile() {
        return file;
    }
}
