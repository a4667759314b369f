package com.cbd.config;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;

/**
 * Compiled-in defaults: the configuration used when no base document exists. Bundled as the
 * classpath resource {@value #RESOURCE}.
 */
public final class SystemConfigDefaults {

    static final String RESOURCE = "/system-config-defaults.json";

    private SystemConfigDefaults() {
    }

    /** Returns a new default configuration (the resource is parsed on each call). */
    public static SystemConfig create() {
        try (InputStream in = SystemConfigDefaults.class.getResourceAsStream(RESOURCE)) {
            if (in == null) {
                throw new IllegalStateException("Missing classpath resource " + RESOURCE);
            }
            return SystemConfigJson.fromJson(new String(in.readAllBytes(), StandardCharsets.UTF_8));
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }
}
