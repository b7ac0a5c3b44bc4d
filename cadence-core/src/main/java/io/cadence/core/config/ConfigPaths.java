package io.cadence.core.config;

import java.nio.file.Path;
import java.util.Map;

public final class ConfigPaths {
    public static final String CONFIG_ENV = "CADENCE_CONFIG";

    private ConfigPaths() {
    }

    public static Path defaultConfigPath() {
        return configPath(System.getenv());
    }

    static Path configPath(Map<String, String> env) {
        String override = env.get(CONFIG_ENV);
        if (override != null && !override.isBlank()) {
            return resolve(override, "config.json");
        }
        return home().resolve("config.json");
    }

    public static Path home() {
        return Path.of(System.getProperty("user.home"), ".cadence");
    }

    public static Path resolve(String rawPath, String fallbackName) {
        if (rawPath == null || rawPath.isBlank()) {
            return home().resolve(fallbackName);
        }
        if (rawPath.startsWith("~/")) {
            return Path.of(System.getProperty("user.home")).resolve(rawPath.substring(2));
        }
        return Path.of(rawPath);
    }
}
