package com.airwatch.service.config;

import com.airwatch.core.util.JsonUtils;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;

public final class ConfigLoader {
    public static final String CONFIG_PATH_ENV = "AIRWATCH_CONFIG";
    public static final Path DEFAULT_CONFIG_PATH = Path.of("config", "airwatch.json");

    private ConfigLoader() {
    }

    public static Path resolvePath(Map<String, String> env) {
        String override = env.get(CONFIG_PATH_ENV);
        if (override == null || override.isBlank()) {
            return DEFAULT_CONFIG_PATH;
        }
        return Path.of(override.trim());
    }

    public static AirWatchConfig load(Path path) {
        try (InputStream in = Files.newInputStream(path)) {
            AirWatchConfig config = JsonUtils.objectMapper().readValue(in, AirWatchConfig.class);
            return config == null ? AirWatchConfig.defaults() : config;
        } catch (IOException | IllegalArgumentException e) {
            throw new IllegalStateException("Failed loading config from " + path, e);
        }
    }
}
