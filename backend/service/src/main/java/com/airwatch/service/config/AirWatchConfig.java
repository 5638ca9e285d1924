package com.airwatch.service.config;

import com.airwatch.pipeline.api.Target;

import java.nio.file.Path;
import java.time.Duration;
import java.util.List;

public record AirWatchConfig(
        Duration refreshInterval,
        Duration liveTtl,
        Duration forecastTtl,
        Duration dedupWindow,
        Integer timelineDays,
        Integer forecastDays,
        String waqiBaseUrl,
        Duration requestTimeout,
        String storeFile,
        List<Target> targets
) {
    public static final Duration MIN_REFRESH_INTERVAL = Duration.ofMinutes(1);
    public static final String DEFAULT_WAQI_BASE_URL = "https://api.waqi.info";
    public static final List<Target> DEFAULT_TARGETS = List.of(
            new Target("Sarajevo", "Sarajevo", "@10557"),
            new Target("Tuzla", "Tuzla", "@8739"),
            new Target("Zenica", "Zenica", "@8740"),
            new Target("Mostar", "Mostar", "@8741"),
            new Target("Vitez", "Vitez", "@8742"),
            new Target("Bihac", "Bihać", "@8743")
    );

    public AirWatchConfig {
        refreshInterval = refreshInterval == null ? Duration.ofMinutes(10) : refreshInterval;
        if (refreshInterval.compareTo(MIN_REFRESH_INTERVAL) < 0) {
            throw new IllegalArgumentException("refreshInterval must be at least " + MIN_REFRESH_INTERVAL);
        }
        liveTtl = positive("liveTtl", liveTtl, Duration.ofMinutes(10));
        forecastTtl = positive("forecastTtl", forecastTtl, Duration.ofHours(2));
        dedupWindow = dedupWindow == null ? Duration.ofMinutes(5) : dedupWindow;
        if (dedupWindow.isNegative()) {
            throw new IllegalArgumentException("dedupWindow must not be negative");
        }
        timelineDays = atLeastOne("timelineDays", timelineDays, 7);
        forecastDays = atLeastOne("forecastDays", forecastDays, 7);
        waqiBaseUrl = waqiBaseUrl == null || waqiBaseUrl.isBlank() ? DEFAULT_WAQI_BASE_URL : stripTrailingSlash(waqiBaseUrl.trim());
        requestTimeout = positive("requestTimeout", requestTimeout, Duration.ofSeconds(10));
        storeFile = storeFile == null || storeFile.isBlank() ? "data/snapshots.jsonl" : storeFile.trim();
        targets = targets == null || targets.isEmpty() ? DEFAULT_TARGETS : List.copyOf(targets);
    }

    public static AirWatchConfig defaults() {
        return new AirWatchConfig(null, null, null, null, null, null, null, null, null, null);
    }

    public Path storePath() {
        return Path.of(storeFile);
    }

    private static Duration positive(String name, Duration value, Duration fallback) {
        if (value == null) {
            return fallback;
        }
        if (value.isNegative() || value.isZero()) {
            throw new IllegalArgumentException(name + " must be positive");
        }
        return value;
    }

    private static Integer atLeastOne(String name, Integer value, int fallback) {
        if (value == null) {
            return fallback;
        }
        if (value < 1) {
            throw new IllegalArgumentException(name + " must be at least 1");
        }
        return value;
    }

    private static String stripTrailingSlash(String url) {
        return url.endsWith("/") ? url.substring(0, url.length() - 1) : url;
    }
}
