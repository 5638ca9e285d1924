package com.airwatch.core.model;

import java.util.Locale;
import java.util.Optional;

public enum Pollutant {
    PM25("pm25", "PM2.5", "µg/m³"),
    PM10("pm10", "PM10", "µg/m³"),
    O3("o3", "O3", "µg/m³"),
    NO2("no2", "NO2", "µg/m³"),
    SO2("so2", "SO2", "µg/m³"),
    CO("co", "CO", "mg/m³");

    private final String code;
    private final String displayName;
    private final String unit;

    Pollutant(String code, String displayName, String unit) {
        this.code = code;
        this.displayName = displayName;
        this.unit = unit;
    }

    public String code() {
        return code;
    }

    public String displayName() {
        return displayName;
    }

    public String unit() {
        return unit;
    }

    public static Optional<Pollutant> fromCode(String value) {
        if (value == null || value.isBlank()) {
            return Optional.empty();
        }
        String normalized = value.trim().toLowerCase(Locale.ROOT).replace(".", "");
        for (Pollutant pollutant : values()) {
            if (pollutant.code.equals(normalized)) {
                return Optional.of(pollutant);
            }
        }
        return Optional.empty();
    }
}
