package com.airwatch.pipeline.api;

import java.util.Objects;

public record Target(String id, String displayName, String stationId) {
    public Target {
        Objects.requireNonNull(id, "id is required");
        if (id.isBlank()) {
            throw new IllegalArgumentException("id must not be blank");
        }
        id = id.trim();
        displayName = displayName == null || displayName.isBlank() ? id : displayName.trim();
    }
}
