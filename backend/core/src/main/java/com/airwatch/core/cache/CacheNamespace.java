package com.airwatch.core.cache;

import java.util.Objects;

public record CacheNamespace<T>(String name, Class<T> type) {
    public CacheNamespace {
        Objects.requireNonNull(name, "name is required");
        Objects.requireNonNull(type, "type is required");
        if (name.isBlank()) {
            throw new IllegalArgumentException("name must not be blank");
        }
    }
}
