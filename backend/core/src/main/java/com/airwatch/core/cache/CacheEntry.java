package com.airwatch.core.cache;

import java.time.Duration;
import java.time.Instant;
import java.util.Objects;

public record CacheEntry<T>(T payload, Instant storedAt) {
    public CacheEntry {
        Objects.requireNonNull(payload, "payload is required");
        Objects.requireNonNull(storedAt, "storedAt is required");
    }

    public boolean isFresh(Instant now, Duration ttl) {
        return Duration.between(storedAt, now).compareTo(ttl) <= 0;
    }
}
