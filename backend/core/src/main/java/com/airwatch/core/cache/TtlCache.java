package com.airwatch.core.cache;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

public final class TtlCache {
    private final Clock clock;
    private final Map<Key, CacheEntry<?>> entries = new ConcurrentHashMap<>();

    public TtlCache(Clock clock) {
        this.clock = Objects.requireNonNull(clock, "clock is required");
    }

    public <T> Optional<T> get(CacheNamespace<T> namespace, String key, Duration ttl) {
        Objects.requireNonNull(ttl, "ttl is required");
        Key cacheKey = Key.of(namespace, key);
        CacheEntry<?> entry = entries.get(cacheKey);
        if (entry == null) {
            return Optional.empty();
        }
        Instant now = clock.instant();
        if (entry.isFresh(now, ttl)) {
            return Optional.of(namespace.type().cast(entry.payload()));
        }
        // conditional remove keeps a concurrent newer set intact
        entries.remove(cacheKey, entry);
        return Optional.empty();
    }

    public <T> void set(CacheNamespace<T> namespace, String key, T value) {
        Objects.requireNonNull(value, "value is required");
        entries.put(Key.of(namespace, key), new CacheEntry<>(namespace.type().cast(value), clock.instant()));
    }

    public <T> Optional<CacheEntry<T>> peek(CacheNamespace<T> namespace, String key) {
        CacheEntry<?> entry = entries.get(Key.of(namespace, key));
        if (entry == null) {
            return Optional.empty();
        }
        return Optional.of(new CacheEntry<>(namespace.type().cast(entry.payload()), entry.storedAt()));
    }

    public int size() {
        return entries.size();
    }

    private record Key(String namespace, String key) {
        static Key of(CacheNamespace<?> namespace, String key) {
            Objects.requireNonNull(namespace, "namespace is required");
            Objects.requireNonNull(key, "key is required");
            return new Key(namespace.name(), key.trim().toLowerCase(Locale.ROOT));
        }
    }
}
