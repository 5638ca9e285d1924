package com.airwatch.pipeline.api;

import com.airwatch.pipeline.error.NotConfiguredException;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

public final class TargetRegistry {
    private final Map<String, Target> byKey = new LinkedHashMap<>();

    public TargetRegistry(List<Target> targets) {
        for (Target target : targets) {
            String key = key(target.id());
            if (byKey.containsKey(key)) {
                throw new IllegalArgumentException("Duplicate target id: " + target.id());
            }
            byKey.put(key, target);
        }
    }

    public Optional<Target> find(String id) {
        if (id == null || id.isBlank()) {
            return Optional.empty();
        }
        return Optional.ofNullable(byKey.get(key(id)));
    }

    public Target require(String id) {
        return find(id).orElseThrow(() -> new NotConfiguredException(
                id == null ? "<none>" : id.trim(),
                "target is not configured"
        ));
    }

    public List<Target> all() {
        return List.copyOf(byKey.values());
    }

    public int size() {
        return byKey.size();
    }

    private static String key(String id) {
        return id.trim().toLowerCase(Locale.ROOT);
    }
}
