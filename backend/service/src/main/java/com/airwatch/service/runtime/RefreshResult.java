package com.airwatch.service.runtime;

import java.util.Map;

public record RefreshResult(String target, boolean success, String message, Map<String, Object> stats) {
    public RefreshResult {
        stats = stats == null ? Map.of() : Map.copyOf(stats);
    }

    public static RefreshResult success(String target, String message, Map<String, Object> stats) {
        return new RefreshResult(target, true, message, stats);
    }

    public static RefreshResult failure(String target, String message, Map<String, Object> stats) {
        return new RefreshResult(target, false, message, stats);
    }

    public static RefreshResult skipped(String target) {
        return failure(target, "Refresh skipped: scheduler is stopping", Map.of("skipped", true));
    }
}
