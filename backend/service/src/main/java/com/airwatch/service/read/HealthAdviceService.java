package com.airwatch.service.read;

import com.airwatch.core.aqi.AqiCategory;
import com.airwatch.core.model.LiveView;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.logging.Logger;

public final class HealthAdviceService {
    private static final Logger LOGGER = Logger.getLogger(HealthAdviceService.class.getName());

    private final AirQualityReadService readService;

    public HealthAdviceService(AirQualityReadService readService) {
        this.readService = Objects.requireNonNull(readService, "readService is required");
    }

    public HealthAdvice groupsFor(String target) {
        LiveView live = readService.getLiveView(target);
        List<GroupAdvice> groups = new ArrayList<>();
        for (SensitiveGroup group : SensitiveGroup.values()) {
            groups.add(adviceFor(group, live.aqi()));
        }
        LOGGER.fine(() -> "Built health advice for " + live.target() + " at index " + live.aqi());
        return new HealthAdvice(live.target(), live.aqi(), live.category(), groups, live.timestamp());
    }

    public static GroupAdvice adviceFor(SensitiveGroup group, int aqi) {
        AqiCategory category = AqiCategory.forIndex(aqi);
        return new GroupAdvice(group, group.recommendationFor(category), riskLevel(group, aqi));
    }

    public static String riskLevel(SensitiveGroup group, int aqi) {
        return switch (AqiCategory.forIndex(aqi)) {
            case GOOD -> "low";
            case MODERATE -> aqi <= group.threshold() ? "low" : "moderate";
            case UNHEALTHY_FOR_SENSITIVE_GROUPS -> "moderate";
            case UNHEALTHY -> "high";
            case VERY_UNHEALTHY, HAZARDOUS -> "very-high";
        };
    }

    public record GroupAdvice(SensitiveGroup group, String recommendation, String riskLevel) {
    }

    public record HealthAdvice(
            String target,
            int aqi,
            AqiCategory category,
            List<GroupAdvice> groups,
            Instant observedAt
    ) {
        public HealthAdvice {
            groups = List.copyOf(groups);
        }
    }
}
