package com.airwatch.service.read;

import com.airwatch.core.aqi.AqiCategory;

import java.util.EnumMap;
import java.util.Map;

public enum SensitiveGroup {
    ATHLETES("Athletes", 100, Map.of(
            AqiCategory.GOOD, "Ideal conditions for all sports. Enjoy training outdoors.",
            AqiCategory.MODERATE, "Fine for most activities. Take short breaks if you feel discomfort.",
            AqiCategory.UNHEALTHY_FOR_SENSITIVE_GROUPS, "Limit intense workouts. Prefer indoor venues.",
            AqiCategory.UNHEALTHY, "Avoid outdoor training. Use gyms and indoor facilities.",
            AqiCategory.VERY_UNHEALTHY, "All activities indoors only, with air filtration.",
            AqiCategory.HAZARDOUS, "Cancel all outdoor activities. Stay indoors."
    )),
    CHILDREN("Children", 75, Map.of(
            AqiCategory.GOOD, "Children can play outside freely. Encourage outdoor activities.",
            AqiCategory.MODERATE, "Most children can play outside; watch those with respiratory problems.",
            AqiCategory.UNHEALTHY_FOR_SENSITIVE_GROUPS, "Limit outdoor time for all children. Short walks are fine.",
            AqiCategory.UNHEALTHY, "Children should stay indoors. Avoid outdoor activities.",
            AqiCategory.VERY_UNHEALTHY, "Keep all children inside. Close windows and use air purifiers.",
            AqiCategory.HAZARDOUS, "Emergency: all children stay indoors. Wear masks if going out is unavoidable."
    )),
    ELDERLY("Elderly", 75, Map.of(
            AqiCategory.GOOD, "Safe for all outdoor activities. Good time for walks and gardening.",
            AqiCategory.MODERATE, "Limit strenuous outdoor activity. Short walks are fine.",
            AqiCategory.UNHEALTHY_FOR_SENSITIVE_GROUPS, "Stay inside if you have heart or lung disease.",
            AqiCategory.UNHEALTHY, "Stay indoors and avoid all outdoor activities.",
            AqiCategory.VERY_UNHEALTHY, "Stay inside with windows closed. Contact a doctor if symptoms appear.",
            AqiCategory.HAZARDOUS, "Emergency: stay indoors. Call a doctor if you feel symptoms."
    )),
    ASTHMATICS("Asthmatics", 50, Map.of(
            AqiCategory.GOOD, "Safe for all activities. Keep taking medication as usual.",
            AqiCategory.MODERATE, "Be careful with physical activity. Keep an inhaler at hand.",
            AqiCategory.UNHEALTHY_FOR_SENSITIVE_GROUPS, "Limit outdoor activities. Adjust medication if advised.",
            AqiCategory.UNHEALTHY, "Stay indoors. Use your inhaler as prescribed and contact your doctor.",
            AqiCategory.VERY_UNHEALTHY, "Stay inside. Have rescue medication ready and call your doctor.",
            AqiCategory.HAZARDOUS, "Stay inside. Keep emergency medication close and call emergency services if needed."
    ));

    private final String displayName;
    private final int threshold;
    private final Map<AqiCategory, String> recommendations;

    SensitiveGroup(String displayName, int threshold, Map<AqiCategory, String> recommendations) {
        this.displayName = displayName;
        this.threshold = threshold;
        this.recommendations = new EnumMap<>(recommendations);
    }

    public String displayName() {
        return displayName;
    }

    public int threshold() {
        return threshold;
    }

    public String recommendationFor(AqiCategory category) {
        return recommendations.get(category);
    }
}
