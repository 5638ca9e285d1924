package com.airwatch.core.aqi;

public enum AqiCategory {
    GOOD(50, "Good", "#00E400",
            "Air quality is considered satisfactory, and air pollution poses little or no risk."),
    MODERATE(100, "Moderate", "#FFFF00",
            "Air quality is acceptable for most people. However, for some pollutants there may be a moderate health concern for a very small number of people who are unusually sensitive to air pollution."),
    UNHEALTHY_FOR_SENSITIVE_GROUPS(150, "Unhealthy for Sensitive Groups", "#FF7E00",
            "Members of sensitive groups may experience health effects. The general public is not likely to be affected."),
    UNHEALTHY(200, "Unhealthy", "#FF0000",
            "Everyone may begin to experience health effects; members of sensitive groups may experience more serious health effects."),
    VERY_UNHEALTHY(300, "Very Unhealthy", "#8F3F97",
            "Health warnings of emergency conditions. The entire population is more likely to be affected."),
    HAZARDOUS(Integer.MAX_VALUE, "Hazardous", "#7E0023",
            "Health alert: everyone may experience more serious health effects.");

    private final int upperBound;
    private final String label;
    private final String color;
    private final String advisory;

    AqiCategory(int upperBound, String label, String color, String advisory) {
        this.upperBound = upperBound;
        this.label = label;
        this.color = color;
        this.advisory = advisory;
    }

    public String label() {
        return label;
    }

    public String color() {
        return color;
    }

    public String advisory() {
        return advisory;
    }

    public int rank() {
        return ordinal();
    }

    public static AqiCategory forIndex(int index) {
        for (AqiCategory category : values()) {
            if (index <= category.upperBound) {
                return category;
            }
        }
        return HAZARDOUS;
    }
}
