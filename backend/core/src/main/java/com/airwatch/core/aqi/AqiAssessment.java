package com.airwatch.core.aqi;

import java.util.Objects;

public record AqiAssessment(int index, AqiCategory category) {
    public AqiAssessment {
        Objects.requireNonNull(category, "category is required");
    }

    public String label() {
        return category.label();
    }

    public String color() {
        return category.color();
    }

    public String advisory() {
        return category.advisory();
    }
}
