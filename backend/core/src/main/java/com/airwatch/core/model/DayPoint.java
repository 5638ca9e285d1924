package com.airwatch.core.model;

import java.time.LocalDate;
import java.util.Objects;

public record DayPoint(LocalDate date, Double avg, Double min, Double max) {
    public DayPoint {
        Objects.requireNonNull(date, "date is required");
    }

    public PollutantRange toRange() {
        return new PollutantRange(avg, min, max);
    }
}
