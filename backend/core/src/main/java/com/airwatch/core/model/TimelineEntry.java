package com.airwatch.core.model;

import com.airwatch.core.aqi.AqiCategory;

import java.time.LocalDate;

public record TimelineEntry(
        LocalDate date,
        String dayName,
        String shortDay,
        int aqi,
        AqiCategory category,
        String color
) {
}
