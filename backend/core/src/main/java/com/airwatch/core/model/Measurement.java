package com.airwatch.core.model;

public record Measurement(Pollutant pollutant, double value, String unit) {
}
