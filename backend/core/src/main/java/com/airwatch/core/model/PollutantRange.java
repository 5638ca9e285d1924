package com.airwatch.core.model;

public record PollutantRange(Double avg, Double min, Double max) {
}
