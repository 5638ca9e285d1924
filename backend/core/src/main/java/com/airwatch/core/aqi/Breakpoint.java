package com.airwatch.core.aqi;

public record Breakpoint(double concentrationLow, double concentrationHigh, int indexLow, int indexHigh) {
    public Breakpoint {
        if (concentrationHigh <= concentrationLow) {
            throw new IllegalArgumentException("concentrationHigh must be greater than concentrationLow");
        }
        if (indexHigh < indexLow) {
            throw new IllegalArgumentException("indexHigh must not be lower than indexLow");
        }
    }

    public double slope() {
        return (indexHigh - indexLow) / (concentrationHigh - concentrationLow);
    }

    public double interpolate(double concentration) {
        return slope() * (concentration - concentrationLow) + indexLow;
    }
}
