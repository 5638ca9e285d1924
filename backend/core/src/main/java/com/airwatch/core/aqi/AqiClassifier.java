package com.airwatch.core.aqi;

import java.util.List;

public final class AqiClassifier {
    private static final List<Breakpoint> BREAKPOINTS = List.of(
            new Breakpoint(0.0, 12.0, 0, 50),
            new Breakpoint(12.1, 35.4, 51, 100),
            new Breakpoint(35.5, 55.4, 101, 150),
            new Breakpoint(55.5, 150.4, 151, 200),
            new Breakpoint(150.5, 250.4, 201, 300),
            new Breakpoint(250.5, 500.4, 301, 500)
    );

    private AqiClassifier() {
    }

    public static List<Breakpoint> breakpoints() {
        return BREAKPOINTS;
    }

    public static AqiAssessment classify(int index) {
        int normalized = Math.max(0, index);
        return new AqiAssessment(normalized, AqiCategory.forIndex(normalized));
    }

    public static int concentrationToIndex(double concentration) {
        if (Double.isNaN(concentration) || concentration <= 0.0) {
            return 0;
        }
        Breakpoint segment = BREAKPOINTS.get(BREAKPOINTS.size() - 1);
        for (Breakpoint breakpoint : BREAKPOINTS) {
            if (concentration <= breakpoint.concentrationHigh()) {
                segment = breakpoint;
                break;
            }
        }
        long rounded = roundHalfAwayFromZero(segment.interpolate(concentration));
        return (int) Math.min(Integer.MAX_VALUE, Math.max(0, rounded));
    }

    public static long roundHalfAwayFromZero(double value) {
        if (value < 0) {
            return -Math.round(Math.floor(-value + 0.5));
        }
        return Math.round(Math.floor(value + 0.5));
    }
}
