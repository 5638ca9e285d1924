package com.airwatch.core.model;

import com.airwatch.core.aqi.AqiAssessment;
import com.airwatch.core.aqi.AqiCategory;
import com.airwatch.core.aqi.AqiClassifier;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

public record LiveView(
        String target,
        String displayName,
        int aqi,
        AqiCategory category,
        String color,
        String healthMessage,
        String dominantPollutant,
        Instant timestamp,
        List<Measurement> measurements
) {
    public LiveView {
        measurements = measurements == null ? List.of() : List.copyOf(measurements);
    }

    public static LiveView from(MetricSnapshot snapshot, String displayName) {
        AqiAssessment assessment = AqiClassifier.classify(snapshot.aqi());
        List<Measurement> measurements = new ArrayList<>();
        snapshot.concentrations().forEach((pollutant, value) ->
                measurements.add(new Measurement(pollutant, value, pollutant.unit())));
        return new LiveView(
                snapshot.target(),
                displayName,
                assessment.index(),
                assessment.category(),
                assessment.color(),
                assessment.advisory(),
                snapshot.dominantPollutant(),
                snapshot.timestamp(),
                measurements
        );
    }
}
