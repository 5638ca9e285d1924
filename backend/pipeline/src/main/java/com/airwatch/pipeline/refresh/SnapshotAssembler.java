package com.airwatch.pipeline.refresh;

import com.airwatch.core.aqi.AqiClassifier;
import com.airwatch.core.model.MetricSnapshot;
import com.airwatch.core.model.Pollutant;
import com.airwatch.pipeline.api.RawPayload;
import com.airwatch.pipeline.error.MalformedPayloadException;
import com.airwatch.pipeline.forecast.ForecastAligner;

import java.time.Clock;
import java.time.Instant;
import java.util.Objects;

public final class SnapshotAssembler {
    static final String UNKNOWN_POLLUTANT = "Unknown";

    private final Clock clock;

    public SnapshotAssembler(Clock clock) {
        this.clock = Objects.requireNonNull(clock, "clock is required");
    }

    public MetricSnapshot assemble(String target, RawPayload payload) {
        if (payload == null) {
            throw new MalformedPayloadException(target, "source returned no payload");
        }
        Instant timestamp = payload.observedAt() == null ? clock.instant() : payload.observedAt();
        String dominant = displayName(payload.dominantPollutant());

        Integer aqi = payload.aqi();
        if (aqi == null || aqi < 0) {
            Pollutant derivedFrom = null;
            for (Pollutant pollutant : ForecastAligner.DEFAULT_PRIORITY) {
                Double concentration = payload.concentrations().get(pollutant);
                if (concentration != null) {
                    derivedFrom = pollutant;
                    aqi = AqiClassifier.concentrationToIndex(concentration);
                    break;
                }
            }
            if (derivedFrom == null) {
                throw new MalformedPayloadException(target, "payload has neither an index nor a usable concentration");
            }
            if (UNKNOWN_POLLUTANT.equals(dominant)) {
                dominant = derivedFrom.displayName();
            }
        }
        return new MetricSnapshot(target, timestamp, aqi, dominant, payload.concentrations());
    }

    private static String displayName(String pollutantCode) {
        return Pollutant.fromCode(pollutantCode).map(Pollutant::displayName).orElse(UNKNOWN_POLLUTANT);
    }
}
