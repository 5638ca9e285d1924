package com.airwatch.pipeline.api;

@FunctionalInterface
public interface AirQualitySource {
    RawPayload fetch(String target);
}
