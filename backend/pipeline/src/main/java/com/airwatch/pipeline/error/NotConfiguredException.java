package com.airwatch.pipeline.error;

public class NotConfiguredException extends AirQualityException {
    public NotConfiguredException(String target, String message) {
        super(target, message);
    }
}
