package com.airwatch.pipeline.error;

public class AirQualityException extends RuntimeException {
    private final String target;

    public AirQualityException(String target, String message) {
        super("[" + target + "] " + message);
        this.target = target;
    }

    public AirQualityException(String target, String message, Throwable cause) {
        super("[" + target + "] " + message, cause);
        this.target = target;
    }

    public String target() {
        return target;
    }
}
