package com.airwatch.pipeline.error;

public class WriteFailureException extends AirQualityException {
    public WriteFailureException(String target, String message) {
        super(target, message);
    }

    public WriteFailureException(String target, String message, Throwable cause) {
        super(target, message, cause);
    }
}
