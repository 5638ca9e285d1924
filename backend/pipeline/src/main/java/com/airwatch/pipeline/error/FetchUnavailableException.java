package com.airwatch.pipeline.error;

public class FetchUnavailableException extends AirQualityException {
    public FetchUnavailableException(String target, String message) {
        super(target, message);
    }

    public FetchUnavailableException(String target, String message, Throwable cause) {
        super(target, message, cause);
    }
}
