package com.airwatch.pipeline.error;

public class MalformedPayloadException extends AirQualityException {
    public MalformedPayloadException(String target, String message) {
        super(target, message);
    }

    public MalformedPayloadException(String target, String message, Throwable cause) {
        super(target, message, cause);
    }
}
