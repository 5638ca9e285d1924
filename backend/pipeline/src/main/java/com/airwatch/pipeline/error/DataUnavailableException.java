package com.airwatch.pipeline.error;

public class DataUnavailableException extends AirQualityException {
    private final String dataType;

    public DataUnavailableException(String target, String dataType) {
        super(target, dataType + " data unavailable");
        this.dataType = dataType;
    }

    public DataUnavailableException(String target, String dataType, Throwable cause) {
        super(target, dataType + " data unavailable", cause);
        this.dataType = dataType;
    }

    public String dataType() {
        return dataType;
    }
}
