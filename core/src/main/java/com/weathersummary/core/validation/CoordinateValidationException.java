package com.weathersummary.core.validation;

public class CoordinateValidationException extends IllegalArgumentException {
    public enum Reason {
        MISSING_COORDINATES("Latitude and Longitude are required"),
        NOT_A_NUMBER("Coordinates must be numbers"),
        LATITUDE_OUT_OF_RANGE("Latitude must be between -90 and 90"),
        LONGITUDE_OUT_OF_RANGE("Longitude must be between -180 and 180");

        private final String message;

        Reason(String message) {
            this.message = message;
        }

        public String message() {
            return message;
        }
    }

    private final Reason reason;

    public CoordinateValidationException(Reason reason) {
        super(reason.message());
        this.reason = reason;
    }

    public Reason reason() {
        return reason;
    }
}
