package com.weathersummary.providers.api;

import com.weathersummary.core.model.Coordinate;

public class WeatherProviderException extends RuntimeException {
    private final String provider;
    private final Coordinate coordinate;

    public WeatherProviderException(String provider, Coordinate coordinate, String message) {
        this(provider, coordinate, message, null);
    }

    public WeatherProviderException(String provider, Coordinate coordinate, String message, Throwable cause) {
        super(message, cause);
        this.provider = provider;
        this.coordinate = coordinate;
    }

    public String provider() {
        return provider;
    }

    public Coordinate coordinate() {
        return coordinate;
    }
}
