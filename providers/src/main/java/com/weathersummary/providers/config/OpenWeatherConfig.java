package com.weathersummary.providers.config;

import java.net.URI;
import java.util.Objects;

public record OpenWeatherConfig(URI baseUrl, String apiKey) {
    public static final URI DEFAULT_BASE_URL = URI.create("https://api.openweathermap.org/data/3.0/onecall");

    public OpenWeatherConfig {
        Objects.requireNonNull(baseUrl, "baseUrl is required");
        if (apiKey == null || apiKey.isBlank()) {
            throw new IllegalArgumentException("apiKey is required");
        }
        apiKey = apiKey.trim();
    }

    @Override
    public String toString() {
        return "OpenWeatherConfig[baseUrl=" + baseUrl + ", apiKey=***]";
    }
}
