package com.weathersummary.core.model;

import java.util.Objects;

public record WeatherAlert(String event) {
    public WeatherAlert {
        Objects.requireNonNull(event, "event is required");
    }
}
