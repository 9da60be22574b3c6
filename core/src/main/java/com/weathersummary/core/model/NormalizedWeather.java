package com.weathersummary.core.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;
import java.util.Objects;

/**
 * Provider-independent weather summary returned to API callers.
 */
public record NormalizedWeather(
        @JsonProperty("current_condition") String currentCondition,
        @JsonProperty("temperature_description") String temperatureDescription,
        @JsonProperty("active_alerts") List<WeatherAlert> activeAlerts
) {
    public NormalizedWeather {
        Objects.requireNonNull(currentCondition, "currentCondition is required");
        Objects.requireNonNull(temperatureDescription, "temperatureDescription is required");
        activeAlerts = activeAlerts == null ? List.of() : List.copyOf(activeAlerts);
    }
}
