package com.weathersummary.providers.api;

import com.weathersummary.core.model.Coordinate;
import com.weathersummary.core.model.NormalizedWeather;

/**
 * A source of current weather for a validated coordinate.
 *
 * <p>Implementations own their wire format and condition-code tables; callers only see
 * {@link NormalizedWeather}. Failures to reach the source or to read its answer are
 * reported as {@link WeatherProviderException}.
 */
public interface WeatherProvider {
    String name();

    NormalizedWeather fetch(Coordinate coordinate);
}
