package com.weathersummary.providers.openweather;

import com.fasterxml.jackson.databind.JsonNode;
import com.weathersummary.core.model.NormalizedWeather;
import com.weathersummary.core.model.WeatherAlert;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Maps One Call payloads to {@link NormalizedWeather}. Never throws: unreadable fields map to
 * {@link #UNKNOWN}.
 *
 * @see <a href="https://openweathermap.org/weather-conditions">OpenWeather condition codes</a>
 */
public final class OpenWeatherMapper {
    public static final String UNKNOWN = "Unknown";

    private static final Map<Integer, String> CONDITIONS = Map.ofEntries(
            Map.entry(200, "Thunderstorm with Light Rain"),
            Map.entry(201, "Thunderstorm with Rain"),
            Map.entry(202, "Thunderstorm with Heavy Rain"),
            Map.entry(210, "Light Thunderstorm"),
            Map.entry(211, "Thunderstorm"),
            Map.entry(212, "Heavy Thunderstorm"),
            Map.entry(221, "Ragged Thunderstorm"),
            Map.entry(230, "Thunderstorm with Light Drizzle"),
            Map.entry(231, "Thunderstorm with Drizzle"),
            Map.entry(232, "Thunderstorm with Heavy Drizzle"),
            Map.entry(300, "Light Intensity Drizzle"),
            Map.entry(301, "Drizzle"),
            Map.entry(302, "Heavy Intensity Drizzle"),
            Map.entry(310, "Light Intensity Drizzle Rain"),
            Map.entry(311, "Drizzle Rain"),
            Map.entry(312, "Heavy Intensity Drizzle Rain"),
            Map.entry(313, "Shower Rain and Drizzle"),
            Map.entry(314, "Heavy Shower Rain and Drizzle"),
            Map.entry(321, "Shower Drizzle"),
            Map.entry(500, "Light Rain"),
            Map.entry(501, "Moderate Rain"),
            Map.entry(502, "Heavy Intensity Rain"),
            Map.entry(503, "Very Heavy Rain"),
            Map.entry(504, "Extreme Rain"),
            Map.entry(511, "Freezing Rain"),
            Map.entry(520, "Light Intensity Shower Rain"),
            Map.entry(521, "Shower Rain"),
            Map.entry(522, "Heavy Intensity Shower Rain"),
            Map.entry(531, "Ragged Shower Rain"),
            Map.entry(600, "Light Snow"),
            Map.entry(601, "Snow"),
            Map.entry(602, "Heavy Snow"),
            Map.entry(611, "Sleet"),
            Map.entry(612, "Light Shower Sleet"),
            Map.entry(613, "Shower Sleet"),
            Map.entry(615, "Light Rain and Snow"),
            Map.entry(616, "Rain and Snow"),
            Map.entry(620, "Light Shower Snow"),
            Map.entry(621, "Shower Snow"),
            Map.entry(622, "Heavy Shower Snow"),
            Map.entry(701, "Mist"),
            Map.entry(711, "Smoke"),
            Map.entry(721, "Haze"),
            Map.entry(731, "Sand, Dust Whirls"),
            Map.entry(741, "Fog"),
            Map.entry(751, "Sand"),
            Map.entry(761, "Dust"),
            Map.entry(762, "Volcanic Ash"),
            Map.entry(771, "Squalls"),
            Map.entry(781, "Tornado"),
            Map.entry(800, "Clear Sky"),
            Map.entry(801, "Few Clouds"),
            Map.entry(802, "Scattered Clouds"),
            Map.entry(803, "Broken Clouds"),
            Map.entry(804, "Overcast Clouds")
    );

    public NormalizedWeather normalize(JsonNode raw) {
        return normalize(OpenWeatherPayload.from(raw));
    }

    public NormalizedWeather normalize(OpenWeatherPayload payload) {
        return new NormalizedWeather(
                condition(payload.conditionCode()),
                temperatureDescription(payload.feelsLikeF()),
                alerts(payload.alertEvents())
        );
    }

    public String condition(Integer code) {
        if (code == null) {
            return UNKNOWN;
        }
        return CONDITIONS.getOrDefault(code, UNKNOWN);
    }

    public String temperatureDescription(Double feelsLikeF) {
        if (feelsLikeF == null || !Double.isFinite(feelsLikeF)) {
            return UNKNOWN;
        }
        return TemperatureBand.fromFahrenheit(feelsLikeF).label();
    }

    private List<WeatherAlert> alerts(List<String> events) {
        List<WeatherAlert> alerts = new ArrayList<>(events.size());
        for (String event : events) {
            alerts.add(new WeatherAlert(event == null || event.isBlank() ? UNKNOWN : event));
        }
        return alerts;
    }
}
