package com.weathersummary.providers.openweather;

import com.fasterxml.jackson.databind.JsonNode;
import com.weathersummary.core.model.Coordinate;
import com.weathersummary.core.model.NormalizedWeather;
import com.weathersummary.core.util.JsonUtils;
import com.weathersummary.providers.api.ProviderContext;
import com.weathersummary.providers.api.WeatherProvider;
import com.weathersummary.providers.api.WeatherProviderException;
import com.weathersummary.providers.config.OpenWeatherConfig;

import java.io.IOException;
import java.math.BigDecimal;
import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.util.logging.Level;

/**
 * Current conditions from the OpenWeather One Call 3.0 API, in imperial units.
 * One request per call; nothing is retried.
 */
public final class OpenWeatherProvider implements WeatherProvider {
    public static final String CONFIG_KEY = "openweather";
    static final String EXCLUDED_SECTIONS = "minutely,hourly,daily";
    static final String UNITS = "imperial";

    private final ProviderContext ctx;
    private final OpenWeatherConfig config;
    private final OpenWeatherMapper mapper;

    public OpenWeatherProvider(ProviderContext ctx) {
        this(ctx, new OpenWeatherMapper());
    }

    public OpenWeatherProvider(ProviderContext ctx, OpenWeatherMapper mapper) {
        this.ctx = ctx;
        this.config = ctx.requiredConfig(CONFIG_KEY, OpenWeatherConfig.class);
        this.mapper = mapper;
        ctx.logger().info("OpenWeather provider initialized with base URL " + config.baseUrl());
    }

    @Override
    public String name() {
        return "openweather";
    }

    @Override
    public NormalizedWeather fetch(Coordinate coordinate) {
        HttpRequest.Builder builder = HttpRequest.newBuilder(requestUri(coordinate))
                .GET()
                .header("Accept", "application/json");
        if (ctx.requestTimeout() != null) {
            builder.timeout(ctx.requestTimeout());
        }
        try {
            HttpResponse<String> response = ctx.httpClient().send(builder.build(), HttpResponse.BodyHandlers.ofString());
            if (response.statusCode() / 100 != 2) {
                throw failure(coordinate, "OpenWeather request failed with status " + response.statusCode(), null);
            }
            JsonNode root = JsonUtils.readTree(response.body());
            return mapper.normalize(root);
        } catch (IOException e) {
            throw failure(coordinate, "OpenWeather request failed", e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw failure(coordinate, "OpenWeather request interrupted", e);
        } catch (IllegalArgumentException e) {
            throw failure(coordinate, "OpenWeather response was not valid JSON", e);
        }
    }

    URI requestUri(Coordinate coordinate) {
        String base = config.baseUrl().toString();
        String query = "lat=" + plain(coordinate.latitude())
                + "&lon=" + plain(coordinate.longitude())
                + "&exclude=" + URLEncoder.encode(EXCLUDED_SECTIONS, StandardCharsets.UTF_8)
                + "&units=" + UNITS
                + "&appid=" + URLEncoder.encode(config.apiKey(), StandardCharsets.UTF_8);
        return URI.create(base + (base.contains("?") ? "&" : "?") + query);
    }

    private WeatherProviderException failure(Coordinate coordinate, String message, Throwable cause) {
        ctx.logger().log(Level.WARNING, message + " for " + coordinate, cause);
        return new WeatherProviderException(name(), coordinate, message, cause);
    }

    private static String plain(double value) {
        return BigDecimal.valueOf(value).stripTrailingZeros().toPlainString();
    }
}
