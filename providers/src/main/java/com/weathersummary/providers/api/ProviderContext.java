package com.weathersummary.providers.api;

import java.net.http.HttpClient;
import java.time.Duration;
import java.util.Map;
import java.util.Objects;
import java.util.logging.Logger;

/**
 * Collaborators handed to a provider at construction time.
 *
 * @param requestTimeout per-request timeout, or {@code null} to keep the transport default
 */
public record ProviderContext(
        HttpClient httpClient,
        Logger logger,
        Duration requestTimeout,
        Map<String, Object> config
) {
    public ProviderContext {
        Objects.requireNonNull(httpClient, "httpClient is required");
        Objects.requireNonNull(logger, "logger is required");
        Objects.requireNonNull(config, "config is required");
        config = Map.copyOf(config);
    }

    public <T> T requiredConfig(String key, Class<T> type) {
        Object value = config.get(key);
        if (value == null) {
            throw new IllegalArgumentException("Missing required config key: " + key);
        }
        if (!type.isInstance(value)) {
            throw new IllegalArgumentException("Config key '" + key + "' must be " + type.getSimpleName());
        }
        return type.cast(value);
    }
}
