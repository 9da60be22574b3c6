package com.weathersummary.service.config;

import com.weathersummary.providers.config.OpenWeatherConfig;

import java.nio.file.Path;
import java.time.Duration;
import java.util.Objects;

/**
 * Startup settings resolved once from the environment by {@link ConfigLoader}.
 *
 * @param gateSecret      inbound API key; {@code null} only in dev mode
 * @param providerTimeout outbound timeout, {@code null} for the transport default
 * @param trustStore      custom outbound trust material, {@code null} for the JDK default
 */
public record ServiceConfig(
        int port,
        OpenWeatherConfig openWeather,
        boolean devMode,
        String gateSecret,
        Duration providerTimeout,
        int workerThreads,
        TrustStore trustStore
) {
    public ServiceConfig {
        Objects.requireNonNull(openWeather, "openWeather is required");
        if (workerThreads < 1) {
            throw new IllegalArgumentException("workerThreads must be positive");
        }
    }

    public record TrustStore(Path path, String password) {
        public TrustStore {
            Objects.requireNonNull(path, "path is required");
            Objects.requireNonNull(password, "password is required");
        }

        @Override
        public String toString() {
            return "TrustStore[path=" + path + "]";
        }
    }

    @Override
    public String toString() {
        return "ServiceConfig[port=" + port
                + ", openWeather=" + openWeather
                + ", devMode=" + devMode
                + ", gateSecret=" + (gateSecret == null ? "unset" : "***")
                + ", providerTimeout=" + providerTimeout
                + ", workerThreads=" + workerThreads
                + ", trustStore=" + trustStore + "]";
    }
}
