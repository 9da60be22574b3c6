package com.weathersummary.service.config;

import com.weathersummary.providers.config.OpenWeatherConfig;

import java.net.URI;
import java.nio.file.Path;
import java.time.Duration;
import java.util.Locale;
import java.util.Map;
import java.util.function.Consumer;

public final class ConfigLoader {
    public static final String PORT = "PORT";
    public static final String OPENWEATHER_API_KEY = "OPENWEATHER_API_KEY";
    public static final String OPENWEATHER_BASE_URL = "OPENWEATHER_BASE_URL";
    public static final String GATE_SECRET = "WEATHER_SERVICE_API_KEY";
    public static final String APP_ENV = "APP_ENV";
    public static final String PROVIDER_TIMEOUT_SECONDS = "PROVIDER_TIMEOUT_SECONDS";
    public static final String HTTP_WORKER_THREADS = "HTTP_WORKER_THREADS";
    public static final String TRUSTSTORE_PATH = "TRUSTSTORE_PATH";
    public static final String TRUSTSTORE_PASSWORD = "TRUSTSTORE_PASSWORD";

    static final int DEFAULT_WORKER_THREADS = 16;

    private ConfigLoader() {
    }

    public static ServiceConfig load(Map<String, String> env, Consumer<String> warn) {
        int port = requiredInt(env, PORT, 1, 65_535);
        String apiKey = required(env, OPENWEATHER_API_KEY);
        URI baseUrl = baseUrl(env);
        boolean devMode = resolveDevMode(env, warn);

        String gateSecret = optional(env, GATE_SECRET);
        if (!devMode && gateSecret == null) {
            throw new ConfigurationException(GATE_SECRET + " must be set unless " + APP_ENV + "=dev");
        }
        if (devMode) {
            warn.accept(APP_ENV + "=dev; inbound API key check is disabled.");
        }

        String timeoutRaw = optional(env, PROVIDER_TIMEOUT_SECONDS);
        Duration providerTimeout = timeoutRaw == null
                ? null
                : Duration.ofSeconds(parseInt(PROVIDER_TIMEOUT_SECONDS, timeoutRaw, 1, 3_600));

        String workersRaw = optional(env, HTTP_WORKER_THREADS);
        int workerThreads = workersRaw == null
                ? DEFAULT_WORKER_THREADS
                : parseInt(HTTP_WORKER_THREADS, workersRaw, 1, 1_024);

        return new ServiceConfig(
                port,
                new OpenWeatherConfig(baseUrl, apiKey),
                devMode,
                gateSecret,
                providerTimeout,
                workerThreads,
                trustStore(env)
        );
    }

    static boolean resolveDevMode(Map<String, String> env, Consumer<String> warn) {
        String raw = env.getOrDefault(APP_ENV, "prod").trim().toLowerCase(Locale.ROOT);
        switch (raw) {
            case "dev":
            case "development":
                return true;
            case "prod":
            case "production":
                return false;
            default:
                warn.accept("Unknown " + APP_ENV + "=" + raw + ", defaulting to prod");
                return false;
        }
    }

    private static URI baseUrl(Map<String, String> env) {
        String raw = optional(env, OPENWEATHER_BASE_URL);
        if (raw == null) {
            return OpenWeatherConfig.DEFAULT_BASE_URL;
        }
        try {
            URI uri = URI.create(raw);
            String scheme = uri.getScheme() == null ? "" : uri.getScheme().toLowerCase(Locale.ROOT);
            if (!(scheme.equals("http") || scheme.equals("https")) || uri.getHost() == null) {
                throw new ConfigurationException(OPENWEATHER_BASE_URL + " must be an absolute http(s) URL: " + raw);
            }
            return uri;
        } catch (IllegalArgumentException e) {
            throw new ConfigurationException(OPENWEATHER_BASE_URL + " is not a valid URL: " + raw, e);
        }
    }

    private static ServiceConfig.TrustStore trustStore(Map<String, String> env) {
        String path = optional(env, TRUSTSTORE_PATH);
        if (path == null) {
            return null;
        }
        String password = env.get(TRUSTSTORE_PASSWORD);
        if (password == null) {
            throw new ConfigurationException(TRUSTSTORE_PASSWORD + " must be set when " + TRUSTSTORE_PATH + " is configured");
        }
        return new ServiceConfig.TrustStore(Path.of(path), password);
    }

    private static String required(Map<String, String> env, String name) {
        String value = optional(env, name);
        if (value == null) {
            throw new ConfigurationException(name + " must be set");
        }
        return value;
    }

    private static String optional(Map<String, String> env, String name) {
        String value = env.get(name);
        if (value == null || value.isBlank()) {
            return null;
        }
        return value.trim();
    }

    private static int requiredInt(Map<String, String> env, String name, int min, int max) {
        return parseInt(name, required(env, name), min, max);
    }

    private static int parseInt(String name, String raw, int min, int max) {
        int value;
        try {
            value = Integer.parseInt(raw);
        } catch (NumberFormatException e) {
            throw new ConfigurationException(name + " must be an integer, got '" + raw + "'", e);
        }
        if (value < min || value > max) {
            throw new ConfigurationException(name + " must be between " + min + " and " + max + ", got " + value);
        }
        return value;
    }
}
