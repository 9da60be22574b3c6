package com.weathersummary.service.api;

public record ServiceInfo(String service, String version, String description) {
    public static final ServiceInfo DEFAULT = new ServiceInfo(
            "WeatherService API",
            "1.0.0",
            "This API provides weather information based on coordinates."
    );
}
