package com.weathersummary.service.config;

public class ConfigurationException extends IllegalStateException {
    public ConfigurationException(String message) {
        super(message);
    }

    public ConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }
}
