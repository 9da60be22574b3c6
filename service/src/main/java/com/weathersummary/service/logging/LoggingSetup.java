package com.weathersummary.service.logging;

import java.io.IOException;
import java.io.InputStream;
import java.util.logging.LogManager;

/**
 * Applies the bundled {@code logging.properties} unless the JVM was given its own
 * JUL configuration through system properties.
 */
public final class LoggingSetup {
    static final String RESOURCE = "/logging.properties";

    private LoggingSetup() {
    }

    public static boolean configure() {
        if (System.getProperty("java.util.logging.config.file") != null
                || System.getProperty("java.util.logging.config.class") != null) {
            return false;
        }
        return configureFrom(RESOURCE);
    }

    static boolean configureFrom(String resource) {
        try (InputStream in = LoggingSetup.class.getResourceAsStream(resource)) {
            if (in == null) {
                return false;
            }
            LogManager.getLogManager().readConfiguration(in);
            return true;
        } catch (IOException e) {
            throw new IllegalStateException("Failed loading logging configuration " + resource, e);
        }
    }
}
