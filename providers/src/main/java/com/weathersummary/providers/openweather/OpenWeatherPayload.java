package com.weathersummary.providers.openweather;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;

/**
 * The parts of a One Call response this service reads. Anything missing or of the wrong
 * shape is left {@code null} (or empty for alerts) instead of failing.
 *
 * @param conditionCode {@code current.weather[0].id}
 * @param feelsLikeF    {@code current.feels_like}, requested in imperial units
 * @param alertEvents   {@code alerts[].event}; an alert without event text contributes {@code ""}
 */
public record OpenWeatherPayload(Integer conditionCode, Double feelsLikeF, List<String> alertEvents) {
    private static final Pattern INTEGER = Pattern.compile("[+-]?\\d{1,9}");
    private static final Pattern DECIMAL = Pattern.compile("[+-]?(\\d+(\\.\\d*)?|\\.\\d+)([eE][+-]?\\d+)?");

    public OpenWeatherPayload {
        alertEvents = alertEvents == null ? List.of() : List.copyOf(alertEvents);
    }

    public static OpenWeatherPayload from(JsonNode root) {
        if (root == null) {
            return new OpenWeatherPayload(null, null, List.of());
        }
        JsonNode current = root.path("current");
        return new OpenWeatherPayload(
                conditionCode(current.path("weather").path(0).path("id")),
                feelsLike(current.path("feels_like")),
                alertEvents(root.path("alerts"))
        );
    }

    private static Integer conditionCode(JsonNode node) {
        if (node.isIntegralNumber() && node.canConvertToInt()) {
            return node.intValue();
        }
        if (node.isFloatingPointNumber() && Double.isFinite(node.doubleValue()) && node.canConvertToInt()) {
            return (int) node.doubleValue();
        }
        if (node.isTextual() && INTEGER.matcher(node.textValue().trim()).matches()) {
            return Integer.parseInt(node.textValue().trim());
        }
        return null;
    }

    private static Double feelsLike(JsonNode node) {
        if (node.isNumber()) {
            double value = node.doubleValue();
            return Double.isFinite(value) ? value : null;
        }
        if (node.isTextual() && DECIMAL.matcher(node.textValue().trim()).matches()) {
            double value = Double.parseDouble(node.textValue().trim());
            return Double.isFinite(value) ? value : null;
        }
        return null;
    }

    private static List<String> alertEvents(JsonNode alerts) {
        if (!alerts.isArray()) {
            return List.of();
        }
        List<String> events = new ArrayList<>(alerts.size());
        for (JsonNode alert : alerts) {
            JsonNode event = alert.path("event");
            events.add(event.isValueNode() && !event.isNull() ? event.asText("") : "");
        }
        return events;
    }
}
