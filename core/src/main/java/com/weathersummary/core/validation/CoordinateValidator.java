package com.weathersummary.core.validation;

import com.weathersummary.core.model.Coordinate;

import java.util.regex.Pattern;

/**
 * Turns raw {@code lat}/{@code lon} query values into a {@link Coordinate}.
 *
 * <p>Checks run in a fixed order: presence, number format (both values), latitude range,
 * then longitude range. The first failing check decides the reported reason.
 */
public final class CoordinateValidator {
    // Plain decimal notation only; Double.parseDouble alone would also accept NaN, Infinity, hex and "1d".
    private static final Pattern DECIMAL = Pattern.compile("[+-]?(\\d+(\\.\\d*)?|\\.\\d+)([eE][+-]?\\d+)?");

    private CoordinateValidator() {
    }

    public static Coordinate validate(String latRaw, String lonRaw) {
        if (isBlank(latRaw) || isBlank(lonRaw)) {
            throw new CoordinateValidationException(CoordinateValidationException.Reason.MISSING_COORDINATES);
        }
        Double latitude = parse(latRaw);
        Double longitude = parse(lonRaw);
        if (latitude == null || longitude == null) {
            throw new CoordinateValidationException(CoordinateValidationException.Reason.NOT_A_NUMBER);
        }
        if (!inRange(latitude, Coordinate.MAX_LATITUDE)) {
            throw new CoordinateValidationException(CoordinateValidationException.Reason.LATITUDE_OUT_OF_RANGE);
        }
        if (!inRange(longitude, Coordinate.MAX_LONGITUDE)) {
            throw new CoordinateValidationException(CoordinateValidationException.Reason.LONGITUDE_OUT_OF_RANGE);
        }
        return new Coordinate(latitude, longitude);
    }

    private static Double parse(String raw) {
        String trimmed = raw.trim();
        if (!DECIMAL.matcher(trimmed).matches()) {
            return null;
        }
        return Double.parseDouble(trimmed);
    }

    private static boolean inRange(double value, double bound) {
        return Double.isFinite(value) && value >= -bound && value <= bound;
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
