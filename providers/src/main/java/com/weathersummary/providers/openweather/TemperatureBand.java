package com.weathersummary.providers.openweather;

/**
 * Feels-like temperature buckets in degrees Fahrenheit. Each band covers
 * (previous upper bound, own upper bound], so boundary values fall into the colder band.
 */
public enum TemperatureBand {
    EXTREMELY_COLD(-4, "Extremely Cold"),
    VERY_COLD(14, "Very Cold"),
    COLD(32, "Cold"),
    CHILLY(50, "Chilly"),
    COOL(59, "Cool"),
    MILD(68, "Mild"),
    WARM(77, "Warm"),
    HOT(86, "Hot"),
    VERY_HOT(95, "Very Hot"),
    EXTREMELY_HOT(Double.POSITIVE_INFINITY, "Extremely Hot");

    private final double upperBoundF;
    private final String label;

    TemperatureBand(double upperBoundF, String label) {
        this.upperBoundF = upperBoundF;
        this.label = label;
    }

    public double upperBoundF() {
        return upperBoundF;
    }

    public String label() {
        return label;
    }

    public static TemperatureBand fromFahrenheit(double temperatureF) {
        if (Double.isNaN(temperatureF)) {
            throw new IllegalArgumentException("temperature is NaN");
        }
        for (TemperatureBand band : values()) {
            if (temperatureF <= band.upperBoundF) {
                return band;
            }
        }
        return EXTREMELY_HOT;
    }
}
