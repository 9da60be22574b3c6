package com.weathersummary.core.model;

public record Coordinate(double latitude, double longitude) {
    public static final double MAX_LATITUDE = 90.0;
    public static final double MAX_LONGITUDE = 180.0;

    public Coordinate {
        if (!Double.isFinite(latitude) || Math.abs(latitude) > MAX_LATITUDE) {
            throw new IllegalArgumentException("latitude out of range: " + latitude);
        }
        if (!Double.isFinite(longitude) || Math.abs(longitude) > MAX_LONGITUDE) {
            throw new IllegalArgumentException("longitude out of range: " + longitude);
        }
    }

    @Override
    public String toString() {
        return latitude + "," + longitude;
    }
}
