package com.weathersummary.service.api;

import java.time.Instant;

public record HealthStatus(String status, String provider, Instant startedAt) {
}
