package com.weathersummary.service.api;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;

/**
 * Shared-secret check for inbound requests. The key is read from the {@code x-api-key}
 * header, falling back to the {@code apikey} query parameter.
 */
public final class ApiKeyGate {
    public static final String HEADER = "x-api-key";
    public static final String QUERY_PARAM = "apikey";

    public enum Decision {
        ALLOWED,
        MISSING_KEY,
        INVALID_KEY
    }

    private final byte[] secret;

    private ApiKeyGate(byte[] secret) {
        this.secret = secret;
    }

    public static ApiKeyGate disabled() {
        return new ApiKeyGate(null);
    }

    public static ApiKeyGate requiring(String secret) {
        if (secret == null || secret.isBlank()) {
            throw new IllegalArgumentException("Gate secret must not be blank");
        }
        return new ApiKeyGate(secret.getBytes(StandardCharsets.UTF_8));
    }

    public boolean enabled() {
        return secret != null;
    }

    public Decision evaluate(String headerKey, String queryKey) {
        if (secret == null) {
            return Decision.ALLOWED;
        }
        String presented = !isBlank(headerKey) ? headerKey : queryKey;
        if (isBlank(presented)) {
            return Decision.MISSING_KEY;
        }
        return MessageDigest.isEqual(secret, presented.getBytes(StandardCharsets.UTF_8))
                ? Decision.ALLOWED
                : Decision.INVALID_KEY;
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
