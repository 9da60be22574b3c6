package com.weathersummary.providers.api;

import com.weathersummary.providers.config.OpenWeatherConfig;
import org.junit.jupiter.api.Test;

import java.net.URI;
import java.net.http.HttpClient;
import java.util.HashMap;
import java.util.Map;
import java.util.logging.Logger;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ProviderContextTest {
    private static final Logger LOGGER = Logger.getLogger(ProviderContextTest.class.getName());

    @Test
    void requiredConfigReturnsTypedValue() {
        OpenWeatherConfig config = new OpenWeatherConfig(OpenWeatherConfig.DEFAULT_BASE_URL, " key ");
        ProviderContext ctx = new ProviderContext(HttpClient.newHttpClient(), LOGGER, null, Map.of("openweather", config));

        assertEquals(config, ctx.requiredConfig("openweather", OpenWeatherConfig.class));
        assertEquals("key", config.apiKey());
        assertNull(ctx.requestTimeout());
    }

    @Test
    void requiredConfigRejectsMissingAndMistypedValues() {
        ProviderContext ctx = new ProviderContext(HttpClient.newHttpClient(), LOGGER, null, Map.of("openweather", "nope"));

        IllegalArgumentException missing = assertThrows(IllegalArgumentException.class, () -> ctx.requiredConfig("other", String.class));
        assertTrue(missing.getMessage().contains("other"));

        IllegalArgumentException mistyped = assertThrows(IllegalArgumentException.class, () -> ctx.requiredConfig("openweather", OpenWeatherConfig.class));
        assertTrue(mistyped.getMessage().contains("OpenWeatherConfig"));
    }

    @Test
    void configMapIsCopiedAndCollaboratorsAreRequired() {
        Map<String, Object> config = new HashMap<>();
        config.put("a", 1);
        ProviderContext ctx = new ProviderContext(HttpClient.newHttpClient(), LOGGER, null, config);
        config.put("b", 2);

        assertFalse(ctx.config().containsKey("b"));
        assertThrows(NullPointerException.class, () -> new ProviderContext(null, LOGGER, null, Map.of()));
        assertThrows(NullPointerException.class, () -> new ProviderContext(HttpClient.newHttpClient(), null, null, Map.of()));
    }

    @Test
    void openWeatherConfigRequiresKeyAndHidesItFromToString() {
        assertThrows(IllegalArgumentException.class, () -> new OpenWeatherConfig(URI.create("https://x.test"), " "));
        assertThrows(NullPointerException.class, () -> new OpenWeatherConfig(null, "key"));
        assertFalse(new OpenWeatherConfig(URI.create("https://x.test"), "secret").toString().contains("secret"));
    }
}
