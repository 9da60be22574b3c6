package com.weathersummary.providers.openweather;

import com.weathersummary.core.model.Coordinate;
import com.weathersummary.core.model.NormalizedWeather;
import com.weathersummary.core.model.WeatherAlert;
import com.weathersummary.providers.api.ProviderContext;
import com.weathersummary.providers.api.WeatherProviderException;
import com.weathersummary.providers.config.OpenWeatherConfig;
import com.weathersummary.providers.support.FixtureUtils;
import com.weathersummary.providers.support.LogCapture;
import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpHandler;
import com.sun.net.httpserver.HttpServer;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpTimeoutException;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;
import java.util.logging.Level;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class OpenWeatherProviderTest {
    private static final Coordinate NEW_YORK = new Coordinate(40.7128, -74.006);

    private HttpServer server;
    private LogCapture logs;

    @BeforeEach
    void setUp() {
        logs = LogCapture.attach("test.openweather." + System.nanoTime());
    }

    @AfterEach
    void tearDown() {
        if (server != null) {
            server.stop(0);
        }
        logs.close();
    }

    @Test
    void sendsCoordinatesUnitsExclusionsAndKey() throws Exception {
        AtomicReference<String> query = new AtomicReference<>();
        AtomicReference<String> accept = new AtomicReference<>();
        startServer(exchange -> {
            query.set(exchange.getRequestURI().getQuery());
            accept.set(exchange.getRequestHeaders().getFirst("Accept"));
            writeResponse(exchange, 200, FixtureUtils.fixtureText("fixtures/onecall-clear.json"));
        });

        NormalizedWeather weather = provider(null).fetch(NEW_YORK);

        assertEquals(new NormalizedWeather("Clear Sky", "Warm", List.of()), weather);
        assertEquals("lat=40.7128&lon=-74.006&exclude=minutely,hourly,daily&units=imperial&appid=test-key", query.get());
        assertEquals("application/json", accept.get());
    }

    @Test
    void rendersWholeNumberCoordinatesWithoutTrailingZeros() {
        OpenWeatherProvider provider = new OpenWeatherProvider(context(URI.create("https://example.test/onecall?lang=en"), null));

        URI uri = provider.requestUri(new Coordinate(90.0, -180.0));

        assertEquals(
                "https://example.test/onecall?lang=en&lat=90&lon=-180&exclude=minutely%2Chourly%2Cdaily&units=imperial&appid=test-key",
                uri.toString()
        );
    }

    @Test
    void mapsAlertsFromProviderResponse() throws Exception {
        startServer(exchange -> writeResponse(exchange, 200, FixtureUtils.fixtureText("fixtures/onecall-storm-alerts.json")));

        NormalizedWeather weather = provider(null).fetch(new Coordinate(29.7604, -95.3698));

        assertEquals("Thunderstorm", weather.currentCondition());
        assertEquals(List.of(new WeatherAlert("Heat Advisory"), new WeatherAlert("Flood Watch")), weather.activeAlerts());
    }

    @Test
    void nonSuccessStatusFailsWithoutRetryAndWithoutLeakingKey() throws Exception {
        AtomicInteger calls = new AtomicInteger();
        startServer(exchange -> {
            calls.incrementAndGet();
            writeResponse(exchange, 503, "{\"cod\":503,\"message\":\"unavailable\"}");
        });

        WeatherProviderException ex = assertThrows(WeatherProviderException.class, () -> provider(null).fetch(NEW_YORK));

        assertEquals(1, calls.get());
        assertEquals("openweather", ex.provider());
        assertEquals(NEW_YORK, ex.coordinate());
        assertTrue(ex.getMessage().contains("503"));
        assertFalse(ex.getMessage().contains("test-key"));
        assertEquals(1, logs.atLevel(Level.WARNING).size());
    }

    @Test
    void unauthorizedStatusIsAProviderFailure() throws Exception {
        startServer(exchange -> writeResponse(exchange, 401, "{\"cod\":401,\"message\":\"Invalid API key\"}"));

        WeatherProviderException ex = assertThrows(WeatherProviderException.class, () -> provider(null).fetch(NEW_YORK));

        assertTrue(ex.getMessage().contains("401"));
    }

    @Test
    void invalidJsonBodyIsAProviderFailure() throws Exception {
        startServer(exchange -> writeResponse(exchange, 200, "<html>gateway</html>"));

        WeatherProviderException ex = assertThrows(WeatherProviderException.class, () -> provider(null).fetch(NEW_YORK));

        assertInstanceOf(IllegalArgumentException.class, ex.getCause());
    }

    @Test
    void connectionFailureCarriesCause() throws Exception {
        server = HttpServer.create(new InetSocketAddress(0), 0);
        int port = server.getAddress().getPort();
        server.stop(0);
        server = null;

        OpenWeatherProvider provider = new OpenWeatherProvider(context(URI.create("http://localhost:" + port + "/onecall"), null));
        WeatherProviderException ex = assertThrows(WeatherProviderException.class, () -> provider.fetch(NEW_YORK));

        assertInstanceOf(IOException.class, ex.getCause());
        LogCaptureAssertions.assertWarningMentions(logs, "40.7128,-74.006");
    }

    @Test
    void configuredTimeoutAppliesToRequest() throws Exception {
        startServer(exchange -> {
            try {
                Thread.sleep(1_000);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            writeResponse(exchange, 200, "{}");
        });

        WeatherProviderException ex = assertThrows(
                WeatherProviderException.class,
                () -> provider(Duration.ofMillis(100)).fetch(NEW_YORK)
        );

        assertInstanceOf(HttpTimeoutException.class, ex.getCause());
    }

    @Test
    void logsInitializationWithoutKey() {
        new OpenWeatherProvider(context(URI.create("https://example.test/onecall"), null));

        assertTrue(logs.atLevel(Level.INFO).stream()
                .anyMatch(record -> record.getMessage().contains("OpenWeather provider initialized with base URL https://example.test/onecall")));
        assertTrue(logs.records().stream().noneMatch(record -> record.getMessage().contains("test-key")));
    }

    @Test
    void missingConfigFailsAtConstruction() {
        ProviderContext ctx = new ProviderContext(HttpClient.newHttpClient(), logs.logger(), null, Map.of());

        IllegalArgumentException ex = assertThrows(IllegalArgumentException.class, () -> new OpenWeatherProvider(ctx));
        assertTrue(ex.getMessage().contains(OpenWeatherProvider.CONFIG_KEY));
    }

    private OpenWeatherProvider provider(Duration timeout) {
        URI baseUrl = URI.create("http://localhost:" + server.getAddress().getPort() + "/data/3.0/onecall");
        return new OpenWeatherProvider(context(baseUrl, timeout));
    }

    private ProviderContext context(URI baseUrl, Duration timeout) {
        return new ProviderContext(
                HttpClient.newBuilder().connectTimeout(Duration.ofSeconds(1)).build(),
                logs.logger(),
                timeout,
                Map.of(OpenWeatherProvider.CONFIG_KEY, new OpenWeatherConfig(baseUrl, "test-key"))
        );
    }

    private void startServer(HttpHandler handler) throws IOException {
        server = HttpServer.create(new InetSocketAddress(0), 0);
        server.createContext("/data/3.0/onecall", handler);
        server.start();
    }

    private static void writeResponse(HttpExchange exchange, int status, String body) throws IOException {
        byte[] bytes = body.getBytes(StandardCharsets.UTF_8);
        exchange.getResponseHeaders().set("Content-Type", "application/json");
        exchange.sendResponseHeaders(status, bytes.length);
        try (OutputStream out = exchange.getResponseBody()) {
            out.write(bytes);
        }
    }

    private static final class LogCaptureAssertions {
        private LogCaptureAssertions() {
        }

        static void assertWarningMentions(LogCapture logs, String text) {
            assertTrue(logs.atLevel(Level.WARNING).stream().anyMatch(record -> record.getMessage().contains(text)),
                    () -> "no WARNING containing " + text + " in " + logs.records());
        }
    }
}
