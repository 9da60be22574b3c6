package com.weathersummary.service.api;

import com.weathersummary.core.model.Coordinate;
import com.weathersummary.core.model.NormalizedWeather;
import com.weathersummary.core.util.JsonUtils;
import com.weathersummary.core.validation.CoordinateValidationException;
import com.weathersummary.core.validation.CoordinateValidator;
import com.weathersummary.providers.api.WeatherProvider;
import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpHandler;
import com.sun.net.httpserver.HttpServer;

import java.io.IOException;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.net.URI;
import java.net.URLDecoder;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.logging.Level;
import java.util.logging.Logger;

public class ApiServer {
    private static final Logger LOGGER = Logger.getLogger(ApiServer.class.getName());

    static final String COORDINATES_PATH = "/coordinates";
    static final String VERSION_PATH = "/version";
    static final String HEALTH_PATH = "/health";

    static final String FETCH_FAILED = "Failed to fetch weather data";
    static final String INTERNAL_ERROR = "Internal Server Error";
    static final String UNAUTHORIZED = "Unauthorized";
    static final String FORBIDDEN = "Forbidden";
    static final String NOT_FOUND = "Not Found";
    static final String INVALID_QUERY = "Malformed query string";

    private final int port;
    private final WeatherProvider weatherProvider;
    private final ApiKeyGate apiKeyGate;
    private final ServiceInfo serviceInfo;
    private final int workerThreads;
    private final Clock clock;

    private HttpServer server;
    private ExecutorService executor;
    private Instant startedAt;

    public ApiServer(int port, WeatherProvider weatherProvider, ApiKeyGate apiKeyGate) {
        this(port, weatherProvider, apiKeyGate, ServiceInfo.DEFAULT, 4, Clock.systemUTC());
    }

    public ApiServer(
            int port,
            WeatherProvider weatherProvider,
            ApiKeyGate apiKeyGate,
            ServiceInfo serviceInfo,
            int workerThreads,
            Clock clock
    ) {
        this.port = port;
        this.weatherProvider = weatherProvider;
        this.apiKeyGate = apiKeyGate;
        this.serviceInfo = serviceInfo;
        this.workerThreads = workerThreads;
        this.clock = clock;
    }

    public void start() {
        try {
            server = HttpServer.create(new InetSocketAddress(port), 0);
            executor = Executors.newFixedThreadPool(workerThreads);
            server.setExecutor(executor);
            server.createContext(COORDINATES_PATH, guarded(COORDINATES_PATH, this::handleCoordinates));
            server.createContext(VERSION_PATH, guarded(VERSION_PATH, this::handleVersion));
            server.createContext(HEALTH_PATH, guarded(HEALTH_PATH, this::handleHealth));
            server.createContext("/", this::handleNotFound);
            startedAt = clock.instant();
            server.start();
        } catch (IOException e) {
            throw new IllegalStateException("Failed starting API server", e);
        }
    }

    public void stop() {
        if (server != null) {
            server.stop(0);
        }
        if (executor != null) {
            executor.shutdownNow();
        }
    }

    public int actualPort() {
        if (server == null) {
            return port;
        }
        return server.getAddress().getPort();
    }

    private void handleCoordinates(HttpExchange exchange, Map<String, String> query) throws IOException {
        if (!authorize(exchange, query)) {
            return;
        }

        Coordinate coordinate;
        try {
            coordinate = CoordinateValidator.validate(query.get("lat"), query.get("lon"));
        } catch (CoordinateValidationException e) {
            LOGGER.warning("Rejected coordinates lat=" + query.get("lat") + " lon=" + query.get("lon") + ": " + e.getMessage());
            writeError(exchange, 400, e.getMessage());
            return;
        }

        NormalizedWeather weather;
        try {
            weather = weatherProvider.fetch(coordinate);
        } catch (RuntimeException e) {
            LOGGER.log(Level.SEVERE, FETCH_FAILED + " from " + weatherProvider.name() + " for " + coordinate, e);
            writeError(exchange, 500, FETCH_FAILED);
            return;
        }
        writeJson(exchange, 200, weather);
    }

    private void handleVersion(HttpExchange exchange, Map<String, String> query) throws IOException {
        if (!authorize(exchange, query)) {
            return;
        }
        writeJson(exchange, 200, serviceInfo);
    }

    private void handleHealth(HttpExchange exchange, Map<String, String> query) throws IOException {
        writeJson(exchange, 200, new HealthStatus("ok", weatherProvider.name(), startedAt));
    }

    private void handleNotFound(HttpExchange exchange) throws IOException {
        LOGGER.info("HTTP " + clientIp(exchange) + " " + exchange.getRequestMethod() + " "
                + exchange.getRequestURI().getPath() + " (no route)");
        try {
            writeError(exchange, 404, NOT_FOUND);
        } finally {
            exchange.close();
        }
    }

    private boolean authorize(HttpExchange exchange, Map<String, String> query) throws IOException {
        ApiKeyGate.Decision decision = apiKeyGate.evaluate(
                exchange.getRequestHeaders().getFirst(ApiKeyGate.HEADER),
                query.get(ApiKeyGate.QUERY_PARAM)
        );
        switch (decision) {
            case MISSING_KEY:
                writeError(exchange, 401, UNAUTHORIZED);
                return false;
            case INVALID_KEY:
                LOGGER.warning("Rejected request with invalid API key from " + clientIp(exchange));
                writeError(exchange, 403, FORBIDDEN);
                return false;
            default:
                return true;
        }
    }

    private HttpHandler guarded(String path, RouteHandler route) {
        return exchange -> {
            try {
                if (!path.equals(exchange.getRequestURI().getPath())) {
                    handleNotFound(exchange);
                    return;
                }
                if (!ensureGet(exchange)) {
                    return;
                }
                Map<String, String> query;
                try {
                    query = queryParams(exchange.getRequestURI());
                } catch (IllegalArgumentException malformedQuery) {
                    writeError(exchange, 400, INVALID_QUERY);
                    return;
                }
                logRequest(exchange, query);
                route.handle(exchange, query);
            } catch (RuntimeException e) {
                LOGGER.log(Level.SEVERE, "Unhandled error for " + exchange.getRequestMethod() + " " + path, e);
                if (exchange.getResponseCode() == -1) {
                    writeError(exchange, 500, INTERNAL_ERROR);
                }
            } finally {
                exchange.close();
            }
        };
    }

    private boolean ensureGet(HttpExchange exchange) throws IOException {
        if ("OPTIONS".equalsIgnoreCase(exchange.getRequestMethod())) {
            exchange.getResponseHeaders().set("Access-Control-Allow-Origin", "*");
            exchange.getResponseHeaders().set("Access-Control-Allow-Methods", "GET,OPTIONS");
            exchange.getResponseHeaders().set("Access-Control-Allow-Headers", "Content-Type," + ApiKeyGate.HEADER);
            exchange.sendResponseHeaders(204, -1);
            return false;
        }
        if (!"GET".equalsIgnoreCase(exchange.getRequestMethod())) {
            exchange.getResponseHeaders().set("Allow", "GET,OPTIONS");
            exchange.sendResponseHeaders(405, -1);
            return false;
        }
        return true;
    }

    private void logRequest(HttpExchange exchange, Map<String, String> query) {
        Map<String, String> loggable = new LinkedHashMap<>(query);
        loggable.computeIfPresent(ApiKeyGate.QUERY_PARAM, (key, value) -> "***");
        LOGGER.info("HTTP " + clientIp(exchange) + " " + exchange.getRequestMethod() + " "
                + exchange.getRequestURI().getPath() + " " + loggable);
    }

    private static String clientIp(HttpExchange exchange) {
        InetSocketAddress remote = exchange.getRemoteAddress();
        if (remote == null || remote.getAddress() == null) {
            return "unknown";
        }
        return remote.getAddress().getHostAddress();
    }

    private void writeError(HttpExchange exchange, int status, String message) throws IOException {
        writeJson(exchange, status, Map.of("error", message));
    }

    private void writeJson(HttpExchange exchange, int status, Object body) throws IOException {
        byte[] payload = JsonUtils.toBytes(body);
        exchange.getResponseHeaders().set("Content-Type", "application/json");
        exchange.getResponseHeaders().set("Access-Control-Allow-Origin", "*");
        exchange.sendResponseHeaders(status, payload.length);
        try (OutputStream out = exchange.getResponseBody()) {
            out.write(payload);
        }
    }

    // First occurrence wins for repeated keys.
    static Map<String, String> queryParams(URI uri) {
        Map<String, String> query = new LinkedHashMap<>();
        String raw = uri.getRawQuery();
        if (raw == null || raw.isBlank()) {
            return query;
        }
        for (String entry : raw.split("&")) {
            if (entry.isEmpty()) {
                continue;
            }
            String[] pair = entry.split("=", 2);
            String key = URLDecoder.decode(pair[0], StandardCharsets.UTF_8);
            String value = pair.length > 1 ? URLDecoder.decode(pair[1], StandardCharsets.UTF_8) : "";
            query.putIfAbsent(key, value);
        }
        return query;
    }

    @FunctionalInterface
    private interface RouteHandler {
        void handle(HttpExchange exchange, Map<String, String> query) throws IOException;
    }
}
