package com.weathersummary.service;

import com.weathersummary.providers.api.ProviderContext;
import com.weathersummary.providers.api.WeatherProvider;
import com.weathersummary.providers.openweather.OpenWeatherProvider;
import com.weathersummary.service.api.ApiKeyGate;
import com.weathersummary.service.api.ApiServer;
import com.weathersummary.service.api.ServiceInfo;
import com.weathersummary.service.config.ConfigLoader;
import com.weathersummary.service.config.ServiceConfig;
import com.weathersummary.service.http.HttpClientFactory;
import com.weathersummary.service.logging.LoggingSetup;

import java.net.http.HttpClient;
import java.time.Clock;
import java.util.Map;
import java.util.concurrent.CountDownLatch;
import java.util.logging.Level;
import java.util.logging.Logger;

public final class Main {
    private static final Logger LOGGER = Logger.getLogger(Main.class.getName());

    private Main() {
    }

    public static void main(String[] args) throws InterruptedException {
        LoggingSetup.configure();

        ApiServer apiServer;
        try {
            ServiceConfig config = ConfigLoader.load(System.getenv(), LOGGER::warning);
            LOGGER.info("Starting with " + config);
            apiServer = createServer(config, Clock.systemUTC());
            apiServer.start();
        } catch (IllegalStateException | IllegalArgumentException e) {
            LOGGER.log(Level.SEVERE, "Startup failed: " + e.getMessage(), e);
            System.exit(1);
            return;
        }
        LOGGER.info("Weather service listening on port " + apiServer.actualPort());

        CountDownLatch shutdownLatch = new CountDownLatch(1);
        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            apiServer.stop();
            shutdownLatch.countDown();
        }));

        shutdownLatch.await();
    }

    static ApiServer createServer(ServiceConfig config, Clock clock) {
        HttpClient httpClient = HttpClientFactory.create(config);
        ProviderContext providerContext = new ProviderContext(
                httpClient,
                Logger.getLogger(OpenWeatherProvider.class.getName()),
                config.providerTimeout(),
                Map.of(OpenWeatherProvider.CONFIG_KEY, config.openWeather())
        );
        WeatherProvider provider = new OpenWeatherProvider(providerContext);
        ApiKeyGate gate = config.devMode() ? ApiKeyGate.disabled() : ApiKeyGate.requiring(config.gateSecret());
        return new ApiServer(
                config.port(),
                provider,
                gate,
                ServiceInfo.DEFAULT,
                config.workerThreads(),
                clock
        );
    }
}
