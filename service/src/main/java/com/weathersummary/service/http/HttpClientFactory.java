package com.weathersummary.service.http;

import com.weathersummary.service.config.ServiceConfig;

import javax.net.ssl.SSLContext;
import javax.net.ssl.TrustManagerFactory;
import java.io.InputStream;
import java.net.http.HttpClient;
import java.nio.file.Files;
import java.nio.file.Path;
import java.security.KeyStore;
import java.security.SecureRandom;
import java.time.Duration;
import java.util.Locale;

public final class HttpClientFactory {
    private HttpClientFactory() {
    }

    public static HttpClient create(ServiceConfig config) {
        return create(config.providerTimeout(), config.trustStore());
    }

    /**
     * @param connectTimeout {@code null} keeps the JDK default (no connect timeout)
     * @param trustStore     {@code null} keeps the JDK default trust store
     */
    public static HttpClient create(Duration connectTimeout, ServiceConfig.TrustStore trustStore) {
        HttpClient.Builder builder = HttpClient.newBuilder()
                .followRedirects(HttpClient.Redirect.NORMAL);
        if (connectTimeout != null) {
            builder.connectTimeout(connectTimeout);
        }
        if (trustStore != null) {
            builder.sslContext(sslContext(trustStore));
        }
        return builder.build();
    }

    private static SSLContext sslContext(ServiceConfig.TrustStore trustStore) {
        Path path = trustStore.path();
        if (!Files.exists(path)) {
            throw new IllegalStateException("Truststore file does not exist: " + path);
        }

        try (InputStream in = Files.newInputStream(path)) {
            KeyStore keyStore = KeyStore.getInstance(inferTruststoreType(path));
            keyStore.load(in, trustStore.password().toCharArray());

            TrustManagerFactory tmf = TrustManagerFactory.getInstance(TrustManagerFactory.getDefaultAlgorithm());
            tmf.init(keyStore);

            SSLContext sslContext = SSLContext.getInstance("TLS");
            sslContext.init(null, tmf.getTrustManagers(), new SecureRandom());
            return sslContext;
        } catch (Exception e) {
            throw new IllegalStateException("Failed to build SSL context from truststore " + path, e);
        }
    }

    static String inferTruststoreType(Path path) {
        String lower = path.getFileName().toString().toLowerCase(Locale.ROOT);
        if (lower.endsWith(".p12") || lower.endsWith(".pfx") || lower.endsWith(".pkcs12")) {
            return "PKCS12";
        }
        return "JKS";
    }
}
