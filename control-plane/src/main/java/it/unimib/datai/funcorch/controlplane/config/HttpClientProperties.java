package it.unimib.datai.funcorch.controlplane.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Configuration properties for the client used to reach URL-hosted functions.
 */
@ConfigurationProperties(prefix = "funcorch.http-client")
public record HttpClientProperties(
        Integer connectTimeoutMs,
        Integer readTimeoutMs,
        Integer maxInMemorySizeMb
) {
    public HttpClientProperties {
        if (connectTimeoutMs == null || connectTimeoutMs <= 0) {
            connectTimeoutMs = 5000;
        }
        if (readTimeoutMs == null || readTimeoutMs <= 0) {
            readTimeoutMs = 30000;
        }
        if (maxInMemorySizeMb == null || maxInMemorySizeMb <= 0) {
            maxInMemorySizeMb = 1;
        }
    }

    public static HttpClientProperties defaults() {
        return new HttpClientProperties(null, null, null);
    }
}
