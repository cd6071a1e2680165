package dev.vigil.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

/**
 * Inference server gateway config. {@code baseUrl} is only the starting point for endpoint
 * probing; {@code apiKey} is optional and falls back to the environment.
 */
@ConfigurationProperties(prefix = "vigil.gateway")
public record GatewayProperties(String baseUrl, String apiKey, Duration modelsTtl,
                                Duration metadataTimeout, Duration chatTimeout, Duration connectTimeout,
                                Double temperature, int maxTokens) {
    public GatewayProperties {
        if (baseUrl == null || baseUrl.isBlank()) baseUrl = "http://127.0.0.1:1234/v1";
        if (modelsTtl == null) modelsTtl = Duration.ofSeconds(15);
        if (metadataTimeout == null) metadataTimeout = Duration.ofSeconds(5);
        if (chatTimeout == null) chatTimeout = Duration.ofSeconds(60);
        if (connectTimeout == null) connectTimeout = Duration.ofSeconds(5);
        if (temperature == null) temperature = 0.3;
        if (maxTokens <= 0) maxTokens = 500;
    }
}
