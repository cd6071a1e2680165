package dev.vigil.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.nio.file.Path;
import java.time.Duration;

/**
 * MCP inspector config. A null {@code configPath} means ".mcp.json" is searched from the
 * working directory upwards.
 */
@ConfigurationProperties(prefix = "vigil.mcp")
public record McpProperties(Path configPath, Duration requestTimeout) {
    public McpProperties {
        if (requestTimeout == null) requestTimeout = Duration.ofSeconds(20);
    }
}
