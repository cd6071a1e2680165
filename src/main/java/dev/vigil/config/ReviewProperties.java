package dev.vigil.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.nio.file.Path;
import java.time.Duration;

/**
 * Shadow review config. {@code enabled} is the initial state only; it can be toggled at runtime.
 */
@ConfigurationProperties(prefix = "vigil.review")
public record ReviewProperties(boolean enabled, Path root, Duration pollInterval, Duration cooldown) {
    public ReviewProperties {
        if (root == null) root = Path.of(".");
        if (pollInterval == null) pollInterval = Duration.ofSeconds(5);
        if (cooldown == null) cooldown = Duration.ofSeconds(30);
    }
}
