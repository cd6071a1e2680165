package dev.vigil;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;
import org.springframework.scheduling.annotation.EnableScheduling;

/**
 * Vigil: local LLM gateway and shadow code review companion.
 *
 * <p>Architecture overview:
 * <pre>
 * poll tick → ChangeDetector → ShadowReviewScheduler (gates) → DiffProvider
 *   → GatewayClient (endpoint probing, auth retry) → severity → activity log
 *
 * REST request → AssistantService → GatewayClient (blocking or streaming)
 * </pre>
 *
 * <p>Key design decisions:
 * <ul>
 *   <li>Endpoint discovery over configuration: the inference server's host and API path
 *       are tried from one base URL, and the first working candidate becomes sticky</li>
 *   <li>Failures as values: the gateway never throws to its callers, every failure is
 *       rendered as a displayable {@code Error: ...} string</li>
 *   <li>Poll-based change detection: one scheduler thread, seconds-scale reaction time</li>
 * </ul>
 */
@SpringBootApplication
@ConfigurationPropertiesScan
@EnableScheduling
public class VigilApplication {

    public static void main(String[] args) {
        SpringApplication.run(VigilApplication.class, args);
    }
}
