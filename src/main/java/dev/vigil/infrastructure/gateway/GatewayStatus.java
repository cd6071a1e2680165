package dev.vigil.infrastructure.gateway;

import java.time.Instant;
import java.util.List;

/**
 * Point-in-time view of the gateway's connection state for readers outside the client.
 */
public record GatewayStatus(boolean connected, String lastError, String stickyBaseUrl,
                            List<String> models, Instant refreshedAt) {}
