package dev.vigil.dto.response;

import dev.vigil.infrastructure.gateway.GatewayStatus;

import java.time.Instant;
import java.util.List;

public record GatewayStatusResponse(
        boolean connected, String statusLine, String lastError, String baseUrl,
        List<String> models, String selectedModel, Instant refreshedAt
) {
    public static GatewayStatusResponse of(GatewayStatus status, String statusLine, String selectedModel) {
        return new GatewayStatusResponse(status.connected(), statusLine, status.lastError(),
                status.stickyBaseUrl(), status.models(), selectedModel, status.refreshedAt());
    }
}
