package dev.vigil.dto.response;

import dev.vigil.infrastructure.mcp.ConfigLoad;
import dev.vigil.infrastructure.mcp.McpServerDefinition;

import java.util.List;

public record McpServersResponse(String source, List<ServerSummary> servers, String loadError) {

    public record ServerSummary(String name, String command, List<String> args) {}

    public static McpServersResponse of(ConfigLoad load) {
        return new McpServersResponse(
                load.source() == null ? null : load.source().toString(),
                load.servers().stream().map(McpServersResponse::summary).toList(),
                load.isFailed() ? load.failure().getMessage() : null);
    }

    private static ServerSummary summary(McpServerDefinition server) {
        return new ServerSummary(server.name(), server.command(), server.args());
    }
}
