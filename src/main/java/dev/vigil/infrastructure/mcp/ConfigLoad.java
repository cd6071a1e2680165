package dev.vigil.infrastructure.mcp;

import java.nio.file.Path;
import java.util.List;
import java.util.Optional;

/**
 * Result of reading {@code .mcp.json}. A missing or unreadable file still yields a usable,
 * empty server list; the cause of an unreadable file is kept for diagnostics.
 */
public record ConfigLoad(Path source, List<McpServerDefinition> servers, Exception failure) {

    public ConfigLoad {
        servers = servers == null ? List.of() : List.copyOf(servers);
    }

    public static ConfigLoad absent() {
        return new ConfigLoad(null, List.of(), null);
    }

    public static ConfigLoad loaded(Path source, List<McpServerDefinition> servers) {
        return new ConfigLoad(source, servers, null);
    }

    public static ConfigLoad failed(Path source, Exception failure) {
        return new ConfigLoad(source, List.of(), failure);
    }

    public Optional<McpServerDefinition> server(String name) {
        return servers.stream().filter(s -> s.name().equals(name)).findFirst();
    }

    public boolean isFailed() {
        return failure != null;
    }
}
