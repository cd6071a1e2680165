package dev.vigil.infrastructure.mcp;

import java.util.List;
import java.util.Map;

/**
 * How to launch one MCP server over stdio, as declared under {@code mcpServers} in {@code .mcp.json}.
 */
public record McpServerDefinition(String name, String command, List<String> args, String cwd,
                                  Map<String, String> env) {

    public McpServerDefinition {
        args = args == null ? List.of() : List.copyOf(args);
        env = env == null ? Map.of() : Map.copyOf(env);
    }
}
