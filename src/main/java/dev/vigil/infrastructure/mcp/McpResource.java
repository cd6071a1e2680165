package dev.vigil.infrastructure.mcp;

/**
 * A resource advertised by an MCP server.
 */
public record McpResource(String uri, String name, String description, String mimeType) {}
