package dev.vigil.controller;

import dev.vigil.dto.response.McpServersResponse;
import dev.vigil.infrastructure.mcp.McpResource;
import dev.vigil.infrastructure.mcp.McpResourceClient;
import dev.vigil.infrastructure.mcp.McpServerRegistry;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;

/**
 * Read-only inspector for the resources of configured MCP servers.
 */
@RestController
@RequestMapping("/mcp")
public class McpController {
    private final McpServerRegistry registry;
    private final McpResourceClient client;

    public McpController(McpServerRegistry registry, McpResourceClient client) {
        this.registry = registry;
        this.client = client;
    }

    @GetMapping("/servers")
    public ResponseEntity<McpServersResponse> servers() {
        return ResponseEntity.ok(McpServersResponse.of(registry.current()));
    }

    @PostMapping("/servers/reload")
    public ResponseEntity<McpServersResponse> reload() {
        return ResponseEntity.ok(McpServersResponse.of(registry.reload()));
    }

    @GetMapping("/servers/{name}/resources")
    public ResponseEntity<List<McpResource>> resources(@PathVariable String name) {
        if (registry.find(name).isEmpty()) return ResponseEntity.notFound().build();
        return ResponseEntity.ok(client.listResources(name));
    }

    @GetMapping(value = "/servers/{name}/resource", produces = MediaType.TEXT_PLAIN_VALUE)
    public ResponseEntity<String> resource(@PathVariable String name, @RequestParam String uri) {
        return ResponseEntity.ok(client.readResource(name, uri));
    }
}
