package dev.vigil.infrastructure.mcp;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import dev.vigil.config.McpProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * MCP servers declared in {@code .mcp.json}.
 *
 * <p>The file is taken from {@code vigil.mcp.config-path} when set, otherwise searched from
 * the working directory upwards. Loading never fails: problems end up in {@link ConfigLoad}.
 */
@Component
public class McpServerRegistry {
    private static final Logger log = LoggerFactory.getLogger(McpServerRegistry.class);
    static final String CONFIG_FILE = ".mcp.json";

    private final ObjectMapper objectMapper;
    private final Path configuredPath;
    private final Path searchStart;
    private volatile ConfigLoad current;

    @Autowired
    public McpServerRegistry(McpProperties properties, ObjectMapper objectMapper) {
        this(properties.configPath(), Path.of("").toAbsolutePath(), objectMapper);
    }

    McpServerRegistry(Path configuredPath, Path searchStart, ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
        this.configuredPath = configuredPath;
        this.searchStart = searchStart;
        this.current = load();
    }

    public ConfigLoad current() {
        return current;
    }

    public List<McpServerDefinition> servers() {
        return current.servers();
    }

    public Optional<McpServerDefinition> find(String name) {
        return current.server(name);
    }

    public ConfigLoad reload() {
        current = load();
        return current;
    }

    ConfigLoad load() {
        Optional<Path> source = configuredPath != null ? Optional.of(configuredPath) : discover(searchStart);
        if (source.isEmpty() || !Files.isRegularFile(source.get())) {
            log.debug("No {} found, MCP inspector has no servers", CONFIG_FILE);
            return ConfigLoad.absent();
        }
        Path file = source.get();
        try {
            List<McpServerDefinition> servers = parse(objectMapper.readTree(file.toFile()));
            log.info("Loaded {} MCP servers from {}", servers.size(), file);
            return ConfigLoad.loaded(file, servers);
        } catch (IOException | RuntimeException e) {
            log.warn("Ignoring unreadable {}: {}", file, e.getMessage());
            return ConfigLoad.failed(file, e);
        }
    }

    static Optional<Path> discover(Path start) {
        for (Path dir = start.toAbsolutePath(); dir != null; dir = dir.getParent()) {
            Path candidate = dir.resolve(CONFIG_FILE);
            if (Files.isRegularFile(candidate)) return Optional.of(candidate);
        }
        return Optional.empty();
    }

    List<McpServerDefinition> parse(JsonNode root) {
        JsonNode servers = root.path("mcpServers");
        if (!servers.isObject()) {
            throw new IllegalArgumentException("'mcpServers' must be an object");
        }
        List<McpServerDefinition> result = new ArrayList<>();
        Iterator<Map.Entry<String, JsonNode>> fields = servers.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> entry = fields.next();
            JsonNode server = entry.getValue();
            String command = server.path("command").asText("");
            if (command.isBlank()) {
                log.warn("MCP server '{}' has no command, skipping", entry.getKey());
                continue;
            }
            List<String> args = new ArrayList<>();
            server.path("args").forEach(arg -> args.add(arg.asText()));
            Map<String, String> env = new LinkedHashMap<>();
            server.path("env").fields().forEachRemaining(e -> env.put(e.getKey(), e.getValue().asText()));
            String cwd = server.hasNonNull("cwd") ? server.get("cwd").asText() : null;
            result.add(new McpServerDefinition(entry.getKey(), command, args, cwd, env));
        }
        return result;
    }
}
