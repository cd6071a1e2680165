package dev.vigil.infrastructure.mcp;

import com.fasterxml.jackson.databind.ObjectMapper;
import dev.vigil.config.McpProperties;
import io.modelcontextprotocol.client.McpClient;
import io.modelcontextprotocol.client.McpSyncClient;
import io.modelcontextprotocol.client.transport.ServerParameters;
import io.modelcontextprotocol.client.transport.StdioClientTransport;
import io.modelcontextprotocol.spec.McpSchema;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.Base64;
import java.util.List;
import java.util.Optional;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Short-lived stdio sessions against the servers in {@link McpServerRegistry}.
 *
 * <p>Each call launches the server, initializes a session, does one request and shuts the
 * process down again. Inspection is rare and user-driven, so no session is kept open.
 * Failures are reported as an empty list or as displayable text.
 */
@Component
public class McpResourceClient {
    private static final Logger log = LoggerFactory.getLogger(McpResourceClient.class);

    static final String SERVER_NOT_FOUND = "Server not found: ";
    static final String READ_FAILED = "Error reading resource: ";

    private final McpServerRegistry registry;
    private final ObjectMapper objectMapper;
    private final Function<McpServerDefinition, McpSyncClient> connector;

    @Autowired
    public McpResourceClient(McpServerRegistry registry, McpProperties properties, ObjectMapper objectMapper) {
        this(registry, objectMapper, definition -> stdioClient(definition, properties.requestTimeout(), objectMapper));
    }

    McpResourceClient(McpServerRegistry registry, ObjectMapper objectMapper,
                      Function<McpServerDefinition, McpSyncClient> connector) {
        this.registry = registry;
        this.objectMapper = objectMapper;
        this.connector = connector;
    }

    public List<McpResource> listResources(String serverName) {
        Optional<McpServerDefinition> server = registry.find(serverName);
        if (server.isEmpty()) return List.of();
        try (McpSyncClient client = connector.apply(server.get())) {
            client.initialize();
            return client.listResources().resources().stream()
                    .map(McpResourceClient::toResource)
                    .toList();
        } catch (Exception e) {
            log.warn("Listing resources of MCP server '{}' failed: {}", serverName, e.getMessage());
            return List.of();
        }
    }

    public String readResource(String serverName, String uri) {
        Optional<McpServerDefinition> server = registry.find(serverName);
        if (server.isEmpty()) return SERVER_NOT_FOUND + serverName;
        try (McpSyncClient client = connector.apply(server.get())) {
            client.initialize();
            McpSchema.ReadResourceResult result = client.readResource(new McpSchema.ReadResourceRequest(uri));
            return result.contents().stream()
                    .map(this::render)
                    .collect(Collectors.joining("\n"));
        } catch (Exception e) {
            log.warn("Reading {} from MCP server '{}' failed: {}", uri, serverName, e.getMessage());
            return READ_FAILED + e.getMessage();
        }
    }

    String render(McpSchema.ResourceContents contents) {
        if (contents instanceof McpSchema.TextResourceContents text) {
            return prettyIfJson(text.text(), text.mimeType());
        }
        if (contents instanceof McpSchema.BlobResourceContents blob) {
            return "[Binary data: " + decodedLength(blob.blob()) + " bytes]";
        }
        return String.valueOf(contents);
    }

    String prettyIfJson(String text, String mimeType) {
        if (text == null) return "";
        String trimmed = text.strip();
        boolean looksJson = (mimeType != null && mimeType.contains("json"))
                || trimmed.startsWith("{") || trimmed.startsWith("[");
        if (!looksJson) return text;
        try {
            return objectMapper.writerWithDefaultPrettyPrinter().writeValueAsString(objectMapper.readTree(trimmed));
        } catch (Exception e) {
            log.trace("Resource text is not valid JSON, keeping it as is: {}", e.getMessage());
            return text;
        }
    }

    private static int decodedLength(String base64) {
        if (base64 == null) return 0;
        try {
            return Base64.getDecoder().decode(base64).length;
        } catch (IllegalArgumentException e) {
            return base64.length();
        }
    }

    private static McpSyncClient stdioClient(McpServerDefinition definition, Duration timeout, ObjectMapper mapper) {
        if (definition.cwd() != null) {
            log.debug("MCP server '{}' declares cwd {}, stdio transport starts it in the current directory",
                    definition.name(), definition.cwd());
        }
        ServerParameters parameters = ServerParameters.builder(definition.command())
                .args(definition.args())
                .env(definition.env())
                .build();
        return McpClient.sync(new StdioClientTransport(parameters, mapper))
                .requestTimeout(timeout)
                .build();
    }

    /** Servers may omit name and description; the URI stands in for a missing name. */
    static McpResource toResource(McpSchema.Resource resource) {
        String name = resource.name() != null && !resource.name().isBlank() ? resource.name() : resource.uri();
        String description = resource.description() != null ? resource.description() : "";
        return new McpResource(resource.uri(), name, description, resource.mimeType());
    }
}
