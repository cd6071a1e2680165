package dev.vigil.infrastructure.gateway;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import dev.vigil.config.GatewayProperties;
import io.netty.channel.ChannelOption;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.core.ResolvableType;
import org.springframework.core.codec.StringDecoder;
import org.springframework.core.io.buffer.DataBuffer;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.client.reactive.ReactorClientHttpConnector;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.ClientResponse;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientResponseException;
import reactor.core.publisher.Flux;
import reactor.netty.http.client.HttpClient;

import java.net.URI;
import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.UnaryOperator;

/**
 * Client for a local OpenAI-compatible inference server whose exact address is unknown.
 *
 * <p>Every call walks the candidates produced by {@link EndpointResolver}, starting with the
 * last base URL that worked ("sticky"). The first candidate that answers wins and becomes the
 * new sticky URL.
 *
 * <p>Design decisions:
 * <ul>
 *   <li>No public operation throws. Failures come back as {@link ChatResult} values, as an
 *       {@code "Error: ..."} stream fragment, or as {@link #lastError()} after a refresh.</li>
 *   <li>Only {@link #refreshModels(boolean)} is serialized. Two callers that find the catalog
 *       stale cause one round trip; the second one reads what the first stored.</li>
 *   <li>Blocking calls send no credentials first and retry once with the bearer token on
 *       401/403. Streaming sends the token up front since a rejected stream cannot be
 *       replayed cheaply.</li>
 *   <li>Model metadata and chat use separate HTTP clients so a slow completion never holds
 *       the short metadata timeout hostage.</li>
 * </ul>
 */
@Component
public class GatewayClient {
    private static final Logger log = LoggerFactory.getLogger(GatewayClient.class);
    private static final ObjectMapper MAPPER = new ObjectMapper();

    static final String SYSTEM_PERSONA = "You are a concise assistant helping with git operations. Be brief and direct.";
    static final String DEFAULT_API_KEY = "lm-studio";
    static final String API_KEY_ENV = "LMSTUDIO_API_KEY";
    static final String NO_MODELS = "No models returned.";

    private final GatewayProperties properties;
    private final Clock clock;
    private final List<EndpointCandidate> candidates;
    private final String apiKey;
    private final WebClient metadataClient;
    private final WebClient chatClient;
    private final ReentrantLock refreshLock = new ReentrantLock();

    private volatile ModelCatalog catalog = ModelCatalog.empty();
    private volatile boolean connected;
    private volatile String lastError;
    private volatile EndpointCandidate sticky;

    @Autowired
    public GatewayClient(GatewayProperties properties, WebClient.Builder builder, Clock clock) {
        this(properties, builder, clock, System::getenv);
    }

    GatewayClient(GatewayProperties properties, WebClient.Builder builder, Clock clock,
                  UnaryOperator<String> environment) {
        this.properties = properties;
        this.clock = clock;
        this.candidates = EndpointResolver.resolve(properties.baseUrl());
        this.apiKey = resolveApiKey(properties.apiKey(), environment.apply(API_KEY_ENV));
        this.metadataClient = buildClient(builder, properties.metadataTimeout(), properties.connectTimeout());
        this.chatClient = buildClient(builder, properties.chatTimeout(), properties.connectTimeout());
        log.info("Gateway configured for {} ({} candidate endpoints)", properties.baseUrl(), candidates.size());
    }

    // ── Models ───────────────────────────────────────────────────────

    /**
     * Returns the advertised model ids, hitting the network only when forced or when the
     * cached catalog is older than the configured TTL.
     */
    public List<String> refreshModels(boolean force) {
        if (!force && !catalog.isStale(clock.instant(), properties.modelsTtl())) {
            return catalog.models();
        }
        refreshLock.lock();
        try {
            if (!force && !catalog.isStale(clock.instant(), properties.modelsTtl())) {
                return catalog.models();
            }
            return discoverModels();
        } finally {
            refreshLock.unlock();
        }
    }

    private List<String> discoverModels() {
        GatewayFailure failure = GatewayFailure.unknown();
        for (EndpointCandidate candidate : orderedCandidates()) {
            try {
                String body = withAuthRetry(authorize -> get(metadataClient, candidate.modelsUrl(), authorize));
                List<String> models = extractModelIds(parseBody(body));
                pin(candidate);
                catalog = new ModelCatalog(models, clock.instant());
                connected = true;
                updateError(models.isEmpty() ? NO_MODELS : null);
                log.debug("Listed {} models from {}", models.size(), candidate);
                return models;
            } catch (Exception e) {
                failure = GatewayFailure.classify(e);
                log.debug("Model listing failed at {}: {}", candidate, failure.message());
                if (!failure.isRecoverable()) break;
            }
        }
        catalog = new ModelCatalog(List.of(), clock.instant());
        connected = false;
        updateError(failure.message());
        return List.of();
    }

    /**
     * @throws IllegalStateException for an empty body, which means the server answered but
     *         is not speaking the expected API
     */
    static JsonNode parseBody(String body) throws JsonProcessingException {
        if (body == null || body.isBlank()) {
            throw new IllegalStateException("Empty response body");
        }
        JsonNode node = MAPPER.readTree(body);
        if (node == null || node.isMissingNode()) {
            throw new IllegalStateException("Empty response body");
        }
        return node;
    }

    static List<String> extractModelIds(JsonNode body) {
        JsonNode items = body.isArray() ? body : body.path("data");
        List<String> ids = new ArrayList<>();
        if (!items.isArray()) return ids;
        for (JsonNode item : items) {
            for (String field : List.of("id", "name", "model")) {
                JsonNode value = item.get(field);
                if (value != null && value.isTextual() && !value.asText().isBlank()) {
                    ids.add(value.asText());
                    break;
                }
            }
        }
        return ids;
    }

    // ── Chat ─────────────────────────────────────────────────────────

    public ChatResult chat(ChatRequest request) {
        Map<String, Object> payload = payload(request, false);
        GatewayFailure failure = GatewayFailure.unknown();
        for (EndpointCandidate candidate : orderedCandidates()) {
            try {
                String body = withAuthRetry(authorize -> post(candidate.chatCompletionsUrl(), payload, authorize));
                String content = extractMessageContent(parseBody(body));
                pin(candidate);
                return ChatResult.success(content);
            } catch (Exception e) {
                failure = GatewayFailure.classify(e);
                log.debug("Chat failed at {}: {}", candidate, failure.message());
                if (!failure.isRecoverable()) break;
            }
        }
        log.warn("Chat request failed: {}", failure.message());
        return ChatResult.failure(failure);
    }

    static String extractMessageContent(JsonNode body) {
        JsonNode message = body.path("choices").path(0).path("message");
        if (!message.has("content")) {
            throw new IllegalStateException("Response has no choices[0].message.content");
        }
        JsonNode content = message.get("content");
        return content.isNull() ? "" : content.asText();
    }

    /**
     * Streams the completion as text deltas. Failures before the first delta move on to the
     * next candidate; a failure after text has been emitted ends the sequence with a single
     * error fragment, since replaying elsewhere would duplicate output.
     */
    public Flux<String> chatStream(ChatRequest request) {
        return Flux.defer(() -> streamFrom(orderedCandidates(), 0, payload(request, true), GatewayFailure.unknown()));
    }

    private Flux<String> streamFrom(List<EndpointCandidate> order, int index, Map<String, Object> payload,
                                    GatewayFailure lastFailure) {
        if (index >= order.size()) {
            log.warn("Streaming chat failed: {}", lastFailure.message());
            return Flux.just(ChatResult.ERROR_PREFIX + lastFailure.message());
        }
        EndpointCandidate candidate = order.get(index);
        AtomicBoolean emitted = new AtomicBoolean();
        return chatClient.post()
                .uri(URI.create(candidate.chatCompletionsUrl()))
                .header(HttpHeaders.AUTHORIZATION, bearer())
                .accept(MediaType.TEXT_EVENT_STREAM)
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue(payload)
                .<String>exchangeToFlux(response -> {
                    if (response.statusCode().isError()) {
                        return response.createException().flatMapMany(error -> Flux.<String>error(error));
                    }
                    pin(candidate);
                    return StreamDecoder.decode(lines(response));
                })
                .doOnNext(delta -> emitted.set(true))
                .onErrorResume(e -> {
                    GatewayFailure failure = GatewayFailure.classify(e);
                    log.debug("Streaming chat failed at {}: {}", candidate, failure.message());
                    if (emitted.get() || !failure.isRecoverable()) {
                        log.warn("Streaming chat aborted: {}", failure.message());
                        return Flux.just(ChatResult.ERROR_PREFIX + failure.message());
                    }
                    return streamFrom(order, index + 1, payload, failure);
                });
    }

    private static Flux<String> lines(ClientResponse response) {
        return StringDecoder.allMimeTypes()
                .decode(response.bodyToFlux(DataBuffer.class), ResolvableType.forClass(String.class), null, null);
    }

    // ── State ────────────────────────────────────────────────────────

    public boolean isConnected() {
        return connected;
    }

    public String lastError() {
        return lastError;
    }

    /** Cached model ids; never triggers I/O. */
    public List<String> models() {
        return catalog.models();
    }

    public GatewayStatus status() {
        ModelCatalog current = catalog;
        EndpointCandidate pinned = sticky;
        return new GatewayStatus(connected, lastError, pinned == null ? null : pinned.baseUrl(),
                current.models(), current.refreshedAt());
    }

    // ── Internal ─────────────────────────────────────────────────────

    List<EndpointCandidate> orderedCandidates() {
        EndpointCandidate pinned = sticky;
        if (pinned == null) return candidates;
        List<EndpointCandidate> ordered = new ArrayList<>(candidates.size() + 1);
        ordered.add(pinned);
        for (EndpointCandidate candidate : candidates) {
            if (!candidate.equals(pinned)) ordered.add(candidate);
        }
        return ordered;
    }

    private void pin(EndpointCandidate candidate) {
        if (!candidate.equals(sticky)) {
            log.info("Using inference endpoint {}", candidate);
            sticky = candidate;
        }
    }

    private void updateError(String error) {
        if (error != null && !error.equals(lastError)) {
            log.warn("Inference server unavailable: {}", error);
        }
        lastError = error;
    }

    private Map<String, Object> payload(ChatRequest request, boolean stream) {
        Map<String, Object> payload = new LinkedHashMap<>();
        if (request.model() != null && !request.model().isBlank()) payload.put("model", request.model());
        payload.put("messages", List.of(
                Map.of("role", "system", "content", SYSTEM_PERSONA),
                Map.of("role", "user", "content", request.userMessage())));
        payload.put("temperature", properties.temperature());
        payload.put("max_tokens", properties.maxTokens());
        payload.put("stream", stream);
        return payload;
    }

    private <T> T withAuthRetry(AuthorizedCall<T> call) {
        try {
            return call.execute(false);
        } catch (WebClientResponseException e) {
            if (e.getStatusCode().value() == HttpStatus.UNAUTHORIZED.value()
                    || e.getStatusCode().value() == HttpStatus.FORBIDDEN.value()) {
                return call.execute(true);
            }
            throw e;
        }
    }

    private String get(WebClient client, String url, boolean authorize) {
        return client.get()
                .uri(URI.create(url))
                .headers(headers -> { if (authorize) headers.set(HttpHeaders.AUTHORIZATION, bearer()); })
                .accept(MediaType.APPLICATION_JSON)
                .retrieve()
                .bodyToMono(String.class)
                .block();
    }

    private String post(String url, Map<String, Object> payload, boolean authorize) {
        return chatClient.post()
                .uri(URI.create(url))
                .headers(headers -> { if (authorize) headers.set(HttpHeaders.AUTHORIZATION, bearer()); })
                .contentType(MediaType.APPLICATION_JSON)
                .accept(MediaType.APPLICATION_JSON)
                .bodyValue(payload)
                .retrieve()
                .bodyToMono(String.class)
                .block();
    }

    private String bearer() {
        return "Bearer " + apiKey;
    }

    static String resolveApiKey(String configured, String fromEnvironment) {
        if (configured != null && !configured.isBlank()) return configured;
        if (fromEnvironment != null && !fromEnvironment.isBlank()) return fromEnvironment;
        return DEFAULT_API_KEY;
    }

    private static WebClient buildClient(WebClient.Builder builder, Duration responseTimeout, Duration connectTimeout) {
        HttpClient httpClient = HttpClient.create()
                .responseTimeout(responseTimeout)
                .option(ChannelOption.CONNECT_TIMEOUT_MILLIS, (int) connectTimeout.toMillis());
        return builder.clone()
                .clientConnector(new ReactorClientHttpConnector(httpClient))
                .build();
    }

    @FunctionalInterface
    private interface AuthorizedCall<T> {
        T execute(boolean authorize);
    }
}
