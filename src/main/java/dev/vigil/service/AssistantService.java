package dev.vigil.service;

import dev.vigil.domain.enums.AssistantAction;
import dev.vigil.infrastructure.gateway.ChatRequest;
import dev.vigil.infrastructure.gateway.GatewayClient;
import dev.vigil.infrastructure.git.DiffProvider;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;

import java.util.Optional;

/**
 * Manual, user-triggered requests to the model. Runs alongside the shadow review and
 * never touches its state.
 */
@Service
public class AssistantService {
    private static final Logger log = LoggerFactory.getLogger(AssistantService.class);

    static final String NOT_CONNECTED = "LM Studio not connected";
    static final String NO_MODEL = "No model selected";

    private final GatewayClient gateway;
    private final ModelSelectionService modelSelection;
    private final DiffProvider diffProvider;
    private volatile String lastOutput = "";

    public AssistantService(GatewayClient gateway, ModelSelectionService modelSelection, DiffProvider diffProvider) {
        this.gateway = gateway;
        this.modelSelection = modelSelection;
        this.diffProvider = diffProvider;
    }

    public String run(AssistantAction action) {
        Optional<String> blocked = precheck();
        if (blocked.isPresent()) return remember(blocked.get());
        ChatRequest request = request(action);
        log.info("Running assistant action {} with {}", action, request.model());
        return remember(gateway.chat(request).text());
    }

    /**
     * Same as {@link #run(AssistantAction)} but delivers the answer as it is generated.
     * The full text is retained once the stream completes.
     */
    public Flux<String> stream(AssistantAction action) {
        return Flux.defer(() -> {
            Optional<String> blocked = precheck();
            if (blocked.isPresent()) return Flux.just(remember(blocked.get()));
            ChatRequest request = request(action);
            log.info("Streaming assistant action {} with {}", action, request.model());
            StringBuilder answer = new StringBuilder();
            return gateway.chatStream(request)
                    .doOnNext(answer::append)
                    .doOnComplete(() -> remember(answer.toString()));
        });
    }

    public String lastOutput() {
        return lastOutput;
    }

    private Optional<String> precheck() {
        if (!gateway.isConnected()) {
            modelSelection.refresh(true);
        }
        if (!gateway.isConnected()) return Optional.of(NOT_CONNECTED);
        if (modelSelection.selectedModel().isEmpty()) return Optional.of(NO_MODEL);
        return Optional.empty();
    }

    private ChatRequest request(AssistantAction action) {
        String model = modelSelection.selectedModel().orElse(null);
        return new ChatRequest(action.prompt(), context(action), model);
    }

    private String context(AssistantAction action) {
        return switch (action) {
            case PING -> "";
            case EXPLAIN_DIFF -> diffProvider.unstagedDiff();
            case SUMMARIZE_STAGED -> diffProvider.stagedDiff();
            case SUGGEST_COMMIT -> {
                String staged = diffProvider.stagedDiff();
                yield DiffProvider.NOTHING_STAGED.equals(staged) ? diffProvider.unstagedDiff() : staged;
            }
        };
    }

    private String remember(String output) {
        lastOutput = output;
        return output;
    }
}
