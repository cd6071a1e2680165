package dev.vigil.service;

import dev.vigil.infrastructure.gateway.GatewayClient;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Optional;

/**
 * Keeps track of which advertised model the assistant and the shadow review use.
 *
 * <p>A periodic non-forced refresh keeps the selection in line with what the server
 * advertises: the current model is kept while it is still listed, otherwise the first
 * advertised model takes over. Most ticks are answered from the gateway's cached catalog.
 */
@Service
public class ModelSelectionService {
    private static final Logger log = LoggerFactory.getLogger(ModelSelectionService.class);

    private final GatewayClient gateway;
    private volatile String selectedModel;

    public ModelSelectionService(GatewayClient gateway) {
        this.gateway = gateway;
    }

    @Scheduled(fixedDelayString = "${vigil.gateway.model-refresh-interval:PT2S}")
    public void scheduledRefresh() {
        refresh(false);
    }

    public synchronized List<String> refresh(boolean force) {
        List<String> models = gateway.refreshModels(force);
        String previous = selectedModel;
        if (!gateway.isConnected() || models.isEmpty()) {
            selectedModel = null;
        } else if (previous == null || !models.contains(previous)) {
            selectedModel = models.get(0);
        }
        if (selectedModel != null && !selectedModel.equals(previous)) {
            log.info("Selected model {}", selectedModel);
        } else if (selectedModel == null && previous != null) {
            log.info("Model selection cleared");
        }
        return models;
    }

    /**
     * @throws IllegalArgumentException when the server does not advertise {@code model}
     */
    public synchronized String select(String model) {
        List<String> models = gateway.refreshModels(false);
        if (model == null || !models.contains(model)) {
            throw new IllegalArgumentException("Model not advertised by the server: " + model);
        }
        selectedModel = model;
        log.info("Selected model {}", model);
        return model;
    }

    public Optional<String> selectedModel() {
        return Optional.ofNullable(selectedModel);
    }

    public String statusLine() {
        if (gateway.isConnected()) {
            return "LM Studio connected (" + gateway.models().size() + " models)";
        }
        String error = gateway.lastError();
        return "LM Studio offline (" + (error == null ? "not checked yet" : error) + ")";
    }
}
