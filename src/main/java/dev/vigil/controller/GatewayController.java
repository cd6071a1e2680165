package dev.vigil.controller;

import dev.vigil.dto.request.ModelSelectionRequest;
import dev.vigil.dto.response.GatewayStatusResponse;
import dev.vigil.infrastructure.gateway.GatewayClient;
import dev.vigil.service.ModelSelectionService;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

/**
 * Connection state and model selection for the local inference server.
 */
@RestController
@RequestMapping("/gateway")
public class GatewayController {
    private final GatewayClient gateway;
    private final ModelSelectionService modelSelection;

    public GatewayController(GatewayClient gateway, ModelSelectionService modelSelection) {
        this.gateway = gateway;
        this.modelSelection = modelSelection;
    }

    @GetMapping("/status")
    public ResponseEntity<GatewayStatusResponse> status() {
        return ResponseEntity.ok(currentStatus());
    }

    @PostMapping("/models/refresh")
    public ResponseEntity<GatewayStatusResponse> refresh(@RequestParam(defaultValue = "true") boolean force) {
        modelSelection.refresh(force);
        return ResponseEntity.ok(currentStatus());
    }

    @PutMapping("/model")
    public ResponseEntity<GatewayStatusResponse> select(@RequestBody ModelSelectionRequest request) {
        modelSelection.select(request.model());
        return ResponseEntity.ok(currentStatus());
    }

    private GatewayStatusResponse currentStatus() {
        return GatewayStatusResponse.of(gateway.status(), modelSelection.statusLine(),
                modelSelection.selectedModel().orElse(null));
    }
}
