package dev.vigil.controller;

import dev.vigil.domain.enums.AssistantAction;
import dev.vigil.dto.response.AssistantResponse;
import dev.vigil.service.AssistantService;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import reactor.core.publisher.Flux;

/**
 * One-shot assistant actions. {@code /stream} delivers the answer as server-sent events,
 * one event per text delta.
 */
@RestController
@RequestMapping("/assistant")
public class AssistantController {
    private final AssistantService assistant;

    public AssistantController(AssistantService assistant) { this.assistant = assistant; }

    @PostMapping("/{action}")
    public ResponseEntity<AssistantResponse> run(@PathVariable String action) {
        AssistantAction resolved = AssistantAction.fromPath(action);
        return ResponseEntity.ok(new AssistantResponse(resolved.path(), assistant.run(resolved)));
    }

    @GetMapping(value = "/{action}/stream", produces = MediaType.TEXT_EVENT_STREAM_VALUE)
    public Flux<String> stream(@PathVariable String action) {
        return assistant.stream(AssistantAction.fromPath(action));
    }

    @GetMapping("/last")
    public ResponseEntity<AssistantResponse> last() {
        return ResponseEntity.ok(new AssistantResponse(null, assistant.lastOutput()));
    }
}
