package dev.vigil.infrastructure.gateway;

/**
 * A single-turn chat request: an instruction plus the text it applies to (usually a diff).
 * {@code model} may be null to let the server pick its loaded model.
 */
public record ChatRequest(String prompt, String context, String model) {

    public ChatRequest {
        if (prompt == null) prompt = "";
        if (context == null) context = "";
    }

    /** Prompt followed by the context in a fenced block. */
    public String userMessage() {
        return prompt + "\n\n```\n" + context + "\n```";
    }
}
