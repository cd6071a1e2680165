package dev.vigil.domain.enums;

import java.util.Arrays;
import java.util.Locale;

/**
 * One-shot assistant requests, each bound to a fixed instruction and a diff source.
 */
public enum AssistantAction {
    PING("ping", "Reply with exactly: pong"),
    EXPLAIN_DIFF("explain-diff", "Explain what this diff does. Be concise."),
    SUMMARIZE_STAGED("summarize-staged", "Summarize these staged changes. What's the intent?"),
    SUGGEST_COMMIT("suggest-commit", "Suggest a commit message for these changes. Just the message, no explanation.");

    private final String path;
    private final String prompt;

    AssistantAction(String path, String prompt) {
        this.path = path;
        this.prompt = prompt;
    }

    public String path() {
        return path;
    }

    public String prompt() {
        return prompt;
    }

    /**
     * @throws IllegalArgumentException for names that match no action
     */
    public static AssistantAction fromPath(String value) {
        String normalized = value == null ? "" : value.trim().toLowerCase(Locale.ROOT).replace('_', '-');
        return Arrays.stream(values())
                .filter(action -> action.path.equals(normalized))
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException("Unknown assistant action: " + value));
    }
}
