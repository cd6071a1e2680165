package dev.vigil.infrastructure.gateway;

/**
 * Outcome of a blocking chat call: the completion text, or the failure that ended the
 * candidate walk. Callers render {@link #text()} directly either way.
 */
public record ChatResult(String content, GatewayFailure failure) {

    public static final String ERROR_PREFIX = "Error: ";

    public static ChatResult success(String content) {
        return new ChatResult(content, null);
    }

    public static ChatResult failure(GatewayFailure failure) {
        return new ChatResult(null, failure);
    }

    public boolean isSuccess() {
        return failure == null;
    }

    public String text() {
        return isSuccess() ? content : ERROR_PREFIX + failure.message();
    }
}
