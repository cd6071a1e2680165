package dev.vigil.infrastructure.gateway;

import org.springframework.web.reactive.function.client.WebClientResponseException;

import java.net.SocketException;
import java.net.UnknownHostException;

/**
 * Classified failure of one gateway call, carrying the user-facing message.
 *
 * <p>CONNECT and HTTP_STATUS mean "this candidate is wrong, try the next one".
 * Anything else (timeouts, unparseable bodies) stops the candidate walk: the server was found but
 * could not serve the request, and another spelling of the same address will not help.
 */
public record GatewayFailure(Kind kind, String message) {

    public enum Kind { CONNECT, HTTP_STATUS, OTHER }

    static final String CANNOT_CONNECT = "Can't connect to LM Studio. Is it running?";

    public static GatewayFailure unknown() {
        return new GatewayFailure(Kind.OTHER, "Unknown error");
    }

    public static GatewayFailure classify(Throwable error) {
        if (error instanceof WebClientResponseException response) {
            return new GatewayFailure(Kind.HTTP_STATUS,
                    (response.getStatusCode().value() + " " + response.getStatusText()).trim());
        }
        for (Throwable cause = error; cause != null; cause = cause.getCause()) {
            if (cause instanceof SocketException || cause instanceof UnknownHostException) {
                return new GatewayFailure(Kind.CONNECT, CANNOT_CONNECT);
            }
        }
        String detail = error.getMessage() != null ? error.getMessage() : error.getClass().getSimpleName();
        return new GatewayFailure(Kind.OTHER, detail);
    }

    public boolean isRecoverable() {
        return kind != Kind.OTHER;
    }
}
