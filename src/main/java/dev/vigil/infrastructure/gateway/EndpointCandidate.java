package dev.vigil.infrastructure.gateway;

import java.util.Objects;

/**
 * One base URL at which the inference server's API may be reachable.
 * IPv6 literal hosts are always held in bracket form so a port can be reattached.
 */
public record EndpointCandidate(String scheme, String host, int port, String path) {

    public static final int NO_PORT = -1;

    public EndpointCandidate {
        Objects.requireNonNull(scheme, "scheme");
        Objects.requireNonNull(host, "host");
        if (host.contains(":") && !host.startsWith("[")) host = "[" + host + "]";
        path = stripTrailingSlash(path == null ? "" : path);
    }

    public String baseUrl() {
        StringBuilder url = new StringBuilder(scheme).append("://").append(host);
        if (port != NO_PORT) url.append(':').append(port);
        return stripTrailingSlash(url.append(path).toString());
    }

    public String modelsUrl() {
        return baseUrl() + "/models";
    }

    public String chatCompletionsUrl() {
        return baseUrl() + "/chat/completions";
    }

    @Override
    public String toString() {
        return baseUrl();
    }

    static String stripTrailingSlash(String value) {
        int end = value.length();
        while (end > 0 && value.charAt(end - 1) == '/') end--;
        return value.substring(0, end);
    }
}
