package dev.vigil.infrastructure.gateway;

import java.net.URI;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Expands one configured base URL into the ordered list of candidates worth probing.
 *
 * <p>Two kinds of variation are covered:
 * <ul>
 *   <li>Host: loopback aliases are interchangeable, but some resolver stacks map
 *       {@code localhost} to IPv6 while the server only listens on IPv4 (or the reverse),
 *       so every loopback spelling is tried.</li>
 *   <li>Path: OpenAI-compatible servers expose {@code /v1}, LM Studio's native API lives
 *       under {@code /api/v0}, and some proxies mount the API at the root.</li>
 * </ul>
 * The configured URL itself always comes first. Pure function, no I/O.
 */
public final class EndpointResolver {

    private static final Set<String> LOOPBACK_HOSTS = Set.of("localhost", "127.0.0.1", "::1");
    private static final List<String> LOOPBACK_FALLBACKS = List.of("localhost", "127.0.0.1", "[::1]");
    private static final String OPENAI_SUFFIX = "/v1";
    private static final String NATIVE_SUFFIX = "/api/v0";

    private EndpointResolver() {}

    /**
     * @throws IllegalArgumentException if {@code baseUrl} is not a parseable URL
     */
    public static List<EndpointCandidate> resolve(String baseUrl) {
        URI uri = URI.create(EndpointCandidate.stripTrailingSlash(baseUrl.trim()));
        String scheme = uri.getScheme() != null ? uri.getScheme() : "http";
        String hostname = uri.getHost() != null ? uri.getHost() : "127.0.0.1";
        String path = EndpointCandidate.stripTrailingSlash(uri.getRawPath() != null ? uri.getRawPath() : "");

        List<String> hosts = new ArrayList<>();
        hosts.add(hostname);
        if (isLoopback(hostname)) hosts.addAll(LOOPBACK_FALLBACKS);

        String root = apiRoot(path);
        List<String> paths = List.of(path, root + OPENAI_SUFFIX, root + NATIVE_SUFFIX, root);

        Set<EndpointCandidate> candidates = new LinkedHashSet<>();
        for (String host : hosts) {
            for (String apiPath : paths) {
                candidates.add(new EndpointCandidate(scheme, host, uri.getPort(), apiPath));
            }
        }
        return List.copyOf(candidates);
    }

    static boolean isLoopback(String host) {
        String bare = host.startsWith("[") && host.endsWith("]") ? host.substring(1, host.length() - 1) : host;
        return LOOPBACK_HOSTS.contains(bare.toLowerCase(Locale.ROOT));
    }

    static String apiRoot(String path) {
        if (path.endsWith(OPENAI_SUFFIX)) return path.substring(0, path.length() - OPENAI_SUFFIX.length());
        if (path.endsWith(NATIVE_SUFFIX)) return path.substring(0, path.length() - NATIVE_SUFFIX.length());
        return path;
    }
}
