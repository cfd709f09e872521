package warden.core.service.gateway;

import java.net.URI;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import warden.core.config.BackendConfig;
import warden.core.model.gateway.GatewayRequest;
import warden.core.model.gateway.PreparedProxyRequest;

/**
 * Prepares backend requests by applying header hygiene and forwarding rules.
 * This encapsulates the logic for:
 * - Dropping the inbound Host header so the gateway's own host never reaches the backend
 * - Filtering hop-by-hop headers (RFC 2616 Section 13.5.1)
 * - Overwriting X-Forwarded-For and X-Forwarded-Proto for the originating client
 * - Resolving path and raw query against the backend base URL
 */
@ApplicationScoped
public class ProxyRequestPreparer {

    static final String X_FORWARDED_FOR = "X-Forwarded-For";
    static final String X_FORWARDED_PROTO = "X-Forwarded-Proto";

    /**
     * HTTP hop-by-hop headers that must not be forwarded.
     * These are connection-specific headers per RFC 2616 Section 13.5.1.
     */
    private static final Set<String> HOP_BY_HOP_HEADERS = Set.of(
            "connection",
            "keep-alive",
            "proxy-authenticate",
            "proxy-authorization",
            "te",
            "trailer",
            "transfer-encoding",
            "upgrade");

    private final URI backendBase;

    @Inject
    public ProxyRequestPreparer(BackendConfig config) {
        this(URI.create(config.url()));
    }

    public ProxyRequestPreparer(URI backendBase) {
        if (backendBase.getScheme() == null || backendBase.getHost() == null) {
            throw new IllegalArgumentException("warden.backend.url must be an absolute URL: " + backendBase);
        }
        this.backendBase = backendBase;
    }

    public PreparedProxyRequest prepare(GatewayRequest request) {
        var headers = buildHeaders(request);
        return new PreparedProxyRequest(request.method(), targetUri(request), headers, request.body());
    }

    /**
     * Filters hop-by-hop headers and Content-Length from a backend response.
     * Content-Length is recomputed when the response is written back.
     */
    public Map<String, List<String>> filterResponseHeaders(Map<String, List<String>> responseHeaders) {
        Map<String, List<String>> filtered = new LinkedHashMap<>();
        for (var entry : responseHeaders.entrySet()) {
            var lowerName = entry.getKey().toLowerCase(Locale.ROOT);
            if (!HOP_BY_HOP_HEADERS.contains(lowerName) && !"content-length".equals(lowerName)) {
                filtered.put(entry.getKey(), entry.getValue());
            }
        }
        return filtered;
    }

    URI targetUri(GatewayRequest request) {
        var basePath = backendBase.getRawPath() == null ? "" : backendBase.getRawPath();
        if (basePath.endsWith("/")) {
            basePath = basePath.substring(0, basePath.length() - 1);
        }
        var authority = backendBase.getRawAuthority();
        return URI.create(backendBase.getScheme() + "://" + authority + basePath + request.pathWithQuery());
    }

    private Map<String, List<String>> buildHeaders(GatewayRequest request) {
        Map<String, List<String>> headers = new LinkedHashMap<>();

        copyFilteredHeaders(request, headers);
        headers.put(X_FORWARDED_FOR, List.of(request.clientIp()));
        headers.put(X_FORWARDED_PROTO, List.of(request.scheme()));

        return headers;
    }

    private void copyFilteredHeaders(GatewayRequest request, Map<String, List<String>> headers) {
        for (var entry : request.headers().entrySet()) {
            var headerName = entry.getKey();
            var lowerName = headerName.toLowerCase(Locale.ROOT);

            if (shouldSkipHeader(lowerName)) {
                continue;
            }

            headers.put(headerName, new ArrayList<>(entry.getValue()));
        }
    }

    private boolean shouldSkipHeader(String lowerName) {
        if (HOP_BY_HOP_HEADERS.contains(lowerName)) {
            return true;
        }
        // The backend gets its own host from the client
        if ("host".equals(lowerName)) {
            return true;
        }
        // Recomputed by the HTTP client from the body
        if ("content-length".equals(lowerName)) {
            return true;
        }
        // Replaced below with the gateway's view of the client
        return "x-forwarded-for".equals(lowerName) || "x-forwarded-proto".equals(lowerName);
    }
}
