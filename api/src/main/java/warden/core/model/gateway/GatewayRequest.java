package warden.core.model.gateway;

import java.util.List;
import java.util.Map;

/**
 * A single inbound request as seen by the gateway.
 *
 * @param method the HTTP method
 * @param path the request path, always starting with {@code /}
 * @param rawQuery the raw (still encoded) query string, or null when absent
 * @param headers a copy of the inbound headers
 * @param body the request body, empty when absent
 * @param clientIp the originator's address, {@code unknown} when undeterminable
 * @param scheme the inbound scheme ({@code http} or {@code https})
 */
public record GatewayRequest(
        String method,
        String path,
        String rawQuery,
        Map<String, List<String>> headers,
        byte[] body,
        String clientIp,
        String scheme) {

    public static final String UNKNOWN_CLIENT = "unknown";

    public GatewayRequest {
        if (method == null || method.isBlank()) {
            throw new IllegalArgumentException("method is required");
        }
        if (path == null || path.isEmpty()) {
            path = "/";
        }
        if (rawQuery != null && rawQuery.isEmpty()) {
            rawQuery = null;
        }
        if (headers == null) {
            headers = Map.of();
        }
        if (body == null) {
            body = new byte[0];
        }
        if (clientIp == null || clientIp.isBlank()) {
            clientIp = UNKNOWN_CLIENT;
        }
        if (scheme == null || scheme.isBlank()) {
            scheme = "http";
        }
    }

    /**
     * Path plus query string, as it should be requested from the backend.
     */
    public String pathWithQuery() {
        return rawQuery == null ? path : path + "?" + rawQuery;
    }
}
