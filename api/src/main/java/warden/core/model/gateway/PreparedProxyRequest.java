package warden.core.model.gateway;

import java.net.URI;
import java.util.List;
import java.util.Map;

/**
 * A fully prepared outbound request.
 * This includes:
 * - Original headers with Host, Content-Length and hop-by-hop headers removed
 * - X-Forwarded-For and X-Forwarded-Proto set for the originating client
 * - The original query string reattached to the target URI
 */
public record PreparedProxyRequest(String method, URI targetUri, Map<String, List<String>> headers, byte[] body) {

    public PreparedProxyRequest {
        if (method == null || method.isBlank()) {
            throw new IllegalArgumentException("method is required");
        }
        if (targetUri == null) {
            throw new IllegalArgumentException("targetUri is required");
        }
        if (headers == null) {
            headers = Map.of();
        }
        if (body == null) {
            body = new byte[0];
        }
    }
}
