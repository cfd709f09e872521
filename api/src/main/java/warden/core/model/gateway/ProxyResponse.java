package warden.core.model.gateway;

import java.util.List;
import java.util.Map;

public record ProxyResponse(int statusCode, Map<String, List<String>> headers, byte[] body, String contentType) {

    public static final String DEFAULT_CONTENT_TYPE = "application/json";

    public ProxyResponse {
        if (headers == null) {
            headers = Map.of();
        }
        if (body == null) {
            body = new byte[0];
        }
        if (contentType == null || contentType.isBlank()) {
            contentType = DEFAULT_CONTENT_TYPE;
        }
    }
}
