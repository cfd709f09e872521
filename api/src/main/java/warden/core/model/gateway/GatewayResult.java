package warden.core.model.gateway;

import java.util.List;
import java.util.Map;

public sealed interface GatewayResult {

    record Success(int statusCode, Map<String, List<String>> headers, byte[] body, String contentType)
            implements GatewayResult {
        public Success {
            if (headers == null) {
                headers = Map.of();
            }
            if (body == null) {
                body = new byte[0];
            }
        }

        public static Success from(ProxyResponse response) {
            return new Success(response.statusCode(), response.headers(), response.body(), response.contentType());
        }
    }

    record RateLimited(String method, long limit, long windowSeconds, long retryAfterSeconds)
            implements GatewayResult {}

    record BackendUnavailable(String message) implements GatewayResult {}

    record BackendTimeout(String message) implements GatewayResult {}

    record InternalError(String message) implements GatewayResult {}

    /**
     * Converts a failed forwarding attempt into the matching result type.
     */
    static GatewayResult fromFailure(ForwardResult.Failed failed) {
        return switch (failed.failure()) {
            case BACKEND_UNAVAILABLE -> new BackendUnavailable(failed.message());
            case BACKEND_TIMEOUT -> new BackendTimeout(failed.message());
            case INTERNAL_ERROR -> new InternalError(failed.message());
        };
    }
}
