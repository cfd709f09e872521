package warden.adapter.in.problem;

import jakarta.ws.rs.core.Response.Status;

import io.quarkiverse.resteasy.problem.HttpProblem;

/**
 * RFC 7807 Problem Details factory for gateway errors.
 *
 * <p>Messages are fixed per outcome; internal exception text never reaches the client.
 */
public final class GatewayProblem {

    static final String BACKEND_UNAVAILABLE = "Backend service unavailable";
    static final String GATEWAY_TIMEOUT = "Gateway timeout";
    static final String INTERNAL_ERROR = "Internal Gateway error";

    private GatewayProblem() {
        // Utility class - prevent instantiation
    }

    // ========== Rate Limit Errors ==========

    /**
     * Create a 429 Too Many Requests problem.
     *
     * @param limit the limit that was exceeded
     * @param windowSeconds the window length in seconds
     * @param retryAfterSeconds seconds until the client can retry
     * @return rate limit problem
     */
    public static HttpProblem tooManyRequests(long limit, long windowSeconds, long retryAfterSeconds) {
        return HttpProblem.builder()
                .withTitle("Too Many Requests")
                .withStatus(Status.TOO_MANY_REQUESTS)
                .withDetail(rateLimitDetail(limit, windowSeconds, retryAfterSeconds))
                .with("retryAfter", retryAfterSeconds)
                .with("limit", limit)
                .build();
    }

    public static String rateLimitDetail(long limit, long windowSeconds, long retryAfterSeconds) {
        return "Too Many Requests. Limit: %d per %ds. Please retry after %d seconds."
                .formatted(limit, windowSeconds, retryAfterSeconds);
    }

    // ========== Gateway Errors ==========

    public static HttpProblem serviceUnavailable() {
        return HttpProblem.builder()
                .withTitle("Service Unavailable")
                .withStatus(Status.SERVICE_UNAVAILABLE)
                .withDetail(BACKEND_UNAVAILABLE)
                .build();
    }

    public static HttpProblem gatewayTimeout() {
        return HttpProblem.builder()
                .withTitle("Gateway Timeout")
                .withStatus(Status.GATEWAY_TIMEOUT)
                .withDetail(GATEWAY_TIMEOUT)
                .build();
    }

    // ========== Server Errors ==========

    public static HttpProblem internalError() {
        return HttpProblem.builder()
                .withTitle("Internal Server Error")
                .withStatus(Status.INTERNAL_SERVER_ERROR)
                .withDetail(INTERNAL_ERROR)
                .build();
    }
}
