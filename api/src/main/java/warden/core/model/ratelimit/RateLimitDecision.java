package warden.core.model.ratelimit;

/**
 * Result of a rate limit evaluation.
 *
 * @param allowed whether the request is admitted
 * @param limit the configured limit for the method (0 when the method is not allowed at all)
 * @param windowSeconds the window duration in seconds
 * @param requestCount requests counted in the current window, including this one
 * @param retryAfterSeconds seconds until the client may retry (only meaningful when rejected)
 */
public record RateLimitDecision(
        boolean allowed, long limit, long windowSeconds, long requestCount, long retryAfterSeconds) {

    /**
     * An admission that was not counted against any limit.
     *
     * <p>Used for methods without a configured limit and for fail-open store failures.
     */
    public static RateLimitDecision allowUncounted(long windowSeconds) {
        return new RateLimitDecision(true, Long.MAX_VALUE, windowSeconds, 0, 0);
    }

    public static RateLimitDecision allow(long limit, long windowSeconds, long requestCount) {
        return new RateLimitDecision(true, limit, windowSeconds, requestCount, 0);
    }

    /**
     * A rejection. Clients are told to retry after one full window.
     */
    public static RateLimitDecision rejected(long limit, long windowSeconds, long requestCount) {
        return new RateLimitDecision(false, limit, windowSeconds, requestCount, windowSeconds);
    }
}
