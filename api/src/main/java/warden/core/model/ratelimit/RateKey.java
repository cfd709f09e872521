package warden.core.model.ratelimit;

import java.util.Locale;
import java.util.Objects;

/**
 * Identifies a fixed-window counter for one client and HTTP method.
 *
 * <p>Windows are aligned to epoch boundaries: the window index is
 * {@code floor(epochSeconds / windowSeconds)}, so every gateway instance
 * computes the same key for the same instant.
 *
 * <p>Key format: {@code {prefix}{clientId}:{METHOD}:{windowIndex}}
 *
 * @param clientId the client identity (remote IP or {@code unknown})
 * @param method the upper-cased HTTP method
 * @param windowIndex the fixed window index
 */
public record RateKey(String clientId, String method, long windowIndex) {

    public RateKey {
        Objects.requireNonNull(clientId, "clientId must not be null");
        Objects.requireNonNull(method, "method must not be null");
        if (clientId.isBlank()) {
            throw new IllegalArgumentException("clientId must not be blank");
        }
        method = method.toUpperCase(Locale.ROOT);
    }

    /**
     * Creates the key for the window containing the given instant.
     *
     * @param clientId the client identity
     * @param method the HTTP method
     * @param epochSeconds the current time in epoch seconds
     * @param windowSeconds the window duration in seconds
     * @return the rate key
     */
    public static RateKey forWindow(String clientId, String method, long epochSeconds, long windowSeconds) {
        if (windowSeconds <= 0) {
            throw new IllegalArgumentException("windowSeconds must be positive");
        }
        return new RateKey(clientId, method, Math.floorDiv(epochSeconds, windowSeconds));
    }

    /**
     * Converts this key to the store key string.
     *
     * @param prefix the namespace prefix, e.g. {@code warden:ratelimit:}
     * @return the store key
     */
    public String toStoreKey(String prefix) {
        return prefix + clientId + ":" + method + ":" + windowIndex;
    }
}
