package warden.core.config;

import java.util.Map;

import io.smallrye.config.ConfigMapping;
import io.smallrye.config.WithDefault;

import warden.core.model.ratelimit.StoreFailurePolicy;
import warden.core.model.ratelimit.UnconfiguredMethodPolicy;

/**
 * Configuration mapping for per-client, per-method rate limiting.
 *
 * <p>Configuration prefix: {@code warden.rate-limiting}
 *
 * <p>Limits are keyed by upper-case HTTP method:
 * <pre>
 * warden.rate-limiting.limits.GET=5
 * warden.rate-limiting.limits.POST=5
 * </pre>
 */
@ConfigMapping(prefix = "warden.rate-limiting")
public interface RateLimitingConfig {

    /**
     * Maximum requests per window, keyed by HTTP method.
     *
     * @return the per-method limits
     */
    Map<String, Long> limits();

    /**
     * Fixed window duration in seconds.
     *
     * @return window seconds (default: 60)
     */
    @WithDefault("60")
    long windowSeconds();

    /**
     * Policy for methods absent from {@link #limits()}.
     *
     * @return the policy (default: ALLOW)
     */
    @WithDefault("ALLOW")
    UnconfiguredMethodPolicy unconfiguredMethodPolicy();

    /**
     * Policy applied when the counting store is unreachable.
     *
     * @return the policy (default: FAIL_OPEN)
     */
    @WithDefault("FAIL_OPEN")
    StoreFailurePolicy storeFailurePolicy();

    /**
     * Prefix of every counter key in the store.
     *
     * <p>Allows several gateways to share one Redis instance.
     *
     * @return key prefix (default: "warden:ratelimit:")
     */
    @WithDefault("warden:ratelimit:")
    String keyPrefix();
}
