package warden.core.config;

import java.time.Duration;

import io.smallrye.config.ConfigMapping;
import io.smallrye.config.WithDefault;

/**
 * Configuration mapping for the counting store.
 *
 * <p>Configuration prefix: {@code warden.store}. The Redis connection itself is
 * configured through {@code quarkus.redis.hosts}.
 */
@ConfigMapping(prefix = "warden.store")
public interface StoreConfig {

    /**
     * Store implementation.
     *
     * <p>{@code redis} shares counters across every gateway instance;
     * {@code memory} keeps them local to this process.
     *
     * @return the store type (default: redis)
     */
    @WithDefault("redis")
    StoreType type();

    /**
     * Timeout of a single increment round trip.
     *
     * @return operation timeout (default: 1 second)
     */
    @WithDefault("PT1S")
    Duration timeout();

    /**
     * Timeout of the liveness probe used by the health endpoint.
     *
     * @return probe timeout (default: 1 second)
     */
    @WithDefault("PT1S")
    Duration healthTimeout();

    enum StoreType {
        REDIS,
        MEMORY
    }
}
