package warden.core.port.out;

import io.smallrye.mutiny.Uni;

/**
 * Port interface for the shared counting store behind rate limiting.
 *
 * <p>Counters are addressed by opaque string keys and expire on their own, so stale
 * windows never need an explicit sweep. Implementations must be safe for concurrent
 * callers across every gateway process.
 */
public interface CountingStore {

    /**
     * Atomically increment the counter for {@code key} and return the new value.
     *
     * <p>When the increment creates the counter, it is set to expire after
     * {@code windowSeconds}. Increment and expiry happen in one atomic step so that
     * concurrent creators can never extend the TTL indefinitely.
     *
     * @param key the counter key
     * @param windowSeconds lifetime of a newly created counter
     * @return the counter value after the increment; fails with
     *     {@link StoreUnavailableException} when the store cannot be reached
     */
    Uni<Long> incrementAndGet(String key, long windowSeconds);

    /**
     * Probe the store's liveness.
     *
     * <p>Never fails and never waits longer than the configured probe timeout.
     *
     * @return true if the store answered
     */
    Uni<Boolean> ping();

    /**
     * Short name for logging, e.g. {@code redis} or {@code memory}.
     */
    String name();
}
