package warden.adapter.out.ratelimit.redis;

import java.time.Duration;
import java.util.function.Supplier;

import io.smallrye.mutiny.Uni;
import org.jboss.logging.Logger;

import warden.core.port.out.StoreUnavailableException;

/**
 * Bounds Redis round trips with a timeout and normalizes their failures.
 *
 * <ul>
 *   <li>{@link #withTimeout} - fail-fast: any timeout or failure surfaces as
 *       {@link StoreUnavailableException}. Used for counter increments, where the
 *       caller decides the failure policy.</li>
 *   <li>{@link #withTimeoutFallback} - fail-soft: returns a fallback value. Used for
 *       liveness probes, which must never fail.</li>
 * </ul>
 */
public class RedisTimeoutHelper {

    private static final Logger LOG = Logger.getLogger(RedisTimeoutHelper.class);

    private final Duration timeout;

    public RedisTimeoutHelper(Duration timeout) {
        this.timeout = timeout;
    }

    public <T> Uni<T> withTimeout(Uni<T> operation, String operationName) {
        return operation
                .ifNoItem()
                .after(timeout)
                .failWith(() -> {
                    LOG.warnv("Redis operation timeout: {0} after {1}", operationName, timeout);
                    return new StoreUnavailableException(operationName, "timed out after " + timeout);
                })
                .onFailure(error -> !(error instanceof StoreUnavailableException))
                .transform(error -> {
                    LOG.warnv("Redis operation failure: {0}: {1}", operationName, error.getMessage());
                    return new StoreUnavailableException(operationName, error);
                });
    }

    public <T> Uni<T> withTimeoutFallback(Uni<T> operation, String operationName, Supplier<T> fallback) {
        return operation
                .ifNoItem()
                .after(timeout)
                .recoverWithItem(() -> {
                    LOG.debugv("Redis operation timeout (fallback): {0} after {1}", operationName, timeout);
                    return fallback.get();
                })
                .onFailure()
                .recoverWithItem(error -> {
                    LOG.debugv("Redis operation failure (fallback): {0}: {1}", operationName, error.getMessage());
                    return fallback.get();
                });
    }
}
