package warden.adapter.out.ratelimit.memory;

import java.time.Clock;
import java.time.Duration;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

import io.smallrye.mutiny.Uni;
import org.jboss.logging.Logger;

import warden.core.port.out.CountingStore;

/**
 * In-memory counting store.
 *
 * <p>Counters live in a concurrent map and are only visible to this process, so
 * limits are enforced per instance rather than cluster-wide. Suitable for a single
 * instance, development and tests.
 *
 * <p>Expired counters are reset lazily on the next increment and removed by a
 * periodic sweep.
 */
public final class InMemoryCountingStore implements CountingStore {

    private static final Logger LOG = Logger.getLogger(InMemoryCountingStore.class);

    private final ConcurrentMap<String, Counter> counters = new ConcurrentHashMap<>();
    private final Clock clock;
    private final ScheduledExecutorService sweeper;

    public InMemoryCountingStore(Duration sweepInterval) {
        this(Clock.systemUTC(), sweepInterval);
    }

    public InMemoryCountingStore(Clock clock, Duration sweepInterval) {
        this.clock = clock;
        this.sweeper = Executors.newSingleThreadScheduledExecutor(runnable -> {
            final var thread = new Thread(runnable, "warden-counter-sweeper");
            thread.setDaemon(true);
            return thread;
        });
        final var intervalMs = Math.max(1L, sweepInterval.toMillis());
        sweeper.scheduleAtFixedRate(this::sweep, intervalMs, intervalMs, TimeUnit.MILLISECONDS);
    }

    @Override
    public Uni<Long> incrementAndGet(String key, long windowSeconds) {
        return Uni.createFrom().item(() -> increment(key, windowSeconds));
    }

    long increment(String key, long windowSeconds) {
        final var now = clock.millis();
        final var updated = counters.compute(key, (k, existing) -> {
            if (existing == null || existing.isExpired(now)) {
                return new Counter(1, now + windowSeconds * 1000L);
            }
            return new Counter(existing.count() + 1, existing.expiresAtMillis());
        });
        return updated.count();
    }

    @Override
    public Uni<Boolean> ping() {
        return Uni.createFrom().item(true);
    }

    @Override
    public String name() {
        return "memory";
    }

    /**
     * Remove every expired counter.
     */
    void sweep() {
        final var now = clock.millis();
        final var before = counters.size();
        counters.entrySet().removeIf(entry -> entry.getValue().isExpired(now));
        final var removed = before - counters.size();
        if (removed > 0) {
            LOG.debugv("Swept {0} expired rate limit counters", removed);
        }
    }

    int size() {
        return counters.size();
    }

    /**
     * Stop the background sweep.
     */
    public void shutdown() {
        sweeper.shutdownNow();
    }

    private record Counter(long count, long expiresAtMillis) {

        boolean isExpired(long nowMillis) {
            return nowMillis >= expiresAtMillis;
        }
    }
}
