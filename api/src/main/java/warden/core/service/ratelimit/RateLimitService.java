package warden.core.service.ratelimit;

import java.time.Clock;
import java.util.HashMap;
import java.util.Locale;
import java.util.Map;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import io.smallrye.mutiny.Uni;
import org.jboss.logging.Logger;

import warden.core.config.RateLimitingConfig;
import warden.core.model.ratelimit.RateKey;
import warden.core.model.ratelimit.RateLimitDecision;
import warden.core.model.ratelimit.StoreFailurePolicy;
import warden.core.model.ratelimit.UnconfiguredMethodPolicy;
import warden.core.port.out.CountingStore;
import warden.core.port.out.Metrics;
import warden.core.port.out.StoreUnavailableException;

/**
 * Fixed-window rate limiting per client identity and HTTP method.
 *
 * <p>Every evaluation is a fresh round trip to the {@link CountingStore}; no rate
 * state is cached locally, so all gateway instances share the same counters.
 *
 * <p>The fixed window lets a client burst up to twice its limit across a window
 * boundary (the tail of one window plus the head of the next). This is accepted.
 *
 * <p>Metrics: every evaluation counts as processed, every rejection additionally
 * counts as blocked.
 */
@ApplicationScoped
public class RateLimitService {

    private static final Logger LOG = Logger.getLogger(RateLimitService.class);

    private final CountingStore store;
    private final Metrics metrics;
    private final Map<String, Long> limits;
    private final long windowSeconds;
    private final UnconfiguredMethodPolicy unconfiguredMethodPolicy;
    private final StoreFailurePolicy storeFailurePolicy;
    private final String keyPrefix;
    private final Clock clock;

    @Inject
    public RateLimitService(CountingStore store, Metrics metrics, RateLimitingConfig config) {
        this(store, metrics, config, Clock.systemUTC());
    }

    public RateLimitService(CountingStore store, Metrics metrics, RateLimitingConfig config, Clock clock) {
        if (config.windowSeconds() <= 0) {
            throw new IllegalArgumentException("warden.rate-limiting.window-seconds must be positive");
        }
        this.store = store;
        this.metrics = metrics;
        this.limits = normalizeLimits(config.limits());
        this.windowSeconds = config.windowSeconds();
        this.unconfiguredMethodPolicy = config.unconfiguredMethodPolicy();
        this.storeFailurePolicy = config.storeFailurePolicy();
        this.keyPrefix = config.keyPrefix();
        this.clock = clock;
    }

    /**
     * Decide whether a request from {@code clientId} using {@code method} is admitted.
     *
     * @param clientId the client identity
     * @param method the HTTP method
     * @return the decision; never fails on store outages, which follow the configured policy
     */
    public Uni<RateLimitDecision> evaluate(String clientId, String method) {
        return Uni.createFrom().deferred(() -> {
            metrics.recordRequestProcessed();

            final var normalizedMethod = method.toUpperCase(Locale.ROOT);
            final var limit = limits.get(normalizedMethod);
            if (limit == null) {
                return Uni.createFrom().item(record(unconfigured(normalizedMethod)));
            }

            final var key = RateKey.forWindow(
                    clientId, normalizedMethod, clock.instant().getEpochSecond(), windowSeconds);

            return store.incrementAndGet(key.toStoreKey(keyPrefix), windowSeconds)
                    .map(count -> decide(count, limit))
                    .onFailure(StoreUnavailableException.class)
                    .recoverWithItem(error -> onStoreUnavailable(clientId, normalizedMethod, limit, error))
                    .map(this::record);
        });
    }

    public long windowSeconds() {
        return windowSeconds;
    }

    public Map<String, Long> limits() {
        return limits;
    }

    private RateLimitDecision decide(long count, long limit) {
        if (count > limit) {
            return RateLimitDecision.rejected(limit, windowSeconds, count);
        }
        return RateLimitDecision.allow(limit, windowSeconds, count);
    }

    private RateLimitDecision unconfigured(String method) {
        if (unconfiguredMethodPolicy == UnconfiguredMethodPolicy.REJECT) {
            LOG.debugv("No rate limit configured for {0}, rejecting", method);
            return RateLimitDecision.rejected(0, windowSeconds, 0);
        }
        return RateLimitDecision.allowUncounted(windowSeconds);
    }

    private RateLimitDecision onStoreUnavailable(String clientId, String method, long limit, Throwable error) {
        metrics.recordStoreFailure("increment");
        if (storeFailurePolicy == StoreFailurePolicy.FAIL_CLOSED) {
            LOG.warnv("Counting store unavailable, rejecting {0} from {1}: {2}", method, clientId, error.getMessage());
            return RateLimitDecision.rejected(limit, windowSeconds, 0);
        }
        LOG.warnv("Counting store unavailable, admitting {0} from {1}: {2}", method, clientId, error.getMessage());
        return RateLimitDecision.allowUncounted(windowSeconds);
    }

    private RateLimitDecision record(RateLimitDecision decision) {
        if (!decision.allowed()) {
            metrics.recordRequestBlocked();
        }
        return decision;
    }

    private static Map<String, Long> normalizeLimits(Map<String, Long> configured) {
        final Map<String, Long> normalized = new HashMap<>();
        if (configured == null) {
            return Map.of();
        }
        for (var entry : configured.entrySet()) {
            if (entry.getValue() == null || entry.getValue() < 0) {
                throw new IllegalArgumentException(
                        "warden.rate-limiting.limits." + entry.getKey() + " must be zero or positive");
            }
            normalized.put(entry.getKey().toUpperCase(Locale.ROOT), entry.getValue());
        }
        return Map.copyOf(normalized);
    }
}
