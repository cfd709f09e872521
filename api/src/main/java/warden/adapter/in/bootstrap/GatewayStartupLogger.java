package warden.adapter.in.bootstrap;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.event.Observes;
import jakarta.inject.Inject;

import io.quarkus.runtime.StartupEvent;
import org.jboss.logging.Logger;

import warden.core.config.AdmissionConfig;
import warden.core.config.BackendConfig;
import warden.core.config.RateLimitingConfig;
import warden.core.port.out.CountingStore;
import warden.core.service.ratelimit.RateLimitService;

/**
 * Logs the effective gateway configuration on startup and checks the counting store.
 *
 * <p>An unreachable store does not stop startup; requests are then handled by the
 * store failure policy.
 */
@ApplicationScoped
public class GatewayStartupLogger {

    private static final Logger LOG = Logger.getLogger(GatewayStartupLogger.class);

    private final BackendConfig backendConfig;
    private final AdmissionConfig admissionConfig;
    private final RateLimitingConfig rateLimitingConfig;
    private final RateLimitService rateLimitService;
    private final CountingStore countingStore;

    @Inject
    public GatewayStartupLogger(
            BackendConfig backendConfig,
            AdmissionConfig admissionConfig,
            RateLimitingConfig rateLimitingConfig,
            RateLimitService rateLimitService,
            CountingStore countingStore) {
        this.backendConfig = backendConfig;
        this.admissionConfig = admissionConfig;
        this.rateLimitingConfig = rateLimitingConfig;
        this.rateLimitService = rateLimitService;
        this.countingStore = countingStore;
    }

    void onStart(@Observes StartupEvent event) {
        LOG.infov("Forwarding to backend {0} (request timeout {1})", backendConfig.url(), backendConfig.requestTimeout());
        LOG.infov(
                "Rate limits {0} per {1}s window, unconfigured methods: {2}, store failures: {3}",
                rateLimitService.limits(),
                rateLimitService.windowSeconds(),
                rateLimitingConfig.unconfiguredMethodPolicy(),
                rateLimitingConfig.storeFailurePolicy());
        LOG.infov("Backend concurrency capped at {0} requests", admissionConfig.maxConcurrentRequests());

        countingStore.ping().subscribe().with(up -> {
            if (up) {
                LOG.infov("Counting store ({0}) is reachable", countingStore.name());
            } else {
                LOG.error("========================================");
                LOG.errorv("CRITICAL: counting store ({0}) is unreachable", countingStore.name());
                LOG.errorv("Rate limiting falls back to {0}", rateLimitingConfig.storeFailurePolicy());
                LOG.error("========================================");
            }
        });
    }
}
