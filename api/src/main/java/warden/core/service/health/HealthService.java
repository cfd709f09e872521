package warden.core.service.health;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import io.smallrye.mutiny.Uni;
import org.jboss.logging.Logger;

import warden.core.model.health.DependencyHealth;
import warden.core.model.health.GatewayHealth;
import warden.core.port.in.GatewayHealthUseCase;
import warden.core.port.out.CountingStore;
import warden.core.port.out.Metrics;
import warden.core.port.out.ProxyClient;

/**
 * Reports gateway health from two bounded probes: the counting store and the backend.
 *
 * <p>Both probes run concurrently and carry their own timeouts, so a hung dependency
 * degrades the report instead of hanging it.
 */
@ApplicationScoped
public class HealthService implements GatewayHealthUseCase {

    private static final Logger LOG = Logger.getLogger(HealthService.class);

    private final CountingStore store;
    private final ProxyClient proxyClient;
    private final Metrics metrics;

    @Inject
    public HealthService(CountingStore store, ProxyClient proxyClient, Metrics metrics) {
        this.store = store;
        this.proxyClient = proxyClient;
        this.metrics = metrics;
    }

    @Override
    public Uni<GatewayHealth> check() {
        return Uni.combine()
                .all()
                .unis(probeStore(), probeBackend())
                .asTuple()
                .map(probes -> GatewayHealth.of(probes.getItem1(), probes.getItem2(), metrics.snapshot()));
    }

    private Uni<DependencyHealth> probeStore() {
        return store.ping()
                .map(up -> up ? DependencyHealth.connected() : DependencyHealth.disconnected("no answer"))
                .onFailure()
                .recoverWithItem(error -> {
                    LOG.errorv("Counting store health check failed: {0}", error.getMessage());
                    return DependencyHealth.disconnected("error");
                });
    }

    private Uni<DependencyHealth> probeBackend() {
        return proxyClient
                .probeHealth()
                .onFailure()
                .recoverWithItem(error -> {
                    LOG.errorv("Backend health check failed: {0}", error.getMessage());
                    return DependencyHealth.disconnected("error");
                });
    }
}
