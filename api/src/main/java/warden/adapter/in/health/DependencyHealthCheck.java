package warden.adapter.in.health;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import io.smallrye.health.api.AsyncHealthCheck;
import io.smallrye.mutiny.Uni;
import org.eclipse.microprofile.health.HealthCheckResponse;
import org.eclipse.microprofile.health.Readiness;

import warden.core.model.health.HealthStatus;
import warden.core.port.in.GatewayHealthUseCase;

/**
 * Readiness check over the counting store and the backend.
 *
 * <p>A single dependency outage leaves the gateway ready: a store outage is absorbed by
 * the store failure policy and a backend outage is reported per request. Only when both
 * are down is the instance taken out of rotation.
 */
@Readiness
@ApplicationScoped
public class DependencyHealthCheck implements AsyncHealthCheck {

    private final GatewayHealthUseCase healthUseCase;

    @Inject
    public DependencyHealthCheck(GatewayHealthUseCase healthUseCase) {
        this.healthUseCase = healthUseCase;
    }

    @Override
    public Uni<HealthCheckResponse> call() {
        return healthUseCase.check().map(health -> HealthCheckResponse.named("gateway-dependencies")
                .status(health.status() != HealthStatus.UNHEALTHY)
                .withData("status", health.status().name())
                .withData("store", health.store().detail())
                .withData("backend", health.backend().detail())
                .build());
    }
}
