package warden.core.port.in;

import io.smallrye.mutiny.Uni;

import warden.core.model.health.GatewayHealth;

/**
 * Use case for reporting gateway health.
 */
public interface GatewayHealthUseCase {

    /**
     * Probe the counting store and the backend and combine the results with the
     * current request counters.
     *
     * @return the gateway health; never fails
     */
    Uni<GatewayHealth> check();
}
