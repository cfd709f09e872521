package warden.adapter.in.rest;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import jakarta.ws.rs.GET;
import jakarta.ws.rs.Path;
import jakarta.ws.rs.Produces;
import jakarta.ws.rs.core.MediaType;

import io.smallrye.mutiny.Uni;

import warden.adapter.in.dto.HealthResponse;
import warden.core.port.in.GatewayHealthUseCase;

/**
 * Gateway health endpoint.
 *
 * <p>Always answers 200; the overall status and each dependency are reported in the body.
 * The request is not rate limited and does not count toward the gateway metrics.
 */
@Path("/health")
@ApplicationScoped
public class HealthResource {

    private final GatewayHealthUseCase healthUseCase;

    @Inject
    public HealthResource(GatewayHealthUseCase healthUseCase) {
        this.healthUseCase = healthUseCase;
    }

    @GET
    @Produces(MediaType.APPLICATION_JSON)
    public Uni<HealthResponse> health() {
        return healthUseCase.check().map(HealthResponse::fromModel);
    }
}
