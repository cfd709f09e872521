package warden.core.service.gateway;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import io.smallrye.mutiny.Uni;
import org.jboss.logging.Logger;

import warden.core.model.gateway.ForwardResult;
import warden.core.model.gateway.GatewayRequest;
import warden.core.model.gateway.GatewayResult;
import warden.core.model.ratelimit.RateLimitDecision;
import warden.core.port.in.GatewayUseCase;
import warden.core.port.out.Metrics;
import warden.core.service.ratelimit.RateLimitService;

/**
 * Handle gateway requests: rate limit first, then forward.
 *
 * <p>Each request moves through {@code Received -> RateChecked -> (Rejected | Admitted)
 * -> (Forwarded | Failed) -> Responded}. A rejected request never reaches the
 * {@link BackendForwarder}, so a 429 never costs a backend call or a concurrency slot.
 *
 * <p>All operations are fully reactive and never block.
 */
@ApplicationScoped
public class GatewayService implements GatewayUseCase {

    private static final Logger LOG = Logger.getLogger(GatewayService.class);

    private final RateLimitService rateLimitService;
    private final BackendForwarder forwarder;
    private final Metrics metrics;

    @Inject
    public GatewayService(RateLimitService rateLimitService, BackendForwarder forwarder, Metrics metrics) {
        this.rateLimitService = rateLimitService;
        this.forwarder = forwarder;
        this.metrics = metrics;
    }

    @Override
    public Uni<GatewayResult> forward(GatewayRequest request) {
        return rateLimitService
                .evaluate(request.clientIp(), request.method())
                .flatMap(decision -> handleDecision(request, decision))
                .onFailure()
                .recoverWithItem(error -> {
                    LOG.errorv(error, "Unexpected gateway failure for {0} {1} from {2}",
                            request.method(), request.path(), request.clientIp());
                    return new GatewayResult.InternalError(String.valueOf(error.getMessage()));
                })
                .invoke(result -> metrics.recordGatewayResult(request.method(), result));
    }

    private Uni<GatewayResult> handleDecision(GatewayRequest request, RateLimitDecision decision) {
        if (!decision.allowed()) {
            LOG.debugv("Rate limit exceeded for {0} {1} from {2} ({3}/{4} in {5}s)",
                    request.method(), request.path(), request.clientIp(),
                    decision.requestCount(), decision.limit(), decision.windowSeconds());
            return Uni.createFrom().item(new GatewayResult.RateLimited(
                    request.method(), decision.limit(), decision.windowSeconds(), decision.retryAfterSeconds()));
        }

        return forwarder.forward(request).map(GatewayService::toResult);
    }

    private static GatewayResult toResult(ForwardResult result) {
        if (result instanceof ForwardResult.Forwarded forwarded) {
            return GatewayResult.Success.from(forwarded.response());
        }
        return GatewayResult.fromFailure((ForwardResult.Failed) result);
    }
}
