package warden.core.port.in;

import io.smallrye.mutiny.Uni;

import warden.core.model.gateway.GatewayRequest;
import warden.core.model.gateway.GatewayResult;

/**
 * Use case for passing a request through the gateway.
 *
 * <p>The request is rate limited per client and method, then forwarded to the
 * backend under the global concurrency cap.
 */
public interface GatewayUseCase {

    /**
     * Forward a request through the gateway.
     *
     * @param request the inbound request
     * @return the gateway result: success, rate limited, or a classified backend failure
     */
    Uni<GatewayResult> forward(GatewayRequest request);
}
