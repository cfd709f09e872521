package warden.core.port.out;

import io.smallrye.mutiny.Uni;

import warden.core.model.gateway.PreparedProxyRequest;
import warden.core.model.gateway.ProxyResponse;
import warden.core.model.health.DependencyHealth;

public interface ProxyClient {

    /**
     * Send a prepared request to the backend.
     *
     * <p>Transport failures are reported as {@link BackendConnectionException}. The
     * caller applies the request timeout.
     *
     * @param request the prepared request
     * @return the backend response
     */
    Uni<ProxyResponse> forward(PreparedProxyRequest request);

    /**
     * Call the backend's health endpoint with a bounded timeout.
     *
     * <p>Never fails; any error is reported as a disconnected dependency.
     *
     * @return the backend's health
     */
    Uni<DependencyHealth> probeHealth();
}
