package warden.core.service.gateway;

import java.time.Duration;
import java.util.concurrent.TimeoutException;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import io.smallrye.mutiny.Uni;
import org.jboss.logging.Logger;

import warden.core.config.BackendConfig;
import warden.core.model.gateway.ForwardFailure;
import warden.core.model.gateway.ForwardResult;
import warden.core.model.gateway.GatewayRequest;
import warden.core.model.gateway.ProxyResponse;
import warden.core.port.out.BackendConnectionException;
import warden.core.port.out.Metrics;
import warden.core.port.out.ProxyClient;
import warden.core.service.admission.AdmissionController;

/**
 * Forwards admitted requests to the backend under the global concurrency cap.
 *
 * <p>Each call is a single attempt bounded by the configured request timeout; the
 * timeout starts once a concurrency slot is held. Failures are classified rather than
 * propagated:
 * <ul>
 *   <li>transport failure: {@link ForwardFailure#BACKEND_UNAVAILABLE}</li>
 *   <li>timeout: {@link ForwardFailure#BACKEND_TIMEOUT}</li>
 *   <li>anything else: {@link ForwardFailure#INTERNAL_ERROR}</li>
 * </ul>
 */
@ApplicationScoped
public class BackendForwarder {

    private static final Logger LOG = Logger.getLogger(BackendForwarder.class);

    private final ProxyRequestPreparer requestPreparer;
    private final ProxyClient proxyClient;
    private final AdmissionController admissionController;
    private final Metrics metrics;
    private final Duration requestTimeout;

    @Inject
    public BackendForwarder(
            ProxyRequestPreparer requestPreparer,
            ProxyClient proxyClient,
            AdmissionController admissionController,
            Metrics metrics,
            BackendConfig config) {
        this(requestPreparer, proxyClient, admissionController, metrics, config.requestTimeout());
    }

    public BackendForwarder(
            ProxyRequestPreparer requestPreparer,
            ProxyClient proxyClient,
            AdmissionController admissionController,
            Metrics metrics,
            Duration requestTimeout) {
        this.requestPreparer = requestPreparer;
        this.proxyClient = proxyClient;
        this.admissionController = admissionController;
        this.metrics = metrics;
        this.requestTimeout = requestTimeout;
    }

    /**
     * Forward a request to the backend.
     *
     * @param request the inbound request
     * @return the backend response, or the classified failure; never fails
     */
    public Uni<ForwardResult> forward(GatewayRequest request) {
        return admissionController
                .withSlot(() -> call(request))
                .map(response -> (ForwardResult) new ForwardResult.Forwarded(response))
                .onFailure()
                .recoverWithItem(error -> classify(request, error));
    }

    private Uni<ProxyResponse> call(GatewayRequest request) {
        final long startTime = System.nanoTime();
        final var prepared = requestPreparer.prepare(request);
        LOG.debugv("Proxying {0} {1} from {2} to {3}",
                request.method(), request.pathWithQuery(), request.clientIp(), prepared.targetUri());

        // Outer bound; the client adapter also enforces the timeout on the connection
        return proxyClient
                .forward(prepared)
                .ifNoItem()
                .after(requestTimeout)
                .failWith(() -> new TimeoutException("No backend response within " + requestTimeout))
                .invoke(response -> metrics.recordProxyLatency(
                        request.method(), response.statusCode(), (System.nanoTime() - startTime) / 1_000_000));
    }

    private ForwardResult classify(GatewayRequest request, Throwable error) {
        if (error instanceof TimeoutException) {
            LOG.errorv("Backend timeout for {0} {1} from {2}: {3}",
                    request.method(), request.path(), request.clientIp(), error.getMessage());
            return new ForwardResult.Failed(ForwardFailure.BACKEND_TIMEOUT, error.getMessage());
        }
        if (error instanceof BackendConnectionException) {
            LOG.errorv("Backend unavailable for {0} {1} from {2}: {3}",
                    request.method(), request.path(), request.clientIp(), error.getMessage());
            return new ForwardResult.Failed(ForwardFailure.BACKEND_UNAVAILABLE, error.getMessage());
        }
        LOG.errorv(error, "Unexpected error forwarding {0} {1} from {2}",
                request.method(), request.path(), request.clientIp());
        return new ForwardResult.Failed(ForwardFailure.INTERNAL_ERROR, String.valueOf(error.getMessage()));
    }
}
