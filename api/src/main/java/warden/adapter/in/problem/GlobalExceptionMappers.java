package warden.adapter.in.problem;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.ws.rs.core.Response;

import io.quarkiverse.resteasy.problem.HttpProblem;
import org.jboss.logging.Logger;
import org.jboss.resteasy.reactive.server.ServerExceptionMapper;

import warden.core.port.out.BackendConnectionException;
import warden.core.port.out.StoreUnavailableException;

/**
 * Global exception mappers for converting stray exceptions to RFC 7807 Problem Details.
 *
 * <p>The gateway pipeline reports failures as typed results, so these only fire when an
 * adapter exception escapes it. The response never carries the exception text.
 */
@ApplicationScoped
public class GlobalExceptionMappers {

    private static final Logger LOG = Logger.getLogger(GlobalExceptionMappers.class);
    private static final String PROBLEM_JSON = "application/problem+json";

    @ServerExceptionMapper
    public Response mapBackendConnectionException(BackendConnectionException e) {
        LOG.errorv("Unhandled backend connection failure: {0}", e.getMessage());
        return toResponse(GatewayProblem.serviceUnavailable());
    }

    @ServerExceptionMapper
    public Response mapStoreUnavailableException(StoreUnavailableException e) {
        LOG.errorv("Unhandled counting store failure: {0}", e.getMessage());
        return toResponse(GatewayProblem.internalError());
    }

    private Response toResponse(HttpProblem problem) {
        return Response.status(problem.getStatus())
                .type(PROBLEM_JSON)
                .entity(problem)
                .build();
    }
}
