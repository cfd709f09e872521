package warden.adapter.in.rest;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import jakarta.ws.rs.DELETE;
import jakarta.ws.rs.GET;
import jakarta.ws.rs.HEAD;
import jakarta.ws.rs.OPTIONS;
import jakarta.ws.rs.PATCH;
import jakarta.ws.rs.POST;
import jakarta.ws.rs.PUT;
import jakarta.ws.rs.Path;
import jakarta.ws.rs.container.ContainerRequestContext;
import jakarta.ws.rs.core.Context;
import jakarta.ws.rs.core.HttpHeaders;
import jakarta.ws.rs.core.Response;

import io.smallrye.mutiny.Uni;
import io.vertx.core.http.HttpServerRequest;

import warden.adapter.in.problem.GatewayProblem;
import warden.core.model.gateway.GatewayRequest;
import warden.core.model.gateway.GatewayResult;
import warden.core.port.in.GatewayUseCase;

/**
 * Catch-all proxy endpoint.
 *
 * <p>Every path and method not claimed by another resource is rate limited and
 * forwarded to the backend. The raw path, query and body are forwarded unchanged
 * for every method.
 */
@Path("/")
@ApplicationScoped
public class GatewayResource {

    private static final String PROBLEM_JSON = "application/problem+json";

    private final GatewayUseCase gatewayUseCase;

    @Context
    HttpServerRequest serverRequest;

    @Inject
    public GatewayResource(GatewayUseCase gatewayUseCase) {
        this.gatewayUseCase = gatewayUseCase;
    }

    @GET
    @Path("{path:.*}")
    public Uni<Response> proxyGet(@Context ContainerRequestContext requestContext, byte[] body) {
        return proxyRequest(requestContext, body);
    }

    @POST
    @Path("{path:.*}")
    public Uni<Response> proxyPost(@Context ContainerRequestContext requestContext, byte[] body) {
        return proxyRequest(requestContext, body);
    }

    @PUT
    @Path("{path:.*}")
    public Uni<Response> proxyPut(@Context ContainerRequestContext requestContext, byte[] body) {
        return proxyRequest(requestContext, body);
    }

    @DELETE
    @Path("{path:.*}")
    public Uni<Response> proxyDelete(@Context ContainerRequestContext requestContext, byte[] body) {
        return proxyRequest(requestContext, body);
    }

    @PATCH
    @Path("{path:.*}")
    public Uni<Response> proxyPatch(@Context ContainerRequestContext requestContext, byte[] body) {
        return proxyRequest(requestContext, body);
    }

    @HEAD
    @Path("{path:.*}")
    public Uni<Response> proxyHead(@Context ContainerRequestContext requestContext, byte[] body) {
        return proxyRequest(requestContext, body);
    }

    @OPTIONS
    @Path("{path:.*}")
    public Uni<Response> proxyOptions(@Context ContainerRequestContext requestContext, byte[] body) {
        return proxyRequest(requestContext, body);
    }

    private Uni<Response> proxyRequest(ContainerRequestContext requestContext, byte[] body) {
        final var requestUri = requestContext.getUriInfo().getRequestUri();

        Map<String, List<String>> headers = new LinkedHashMap<>();
        requestContext.getHeaders().forEach((name, values) -> headers.put(name, new ArrayList<>(values)));

        final var request = new GatewayRequest(
                requestContext.getMethod(),
                requestUri.getRawPath(),
                requestUri.getRawQuery(),
                headers,
                body,
                clientIp(),
                requestUri.getScheme());

        return gatewayUseCase.forward(request).map(this::toResponse);
    }

    private String clientIp() {
        if (serverRequest == null || serverRequest.remoteAddress() == null) {
            return GatewayRequest.UNKNOWN_CLIENT;
        }
        final var host = serverRequest.remoteAddress().host();
        return host != null ? host : GatewayRequest.UNKNOWN_CLIENT;
    }

    private Response toResponse(GatewayResult result) {
        if (result instanceof GatewayResult.Success success) {
            final var builder = Response.status(success.statusCode());
            success.headers().forEach((name, values) -> {
                if (!HttpHeaders.CONTENT_TYPE.equalsIgnoreCase(name)) {
                    values.forEach(value -> builder.header(name, value));
                }
            });
            builder.header(HttpHeaders.CONTENT_TYPE, success.contentType());
            if (success.body().length > 0) {
                builder.entity(success.body());
            }
            return builder.build();
        }

        if (result instanceof GatewayResult.RateLimited limited) {
            return Response.status(Response.Status.TOO_MANY_REQUESTS)
                    .header("Retry-After", limited.retryAfterSeconds())
                    .type(PROBLEM_JSON)
                    .entity(GatewayProblem.tooManyRequests(
                            limited.limit(), limited.windowSeconds(), limited.retryAfterSeconds()))
                    .build();
        }

        if (result instanceof GatewayResult.BackendUnavailable) {
            throw GatewayProblem.serviceUnavailable();
        }

        if (result instanceof GatewayResult.BackendTimeout) {
            throw GatewayProblem.gatewayTimeout();
        }

        throw GatewayProblem.internalError();
    }
}
