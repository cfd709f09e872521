package warden.adapter.out.http;

import java.io.IOException;
import java.net.URI;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.TimeoutException;

import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import io.opentelemetry.api.OpenTelemetry;
import io.opentelemetry.api.trace.SpanKind;
import io.opentelemetry.api.trace.StatusCode;
import io.opentelemetry.api.trace.Tracer;
import io.opentelemetry.context.Context;
import io.opentelemetry.context.propagation.TextMapPropagator;
import io.opentelemetry.context.propagation.TextMapSetter;
import io.smallrye.mutiny.Uni;
import io.vertx.core.VertxException;
import io.vertx.core.http.HttpMethod;
import io.vertx.ext.web.client.WebClientOptions;
import io.vertx.mutiny.core.Vertx;
import io.vertx.mutiny.core.buffer.Buffer;
import io.vertx.mutiny.ext.web.client.HttpRequest;
import io.vertx.mutiny.ext.web.client.HttpResponse;
import io.vertx.mutiny.ext.web.client.WebClient;
import org.jboss.logging.Logger;

import warden.adapter.out.telemetry.SpanAttributes;
import warden.core.config.BackendConfig;
import warden.core.model.gateway.PreparedProxyRequest;
import warden.core.model.gateway.ProxyResponse;
import warden.core.model.health.DependencyHealth;
import warden.core.port.out.BackendConnectionException;
import warden.core.port.out.ProxyClient;
import warden.core.service.gateway.ProxyRequestPreparer;

/**
 * HTTP adapter for forwarding prepared proxy requests using Vert.x WebClient.
 * All header preparation logic is handled by {@link ProxyRequestPreparer} in core.
 *
 * <p>One pooled client with keep-alive is shared by every request. Transport failures
 * are reported as {@link BackendConnectionException}. The request timeout is enforced on
 * the Vert.x request itself, so an expired call resets its stream and gives the pooled
 * connection back; it fails with a {@link TimeoutException}. W3C Trace Context headers
 * are propagated to the backend.
 */
@ApplicationScoped
public class ProxyHttpClient implements ProxyClient {

    private static final Logger LOG = Logger.getLogger(ProxyHttpClient.class);

    private static final TextMapSetter<HttpRequest<Buffer>> HEADER_SETTER =
            (carrier, key, value) -> carrier.putHeader(key, value);

    private final Vertx vertx;
    private final ProxyRequestPreparer requestPreparer;
    private final BackendConfig config;
    private final Tracer tracer;
    private final TextMapPropagator propagator;
    private WebClient webClient;

    @Inject
    public ProxyHttpClient(
            Vertx vertx, ProxyRequestPreparer requestPreparer, BackendConfig config, OpenTelemetry openTelemetry) {
        this.vertx = vertx;
        this.requestPreparer = requestPreparer;
        this.config = config;
        this.tracer = openTelemetry.getTracer("warden-gateway");
        this.propagator = openTelemetry.getPropagators().getTextMapPropagator();
    }

    @PostConstruct
    void init() {
        final var options = new WebClientOptions()
                .setKeepAlive(true)
                .setMaxPoolSize(config.maxPoolSize())
                .setConnectTimeout((int) config.connectTimeout().toMillis())
                .setFollowRedirects(false)
                .setTryUseCompression(false);
        this.webClient = WebClient.create(vertx, options);
    }

    @PreDestroy
    void close() {
        if (webClient != null) {
            webClient.close();
        }
    }

    @Override
    public Uni<ProxyResponse> forward(PreparedProxyRequest preparedRequest) {
        final var targetUri = preparedRequest.targetUri();
        final var method = HttpMethod.valueOf(preparedRequest.method());

        final var span = tracer.spanBuilder("HTTP " + preparedRequest.method())
                .setSpanKind(SpanKind.CLIENT)
                .setAttribute(SpanAttributes.HTTP_METHOD, preparedRequest.method())
                .setAttribute(SpanAttributes.HTTP_URL, targetUri.toString())
                .setAttribute(SpanAttributes.NET_PEER_NAME, targetUri.getHost())
                .setAttribute(SpanAttributes.NET_PEER_PORT, (long) getPort(targetUri))
                .startSpan();

        final var request = createRequest(method, targetUri).timeout(config.requestTimeout().toMillis());
        applyHeaders(preparedRequest, request);
        propagator.inject(Context.current().with(span), request, HEADER_SETTER);

        return executeRequest(request, preparedRequest.body())
                .map(this::toProxyResponse)
                .onFailure(ProxyHttpClient::isTransportFailure)
                .transform(error -> new BackendConnectionException(
                        "Cannot reach backend at " + targetUri.getAuthority() + ": " + error.getMessage(), error))
                .invoke(response -> {
                    span.setAttribute(SpanAttributes.HTTP_STATUS_CODE, (long) response.statusCode());
                    if (response.statusCode() >= 500) {
                        span.setStatus(StatusCode.ERROR, "HTTP " + response.statusCode());
                    }
                    span.end();
                })
                .onFailure()
                .invoke(error -> {
                    span.setStatus(StatusCode.ERROR, String.valueOf(error.getMessage()));
                    span.recordException(error);
                    span.end();
                })
                .onCancellation()
                .invoke(span::end);
    }

    @Override
    public Uni<DependencyHealth> probeHealth() {
        final var healthUri = healthUri();
        final var timeout = config.healthTimeout();
        return createRequest(HttpMethod.GET, healthUri)
                .send()
                .ifNoItem()
                .after(timeout)
                .failWith(() -> new TimeoutException("Backend health probe timed out after " + timeout))
                .map(response -> {
                    if (response.statusCode() >= 200 && response.statusCode() < 300) {
                        return DependencyHealth.connected();
                    }
                    return DependencyHealth.disconnected("HTTP " + response.statusCode());
                })
                .onFailure()
                .recoverWithItem(error -> {
                    LOG.debugv("Backend health probe failed: {0}", error.getMessage());
                    return DependencyHealth.disconnected(
                            error instanceof TimeoutException ? "timeout" : "connection error");
                });
    }

    URI healthUri() {
        var base = config.url();
        while (base.endsWith("/")) {
            base = base.substring(0, base.length() - 1);
        }
        final var healthPath = config.healthPath().startsWith("/") ? config.healthPath() : "/" + config.healthPath();
        return URI.create(base + healthPath);
    }

    static boolean isTransportFailure(Throwable error) {
        if (error instanceof TimeoutException || error instanceof BackendConnectionException) {
            return false;
        }
        return error instanceof IOException || error instanceof VertxException;
    }

    private int getPort(URI uri) {
        var port = uri.getPort();
        if (port == -1) {
            port = "https".equalsIgnoreCase(uri.getScheme()) ? 443 : 80;
        }
        return port;
    }

    private HttpRequest<Buffer> createRequest(HttpMethod method, URI targetUri) {
        var path = targetUri.getRawPath();
        if (path == null || path.isEmpty()) {
            path = "/";
        }
        if (targetUri.getRawQuery() != null) {
            path += "?" + targetUri.getRawQuery();
        }

        return webClient
                .request(method, getPort(targetUri), targetUri.getHost(), path)
                .ssl("https".equalsIgnoreCase(targetUri.getScheme()));
    }

    private void applyHeaders(PreparedProxyRequest preparedRequest, HttpRequest<Buffer> httpRequest) {
        for (var entry : preparedRequest.headers().entrySet()) {
            for (var value : entry.getValue()) {
                httpRequest.headers().add(entry.getKey(), value);
            }
        }
    }

    private Uni<HttpResponse<Buffer>> executeRequest(HttpRequest<Buffer> request, byte[] body) {
        if (body != null && body.length > 0) {
            return request.sendBuffer(Buffer.buffer(body));
        }

        return request.send();
    }

    private ProxyResponse toProxyResponse(HttpResponse<Buffer> response) {
        Map<String, List<String>> headers = new LinkedHashMap<>();

        for (var name : response.headers().names()) {
            headers.computeIfAbsent(name, k -> new ArrayList<>())
                    .addAll(response.headers().getAll(name));
        }

        final var filteredHeaders = requestPreparer.filterResponseHeaders(headers);
        final var responseBody = response.body() != null ? response.body().getBytes() : new byte[0];

        return new ProxyResponse(
                response.statusCode(), filteredHeaders, responseBody, response.getHeader("Content-Type"));
    }
}
