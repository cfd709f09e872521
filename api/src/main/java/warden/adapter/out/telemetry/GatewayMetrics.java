package warden.adapter.out.telemetry;

import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;

import jakarta.annotation.PostConstruct;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.FunctionCounter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;

import warden.core.model.gateway.GatewayResult;
import warden.core.model.health.MetricsSnapshot;
import warden.core.port.out.Metrics;
import warden.core.service.admission.AdmissionController;

/**
 * Records gateway metrics using Micrometer.
 *
 * <p>The processed and blocked totals are kept in process-local counters so the health
 * endpoint can report them; they are exported to the registry as function counters.
 *
 * <p>Metrics recorded:
 * <ul>
 *   <li>{@code warden.requests.processed} - Requests that reached the rate limiter</li>
 *   <li>{@code warden.requests.blocked} - Requests rejected by the rate limiter</li>
 *   <li>{@code warden.gateway.results} - Gateway result types by method</li>
 *   <li>{@code warden.proxy.latency} - Backend response latency</li>
 *   <li>{@code warden.store.failures} - Counting store failures by operation</li>
 *   <li>{@code warden.admission.*} - In-flight, waiting and capacity gauges</li>
 * </ul>
 */
@ApplicationScoped
public class GatewayMetrics implements Metrics {

    private final MeterRegistry registry;
    private final AdmissionController admissionController;

    private final AtomicLong requestsProcessed = new AtomicLong(0);
    private final AtomicLong requestsBlocked = new AtomicLong(0);

    @Inject
    public GatewayMetrics(MeterRegistry registry, AdmissionController admissionController) {
        this.registry = registry;
        this.admissionController = admissionController;
    }

    @PostConstruct
    void init() {
        FunctionCounter.builder("warden.requests.processed", requestsProcessed, AtomicLong::get)
                .description("Requests evaluated by the rate limiter")
                .register(registry);

        FunctionCounter.builder("warden.requests.blocked", requestsBlocked, AtomicLong::get)
                .description("Requests rejected by the rate limiter")
                .register(registry);

        Gauge.builder("warden.admission.in_flight", admissionController, AdmissionController::inFlight)
                .description("Backend calls currently holding an admission slot")
                .register(registry);

        Gauge.builder("warden.admission.waiting", admissionController, AdmissionController::waiting)
                .description("Requests queued for an admission slot")
                .register(registry);

        Gauge.builder("warden.admission.capacity", admissionController, AdmissionController::capacity)
                .description("Configured backend concurrency cap")
                .register(registry);
    }

    @Override
    public void recordRequestProcessed() {
        requestsProcessed.incrementAndGet();
    }

    @Override
    public void recordRequestBlocked() {
        requestsBlocked.incrementAndGet();
    }

    @Override
    public void recordStoreFailure(String operation) {
        Counter.builder("warden.store.failures")
                .description("Counting store operations that failed or timed out")
                .tag("operation", operation)
                .register(registry)
                .increment();
    }

    @Override
    public void recordGatewayResult(String method, GatewayResult result) {
        Counter.builder("warden.gateway.results")
                .description("Gateway request outcomes")
                .tag("method", method)
                .tag("result", resultType(result))
                .register(registry)
                .increment();
    }

    @Override
    public void recordProxyLatency(String method, int statusCode, long latencyMs) {
        Timer.builder("warden.proxy.latency")
                .description("Backend response latency")
                .tag("method", method)
                .tag("status_class", statusClass(statusCode))
                .register(registry)
                .record(latencyMs, TimeUnit.MILLISECONDS);
    }

    @Override
    public MetricsSnapshot snapshot() {
        return new MetricsSnapshot(requestsProcessed.get(), requestsBlocked.get());
    }

    private static String resultType(GatewayResult result) {
        if (result instanceof GatewayResult.Success) {
            return "success";
        }
        if (result instanceof GatewayResult.RateLimited) {
            return "rate_limited";
        }
        if (result instanceof GatewayResult.BackendUnavailable) {
            return "backend_unavailable";
        }
        if (result instanceof GatewayResult.BackendTimeout) {
            return "backend_timeout";
        }
        return "internal_error";
    }

    private static String statusClass(int statusCode) {
        if (statusCode < 100 || statusCode > 599) {
            return "unknown";
        }
        return (statusCode / 100) + "xx";
    }
}
