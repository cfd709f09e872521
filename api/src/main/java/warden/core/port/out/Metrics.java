package warden.core.port.out;

import warden.core.model.gateway.GatewayResult;
import warden.core.model.health.MetricsSnapshot;

/**
 * Port interface for recording gateway metrics.
 *
 * <p>The processed/blocked counters are the process-wide aggregate reported by the
 * health endpoint; everything else is exported to the metrics registry only.
 */
public interface Metrics {

    /**
     * Record a request reaching the rate limiter.
     */
    void recordRequestProcessed();

    /**
     * Record a request rejected by the rate limiter.
     */
    void recordRequestBlocked();

    /**
     * Record a counting store failure.
     *
     * @param operation the failed store operation
     */
    void recordStoreFailure(String operation);

    /**
     * Record the final outcome of a gateway request.
     *
     * @param method the HTTP method
     * @param result the gateway result
     */
    void recordGatewayResult(String method, GatewayResult result);

    /**
     * Record backend latency.
     *
     * @param method the HTTP method
     * @param statusCode the backend status code
     * @param latencyMs latency in milliseconds
     */
    void recordProxyLatency(String method, int statusCode, long latencyMs);

    /**
     * Read the aggregate request counters.
     *
     * @return a snapshot of processed and blocked totals
     */
    MetricsSnapshot snapshot();
}
