package warden.support;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicLong;

import warden.core.model.gateway.GatewayResult;
import warden.core.model.health.MetricsSnapshot;
import warden.core.port.out.Metrics;

/**
 * Metrics that keep everything in memory for assertions.
 */
public class RecordingMetrics implements Metrics {

    private final AtomicLong processed = new AtomicLong();
    private final AtomicLong blocked = new AtomicLong();
    private final List<String> storeFailures = new CopyOnWriteArrayList<>();
    private final List<GatewayResult> results = new CopyOnWriteArrayList<>();
    private final AtomicLong latencySamples = new AtomicLong();

    @Override
    public void recordRequestProcessed() {
        processed.incrementAndGet();
    }

    @Override
    public void recordRequestBlocked() {
        blocked.incrementAndGet();
    }

    @Override
    public void recordStoreFailure(String operation) {
        storeFailures.add(operation);
    }

    @Override
    public void recordGatewayResult(String method, GatewayResult result) {
        results.add(result);
    }

    @Override
    public void recordProxyLatency(String method, int statusCode, long latencyMs) {
        latencySamples.incrementAndGet();
    }

    @Override
    public MetricsSnapshot snapshot() {
        return new MetricsSnapshot(processed.get(), blocked.get());
    }

    public List<String> storeFailures() {
        return storeFailures;
    }

    public List<GatewayResult> results() {
        return results;
    }

    public long latencySamples() {
        return latencySamples.get();
    }
}
