package warden.adapter.in.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

import warden.core.model.health.GatewayHealth;

/**
 * Body of {@code GET /health}.
 */
public record HealthResponse(
        String status,
        @JsonProperty("store_status") String storeStatus,
        @JsonProperty("backend_status") String backendStatus,
        Metrics metrics) {

    public record Metrics(
            @JsonProperty("total_requests_processed") long totalRequestsProcessed,
            @JsonProperty("total_requests_blocked") long totalRequestsBlocked) {}

    public static HealthResponse fromModel(GatewayHealth health) {
        return new HealthResponse(
                health.status().name(),
                health.store().detail(),
                health.backend().detail(),
                new Metrics(
                        health.metrics().totalRequestsProcessed(),
                        health.metrics().totalRequestsBlocked()));
    }
}
