package warden.core.model.health;

public record GatewayHealth(
        HealthStatus status, DependencyHealth store, DependencyHealth backend, MetricsSnapshot metrics) {

    public static GatewayHealth of(DependencyHealth store, DependencyHealth backend, MetricsSnapshot metrics) {
        return new GatewayHealth(HealthStatus.of(store, backend), store, backend, metrics);
    }
}
