package warden.core.model.health;

/**
 * Point-in-time copy of the process-wide request counters.
 */
public record MetricsSnapshot(long totalRequestsProcessed, long totalRequestsBlocked) {}
