package warden.core.model.health;

public enum HealthStatus {
    OK,
    DEGRADED,
    UNHEALTHY;

    /**
     * Combines the two dependency probes: both up is OK, exactly one down is DEGRADED,
     * both down is UNHEALTHY.
     */
    public static HealthStatus of(DependencyHealth store, DependencyHealth backend) {
        if (store.up() && backend.up()) {
            return OK;
        }
        if (store.up() || backend.up()) {
            return DEGRADED;
        }
        return UNHEALTHY;
    }
}
