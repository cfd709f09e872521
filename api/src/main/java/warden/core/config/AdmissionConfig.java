package warden.core.config;

import io.smallrye.config.ConfigMapping;
import io.smallrye.config.WithDefault;

/**
 * Configuration mapping for backend admission control.
 *
 * <p>Configuration prefix: {@code warden.admission}
 */
@ConfigMapping(prefix = "warden.admission")
public interface AdmissionConfig {

    /**
     * Maximum number of backend calls in flight at the same time.
     *
     * <p>Requests beyond this cap wait for a free slot; the wait itself is
     * unbounded and only the backend request timeout applies once admitted.
     *
     * @return the concurrency cap (default: 5)
     */
    @WithDefault("5")
    int maxConcurrentRequests();
}
