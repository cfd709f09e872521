package warden.core.config;

import java.time.Duration;

import io.smallrye.config.ConfigMapping;
import io.smallrye.config.WithDefault;

/**
 * Configuration mapping for the proxied backend.
 *
 * <p>Configuration prefix: {@code warden.backend}
 *
 * <h2>Environment Variables</h2>
 * <ul>
 *   <li>{@code WARDEN_BACKEND_URL} - Base URL every request is forwarded to</li>
 *   <li>{@code WARDEN_BACKEND_REQUEST_TIMEOUT} - Per-call timeout (ISO-8601 duration)</li>
 * </ul>
 */
@ConfigMapping(prefix = "warden.backend")
public interface BackendConfig {

    /**
     * Base URL of the single backend service.
     *
     * @return the backend base URL (default: http://127.0.0.1:8001)
     */
    @WithDefault("http://127.0.0.1:8001")
    String url();

    /**
     * Maximum time to wait for a backend response.
     *
     * <p>If exceeded, the gateway answers 504 Gateway Timeout.
     *
     * @return request timeout (default: 5 seconds)
     */
    @WithDefault("PT5S")
    Duration requestTimeout();

    /**
     * Maximum time to establish a TCP connection to the backend.
     *
     * @return connect timeout (default: 2 seconds)
     */
    @WithDefault("PT2S")
    Duration connectTimeout();

    /**
     * Path of the backend's own health endpoint.
     *
     * @return health path (default: /health)
     */
    @WithDefault("/health")
    String healthPath();

    /**
     * Timeout of the backend health probe.
     *
     * @return health probe timeout (default: 2 seconds)
     */
    @WithDefault("PT2S")
    Duration healthTimeout();

    /**
     * Maximum pooled connections to the backend.
     *
     * @return pool size (default: 50)
     */
    @WithDefault("50")
    int maxPoolSize();
}
