package warden.core.service.ratelimit;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Map;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import warden.core.model.ratelimit.RateLimitDecision;
import warden.core.model.ratelimit.StoreFailurePolicy;
import warden.core.model.ratelimit.UnconfiguredMethodPolicy;
import warden.support.FakeCountingStore;
import warden.support.RecordingMetrics;
import warden.support.TestRateLimitingConfig;

@DisplayName("RateLimitService")
class RateLimitServiceTest {

    private static final Duration TIMEOUT = Duration.ofSeconds(5);
    private static final Clock CLOCK = Clock.fixed(Instant.ofEpochSecond(1_700_000_000L), ZoneOffset.UTC);

    private FakeCountingStore store;
    private RecordingMetrics metrics;

    @BeforeEach
    void setUp() {
        store = new FakeCountingStore();
        metrics = new RecordingMetrics();
    }

    private RateLimitService service(TestRateLimitingConfig config) {
        return new RateLimitService(store, metrics, config, CLOCK);
    }

    private RateLimitDecision evaluate(RateLimitService service, String client, String method) {
        return service.evaluate(client, method).await().atMost(TIMEOUT);
    }

    @Nested
    @DisplayName("Configured methods")
    class ConfiguredMethodTests {

        @Test
        @DisplayName("should admit up to the limit and reject the next request")
        void shouldAdmitUpToLimitThenReject() {
            final var service = service(TestRateLimitingConfig.defaults());

            for (int i = 1; i <= 5; i++) {
                final var decision = evaluate(service, "10.0.0.1", "GET");
                assertTrue(decision.allowed(), "request " + i + " should be admitted");
                assertEquals(i, decision.requestCount());
            }

            final var rejected = evaluate(service, "10.0.0.1", "GET");
            assertFalse(rejected.allowed());
            assertEquals(5, rejected.limit());
            assertEquals(60, rejected.retryAfterSeconds());
        }

        @Test
        @DisplayName("should count processed and blocked requests")
        void shouldCountProcessedAndBlocked() {
            final var service = service(TestRateLimitingConfig.defaults());

            for (int i = 0; i < 8; i++) {
                evaluate(service, "10.0.0.1", "POST");
            }

            assertEquals(8, metrics.snapshot().totalRequestsProcessed());
            assertEquals(3, metrics.snapshot().totalRequestsBlocked());
        }

        @Test
        @DisplayName("should keep clients and methods independent")
        void shouldKeepClientsAndMethodsIndependent() {
            final var service = service(TestRateLimitingConfig.defaults().withLimits(Map.of("GET", 1L, "POST", 1L)));

            assertTrue(evaluate(service, "10.0.0.1", "GET").allowed());
            assertTrue(evaluate(service, "10.0.0.2", "GET").allowed());
            assertTrue(evaluate(service, "10.0.0.1", "POST").allowed());
            assertFalse(evaluate(service, "10.0.0.1", "GET").allowed());
        }

        @Test
        @DisplayName("should match methods case-insensitively")
        void shouldMatchMethodsCaseInsensitively() {
            final var service = service(TestRateLimitingConfig.defaults().withLimits(Map.of("get", 1L)));

            assertTrue(evaluate(service, "10.0.0.1", "GET").allowed());
            assertFalse(evaluate(service, "10.0.0.1", "get").allowed());
        }

        @Test
        @DisplayName("should use the fixed window key")
        void shouldUseFixedWindowKey() {
            final var service = service(TestRateLimitingConfig.defaults());

            evaluate(service, "10.0.0.1", "PUT");

            assertEquals("warden:ratelimit:10.0.0.1:PUT:28333333", store.incrementedKeys().get(0));
        }

        @Test
        @DisplayName("should reject every request when the limit is zero")
        void shouldRejectWhenLimitIsZero() {
            final var service = service(TestRateLimitingConfig.defaults().withLimits(Map.of("DELETE", 0L)));

            assertFalse(evaluate(service, "10.0.0.1", "DELETE").allowed());
        }
    }

    @Nested
    @DisplayName("Unconfigured methods")
    class UnconfiguredMethodTests {

        @Test
        @DisplayName("should admit without counting when policy is ALLOW")
        void shouldAdmitWhenAllow() {
            final var service = service(TestRateLimitingConfig.defaults());

            for (int i = 0; i < 10; i++) {
                assertTrue(evaluate(service, "10.0.0.1", "PATCH").allowed());
            }
            assertTrue(store.incrementedKeys().isEmpty());
            assertEquals(10, metrics.snapshot().totalRequestsProcessed());
            assertEquals(0, metrics.snapshot().totalRequestsBlocked());
        }

        @Test
        @DisplayName("should reject when policy is REJECT")
        void shouldRejectWhenReject() {
            final var service = service(
                    TestRateLimitingConfig.defaults().withUnconfiguredMethodPolicy(UnconfiguredMethodPolicy.REJECT));

            final var decision = evaluate(service, "10.0.0.1", "OPTIONS");

            assertFalse(decision.allowed());
            assertEquals(0, decision.limit());
            assertEquals(1, metrics.snapshot().totalRequestsBlocked());
        }
    }

    @Nested
    @DisplayName("Store failures")
    class StoreFailureTests {

        @Test
        @DisplayName("should admit when the store is down and policy is FAIL_OPEN")
        void shouldFailOpen() {
            final var service = service(TestRateLimitingConfig.defaults());
            store.setAvailable(false);

            assertTrue(evaluate(service, "10.0.0.1", "GET").allowed());
            assertEquals(1, metrics.storeFailures().size());
            assertEquals(0, metrics.snapshot().totalRequestsBlocked());
        }

        @Test
        @DisplayName("should reject when the store is down and policy is FAIL_CLOSED")
        void shouldFailClosed() {
            final var service =
                    service(TestRateLimitingConfig.defaults().withStoreFailurePolicy(StoreFailurePolicy.FAIL_CLOSED));
            store.setAvailable(false);

            final var decision = evaluate(service, "10.0.0.1", "GET");

            assertFalse(decision.allowed());
            assertEquals(1, metrics.snapshot().totalRequestsBlocked());
        }
    }

    @Nested
    @DisplayName("Configuration")
    class ConfigurationTests {

        @Test
        @DisplayName("should reject negative limits")
        void shouldRejectNegativeLimits() {
            final var config = TestRateLimitingConfig.defaults().withLimits(Map.of("GET", -1L));

            assertThrows(IllegalArgumentException.class, () -> service(config));
        }

        @Test
        @DisplayName("should reject a non-positive window")
        void shouldRejectNonPositiveWindow() {
            final var defaults = TestRateLimitingConfig.defaults();
            final var config = new TestRateLimitingConfig(
                    defaults.limits(),
                    0,
                    defaults.unconfiguredMethodPolicy(),
                    defaults.storeFailurePolicy(),
                    defaults.keyPrefix());

            assertThrows(IllegalArgumentException.class, () -> service(config));
        }
    }
}
