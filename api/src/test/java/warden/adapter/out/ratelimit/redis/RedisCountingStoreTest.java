package warden.adapter.out.ratelimit.redis;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.mockito.Mockito.mock;

import java.net.ConnectException;
import java.time.Duration;

import io.quarkus.redis.datasource.ReactiveRedisDataSource;
import io.smallrye.mutiny.Uni;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import warden.core.port.out.StoreUnavailableException;

@DisplayName("RedisCountingStore")
class RedisCountingStoreTest {

    private static final Duration TIMEOUT = Duration.ofSeconds(5);
    private static final Duration STORE_TIMEOUT = Duration.ofMillis(50);

    private RedisCountingStore storeAnswering(Uni<?> answer) {
        final var dataSource = mock(ReactiveRedisDataSource.class, invocation -> answer);
        return new RedisCountingStore(
                dataSource, new RedisTimeoutHelper(STORE_TIMEOUT), new RedisTimeoutHelper(STORE_TIMEOUT));
    }

    @Test
    @DisplayName("should report connection failures as StoreUnavailableException")
    void shouldWrapConnectionFailures() {
        final var store = storeAnswering(Uni.createFrom().failure(new ConnectException("Connection refused")));

        final var error = assertThrows(
                StoreUnavailableException.class,
                () -> store.incrementAndGet("k", 60).await().atMost(TIMEOUT));

        assertEquals("increment", error.getOperation());
        assertInstanceOf(ConnectException.class, error.getCause());
    }

    @Test
    @DisplayName("should report a hung store as StoreUnavailableException")
    void shouldTimeOut() {
        final var store = storeAnswering(Uni.createFrom().nothing());

        assertThrows(
                StoreUnavailableException.class,
                () -> store.incrementAndGet("k", 60).await().atMost(TIMEOUT));
    }

    @Test
    @DisplayName("should answer false to ping when the store is down")
    void shouldPingFalseWhenDown() {
        final var failing = storeAnswering(Uni.createFrom().failure(new ConnectException("Connection refused")));
        final var hung = storeAnswering(Uni.createFrom().nothing());

        assertFalse(failing.ping().await().atMost(TIMEOUT));
        assertFalse(hung.ping().await().atMost(TIMEOUT));
    }
}
