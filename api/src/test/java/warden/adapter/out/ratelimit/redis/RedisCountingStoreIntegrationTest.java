package warden.adapter.out.ratelimit.redis;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

import io.smallrye.mutiny.Uni;
import io.vertx.mutiny.core.Vertx;
import io.vertx.mutiny.redis.client.Command;
import io.vertx.mutiny.redis.client.Redis;
import io.vertx.mutiny.redis.client.RedisAPI;
import io.vertx.mutiny.redis.client.Request;
import io.vertx.redis.client.RedisOptions;
import org.junit.jupiter.api.AfterAll;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.testcontainers.containers.GenericContainer;
import org.testcontainers.junit.jupiter.Container;
import org.testcontainers.junit.jupiter.Testcontainers;
import org.testcontainers.utility.DockerImageName;

/**
 * Runs the counter increment script against a real Redis instance.
 */
@Testcontainers(disabledWithoutDocker = true)
@DisplayName("Redis counting store script")
class RedisCountingStoreIntegrationTest {

    private static final Duration TIMEOUT = Duration.ofSeconds(5);

    @Container
    static GenericContainer<?> redis =
            new GenericContainer<>(DockerImageName.parse("redis:7-alpine")).withExposedPorts(6379);

    private static Vertx vertx;
    private static Redis redisClient;

    @BeforeAll
    static void setUpClass() {
        vertx = Vertx.vertx();

        var redisOptions =
                new RedisOptions().setConnectionString("redis://" + redis.getHost() + ":" + redis.getMappedPort(6379));

        redisClient = Redis.createClient(vertx, redisOptions);
    }

    @AfterAll
    static void tearDownClass() {
        if (redisClient != null) {
            redisClient.close();
        }
        if (vertx != null) {
            vertx.closeAndAwait();
        }
    }

    @BeforeEach
    void setUp() {
        RedisAPI.api(redisClient).flushall(List.of()).await().atMost(TIMEOUT);
    }

    private Uni<Long> increment(String key, long windowSeconds) {
        return redisClient
                .send(Request.cmd(Command.EVAL)
                        .arg(RedisCountingStore.INCREMENT_SCRIPT)
                        .arg("1")
                        .arg(key)
                        .arg(String.valueOf(windowSeconds)))
                .map(response -> response.toLong());
    }

    private long ttl(String key) {
        return RedisAPI.api(redisClient).ttl(key).await().atMost(TIMEOUT).toLong();
    }

    @Test
    @DisplayName("should count from one and set the expiry on creation")
    void shouldCountAndExpire() {
        assertEquals(1L, increment("k", 60).await().atMost(TIMEOUT));
        assertEquals(2L, increment("k", 60).await().atMost(TIMEOUT));

        final var ttl = ttl("k");
        assertTrue(ttl > 0 && ttl <= 60, "ttl was " + ttl);
    }

    @Test
    @DisplayName("should restore a missing expiry")
    void shouldRestoreMissingExpiry() {
        RedisAPI.api(redisClient).set(List.of("k", "3")).await().atMost(TIMEOUT);
        assertEquals(-1L, ttl("k"));

        assertEquals(4L, increment("k", 60).await().atMost(TIMEOUT));
        assertTrue(ttl("k") > 0);
    }

    @Test
    @DisplayName("should not lose concurrent increments")
    void shouldNotLoseConcurrentIncrements() {
        List<Uni<Long>> increments = new ArrayList<>();
        for (int i = 0; i < 50; i++) {
            increments.add(increment("shared", 60));
        }

        Uni.join().all(increments).andFailFast().await().atMost(TIMEOUT);

        assertEquals(51L, increment("shared", 60).await().atMost(TIMEOUT));
    }
}
