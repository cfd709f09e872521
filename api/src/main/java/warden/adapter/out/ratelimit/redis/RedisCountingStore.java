package warden.adapter.out.ratelimit.redis;

import io.quarkus.redis.datasource.ReactiveRedisDataSource;
import io.smallrye.mutiny.Uni;
import io.vertx.mutiny.redis.client.Response;

import warden.core.port.out.CountingStore;

/**
 * Redis-backed counting store shared by every gateway instance.
 *
 * <p>Increment and expiry run in a single Lua script so they are atomic on the
 * server. The expiry is also re-applied to a counter that somehow lost its TTL,
 * which keeps a failed EXPIRE from leaving a key that never resets.
 */
public final class RedisCountingStore implements CountingStore {

    static final String INCREMENT_SCRIPT =
            """
            local count = redis.call('INCR', KEYS[1])
            if count == 1 or redis.call('TTL', KEYS[1]) == -1 then
                redis.call('EXPIRE', KEYS[1], ARGV[1])
            end
            return count
            """;

    private final ReactiveRedisDataSource redisDataSource;
    private final RedisTimeoutHelper operationTimeout;
    private final RedisTimeoutHelper probeTimeout;

    public RedisCountingStore(
            ReactiveRedisDataSource redisDataSource,
            RedisTimeoutHelper operationTimeout,
            RedisTimeoutHelper probeTimeout) {
        this.redisDataSource = redisDataSource;
        this.operationTimeout = operationTimeout;
        this.probeTimeout = probeTimeout;
    }

    @Override
    public Uni<Long> incrementAndGet(String key, long windowSeconds) {
        final var increment = redisDataSource
                .execute("EVAL", INCREMENT_SCRIPT, "1", key, String.valueOf(windowSeconds))
                .map(Response::toLong);
        return operationTimeout.withTimeout(increment, "increment");
    }

    @Override
    public Uni<Boolean> ping() {
        final var ping = redisDataSource.execute("PING").map(response -> response != null
                && "PONG".equalsIgnoreCase(response.toString()));
        return probeTimeout.withTimeoutFallback(ping, "ping", () -> false);
    }

    @Override
    public String name() {
        return "redis";
    }
}
