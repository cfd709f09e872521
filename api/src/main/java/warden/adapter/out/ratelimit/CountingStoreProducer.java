package warden.adapter.out.ratelimit;

import java.time.Duration;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.inject.Disposes;
import jakarta.enterprise.inject.Instance;
import jakarta.enterprise.inject.Produces;
import jakarta.inject.Inject;

import io.quarkus.redis.datasource.ReactiveRedisDataSource;
import org.jboss.logging.Logger;

import warden.adapter.out.ratelimit.memory.InMemoryCountingStore;
import warden.adapter.out.ratelimit.redis.RedisCountingStore;
import warden.adapter.out.ratelimit.redis.RedisTimeoutHelper;
import warden.core.config.RateLimitingConfig;
import warden.core.config.StoreConfig;
import warden.core.port.out.CountingStore;

/**
 * CDI producer for the counting store.
 *
 * <p>Selects the implementation from {@code warden.store.type}. The Redis data source
 * is looked up lazily so that the in-memory store never opens a Redis connection.
 */
@ApplicationScoped
public class CountingStoreProducer {

    private static final Logger LOG = Logger.getLogger(CountingStoreProducer.class);

    private final StoreConfig storeConfig;
    private final RateLimitingConfig rateLimitingConfig;
    private final Instance<ReactiveRedisDataSource> redisDataSource;

    @Inject
    public CountingStoreProducer(
            StoreConfig storeConfig,
            RateLimitingConfig rateLimitingConfig,
            Instance<ReactiveRedisDataSource> redisDataSource) {
        this.storeConfig = storeConfig;
        this.rateLimitingConfig = rateLimitingConfig;
        this.redisDataSource = redisDataSource;
    }

    @Produces
    @ApplicationScoped
    public CountingStore produceCountingStore() {
        if (storeConfig.type() == StoreConfig.StoreType.MEMORY) {
            LOG.info("Using in-memory counting store; limits are enforced per instance");
            return new InMemoryCountingStore(Duration.ofSeconds(rateLimitingConfig.windowSeconds()));
        }

        if (!redisDataSource.isResolvable()) {
            throw new IllegalStateException(
                    "warden.store.type=redis but no Redis data source is available; set quarkus.redis.hosts");
        }
        LOG.infov("Using Redis counting store (timeout={0})", storeConfig.timeout());
        return new RedisCountingStore(
                redisDataSource.get(),
                new RedisTimeoutHelper(storeConfig.timeout()),
                new RedisTimeoutHelper(storeConfig.healthTimeout()));
    }

    void disposeCountingStore(@Disposes CountingStore store) {
        if (store instanceof InMemoryCountingStore inMemory) {
            inMemory.shutdown();
        }
    }
}
