package devicevault.pipeline.broker;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import redis.clients.jedis.Jedis;
import redis.clients.jedis.JedisPool;
import redis.clients.jedis.exceptions.JedisException;

import java.net.URI;
import java.util.function.Function;

/**
 * Shared Jedis pool for the Redis-backed queue, stream and lock adapters.
 * Every Jedis failure leaves this class as a {@link BrokerException}.
 */
public final class RedisConnection implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(RedisConnection.class);

    private final JedisPool pool;

    public RedisConnection(String redisUrl) {
        this.pool = new JedisPool(URI.create(redisUrl));
        log.info("Redis pool initialized: {}", redisUrl);
    }

    <T> T execute(String operation, Function<Jedis, T> command) {
        try (Jedis jedis = pool.getResource()) {
            return command.apply(jedis);
        } catch (JedisException e) {
            throw new BrokerException("Redis " + operation + " failed: " + e.getMessage(), e);
        }
    }

    public boolean isHealthy() {
        try {
            return "PONG".equalsIgnoreCase(execute("ping", Jedis::ping));
        } catch (BrokerException e) {
            log.warn("Redis health check failed: {}", e.getMessage());
            return false;
        }
    }

    @Override
    public void close() {
        if (!pool.isClosed()) {
            pool.close();
            log.info("Redis pool closed");
        }
    }
}
