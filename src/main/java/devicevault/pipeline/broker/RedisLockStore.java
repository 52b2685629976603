package devicevault.pipeline.broker;

import redis.clients.jedis.params.SetParams;

import java.time.Duration;
import java.util.List;
import java.util.Optional;

/**
 * Lock primitives on plain Redis keys. The conditional variants run as Lua
 * scripts so the compare and the write are one atomic step.
 */
public class RedisLockStore implements LockStore {

    private static final String EXTEND_IF_VALUE = """
            if redis.call('GET', KEYS[1]) == ARGV[1] then
                return redis.call('EXPIRE', KEYS[1], ARGV[2])
            end
            return 0
            """;

    private static final String DELETE_IF_VALUE = """
            if redis.call('GET', KEYS[1]) == ARGV[1] then
                return redis.call('DEL', KEYS[1])
            end
            return 0
            """;

    private final RedisConnection redis;

    public RedisLockStore(RedisConnection redis) {
        this.redis = redis;
    }

    @Override
    public boolean setIfAbsent(String key, String value, Duration ttl) {
        String reply = redis.execute("SET NX " + key,
                jedis -> jedis.set(key, value, SetParams.setParams().nx().ex(ttl.toSeconds())));
        return "OK".equals(reply);
    }

    @Override
    public Optional<String> get(String key) {
        return Optional.ofNullable(redis.execute("GET " + key, jedis -> jedis.get(key)));
    }

    @Override
    public boolean extendIfValue(String key, String expectedValue, Duration ttl) {
        Object reply = redis.execute("EXPIRE " + key, jedis -> jedis.eval(EXTEND_IF_VALUE,
                List.of(key), List.of(expectedValue, String.valueOf(ttl.toSeconds()))));
        return isOne(reply);
    }

    @Override
    public boolean deleteIfValue(String key, String expectedValue) {
        Object reply = redis.execute("DEL " + key, jedis -> jedis.eval(DELETE_IF_VALUE,
                List.of(key), List.of(expectedValue)));
        return isOne(reply);
    }

    @Override
    public boolean delete(String key) {
        return redis.execute("DEL " + key, jedis -> jedis.del(key)) > 0;
    }

    @Override
    public Optional<Duration> remainingTtl(String key) {
        long seconds = redis.execute("TTL " + key, jedis -> jedis.ttl(key));
        return seconds >= 0 ? Optional.of(Duration.ofSeconds(seconds)) : Optional.empty();
    }

    private static boolean isOne(Object reply) {
        return reply instanceof Long value && value == 1L;
    }
}
