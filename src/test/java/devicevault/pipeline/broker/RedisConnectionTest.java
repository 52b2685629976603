package devicevault.pipeline.broker;

import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Failure mapping with nothing listening on the Redis port.
 */
class RedisConnectionTest {

    private static final String UNREACHABLE = "redis://127.0.0.1:1";

    @Test
    void unreachableRedisIsUnhealthy() {
        try (RedisConnection connection = new RedisConnection(UNREACHABLE)) {
            assertFalse(connection.isHealthy());
        }
    }

    @Test
    void adapterFailuresSurfaceAsBrokerExceptions() {
        try (RedisConnection connection = new RedisConnection(UNREACHABLE)) {
            BrokerException push = assertThrows(BrokerException.class,
                    () -> new RedisJobQueue(connection).push("collector", "{}"));
            assertTrue(push.getMessage().startsWith("Redis LPUSH collector failed"), push.getMessage());

            assertThrows(BrokerException.class,
                    () -> new RedisResultStream(connection).append("collection:results", Map.of("k", "v")));
            assertThrows(BrokerException.class,
                    () -> new RedisLockStore(connection).setIfAbsent("lock", "1@a", Duration.ofSeconds(5)));
            assertThrows(BrokerException.class,
                    () -> new RedisJobQueue(connection).pop(List.of("collector"), Duration.ofSeconds(1)));
        }
    }
}
