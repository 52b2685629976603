package devicevault.pipeline.broker;

import org.junit.jupiter.api.*;
import org.testcontainers.containers.GenericContainer;
import org.testcontainers.junit.jupiter.Container;
import org.testcontainers.junit.jupiter.Testcontainers;
import org.testcontainers.utility.DockerImageName;
import redis.clients.jedis.Jedis;

import java.time.Duration;
import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

/**
 * List-backed queues against a real Redis. Skipped when Docker is not available.
 */
@Testcontainers(disabledWithoutDocker = true)
class RedisJobQueueTest {

    @Container
    private static final GenericContainer<?> REDIS =
            new GenericContainer<>(DockerImageName.parse("redis:7-alpine")).withExposedPorts(6379);

    private RedisConnection connection;
    private RedisJobQueue queue;

    private Jedis jedis() {
        return new Jedis(REDIS.getHost(), REDIS.getMappedPort(6379));
    }

    @BeforeEach
    void connect() {
        try (Jedis jedis = jedis()) {
            jedis.flushAll();
        }
        connection = new RedisConnection("redis://" + REDIS.getHost() + ":" + REDIS.getMappedPort(6379));
        queue = new RedisJobQueue(connection);
    }

    @AfterEach
    void close() {
        connection.close();
    }

    @Test
    void popsInPushOrder() {
        queue.push("collector", "job-1");
        queue.push("collector", "job-2");

        assertEquals(Optional.of("job-1"), queue.pop(List.of("collector"), Duration.ofSeconds(1)));
        assertEquals(Optional.of("job-2"), queue.pop(List.of("collector"), Duration.ofSeconds(1)));
    }

    @Test
    void popTimesOutOnEmptyQueues() {
        assertEquals(Optional.empty(), queue.pop(List.of("collector", "collector.group.7"), Duration.ofSeconds(1)));
    }

    @Test
    @DisplayName("A worker listening on several queues takes from the first non-empty one")
    void popsFromFirstNonEmptyQueue() {
        queue.push("collector", "default-job");
        queue.push("collector.group.7", "group-job");

        assertEquals(Optional.of("group-job"), queue.pop(List.of("collector.group.7", "collector"), Duration.ofSeconds(1)));
        assertEquals(Optional.of("default-job"), queue.pop(List.of("collector.group.7", "collector"), Duration.ofSeconds(1)));
    }

    @Test
    void expireSetsTtlOnReplyQueue() {
        queue.push("storage.reply.abc", "{}");
        queue.expire("storage.reply.abc", Duration.ofSeconds(120));

        try (Jedis jedis = jedis()) {
            long ttl = jedis.ttl("storage.reply.abc");
            assertTrue(ttl > 100 && ttl <= 120, "ttl " + ttl);
        }
    }
}
