package devicevault.pipeline.broker;

import java.time.Duration;
import java.util.List;
import java.util.Optional;

/**
 * Redis lists as job queues: LPUSH to enqueue, BRPOP to claim.
 */
public class RedisJobQueue implements JobQueue {

    private final RedisConnection redis;

    public RedisJobQueue(RedisConnection redis) {
        this.redis = redis;
    }

    @Override
    public void push(String queue, String payload) {
        redis.execute("LPUSH " + queue, jedis -> jedis.lpush(queue, payload));
    }

    @Override
    public Optional<String> pop(List<String> queues, Duration timeout) {
        // BRPOP timeout is whole seconds; 0 would block forever
        int seconds = (int) Math.max(1, timeout.toSeconds());
        List<String> reply = redis.execute("BRPOP " + queues,
                jedis -> jedis.brpop(seconds, queues.toArray(new String[0])));
        if (reply == null || reply.size() < 2) {
            return Optional.empty();
        }
        return Optional.of(reply.get(1));
    }

    @Override
    public void expire(String queue, Duration ttl) {
        redis.execute("EXPIRE " + queue, jedis -> jedis.expire(queue, ttl.toSeconds()));
    }
}
