package devicevault.pipeline.broker;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import redis.clients.jedis.StreamEntryID;
import redis.clients.jedis.exceptions.JedisDataException;
import redis.clients.jedis.params.XAddParams;
import redis.clients.jedis.params.XReadGroupParams;
import redis.clients.jedis.resps.StreamEntry;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Redis streams with consumer groups (XADD / XREADGROUP / XACK).
 */
public class RedisResultStream implements ResultStream {

    private static final Logger log = LoggerFactory.getLogger(RedisResultStream.class);

    private final RedisConnection redis;

    public RedisResultStream(RedisConnection redis) {
        this.redis = redis;
    }

    @Override
    public String append(String stream, Map<String, String> fields) {
        StreamEntryID id = redis.execute("XADD " + stream,
                jedis -> jedis.xadd(stream, XAddParams.xAddParams(), fields));
        return id.toString();
    }

    @Override
    public void ensureGroup(String stream, String group) {
        try {
            redis.execute("XGROUP CREATE " + stream,
                    jedis -> jedis.xgroupCreate(stream, group, new StreamEntryID(), true));
            log.info("Created consumer group {} on {}", group, stream);
        } catch (BrokerException e) {
            if (e.getCause() instanceof JedisDataException && e.getMessage().contains("BUSYGROUP")) {
                log.debug("Consumer group {} on {} already exists", group, stream);
                return;
            }
            throw e;
        }
    }

    @Override
    public List<StreamMessage> readGroup(String stream, String group, String consumer, int count, Duration block) {
        XReadGroupParams params = XReadGroupParams.xReadGroupParams()
                .count(count)
                .block((int) block.toMillis());

        List<Map.Entry<String, List<StreamEntry>>> reply = redis.execute("XREADGROUP " + stream,
                jedis -> jedis.xreadGroup(group, consumer, params,
                        Map.of(stream, StreamEntryID.UNRECEIVED_ENTRY)));

        List<StreamMessage> messages = new ArrayList<>();
        if (reply == null) {
            return messages;
        }
        for (Map.Entry<String, List<StreamEntry>> perStream : reply) {
            for (StreamEntry entry : perStream.getValue()) {
                messages.add(new StreamMessage(entry.getID().toString(), entry.getFields()));
            }
        }
        return messages;
    }

    @Override
    public void ack(String stream, String group, String entryId) {
        redis.execute("XACK " + stream, jedis -> jedis.xack(stream, group, new StreamEntryID(entryId)));
    }

    @Override
    public long pending(String stream, String group) {
        return redis.execute("XPENDING " + stream, jedis -> jedis.xpending(stream, group).getTotal());
    }
}
