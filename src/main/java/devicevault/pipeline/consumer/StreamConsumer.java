package devicevault.pipeline.consumer;

import devicevault.pipeline.broker.BrokerException;
import devicevault.pipeline.broker.ResultStream;
import devicevault.pipeline.broker.StreamMessage;
import devicevault.pipeline.util.Backoff;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.List;

/**
 * Consumer-group reader over one result stream.
 *
 * Every delivered entry is acknowledged, whatever happened while handling
 * it: an unacknowledged entry would sit in the pending list forever. Poison
 * entries are only logged; other failures are copied to the dead-letter
 * stream before the acknowledgement.
 */
public abstract class StreamConsumer implements Runnable {

    private final Logger log = LoggerFactory.getLogger(getClass());

    private final ResultStream stream;
    private final String streamName;
    private final String group;
    private final String consumerName;
    private final int count;
    private final Duration block;
    private final DeadLetterSink deadLetters;

    private volatile boolean running = true;
    private boolean groupReady = false;

    protected StreamConsumer(ResultStream stream, String streamName, String group, String consumerName,
            int count, Duration block, DeadLetterSink deadLetters) {
        this.stream = stream;
        this.streamName = streamName;
        this.group = group;
        this.consumerName = consumerName;
        this.count = count;
        this.block = block;
        this.deadLetters = deadLetters;
    }

    /**
     * Process one entry. Throw {@link PoisonMessageException} for entries
     * that can never succeed.
     */
    protected abstract void handle(StreamMessage message);

    @Override
    public void run() {
        log.info("Consuming {} as {}/{}", streamName, group, consumerName);
        Backoff backoff = Backoff.standard();
        while (running && !Thread.currentThread().isInterrupted()) {
            try {
                pollOnce();
                backoff.reset();
            } catch (BrokerException e) {
                log.warn("Stream {} unavailable, retrying in {}ms: {}", streamName, backoff.current().toMillis(),
                        e.getMessage());
                groupReady = false;
                if (!backoff.pause()) {
                    break;
                }
            } catch (Exception e) {
                log.error("Consumer loop error on {}", streamName, e);
            }
        }
        log.info("Consumer on {} stopped", streamName);
    }

    public void stop() {
        running = false;
    }

    /**
     * One blocking read and the processing of whatever it returned.
     *
     * @return number of entries processed
     * @throws BrokerException if the stream cannot be read
     */
    public int pollOnce() {
        if (!groupReady) {
            stream.ensureGroup(streamName, group);
            groupReady = true;
        }
        List<StreamMessage> messages = stream.readGroup(streamName, group, consumerName, count, block);
        for (StreamMessage message : messages) {
            process(message);
        }
        return messages.size();
    }

    void process(StreamMessage message) {
        try {
            handle(message);
        } catch (PoisonMessageException e) {
            log.warn("Discarding {} entry {}: {}", streamName, message.id(), e.getMessage());
        } catch (RuntimeException e) {
            log.error("Failed to process {} entry {}", streamName, message.id(), e);
            deadLetters.record(streamName, message, e);
        } finally {
            acknowledge(message);
        }
    }

    private void acknowledge(StreamMessage message) {
        try {
            stream.ack(streamName, group, message.id());
        } catch (BrokerException e) {
            log.error("Failed to acknowledge {} entry {}: {}", streamName, message.id(), e.getMessage());
        }
    }

    protected String streamName() {
        return streamName;
    }
}
