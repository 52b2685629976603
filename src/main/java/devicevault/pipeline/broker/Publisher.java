package devicevault.pipeline.broker;

import devicevault.pipeline.util.Json;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Map;
import java.util.function.Supplier;

/**
 * Publishing front for queues and streams. Transient broker failures are
 * retried a bounded number of times with exponential backoff before the
 * last error is rethrown.
 */
public class Publisher {

    private static final Logger log = LoggerFactory.getLogger(Publisher.class);

    public static final int DEFAULT_ATTEMPTS = 3;
    public static final Duration DEFAULT_INITIAL_BACKOFF = Duration.ofMillis(200);

    private final JobQueue queue;
    private final ResultStream stream;
    private final int attempts;
    private final Duration initialBackoff;

    public Publisher(JobQueue queue, ResultStream stream) {
        this(queue, stream, DEFAULT_ATTEMPTS, DEFAULT_INITIAL_BACKOFF);
    }

    public Publisher(JobQueue queue, ResultStream stream, int attempts, Duration initialBackoff) {
        if (attempts < 1) {
            throw new IllegalArgumentException("attempts must be >= 1");
        }
        this.queue = queue;
        this.stream = stream;
        this.attempts = attempts;
        this.initialBackoff = initialBackoff;
    }

    /**
     * Serialize a job as JSON and push it to the queue.
     */
    public void enqueue(String queueName, Object job) {
        String payload = Json.write(job);
        withRetry("enqueue to " + queueName, () -> {
            queue.push(queueName, payload);
            return null;
        });
    }

    /**
     * Append a flat entry to a stream.
     *
     * @return the stream entry ID
     */
    public String publish(String streamName, Map<String, String> fields) {
        return withRetry("publish to " + streamName, () -> stream.append(streamName, fields));
    }

    private <T> T withRetry(String what, Supplier<T> action) {
        long backoffMs = initialBackoff.toMillis();
        int attempt = 0;
        while (true) {
            attempt++;
            try {
                return action.get();
            } catch (BrokerException e) {
                if (attempt >= attempts) {
                    log.error("Failed to {} after {} attempts", what, attempt);
                    throw e;
                }
                log.warn("Failed to {} (attempt {}/{}): {}", what, attempt, attempts, e.getMessage());
                sleep(backoffMs);
                backoffMs *= 2;
            }
        }
    }

    private static void sleep(long millis) {
        try {
            Thread.sleep(millis);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new BrokerException("Interrupted while backing off", e);
        }
    }
}
