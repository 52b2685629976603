package devicevault.pipeline.broker;

import java.time.Duration;
import java.util.List;
import java.util.Optional;

/**
 * Named FIFO work queues. A job pushed to a queue is handed to exactly one
 * popping worker.
 */
public interface JobQueue {

    void push(String queue, String payload);

    /**
     * Block until a payload is available on any of the queues (checked in
     * order) or the timeout elapses.
     */
    Optional<String> pop(List<String> queues, Duration timeout);

    default Optional<String> pop(String queue, Duration timeout) {
        return pop(List.of(queue), timeout);
    }

    /**
     * Let a queue disappear after the given time (used for one-shot reply queues).
     */
    void expire(String queue, Duration ttl);
}
