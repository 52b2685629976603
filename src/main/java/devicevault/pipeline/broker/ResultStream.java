package devicevault.pipeline.broker;

import java.time.Duration;
import java.util.List;
import java.util.Map;

/**
 * Append-only streams read through durable consumer groups with explicit
 * acknowledgement (at-least-once delivery).
 */
public interface ResultStream {

    /**
     * Append an entry.
     *
     * @return the assigned entry ID
     */
    String append(String stream, Map<String, String> fields);

    /**
     * Create the consumer group (and the stream) if it does not exist yet.
     */
    void ensureGroup(String stream, String group);

    /**
     * Read entries never delivered to this group before, blocking up to
     * {@code block} when none are available. Returned entries stay pending
     * until acknowledged.
     */
    List<StreamMessage> readGroup(String stream, String group, String consumer, int count, Duration block);

    void ack(String stream, String group, String entryId);

    /**
     * Number of delivered but unacknowledged entries in the group.
     */
    long pending(String stream, String group);
}
