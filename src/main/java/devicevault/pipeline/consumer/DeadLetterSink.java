package devicevault.pipeline.consumer;

import devicevault.pipeline.broker.BrokerException;
import devicevault.pipeline.broker.ResultStream;
import devicevault.pipeline.broker.StreamMessage;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Keeps a copy of entries whose processing failed for a non-poison reason
 * (e.g. the database was down) on {@code <stream><suffix>}, so that
 * acknowledging them does not lose them.
 */
public class DeadLetterSink {

    private static final Logger log = LoggerFactory.getLogger(DeadLetterSink.class);

    private final ResultStream stream;
    private final String suffix;
    private final Clock clock;

    public DeadLetterSink(ResultStream stream, String suffix, Clock clock) {
        this.stream = stream;
        this.suffix = suffix;
        this.clock = clock;
    }

    public String deadLetterStream(String source) {
        return source + suffix;
    }

    /**
     * @return false if the copy could not be written either
     */
    public boolean record(String source, StreamMessage message, Exception error) {
        Map<String, String> fields = new LinkedHashMap<>(message.fields());
        fields.put("dead_letter_source_id", message.id());
        fields.put("dead_letter_error", String.valueOf(error));
        fields.put("dead_letter_at", clock.instant().toString());
        try {
            stream.append(deadLetterStream(source), fields);
            log.warn("Moved {} entry {} to {}", source, message.id(), deadLetterStream(source));
            return true;
        } catch (BrokerException e) {
            log.error("Could not dead-letter {} entry {}; it is lost: {}", source, message.id(), message.fields(), e);
            return false;
        }
    }
}
