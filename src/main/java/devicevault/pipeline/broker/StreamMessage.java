package devicevault.pipeline.broker;

import java.util.Map;

/**
 * One entry read from a result stream.
 *
 * @param id     stream-assigned entry ID, needed for acknowledgement
 * @param fields flat string fields as published
 */
public record StreamMessage(String id, Map<String, String> fields) {

    public StreamMessage {
        fields = fields == null ? Map.of() : Map.copyOf(fields);
    }
}
