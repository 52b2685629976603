package devicevault.pipeline.model;

import devicevault.pipeline.util.Json;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Entry on the collection-results stream. Every field is a string on the wire;
 * {@link #fromFields} is lenient so that malformed entries can still be
 * logged and acknowledged by the consumer.
 */
public record CollectionResultMessage(
        String taskId,
        String taskIdentifier,
        String deviceId,
        String status,
        String deviceConfig,
        String collectionDurationMs,
        List<String> log,
        String timestamp,
        String initiatedAt) {

    public Map<String, String> toFields() {
        Map<String, String> fields = new LinkedHashMap<>();
        fields.put("task_id", nullToEmpty(taskId));
        fields.put("task_identifier", nullToEmpty(taskIdentifier));
        fields.put("device_id", nullToEmpty(deviceId));
        fields.put("status", nullToEmpty(status));
        fields.put("device_config", nullToEmpty(deviceConfig));
        fields.put("collection_duration_ms", nullToEmpty(collectionDurationMs));
        fields.put("log", Json.write(log == null ? List.of() : log));
        fields.put("timestamp", nullToEmpty(timestamp));
        fields.put("initiated_at", nullToEmpty(initiatedAt));
        return fields;
    }

    public static CollectionResultMessage fromFields(Map<String, String> fields) {
        return new CollectionResultMessage(
                fields.getOrDefault("task_id", ""),
                fields.getOrDefault("task_identifier", ""),
                fields.getOrDefault("device_id", ""),
                fields.getOrDefault("status", ResultStatus.FAILURE.wireValue()),
                fields.getOrDefault("device_config", ""),
                fields.getOrDefault("collection_duration_ms", ""),
                Json.readLog(fields.getOrDefault("log", "[]")),
                fields.getOrDefault("timestamp", ""),
                fields.getOrDefault("initiated_at", ""));
    }

    public ResultStatus resultStatus() {
        return ResultStatus.fromWire(status);
    }

    private static String nullToEmpty(String s) {
        return s == null ? "" : s;
    }
}
