package devicevault.pipeline.model;

import devicevault.pipeline.util.Json;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Entry on the storage-results stream.
 */
public record StorageResultMessage(
        String taskId,
        String taskIdentifier,
        String deviceId,
        String storageBackend,
        String storageRef,
        String status,
        List<String> log,
        String timestamp,
        String operation) {

    public Map<String, String> toFields() {
        Map<String, String> fields = new LinkedHashMap<>();
        fields.put("task_id", nullToEmpty(taskId));
        fields.put("task_identifier", nullToEmpty(taskIdentifier));
        fields.put("device_id", nullToEmpty(deviceId));
        fields.put("storage_backend", nullToEmpty(storageBackend));
        fields.put("storage_ref", nullToEmpty(storageRef));
        fields.put("status", nullToEmpty(status));
        fields.put("log", Json.write(log == null ? List.of() : log));
        fields.put("timestamp", nullToEmpty(timestamp));
        fields.put("operation", operation == null ? StorageOperation.STORE.wireValue() : operation);
        return fields;
    }

    public static StorageResultMessage fromFields(Map<String, String> fields) {
        return new StorageResultMessage(
                fields.getOrDefault("task_id", ""),
                fields.getOrDefault("task_identifier", ""),
                fields.getOrDefault("device_id", ""),
                fields.getOrDefault("storage_backend", ""),
                fields.getOrDefault("storage_ref", ""),
                fields.getOrDefault("status", ResultStatus.FAILURE.wireValue()),
                Json.readLog(fields.getOrDefault("log", "[]")),
                fields.getOrDefault("timestamp", ""),
                fields.getOrDefault("operation", StorageOperation.STORE.wireValue()));
    }

    public ResultStatus resultStatus() {
        return ResultStatus.fromWire(status);
    }

    private static String nullToEmpty(String s) {
        return s == null ? "" : s;
    }
}
