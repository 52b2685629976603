package devicevault.pipeline.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;
import java.util.Map;
import java.util.Objects;

/**
 * Job consumed by storage workers from {@code storage.<backend-kind>}.
 * A store job carries the collected content; a read job carries the opaque
 * reference and the queue the worker must reply on.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record StorageJob(
        @JsonProperty("task_id") String taskId,
        @JsonProperty("task_identifier") String taskIdentifier,
        @JsonProperty("device_id") Long deviceId,
        @JsonProperty("storage_backend") String storageBackend,
        @JsonProperty("storage_config") Map<String, Object> storageConfig,
        @JsonProperty("device_config") String deviceConfig,
        @JsonProperty("operation") String operation,
        @JsonProperty("storage_ref") String storageRef,
        @JsonProperty("reply_to") String replyTo,
        @JsonProperty("initiated_at") Instant initiatedAt) {

    public StorageJob {
        Objects.requireNonNull(taskId, "task_id is required");
        storageConfig = storageConfig == null ? Map.of() : storageConfig;
        operation = operation == null ? StorageOperation.STORE.wireValue() : operation;
    }

    public static StorageJob store(String taskId, String taskIdentifier, long deviceId, StorageLocation location,
            String content, Instant initiatedAt) {
        return new StorageJob(taskId, taskIdentifier, deviceId, location.backendKind(), location.config(),
                content, StorageOperation.STORE.wireValue(), null, null, initiatedAt);
    }

    public static StorageJob read(String taskId, String taskIdentifier, String storageBackend, String storageRef,
            Map<String, Object> storageConfig, String replyTo) {
        return new StorageJob(taskId, taskIdentifier, null, storageBackend, storageConfig, null,
                StorageOperation.READ.wireValue(), storageRef, replyTo, null);
    }

    public StorageOperation storageOperation() {
        return StorageOperation.fromWire(operation);
    }
}
