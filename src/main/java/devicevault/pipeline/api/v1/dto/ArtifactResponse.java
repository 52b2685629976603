package devicevault.pipeline.api.v1.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import devicevault.pipeline.model.StoredArtifact;

import java.time.Instant;
import java.util.List;

/**
 * Stored artifact as listed by GET /api/v1/devices/{id}/artifacts.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ArtifactResponse(
        @JsonProperty("id") Long id,
        @JsonProperty("task_identifier") String taskIdentifier,
        @JsonProperty("device_id") long deviceId,
        @JsonProperty("storage_backend") String storageBackend,
        @JsonProperty("storage_ref") String storageRef,
        @JsonProperty("status") String status,
        @JsonProperty("timestamp") Instant timestamp,
        @JsonProperty("log") List<String> log) {

    public static ArtifactResponse from(StoredArtifact artifact) {
        return new ArtifactResponse(
                artifact.id(),
                artifact.taskIdentifier(),
                artifact.deviceId(),
                artifact.storageBackend(),
                artifact.storageRef(),
                artifact.status().wireValue(),
                artifact.timestamp(),
                artifact.log());
    }
}
