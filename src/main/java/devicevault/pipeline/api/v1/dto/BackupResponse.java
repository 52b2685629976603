package devicevault.pipeline.api.v1.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import devicevault.pipeline.model.CollectionJob;

/**
 * Response DTO for an on-demand backup.
 * POST /api/v1/devices/{id}/backup
 */
public record BackupResponse(
        @JsonProperty("task_id") String taskId,
        @JsonProperty("task_identifier") String taskIdentifier,
        @JsonProperty("device_id") long deviceId,
        @JsonProperty("status") String status) {

    public static BackupResponse from(CollectionJob job) {
        return new BackupResponse(job.taskId(), job.taskIdentifier(), job.deviceId(), "queued");
    }
}
