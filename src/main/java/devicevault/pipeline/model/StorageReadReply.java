package devicevault.pipeline.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Reply a storage worker sends back to the retrieval bridge for a read job.
 */
public record StorageReadReply(
        @JsonProperty("task_id") String taskId,
        @JsonProperty("status") String status,
        @JsonProperty("content") String content,
        @JsonProperty("log") List<String> log) {

    public static StorageReadReply success(String taskId, String content, List<String> log) {
        return new StorageReadReply(taskId, ResultStatus.SUCCESS.wireValue(), content, log);
    }

    public static StorageReadReply failure(String taskId, List<String> log) {
        return new StorageReadReply(taskId, ResultStatus.FAILURE.wireValue(), null, log);
    }

    public boolean isSuccess() {
        return ResultStatus.fromWire(status) == ResultStatus.SUCCESS;
    }
}
