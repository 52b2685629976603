package devicevault.pipeline.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;
import java.util.Map;
import java.util.Objects;

/**
 * Collection job as it travels from the scheduler (or the API) to a collector
 * worker through a routed queue.
 *
 * @param taskId         unique per enqueue
 * @param taskIdentifier logical correlation key carried through the whole pipeline
 * @param deviceId       device to collect from
 * @param pluginKey      plugin registry key (the device's backup method)
 * @param config         plugin input (ip, credentials, plugin params)
 * @param timeoutSeconds collection timeout handed to the plugin
 * @param catchUp        true for a replay of a missed window inside the catch-up horizon
 * @param initiatedAt    when the job was enqueued
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record CollectionJob(
        @JsonProperty("task_id") String taskId,
        @JsonProperty("task_identifier") String taskIdentifier,
        @JsonProperty("device_id") long deviceId,
        @JsonProperty("plugin_key") String pluginKey,
        @JsonProperty("config") Map<String, Object> config,
        @JsonProperty("timeout") int timeoutSeconds,
        @JsonProperty("catch_up") boolean catchUp,
        @JsonProperty("initiated_at") Instant initiatedAt) {

    public CollectionJob {
        Objects.requireNonNull(taskId, "task_id is required");
        Objects.requireNonNull(taskIdentifier, "task_identifier is required");
        config = config == null ? Map.of() : config;
    }
}
