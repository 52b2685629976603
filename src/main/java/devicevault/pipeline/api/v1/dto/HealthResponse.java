package devicevault.pipeline.api.v1.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;

/**
 * Response DTO for health check.
 * GET /api/v1/health
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record HealthResponse(
        @JsonProperty("status") String status,
        @JsonProperty("database") String database,
        @JsonProperty("broker") String broker,
        @JsonProperty("uptime") String uptime,
        @JsonProperty("version") String version,
        @JsonProperty("schedulerRunning") Boolean schedulerRunning,
        @JsonProperty("schedulerLastTick") Instant schedulerLastTick) {

    public static HealthResponse healthy(String uptime, String version, boolean schedulerRunning,
            Instant schedulerLastTick) {
        return new HealthResponse("healthy", "ok", "ok", uptime, version, schedulerRunning, schedulerLastTick);
    }

    public static HealthResponse unhealthy(String database, String broker) {
        return new HealthResponse("unhealthy", database, broker, null, null, null, null);
    }
}
