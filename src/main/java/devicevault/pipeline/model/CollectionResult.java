package devicevault.pipeline.model;

import java.time.Instant;
import java.util.List;
import java.util.Objects;

/**
 * Persisted outcome of one collection attempt (or one missed schedule window).
 * Immutable once written, apart from overallDurationMs which is filled in when
 * the matching storage result arrives.
 */
public final class CollectionResult {
    private final Long id;
    private final String taskId;
    private final String taskIdentifier;
    private final long deviceId;
    private final ResultStatus status;
    private final Instant timestamp;
    private final List<String> log;
    private final Long collectionDurationMs;
    private final Instant initiatedAt;
    private final Long overallDurationMs;

    private CollectionResult(Builder builder) {
        this.id = builder.id;
        this.taskId = builder.taskId == null ? "" : builder.taskId;
        this.taskIdentifier = Objects.requireNonNull(builder.taskIdentifier, "taskIdentifier is required");
        this.deviceId = builder.deviceId;
        this.status = Objects.requireNonNull(builder.status, "status is required");
        this.timestamp = Objects.requireNonNull(builder.timestamp, "timestamp is required");
        this.log = builder.log == null ? List.of() : List.copyOf(builder.log);
        this.collectionDurationMs = builder.collectionDurationMs;
        this.initiatedAt = builder.initiatedAt;
        this.overallDurationMs = builder.overallDurationMs;
    }

    public Long id() {
        return id;
    }

    public String taskId() {
        return taskId;
    }

    public String taskIdentifier() {
        return taskIdentifier;
    }

    public long deviceId() {
        return deviceId;
    }

    public ResultStatus status() {
        return status;
    }

    public Instant timestamp() {
        return timestamp;
    }

    public List<String> log() {
        return log;
    }

    public Long collectionDurationMs() {
        return collectionDurationMs;
    }

    public Instant initiatedAt() {
        return initiatedAt;
    }

    public Long overallDurationMs() {
        return overallDurationMs;
    }

    public boolean isSuccess() {
        return status == ResultStatus.SUCCESS;
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private Long id;
        private String taskId;
        private String taskIdentifier;
        private long deviceId;
        private ResultStatus status = ResultStatus.FAILURE;
        private Instant timestamp;
        private List<String> log;
        private Long collectionDurationMs;
        private Instant initiatedAt;
        private Long overallDurationMs;

        public Builder id(Long id) {
            this.id = id;
            return this;
        }

        public Builder taskId(String taskId) {
            this.taskId = taskId;
            return this;
        }

        public Builder taskIdentifier(String taskIdentifier) {
            this.taskIdentifier = taskIdentifier;
            return this;
        }

        public Builder deviceId(long deviceId) {
            this.deviceId = deviceId;
            return this;
        }

        public Builder status(ResultStatus status) {
            this.status = status;
            return this;
        }

        public Builder timestamp(Instant timestamp) {
            this.timestamp = timestamp;
            return this;
        }

        public Builder log(List<String> log) {
            this.log = log;
            return this;
        }

        public Builder collectionDurationMs(Long collectionDurationMs) {
            this.collectionDurationMs = collectionDurationMs;
            return this;
        }

        public Builder initiatedAt(Instant initiatedAt) {
            this.initiatedAt = initiatedAt;
            return this;
        }

        public Builder overallDurationMs(Long overallDurationMs) {
            this.overallDurationMs = overallDurationMs;
            return this;
        }

        public CollectionResult build() {
            return new CollectionResult(this);
        }
    }

    @Override
    public String toString() {
        return "CollectionResult{taskIdentifier='" + taskIdentifier + "', deviceId=" + deviceId
                + ", status=" + status + "}";
    }
}
