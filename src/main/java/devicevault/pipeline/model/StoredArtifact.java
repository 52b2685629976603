package devicevault.pipeline.model;

import java.time.Instant;
import java.util.List;
import java.util.Objects;

/**
 * Retrieval index entry for a stored backup. Holds only the backend-opaque
 * reference, never the content.
 */
public final class StoredArtifact {
    private final Long id;
    private final String taskId;
    private final String taskIdentifier;
    private final long deviceId;
    private final String storageBackend;
    private final String storageRef;
    private final ResultStatus status;
    private final Instant timestamp;
    private final List<String> log;

    private StoredArtifact(Builder builder) {
        this.id = builder.id;
        this.taskId = builder.taskId == null ? "" : builder.taskId;
        this.taskIdentifier = Objects.requireNonNull(builder.taskIdentifier, "taskIdentifier is required");
        this.deviceId = builder.deviceId;
        this.storageBackend = builder.storageBackend == null ? "" : builder.storageBackend;
        this.storageRef = builder.storageRef == null ? "" : builder.storageRef;
        this.status = Objects.requireNonNull(builder.status, "status is required");
        this.timestamp = Objects.requireNonNull(builder.timestamp, "timestamp is required");
        this.log = builder.log == null ? List.of() : List.copyOf(builder.log);
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

    public String storageBackend() {
        return storageBackend;
    }

    public String storageRef() {
        return storageRef;
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

    /** Only successfully stored artifacts with a reference can be read back. */
    public boolean isRetrievable() {
        return status == ResultStatus.SUCCESS && !storageRef.isBlank();
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private Long id;
        private String taskId;
        private String taskIdentifier;
        private long deviceId;
        private String storageBackend;
        private String storageRef;
        private ResultStatus status = ResultStatus.FAILURE;
        private Instant timestamp;
        private List<String> log;

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

        public Builder storageBackend(String storageBackend) {
            this.storageBackend = storageBackend;
            return this;
        }

        public Builder storageRef(String storageRef) {
            this.storageRef = storageRef;
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

        public StoredArtifact build() {
            return new StoredArtifact(this);
        }
    }

    @Override
    public String toString() {
        return "StoredArtifact{id=" + id + ", taskIdentifier='" + taskIdentifier + "', backend='"
                + storageBackend + "', status=" + status + "}";
    }
}
