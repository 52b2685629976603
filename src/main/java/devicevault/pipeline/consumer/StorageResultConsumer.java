package devicevault.pipeline.consumer;

import devicevault.pipeline.broker.ResultStream;
import devicevault.pipeline.broker.StreamMessage;
import devicevault.pipeline.model.CollectionResult;
import devicevault.pipeline.model.ResultStatus;
import devicevault.pipeline.model.StorageOperation;
import devicevault.pipeline.model.StorageResultMessage;
import devicevault.pipeline.model.StoredArtifact;
import devicevault.pipeline.repository.CollectionResultRepository;
import devicevault.pipeline.repository.StoredArtifactRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Optional;

/**
 * Builds the retrieval index: one stored-artifact row per store result.
 */
public class StorageResultConsumer extends StreamConsumer {

    private static final Logger log = LoggerFactory.getLogger(StorageResultConsumer.class);

    private final StoredArtifactRepository artifacts;
    private final CollectionResultRepository results;
    private final Clock clock;

    public StorageResultConsumer(ResultStream stream, String streamName, String group, String consumerName,
            int count, Duration block, DeadLetterSink deadLetters,
            StoredArtifactRepository artifacts, CollectionResultRepository results, Clock clock) {
        super(stream, streamName, group, consumerName, count, block, deadLetters);
        this.artifacts = artifacts;
        this.results = results;
        this.clock = clock;
    }

    @Override
    protected void handle(StreamMessage entry) {
        StorageResultMessage message = StorageResultMessage.fromFields(entry.fields());

        StorageOperation operation;
        try {
            operation = StorageOperation.fromWire(message.operation());
        } catch (IllegalArgumentException e) {
            throw new PoisonMessageException("unknown operation '" + message.operation() + "'");
        }
        if (operation != StorageOperation.STORE) {
            log.info("Storage {} result for {} not indexed: {}", operation.wireValue(), message.storageRef(),
                    message.log());
            return;
        }

        String taskIdentifier = Fields.requireText(message.taskIdentifier(), "task_identifier");
        long deviceId = Fields.requireId(message.deviceId(), "device_id");

        if (artifacts.existsByTaskIdentifier(taskIdentifier)) {
            log.info("Stored artifact {} already recorded; skipping redelivery", taskIdentifier);
            return;
        }

        Optional<CollectionResult> origin = results.findByTaskIdentifier(taskIdentifier);
        if (origin.isEmpty() || origin.get().deviceId() != deviceId) {
            throw new PoisonMessageException("no collection result " + taskIdentifier + " for device " + deviceId);
        }

        ResultStatus status = message.resultStatus();
        StoredArtifact artifact = StoredArtifact.builder()
                .taskId(message.taskId())
                .taskIdentifier(taskIdentifier)
                .deviceId(deviceId)
                .storageBackend(message.storageBackend())
                .storageRef(status == ResultStatus.SUCCESS ? message.storageRef() : "")
                .status(status)
                .timestamp(Fields.instantOr(message.timestamp(), clock.instant()))
                .log(message.log())
                .build();

        if (!artifacts.save(artifact)) {
            log.info("Stored artifact {} recorded concurrently; skipping", taskIdentifier);
            return;
        }
        log.info("Indexed stored artifact {} for device {}: {} {}", taskIdentifier, deviceId,
                status.wireValue(), artifact.storageRef());

        Instant initiatedAt = origin.get().initiatedAt();
        if (status == ResultStatus.SUCCESS && initiatedAt != null) {
            long overallMs = Math.max(0, Duration.between(initiatedAt, clock.instant()).toMillis());
            results.updateOverallDuration(taskIdentifier, overallMs);
        }
    }
}
