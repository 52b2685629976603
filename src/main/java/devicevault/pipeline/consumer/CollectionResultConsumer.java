package devicevault.pipeline.consumer;

import devicevault.pipeline.broker.ResultStream;
import devicevault.pipeline.broker.StreamMessage;
import devicevault.pipeline.model.CollectionResult;
import devicevault.pipeline.model.CollectionResultMessage;
import devicevault.pipeline.model.Device;
import devicevault.pipeline.model.ResultStatus;
import devicevault.pipeline.model.StorageJob;
import devicevault.pipeline.model.StorageLocation;
import devicevault.pipeline.repository.CollectionResultRepository;
import devicevault.pipeline.repository.DeviceRepository;
import devicevault.pipeline.repository.StorageLocationRepository;
import devicevault.pipeline.storage.StorageDispatcher;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Optional;

/**
 * Persists collection results and, for successful ones, starts the storage
 * step by dispatching exactly one storage job.
 */
public class CollectionResultConsumer extends StreamConsumer {

    private static final Logger log = LoggerFactory.getLogger(CollectionResultConsumer.class);

    private final DeviceRepository devices;
    private final CollectionResultRepository results;
    private final StorageLocationRepository locations;
    private final StorageDispatcher storageDispatcher;
    private final Clock clock;

    public CollectionResultConsumer(ResultStream stream, String streamName, String group, String consumerName,
            int count, Duration block, DeadLetterSink deadLetters,
            DeviceRepository devices, CollectionResultRepository results, StorageLocationRepository locations,
            StorageDispatcher storageDispatcher, Clock clock) {
        super(stream, streamName, group, consumerName, count, block, deadLetters);
        this.devices = devices;
        this.results = results;
        this.locations = locations;
        this.storageDispatcher = storageDispatcher;
        this.clock = clock;
    }

    @Override
    protected void handle(StreamMessage entry) {
        CollectionResultMessage message = CollectionResultMessage.fromFields(entry.fields());
        String taskIdentifier = Fields.requireText(message.taskIdentifier(), "task_identifier");
        long deviceId = Fields.requireId(message.deviceId(), "device_id");

        if (results.existsByTaskIdentifier(taskIdentifier)) {
            log.info("Collection result {} already recorded; skipping redelivery", taskIdentifier);
            return;
        }

        Device device = devices.findById(deviceId)
                .orElseThrow(() -> new PoisonMessageException("unknown device " + deviceId + " for " + taskIdentifier));

        ResultStatus status = message.resultStatus();
        Instant timestamp = Fields.instantOr(message.timestamp(), clock.instant());
        CollectionResult result = CollectionResult.builder()
                .taskId(message.taskId())
                .taskIdentifier(taskIdentifier)
                .deviceId(deviceId)
                .status(status)
                .timestamp(timestamp)
                .log(message.log())
                .collectionDurationMs(Fields.optionalLong(message.collectionDurationMs()))
                .initiatedAt(Fields.instantOr(message.initiatedAt(), null))
                .build();

        if (!results.save(result)) {
            log.info("Collection result {} recorded concurrently; skipping", taskIdentifier);
            return;
        }
        devices.updateLastBackup(deviceId, timestamp, status.wireValue());
        log.info("Recorded collection result {} for device {}: {}", taskIdentifier, deviceId, status.wireValue());

        if (status == ResultStatus.SUCCESS) {
            dispatchStorage(device, message, result);
        }
    }

    private void dispatchStorage(Device device, CollectionResultMessage message, CollectionResult result) {
        if (device.storageLocationId() == null) {
            log.warn("Device {} has no storage location; {} will not be stored", device.id(),
                    result.taskIdentifier());
            return;
        }
        Optional<StorageLocation> location = locations.findById(device.storageLocationId());
        if (location.isEmpty()) {
            log.warn("Storage location {} of device {} does not exist; {} will not be stored",
                    device.storageLocationId(), device.id(), result.taskIdentifier());
            return;
        }

        try {
            storageDispatcher.dispatch(StorageJob.store(result.taskId(), result.taskIdentifier(), device.id(),
                    location.get(), message.deviceConfig(), result.initiatedAt()));
        } catch (RuntimeException e) {
            // the result is recorded; re-running the backup recovers the artifact
            log.error("Failed to dispatch storage job for {}", result.taskIdentifier(), e);
        }
    }
}
