package devicevault.pipeline.service;

import devicevault.pipeline.model.CollectionJob;
import devicevault.pipeline.model.Device;
import devicevault.pipeline.model.TaskIdentifiers;
import devicevault.pipeline.repository.DeviceRepository;
import devicevault.pipeline.scheduler.BackupDispatcher;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.util.Optional;

/**
 * On-demand backups. Jobs go through the same dispatcher and routing as
 * scheduled ones; only the task identifier differs.
 */
public class BackupService {

    private static final Logger log = LoggerFactory.getLogger(BackupService.class);

    private final DeviceRepository deviceRepository;
    private final BackupDispatcher dispatcher;
    private final Clock clock;

    public BackupService(DeviceRepository deviceRepository, BackupDispatcher dispatcher, Clock clock) {
        this.deviceRepository = deviceRepository;
        this.dispatcher = dispatcher;
        this.clock = clock;
    }

    /**
     * Enqueue a collection job for one device.
     *
     * @return the dispatched job, or empty if the device does not exist
     * @throws IllegalArgumentException if the device is disabled
     */
    public Optional<CollectionJob> backupNow(long deviceId) {
        Optional<Device> device = deviceRepository.findById(deviceId);
        if (device.isEmpty()) {
            return Optional.empty();
        }
        if (!device.get().enabled()) {
            throw new IllegalArgumentException("device " + deviceId + " is disabled");
        }

        String taskIdentifier = TaskIdentifiers.manual(deviceId, Instant.now(clock));
        CollectionJob job = dispatcher.dispatch(device.get(), taskIdentifier, false);
        log.info("On-demand backup {} queued for device {}", taskIdentifier, deviceId);
        return Optional.of(job);
    }
}
