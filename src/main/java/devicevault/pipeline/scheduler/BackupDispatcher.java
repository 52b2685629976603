package devicevault.pipeline.scheduler;

import devicevault.pipeline.broker.Publisher;
import devicevault.pipeline.broker.QueueRouter;
import devicevault.pipeline.model.CollectionJob;
import devicevault.pipeline.model.Device;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.UUID;

/**
 * Turns a device into a collection job and enqueues it on the device's
 * collector queue. Used by the scheduler and by on-demand backups.
 */
public class BackupDispatcher {

    private static final Logger log = LoggerFactory.getLogger(BackupDispatcher.class);

    private final Publisher publisher;
    private final QueueRouter router;
    private final Duration collectionTimeout;
    private final Clock clock;

    public BackupDispatcher(Publisher publisher, QueueRouter router, Duration collectionTimeout, Clock clock) {
        this.publisher = publisher;
        this.router = router;
        this.collectionTimeout = collectionTimeout;
        this.clock = clock;
    }

    /**
     * Enqueue one collection job.
     *
     * @throws devicevault.pipeline.broker.BrokerException if the queue stays unreachable
     */
    public CollectionJob dispatch(Device device, String taskIdentifier, boolean catchUp) {
        CollectionJob job = new CollectionJob(
                UUID.randomUUID().toString(),
                taskIdentifier,
                device.id(),
                device.backupMethod(),
                pluginConfig(device),
                (int) collectionTimeout.toSeconds(),
                catchUp,
                clock.instant());

        String queue = router.collectorQueue(device);
        publisher.enqueue(queue, job);
        log.info("Dispatched {} for device {} ({}) to {}", taskIdentifier, device.id(), device.name(), queue);
        return job;
    }

    static Map<String, Object> pluginConfig(Device device) {
        Map<String, Object> config = new LinkedHashMap<>();
        config.put("device_id", device.id());
        config.put("name", device.name());
        config.put("ip", device.ipAddress());
        config.put("credentials", device.credentials());
        return config;
    }
}
