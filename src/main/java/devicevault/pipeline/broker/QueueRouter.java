package devicevault.pipeline.broker;

import devicevault.pipeline.model.Device;

/**
 * Maps devices to collector queues and storage backends to storage queues.
 * Grouped devices go to their group's dedicated queue; ungrouped devices go
 * to the shared default queue that every collector worker listens on.
 */
public final class QueueRouter {

    public static final String GROUP_QUEUE_PREFIX = "collector.group.";
    public static final String STORAGE_QUEUE_PREFIX = "storage.";

    private final String defaultCollectorQueue;

    public QueueRouter(String defaultCollectorQueue) {
        this.defaultCollectorQueue = defaultCollectorQueue;
    }

    public String collectorQueue(Device device) {
        if (device.hasCollectionGroup()) {
            return groupQueue(device.collectionGroupId());
        }
        return defaultCollectorQueue;
    }

    public String defaultCollectorQueue() {
        return defaultCollectorQueue;
    }

    public static String groupQueue(long collectionGroupId) {
        return GROUP_QUEUE_PREFIX + collectionGroupId;
    }

    public static String storageQueue(String backendKind) {
        if (backendKind == null || backendKind.isBlank()) {
            throw new IllegalArgumentException("storage backend kind is required");
        }
        return STORAGE_QUEUE_PREFIX + backendKind.trim().toLowerCase();
    }
}
