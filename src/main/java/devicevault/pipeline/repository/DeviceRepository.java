package devicevault.pipeline.repository;

import devicevault.pipeline.model.CollectionGroup;
import devicevault.pipeline.model.Device;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Read access to devices and their collection groups, plus the last-backup
 * bookkeeping the pipeline writes back.
 */
public interface DeviceRepository {

    /**
     * Insert a new device (id == 0) or update an existing one.
     */
    Device save(Device device);

    Optional<Device> findById(long id);

    /**
     * Enabled devices attached to a schedule, ordered by ID.
     */
    List<Device> findEnabledBySchedule(long scheduleId);

    /**
     * Record the latest collection outcome on the device.
     *
     * @return true if the device exists
     */
    boolean updateLastBackup(long deviceId, Instant time, String status);

    CollectionGroup saveCollectionGroup(String name);

    Optional<CollectionGroup> findCollectionGroup(long id);
}
