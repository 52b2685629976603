package devicevault.pipeline.model;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * The slice of a managed device that the pipeline needs: where to collect
 * from, with which plugin, on which schedule, through which queue, and where
 * to store the result.
 */
public record Device(
        long id,
        String name,
        String ipAddress,
        String backupMethod,
        boolean enabled,
        Long scheduleId,
        Long collectionGroupId,
        Long storageLocationId,
        Map<String, Object> credentials,
        Instant lastBackupTime,
        String lastBackupStatus) {

    public Device {
        credentials = credentials == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(credentials));
    }

    public boolean hasCollectionGroup() {
        return collectionGroupId != null;
    }
}
