package devicevault.pipeline.repository;

import devicevault.pipeline.model.CollectionResult;

import java.util.List;
import java.util.Optional;

/**
 * Persistence for collection outcomes, one row per execution attempt.
 */
public interface CollectionResultRepository {

    /**
     * Insert a result.
     *
     * @return false if a row with the same task identifier already exists
     */
    boolean save(CollectionResult result);

    boolean existsByTaskIdentifier(String taskIdentifier);

    Optional<CollectionResult> findByTaskIdentifier(String taskIdentifier);

    /**
     * Most recent results for a device.
     */
    List<CollectionResult> findByDevice(long deviceId, int limit);

    /**
     * Record the end-to-end duration once the artifact has been stored.
     */
    boolean updateOverallDuration(String taskIdentifier, long overallDurationMs);
}
