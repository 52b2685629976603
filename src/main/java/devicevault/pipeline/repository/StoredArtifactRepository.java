package devicevault.pipeline.repository;

import devicevault.pipeline.model.StoredArtifact;

import java.util.List;
import java.util.Optional;

/**
 * The authoritative retrieval index. Written only by the storage result consumer.
 */
public interface StoredArtifactRepository {

    /**
     * Insert an artifact row.
     *
     * @return false if a row with the same task identifier already exists
     */
    boolean save(StoredArtifact artifact);

    boolean existsByTaskIdentifier(String taskIdentifier);

    Optional<StoredArtifact> findById(long id);

    Optional<StoredArtifact> findByTaskIdentifier(String taskIdentifier);

    /**
     * Most recent artifacts for a device.
     */
    List<StoredArtifact> findByDevice(long deviceId, int limit);
}
