package devicevault.pipeline.repository;

import devicevault.pipeline.model.StorageLocation;

import java.util.Optional;

/**
 * Configured storage backend instances.
 */
public interface StorageLocationRepository {

    StorageLocation save(StorageLocation location);

    Optional<StorageLocation> findById(long id);
}
