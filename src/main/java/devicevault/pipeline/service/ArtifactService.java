package devicevault.pipeline.service;

import devicevault.pipeline.model.Device;
import devicevault.pipeline.model.StorageLocation;
import devicevault.pipeline.model.StoredArtifact;
import devicevault.pipeline.repository.DeviceRepository;
import devicevault.pipeline.repository.StorageLocationRepository;
import devicevault.pipeline.repository.StoredArtifactRepository;
import devicevault.pipeline.retrieval.RetrievalBridge;
import devicevault.pipeline.retrieval.RetrievalException;

import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Stored artifact index and synchronous content download.
 */
public class ArtifactService {

    private final StoredArtifactRepository artifactRepository;
    private final DeviceRepository deviceRepository;
    private final StorageLocationRepository locationRepository;
    private final RetrievalBridge bridge;

    public ArtifactService(StoredArtifactRepository artifactRepository, DeviceRepository deviceRepository,
            StorageLocationRepository locationRepository, RetrievalBridge bridge) {
        this.artifactRepository = artifactRepository;
        this.deviceRepository = deviceRepository;
        this.locationRepository = locationRepository;
        this.bridge = bridge;
    }

    public List<StoredArtifact> listForDevice(long deviceId, int limit) {
        if (limit <= 0) {
            throw new IllegalArgumentException("limit must be positive: " + limit);
        }
        return artifactRepository.findByDevice(deviceId, limit);
    }

    public Optional<StoredArtifact> findById(long artifactId) {
        return artifactRepository.findById(artifactId);
    }

    /**
     * Read the stored content of an artifact through its storage worker.
     * The backend configuration comes from the device's current storage
     * location; an artifact whose device no longer has one is read with an
     * empty configuration.
     *
     * @throws RetrievalException when the artifact was not stored, the worker
     *                            fails, or no reply arrives in time
     */
    public String content(StoredArtifact artifact) {
        if (!artifact.isRetrievable()) {
            throw new RetrievalException(RetrievalException.Reason.NOT_RETRIEVABLE,
                    "artifact " + artifact.id() + " was not stored successfully");
        }
        Map<String, Object> config = deviceRepository.findById(artifact.deviceId())
                .map(Device::storageLocationId)
                .flatMap(locationRepository::findById)
                .map(StorageLocation::config)
                .orElse(Map.of());
        return bridge.fetch(artifact.storageBackend(), artifact.storageRef(), config);
    }
}
