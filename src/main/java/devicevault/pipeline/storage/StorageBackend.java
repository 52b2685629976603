package devicevault.pipeline.storage;

import java.util.Map;

/**
 * Store/read capability pair of one storage backend kind. References
 * returned by {@link #store} are opaque to everyone except the backend.
 */
public interface StorageBackend {

    /**
     * @param content  artifact content
     * @param pathHint relative location suggestion, {@code <device>/<identifier>.txt}
     * @param config   location-specific settings
     * @return reference that {@link #read} accepts
     * @throws StorageException if the content could not be written
     */
    String store(String content, String pathHint, Map<String, Object> config);

    /**
     * @throws StorageException if the reference cannot be resolved or read
     */
    String read(String ref, Map<String, Object> config);
}
