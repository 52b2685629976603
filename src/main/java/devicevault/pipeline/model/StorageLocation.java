package devicevault.pipeline.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * A configured storage backend instance (e.g. a filesystem root or a git repository).
 *
 * @param id          location ID
 * @param name        display name
 * @param backendKind backend type key ({@code fs}, {@code git}, ...), selects the storage queue
 * @param config      backend specific settings, passed through to the worker untouched
 */
public record StorageLocation(long id, String name, String backendKind, Map<String, Object> config) {

    public StorageLocation {
        config = config == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(config));
    }
}
