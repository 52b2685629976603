package devicevault.pipeline.storage;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Storage backends by kind. One backend may be registered under several kinds.
 */
public class StorageBackendRegistry {

    private final Map<String, StorageBackend> backends = new LinkedHashMap<>();

    public static StorageBackendRegistry withDefaults() {
        FilesystemStorageBackend fs = new FilesystemStorageBackend();
        return new StorageBackendRegistry()
                .register("fs", fs)
                .register("filesystem", fs);
    }

    public StorageBackendRegistry register(String kind, StorageBackend backend) {
        backends.put(kind, backend);
        return this;
    }

    public Optional<StorageBackend> find(String kind) {
        return kind == null ? Optional.empty() : Optional.ofNullable(backends.get(kind));
    }

    public Set<String> kinds() {
        return backends.keySet();
    }
}
