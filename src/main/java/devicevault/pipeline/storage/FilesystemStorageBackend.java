package devicevault.pipeline.storage;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.Map;

/**
 * Stores artifacts as files under the location's base directory ({@code path}
 * config key). References are paths relative to that directory, with
 * forward slashes.
 */
public class FilesystemStorageBackend implements StorageBackend {

    private static final Logger log = LoggerFactory.getLogger(FilesystemStorageBackend.class);

    public static final String CONFIG_PATH = "path";

    @Override
    public String store(String content, String pathHint, Map<String, Object> config) {
        Path base = baseDir(config);
        Path target = resolveInside(base, pathHint);
        try {
            Files.createDirectories(target.getParent());
            Files.writeString(target, content, StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new StorageException("Failed to write " + target + ": " + e.getMessage(), e);
        }
        String ref = base.relativize(target).toString().replace('\\', '/');
        log.debug("Stored {} bytes at {}", content.length(), target);
        return ref;
    }

    @Override
    public String read(String ref, Map<String, Object> config) {
        Path target = resolveInside(baseDir(config), ref);
        try {
            return Files.readString(target, StandardCharsets.UTF_8);
        } catch (NoSuchFileException e) {
            throw new StorageException("Stored artifact not found: " + ref, e);
        } catch (IOException e) {
            throw new StorageException("Failed to read " + target + ": " + e.getMessage(), e);
        }
    }

    private static Path baseDir(Map<String, Object> config) {
        Object path = config == null ? null : config.get(CONFIG_PATH);
        if (path == null || path.toString().isBlank()) {
            throw new StorageException("filesystem storage location has no '" + CONFIG_PATH + "' configured");
        }
        return Path.of(path.toString()).toAbsolutePath().normalize();
    }

    private static Path resolveInside(Path base, String relative) {
        if (relative == null || relative.isBlank()) {
            throw new StorageException("empty storage reference");
        }
        Path resolved = base.resolve(relative).normalize();
        if (!resolved.startsWith(base) || resolved.equals(base)) {
            throw new StorageException("storage reference escapes base directory: " + relative);
        }
        return resolved;
    }
}
