package devicevault.pipeline.collector;

import java.time.Duration;
import java.util.Map;

/**
 * A backup method: collects a configuration artifact from one device.
 *
 * The config map carries at least {@code ip} and {@code credentials}.
 * Implementations may throw; the registry turns exceptions into failures.
 */
public interface BackupPlugin {

    /** Registry key, matched against the device's backup method */
    String key();

    String description();

    CollectionOutcome collect(Map<String, Object> config, Duration timeout) throws Exception;
}
