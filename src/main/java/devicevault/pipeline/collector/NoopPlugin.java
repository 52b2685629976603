package devicevault.pipeline.collector;

import java.time.Duration;
import java.util.List;
import java.util.Map;

/**
 * Skips collection and returns empty content. Used for demo devices.
 */
public class NoopPlugin implements BackupPlugin {

    public static final String KEY = "noop";

    @Override
    public String key() {
        return KEY;
    }

    @Override
    public String description() {
        return "Skips backup execution and returns empty content";
    }

    @Override
    public CollectionOutcome collect(Map<String, Object> config, Duration timeout) {
        return CollectionOutcome.success("", List.of("noop: nothing collected"));
    }
}
