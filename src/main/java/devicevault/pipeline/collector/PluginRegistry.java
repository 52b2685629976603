package devicevault.pipeline.collector;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Explicit registry of backup plugins, keyed by backup method.
 * Populated at startup; there is no classpath or directory scanning.
 */
public class PluginRegistry {

    private static final Logger log = LoggerFactory.getLogger(PluginRegistry.class);

    private final Map<String, BackupPlugin> plugins = new LinkedHashMap<>();

    /**
     * Registry with the built-in plugins.
     */
    public static PluginRegistry withDefaults() {
        return new PluginRegistry()
                .register(new NoopPlugin())
                .register(new BinaryDummyPlugin());
    }

    public PluginRegistry register(BackupPlugin plugin) {
        BackupPlugin previous = plugins.put(plugin.key(), plugin);
        if (previous != null) {
            log.warn("Backup plugin '{}' replaced by {}", plugin.key(), plugin.getClass().getSimpleName());
        }
        return this;
    }

    public Optional<BackupPlugin> find(String key) {
        return key == null ? Optional.empty() : Optional.ofNullable(plugins.get(key));
    }

    public Set<String> keys() {
        return plugins.keySet();
    }

    /**
     * Run a plugin and normalize the result. Never throws: an unknown key or
     * a plugin exception becomes a failure outcome.
     */
    public CollectionOutcome run(String key, Map<String, Object> config, Duration timeout) {
        Optional<BackupPlugin> plugin = find(key);
        if (plugin.isEmpty()) {
            return CollectionOutcome.failure("unknown backup plugin: " + key);
        }
        try {
            CollectionOutcome outcome = plugin.get().collect(config, timeout);
            return outcome != null ? outcome : CollectionOutcome.failure("plugin returned no result");
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return CollectionOutcome.failure("plugin_exception: interrupted");
        } catch (Exception e) {
            log.warn("Backup plugin '{}' failed: {}", key, e.toString());
            return CollectionOutcome.failure("plugin_exception: " + e);
        }
    }
}
