package devicevault.pipeline.config;

import org.ini4j.Ini;
import org.ini4j.Profile;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.time.ZoneId;

/**
 * Loads pipeline settings from an INI file.
 * Supports sections [database], [redis], [scheduler], [streams], [workers], [server].
 * Missing sections and keys keep their defaults.
 */
public final class IniConfigLoader {

    private static final Logger log = LoggerFactory.getLogger(IniConfigLoader.class);

    private IniConfigLoader() {
    }

    public static PipelineConfig load(Path file) {
        PipelineConfig config = PipelineConfig.defaults();
        apply(file, config);
        return config;
    }

    static void apply(Path file, PipelineConfig config) {
        if (!Files.exists(file)) {
            log.warn("Config file not found: {}, using defaults", file);
            return;
        }

        Ini ini;
        try {
            ini = new Ini(file.toFile());
        } catch (IOException e) {
            throw new IllegalArgumentException("Failed to read config file " + file, e);
        }

        Profile.Section database = ini.get("database");
        if (database != null) {
            String url = opt(database, "url");
            if (url != null) config.withDatabaseUrl(url);
            String pool = opt(database, "pool_size");
            if (pool != null) config.withDatabasePoolSize(Integer.parseInt(pool));
        }

        Profile.Section redis = ini.get("redis");
        if (redis != null) {
            String url = opt(redis, "url");
            if (url != null) config.withRedisUrl(url);
        }

        Profile.Section scheduler = ini.get("scheduler");
        if (scheduler != null) {
            String enabled = opt(scheduler, "enabled");
            if (enabled != null) config.withSchedulerEnabled(Boolean.parseBoolean(enabled));
            String window = opt(scheduler, "restart_window_minutes");
            if (window != null) config.withRestartWindow(Duration.ofMinutes(Long.parseLong(window)));
            String tick = opt(scheduler, "tick_interval_seconds");
            if (tick != null) config.withTickInterval(Duration.ofSeconds(Long.parseLong(tick)));
            String lockKey = opt(scheduler, "lock_key");
            if (lockKey != null) config.withLockKey(lockKey);
            String ttl = opt(scheduler, "lock_ttl_seconds");
            if (ttl != null) config.withLockTtl(Duration.ofSeconds(Long.parseLong(ttl)));
            String renew = opt(scheduler, "lock_renew_seconds");
            if (renew != null) config.withLockRenewInterval(Duration.ofSeconds(Long.parseLong(renew)));
            String tz = opt(scheduler, "display_timezone");
            if (tz != null) config.withDisplayTimezone(ZoneId.of(tz));
            String lookback = opt(scheduler, "missed_lookback_days");
            if (lookback != null) config.withMissedLookbackDays(Integer.parseInt(lookback));
        }

        Profile.Section streams = ini.get("streams");
        if (streams != null) {
            config.withCollectionResults(
                    opt(streams, "collection_results", config.collectionResultsStream()),
                    opt(streams, "collection_group", config.collectionResultsGroup()));
            config.withStorageResults(
                    opt(streams, "storage_results", config.storageResultsStream()),
                    opt(streams, "storage_group", config.storageResultsGroup()));
            String count = opt(streams, "read_count");
            if (count != null) config.withStreamReadCount(Integer.parseInt(count));
            String block = opt(streams, "block_millis");
            if (block != null) config.withStreamBlock(Duration.ofMillis(Long.parseLong(block)));
            String suffix = opt(streams, "dead_letter_suffix");
            if (suffix != null) config.withDeadLetterSuffix(suffix);
        }

        Profile.Section workers = ini.get("workers");
        if (workers != null) {
            String timeout = opt(workers, "collection_timeout_seconds");
            if (timeout != null) config.withCollectionTimeout(Duration.ofSeconds(Long.parseLong(timeout)));
            String queue = opt(workers, "default_collector_queue");
            if (queue != null) config.withDefaultCollectorQueue(queue);
            String retrieval = opt(workers, "retrieval_timeout_seconds");
            if (retrieval != null) config.withRetrievalTimeout(Duration.ofSeconds(Long.parseLong(retrieval)));
        }

        Profile.Section server = ini.get("server");
        if (server != null) {
            String host = opt(server, "host");
            if (host != null) config.withServerHost(host);
            String port = opt(server, "port");
            if (port != null) config.withServerPort(Integer.parseInt(port));
        }

        log.info("Loaded config from {}", file);
    }

    private static String opt(Profile.Section section, String key) {
        String value = section.get(key);
        return value == null || value.isBlank() ? null : value.trim();
    }

    private static String opt(Profile.Section section, String key, String def) {
        String value = opt(section, key);
        return value != null ? value : def;
    }
}
