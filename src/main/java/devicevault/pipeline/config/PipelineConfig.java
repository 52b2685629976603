package devicevault.pipeline.config;

import java.time.Duration;
import java.time.ZoneId;

/**
 * Configuration holder for the scheduler, pipeline workers and consumers.
 * All settings have sensible defaults.
 */
public final class PipelineConfig {

    // Database settings
    private String databaseUrl = "jdbc:h2:file:./data/devicevault;AUTO_SERVER=TRUE;MODE=PostgreSQL;DATABASE_TO_UPPER=FALSE";
    private int databasePoolSize = 10;

    // Broker settings
    private String redisUrl = "redis://localhost:6379/1";

    // Scheduler settings
    private boolean schedulerEnabled = true;
    private Duration restartWindow = Duration.ofMinutes(120);
    private Duration tickInterval = Duration.ofSeconds(60);
    private String lockKey = "devicevault:scheduler:lock";
    private Duration lockTtl = Duration.ofSeconds(180);
    private Duration lockRenewInterval = Duration.ofSeconds(60);
    private ZoneId displayTimezone = ZoneId.of("UTC");
    private int missedLookbackDays = 365;

    // Stream settings
    private String collectionResultsStream = "device:results";
    private String collectionResultsGroup = "devicevault";
    private String storageResultsStream = "storage:results";
    private String storageResultsGroup = "devicevault-storage";
    private String deadLetterSuffix = ":dead";
    private int streamReadCount = 10;
    private Duration streamBlock = Duration.ofMillis(2000);
    private String consumerName = "consumer-" + ProcessHandle.current().pid();

    // Worker settings
    private Duration collectionTimeout = Duration.ofSeconds(240);
    private String defaultCollectorQueue = "collector";
    private Duration retrievalTimeout = Duration.ofSeconds(60);

    // Server settings
    private int serverPort = 8080;
    private String serverHost = "0.0.0.0";

    PipelineConfig() {
    }

    public static PipelineConfig defaults() {
        return new PipelineConfig();
    }

    /**
     * Defaults, then the INI file named by DEVICEVAULT_CONFIG (if any), then
     * individual environment variables.
     */
    public static PipelineConfig fromEnv() {
        PipelineConfig config = new PipelineConfig();

        String iniPath = System.getenv("DEVICEVAULT_CONFIG");
        if (iniPath != null && !iniPath.isBlank()) {
            IniConfigLoader.apply(java.nio.file.Path.of(iniPath), config);
        }

        String dbUrl = System.getenv("DEVICEVAULT_DB_URL");
        if (dbUrl != null && !dbUrl.isBlank()) {
            config.databaseUrl = dbUrl;
        }

        String redisUrl = System.getenv("DEVICEVAULT_REDIS_URL");
        if (redisUrl != null && !redisUrl.isBlank()) {
            config.redisUrl = redisUrl;
        }

        String tz = System.getenv("DEVICEVAULT_DISPLAY_TIMEZONE");
        if (tz != null && !tz.isBlank()) {
            config.displayTimezone = ZoneId.of(tz);
        }

        String window = System.getenv("DEVICEVAULT_RESTART_WINDOW_MINUTES");
        if (window != null && !window.isBlank()) {
            config.restartWindow = Duration.ofMinutes(Long.parseLong(window));
        }

        String port = System.getenv("DEVICEVAULT_PORT");
        if (port != null && !port.isBlank()) {
            config.serverPort = Integer.parseInt(port);
        }

        String consumer = System.getenv("DEVICEVAULT_CONSUMER_NAME");
        if (consumer != null && !consumer.isBlank()) {
            config.consumerName = consumer;
        }

        return config;
    }

    // Getters
    public String databaseUrl() {
        return databaseUrl;
    }

    public int databasePoolSize() {
        return databasePoolSize;
    }

    public String redisUrl() {
        return redisUrl;
    }

    public boolean schedulerEnabled() {
        return schedulerEnabled;
    }

    public Duration restartWindow() {
        return restartWindow;
    }

    public Duration tickInterval() {
        return tickInterval;
    }

    public String lockKey() {
        return lockKey;
    }

    public Duration lockTtl() {
        return lockTtl;
    }

    public Duration lockRenewInterval() {
        return lockRenewInterval;
    }

    public ZoneId displayTimezone() {
        return displayTimezone;
    }

    public int missedLookbackDays() {
        return missedLookbackDays;
    }

    public String collectionResultsStream() {
        return collectionResultsStream;
    }

    public String collectionResultsGroup() {
        return collectionResultsGroup;
    }

    public String storageResultsStream() {
        return storageResultsStream;
    }

    public String storageResultsGroup() {
        return storageResultsGroup;
    }

    public String deadLetterSuffix() {
        return deadLetterSuffix;
    }

    public int streamReadCount() {
        return streamReadCount;
    }

    public Duration streamBlock() {
        return streamBlock;
    }

    public String consumerName() {
        return consumerName;
    }

    public Duration collectionTimeout() {
        return collectionTimeout;
    }

    public String defaultCollectorQueue() {
        return defaultCollectorQueue;
    }

    public Duration retrievalTimeout() {
        return retrievalTimeout;
    }

    public int serverPort() {
        return serverPort;
    }

    public String serverHost() {
        return serverHost;
    }

    // Fluent setters for testing/customization
    public PipelineConfig withDatabaseUrl(String url) {
        this.databaseUrl = url;
        return this;
    }

    public PipelineConfig withDatabasePoolSize(int size) {
        this.databasePoolSize = size;
        return this;
    }

    public PipelineConfig withRedisUrl(String url) {
        this.redisUrl = url;
        return this;
    }

    public PipelineConfig withSchedulerEnabled(boolean enabled) {
        this.schedulerEnabled = enabled;
        return this;
    }

    public PipelineConfig withRestartWindow(Duration window) {
        this.restartWindow = window;
        return this;
    }

    public PipelineConfig withTickInterval(Duration interval) {
        this.tickInterval = interval;
        return this;
    }

    public PipelineConfig withLockKey(String key) {
        this.lockKey = key;
        return this;
    }

    public PipelineConfig withLockTtl(Duration ttl) {
        this.lockTtl = ttl;
        return this;
    }

    public PipelineConfig withLockRenewInterval(Duration interval) {
        this.lockRenewInterval = interval;
        return this;
    }

    public PipelineConfig withDisplayTimezone(ZoneId zone) {
        this.displayTimezone = zone;
        return this;
    }

    public PipelineConfig withMissedLookbackDays(int days) {
        this.missedLookbackDays = days;
        return this;
    }

    public PipelineConfig withCollectionResults(String stream, String group) {
        this.collectionResultsStream = stream;
        this.collectionResultsGroup = group;
        return this;
    }

    public PipelineConfig withStorageResults(String stream, String group) {
        this.storageResultsStream = stream;
        this.storageResultsGroup = group;
        return this;
    }

    public PipelineConfig withDeadLetterSuffix(String suffix) {
        this.deadLetterSuffix = suffix;
        return this;
    }

    public PipelineConfig withStreamReadCount(int count) {
        this.streamReadCount = count;
        return this;
    }

    public PipelineConfig withStreamBlock(Duration block) {
        this.streamBlock = block;
        return this;
    }

    public PipelineConfig withConsumerName(String name) {
        this.consumerName = name;
        return this;
    }

    public PipelineConfig withCollectionTimeout(Duration timeout) {
        this.collectionTimeout = timeout;
        return this;
    }

    public PipelineConfig withDefaultCollectorQueue(String queue) {
        this.defaultCollectorQueue = queue;
        return this;
    }

    public PipelineConfig withRetrievalTimeout(Duration timeout) {
        this.retrievalTimeout = timeout;
        return this;
    }

    public PipelineConfig withServerPort(int port) {
        this.serverPort = port;
        return this;
    }

    public PipelineConfig withServerHost(String host) {
        this.serverHost = host;
        return this;
    }

    @Override
    public String toString() {
        return "PipelineConfig{" +
                "databaseUrl='" + databaseUrl + '\'' +
                ", redisUrl='" + redisUrl + '\'' +
                ", schedulerEnabled=" + schedulerEnabled +
                ", restartWindow=" + restartWindow.toMinutes() + "min" +
                ", displayTimezone=" + displayTimezone +
                ", serverPort=" + serverPort +
                '}';
    }
}
