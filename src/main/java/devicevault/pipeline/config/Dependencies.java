package devicevault.pipeline.config;

import devicevault.pipeline.api.v1.ArtifactController;
import devicevault.pipeline.api.v1.BackupController;
import devicevault.pipeline.api.v1.HealthController;
import devicevault.pipeline.broker.JobQueue;
import devicevault.pipeline.broker.LockStore;
import devicevault.pipeline.broker.Publisher;
import devicevault.pipeline.broker.QueueRouter;
import devicevault.pipeline.broker.RedisConnection;
import devicevault.pipeline.broker.RedisJobQueue;
import devicevault.pipeline.broker.RedisLockStore;
import devicevault.pipeline.broker.RedisResultStream;
import devicevault.pipeline.broker.ResultStream;
import devicevault.pipeline.collector.CollectorWorker;
import devicevault.pipeline.collector.PluginRegistry;
import devicevault.pipeline.consumer.CollectionResultConsumer;
import devicevault.pipeline.consumer.DeadLetterSink;
import devicevault.pipeline.consumer.StorageResultConsumer;
import devicevault.pipeline.repository.CollectionResultRepository;
import devicevault.pipeline.repository.DeviceRepository;
import devicevault.pipeline.repository.ScheduleRepository;
import devicevault.pipeline.repository.SchedulerStateRepository;
import devicevault.pipeline.repository.StorageLocationRepository;
import devicevault.pipeline.repository.StoredArtifactRepository;
import devicevault.pipeline.retrieval.RetrievalBridge;
import devicevault.pipeline.scheduler.BackupDispatcher;
import devicevault.pipeline.scheduler.LockOwner;
import devicevault.pipeline.scheduler.MissedWindowRecovery;
import devicevault.pipeline.scheduler.ProcessProbe;
import devicevault.pipeline.scheduler.ScheduleTicker;
import devicevault.pipeline.scheduler.SchedulerDaemon;
import devicevault.pipeline.scheduler.SchedulerLock;
import devicevault.pipeline.server.PipelineHttpServer;
import devicevault.pipeline.server.RouterHandler;
import devicevault.pipeline.service.ArtifactService;
import devicevault.pipeline.service.BackupService;
import devicevault.pipeline.service.ScheduleService;
import devicevault.pipeline.storage.StorageBackendRegistry;
import devicevault.pipeline.storage.StorageDispatcher;
import devicevault.pipeline.storage.StorageWorker;
import devicevault.pipeline.store.Database;
import devicevault.pipeline.store.JdbcCollectionResultRepository;
import devicevault.pipeline.store.JdbcDeviceRepository;
import devicevault.pipeline.store.JdbcScheduleRepository;
import devicevault.pipeline.store.JdbcSchedulerStateRepository;
import devicevault.pipeline.store.JdbcStorageLocationRepository;
import devicevault.pipeline.store.JdbcStoredArtifactRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.util.List;

/**
 * Manual dependency injection container.
 * Creates and wires everything the CLI roles need; each role only pulls
 * the parts it uses.
 *
 * Usage:
 *
 * <pre>
 * try (Dependencies deps = Dependencies.create(PipelineConfig.fromEnv())) {
 *     int exit = deps.schedulerDaemon().run();
 * }
 * </pre>
 */
public final class Dependencies implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(Dependencies.class);

    private static final Duration REPLY_QUEUE_GRACE = Duration.ofSeconds(60);

    private final PipelineConfig config;
    private final Clock clock;

    // Infrastructure
    private final Database database;
    private final RedisConnection redis;
    private final JobQueue jobQueue;
    private final ResultStream resultStream;
    private final LockStore lockStore;
    private final Publisher publisher;
    private final QueueRouter queueRouter;

    // Repositories
    private final ScheduleRepository scheduleRepository;
    private final DeviceRepository deviceRepository;
    private final StorageLocationRepository storageLocationRepository;
    private final SchedulerStateRepository schedulerStateRepository;
    private final CollectionResultRepository collectionResultRepository;
    private final StoredArtifactRepository storedArtifactRepository;

    // Pipeline
    private final BackupDispatcher backupDispatcher;
    private final StorageDispatcher storageDispatcher;
    private final RetrievalBridge retrievalBridge;

    // Services
    private final ScheduleService scheduleService;
    private final BackupService backupService;
    private final ArtifactService artifactService;

    // Router (lazy-initialized)
    private RouterHandler routerHandler;

    private Dependencies(PipelineConfig config) {
        this.config = config;
        this.clock = Clock.systemUTC();

        log.info("Initializing dependencies with config: {}", config);

        this.database = new Database(config);
        this.redis = new RedisConnection(config.redisUrl());
        this.jobQueue = new RedisJobQueue(redis);
        this.resultStream = new RedisResultStream(redis);
        this.lockStore = new RedisLockStore(redis);
        this.publisher = new Publisher(jobQueue, resultStream);
        this.queueRouter = new QueueRouter(config.defaultCollectorQueue());

        this.scheduleRepository = new JdbcScheduleRepository(database);
        this.deviceRepository = new JdbcDeviceRepository(database);
        this.storageLocationRepository = new JdbcStorageLocationRepository(database);
        this.schedulerStateRepository = new JdbcSchedulerStateRepository(database);
        this.collectionResultRepository = new JdbcCollectionResultRepository(database);
        this.storedArtifactRepository = new JdbcStoredArtifactRepository(database);

        this.backupDispatcher = new BackupDispatcher(publisher, queueRouter, config.collectionTimeout(), clock);
        this.storageDispatcher = new StorageDispatcher(publisher);
        this.retrievalBridge = new RetrievalBridge(jobQueue, storageDispatcher, config.retrievalTimeout());

        this.scheduleService = new ScheduleService(scheduleRepository, config.displayTimezone(), clock);
        this.backupService = new BackupService(deviceRepository, backupDispatcher, clock);
        this.artifactService = new ArtifactService(storedArtifactRepository, deviceRepository,
                storageLocationRepository, retrievalBridge);

        log.info("Dependencies initialized successfully");
    }

    public static Dependencies create(PipelineConfig config) {
        return new Dependencies(config);
    }

    public static Dependencies create() {
        return create(PipelineConfig.fromEnv());
    }

    public PipelineConfig config() {
        return config;
    }

    public Database database() {
        return database;
    }

    public RedisConnection redis() {
        return redis;
    }

    public ScheduleService scheduleService() {
        return scheduleService;
    }

    public BackupService backupService() {
        return backupService;
    }

    public ArtifactService artifactService() {
        return artifactService;
    }

    public SchedulerLock schedulerLock() {
        return new SchedulerLock(lockStore, config.lockKey(), config.lockTtl(), LockOwner.current(),
                ProcessProbe.local());
    }

    public SchedulerDaemon schedulerDaemon() {
        MissedWindowRecovery recovery = new MissedWindowRecovery(scheduleRepository, deviceRepository,
                collectionResultRepository, backupDispatcher, config.restartWindow(),
                Duration.ofDays(config.missedLookbackDays()), config.displayTimezone());
        ScheduleTicker ticker = new ScheduleTicker(scheduleRepository, deviceRepository, backupDispatcher,
                config.displayTimezone());
        return new SchedulerDaemon(schedulerLock(), schedulerStateRepository, recovery, ticker, clock,
                config.tickInterval(), config.lockRenewInterval());
    }

    /**
     * Collector worker for the given queues, or the default collector queue when none are named.
     */
    public CollectorWorker collectorWorker(List<String> queues) {
        List<String> effective = queues.isEmpty() ? List.of(queueRouter.defaultCollectorQueue()) : queues;
        return new CollectorWorker(jobQueue, publisher, PluginRegistry.withDefaults(), effective,
                config.collectionResultsStream(), clock);
    }

    public StorageWorker storageWorker(List<String> backendKinds) {
        return new StorageWorker(jobQueue, publisher, StorageBackendRegistry.withDefaults(), backendKinds,
                config.storageResultsStream(), config.retrievalTimeout().plus(REPLY_QUEUE_GRACE), clock);
    }

    public CollectionResultConsumer collectionResultConsumer() {
        return new CollectionResultConsumer(resultStream, config.collectionResultsStream(),
                config.collectionResultsGroup(), config.consumerName(), config.streamReadCount(),
                config.streamBlock(), deadLetterSink(), deviceRepository, collectionResultRepository,
                storageLocationRepository, storageDispatcher, clock);
    }

    public StorageResultConsumer storageResultConsumer() {
        return new StorageResultConsumer(resultStream, config.storageResultsStream(),
                config.storageResultsGroup(), config.consumerName(), config.streamReadCount(),
                config.streamBlock(), deadLetterSink(), storedArtifactRepository, collectionResultRepository,
                clock);
    }

    private DeadLetterSink deadLetterSink() {
        return new DeadLetterSink(resultStream, config.deadLetterSuffix(), clock);
    }

    /**
     * Get a fully configured RouterHandler with all controllers registered.
     */
    public RouterHandler routerHandler() {
        if (routerHandler == null) {
            routerHandler = new RouterHandler()
                    .registerController(new HealthController(database, redis, schedulerStateRepository))
                    .registerController(new BackupController(backupService))
                    .registerController(new ArtifactController(artifactService));
            log.info("RouterHandler created with {} controllers", routerHandler.controllerCount());
        }
        return routerHandler;
    }

    public PipelineHttpServer httpServer() {
        return new PipelineHttpServer(routerHandler(), config.serverHost(), config.serverPort());
    }

    @Override
    public void close() {
        log.info("Closing dependencies...");

        try {
            redis.close();
        } catch (Exception e) {
            log.warn("Error closing redis pool: {}", e.getMessage());
        }

        try {
            database.close();
        } catch (Exception e) {
            log.warn("Error closing database: {}", e.getMessage());
        }

        log.info("Dependencies closed");
    }
}
