package devicevault.pipeline.storage;

import devicevault.pipeline.broker.BrokerException;
import devicevault.pipeline.broker.JobQueue;
import devicevault.pipeline.broker.Publisher;
import devicevault.pipeline.broker.QueueRouter;
import devicevault.pipeline.model.ResultStatus;
import devicevault.pipeline.model.StorageJob;
import devicevault.pipeline.model.StorageOperation;
import devicevault.pipeline.model.StorageReadReply;
import devicevault.pipeline.model.StorageResultMessage;
import devicevault.pipeline.util.Backoff;
import devicevault.pipeline.util.Json;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Consumes {@code storage.<kind>} queues. Store jobs write the artifact and
 * publish to the storage-results stream; read jobs answer on the job's reply
 * queue (failures are published to the stream as well).
 */
public class StorageWorker implements Runnable {

    private static final Logger log = LoggerFactory.getLogger(StorageWorker.class);

    private static final Duration POLL_TIMEOUT = Duration.ofSeconds(2);
    private static final Pattern UNSAFE_PATH_CHARS = Pattern.compile("[^A-Za-z0-9_.-]");

    private final JobQueue queue;
    private final Publisher publisher;
    private final StorageBackendRegistry backends;
    private final List<String> queues;
    private final String resultsStream;
    private final Duration replyTtl;
    private final Clock clock;

    private volatile boolean running = true;

    public StorageWorker(JobQueue queue, Publisher publisher, StorageBackendRegistry backends,
            List<String> backendKinds, String resultsStream, Duration replyTtl, Clock clock) {
        if (backendKinds.isEmpty()) {
            throw new IllegalArgumentException("storage worker needs at least one backend kind");
        }
        this.queue = queue;
        this.publisher = publisher;
        this.backends = backends;
        this.queues = backendKinds.stream().map(QueueRouter::storageQueue).toList();
        this.resultsStream = resultsStream;
        this.replyTtl = replyTtl;
        this.clock = clock;
    }

    @Override
    public void run() {
        log.info("Storage worker listening on {}", queues);
        Backoff backoff = Backoff.standard();
        while (running && !Thread.currentThread().isInterrupted()) {
            try {
                Optional<String> payload = queue.pop(queues, POLL_TIMEOUT);
                backoff.reset();
                payload.ifPresent(this::handle);
            } catch (BrokerException e) {
                log.warn("Storage queue unavailable, retrying in {}ms: {}", backoff.current().toMillis(),
                        e.getMessage());
                if (!backoff.pause()) {
                    break;
                }
            } catch (Exception e) {
                log.error("Storage worker error", e);
            }
        }
        log.info("Storage worker stopped");
    }

    public void stop() {
        running = false;
    }

    void handle(String payload) {
        StorageJob job;
        try {
            job = Json.read(payload, StorageJob.class);
        } catch (IllegalArgumentException e) {
            log.warn("Dropping malformed storage job: {}", e.getMessage());
            return;
        }

        StorageOperation operation;
        try {
            operation = job.storageOperation();
        } catch (IllegalArgumentException e) {
            log.warn("Dropping storage job {} with unknown operation '{}'", job.taskId(), job.operation());
            return;
        }

        if (operation == StorageOperation.READ) {
            read(job);
        } else {
            publisher.publish(resultsStream, store(job).toFields());
        }
    }

    /**
     * Store the job's content and build the result entry. Never throws for
     * job-level problems; those become failure entries.
     */
    StorageResultMessage store(StorageJob job) {
        List<String> logLines = new ArrayList<>();
        String kind = job.storageBackend();
        Optional<StorageBackend> backend = backends.find(kind);

        if (backend.isEmpty()) {
            logLines.add("unsupported storage backend: " + kind);
            return result(job, "", ResultStatus.FAILURE, logLines, StorageOperation.STORE);
        }
        if (job.deviceConfig() == null || job.deviceConfig().isEmpty()) {
            logLines.add("device_config missing; nothing to store");
            return result(job, "", ResultStatus.FAILURE, logLines, StorageOperation.STORE);
        }

        try {
            String ref = backend.get().store(job.deviceConfig(), pathHint(job.deviceId(), job.taskIdentifier()),
                    job.storageConfig());
            logLines.add("stored to " + kind + ":" + ref);
            log.info("Stored {} for device {} at {}:{}", job.taskIdentifier(), job.deviceId(), kind, ref);
            return result(job, ref, ResultStatus.SUCCESS, logLines, StorageOperation.STORE);
        } catch (RuntimeException e) {
            log.error("Storage of {} on {} failed", job.taskIdentifier(), kind, e);
            logLines.add("store failed: " + e.getMessage());
            return result(job, "", ResultStatus.FAILURE, logLines, StorageOperation.STORE);
        }
    }

    /**
     * Read the referenced artifact and reply on the job's reply queue.
     */
    StorageReadReply read(StorageJob job) {
        StorageReadReply reply;
        Optional<StorageBackend> backend = backends.find(job.storageBackend());
        if (backend.isEmpty()) {
            reply = StorageReadReply.failure(job.taskId(),
                    List.of("unsupported storage backend: " + job.storageBackend()));
        } else {
            try {
                String content = backend.get().read(job.storageRef(), job.storageConfig());
                reply = StorageReadReply.success(job.taskId(), content, List.of());
            } catch (RuntimeException e) {
                log.warn("Read of {} on {} failed: {}", job.storageRef(), job.storageBackend(), e.getMessage());
                reply = StorageReadReply.failure(job.taskId(), List.of("read failed: " + e.getMessage()));
            }
        }

        if (job.replyTo() != null && !job.replyTo().isBlank()) {
            publisher.enqueue(job.replyTo(), reply);
            queue.expire(job.replyTo(), replyTtl);
        } else {
            log.warn("Read job {} has no reply queue; result discarded", job.taskId());
        }

        if (!reply.isSuccess()) {
            publisher.publish(resultsStream,
                    result(job, job.storageRef(), ResultStatus.FAILURE, reply.log(), StorageOperation.READ).toFields());
        }
        return reply;
    }

    private StorageResultMessage result(StorageJob job, String ref, ResultStatus status, List<String> logLines,
            StorageOperation operation) {
        return new StorageResultMessage(
                job.taskId(),
                job.taskIdentifier(),
                job.deviceId() != null ? String.valueOf(job.deviceId()) : "",
                job.storageBackend(),
                ref,
                status.wireValue(),
                logLines,
                clock.instant().toString(),
                operation.wireValue());
    }

    /**
     * {@code <device id>/<task identifier>.txt} with unsafe characters replaced.
     */
    static String pathHint(Long deviceId, String taskIdentifier) {
        String identifier = taskIdentifier == null || taskIdentifier.isBlank() ? "job" : taskIdentifier;
        String prefix = deviceId != null ? String.valueOf(deviceId) : "unknown";
        return prefix + "/" + UNSAFE_PATH_CHARS.matcher(identifier).replaceAll("-") + ".txt";
    }
}
