package devicevault.pipeline.retrieval;

import devicevault.pipeline.broker.BrokerException;
import devicevault.pipeline.broker.JobQueue;
import devicevault.pipeline.model.StorageJob;
import devicevault.pipeline.model.StorageReadReply;
import devicevault.pipeline.storage.StorageDispatcher;
import devicevault.pipeline.util.Json;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Map;
import java.util.UUID;

/**
 * Synchronous read over the asynchronous storage pipeline: sends a read job
 * to the backend's queue and waits, bounded, for the worker's reply on a
 * one-shot reply queue. Never retries.
 */
public class RetrievalBridge {

    private static final Logger log = LoggerFactory.getLogger(RetrievalBridge.class);

    public static final String REPLY_QUEUE_PREFIX = "storage:reply:";

    private final JobQueue queue;
    private final StorageDispatcher dispatcher;
    private final Duration timeout;

    public RetrievalBridge(JobQueue queue, StorageDispatcher dispatcher, Duration timeout) {
        this.queue = queue;
        this.dispatcher = dispatcher;
        this.timeout = timeout;
    }

    /**
     * Read the content behind an opaque reference.
     *
     * @throws RetrievalException on timeout, worker failure or unreachable queue
     */
    public String fetch(String backend, String storageRef, Map<String, Object> storageConfig) {
        if (backend == null || backend.isBlank() || storageRef == null || storageRef.isBlank()) {
            throw new RetrievalException(RetrievalException.Reason.NOT_RETRIEVABLE,
                    "artifact has no storage backend or reference");
        }

        String taskId = UUID.randomUUID().toString();
        String replyQueue = REPLY_QUEUE_PREFIX + taskId;
        StorageJob job = StorageJob.read(taskId, "read:" + storageRef, backend, storageRef, storageConfig,
                replyQueue);

        String raw;
        try {
            dispatcher.dispatch(job);
            raw = queue.pop(replyQueue, timeout).orElse(null);
        } catch (BrokerException e) {
            throw new RetrievalException(RetrievalException.Reason.UNAVAILABLE,
                    "storage queue unavailable: " + e.getMessage(), e);
        }

        if (raw == null) {
            log.warn("No reply for read of {}:{} within {}s", backend, storageRef, timeout.toSeconds());
            throw new RetrievalException(RetrievalException.Reason.TIMEOUT,
                    "no reply from " + backend + " storage worker within " + timeout.toSeconds() + "s");
        }

        StorageReadReply reply;
        try {
            reply = Json.read(raw, StorageReadReply.class);
        } catch (IllegalArgumentException e) {
            throw new RetrievalException(RetrievalException.Reason.WORKER_FAILURE, e.getMessage(), e);
        }
        if (!reply.isSuccess()) {
            throw new RetrievalException(RetrievalException.Reason.WORKER_FAILURE,
                    "storage worker failed to read " + storageRef + ": "
                            + (reply.log() == null ? "" : String.join("; ", reply.log())));
        }
        return reply.content() == null ? "" : reply.content();
    }

    public Duration timeout() {
        return timeout;
    }
}
