package devicevault.pipeline.collector;

import devicevault.pipeline.broker.BrokerException;
import devicevault.pipeline.broker.JobQueue;
import devicevault.pipeline.broker.Publisher;
import devicevault.pipeline.model.CollectionJob;
import devicevault.pipeline.model.CollectionResultMessage;
import devicevault.pipeline.model.ResultStatus;
import devicevault.pipeline.util.Backoff;
import devicevault.pipeline.util.Json;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Pulls collection jobs from its queues, runs the device's plugin under the
 * job's timeout, and publishes the outcome to the collection-results stream.
 */
public class CollectorWorker implements Runnable {

    private static final Logger log = LoggerFactory.getLogger(CollectorWorker.class);

    private static final Duration POLL_TIMEOUT = Duration.ofSeconds(2);

    private final JobQueue queue;
    private final Publisher publisher;
    private final PluginRegistry plugins;
    private final List<String> queues;
    private final String resultsStream;
    private final Clock clock;
    private final ExecutorService pluginExecutor;

    private volatile boolean running = true;

    public CollectorWorker(JobQueue queue, Publisher publisher, PluginRegistry plugins, List<String> queues,
            String resultsStream, Clock clock) {
        if (queues.isEmpty()) {
            throw new IllegalArgumentException("collector worker needs at least one queue");
        }
        this.queue = queue;
        this.publisher = publisher;
        this.plugins = plugins;
        this.queues = List.copyOf(queues);
        this.resultsStream = resultsStream;
        this.clock = clock;
        // cached: a plugin that ignores cancellation must not block the next job
        this.pluginExecutor = Executors.newCachedThreadPool(r -> {
            Thread t = new Thread(r, "devicevault-plugin");
            t.setDaemon(true);
            return t;
        });
    }

    @Override
    public void run() {
        log.info("Collector worker listening on {}", queues);
        Backoff backoff = Backoff.standard();
        while (running && !Thread.currentThread().isInterrupted()) {
            try {
                Optional<String> payload = queue.pop(queues, POLL_TIMEOUT);
                backoff.reset();
                payload.ifPresent(this::handle);
            } catch (BrokerException e) {
                log.warn("Collector queue unavailable, retrying in {}ms: {}", backoff.current().toMillis(),
                        e.getMessage());
                if (!backoff.pause()) {
                    break;
                }
            } catch (Exception e) {
                log.error("Collector worker error", e);
            }
        }
        pluginExecutor.shutdownNow();
        log.info("Collector worker stopped");
    }

    public void stop() {
        running = false;
    }

    /**
     * Handle one raw queue payload. Malformed payloads are dropped.
     *
     * @return the published message, or null if the payload was unusable
     */
    CollectionResultMessage handle(String payload) {
        CollectionJob job;
        try {
            job = Json.read(payload, CollectionJob.class);
        } catch (IllegalArgumentException e) {
            log.warn("Dropping malformed collection job: {}", e.getMessage());
            return null;
        }
        CollectionResultMessage message = collect(job);
        publisher.publish(resultsStream, message.toFields());
        log.info("Collected {} for device {}: {}", job.taskIdentifier(), job.deviceId(), message.status());
        return message;
    }

    /**
     * Run the job's plugin and build the result entry.
     */
    CollectionResultMessage collect(CollectionJob job) {
        Duration timeout = Duration.ofSeconds(Math.max(1, job.timeoutSeconds()));
        long started = System.nanoTime();
        CollectionOutcome outcome = runWithTimeout(job, timeout);
        long durationMs = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - started);

        List<String> logLines = new ArrayList<>(outcome.log());
        if (job.catchUp()) {
            logLines.add(0, "catch-up run for a missed schedule window");
        }

        Instant initiatedAt = job.initiatedAt();
        return new CollectionResultMessage(
                job.taskId(),
                job.taskIdentifier(),
                String.valueOf(job.deviceId()),
                outcome.success() ? ResultStatus.SUCCESS.wireValue() : ResultStatus.FAILURE.wireValue(),
                outcome.deviceConfig(),
                String.valueOf(durationMs),
                logLines,
                clock.instant().toString(),
                initiatedAt != null ? initiatedAt.toString() : "");
    }

    private CollectionOutcome runWithTimeout(CollectionJob job, Duration timeout) {
        Future<CollectionOutcome> future = pluginExecutor.submit(
                () -> plugins.run(job.pluginKey(), job.config(), timeout));
        try {
            return future.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            future.cancel(true);
            return CollectionOutcome.failure("collection timed out after " + timeout.toSeconds() + "s");
        } catch (InterruptedException e) {
            future.cancel(true);
            Thread.currentThread().interrupt();
            return CollectionOutcome.failure("collection interrupted");
        } catch (ExecutionException e) {
            return CollectionOutcome.failure("plugin_exception: " + e.getCause());
        }
    }
}
