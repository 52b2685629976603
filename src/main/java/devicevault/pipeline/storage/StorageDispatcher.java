package devicevault.pipeline.storage;

import devicevault.pipeline.broker.Publisher;
import devicevault.pipeline.broker.QueueRouter;
import devicevault.pipeline.model.StorageJob;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Routes storage jobs to {@code storage.<backend-kind>}.
 */
public class StorageDispatcher {

    private static final Logger log = LoggerFactory.getLogger(StorageDispatcher.class);

    private final Publisher publisher;

    public StorageDispatcher(Publisher publisher) {
        this.publisher = publisher;
    }

    /**
     * @return the queue the job was pushed to
     * @throws devicevault.pipeline.broker.BrokerException if the queue stays unreachable
     */
    public String dispatch(StorageJob job) {
        String queue = QueueRouter.storageQueue(job.storageBackend());
        publisher.enqueue(queue, job);
        log.info("Dispatched {} job {} to {}", job.operation(), job.taskIdentifier(), queue);
        return queue;
    }
}
