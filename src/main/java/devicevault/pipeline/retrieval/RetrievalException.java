package devicevault.pipeline.retrieval;

/**
 * A synchronous artifact read did not produce content.
 */
public class RetrievalException extends RuntimeException {

    public enum Reason {
        /** No reply from a storage worker within the timeout */
        TIMEOUT,
        /** The worker replied with a failure */
        WORKER_FAILURE,
        /** The queue could not be reached */
        UNAVAILABLE,
        /** The artifact has no readable reference */
        NOT_RETRIEVABLE
    }

    private final Reason reason;

    public RetrievalException(Reason reason, String message) {
        super(message);
        this.reason = reason;
    }

    public RetrievalException(Reason reason, String message, Throwable cause) {
        super(message, cause);
        this.reason = reason;
    }

    public Reason reason() {
        return reason;
    }
}
