package devicevault.pipeline.broker;

/**
 * Queue, stream or lock store unreachable or rejected a command.
 * Treated as transient by publishers and consumers.
 */
public class BrokerException extends RuntimeException {

    public BrokerException(String message) {
        super(message);
    }

    public BrokerException(String message, Throwable cause) {
        super(message, cause);
    }
}
