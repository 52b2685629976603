package devicevault.pipeline.consumer;

/**
 * A stream entry that can never be processed (malformed, or referring to
 * something that does not exist). Logged and acknowledged, never retried.
 */
public class PoisonMessageException extends RuntimeException {

    public PoisonMessageException(String message) {
        super(message);
    }
}
