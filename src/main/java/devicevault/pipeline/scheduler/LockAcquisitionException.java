package devicevault.pipeline.scheduler;

/**
 * Another live scheduler holds the lock.
 */
public class LockAcquisitionException extends RuntimeException {

    private final String currentOwner;

    public LockAcquisitionException(String message, String currentOwner) {
        super(message);
        this.currentOwner = currentOwner;
    }

    public String currentOwner() {
        return currentOwner;
    }
}
