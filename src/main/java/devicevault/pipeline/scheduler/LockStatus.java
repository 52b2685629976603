package devicevault.pipeline.scheduler;

/**
 * Result of inspecting the scheduler lock from the outside.
 */
public enum LockStatus {
    /** Owned by a live process, or by one on another host that cannot be probed */
    HELD,
    /** Owner is on this host and its process is gone */
    STALE,
    FREE;

    public String label() {
        return name().toLowerCase();
    }
}
