package devicevault.pipeline.model;

/**
 * Lifecycle of the scheduler daemon.
 */
public enum SchedulerPhase {
    STARTING,
    ACQUIRING_LOCK,
    /** Another live process holds the lock; the daemon exits */
    LOCK_FAILED,
    RUNNING,
    SHUTTING_DOWN,
    STOPPED
}
