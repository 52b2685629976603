package devicevault.pipeline.scheduler;

/**
 * Liveness check for a process on this host.
 */
@FunctionalInterface
public interface ProcessProbe {

    boolean isAlive(long pid);

    static ProcessProbe local() {
        return pid -> ProcessHandle.of(pid).map(ProcessHandle::isAlive).orElse(false);
    }
}
