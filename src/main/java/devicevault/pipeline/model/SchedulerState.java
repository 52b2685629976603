package devicevault.pipeline.model;

import java.time.Instant;

/**
 * Persisted scheduler bookkeeping (single row).
 * Only used to bound the catch-up window after a restart; {@code running}
 * and {@code ownerPid} are informational, the distributed lock is what
 * guarantees a single scheduler.
 */
public record SchedulerState(
        Instant lastTick,
        boolean running,
        Long ownerPid,
        Instant lastRestartAt) {

    public static SchedulerState initial() {
        return new SchedulerState(null, false, null, null);
    }

    public SchedulerState withTick(Instant tick, long pid) {
        return new SchedulerState(tick, true, pid, lastRestartAt);
    }

    public SchedulerState withRestart(Instant restartAt) {
        return new SchedulerState(lastTick, running, ownerPid, restartAt);
    }

    public SchedulerState stopped() {
        return new SchedulerState(lastTick, false, ownerPid, lastRestartAt);
    }
}
