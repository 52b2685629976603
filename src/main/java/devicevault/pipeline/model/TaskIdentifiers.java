package devicevault.pipeline.model;

import java.time.Instant;
import java.time.temporal.ChronoUnit;

/**
 * Builders for the logical task identifiers that correlate a job with its
 * collection result and stored artifact. The identifier carries how the job
 * was triggered and for which device.
 */
public final class TaskIdentifiers {

    private TaskIdentifiers() {
    }

    public static String scheduled(long deviceId, Instant now) {
        return "scheduled:" + deviceId + ":" + iso(now);
    }

    public static String catchUp(long deviceId, Instant scheduledFor) {
        return "scheduled_catchup:" + deviceId + ":" + iso(scheduledFor);
    }

    public static String manual(long deviceId, Instant now) {
        return "manual:" + deviceId + ":" + iso(now);
    }

    public static String missed(long deviceId, Instant scheduledFor) {
        return "missed:" + deviceId + ":" + iso(scheduledFor);
    }

    /**
     * Task ID of a synthesized missed-window row. Deterministic so that a
     * second recovery pass over the same window cannot add a duplicate.
     */
    public static String missedTaskId(long deviceId, Instant scheduledFor) {
        return "missed_" + deviceId + "_" + scheduledFor.getEpochSecond();
    }

    private static String iso(Instant instant) {
        return instant.truncatedTo(ChronoUnit.SECONDS).toString();
    }
}
