package devicevault.pipeline.scheduler;

import java.time.Duration;

/**
 * Snapshot of the lock for {@code --check-lock}.
 *
 * @param status       held / stale / free
 * @param owner        raw owner value, null when free
 * @param remainingTtl time until natural expiry, null if unknown
 */
public record LockReport(LockStatus status, String owner, Duration remainingTtl) {

    public String describe() {
        if (status == LockStatus.FREE) {
            return LockStatus.FREE.label();
        }
        StringBuilder sb = new StringBuilder(status.label()).append(" owner=").append(owner);
        if (remainingTtl != null) {
            sb.append(" ttl=").append(remainingTtl.toSeconds()).append('s');
        }
        return sb.toString();
    }
}
