package devicevault.pipeline.scheduler;

import devicevault.pipeline.broker.BrokerException;
import devicevault.pipeline.broker.LockStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Optional;

/**
 * Distributed singleton lock for the scheduler daemon.
 *
 * Acquisition is a set-if-absent with expiry. A lock left behind by a
 * crashed process on this host is detected through the recorded PID,
 * cleared and acquisition retried once. Renewal and release only touch the
 * key while it still carries this process's identity.
 */
public class SchedulerLock {

    private static final Logger log = LoggerFactory.getLogger(SchedulerLock.class);

    private final LockStore store;
    private final String key;
    private final Duration ttl;
    private final LockOwner self;
    private final ProcessProbe probe;

    private volatile boolean held = false;

    public SchedulerLock(LockStore store, String key, Duration ttl, LockOwner self, ProcessProbe probe) {
        this.store = store;
        this.key = key;
        this.ttl = ttl;
        this.self = self;
        this.probe = probe;
    }

    /**
     * Take the lock or fail fast.
     *
     * @throws LockAcquisitionException if a live (or unverifiable) owner holds it
     * @throws BrokerException          if the lock store is unreachable
     */
    public void acquire() {
        if (store.setIfAbsent(key, self.toString(), ttl)) {
            held = true;
            log.info("Acquired scheduler lock {} as {} (ttl {}s)", key, self, ttl.toSeconds());
            return;
        }

        Optional<String> owner = store.get(key);
        if (owner.isEmpty()) {
            // expired between the two calls
            retryOnce("previous owner expired");
            return;
        }

        if (statusOf(owner.get()) == LockStatus.STALE) {
            log.warn("Scheduler lock {} is held by dead process {}; clearing stale lock", key, owner.get());
            store.deleteIfValue(key, owner.get());
            retryOnce("stale lock cleared");
            return;
        }

        throw new LockAcquisitionException(
                "Scheduler lock " + key + " is held by " + owner.get() + "; another scheduler is running",
                owner.get());
    }

    private void retryOnce(String reason) {
        if (store.setIfAbsent(key, self.toString(), ttl)) {
            held = true;
            log.info("Acquired scheduler lock {} as {} ({})", key, self, reason);
            return;
        }
        String owner = store.get(key).orElse("unknown");
        throw new LockAcquisitionException(
                "Scheduler lock " + key + " was taken by " + owner + " during acquisition", owner);
    }

    /**
     * Extend the expiry.
     *
     * @return false if the lock is no longer ours or the store is unreachable
     */
    public boolean renew() {
        try {
            boolean renewed = store.extendIfValue(key, self.toString(), ttl);
            if (!renewed) {
                held = false;
                log.error("Scheduler lock {} is no longer owned by {}", key, self);
            } else {
                log.debug("Renewed scheduler lock {}", key);
            }
            return renewed;
        } catch (BrokerException e) {
            log.error("Scheduler lock renewal failed: {}", e.getMessage());
            return false;
        }
    }

    /**
     * Best-effort release; an unreachable store leaves the key to expire.
     */
    public void release() {
        try {
            if (store.deleteIfValue(key, self.toString())) {
                log.info("Released scheduler lock {}", key);
            } else {
                log.warn("Scheduler lock {} was not held by {} at release", key, self);
            }
        } catch (BrokerException e) {
            log.warn("Could not release scheduler lock {} ({}); it will expire on its own", key, e.getMessage());
        } finally {
            held = false;
        }
    }

    public LockReport check() {
        Optional<String> owner = store.get(key);
        if (owner.isEmpty()) {
            return new LockReport(LockStatus.FREE, null, null);
        }
        return new LockReport(statusOf(owner.get()), owner.get(), store.remainingTtl(key).orElse(null));
    }

    /**
     * Operator recovery: delete the key whoever owns it.
     *
     * @return the report taken just before clearing
     */
    public LockReport clear() {
        LockReport before = check();
        if (before.status() == LockStatus.HELD) {
            log.warn("Force-clearing scheduler lock {} held by {}", key, before.owner());
        }
        if (before.status() != LockStatus.FREE) {
            store.delete(key);
            log.info("Cleared scheduler lock {}", key);
        }
        return before;
    }

    LockStatus statusOf(String ownerValue) {
        Optional<LockOwner> owner = LockOwner.parse(ownerValue);
        if (owner.isEmpty() || !owner.get().sameHost(self)) {
            return LockStatus.HELD;
        }
        if (owner.get().equals(self) && !held) {
            // our own pid@host before we took the lock: a previous process that reused this pid
            return LockStatus.STALE;
        }
        return probe.isAlive(owner.get().pid()) ? LockStatus.HELD : LockStatus.STALE;
    }

    public boolean isHeld() {
        return held;
    }

    public LockOwner owner() {
        return self;
    }
}
