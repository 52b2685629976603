package devicevault.pipeline.broker;

import java.time.Duration;
import java.util.Optional;

/**
 * Expiring keys with atomic conditional updates, the primitive behind the
 * scheduler lock.
 */
public interface LockStore {

    /**
     * Set the key only if it is absent.
     *
     * @return true if this call created the key
     */
    boolean setIfAbsent(String key, String value, Duration ttl);

    Optional<String> get(String key);

    /**
     * Reset the expiry, only while the key still holds {@code expectedValue}.
     */
    boolean extendIfValue(String key, String expectedValue, Duration ttl);

    /**
     * Delete the key, only while it still holds {@code expectedValue}.
     */
    boolean deleteIfValue(String key, String expectedValue);

    /**
     * Unconditional delete.
     */
    boolean delete(String key);

    /**
     * Remaining time to live, empty if the key is absent or has no expiry.
     */
    Optional<Duration> remainingTtl(String key);
}
