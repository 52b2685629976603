package devicevault.pipeline.util;

import java.time.Duration;

/**
 * Exponential pause for retry loops: doubles on every failure up to a cap,
 * back to the initial delay after a success.
 */
public final class Backoff {

    private final long initialMs;
    private final long maxMs;
    private long currentMs;

    public Backoff(Duration initial, Duration max) {
        this.initialMs = initial.toMillis();
        this.maxMs = max.toMillis();
        this.currentMs = initialMs;
    }

    public static Backoff standard() {
        return new Backoff(Duration.ofSeconds(1), Duration.ofSeconds(30));
    }

    /**
     * Sleep for the current delay, then double it.
     *
     * @return false if interrupted (the interrupt flag is restored)
     */
    public boolean pause() {
        long delay = currentMs;
        currentMs = Math.min(maxMs, currentMs * 2);
        try {
            Thread.sleep(delay);
            return true;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }

    public void reset() {
        currentMs = initialMs;
    }

    public Duration current() {
        return Duration.ofMillis(currentMs);
    }
}
