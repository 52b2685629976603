package devicevault.pipeline.scheduler;

import devicevault.pipeline.broker.BrokerException;
import devicevault.pipeline.model.SchedulerPhase;
import devicevault.pipeline.model.SchedulerState;
import devicevault.pipeline.repository.SchedulerStateRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * The singleton scheduler process.
 *
 * STARTING, then ACQUIRING_LOCK, then either LOCK_FAILED or RUNNING. While
 * running, ticks are serialized on one thread and lock renewal runs on its
 * own, so a slow tick cannot let the lock expire. A shutdown waits for the
 * in-flight tick and keeps renewing until it is done. Losing the lock shuts
 * the daemon down.
 */
public class SchedulerDaemon {

    private static final Logger log = LoggerFactory.getLogger(SchedulerDaemon.class);

    public static final int EXIT_OK = 0;
    public static final int EXIT_LOCK_FAILED = 1;

    private static final Duration SHUTDOWN_GRACE = Duration.ofSeconds(60);

    private final SchedulerLock lock;
    private final SchedulerStateRepository stateRepository;
    private final MissedWindowRecovery recovery;
    private final ScheduleTicker ticker;
    private final Clock clock;
    private final Duration tickInterval;
    private final Duration renewInterval;
    private final long pid;

    private final ScheduledExecutorService executor;
    private final ScheduledExecutorService renewer;
    private final AtomicBoolean shuttingDown = new AtomicBoolean(false);
    private final CountDownLatch terminated = new CountDownLatch(1);

    private volatile SchedulerPhase phase = SchedulerPhase.STARTING;
    private volatile boolean lockLost = false;
    private volatile Instant windowStart;
    private volatile SchedulerState state;

    public SchedulerDaemon(SchedulerLock lock, SchedulerStateRepository stateRepository,
            MissedWindowRecovery recovery, ScheduleTicker ticker, Clock clock,
            Duration tickInterval, Duration renewInterval) {
        this.lock = lock;
        this.stateRepository = stateRepository;
        this.recovery = recovery;
        this.ticker = ticker;
        this.clock = clock;
        this.tickInterval = tickInterval;
        this.renewInterval = renewInterval;
        this.pid = lock.owner().pid();
        this.executor = Executors.newSingleThreadScheduledExecutor(r -> daemonThread(r, "devicevault-scheduler"));
        this.renewer = Executors.newSingleThreadScheduledExecutor(r -> daemonThread(r, "devicevault-scheduler-lock"));
    }

    private static Thread daemonThread(Runnable r, String name) {
        Thread t = new Thread(r, name);
        t.setDaemon(true);
        return t;
    }

    /**
     * Take the lock, run the restart catch-up pass and start ticking.
     *
     * @throws LockAcquisitionException if another scheduler holds the lock
     */
    public void start() {
        phase = SchedulerPhase.ACQUIRING_LOCK;
        try {
            lock.acquire();
        } catch (LockAcquisitionException | BrokerException e) {
            phase = SchedulerPhase.LOCK_FAILED;
            terminated.countDown();
            throw e;
        }

        try {
            Instant now = clock.instant();
            SchedulerState previous = stateRepository.load();
            if (previous.lastTick() != null) {
                MissedWindowRecovery.Report report = recovery.recover(previous.lastTick(), now);
                log.info("Restart after last tick {}: {} catch-up job(s), {} missed window(s)",
                        previous.lastTick(), report.catchUpJobs(), report.missedWindows());
            } else {
                log.info("No previous tick recorded; skipping missed-window recovery");
            }

            state = previous.withRestart(now).withTick(now, pid);
            stateRepository.save(state);
            windowStart = now;
        } catch (RuntimeException e) {
            lock.release();
            phase = SchedulerPhase.STOPPED;
            terminated.countDown();
            throw e;
        }
        phase = SchedulerPhase.RUNNING;

        executor.scheduleWithFixedDelay(this::tickSafely,
                tickInterval.toMillis(), tickInterval.toMillis(), TimeUnit.MILLISECONDS);
        renewer.scheduleWithFixedDelay(this::renewLock,
                renewInterval.toMillis(), renewInterval.toMillis(), TimeUnit.MILLISECONDS);
        log.info("Scheduler running as {} (tick every {}s, lock renewal every {}s)",
                lock.owner(), tickInterval.toSeconds(), renewInterval.toSeconds());
    }

    /**
     * Start and block until stopped.
     *
     * @return process exit code
     */
    public int run() {
        try {
            start();
        } catch (LockAcquisitionException e) {
            log.error("Cannot start scheduler: {}", e.getMessage());
            return EXIT_LOCK_FAILED;
        } catch (BrokerException e) {
            log.error("Cannot start scheduler, lock store unreachable: {}", e.getMessage());
            return EXIT_LOCK_FAILED;
        }
        awaitTermination();
        return lockLost ? EXIT_LOCK_FAILED : EXIT_OK;
    }

    /**
     * Run one tick now. Exposed for the tick loop and for tests.
     */
    void tick() {
        if (phase != SchedulerPhase.RUNNING) {
            return;
        }
        Instant now = clock.instant();
        ticker.tick(windowStart, now);
        windowStart = now;
        state = state.withTick(now, pid);
        stateRepository.save(state);
    }

    private void tickSafely() {
        try {
            tick();
        } catch (Exception e) {
            // window is not advanced, the next tick covers it again
            log.error("Scheduler tick failed", e);
        }
    }

    void renewLock() {
        if (phase != SchedulerPhase.RUNNING && phase != SchedulerPhase.SHUTTING_DOWN) {
            return;
        }
        if (lockLost) {
            return;
        }
        if (!lock.renew()) {
            lockLost = true;
            log.error("Scheduler lock lost; shutting down instead of running unguarded");
            phase = SchedulerPhase.SHUTTING_DOWN;
            Thread stopper = new Thread(this::shutdown, "devicevault-scheduler-stop");
            stopper.setDaemon(true);
            stopper.start();
        }
    }

    /**
     * Graceful stop: no new ticks, wait for the in-flight one, mark the state
     * stopped and release the lock. Safe to call more than once.
     */
    public void shutdown() {
        if (!shuttingDown.compareAndSet(false, true)) {
            return;
        }
        if (phase != SchedulerPhase.RUNNING && phase != SchedulerPhase.SHUTTING_DOWN) {
            executor.shutdownNow();
            renewer.shutdownNow();
            terminated.countDown();
            return;
        }

        phase = SchedulerPhase.SHUTTING_DOWN;
        log.info("Scheduler shutting down");
        executor.shutdown();
        try {
            if (!executor.awaitTermination(SHUTDOWN_GRACE.toMillis(), TimeUnit.MILLISECONDS)) {
                executor.shutdownNow();
                log.warn("Scheduler tick did not finish within {}s", SHUTDOWN_GRACE.toSeconds());
            }
        } catch (InterruptedException e) {
            executor.shutdownNow();
            Thread.currentThread().interrupt();
        }
        renewer.shutdownNow();

        try {
            if (state != null) {
                state = state.stopped();
                stateRepository.save(state);
            }
        } catch (RuntimeException e) {
            log.error("Failed to mark scheduler state stopped", e);
        }

        if (!lockLost) {
            lock.release();
        }
        phase = SchedulerPhase.STOPPED;
        log.info("Scheduler stopped");
        terminated.countDown();
    }

    public void awaitTermination() {
        try {
            terminated.await();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    public SchedulerPhase phase() {
        return phase;
    }

    public boolean lockLost() {
        return lockLost;
    }
}
