package devicevault.pipeline.scheduler;

import devicevault.pipeline.model.CollectionResult;
import devicevault.pipeline.model.Device;
import devicevault.pipeline.model.ResultStatus;
import devicevault.pipeline.model.Schedule;
import devicevault.pipeline.model.TaskIdentifiers;
import devicevault.pipeline.repository.CollectionResultRepository;
import devicevault.pipeline.repository.DeviceRepository;
import devicevault.pipeline.repository.ScheduleRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.util.List;

/**
 * Restart catch-up pass. Every occurrence that fell between the last
 * recorded tick and the restart is either replayed (inside the catch-up
 * horizon) or recorded as a {@code missed_window} result (outside it).
 */
public class MissedWindowRecovery {

    private static final Logger log = LoggerFactory.getLogger(MissedWindowRecovery.class);

    /** Upper bound on missed_window rows written per schedule in one pass */
    private static final int MAX_MISSED_RECORDED = 10_000;

    private final ScheduleRepository schedules;
    private final DeviceRepository devices;
    private final CollectionResultRepository results;
    private final BackupDispatcher dispatcher;
    private final Duration horizon;
    private final Duration lookback;
    private final ZoneId zone;

    public MissedWindowRecovery(ScheduleRepository schedules, DeviceRepository devices,
            CollectionResultRepository results, BackupDispatcher dispatcher,
            Duration horizon, Duration lookback, ZoneId zone) {
        this.schedules = schedules;
        this.devices = devices;
        this.results = results;
        this.dispatcher = dispatcher;
        this.horizon = horizon;
        this.lookback = lookback;
        this.zone = zone;
    }

    public record Report(int catchUpJobs, int missedWindows) {
        public static final Report NONE = new Report(0, 0);
    }

    /**
     * @param lastTick last tick recorded before the restart
     * @param now      restart instant
     */
    public Report recover(Instant lastTick, Instant now) {
        if (lastTick == null || !lastTick.isBefore(now)) {
            return Report.NONE;
        }

        Instant earliest = now.minus(lookback);
        Instant horizonStart = now.minus(horizon);
        int catchUps = 0;
        int missed = 0;

        for (Schedule schedule : schedules.findEnabled()) {
            try {
                List<Device> attached = devices.findEnabledBySchedule(schedule.id());
                if (attached.isEmpty()) {
                    continue;
                }

                Instant from = latest(lastTick, schedule.lastRunAt(), earliest);
                List<Instant> replayed = List.of();
                List<Instant> older = List.of();
                if (from.isBefore(horizonStart)) {
                    // occurrences at exactly horizonStart belong to the replay window
                    Instant olderEnd = horizonStart.minusNanos(1);
                    older = CadenceCalculator.dueBetween(schedule, from, olderEnd, zone, MAX_MISSED_RECORDED);
                    if (older.size() == MAX_MISSED_RECORDED) {
                        log.warn("Schedule {} ({}) has more than {} occurrence(s) outside the catch-up window; "
                                + "recording the earliest {}", schedule.id(), schedule.name(),
                                MAX_MISSED_RECORDED, MAX_MISSED_RECORDED);
                    }
                    replayed = CadenceCalculator.dueBetween(schedule, olderEnd, now, zone, Integer.MAX_VALUE);
                } else {
                    replayed = CadenceCalculator.dueBetween(schedule, from, now, zone, Integer.MAX_VALUE);
                }
                if (older.isEmpty() && replayed.isEmpty()) {
                    continue;
                }
                log.info("Schedule {} ({}) missed {} occurrence(s) between {} and {}, {} inside the catch-up window",
                        schedule.id(), schedule.name(), older.size() + replayed.size(), from, now, replayed.size());

                for (Instant occurrence : older) {
                    missed += recordMissed(attached, occurrence, lastTick, now);
                }
                for (Instant occurrence : replayed) {
                    catchUps += replay(attached, occurrence);
                }

                Instant last = replayed.isEmpty() ? older.get(older.size() - 1) : replayed.get(replayed.size() - 1);
                Instant next = CadenceCalculator.nextDue(schedule, now, zone).orElse(null);
                schedules.updateRunTimes(schedule.id(), last, next);
            } catch (RuntimeException e) {
                log.error("Missed-window recovery failed for schedule {}", schedule.id(), e);
            }
        }

        log.info("Missed-window recovery: {} catch-up job(s) dispatched, {} missed window(s) recorded",
                catchUps, missed);
        return new Report(catchUps, missed);
    }

    private int replay(List<Device> attached, Instant occurrence) {
        int dispatched = 0;
        for (Device device : attached) {
            try {
                dispatcher.dispatch(device, TaskIdentifiers.catchUp(device.id(), occurrence), true);
                dispatched++;
            } catch (RuntimeException e) {
                log.error("Failed to dispatch catch-up for device {} at {}", device.id(), occurrence, e);
            }
        }
        return dispatched;
    }

    private int recordMissed(List<Device> attached, Instant occurrence, Instant lastTick, Instant now) {
        int recorded = 0;
        for (Device device : attached) {
            CollectionResult result = CollectionResult.builder()
                    .taskId(TaskIdentifiers.missedTaskId(device.id(), occurrence))
                    .taskIdentifier(TaskIdentifiers.missed(device.id(), occurrence))
                    .deviceId(device.id())
                    .status(ResultStatus.MISSED_WINDOW)
                    .timestamp(occurrence)
                    .log(List.of("Scheduled run at " + occurrence + " was missed: scheduler not running between "
                            + lastTick + " and " + now + " (outside " + horizon.toMinutes() + " minute catch-up window)"))
                    .build();
            if (results.save(result)) {
                recorded++;
                log.warn("Recorded missed window for device {} at {}", device.id(), occurrence);
            }
        }
        return recorded;
    }

    private static Instant latest(Instant a, Instant b, Instant c) {
        Instant max = a;
        if (b != null && b.isAfter(max)) {
            max = b;
        }
        return c.isAfter(max) ? c : max;
    }
}
