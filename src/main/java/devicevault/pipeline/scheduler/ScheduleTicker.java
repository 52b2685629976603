package devicevault.pipeline.scheduler;

import devicevault.pipeline.model.Device;
import devicevault.pipeline.model.Schedule;
import devicevault.pipeline.model.TaskIdentifiers;
import devicevault.pipeline.repository.DeviceRepository;
import devicevault.pipeline.repository.ScheduleRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.time.ZoneId;
import java.util.List;
import java.util.Optional;

/**
 * One scheduler tick: find the schedules that came due inside the tick
 * window and enqueue one collection job per attached device.
 */
public class ScheduleTicker {

    private static final Logger log = LoggerFactory.getLogger(ScheduleTicker.class);

    private final ScheduleRepository schedules;
    private final DeviceRepository devices;
    private final BackupDispatcher dispatcher;
    private final ZoneId zone;

    public ScheduleTicker(ScheduleRepository schedules, DeviceRepository devices, BackupDispatcher dispatcher,
            ZoneId zone) {
        this.schedules = schedules;
        this.devices = devices;
        this.dispatcher = dispatcher;
        this.zone = zone;
    }

    public record Report(int schedulesDue, int jobsDispatched) {
    }

    /**
     * Evaluate the window {@code (max(windowStart, last_run_at), now]}.
     * A schedule due more than once inside the window is dispatched once.
     */
    public Report tick(Instant windowStart, Instant now) {
        int due = 0;
        int dispatched = 0;

        for (Schedule schedule : schedules.findEnabled()) {
            try {
                Instant from = schedule.lastRunAt() != null && schedule.lastRunAt().isAfter(windowStart)
                        ? schedule.lastRunAt()
                        : windowStart;
                Optional<Instant> next = CadenceCalculator.nextDue(schedule, from, zone);
                if (next.isEmpty() || next.get().isAfter(now)) {
                    continue;
                }

                List<Device> attached = devices.findEnabledBySchedule(schedule.id());
                Instant nextRun = CadenceCalculator.nextDue(schedule, now, zone).orElse(null);
                if (attached.isEmpty()) {
                    log.debug("Schedule {} is due but has no enabled devices", schedule.id());
                    schedules.updateRunTimes(schedule.id(), schedule.lastRunAt(), nextRun);
                    continue;
                }

                due++;
                log.info("Schedule {} ({}) due at {}; dispatching {} device(s)",
                        schedule.id(), schedule.name(), next.get(), attached.size());
                for (Device device : attached) {
                    try {
                        dispatcher.dispatch(device, TaskIdentifiers.scheduled(device.id(), now), false);
                        dispatched++;
                    } catch (RuntimeException e) {
                        log.error("Failed to dispatch device {} for schedule {}", device.id(), schedule.id(), e);
                    }
                }
                schedules.updateRunTimes(schedule.id(), now, nextRun);
            } catch (RuntimeException e) {
                log.error("Failed to evaluate schedule {}", schedule.id(), e);
            }
        }

        if (due > 0) {
            log.info("Tick at {}: {} schedule(s) due, {} job(s) dispatched", now, due, dispatched);
        } else {
            log.debug("Tick at {}: nothing due", now);
        }
        return new Report(due, dispatched);
    }
}
