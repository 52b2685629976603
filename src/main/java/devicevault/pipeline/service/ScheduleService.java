package devicevault.pipeline.service;

import devicevault.pipeline.model.Cadence;
import devicevault.pipeline.model.Schedule;
import devicevault.pipeline.repository.ScheduleRepository;
import devicevault.pipeline.scheduler.CadenceCalculator;
import devicevault.pipeline.scheduler.CronExpression;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneId;
import java.util.Optional;

/**
 * Schedule management. Every save refreshes the displayed next run time;
 * the daemon never relies on it to decide due-ness.
 */
public class ScheduleService {

    private static final Logger log = LoggerFactory.getLogger(ScheduleService.class);

    private final ScheduleRepository scheduleRepository;
    private final ZoneId zone;
    private final Clock clock;

    public ScheduleService(ScheduleRepository scheduleRepository, ZoneId zone, Clock clock) {
        this.scheduleRepository = scheduleRepository;
        this.zone = zone;
        this.clock = clock;
    }

    /**
     * Validate and persist a schedule.
     *
     * @throws IllegalArgumentException if the cron expression does not parse
     */
    public Schedule save(Schedule schedule) {
        if (schedule.cadence() == Cadence.CRON && !CronExpression.isValid(schedule.cronExpression())) {
            throw new IllegalArgumentException("invalid cron expression: " + schedule.cronExpression());
        }

        Instant nextRunAt = schedule.enabled()
                ? CadenceCalculator.nextDue(schedule, Instant.now(clock), zone).orElse(null)
                : null;
        Schedule saved = scheduleRepository.save(schedule.toBuilder().nextRunAt(nextRunAt).build());
        log.info("Saved schedule {} ({}), next run {}", saved.id(), saved.name(), nextRunAt);
        return saved;
    }

    public Optional<Schedule> findById(long id) {
        return scheduleRepository.findById(id);
    }
}
