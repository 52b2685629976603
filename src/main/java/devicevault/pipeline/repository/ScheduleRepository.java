package devicevault.pipeline.repository;

import devicevault.pipeline.model.Schedule;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Repository interface for backup schedules.
 */
public interface ScheduleRepository {

    /**
     * Insert a new schedule (id == 0) or update an existing one.
     *
     * @return the stored schedule with its ID
     */
    Schedule save(Schedule schedule);

    Optional<Schedule> findById(long id);

    /**
     * All enabled schedules, ordered by ID.
     */
    List<Schedule> findEnabled();

    /**
     * Update the display bookkeeping after a dispatch.
     *
     * @return true if the schedule exists
     */
    boolean updateRunTimes(long id, Instant lastRunAt, Instant nextRunAt);
}
