package devicevault.pipeline.repository;

import devicevault.pipeline.model.SchedulerState;

/**
 * Narrow read/write access to the scheduler's persisted state row.
 * Only the scheduler daemon writes it.
 */
public interface SchedulerStateRepository {

    /**
     * Load the state, creating the row on first use.
     */
    SchedulerState load();

    void save(SchedulerState state);
}
