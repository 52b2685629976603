package devicevault.pipeline.store;

import devicevault.pipeline.model.SchedulerState;
import devicevault.pipeline.repository.SchedulerStateRepository;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;

import static devicevault.pipeline.store.JdbcSupport.*;

/**
 * JDBC implementation of SchedulerStateRepository. The state lives in a
 * single row with a fixed primary key.
 */
public class JdbcSchedulerStateRepository implements SchedulerStateRepository {

    private static final int STATE_ROW_ID = 1;

    private final Database db;

    public JdbcSchedulerStateRepository(Database db) {
        this.db = db;
    }

    @Override
    public SchedulerState load() {
        String select = "SELECT last_tick, is_running, scheduler_pid, last_restart_at FROM scheduler_state WHERE id = ?";

        try (Connection conn = db.getConnection()) {
            try (PreparedStatement ps = conn.prepareStatement(select)) {
                ps.setInt(1, STATE_ROW_ID);
                try (ResultSet rs = ps.executeQuery()) {
                    if (rs.next()) {
                        return new SchedulerState(
                                toInstant(rs.getTimestamp("last_tick")),
                                rs.getBoolean("is_running"),
                                getLongOrNull(rs, "scheduler_pid"),
                                toInstant(rs.getTimestamp("last_restart_at")));
                    }
                }
            }

            try (PreparedStatement ps = conn.prepareStatement(
                    "INSERT INTO scheduler_state (id, is_running) VALUES (?, FALSE)")) {
                ps.setInt(1, STATE_ROW_ID);
                ps.executeUpdate();
                conn.commit();
            } catch (SQLException e) {
                // another process created the row first
                conn.rollback();
                if (!isDuplicateKey(e)) {
                    throw e;
                }
            }
            return SchedulerState.initial();
        } catch (SQLException e) {
            throw new RuntimeException("Failed to load scheduler state", e);
        }
    }

    @Override
    public void save(SchedulerState state) {
        String sql = """
                    MERGE INTO scheduler_state (id, last_tick, is_running, scheduler_pid, last_restart_at, updated_at)
                    KEY (id)
                    VALUES (?, ?, ?, ?, ?, CURRENT_TIMESTAMP)
                """;

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setInt(1, STATE_ROW_ID);
            setTimestamp(ps, 2, state.lastTick());
            ps.setBoolean(3, state.running());
            setLongOrNull(ps, 4, state.ownerPid());
            setTimestamp(ps, 5, state.lastRestartAt());
            ps.executeUpdate();
            conn.commit();
        } catch (SQLException e) {
            throw new RuntimeException("Failed to save scheduler state", e);
        }
    }
}
