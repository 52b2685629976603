package devicevault.pipeline.store;

import devicevault.pipeline.model.Cadence;
import devicevault.pipeline.model.Schedule;
import devicevault.pipeline.repository.ScheduleRepository;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import static devicevault.pipeline.store.JdbcSupport.*;

/**
 * JDBC implementation of ScheduleRepository.
 */
public class JdbcScheduleRepository implements ScheduleRepository {

    private final Database db;

    public JdbcScheduleRepository(Database db) {
        this.db = db;
    }

    @Override
    public Schedule save(Schedule schedule) {
        if (schedule.id() == 0) {
            return insert(schedule);
        }
        update(schedule);
        return schedule;
    }

    private Schedule insert(Schedule schedule) {
        String sql = """
                    INSERT INTO backup_schedules (name, schedule_type, run_hour, run_minute, day_of_week, day_of_month,
                                                  cron_expression, enabled, last_run_at, next_run_at)
                    VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?)
                """;

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql, Statement.RETURN_GENERATED_KEYS)) {

            bind(ps, schedule);
            ps.executeUpdate();
            long id = generatedId(ps);
            conn.commit();

            return schedule.toBuilder().id(id).build();
        } catch (SQLException e) {
            throw new RuntimeException("Failed to save schedule: " + schedule.name(), e);
        }
    }

    private void update(Schedule schedule) {
        String sql = """
                    UPDATE backup_schedules
                    SET name = ?, schedule_type = ?, run_hour = ?, run_minute = ?, day_of_week = ?, day_of_month = ?,
                        cron_expression = ?, enabled = ?, last_run_at = ?, next_run_at = ?
                    WHERE id = ?
                """;

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            bind(ps, schedule);
            ps.setLong(11, schedule.id());
            int updated = ps.executeUpdate();
            conn.commit();

            if (updated == 0) {
                throw new IllegalArgumentException("Schedule not found: " + schedule.id());
            }
        } catch (SQLException e) {
            throw new RuntimeException("Failed to update schedule: " + schedule.id(), e);
        }
    }

    private static void bind(PreparedStatement ps, Schedule schedule) throws SQLException {
        ps.setString(1, schedule.name());
        ps.setString(2, schedule.cadence().wireValue());
        ps.setInt(3, schedule.hour());
        ps.setInt(4, schedule.minute());
        setIntOrNull(ps, 5, schedule.dayOfWeek());
        setIntOrNull(ps, 6, schedule.dayOfMonth());
        ps.setString(7, schedule.cronExpression());
        ps.setBoolean(8, schedule.enabled());
        setTimestamp(ps, 9, schedule.lastRunAt());
        setTimestamp(ps, 10, schedule.nextRunAt());
    }

    @Override
    public Optional<Schedule> findById(long id) {
        String sql = "SELECT * FROM backup_schedules WHERE id = ?";

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setLong(1, id);
            try (ResultSet rs = ps.executeQuery()) {
                if (rs.next()) {
                    return Optional.of(mapRow(rs));
                }
            }
            return Optional.empty();
        } catch (SQLException e) {
            throw new RuntimeException("Failed to find schedule: " + id, e);
        }
    }

    @Override
    public List<Schedule> findEnabled() {
        String sql = "SELECT * FROM backup_schedules WHERE enabled = TRUE ORDER BY id";

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql);
                ResultSet rs = ps.executeQuery()) {

            List<Schedule> schedules = new ArrayList<>();
            while (rs.next()) {
                schedules.add(mapRow(rs));
            }
            return schedules;
        } catch (SQLException e) {
            throw new RuntimeException("Failed to load enabled schedules", e);
        }
    }

    @Override
    public boolean updateRunTimes(long id, Instant lastRunAt, Instant nextRunAt) {
        String sql = "UPDATE backup_schedules SET last_run_at = ?, next_run_at = ? WHERE id = ?";

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            setTimestamp(ps, 1, lastRunAt);
            setTimestamp(ps, 2, nextRunAt);
            ps.setLong(3, id);
            int updated = ps.executeUpdate();
            conn.commit();
            return updated > 0;
        } catch (SQLException e) {
            throw new RuntimeException("Failed to update run times for schedule: " + id, e);
        }
    }

    private Schedule mapRow(ResultSet rs) throws SQLException {
        return Schedule.builder()
                .id(rs.getLong("id"))
                .name(rs.getString("name"))
                .cadence(Cadence.fromWire(rs.getString("schedule_type")))
                .hour(rs.getInt("run_hour"))
                .minute(rs.getInt("run_minute"))
                .dayOfWeek(getIntOrNull(rs, "day_of_week"))
                .dayOfMonth(getIntOrNull(rs, "day_of_month"))
                .cronExpression(rs.getString("cron_expression"))
                .enabled(rs.getBoolean("enabled"))
                .lastRunAt(toInstant(rs.getTimestamp("last_run_at")))
                .nextRunAt(toInstant(rs.getTimestamp("next_run_at")))
                .build();
    }
}
