package devicevault.pipeline.store;

import devicevault.pipeline.model.CollectionResult;
import devicevault.pipeline.model.ResultStatus;
import devicevault.pipeline.repository.CollectionResultRepository;
import devicevault.pipeline.util.Json;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import static devicevault.pipeline.store.JdbcSupport.*;

/**
 * JDBC implementation of CollectionResultRepository.
 * task_identifier is unique, so a redelivered stream message cannot produce
 * a second row.
 */
public class JdbcCollectionResultRepository implements CollectionResultRepository {

    private static final Logger log = LoggerFactory.getLogger(JdbcCollectionResultRepository.class);

    private final Database db;

    public JdbcCollectionResultRepository(Database db) {
        this.db = db;
    }

    @Override
    public boolean save(CollectionResult result) {
        String sql = """
                    INSERT INTO device_backup_results (task_id, task_identifier, device_id, status, recorded_at, log,
                                                       collection_duration_ms, initiated_at, overall_duration_ms)
                    VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?)
                """;

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setString(1, result.taskId());
            ps.setString(2, result.taskIdentifier());
            ps.setLong(3, result.deviceId());
            ps.setString(4, result.status().wireValue());
            setTimestamp(ps, 5, result.timestamp());
            ps.setString(6, Json.write(result.log()));
            setLongOrNull(ps, 7, result.collectionDurationMs());
            setTimestamp(ps, 8, result.initiatedAt());
            setLongOrNull(ps, 9, result.overallDurationMs());

            try {
                ps.executeUpdate();
                conn.commit();
                return true;
            } catch (SQLException e) {
                conn.rollback();
                if (isDuplicateKey(e)) {
                    log.debug("Collection result {} already recorded", result.taskIdentifier());
                    return false;
                }
                throw e;
            }
        } catch (SQLException e) {
            throw new RuntimeException("Failed to save collection result: " + result.taskIdentifier(), e);
        }
    }

    @Override
    public boolean existsByTaskIdentifier(String taskIdentifier) {
        String sql = "SELECT 1 FROM device_backup_results WHERE task_identifier = ?";

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setString(1, taskIdentifier);
            try (ResultSet rs = ps.executeQuery()) {
                return rs.next();
            }
        } catch (SQLException e) {
            throw new RuntimeException("Failed to check collection result: " + taskIdentifier, e);
        }
    }

    @Override
    public Optional<CollectionResult> findByTaskIdentifier(String taskIdentifier) {
        String sql = "SELECT * FROM device_backup_results WHERE task_identifier = ?";

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setString(1, taskIdentifier);
            try (ResultSet rs = ps.executeQuery()) {
                if (rs.next()) {
                    return Optional.of(mapRow(rs));
                }
            }
            return Optional.empty();
        } catch (SQLException e) {
            throw new RuntimeException("Failed to find collection result: " + taskIdentifier, e);
        }
    }

    @Override
    public List<CollectionResult> findByDevice(long deviceId, int limit) {
        String sql = "SELECT * FROM device_backup_results WHERE device_id = ? ORDER BY recorded_at DESC, id DESC LIMIT ?";

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setLong(1, deviceId);
            ps.setInt(2, limit);
            List<CollectionResult> results = new ArrayList<>();
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    results.add(mapRow(rs));
                }
            }
            return results;
        } catch (SQLException e) {
            throw new RuntimeException("Failed to find collection results for device: " + deviceId, e);
        }
    }

    @Override
    public boolean updateOverallDuration(String taskIdentifier, long overallDurationMs) {
        String sql = "UPDATE device_backup_results SET overall_duration_ms = ? WHERE task_identifier = ?";

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setLong(1, overallDurationMs);
            ps.setString(2, taskIdentifier);
            int updated = ps.executeUpdate();
            conn.commit();
            return updated > 0;
        } catch (SQLException e) {
            throw new RuntimeException("Failed to update overall duration: " + taskIdentifier, e);
        }
    }

    private CollectionResult mapRow(ResultSet rs) throws SQLException {
        return CollectionResult.builder()
                .id(rs.getLong("id"))
                .taskId(rs.getString("task_id"))
                .taskIdentifier(rs.getString("task_identifier"))
                .deviceId(rs.getLong("device_id"))
                .status(ResultStatus.fromWire(rs.getString("status")))
                .timestamp(toInstant(rs.getTimestamp("recorded_at")))
                .log(Json.readLog(rs.getString("log")))
                .collectionDurationMs(getLongOrNull(rs, "collection_duration_ms"))
                .initiatedAt(toInstant(rs.getTimestamp("initiated_at")))
                .overallDurationMs(getLongOrNull(rs, "overall_duration_ms"))
                .build();
    }
}
