package devicevault.pipeline.store;

import devicevault.pipeline.model.ResultStatus;
import devicevault.pipeline.model.StoredArtifact;
import devicevault.pipeline.repository.StoredArtifactRepository;
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
 * JDBC implementation of StoredArtifactRepository, the retrieval index.
 */
public class JdbcStoredArtifactRepository implements StoredArtifactRepository {

    private static final Logger log = LoggerFactory.getLogger(JdbcStoredArtifactRepository.class);

    private final Database db;

    public JdbcStoredArtifactRepository(Database db) {
        this.db = db;
    }

    @Override
    public boolean save(StoredArtifact artifact) {
        String sql = """
                    INSERT INTO stored_backups (task_id, task_identifier, device_id, storage_backend, storage_ref,
                                                status, recorded_at, log)
                    VALUES (?, ?, ?, ?, ?, ?, ?, ?)
                """;

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setString(1, artifact.taskId());
            ps.setString(2, artifact.taskIdentifier());
            ps.setLong(3, artifact.deviceId());
            ps.setString(4, artifact.storageBackend());
            ps.setString(5, artifact.storageRef());
            ps.setString(6, artifact.status().wireValue());
            setTimestamp(ps, 7, artifact.timestamp());
            ps.setString(8, Json.write(artifact.log()));

            try {
                ps.executeUpdate();
                conn.commit();
                return true;
            } catch (SQLException e) {
                conn.rollback();
                if (isDuplicateKey(e)) {
                    log.debug("Stored artifact {} already recorded", artifact.taskIdentifier());
                    return false;
                }
                throw e;
            }
        } catch (SQLException e) {
            throw new RuntimeException("Failed to save stored artifact: " + artifact.taskIdentifier(), e);
        }
    }

    @Override
    public boolean existsByTaskIdentifier(String taskIdentifier) {
        String sql = "SELECT 1 FROM stored_backups WHERE task_identifier = ?";

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setString(1, taskIdentifier);
            try (ResultSet rs = ps.executeQuery()) {
                return rs.next();
            }
        } catch (SQLException e) {
            throw new RuntimeException("Failed to check stored artifact: " + taskIdentifier, e);
        }
    }

    @Override
    public Optional<StoredArtifact> findById(long id) {
        return findOne("SELECT * FROM stored_backups WHERE id = ?", ps -> ps.setLong(1, id), String.valueOf(id));
    }

    @Override
    public Optional<StoredArtifact> findByTaskIdentifier(String taskIdentifier) {
        return findOne("SELECT * FROM stored_backups WHERE task_identifier = ?",
                ps -> ps.setString(1, taskIdentifier), taskIdentifier);
    }

    @Override
    public List<StoredArtifact> findByDevice(long deviceId, int limit) {
        String sql = "SELECT * FROM stored_backups WHERE device_id = ? ORDER BY recorded_at DESC, id DESC LIMIT ?";

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setLong(1, deviceId);
            ps.setInt(2, limit);
            List<StoredArtifact> artifacts = new ArrayList<>();
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    artifacts.add(mapRow(rs));
                }
            }
            return artifacts;
        } catch (SQLException e) {
            throw new RuntimeException("Failed to find stored artifacts for device: " + deviceId, e);
        }
    }

    private Optional<StoredArtifact> findOne(String sql, ParameterBinder binder, String key) {
        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            binder.bind(ps);
            try (ResultSet rs = ps.executeQuery()) {
                if (rs.next()) {
                    return Optional.of(mapRow(rs));
                }
            }
            return Optional.empty();
        } catch (SQLException e) {
            throw new RuntimeException("Failed to find stored artifact: " + key, e);
        }
    }

    @FunctionalInterface
    private interface ParameterBinder {
        void bind(PreparedStatement ps) throws SQLException;
    }

    private StoredArtifact mapRow(ResultSet rs) throws SQLException {
        return StoredArtifact.builder()
                .id(rs.getLong("id"))
                .taskId(rs.getString("task_id"))
                .taskIdentifier(rs.getString("task_identifier"))
                .deviceId(rs.getLong("device_id"))
                .storageBackend(rs.getString("storage_backend"))
                .storageRef(rs.getString("storage_ref"))
                .status(ResultStatus.fromWire(rs.getString("status")))
                .timestamp(toInstant(rs.getTimestamp("recorded_at")))
                .log(Json.readLog(rs.getString("log")))
                .build();
    }
}
