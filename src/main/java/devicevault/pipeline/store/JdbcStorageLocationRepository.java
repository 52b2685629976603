package devicevault.pipeline.store;

import devicevault.pipeline.model.StorageLocation;
import devicevault.pipeline.repository.StorageLocationRepository;
import devicevault.pipeline.util.Json;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.Optional;

import static devicevault.pipeline.store.JdbcSupport.generatedId;

/**
 * JDBC implementation of StorageLocationRepository.
 */
public class JdbcStorageLocationRepository implements StorageLocationRepository {

    private final Database db;

    public JdbcStorageLocationRepository(Database db) {
        this.db = db;
    }

    @Override
    public StorageLocation save(StorageLocation location) {
        boolean insert = location.id() == 0;
        String sql = insert
                ? "INSERT INTO storage_locations (name, location_type, config) VALUES (?, ?, ?)"
                : "UPDATE storage_locations SET name = ?, location_type = ?, config = ? WHERE id = ?";

        try (Connection conn = db.getConnection();
                PreparedStatement ps = insert
                        ? conn.prepareStatement(sql, Statement.RETURN_GENERATED_KEYS)
                        : conn.prepareStatement(sql)) {

            ps.setString(1, location.name());
            ps.setString(2, location.backendKind());
            ps.setString(3, Json.write(location.config()));

            long id = location.id();
            if (insert) {
                ps.executeUpdate();
                id = generatedId(ps);
            } else {
                ps.setLong(4, location.id());
                if (ps.executeUpdate() == 0) {
                    throw new IllegalArgumentException("Storage location not found: " + location.id());
                }
            }
            conn.commit();
            return new StorageLocation(id, location.name(), location.backendKind(), location.config());
        } catch (SQLException e) {
            throw new RuntimeException("Failed to save storage location: " + location.name(), e);
        }
    }

    @Override
    public Optional<StorageLocation> findById(long id) {
        String sql = "SELECT id, name, location_type, config FROM storage_locations WHERE id = ?";

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setLong(1, id);
            try (ResultSet rs = ps.executeQuery()) {
                if (rs.next()) {
                    return Optional.of(new StorageLocation(
                            rs.getLong("id"),
                            rs.getString("name"),
                            rs.getString("location_type"),
                            Json.readMap(rs.getString("config"))));
                }
            }
            return Optional.empty();
        } catch (SQLException e) {
            throw new RuntimeException("Failed to find storage location: " + id, e);
        }
    }
}
