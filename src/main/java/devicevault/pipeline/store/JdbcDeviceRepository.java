package devicevault.pipeline.store;

import devicevault.pipeline.model.CollectionGroup;
import devicevault.pipeline.model.Device;
import devicevault.pipeline.repository.DeviceRepository;
import devicevault.pipeline.util.Json;

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
 * JDBC implementation of DeviceRepository.
 */
public class JdbcDeviceRepository implements DeviceRepository {

    private final Database db;

    public JdbcDeviceRepository(Database db) {
        this.db = db;
    }

    @Override
    public Device save(Device device) {
        boolean insert = device.id() == 0;
        String sql = insert
                ? """
                    INSERT INTO devices (name, ip_address, backup_method, enabled, schedule_id, collection_group_id,
                                         storage_location_id, credentials, last_backup_time, last_backup_status)
                    VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?)
                """
                : """
                    UPDATE devices
                    SET name = ?, ip_address = ?, backup_method = ?, enabled = ?, schedule_id = ?, collection_group_id = ?,
                        storage_location_id = ?, credentials = ?, last_backup_time = ?, last_backup_status = ?
                    WHERE id = ?
                """;

        try (Connection conn = db.getConnection();
                PreparedStatement ps = insert
                        ? conn.prepareStatement(sql, Statement.RETURN_GENERATED_KEYS)
                        : conn.prepareStatement(sql)) {

            ps.setString(1, device.name());
            ps.setString(2, device.ipAddress());
            ps.setString(3, device.backupMethod());
            ps.setBoolean(4, device.enabled());
            setLongOrNull(ps, 5, device.scheduleId());
            setLongOrNull(ps, 6, device.collectionGroupId());
            setLongOrNull(ps, 7, device.storageLocationId());
            ps.setString(8, Json.write(device.credentials()));
            setTimestamp(ps, 9, device.lastBackupTime());
            ps.setString(10, device.lastBackupStatus());

            long id = device.id();
            if (insert) {
                ps.executeUpdate();
                id = generatedId(ps);
            } else {
                ps.setLong(11, device.id());
                if (ps.executeUpdate() == 0) {
                    throw new IllegalArgumentException("Device not found: " + device.id());
                }
            }
            conn.commit();

            return new Device(id, device.name(), device.ipAddress(), device.backupMethod(), device.enabled(),
                    device.scheduleId(), device.collectionGroupId(), device.storageLocationId(),
                    device.credentials(), device.lastBackupTime(), device.lastBackupStatus());
        } catch (SQLException e) {
            throw new RuntimeException("Failed to save device: " + device.name(), e);
        }
    }

    @Override
    public Optional<Device> findById(long id) {
        String sql = "SELECT * FROM devices WHERE id = ?";

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
            throw new RuntimeException("Failed to find device: " + id, e);
        }
    }

    @Override
    public List<Device> findEnabledBySchedule(long scheduleId) {
        String sql = "SELECT * FROM devices WHERE schedule_id = ? AND enabled = TRUE ORDER BY id";

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setLong(1, scheduleId);
            List<Device> devices = new ArrayList<>();
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    devices.add(mapRow(rs));
                }
            }
            return devices;
        } catch (SQLException e) {
            throw new RuntimeException("Failed to find devices for schedule: " + scheduleId, e);
        }
    }

    @Override
    public boolean updateLastBackup(long deviceId, Instant time, String status) {
        String sql = "UPDATE devices SET last_backup_time = ?, last_backup_status = ? WHERE id = ?";

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            setTimestamp(ps, 1, time);
            ps.setString(2, status);
            ps.setLong(3, deviceId);
            int updated = ps.executeUpdate();
            conn.commit();
            return updated > 0;
        } catch (SQLException e) {
            throw new RuntimeException("Failed to update last backup for device: " + deviceId, e);
        }
    }

    @Override
    public CollectionGroup saveCollectionGroup(String name) {
        String sql = "INSERT INTO collection_groups (name) VALUES (?)";

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql, Statement.RETURN_GENERATED_KEYS)) {

            ps.setString(1, name);
            ps.executeUpdate();
            long id = generatedId(ps);
            conn.commit();
            return new CollectionGroup(id, name);
        } catch (SQLException e) {
            throw new RuntimeException("Failed to save collection group: " + name, e);
        }
    }

    @Override
    public Optional<CollectionGroup> findCollectionGroup(long id) {
        String sql = "SELECT id, name FROM collection_groups WHERE id = ?";

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setLong(1, id);
            try (ResultSet rs = ps.executeQuery()) {
                if (rs.next()) {
                    return Optional.of(new CollectionGroup(rs.getLong("id"), rs.getString("name")));
                }
            }
            return Optional.empty();
        } catch (SQLException e) {
            throw new RuntimeException("Failed to find collection group: " + id, e);
        }
    }

    private Device mapRow(ResultSet rs) throws SQLException {
        return new Device(
                rs.getLong("id"),
                rs.getString("name"),
                rs.getString("ip_address"),
                rs.getString("backup_method"),
                rs.getBoolean("enabled"),
                getLongOrNull(rs, "schedule_id"),
                getLongOrNull(rs, "collection_group_id"),
                getLongOrNull(rs, "storage_location_id"),
                Json.readMap(rs.getString("credentials")),
                toInstant(rs.getTimestamp("last_backup_time")),
                rs.getString("last_backup_status"));
    }
}
