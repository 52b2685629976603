package devicevault.pipeline.support;

import devicevault.pipeline.store.Database;

import java.sql.Connection;
import java.sql.SQLException;
import java.sql.Statement;

public final class TestDatabases {

    private TestDatabases() {
    }

    public static Database inMemory(String name) {
        return new Database("jdbc:h2:mem:" + name + "-" + System.nanoTime()
                + ";DB_CLOSE_DELAY=-1;MODE=PostgreSQL;DATABASE_TO_UPPER=FALSE", 4);
    }

    public static void clear(Database db) {
        try (Connection conn = db.getConnection();
                Statement st = conn.createStatement()) {
            st.execute("DELETE FROM stored_backups");
            st.execute("DELETE FROM device_backup_results");
            st.execute("DELETE FROM devices");
            st.execute("DELETE FROM collection_groups");
            st.execute("DELETE FROM storage_locations");
            st.execute("DELETE FROM backup_schedules");
            st.execute("DELETE FROM scheduler_state");
            conn.commit();
        } catch (SQLException e) {
            throw new RuntimeException("Failed to clear test database", e);
        }
    }
}
