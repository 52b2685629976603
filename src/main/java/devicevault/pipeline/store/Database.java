package devicevault.pipeline.store;

import com.zaxxer.hikari.HikariConfig;
import com.zaxxer.hikari.HikariDataSource;
import devicevault.pipeline.config.PipelineConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.SQLException;
import java.sql.Statement;

/**
 * Database connection pool and schema management.
 * Uses HikariCP for connection pooling.
 */
public final class Database implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(Database.class);

    private final HikariDataSource dataSource;

    public Database(PipelineConfig config) {
        this(config.databaseUrl(), config.databasePoolSize());
    }

    public Database(String jdbcUrl, int poolSize) {
        HikariConfig hikariConfig = new HikariConfig();
        hikariConfig.setJdbcUrl(jdbcUrl);
        hikariConfig.setMaximumPoolSize(poolSize);
        hikariConfig.setMinimumIdle(1);
        hikariConfig.setConnectionTimeout(5000);
        hikariConfig.setIdleTimeout(300000);
        hikariConfig.setPoolName("devicevault-db-pool");
        hikariConfig.setAutoCommit(false);

        this.dataSource = new HikariDataSource(hikariConfig);

        log.info("Database pool initialized: {}", jdbcUrl);

        initSchema();
    }

    /**
     * Get a connection from the pool.
     * Caller is responsible for closing the connection.
     */
    public Connection getConnection() throws SQLException {
        return dataSource.getConnection();
    }

    public DataSource getDataSource() {
        return dataSource;
    }

    public boolean isHealthy() {
        try (Connection conn = getConnection()) {
            return conn.isValid(2);
        } catch (SQLException e) {
            log.warn("Database health check failed: {}", e.getMessage());
            return false;
        }
    }

    private void initSchema() {
        try (Connection conn = getConnection();
                Statement st = conn.createStatement()) {

            // ---------- SCHEDULES ----------
            st.addBatch("""
                        CREATE TABLE IF NOT EXISTS backup_schedules (
                            id              BIGINT GENERATED BY DEFAULT AS IDENTITY PRIMARY KEY,
                            name            VARCHAR(128) NOT NULL,
                            schedule_type   VARCHAR(20) NOT NULL DEFAULT 'daily',
                            run_hour        INT NOT NULL DEFAULT 0,
                            run_minute      INT NOT NULL DEFAULT 0,
                            day_of_week     INT,
                            day_of_month    INT,
                            cron_expression VARCHAR(255),
                            enabled         BOOLEAN NOT NULL DEFAULT TRUE,
                            last_run_at     TIMESTAMP,
                            next_run_at     TIMESTAMP
                        );
                    """);

            // ---------- COLLECTION GROUPS ----------
            st.addBatch("""
                        CREATE TABLE IF NOT EXISTS collection_groups (
                            id              BIGINT GENERATED BY DEFAULT AS IDENTITY PRIMARY KEY,
                            name            VARCHAR(128) NOT NULL
                        );
                    """);

            // ---------- STORAGE LOCATIONS ----------
            st.addBatch("""
                        CREATE TABLE IF NOT EXISTS storage_locations (
                            id              BIGINT GENERATED BY DEFAULT AS IDENTITY PRIMARY KEY,
                            name            VARCHAR(128) NOT NULL,
                            location_type   VARCHAR(64) NOT NULL,
                            config          CLOB NOT NULL
                        );
                    """);

            // ---------- DEVICES ----------
            st.addBatch("""
                        CREATE TABLE IF NOT EXISTS devices (
                            id                  BIGINT GENERATED BY DEFAULT AS IDENTITY PRIMARY KEY,
                            name                VARCHAR(128) NOT NULL,
                            ip_address          VARCHAR(64),
                            backup_method       VARCHAR(64),
                            enabled             BOOLEAN NOT NULL DEFAULT TRUE,
                            schedule_id         BIGINT REFERENCES backup_schedules(id) ON DELETE SET NULL,
                            collection_group_id BIGINT REFERENCES collection_groups(id) ON DELETE SET NULL,
                            storage_location_id BIGINT REFERENCES storage_locations(id) ON DELETE SET NULL,
                            credentials         CLOB,
                            last_backup_time    TIMESTAMP,
                            last_backup_status  VARCHAR(32)
                        );
                    """);

            // ---------- SCHEDULER STATE ----------
            st.addBatch("""
                        CREATE TABLE IF NOT EXISTS scheduler_state (
                            id              INT PRIMARY KEY,
                            last_tick       TIMESTAMP,
                            is_running      BOOLEAN NOT NULL DEFAULT FALSE,
                            scheduler_pid   BIGINT,
                            last_restart_at TIMESTAMP,
                            updated_at      TIMESTAMP DEFAULT CURRENT_TIMESTAMP
                        );
                    """);

            // ---------- COLLECTION RESULTS ----------
            st.addBatch("""
                        CREATE TABLE IF NOT EXISTS device_backup_results (
                            id                     BIGINT GENERATED BY DEFAULT AS IDENTITY PRIMARY KEY,
                            task_id                VARCHAR(64) NOT NULL,
                            task_identifier        VARCHAR(160) NOT NULL,
                            device_id              BIGINT NOT NULL REFERENCES devices(id) ON DELETE CASCADE,
                            status                 VARCHAR(16) NOT NULL,
                            recorded_at            TIMESTAMP NOT NULL,
                            log                    CLOB NOT NULL,
                            collection_duration_ms BIGINT,
                            initiated_at           TIMESTAMP,
                            overall_duration_ms    BIGINT,
                            CONSTRAINT uq_backup_results_task_identifier UNIQUE (task_identifier)
                        );
                    """);

            // ---------- STORED BACKUPS ----------
            st.addBatch("""
                        CREATE TABLE IF NOT EXISTS stored_backups (
                            id              BIGINT GENERATED BY DEFAULT AS IDENTITY PRIMARY KEY,
                            task_id         VARCHAR(64) NOT NULL,
                            task_identifier VARCHAR(160) NOT NULL,
                            device_id       BIGINT NOT NULL REFERENCES devices(id) ON DELETE CASCADE,
                            storage_backend VARCHAR(32) NOT NULL,
                            storage_ref     VARCHAR(512) NOT NULL,
                            status          VARCHAR(16) NOT NULL,
                            recorded_at     TIMESTAMP NOT NULL,
                            log             CLOB NOT NULL,
                            CONSTRAINT uq_stored_backups_task_identifier UNIQUE (task_identifier)
                        );
                    """);

            // Indexes
            st.addBatch("CREATE INDEX IF NOT EXISTS idx_devices_schedule ON devices(schedule_id, enabled);");
            st.addBatch("CREATE INDEX IF NOT EXISTS idx_results_device_ts ON device_backup_results(device_id, recorded_at);");
            st.addBatch("CREATE INDEX IF NOT EXISTS idx_stored_device_ts ON stored_backups(device_id, recorded_at);");
            st.addBatch("CREATE INDEX IF NOT EXISTS idx_schedules_enabled ON backup_schedules(enabled);");

            st.executeBatch();
            conn.commit();

            log.info("Database schema initialized");
        } catch (SQLException e) {
            throw new RuntimeException("Failed to initialize database schema", e);
        }
    }

    @Override
    public void close() {
        if (dataSource != null && !dataSource.isClosed()) {
            dataSource.close();
            log.info("Database pool closed");
        }
    }
}
