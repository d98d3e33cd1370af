package agenthub.orchestrator.store;

import agenthub.orchestrator.config.OrchestratorConfig;
import com.zaxxer.hikari.HikariConfig;
import com.zaxxer.hikari.HikariDataSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.SQLException;
import java.sql.Statement;

/**
 * Database connection pool and schema management.
 * Uses HikariCP for connection pooling; connections are handed out with auto-commit off.
 */
public final class Database implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(Database.class);

    private final HikariDataSource dataSource;

    public Database(OrchestratorConfig config) {
        this(config.databaseUrl(), config.databasePoolSize());
    }

    public Database(String jdbcUrl, int poolSize) {
        HikariConfig hikariConfig = new HikariConfig();
        hikariConfig.setJdbcUrl(jdbcUrl);
        hikariConfig.setMaximumPoolSize(poolSize);
        hikariConfig.setMinimumIdle(2);
        hikariConfig.setConnectionTimeout(5000);
        hikariConfig.setIdleTimeout(300000);
        hikariConfig.setPoolName("agenthub-db-pool");
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

    /**
     * Check if database is healthy.
     */
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

            // ---------- TASKS ----------
            st.addBatch("""
                        CREATE TABLE IF NOT EXISTS tasks (
                            id                   VARCHAR(40) PRIMARY KEY,
                            agent_type           VARCHAR(100) NOT NULL,
                            status               VARCHAR(20) NOT NULL,
                            priority             INT NOT NULL DEFAULT 0,
                            payload              CLOB NOT NULL,
                            idempotency_key      VARCHAR(64),
                            user_id              VARCHAR(128),
                            attempts             INT NOT NULL DEFAULT 0,
                            max_attempts         INT NOT NULL DEFAULT 3,
                            progress_percent     INT NOT NULL DEFAULT 0,
                            progress_message     VARCHAR(500),
                            current_step         VARCHAR(100),
                            total_steps          INT,
                            current_step_num     INT,
                            result               CLOB,
                            error_code           VARCHAR(64),
                            error_message        VARCHAR(2048),
                            error_retryable      BOOLEAN,
                            tokens_input         BIGINT NOT NULL DEFAULT 0,
                            tokens_output        BIGINT NOT NULL DEFAULT 0,
                            estimated_cost_cents BIGINT NOT NULL DEFAULT 0,
                            webhook_url          VARCHAR(2000),
                            cancel_requested     BOOLEAN NOT NULL DEFAULT FALSE,
                            requeue_count        INT NOT NULL DEFAULT 0,
                            created_at           TIMESTAMP NOT NULL,
                            started_at           TIMESTAMP,
                            updated_at           TIMESTAMP,
                            completed_at         TIMESTAMP,
                            next_retry_at        TIMESTAMP,
                            version              BIGINT NOT NULL DEFAULT 0
                        );
                    """);

            // ---------- DEAD LETTERS ----------
            st.addBatch("""
                        CREATE TABLE IF NOT EXISTS dead_letter_tasks (
                            task_id              VARCHAR(40) PRIMARY KEY,
                            agent_type           VARCHAR(100) NOT NULL,
                            payload              CLOB NOT NULL,
                            priority             INT NOT NULL DEFAULT 0,
                            attempts             INT NOT NULL,
                            max_attempts         INT NOT NULL,
                            error_code           VARCHAR(64),
                            error_message        VARCHAR(2048),
                            error_retryable      BOOLEAN,
                            user_id              VARCHAR(128),
                            webhook_url          VARCHAR(2000),
                            tokens_input         BIGINT NOT NULL DEFAULT 0,
                            tokens_output        BIGINT NOT NULL DEFAULT 0,
                            estimated_cost_cents BIGINT NOT NULL DEFAULT 0,
                            requeue_count        INT NOT NULL DEFAULT 0,
                            created_at           TIMESTAMP,
                            failed_at            TIMESTAMP,
                            moved_at             TIMESTAMP NOT NULL
                        );
                    """);

            // Indexes
            st.addBatch(
                    "CREATE INDEX IF NOT EXISTS idx_tasks_status_priority ON tasks(status, priority DESC, created_at);");
            st.addBatch("CREATE INDEX IF NOT EXISTS idx_tasks_agent_status ON tasks(agent_type, status);");
            st.addBatch("CREATE INDEX IF NOT EXISTS idx_tasks_user ON tasks(user_id);");
            st.addBatch("CREATE INDEX IF NOT EXISTS idx_tasks_completed ON tasks(completed_at);");
            st.addBatch("CREATE INDEX IF NOT EXISTS idx_dead_letter_moved ON dead_letter_tasks(moved_at);");

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
