package agenthub.orchestrator.store;

import agenthub.orchestrator.model.DeadLetterEntry;
import agenthub.orchestrator.model.TaskCost;
import agenthub.orchestrator.model.TaskError;
import agenthub.orchestrator.repository.DeadLetterRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import static agenthub.orchestrator.store.JdbcTaskRepository.getBooleanOrNull;
import static agenthub.orchestrator.store.JdbcTaskRepository.setBooleanOrNull;
import static agenthub.orchestrator.store.JdbcTaskRepository.setTimestamp;
import static agenthub.orchestrator.store.JdbcTaskRepository.toInstant;

/**
 * JDBC implementation of DeadLetterRepository.
 * Uses row locking so that a requeue removes an entry exactly once.
 */
public class JdbcDeadLetterRepository implements DeadLetterRepository {

    private static final Logger log = LoggerFactory.getLogger(JdbcDeadLetterRepository.class);

    private final Database db;

    public JdbcDeadLetterRepository(Database db) {
        this.db = db;
    }

    @Override
    public boolean add(DeadLetterEntry entry) {
        String existsSql = "SELECT 1 FROM dead_letter_tasks WHERE task_id = ?";
        String insertSql = """
                    INSERT INTO dead_letter_tasks (task_id, agent_type, payload, priority, attempts, max_attempts,
                                                   error_code, error_message, error_retryable, user_id, webhook_url,
                                                   tokens_input, tokens_output, estimated_cost_cents, requeue_count,
                                                   created_at, failed_at, moved_at)
                    VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?)
                """;

        try (Connection conn = db.getConnection()) {
            try (PreparedStatement existsPs = conn.prepareStatement(existsSql);
                    PreparedStatement ps = conn.prepareStatement(insertSql)) {

                existsPs.setString(1, entry.taskId());
                try (ResultSet rs = existsPs.executeQuery()) {
                    if (rs.next()) {
                        conn.rollback();
                        log.debug("Task {} already in dead letter queue", entry.taskId());
                        return false;
                    }
                }

                TaskError error = entry.error();
                TaskCost cost = entry.cost() != null ? entry.cost() : TaskCost.ZERO;

                ps.setString(1, entry.taskId());
                ps.setString(2, entry.agentType());
                ps.setString(3, entry.payload());
                ps.setInt(4, entry.priority());
                ps.setInt(5, entry.attempts());
                ps.setInt(6, entry.maxAttempts());
                ps.setString(7, error != null ? error.code() : null);
                ps.setString(8, error != null ? error.message() : null);
                setBooleanOrNull(ps, 9, error != null ? error.retryable() : null);
                ps.setString(10, entry.userId());
                ps.setString(11, entry.webhookUrl());
                ps.setLong(12, cost.tokensInput());
                ps.setLong(13, cost.tokensOutput());
                ps.setLong(14, cost.estimatedCostCents());
                ps.setInt(15, entry.requeueCount());
                setTimestamp(ps, 16, entry.createdAt());
                setTimestamp(ps, 17, entry.failedAt());
                setTimestamp(ps, 18, entry.movedAt());

                ps.executeUpdate();
                conn.commit();

                log.debug("Task {} moved to dead letter queue", entry.taskId());
                return true;
            } catch (SQLException e) {
                conn.rollback();
                throw e;
            }
        } catch (SQLException e) {
            throw new RuntimeException("Failed to add dead letter entry: " + entry.taskId(), e);
        }
    }

    @Override
    public Optional<DeadLetterEntry> findById(String taskId) {
        String sql = "SELECT * FROM dead_letter_tasks WHERE task_id = ?";

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setString(1, taskId);
            try (ResultSet rs = ps.executeQuery()) {
                if (rs.next()) {
                    return Optional.of(mapRow(rs));
                }
            }
            return Optional.empty();
        } catch (SQLException e) {
            throw new RuntimeException("Failed to find dead letter entry: " + taskId, e);
        }
    }

    @Override
    public List<DeadLetterEntry> list(int limit) {
        String sql = "SELECT * FROM dead_letter_tasks ORDER BY moved_at DESC, task_id LIMIT ?";

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setInt(1, limit);
            List<DeadLetterEntry> entries = new ArrayList<>();
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    entries.add(mapRow(rs));
                }
            }
            return entries;
        } catch (SQLException e) {
            throw new RuntimeException("Failed to list dead letter entries", e);
        }
    }

    @Override
    public boolean delete(String taskId) {
        String sql = "DELETE FROM dead_letter_tasks WHERE task_id = ?";

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setString(1, taskId);
            int deleted = ps.executeUpdate();
            conn.commit();
            return deleted > 0;
        } catch (SQLException e) {
            throw new RuntimeException("Failed to delete dead letter entry: " + taskId, e);
        }
    }

    @Override
    public Optional<DeadLetterEntry> take(String taskId) {
        String selectSql = "SELECT * FROM dead_letter_tasks WHERE task_id = ? FOR UPDATE";
        String deleteSql = "DELETE FROM dead_letter_tasks WHERE task_id = ?";

        try (Connection conn = db.getConnection()) {
            try (PreparedStatement selectPs = conn.prepareStatement(selectSql);
                    PreparedStatement deletePs = conn.prepareStatement(deleteSql)) {

                selectPs.setString(1, taskId);
                DeadLetterEntry entry;
                try (ResultSet rs = selectPs.executeQuery()) {
                    if (!rs.next()) {
                        conn.rollback();
                        return Optional.empty();
                    }
                    entry = mapRow(rs);
                }

                deletePs.setString(1, taskId);
                if (deletePs.executeUpdate() != 1) {
                    conn.rollback();
                    return Optional.empty();
                }
                conn.commit();
                return Optional.of(entry);
            } catch (SQLException e) {
                conn.rollback();
                throw e;
            }
        } catch (SQLException e) {
            throw new RuntimeException("Failed to take dead letter entry: " + taskId, e);
        }
    }

    @Override
    public int count() {
        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement("SELECT COUNT(*) FROM dead_letter_tasks");
                ResultSet rs = ps.executeQuery()) {
            return rs.next() ? rs.getInt(1) : 0;
        } catch (SQLException e) {
            throw new RuntimeException("Failed to count dead letter entries", e);
        }
    }

    private DeadLetterEntry mapRow(ResultSet rs) throws SQLException {
        String errorCode = rs.getString("error_code");
        String errorMessage = rs.getString("error_message");
        TaskError error = errorCode != null || errorMessage != null
                ? new TaskError(errorCode, errorMessage, Boolean.TRUE.equals(getBooleanOrNull(rs, "error_retryable")))
                : null;

        return new DeadLetterEntry(
                rs.getString("task_id"),
                rs.getString("agent_type"),
                rs.getString("payload"),
                rs.getInt("priority"),
                rs.getInt("attempts"),
                rs.getInt("max_attempts"),
                error,
                rs.getString("user_id"),
                rs.getString("webhook_url"),
                new TaskCost(rs.getLong("tokens_input"), rs.getLong("tokens_output"),
                        rs.getLong("estimated_cost_cents")),
                rs.getInt("requeue_count"),
                toInstant(rs.getTimestamp("created_at")),
                toInstant(rs.getTimestamp("failed_at")),
                toInstant(rs.getTimestamp("moved_at")));
    }
}
