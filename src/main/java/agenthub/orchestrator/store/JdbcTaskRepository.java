package agenthub.orchestrator.store;

import agenthub.orchestrator.error.ConflictException;
import agenthub.orchestrator.error.InvalidStateException;
import agenthub.orchestrator.error.NotFoundException;
import agenthub.orchestrator.model.Task;
import agenthub.orchestrator.model.TaskCost;
import agenthub.orchestrator.model.TaskError;
import agenthub.orchestrator.model.TaskFilter;
import agenthub.orchestrator.model.TaskPage;
import agenthub.orchestrator.model.TaskProgress;
import agenthub.orchestrator.model.TaskStatus;
import agenthub.orchestrator.repository.TaskRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.*;
import java.time.Instant;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * JDBC implementation of TaskRepository.
 * Uses a version column for optimistic compare-and-set updates.
 */
public class JdbcTaskRepository implements TaskRepository {

    private static final Logger log = LoggerFactory.getLogger(JdbcTaskRepository.class);

    private static final String ACTIVE_STATUSES = "('PENDING', 'RUNNING', 'RETRYING')";
    private static final String TERMINAL_STATUSES = "('COMPLETED', 'FAILED', 'CANCELLED')";

    private final Database db;

    public JdbcTaskRepository(Database db) {
        this.db = db;
    }

    @Override
    public Task create(Task task) {
        String sql = """
                    INSERT INTO tasks (id, agent_type, status, priority, payload, idempotency_key, user_id,
                                       attempts, max_attempts, progress_percent, progress_message, current_step,
                                       total_steps, current_step_num, result, error_code, error_message,
                                       error_retryable, tokens_input, tokens_output, estimated_cost_cents,
                                       webhook_url, cancel_requested, requeue_count, created_at, started_at,
                                       updated_at, completed_at, next_retry_at, version)
                    VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, 0)
                """;

        Instant now = Instant.now();
        Task stored = task.toBuilder()
                .createdAt(task.createdAt() != null ? task.createdAt() : now)
                .updatedAt(task.updatedAt() != null ? task.updatedAt() : now)
                .version(0)
                .build();

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setString(1, stored.id());
            bindColumns(ps, stored, 1);

            ps.executeUpdate();
            conn.commit();

            log.debug("Created task {} ({})", stored.id(), stored.agentType());
            return stored;
        } catch (SQLException e) {
            throw new RuntimeException("Failed to create task: " + task.id(), e);
        }
    }

    @Override
    public Optional<Task> findById(String taskId) {
        String sql = "SELECT * FROM tasks WHERE id = ?";

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
            throw new RuntimeException("Failed to find task: " + taskId, e);
        }
    }

    @Override
    public Task compareAndSet(Task current, Task updated) {
        if (!current.id().equals(updated.id())) {
            throw new IllegalArgumentException("cannot change task id " + current.id() + " to " + updated.id());
        }
        if (!current.status().canTransitionTo(updated.status())) {
            throw new InvalidStateException("Task " + current.id() + " cannot move from "
                    + current.status() + " to " + updated.status());
        }

        String sql = """
                    UPDATE tasks
                    SET agent_type = ?, status = ?, priority = ?, payload = ?, idempotency_key = ?, user_id = ?,
                        attempts = ?, max_attempts = ?, progress_percent = ?, progress_message = ?,
                        current_step = ?, total_steps = ?, current_step_num = ?, result = ?, error_code = ?,
                        error_message = ?, error_retryable = ?, tokens_input = ?, tokens_output = ?,
                        estimated_cost_cents = ?, webhook_url = ?, cancel_requested = ?, requeue_count = ?,
                        created_at = ?, started_at = ?, updated_at = ?, completed_at = ?, next_retry_at = ?,
                        version = version + 1
                    WHERE id = ? AND status = ? AND version = ?
                """;

        Task toWrite = updated.toBuilder()
                .updatedAt(Instant.now())
                .version(current.version() + 1)
                .build();

        try (Connection conn = db.getConnection()) {
            try (PreparedStatement ps = conn.prepareStatement(sql)) {
                int next = bindColumns(ps, toWrite, 0);
                ps.setString(next++, current.id());
                ps.setString(next++, current.status().name());
                ps.setLong(next, current.version());

                int rows = ps.executeUpdate();
                if (rows == 1) {
                    conn.commit();
                    return toWrite;
                }
                conn.rollback();
            } catch (SQLException e) {
                conn.rollback();
                throw e;
            }

            if (exists(conn, current.id())) {
                log.debug("Stale update on task {} (expected {} v{})",
                        current.id(), current.status(), current.version());
                throw new ConflictException(current.id(),
                        "Task " + current.id() + " was modified concurrently");
            }
            throw new NotFoundException("task", current.id());
        } catch (SQLException e) {
            throw new RuntimeException("Failed to update task: " + current.id(), e);
        }
    }

    @Override
    public TaskPage list(TaskFilter filter, int limit, int offset) {
        StringBuilder where = new StringBuilder(" WHERE 1 = 1");
        List<String> params = new ArrayList<>();

        if (filter.agentType() != null) {
            where.append(" AND agent_type = ?");
            params.add(filter.agentType());
        }
        if (filter.status() != null) {
            where.append(" AND status = ?");
            params.add(filter.status().name());
        }
        if (filter.userId() != null) {
            where.append(" AND user_id = ?");
            params.add(filter.userId());
        }
        if (filter.activeOnly()) {
            where.append(" AND status IN ").append(ACTIVE_STATUSES);
        }

        String order = filter.activeOnly()
                ? " ORDER BY priority DESC, created_at ASC, id ASC"
                : " ORDER BY created_at DESC, id DESC";

        String selectSql = "SELECT * FROM tasks" + where + order + " LIMIT ? OFFSET ?";
        String countSql = "SELECT COUNT(*) FROM tasks" + where;

        try (Connection conn = db.getConnection();
                PreparedStatement selectPs = conn.prepareStatement(selectSql);
                PreparedStatement countPs = conn.prepareStatement(countSql)) {

            int index = 1;
            for (String param : params) {
                selectPs.setString(index, param);
                countPs.setString(index, param);
                index++;
            }
            selectPs.setInt(index++, limit);
            selectPs.setInt(index, offset);

            List<Task> tasks = executeQuery(selectPs);

            int total = 0;
            try (ResultSet rs = countPs.executeQuery()) {
                if (rs.next()) {
                    total = rs.getInt(1);
                }
            }
            conn.commit();

            return new TaskPage(tasks, total);
        } catch (SQLException e) {
            throw new RuntimeException("Failed to list tasks", e);
        }
    }

    @Override
    public boolean delete(String taskId) {
        String sql = "DELETE FROM tasks WHERE id = ?";

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setString(1, taskId);
            int deleted = ps.executeUpdate();
            conn.commit();

            if (deleted > 0) {
                log.debug("Task {} deleted", taskId);
            }
            return deleted > 0;
        } catch (SQLException e) {
            throw new RuntimeException("Failed to delete task: " + taskId, e);
        }
    }

    @Override
    public Map<TaskStatus, Integer> countByStatus() {
        String sql = "SELECT status, COUNT(*) AS cnt FROM tasks GROUP BY status";

        Map<TaskStatus, Integer> counts = new EnumMap<>(TaskStatus.class);
        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql);
                ResultSet rs = ps.executeQuery()) {

            while (rs.next()) {
                counts.put(TaskStatus.valueOf(rs.getString("status")), rs.getInt("cnt"));
            }
            conn.commit();
            return counts;
        } catch (SQLException e) {
            throw new RuntimeException("Failed to count tasks by status", e);
        }
    }

    @Override
    public List<Task> findByStatus(TaskStatus status, int limit) {
        String sql = "SELECT * FROM tasks WHERE status = ? ORDER BY priority DESC, created_at LIMIT ?";

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setString(1, status.name());
            ps.setInt(2, limit);
            return executeQuery(ps);
        } catch (SQLException e) {
            throw new RuntimeException("Failed to find tasks by status: " + status, e);
        }
    }

    @Override
    public List<Task> findStuckRunning(Instant startedBefore) {
        String sql = """
                    SELECT * FROM tasks
                    WHERE status = 'RUNNING' AND started_at < ?
                    ORDER BY started_at
                """;

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setTimestamp(1, Timestamp.from(startedBefore));
            return executeQuery(ps);
        } catch (SQLException e) {
            throw new RuntimeException("Failed to find stuck tasks", e);
        }
    }

    @Override
    public List<Task> findExpired(Instant completedBefore, int limit) {
        String sql = "SELECT * FROM tasks WHERE status IN " + TERMINAL_STATUSES
                + " AND completed_at < ? ORDER BY completed_at LIMIT ?";

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setTimestamp(1, Timestamp.from(completedBefore));
            ps.setInt(2, limit);
            return executeQuery(ps);
        } catch (SQLException e) {
            throw new RuntimeException("Failed to find expired tasks", e);
        }
    }

    @Override
    public List<Task> findWithIdempotencyKeySince(Instant createdAfter) {
        String sql = """
                    SELECT * FROM tasks
                    WHERE idempotency_key IS NOT NULL AND created_at >= ?
                    ORDER BY created_at
                """;

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setTimestamp(1, Timestamp.from(createdAfter));
            return executeQuery(ps);
        } catch (SQLException e) {
            throw new RuntimeException("Failed to find tasks with idempotency keys", e);
        }
    }

    // ==================== Helper methods ====================

    private boolean exists(Connection conn, String taskId) throws SQLException {
        try (PreparedStatement ps = conn.prepareStatement("SELECT 1 FROM tasks WHERE id = ?")) {
            ps.setString(1, taskId);
            try (ResultSet rs = ps.executeQuery()) {
                return rs.next();
            }
        }
    }

    /**
     * Bind every column except id and version, starting after {@code offset}.
     *
     * @return the next free parameter index
     */
    private static int bindColumns(PreparedStatement ps, Task task, int offset) throws SQLException {
        int i = offset;
        TaskProgress progress = task.progress();
        TaskError error = task.error();
        TaskCost cost = task.cost();

        ps.setString(++i, task.agentType());
        ps.setString(++i, task.status().name());
        ps.setInt(++i, task.priority());
        ps.setString(++i, task.payload());
        ps.setString(++i, task.idempotencyKey());
        ps.setString(++i, task.userId());
        ps.setInt(++i, task.attempts());
        ps.setInt(++i, task.maxAttempts());
        ps.setInt(++i, progress.percent());
        ps.setString(++i, progress.message());
        ps.setString(++i, progress.currentStep());
        setIntOrNull(ps, ++i, progress.totalSteps());
        setIntOrNull(ps, ++i, progress.currentStepNum());
        ps.setString(++i, task.result());
        ps.setString(++i, error != null ? error.code() : null);
        ps.setString(++i, error != null ? error.message() : null);
        setBooleanOrNull(ps, ++i, error != null ? error.retryable() : null);
        ps.setLong(++i, cost.tokensInput());
        ps.setLong(++i, cost.tokensOutput());
        ps.setLong(++i, cost.estimatedCostCents());
        ps.setString(++i, task.webhookUrl());
        ps.setBoolean(++i, task.cancelRequested());
        ps.setInt(++i, task.requeueCount());
        setTimestamp(ps, ++i, task.createdAt());
        setTimestamp(ps, ++i, task.startedAt());
        setTimestamp(ps, ++i, task.updatedAt());
        setTimestamp(ps, ++i, task.completedAt());
        setTimestamp(ps, ++i, task.nextRetryAt());
        return i + 1;
    }

    private List<Task> executeQuery(PreparedStatement ps) throws SQLException {
        List<Task> results = new ArrayList<>();
        try (ResultSet rs = ps.executeQuery()) {
            while (rs.next()) {
                results.add(mapRow(rs));
            }
        }
        return results;
    }

    private Task mapRow(ResultSet rs) throws SQLException {
        String errorCode = rs.getString("error_code");
        String errorMessage = rs.getString("error_message");
        Boolean errorRetryable = getBooleanOrNull(rs, "error_retryable");
        TaskError error = errorCode != null || errorMessage != null
                ? new TaskError(errorCode, errorMessage, Boolean.TRUE.equals(errorRetryable))
                : null;

        return Task.builder()
                .id(rs.getString("id"))
                .agentType(rs.getString("agent_type"))
                .status(TaskStatus.valueOf(rs.getString("status")))
                .priority(rs.getInt("priority"))
                .payload(rs.getString("payload"))
                .idempotencyKey(rs.getString("idempotency_key"))
                .userId(rs.getString("user_id"))
                .attempts(rs.getInt("attempts"))
                .maxAttempts(rs.getInt("max_attempts"))
                .progress(new TaskProgress(
                        rs.getInt("progress_percent"),
                        rs.getString("progress_message"),
                        rs.getString("current_step"),
                        getIntOrNull(rs, "total_steps"),
                        getIntOrNull(rs, "current_step_num")))
                .result(rs.getString("result"))
                .error(error)
                .cost(new TaskCost(
                        rs.getLong("tokens_input"),
                        rs.getLong("tokens_output"),
                        rs.getLong("estimated_cost_cents")))
                .webhookUrl(rs.getString("webhook_url"))
                .cancelRequested(rs.getBoolean("cancel_requested"))
                .requeueCount(rs.getInt("requeue_count"))
                .createdAt(toInstant(rs.getTimestamp("created_at")))
                .startedAt(toInstant(rs.getTimestamp("started_at")))
                .updatedAt(toInstant(rs.getTimestamp("updated_at")))
                .completedAt(toInstant(rs.getTimestamp("completed_at")))
                .nextRetryAt(toInstant(rs.getTimestamp("next_retry_at")))
                .version(rs.getLong("version"))
                .build();
    }

    static Instant toInstant(Timestamp ts) {
        return ts != null ? ts.toInstant() : null;
    }

    static void setTimestamp(PreparedStatement ps, int index, Instant instant) throws SQLException {
        if (instant != null) {
            ps.setTimestamp(index, Timestamp.from(instant));
        } else {
            ps.setNull(index, Types.TIMESTAMP);
        }
    }

    static void setIntOrNull(PreparedStatement ps, int index, Integer value) throws SQLException {
        if (value != null) {
            ps.setInt(index, value);
        } else {
            ps.setNull(index, Types.INTEGER);
        }
    }

    static void setBooleanOrNull(PreparedStatement ps, int index, Boolean value) throws SQLException {
        if (value != null) {
            ps.setBoolean(index, value);
        } else {
            ps.setNull(index, Types.BOOLEAN);
        }
    }

    static Integer getIntOrNull(ResultSet rs, String column) throws SQLException {
        int value = rs.getInt(column);
        return rs.wasNull() ? null : value;
    }

    static Boolean getBooleanOrNull(ResultSet rs, String column) throws SQLException {
        boolean value = rs.getBoolean(column);
        return rs.wasNull() ? null : value;
    }
}
