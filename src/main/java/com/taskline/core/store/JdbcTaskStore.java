package com.taskline.core.store;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.taskline.core.error.StorageException;
import com.taskline.core.model.StepLog;
import com.taskline.core.model.Task;
import com.taskline.core.model.TaskFilter;
import com.taskline.core.model.TaskPriority;
import com.taskline.core.model.TaskStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.sql.Types;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * JDBC-based {@link TaskStore} that persists tasks to a relational table.
 * <p>
 * Scalar fields map to columns; the reasoning log and execution steps are
 * stored as JSON text. Upserts are an {@code UPDATE} followed by an
 * {@code INSERT} when no row matched, which works on PostgreSQL and any other
 * ANSI database.
 * <p>
 * The table {@code taskline_tasks} is created automatically via
 * {@link #createTables()}.
 */
public class JdbcTaskStore implements TaskStore {

    private static final Logger log = LoggerFactory.getLogger(JdbcTaskStore.class);

    static final String TABLE_NAME = "taskline_tasks";

    private static final String COLUMNS = """
            id, owner_id, agent_id, title, description, status, priority,
            confidence_score, reasoning_log, execution_steps, requires_review,
            reviewed_at, reviewed_by_id, review_notes, was_overridden,
            retry_count, first_attempt_at, last_retry_at, error_message, error_code,
            created_at, updated_at""";

    private static final String CREATE_TABLE_SQL = """
            CREATE TABLE IF NOT EXISTS %s (
                id               VARCHAR(64)  NOT NULL PRIMARY KEY,
                owner_id         VARCHAR(255) NOT NULL,
                agent_id         VARCHAR(255),
                title            VARCHAR(255) NOT NULL,
                description      TEXT,
                status           VARCHAR(32)  NOT NULL,
                priority         VARCHAR(32)  NOT NULL,
                confidence_score DOUBLE PRECISION,
                reasoning_log    TEXT,
                execution_steps  TEXT,
                requires_review  BOOLEAN      NOT NULL DEFAULT FALSE,
                reviewed_at      TIMESTAMP,
                reviewed_by_id   VARCHAR(255),
                review_notes     TEXT,
                was_overridden   BOOLEAN      NOT NULL DEFAULT FALSE,
                retry_count      INTEGER      NOT NULL DEFAULT 0,
                first_attempt_at TIMESTAMP,
                last_retry_at    TIMESTAMP,
                error_message    TEXT,
                error_code       VARCHAR(255),
                created_at       TIMESTAMP    NOT NULL,
                updated_at       TIMESTAMP    NOT NULL
            )
            """.formatted(TABLE_NAME);

    private static final String CREATE_OWNER_INDEX_SQL = """
            CREATE INDEX IF NOT EXISTS idx_%s_owner ON %s (owner_id)
            """.formatted(TABLE_NAME, TABLE_NAME);

    private static final String UPDATE_SQL = """
            UPDATE %s SET
                owner_id = ?, agent_id = ?, title = ?, description = ?, status = ?, priority = ?,
                confidence_score = ?, reasoning_log = ?, execution_steps = ?, requires_review = ?,
                reviewed_at = ?, reviewed_by_id = ?, review_notes = ?, was_overridden = ?,
                retry_count = ?, first_attempt_at = ?, last_retry_at = ?, error_message = ?, error_code = ?,
                created_at = ?, updated_at = ?
            WHERE id = ?
            """.formatted(TABLE_NAME);

    private static final String INSERT_SQL = """
            INSERT INTO %s (
                owner_id, agent_id, title, description, status, priority,
                confidence_score, reasoning_log, execution_steps, requires_review,
                reviewed_at, reviewed_by_id, review_notes, was_overridden,
                retry_count, first_attempt_at, last_retry_at, error_message, error_code,
                created_at, updated_at, id)
            VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?)
            """.formatted(TABLE_NAME);

    private static final String SELECT_BY_ID_SQL = """
            SELECT %s FROM %s WHERE id = ? AND owner_id = ?
            """.formatted(COLUMNS, TABLE_NAME);

    private static final String SELECT_UPDATED_AT_SQL = """
            SELECT updated_at FROM %s WHERE id = ?
            """.formatted(TABLE_NAME);

    private static final String DELETE_SQL = """
            DELETE FROM %s WHERE id = ? AND owner_id = ?
            """.formatted(TABLE_NAME);

    private static final String SELECT_BY_OWNER_SQL = """
            SELECT %s FROM %s WHERE owner_id = ?
            """.formatted(COLUMNS, TABLE_NAME);

    private final DataSource dataSource;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    public JdbcTaskStore(DataSource dataSource, ObjectMapper objectMapper, Clock clock) {
        this.dataSource = Objects.requireNonNull(dataSource, "DataSource must not be null");
        this.objectMapper = Objects.requireNonNull(objectMapper, "ObjectMapper must not be null");
        this.clock = Objects.requireNonNull(clock, "Clock must not be null");
    }

    /**
     * Creates the task table if it does not already exist.
     * Should be called once during application startup.
     */
    public void createTables() throws SQLException {
        try (Connection conn = dataSource.getConnection();
             PreparedStatement table = conn.prepareStatement(CREATE_TABLE_SQL);
             PreparedStatement index = conn.prepareStatement(CREATE_OWNER_INDEX_SQL)) {
            table.execute();
            index.execute();
            log.info("Task table '{}' ensured", TABLE_NAME);
        }
    }

    @Override
    public Optional<Task> get(String taskId, String ownerId) {
        try (Connection conn = dataSource.getConnection();
             PreparedStatement stmt = conn.prepareStatement(SELECT_BY_ID_SQL)) {
            stmt.setString(1, taskId);
            stmt.setString(2, ownerId);

            try (ResultSet rs = stmt.executeQuery()) {
                if (rs.next()) {
                    return Optional.of(fromResultSet(rs));
                }
            }
            return Optional.empty();
        } catch (SQLException e) {
            throw new StorageException("Failed to read task '" + taskId + "'", e);
        }
    }

    @Override
    public Task save(Task task) {
        try (Connection conn = dataSource.getConnection()) {
            Instant previous = currentUpdatedAt(conn, task.id());
            Task refreshed = task.touchedAt(clock.instant());
            if (previous != null && refreshed.updatedAt().isBefore(previous)) {
                refreshed = refreshed.toBuilder().updatedAt(previous).build();
            }

            int updated;
            try (PreparedStatement stmt = conn.prepareStatement(UPDATE_SQL)) {
                bind(stmt, refreshed);
                updated = stmt.executeUpdate();
            }
            if (updated == 0) {
                try (PreparedStatement stmt = conn.prepareStatement(INSERT_SQL)) {
                    bind(stmt, refreshed);
                    stmt.executeUpdate();
                }
            }
            log.debug("Saved task '{}' ({})", refreshed.id(), updated == 0 ? "inserted" : "updated");
            return refreshed;
        } catch (SQLException e) {
            throw new StorageException("Failed to save task '" + task.id() + "'", e);
        }
    }

    @Override
    public boolean delete(String taskId, String ownerId) {
        try (Connection conn = dataSource.getConnection();
             PreparedStatement stmt = conn.prepareStatement(DELETE_SQL)) {
            stmt.setString(1, taskId);
            stmt.setString(2, ownerId);
            int deleted = stmt.executeUpdate();
            log.debug("Deleted {} row(s) for task '{}'", deleted, taskId);
            return deleted > 0;
        } catch (SQLException e) {
            throw new StorageException("Failed to delete task '" + taskId + "'", e);
        }
    }

    @Override
    public List<Task> listByOwner(String ownerId, TaskFilter filter) {
        TaskFilter criteria = filter == null ? TaskFilter.none() : filter;
        StringBuilder sql = new StringBuilder(SELECT_BY_OWNER_SQL.strip());
        List<Object> params = new ArrayList<>();
        params.add(ownerId);
        if (criteria.status() != null) {
            sql.append(" AND status = ?");
            params.add(criteria.status().name());
        }
        if (criteria.priority() != null) {
            sql.append(" AND priority = ?");
            params.add(criteria.priority().name());
        }
        if (criteria.agentId() != null) {
            sql.append(" AND agent_id = ?");
            params.add(criteria.agentId());
        }
        if (criteria.requiresReview() != null) {
            sql.append(" AND requires_review = ?");
            params.add(criteria.requiresReview());
        }
        sql.append(" ORDER BY created_at DESC, id ASC");

        List<Task> tasks = new ArrayList<>();
        try (Connection conn = dataSource.getConnection();
             PreparedStatement stmt = conn.prepareStatement(sql.toString())) {
            for (int i = 0; i < params.size(); i++) {
                stmt.setObject(i + 1, params.get(i));
            }
            try (ResultSet rs = stmt.executeQuery()) {
                while (rs.next()) {
                    tasks.add(fromResultSet(rs));
                }
            }
        } catch (SQLException e) {
            throw new StorageException("Failed to list tasks for owner '" + ownerId + "'", e);
        }
        return tasks;
    }

    @Override
    public boolean isAvailable() {
        try (Connection conn = dataSource.getConnection()) {
            return conn.isValid(5);
        } catch (SQLException e) {
            log.warn("Task store connection check failed: {}", e.getMessage());
            return false;
        }
    }

    // ── Helpers ───────────────────────────────────────────────────────────

    private Instant currentUpdatedAt(Connection conn, String taskId) throws SQLException {
        try (PreparedStatement stmt = conn.prepareStatement(SELECT_UPDATED_AT_SQL)) {
            stmt.setString(1, taskId);
            try (ResultSet rs = stmt.executeQuery()) {
                return rs.next() ? toInstant(rs.getTimestamp("updated_at")) : null;
            }
        }
    }

    private void bind(PreparedStatement stmt, Task task) throws SQLException {
        stmt.setString(1, task.ownerId());
        stmt.setString(2, task.agentId());
        stmt.setString(3, task.title());
        stmt.setString(4, task.description());
        stmt.setString(5, task.status().name());
        stmt.setString(6, task.priority().name());
        if (task.confidenceScore() != null) {
            stmt.setDouble(7, task.confidenceScore());
        } else {
            stmt.setNull(7, Types.DOUBLE);
        }
        stmt.setString(8, serializeStepLog(task.reasoningLog()));
        stmt.setString(9, serializeStepLog(task.executionSteps()));
        stmt.setBoolean(10, task.requiresReview());
        stmt.setTimestamp(11, toTimestamp(task.reviewedAt()));
        stmt.setString(12, task.reviewedById());
        stmt.setString(13, task.reviewNotes());
        stmt.setBoolean(14, task.wasOverridden());
        stmt.setInt(15, task.retryCount());
        stmt.setTimestamp(16, toTimestamp(task.firstAttemptAt()));
        stmt.setTimestamp(17, toTimestamp(task.lastRetryAt()));
        stmt.setString(18, task.errorMessage());
        stmt.setString(19, task.errorCode());
        stmt.setTimestamp(20, toTimestamp(task.createdAt()));
        stmt.setTimestamp(21, toTimestamp(task.updatedAt()));
        stmt.setString(22, task.id());
    }

    private Task fromResultSet(ResultSet rs) throws SQLException {
        double confidence = rs.getDouble("confidence_score");
        Double confidenceScore = rs.wasNull() ? null : confidence;

        return Task.builder()
                .id(rs.getString("id"))
                .ownerId(rs.getString("owner_id"))
                .agentId(rs.getString("agent_id"))
                .title(rs.getString("title"))
                .description(rs.getString("description"))
                .status(TaskStatus.valueOf(rs.getString("status")))
                .priority(TaskPriority.valueOf(rs.getString("priority")))
                .confidenceScore(confidenceScore)
                .reasoningLog(deserializeStepLog(rs.getString("reasoning_log")))
                .executionSteps(deserializeStepLog(rs.getString("execution_steps")))
                .requiresReview(rs.getBoolean("requires_review"))
                .reviewedAt(toInstant(rs.getTimestamp("reviewed_at")))
                .reviewedById(rs.getString("reviewed_by_id"))
                .reviewNotes(rs.getString("review_notes"))
                .wasOverridden(rs.getBoolean("was_overridden"))
                .retryCount(rs.getInt("retry_count"))
                .firstAttemptAt(toInstant(rs.getTimestamp("first_attempt_at")))
                .lastRetryAt(toInstant(rs.getTimestamp("last_retry_at")))
                .errorMessage(rs.getString("error_message"))
                .errorCode(rs.getString("error_code"))
                .createdAt(toInstant(rs.getTimestamp("created_at")))
                .updatedAt(toInstant(rs.getTimestamp("updated_at")))
                .build();
    }

    private String serializeStepLog(StepLog stepLog) {
        if (stepLog == null) {
            return null;
        }
        try {
            return objectMapper.writeValueAsString(stepLog);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize step log", e);
        }
    }

    private StepLog deserializeStepLog(String json) {
        if (json == null || json.isBlank()) {
            return null;
        }
        try {
            return objectMapper.readValue(json, StepLog.class);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to deserialize step log", e);
        }
    }

    private static Timestamp toTimestamp(Instant instant) {
        return instant == null ? null : Timestamp.from(instant);
    }

    private static Instant toInstant(Timestamp timestamp) {
        return timestamp == null ? null : timestamp.toInstant();
    }
}
