package com.taskline.core.store;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.json.JsonMapper;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.taskline.core.error.ErrorCode;
import com.taskline.core.error.StorageException;
import com.taskline.core.model.StepLog;
import com.taskline.core.model.Task;
import com.taskline.core.model.TaskFilter;
import com.taskline.core.model.TaskPriority;
import com.taskline.core.model.TaskStatus;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.contains;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

/**
 * Tests for {@link JdbcTaskStore} against mocked JDBC objects.
 */
class JdbcTaskStoreTest {

    private static final Instant T0 = Instant.parse("2025-03-01T10:00:00Z");

    private DataSource dataSource;
    private Connection connection;
    private PreparedStatement statement;
    private ResultSet resultSet;
    private JdbcTaskStore store;

    @BeforeEach
    void setUp() throws SQLException {
        dataSource = mock(DataSource.class);
        connection = mock(Connection.class);
        statement = mock(PreparedStatement.class);
        resultSet = mock(ResultSet.class);
        when(dataSource.getConnection()).thenReturn(connection);
        when(connection.prepareStatement(anyString())).thenReturn(statement);
        when(statement.executeQuery()).thenReturn(resultSet);
        ObjectMapper mapper = JsonMapper.builder().addModule(new JavaTimeModule()).build();
        store = new JdbcTaskStore(dataSource, mapper, Clock.fixed(T0.plusSeconds(10), ZoneOffset.UTC));
    }

    private static Task task() {
        return Task.builder()
                .id("t1")
                .ownerId("alice")
                .title("Write report")
                .reasoningLog(StepLog.metadata(Map.of("model", "m-1")))
                .createdAt(T0)
                .updatedAt(T0)
                .build();
    }

    @Test
    @DisplayName("createTables creates the table and the owner index")
    void createTables() throws SQLException {
        store.createTables();

        verify(connection).prepareStatement(contains("CREATE TABLE IF NOT EXISTS taskline_tasks"));
        verify(connection).prepareStatement(contains("CREATE INDEX IF NOT EXISTS"));
        verify(statement, times(2)).execute();
    }

    @Nested
    @DisplayName("save")
    class SaveTests {

        @Test
        @DisplayName("inserts when no row was updated")
        void insertsNewRow() throws SQLException {
            when(resultSet.next()).thenReturn(false);
            when(statement.executeUpdate()).thenReturn(0, 1);

            Task saved = store.save(task());

            assertEquals(T0.plusSeconds(10), saved.updatedAt());
            verify(connection).prepareStatement(contains("UPDATE taskline_tasks SET"));
            verify(connection).prepareStatement(contains("INSERT INTO taskline_tasks"));
            // bound once for the UPDATE and once for the INSERT
            verify(statement, times(2)).setString(22, "t1");
            verify(statement, times(2)).setString(8, "{\"model\":\"m-1\"}");
        }

        @Test
        @DisplayName("updates an existing row without inserting")
        void updatesExistingRow() throws SQLException {
            when(resultSet.next()).thenReturn(true);
            when(resultSet.getTimestamp("updated_at")).thenReturn(Timestamp.from(T0));
            when(statement.executeUpdate()).thenReturn(1);

            store.save(task());

            verify(connection, never()).prepareStatement(contains("INSERT INTO"));
        }

        @Test
        @DisplayName("keeps a stored updatedAt that is ahead of the clock")
        void monotonicUpdatedAt() throws SQLException {
            Instant ahead = T0.plusSeconds(3600);
            when(resultSet.next()).thenReturn(true);
            when(resultSet.getTimestamp("updated_at")).thenReturn(Timestamp.from(ahead));
            when(statement.executeUpdate()).thenReturn(1);

            assertEquals(ahead, store.save(task()).updatedAt());
        }

        @Test
        @DisplayName("SQL failure becomes a StorageException")
        void sqlFailure() throws SQLException {
            when(dataSource.getConnection()).thenThrow(new SQLException("refused"));

            var ex = assertThrows(StorageException.class, () -> store.save(task()));
            assertInstanceOf(SQLException.class, ex.getCause());
        }
    }

    @Nested
    @DisplayName("reads")
    class ReadTests {

        @Test
        @DisplayName("get maps every column of the row")
        void getMapsRow() throws SQLException {
            when(resultSet.next()).thenReturn(true);
            when(resultSet.getString("id")).thenReturn("t1");
            when(resultSet.getString("owner_id")).thenReturn("alice");
            when(resultSet.getString("agent_id")).thenReturn("agent-a");
            when(resultSet.getString("title")).thenReturn("Write report");
            when(resultSet.getString("status")).thenReturn("REVIEW");
            when(resultSet.getString("priority")).thenReturn("HIGH");
            when(resultSet.getDouble("confidence_score")).thenReturn(0.4);
            when(resultSet.wasNull()).thenReturn(false);
            when(resultSet.getString("reasoning_log")).thenReturn("[{\"action\":\"plan\"}]");
            when(resultSet.getBoolean("requires_review")).thenReturn(true);
            when(resultSet.getInt("retry_count")).thenReturn(2);
            when(resultSet.getTimestamp("created_at")).thenReturn(Timestamp.from(T0));
            when(resultSet.getTimestamp("updated_at")).thenReturn(Timestamp.from(T0.plusSeconds(5)));

            Optional<Task> found = store.get("t1", "alice");

            assertTrue(found.isPresent());
            Task task = found.get();
            assertEquals("agent-a", task.agentId());
            assertEquals(TaskStatus.REVIEW, task.status());
            assertEquals(TaskPriority.HIGH, task.priority());
            assertEquals(0.4, task.confidenceScore());
            assertInstanceOf(StepLog.Steps.class, task.reasoningLog());
            assertNull(task.executionSteps());
            assertTrue(task.requiresReview());
            assertEquals(2, task.retryCount());
            assertEquals(T0.plusSeconds(5), task.updatedAt());
            verify(statement).setString(1, "t1");
            verify(statement).setString(2, "alice");
        }

        @Test
        @DisplayName("get returns empty when no row matches")
        void getMissing() throws SQLException {
            when(resultSet.next()).thenReturn(false);
            assertTrue(store.get("t1", "bob").isEmpty());
        }

        @Test
        @DisplayName("read failure carries FETCH_ERROR")
        void readFailure() throws SQLException {
            when(statement.executeQuery()).thenThrow(new SQLException("timeout"));

            var ex = assertThrows(StorageException.class, () -> store.get("t1", "alice"));
            assertEquals(ErrorCode.FETCH_ERROR, ex.code());
        }

        @Test
        @DisplayName("filters become parameterised conditions")
        void listWithFilter() throws SQLException {
            when(resultSet.next()).thenReturn(false);

            List<Task> tasks = store.listByOwner("alice",
                    new TaskFilter(TaskStatus.DONE, null, "agent-a", true));

            assertTrue(tasks.isEmpty());
            verify(connection).prepareStatement(contains("AND status = ? AND agent_id = ? AND requires_review = ?"));
            verify(statement).setObject(1, "alice");
            verify(statement).setObject(2, "DONE");
            verify(statement).setObject(3, "agent-a");
            verify(statement).setObject(4, true);
        }
    }

    @Test
    @DisplayName("delete reports whether a row was removed")
    void delete() throws SQLException {
        when(statement.executeUpdate()).thenReturn(1, 0);

        assertTrue(store.delete("t1", "alice"));
        assertFalse(store.delete("t1", "alice"));
    }

    @Test
    @DisplayName("isAvailable is false when no connection can be obtained")
    void availability() throws SQLException {
        when(connection.isValid(5)).thenReturn(true);
        assertTrue(store.isAvailable());

        when(dataSource.getConnection()).thenThrow(new SQLException("refused"));
        assertFalse(store.isAvailable());
    }
}
