package org.cronpulse.jobs;

import org.cronpulse.errors.StoreException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.List;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class JdbcJobStoreTest {

    private static final Instant NOW = Instant.parse("2024-05-01T10:30:00Z");

    @Mock
    private Connection connection;
    @Mock
    private PreparedStatement statement;
    @Mock
    private ResultSet resultSet;

    private JdbcJobStore store;

    @BeforeEach
    void setUp() {
        store = new JdbcJobStore(() -> connection);
    }

    @Test
    void fetchDue_shouldBindNowTwiceAndLimit() throws SQLException {
        when(connection.prepareStatement(JdbcJobStore.FETCH_DUE_SQL)).thenReturn(statement);
        when(statement.executeQuery()).thenReturn(resultSet);
        when(resultSet.next()).thenReturn(false);

        List<ScheduledJob> due = store.fetchDue(NOW, 25);

        assertTrue(due.isEmpty());
        OffsetDateTime bound = OffsetDateTime.ofInstant(NOW, ZoneOffset.UTC);
        verify(statement).setObject(1, bound);
        verify(statement).setObject(2, bound);
        verify(statement).setInt(3, 25);
        verify(connection).close();
    }

    @Test
    void fetchDue_shouldWrapSqlFailure() throws SQLException {
        when(connection.prepareStatement(JdbcJobStore.FETCH_DUE_SQL)).thenThrow(new SQLException("connection reset"));

        StoreException e = assertThrows(StoreException.class, () -> store.fetchDue(NOW, 10));
        assertTrue(e.getCause() instanceof SQLException);
    }

    @Test
    void recordSuccess_shouldClearBackoffInOneStatement() throws SQLException {
        UUID id = UUID.randomUUID();
        when(connection.prepareStatement(JdbcJobStore.RECORD_SUCCESS_SQL)).thenReturn(statement);
        when(statement.executeUpdate()).thenReturn(1);

        assertTrue(store.recordSuccess(id, NOW, NOW.plusSeconds(1800)));

        assertTrue(JdbcJobStore.RECORD_SUCCESS_SQL.contains("error_count = 0, backoff_until = NULL"));
        verify(statement).setObject(1, OffsetDateTime.ofInstant(NOW, ZoneOffset.UTC));
        verify(statement).setObject(2, OffsetDateTime.ofInstant(NOW.plusSeconds(1800), ZoneOffset.UTC));
        verify(statement).setObject(3, id);
    }

    @Test
    void recordFailure_shouldReturnFalseWhenNoRowMatched() throws SQLException {
        UUID id = UUID.randomUUID();
        when(connection.prepareStatement(JdbcJobStore.RECORD_FAILURE_SQL)).thenReturn(statement);
        when(statement.executeUpdate()).thenReturn(0);

        assertFalse(store.recordFailure(id, 2, NOW.plusSeconds(60), NOW));

        verify(statement).setInt(1, 2);
        verify(statement).setObject(4, id);
    }

    @Test
    void outcomeStatements_shouldIgnoreDeletedRows() {
        assertTrue(JdbcJobStore.RECORD_SUCCESS_SQL.contains("deleted_at IS NULL"));
        assertTrue(JdbcJobStore.RECORD_FAILURE_SQL.contains("deleted_at IS NULL"));
        assertTrue(JdbcJobStore.FETCH_DUE_SQL.contains("deleted_at IS NULL"));
        assertEquals(-1, JdbcJobStore.FETCH_DUE_SQL.indexOf("FOR UPDATE"));
    }
}
