package com.landawn.graphjdbc;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.SQLException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

import javax.sql.DataSource;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.Mock;
import org.mockito.MockitoAnnotations;

import com.landawn.abacus.exception.UncheckedSQLException;

public class GraphTransactionTest extends TestBase {

    @Mock
    private DataSource dataSource;

    @Mock
    private Connection connection;

    @Mock
    private PreparedStatement stmt;

    private ExecutionContext context;

    @BeforeEach
    public void setUp() throws SQLException {
        MockitoAnnotations.openMocks(this);
        when(dataSource.getConnection()).thenReturn(connection);
        when(connection.getAutoCommit()).thenReturn(true);
        when(connection.prepareStatement(anyString())).thenReturn(stmt);

        context = ExecutionContext.of(dataSource);
    }

    @Test
    public void testBegin() throws SQLException {
        GraphTransaction tran = context.beginTransaction();

        assertNotNull(tran.id());
        assertSame(connection, tran.connection());
        assertEquals(GraphTransaction.Status.ACTIVE, tran.status());
        assertSame(tran, context.currentTransaction());
        verify(connection).setAutoCommit(false);
    }

    @Test
    public void testCommit() throws SQLException {
        GraphTransaction tran = context.beginTransaction();

        context.prepare("DELETE FROM Person").executeNonQuery();
        context.prepare("DELETE FROM FriendOf").executeNonQuery();

        verify(connection, never()).close();

        tran.commit();

        assertEquals(GraphTransaction.Status.COMMITTED, tran.status());
        assertFalse(tran.isActive());
        assertNull(context.currentTransaction());
        verify(dataSource, times(1)).getConnection();
        verify(connection).commit();
        verify(connection).setAutoCommit(true);
        verify(connection).close();
    }

    @Test
    public void testCommitFailure() throws SQLException {
        GraphTransaction tran = context.beginTransaction();
        doThrow(new SQLException("Commit failed")).when(connection).commit();

        assertThrows(UncheckedSQLException.class, tran::commit);
        assertEquals(GraphTransaction.Status.ROLLED_BACK, tran.status());
        verify(connection).rollback();
        verify(connection).close();
    }

    @Test
    public void testCloseRollsBack() throws SQLException {
        try (GraphTransaction tran = context.beginTransaction()) {
            context.prepare("DELETE FROM Person").executeNonQuery();
        }

        verify(connection).rollback();
        verify(connection).close();
        assertNull(context.currentTransaction());
    }

    @Test
    public void testCloseAfterCommit() throws SQLException {
        try (GraphTransaction tran = context.beginTransaction()) {
            tran.commit();
        }

        verify(connection, never()).rollback();
    }

    @Test
    public void testRollbackTwice() {
        GraphTransaction tran = context.beginTransaction();
        tran.rollback();

        assertThrows(IllegalStateException.class, tran::rollback);
        assertThrows(IllegalStateException.class, tran::commit);
    }

    @Test
    public void testOtherThreadJoinsTransaction() throws Exception {
        when(stmt.executeUpdate()).thenReturn(1);
        ExecutorService pool = Executors.newSingleThreadExecutor();

        try {
            GraphTransaction tran = context.beginTransaction();

            assertEquals(1, context.prepare("DELETE FROM Person WHERE id = @id").addParameter("id", 1).executeNonQueryAsync(pool).get());
            assertSame(tran, context.currentTransaction());

            // one connection, borrowed by the pool thread and left open
            verify(dataSource, times(1)).getConnection();
            verify(connection, never()).close();

            tran.rollback();
            verify(connection).rollback();
        } finally {
            pool.shutdown();
        }
    }

    @Test
    public void testOnlyOneActive() {
        context.beginTransaction();

        assertThrows(IllegalStateException.class, context::beginTransaction);
    }

    @Test
    public void testConnectionContextKeepsConnection() throws SQLException {
        ExecutionContext connContext = ExecutionContext.of(connection);
        GraphTransaction tran = connContext.beginTransaction();

        tran.commit();

        assertTrue(tran.status() == GraphTransaction.Status.COMMITTED);
        verify(connection).setAutoCommit(true);
        verify(connection, never()).close();
    }
}
