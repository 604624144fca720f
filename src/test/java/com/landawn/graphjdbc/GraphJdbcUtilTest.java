package com.landawn.graphjdbc;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.concurrent.Executor;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

import org.junit.jupiter.api.Test;

import com.landawn.abacus.util.ContinuableFuture;

public class GraphJdbcUtilTest extends TestBase {

    @Test
    public void testSqlLogSwitches() {
        assertFalse(GraphJdbcUtil.isSqlLogEnabled());

        GraphJdbcUtil.enableSqlLog(10);
        GraphJdbcUtil.setMinExecutionTimeForSqlPerfLog(-1);

        assertTrue(GraphJdbcUtil.isSqlLogEnabled());
        assertEquals(-1L, GraphJdbcUtil.getMinExecutionTimeForSqlPerfLog());
        assertEquals("SELECT ...", GraphJdbcUtil.sqlLogSettings_TL.get().abbreviate("SELECT * FROM Person"));
        assertFalse(GraphJdbcUtil.sqlLogSettings_TL.get().isSlow(Long.MAX_VALUE));

        GraphJdbcUtil.disableSqlLog();

        assertFalse(GraphJdbcUtil.isSqlLogEnabled());
        assertEquals(-1L, GraphJdbcUtil.getMinExecutionTimeForSqlPerfLog());
    }

    @Test
    public void testSqlLogAware() throws Exception {
        ExecutorService pool = Executors.newSingleThreadExecutor();

        try {
            GraphJdbcUtil.enableSqlLog();
            GraphJdbcUtil.setMinExecutionTimeForSqlPerfLog(250);
            Executor executor = GraphJdbcUtil.sqlLogAware(pool);
            GraphJdbcUtil.disableSqlLog();

            assertTrue(ContinuableFuture.call(GraphJdbcUtil::isSqlLogEnabled, executor).get());
            assertEquals(250L, ContinuableFuture.call(GraphJdbcUtil::getMinExecutionTimeForSqlPerfLog, executor).get());

            // the pool thread keeps its own switches outside the task
            assertFalse(ContinuableFuture.call(GraphJdbcUtil::isSqlLogEnabled, pool).get());
            assertEquals(GraphJdbcUtil.DEFAULT_MIN_EXECUTION_TIME_FOR_SQL_PERF_LOG,
                    ContinuableFuture.call(GraphJdbcUtil::getMinExecutionTimeForSqlPerfLog, pool).get());
        } finally {
            pool.shutdown();
        }
    }
}
