/*
 * Copyright (c) 2025, Haiyang Li.
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 * https://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */
package com.landawn.graphjdbc;

import java.sql.Connection;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.concurrent.Executor;
import java.util.concurrent.TimeUnit;

import javax.sql.DataSource;

import com.landawn.abacus.exception.UncheckedSQLException;
import com.landawn.abacus.logging.Logger;
import com.landawn.abacus.logging.LoggerFactory;
import com.landawn.abacus.util.AsyncExecutor;
import com.landawn.abacus.util.ExceptionUtil;
import com.landawn.abacus.util.IOUtil;
import com.landawn.abacus.util.N;
import com.landawn.abacus.util.Strings;

/**
 * Static helpers shared by the executor, the transaction and the configuration classes:
 * connection acquisition and release, quiet closing, SQL logging and the executor that backs the
 * {@code *Async} operations.
 *
 * <p>SQL logging is switched per thread:</p>
 * <pre>{@code
 * GraphJdbcUtil.enableSqlLog();
 * GraphJdbcUtil.setMinExecutionTimeForSqlPerfLog(500);
 *
 * context.prepare("SELECT * FROM Person WHERE name = @name").addParameter("name", "Alice").execute(rs -> { ... });
 * }</pre>
 *
 * <p>The {@code *Async} operations submit through {@link #sqlLogAware(Executor)}, so a command run on a pool thread is
 * logged with the switches of the thread that submitted it.</p>
 */
public final class GraphJdbcUtil {

    static final Logger logger = LoggerFactory.getLogger(GraphJdbcUtil.class);

    static final Logger sqlLogger = LoggerFactory.getLogger("com.landawn.graphjdbc.SQL");

    public static final int DEFAULT_MAX_SQL_LOG_LENGTH = 1024;

    public static final long DEFAULT_MIN_EXECUTION_TIME_FOR_SQL_PERF_LOG = 1000L;

    static final AsyncExecutor asyncExecutor = new AsyncExecutor(//
            N.max(16, IOUtil.CPU_CORES * 4), // coreThreadPoolSize
            N.max(32, IOUtil.CPU_CORES * 8), // maxThreadPoolSize
            180L, TimeUnit.SECONDS);

    static final ThreadLocal<SqlLogSettings> sqlLogSettings_TL = ThreadLocal.withInitial(() -> SqlLogSettings.DEFAULT);

    private GraphJdbcUtil() {
        // utility class.
    }

    /**
     * @return the executor that runs {@code *Async} operations when no executor is given
     */
    public static Executor defaultAsyncExecutor() {
        return asyncExecutor.getExecutor();
    }

    /**
     * Creates a pooled HikariCP data source.
     *
     * @param url the JDBC URL
     * @param user the user name
     * @param password the password
     * @param minIdle minimum idle connections kept by the pool
     * @param maxPoolSize maximum connections in the pool
     * @return a new {@code DataSource}
     */
    public static DataSource createHikariDataSource(final String url, final String user, final String password, final int minIdle,
            final int maxPoolSize) {
        N.checkArgNotEmpty(url, "url");

        try {
            final com.zaxxer.hikari.HikariConfig config = new com.zaxxer.hikari.HikariConfig();
            config.setJdbcUrl(url);
            config.setUsername(user);
            config.setPassword(password);
            config.setMinimumIdle(minIdle);
            config.setMaximumPoolSize(maxPoolSize);

            return new com.zaxxer.hikari.HikariDataSource(config);
        } catch (final Exception e) {
            throw ExceptionUtil.toRuntimeException(e, true);
        }
    }

    /**
     * Gets a new connection from the specified data source.
     *
     * @param ds the data source
     * @return the connection
     * @throws UncheckedSQLException if the data source fails to hand out a connection
     */
    public static Connection getConnection(final DataSource ds) throws UncheckedSQLException {
        try {
            return ds.getConnection();
        } catch (final SQLException e) {
            throw new UncheckedSQLException(e);
        }
    }

    /**
     * Closes the connection, which returns it to the pool for pooled data sources.
     *
     * @param conn may be {@code null}
     * @param ds the data source the connection came from
     */
    public static void releaseConnection(final Connection conn, final DataSource ds) { //NOSONAR
        if (conn == null) {
            return;
        }

        closeQuietly(null, null, conn);
    }

    public static void closeQuietly(final ResultSet rs) {
        closeQuietly(rs, null, null);
    }

    public static void closeQuietly(final Statement stmt) {
        closeQuietly(null, stmt, null);
    }

    public static void closeQuietly(final ResultSet rs, final Statement stmt, final Connection conn) {
        if (rs != null) {
            try {
                rs.close();
            } catch (final Exception e) {
                logger.error("Failed to close ResultSet", e);
            }
        }

        if (stmt != null) {
            try {
                stmt.close();
            } catch (final Exception e) {
                logger.error("Failed to close Statement", e);
            }
        }

        if (conn != null) {
            try {
                conn.close();
            } catch (final Exception e) {
                logger.error("Failed to close Connection", e);
            }
        }
    }

    /**
     * Enables {@code [SQL]} debug logging for the current thread.
     */
    public static void enableSqlLog() {
        enableSqlLog(DEFAULT_MAX_SQL_LOG_LENGTH);
    }

    public static void enableSqlLog(final int maxSqlLogLength) {
        final SqlLogSettings settings = sqlLogSettings_TL.get();

        if (logger.isDebugEnabled() && !settings.sqlLogEnabled) {
            logger.debug("Turning on SQL log");
        }

        sqlLogSettings_TL.set(settings.withSqlLog(true, maxSqlLogLength));
    }

    public static void disableSqlLog() {
        final SqlLogSettings settings = sqlLogSettings_TL.get();

        if (logger.isDebugEnabled() && settings.sqlLogEnabled) {
            logger.debug("Turning off SQL log");
        }

        sqlLogSettings_TL.set(settings.withSqlLog(false, settings.maxSqlLogLength));
    }

    public static boolean isSqlLogEnabled() {
        return sqlLogSettings_TL.get().sqlLogEnabled;
    }

    /**
     * Sets the elapsed time, in milliseconds, from which a statement is logged as {@code [SQL-PERF]} on the current thread.
     * A negative value turns the perf log off.
     *
     * @param minExecutionTimeForSqlPerfLog threshold in milliseconds
     */
    public static void setMinExecutionTimeForSqlPerfLog(final long minExecutionTimeForSqlPerfLog) {
        setMinExecutionTimeForSqlPerfLog(minExecutionTimeForSqlPerfLog, DEFAULT_MAX_SQL_LOG_LENGTH);
    }

    public static void setMinExecutionTimeForSqlPerfLog(final long minExecutionTimeForSqlPerfLog, final int maxSqlLogLength) {
        final SqlLogSettings settings = sqlLogSettings_TL.get();

        if (logger.isDebugEnabled() && settings.minExecutionTimeForSqlPerfLog != minExecutionTimeForSqlPerfLog) {
            logger.debug("set 'minExecutionTimeForSqlPerfLog' to: " + minExecutionTimeForSqlPerfLog);
        }

        sqlLogSettings_TL.set(settings.withPerfLog(minExecutionTimeForSqlPerfLog, maxSqlLogLength));
    }

    public static long getMinExecutionTimeForSqlPerfLog() {
        return sqlLogSettings_TL.get().minExecutionTimeForSqlPerfLog;
    }

    /**
     * Wraps {@code executor} so that each task runs with the SQL log switches the calling thread has now.
     * The worker thread gets its own switches back when the task ends.
     *
     * @param executor the executor to wrap
     * @return an executor that carries the caller's SQL log switches
     */
    public static Executor sqlLogAware(final Executor executor) {
        N.checkArgNotNull(executor, "executor");

        final SqlLogSettings callerSettings = sqlLogSettings_TL.get();

        return command -> executor.execute(() -> {
            final SqlLogSettings workerSettings = sqlLogSettings_TL.get();
            sqlLogSettings_TL.set(callerSettings);

            try {
                command.run();
            } finally {
                sqlLogSettings_TL.set(workerSettings);
            }
        });
    }

    static void logSql(final String sql) {
        final SqlLogSettings settings = sqlLogSettings_TL.get();

        if (settings.sqlLogEnabled && sqlLogger.isDebugEnabled()) {
            sqlLogger.debug(Strings.concat("[SQL]: ", settings.abbreviate(sql)));
        }
    }

    static void handleSqlLog(final String sql, final long startTime) {
        final SqlLogSettings settings = sqlLogSettings_TL.get();
        final long elapsedTime = System.currentTimeMillis() - startTime;

        if (settings.isSlow(elapsedTime) && sqlLogger.isInfoEnabled()) {
            sqlLogger.info(Strings.concat("[SQL-PERF]: ", String.valueOf(elapsedTime), ", ", settings.abbreviate(sql)));
        }
    }
}
