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
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.List;

import javax.sql.DataSource;

import com.landawn.abacus.exception.DuplicatedResultException;
import com.landawn.abacus.exception.UncheckedSQLException;
import com.landawn.abacus.util.ContinuableFuture;
import com.landawn.abacus.util.N;
import com.landawn.abacus.util.u.Optional;
import com.landawn.abacus.util.stream.Stream;

/**
 * Where commands run: a {@code DataSource}, or a caller-managed {@code Connection}, plus a default timeout
 * and at most one active {@link GraphTransaction}.
 *
 * <p>Executors prepared from a {@code DataSource} context open a connection per execution and close it afterwards.
 * Executors prepared from a {@code Connection} context, or while a transaction is active, borrow the connection and leave it open.</p>
 *
 * <pre>{@code
 * final ExecutionContext context = ExecutionContext.of(dataSource).withTimeout(30);
 *
 * final List<Person> people = context.list("SELECT * FROM Person WHERE age > @age", N.asMap("age", 18), Person.class);
 * }</pre>
 */
public final class ExecutionContext {

    private final DataSource dataSource;

    private final Connection connection;

    private final int timeout;

    private volatile GraphTransaction transaction;

    private ExecutionContext(final DataSource dataSource, final Connection connection, final int timeout) {
        this.dataSource = dataSource;
        this.connection = connection;
        this.timeout = timeout;
    }

    public static ExecutionContext of(final DataSource dataSource) {
        N.checkArgNotNull(dataSource, "dataSource");

        return new ExecutionContext(dataSource, null, 0);
    }

    public static ExecutionContext of(final Connection connection) {
        N.checkArgNotNull(connection, "connection");

        return new ExecutionContext(null, connection, 0);
    }

    /**
     * @param timeoutInSeconds default query timeout for executors prepared from the returned context, 0 for none
     * @return a new context sharing the same data source or connection
     */
    public ExecutionContext withTimeout(final int timeoutInSeconds) {
        N.checkArgNotNegative(timeoutInSeconds, "timeoutInSeconds");

        return new ExecutionContext(dataSource, connection, timeoutInSeconds);
    }

    public DataSource dataSource() {
        return dataSource;
    }

    public int timeout() {
        return timeout;
    }

    /**
     * @return the active transaction, or {@code null}
     */
    public GraphTransaction currentTransaction() {
        final GraphTransaction tran = transaction;

        return tran != null && tran.isActive() ? tran : null;
    }

    /**
     * Starts a transaction. Executors prepared from this context use its connection until it is committed or rolled back.
     *
     * <p>The transaction belongs to this context, not to the calling thread. Work prepared from the same context on any
     * other thread, including the {@code *Async} operations and a {@code CrudService} sharing the context, joins the
     * transaction and runs on its single {@code Connection}, which is not safe for concurrent use. Give each thread that must
     * stay outside the transaction its own context, or don't share the context until the transaction ends.</p>
     *
     * @return the new transaction
     * @throws IllegalStateException if a transaction is already active
     */
    public synchronized GraphTransaction beginTransaction() {
        if (currentTransaction() != null) {
            throw new IllegalStateException("A transaction is already active on this context: " + transaction.id());
        }

        final boolean ownsConnection = connection == null;
        final Connection conn = ownsConnection ? GraphJdbcUtil.getConnection(dataSource) : connection;

        try {
            transaction = new GraphTransaction(this, dataSource, conn, ownsConnection);
        } catch (final SQLException e) {
            if (ownsConnection) {
                GraphJdbcUtil.releaseConnection(conn, dataSource);
            }

            throw new UncheckedSQLException(e);
        }

        return transaction;
    }

    synchronized void detach(final GraphTransaction tran) {
        if (transaction == tran) {
            transaction = null;
        }
    }

    /**
     * Acquires the connection for one execution.
     */
    ConnectionLease acquire() {
        final GraphTransaction tran = currentTransaction();

        if (tran != null) {
            return ConnectionLease.borrow(tran.connection());
        }

        if (connection != null) {
            try {
                if (connection.isClosed()) {
                    throw new IllegalStateException("The connection of this ExecutionContext is closed");
                }
            } catch (final SQLException e) {
                throw new UncheckedSQLException(e);
            }

            return ConnectionLease.borrow(connection);
        }

        return ConnectionLease.open(dataSource);
    }

    /**
     * Prepares a text command with {@code @name} placeholders.
     *
     * @param sql the command text
     * @return a new single-use executor
     */
    public QueryExecutor prepare(final String sql) {
        return prepare(sql, CommandType.TEXT);
    }

    public QueryExecutor prepare(final String commandText, final CommandType commandType) {
        return new QueryExecutor(this, commandText, commandType);
    }

    /**
     * Prepares a text command and binds every entry or property of {@code parameters}.
     *
     * @param sql the command text
     * @param parameters a {@code Map}, a bean, or {@code null}
     * @return a new single-use executor
     */
    public QueryExecutor prepare(final String sql, final Object parameters) {
        return prepare(sql).addParameters(parameters);
    }

    public <T> List<T> list(final String sql, final Object parameters, final Class<T> targetType) {
        final ResultMapper<T> mapper = ResultMapper.of(targetType);
        final List<T> result = new ArrayList<>();

        prepare(sql, parameters).execute(rs -> mapper.forEach(rs, result::add));

        return result;
    }

    public <T> Stream<T> stream(final String sql, final Object parameters, final Class<T> targetType) {
        return prepare(sql, parameters).stream(ResultMapper.of(targetType));
    }

    /**
     * @return the first row, or empty if there is none
     */
    public <T> Optional<T> findFirst(final String sql, final Object parameters, final Class<T> targetType) {
        final ResultMapper<T> mapper = ResultMapper.of(targetType);
        final Object[] holder = new Object[1];

        prepare(sql, parameters).execute(rs -> {
            if (rs.next()) {
                holder[0] = mapper.map(rs);
            }
        });

        @SuppressWarnings("unchecked")
        final T first = (T) holder[0];

        return first == null ? Optional.empty() : Optional.of(first);
    }

    /**
     * @return the only row, or empty if there is none
     * @throws DuplicatedResultException if there is more than one row
     */
    public <T> Optional<T> findOnlyOne(final String sql, final Object parameters, final Class<T> targetType) throws DuplicatedResultException {
        final ResultMapper<T> mapper = ResultMapper.of(targetType);
        final Object[] holder = new Object[1];

        prepare(sql, parameters).execute(rs -> {
            if (rs.next()) {
                holder[0] = mapper.map(rs);

                if (rs.next()) {
                    throw new DuplicatedResultException("There are at least two records found by query: " + sql);
                }
            }
        });

        @SuppressWarnings("unchecked")
        final T only = (T) holder[0];

        return only == null ? Optional.empty() : Optional.of(only);
    }

    public int executeNonQuery(final String sql, final Object parameters) {
        return prepare(sql, parameters).executeNonQuery();
    }

    public ContinuableFuture<Integer> executeNonQueryAsync(final String sql, final Object parameters) {
        return prepare(sql, parameters).executeNonQueryAsync();
    }

    public <T> T executeScalar(final String sql, final Object parameters, final Class<T> targetType) {
        return prepare(sql, parameters).executeScalar(targetType);
    }

    @Override
    public String toString() {
        return "ExecutionContext{dataSource=" + dataSource + ", connection=" + connection + ", timeout=" + timeout + ", transaction=" + transaction + "}";
    }
}
