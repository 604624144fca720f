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

import java.sql.CallableStatement;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;
import java.util.NoSuchElementException;
import java.util.Set;
import java.util.TreeMap;
import java.util.concurrent.CancellationException;
import java.util.concurrent.Executor;
import java.util.concurrent.atomic.AtomicBoolean;

import com.landawn.abacus.exception.UncheckedSQLException;
import com.landawn.abacus.logging.Logger;
import com.landawn.abacus.logging.LoggerFactory;
import com.landawn.abacus.util.ContinuableFuture;
import com.landawn.abacus.util.N;
import com.landawn.abacus.util.ObjIterator;
import com.landawn.abacus.util.Throwables;
import com.landawn.abacus.util.stream.Stream;

/**
 * Runs exactly one command: a SQL text with {@code @name} placeholders, or a stored procedure.
 * Parameters are added fluently, then one of the {@code execute*} or {@code stream} methods is called once.
 * A second execution attempt throws {@code IllegalStateException}.
 *
 * <p>The connection comes from the {@link ExecutionContext}. If the executor opened it, the executor closes it when the
 * execution ends, whatever the outcome. A connection borrowed from a transaction or from a caller is left open.</p>
 *
 * <pre>{@code
 * final OutParameter<Integer> count = OutParameter.of(Integer.class);
 *
 * context.prepare("usp_FriendsOf", CommandType.STORED_PROCEDURE)
 *         .addParameter("name", "Alice")
 *         .addOutParameter("count", count)
 *         .execute(rs -> ResultMapper.of(Person.class).forEach(rs, friends::add));
 *
 * count.getValue();
 * }</pre>
 *
 * <p>{@link #executeAsync(Throwables.Consumer, CancellationToken)} and {@link #stream(Throwables.Function, CancellationToken)}
 * cancel the running statement before the cursor is closed when the consumer fails or cancellation is requested, so
 * closing the cursor doesn't wait for the server to finish sending rows.</p>
 */
public final class QueryExecutor {

    private static final Logger logger = LoggerFactory.getLogger(QueryExecutor.class);

    static final String RETURN_VALUE_NAME = "RETURN_VALUE";

    private final ExecutionContext context;

    private final String commandText;

    private final CommandType commandType;

    private final List<QueryParameter> parameters = new ArrayList<>();

    private final Map<QueryParameter, OutParameter<?>> handles = new IdentityHashMap<>();

    private QueryParameter returnValue;

    private int timeout;

    private boolean isExecuted = false;

    private String jdbcSql;

    private List<QueryParameter> slots;

    private boolean isCallable;

    QueryExecutor(final ExecutionContext context, final String commandText, final CommandType commandType) {
        N.checkArgNotNull(context, "context");
        N.checkArgNotEmpty(commandText, "commandText");
        N.checkArgNotNull(commandType, "commandType");

        this.context = context;
        this.commandText = commandText;
        this.commandType = commandType;
        timeout = context.timeout();
    }

    public String commandText() {
        return commandText;
    }

    public CommandType commandType() {
        return commandType;
    }

    /**
     * @return the bound parameters, in the order they were added. Output values are filled in once execution completes.
     */
    public List<QueryParameter> parameters() {
        return Collections.unmodifiableList(parameters);
    }

    /**
     * Adds an input parameter typed by the runtime class of {@code value}.
     *
     * @param name the name, with or without the leading {@code @}
     * @param value may be {@code null}
     * @return this
     */
    public QueryExecutor addParameter(final String name, final Object value) {
        return addRawParameter(ParameterBinder.toParameter(checkName(name), value, value == null ? null : value.getClass()));
    }

    public QueryExecutor addParameter(final String name, final Object value, final DbType dbType) {
        N.checkArgNotNull(dbType, "dbType");

        return addRawParameter(QueryParameter.input(checkName(name), value, dbType, true));
    }

    /**
     * Adds a parameter with an explicit direction. Use {@link #parameters()} to read the value the backend writes back,
     * or prefer {@link #addOutParameter(String, OutParameter)} for a typed handle.
     *
     * @param name the name
     * @param value the input value, ignored for {@link ParameterDirection#OUTPUT}
     * @param direction the direction
     * @param size declared size, 0 for the driver default
     * @param precision declared precision, 0 for the driver default
     * @param scale declared scale, 0 for the driver default
     * @return this
     */
    public QueryExecutor addParameter(final String name, final Object value, final ParameterDirection direction, final int size, final int precision,
            final int scale) {
        N.checkArgNotNull(direction, "direction");

        final QueryParameter parameter = ParameterBinder.toParameter(checkName(name), value, value == null ? null : value.getClass());
        parameter.setDirection(direction);
        parameter.setSize(size);
        parameter.setPrecision(precision);
        parameter.setScale(scale);

        return addRawParameter(parameter);
    }

    /**
     * Adds every entry or property of {@code source} as an input parameter.
     *
     * @param source a {@code Map}, a bean, or {@code null} for none
     * @return this
     * @see ParameterBinder#bind(Object)
     */
    public QueryExecutor addParameters(final Object source) {
        for (final QueryParameter parameter : ParameterBinder.bind(source)) {
            addRawParameter(parameter);
        }

        return this;
    }

    public QueryExecutor addRawParameter(final QueryParameter parameter) {
        assertNotExecuted();
        N.checkArgNotNull(parameter, "parameter");
        N.checkArgNotNull(parameter.getDirection(), "parameter.direction");

        parameter.setName(checkName(parameter.getName()));

        if (parameter.getDbType() == null) {
            parameter.setDbType(DbType.STRING);
        }

        for (final QueryParameter existing : parameters) {
            if (existing.getName().equalsIgnoreCase(parameter.getName())) {
                throw new IllegalArgumentException("Duplicated parameter: " + parameter.getName());
            }
        }

        if (parameter.getDirection() == ParameterDirection.RETURN_VALUE) {
            N.checkArgument(commandType == CommandType.STORED_PROCEDURE, "A return value parameter can only be added to a stored procedure call");
            N.checkArgument(returnValue == null, "A return value parameter has already been added");

            returnValue = parameter;
        }

        parameters.add(parameter);

        return this;
    }

    public <T> QueryExecutor addOutParameter(final String name, final OutParameter<T> handle) {
        N.checkArgNotNull(handle, "handle");

        return addHandle(QueryParameter.of(checkName(name), null, ParameterDirection.OUTPUT, handle.dbType(), 0, 0, 0), handle);
    }

    public <T> QueryExecutor addInOutParameter(final String name, final Object value, final OutParameter<T> handle) {
        N.checkArgNotNull(handle, "handle");

        return addHandle(QueryParameter.of(checkName(name), value, ParameterDirection.INPUT_OUTPUT, handle.dbType(), 0, 0, 0), handle);
    }

    /**
     * Binds the stored procedure's return value to {@code handle}.
     *
     * @param <T> the value type
     * @param handle the handle to fill
     * @return this
     */
    public <T> QueryExecutor addReturnValue(final OutParameter<T> handle) {
        N.checkArgNotNull(handle, "handle");

        return addHandle(QueryParameter.of(RETURN_VALUE_NAME, null, ParameterDirection.RETURN_VALUE, handle.dbType(), 0, 0, 0), handle);
    }

    private QueryExecutor addHandle(final QueryParameter parameter, final OutParameter<?> handle) {
        assertNotExecuted();

        handle.attach(parameter);
        addRawParameter(parameter);
        handles.put(parameter, handle);

        return this;
    }

    /**
     * @param seconds the query timeout, 0 for none
     * @return this
     */
    public QueryExecutor setTimeout(final int seconds) {
        assertNotExecuted();
        N.checkArgNotNegative(seconds, "seconds");

        timeout = seconds;

        return this;
    }

    /**
     * Executes the command and passes the first result set, if any, to {@code callback}.
     * The result set, the statement and an owned connection are closed when this method returns.
     *
     * @param callback reads the rows
     * @throws UncheckedSQLException if the execution or the callback fails with a {@code SQLException}
     */
    public void execute(final Throwables.Consumer<ResultSet, SQLException> callback) throws UncheckedSQLException {
        N.checkArgNotNull(callback, "callback");

        prepareExecution();

        run(stmt -> {
            final ResultSet rs = executeForResultSet(stmt);

            try {
                if (rs != null) {
                    callback.accept(rs);
                } else if (logger.isDebugEnabled()) {
                    logger.debug("No result set returned by: {}", commandText);
                }
            } finally {
                GraphJdbcUtil.closeQuietly(rs);
            }

            return null;
        });
    }

    public ContinuableFuture<Void> executeAsync(final Throwables.Consumer<ResultSet, ? extends Exception> callback, final CancellationToken token) {
        return executeAsync(callback, token, GraphJdbcUtil.defaultAsyncExecutor());
    }

    /**
     * Executes the command on {@code executor} and passes the first result set to {@code callback}.
     *
     * <p>If {@code callback} fails, or {@code token} is cancelled while the command runs, the statement is cancelled before the
     * result set is closed. The returned future then fails with the callback's exception, or with a
     * {@code CancellationException} when cancellation was requested.</p>
     *
     * @param callback reads the rows
     * @param token cancels the execution
     * @param executor runs the execution
     * @return a future completed after all resources are released
     */
    public ContinuableFuture<Void> executeAsync(final Throwables.Consumer<ResultSet, ? extends Exception> callback, final CancellationToken token,
            final Executor executor) {
        N.checkArgNotNull(callback, "callback");
        N.checkArgNotNull(token, "token");
        N.checkArgNotNull(executor, "executor");

        prepareExecution();

        return ContinuableFuture.run(() -> runCancellable(callback, token), GraphJdbcUtil.sqlLogAware(executor));
    }

    /**
     * Streams the rows of the first result set, mapped by {@code mapper}.
     *
     * @param <T> the record type
     * @param mapper the row mapper
     * @return a lazy, single-use stream. Close it if it isn't consumed to the end.
     */
    public <T> Stream<T> stream(final ResultMapper<T> mapper) {
        return stream(mapper, CancellationToken.NONE);
    }

    public <T> Stream<T> stream(final ResultMapper<T> mapper, final CancellationToken token) {
        N.checkArgNotNull(mapper, "mapper");

        return stream(mapper.toRowMapper(), token);
    }

    /**
     * Streams the rows of the first result set. Nothing is sent to the server until the first element is pulled.
     * {@code token} is checked before every fetch. The statement is cancelled before the cursor is closed when a fetch fails,
     * when cancellation is observed, and when the stream is closed before it is exhausted.
     *
     * @param <T> the element type
     * @param rowMapper maps the current row
     * @param token cancels the stream
     * @return a lazy, single-use stream
     */
    public <T> Stream<T> stream(final Throwables.Function<ResultSet, ? extends T, SQLException> rowMapper, final CancellationToken token) {
        N.checkArgNotNull(rowMapper, "rowMapper");
        N.checkArgNotNull(token, "token");

        prepareExecution();

        final RowIterator<T> iter = new RowIterator<>(rowMapper, token);

        return Stream.of(iter).onClose(iter::close);
    }

    /**
     * @return the affected row count
     */
    public int executeNonQuery() throws UncheckedSQLException {
        prepareExecution();

        return run(PreparedStatement::executeUpdate);
    }

    public ContinuableFuture<Integer> executeNonQueryAsync() {
        return executeNonQueryAsync(GraphJdbcUtil.defaultAsyncExecutor());
    }

    public ContinuableFuture<Integer> executeNonQueryAsync(final Executor executor) {
        N.checkArgNotNull(executor, "executor");

        prepareExecution();

        return ContinuableFuture.call(() -> run(PreparedStatement::executeUpdate), GraphJdbcUtil.sqlLogAware(executor));
    }

    /**
     * Returns the first column of the first row.
     *
     * @param <T> the result type
     * @param targetType the result type. Primitive types are allowed.
     * @return the converted value, or the default value of {@code targetType} (e.g. {@code 0} for {@code int.class})
     *         when there is no row or the value is SQL NULL
     */
    public <T> T executeScalar(final Class<T> targetType) throws UncheckedSQLException {
        N.checkArgNotNull(targetType, "targetType");

        prepareExecution();

        return run(stmt -> readScalar(stmt, targetType));
    }

    public <T> ContinuableFuture<T> executeScalarAsync(final Class<T> targetType) {
        return executeScalarAsync(targetType, GraphJdbcUtil.defaultAsyncExecutor());
    }

    public <T> ContinuableFuture<T> executeScalarAsync(final Class<T> targetType, final Executor executor) {
        N.checkArgNotNull(targetType, "targetType");
        N.checkArgNotNull(executor, "executor");

        prepareExecution();

        return ContinuableFuture.call(() -> run(stmt -> readScalar(stmt, targetType)), GraphJdbcUtil.sqlLogAware(executor));
    }

    private <T> T readScalar(final PreparedStatement stmt, final Class<T> targetType) throws SQLException {
        final ResultSet rs = executeForResultSet(stmt);

        try {
            final Object value = rs != null && rs.next() ? rs.getObject(1) : null;

            return value == null ? N.defaultValueOf(targetType) : N.convert(value, targetType);
        } finally {
            GraphJdbcUtil.closeQuietly(rs);
        }
    }

    private <R> R run(final Throwables.Function<PreparedStatement, R, SQLException> action) throws UncheckedSQLException {
        final ConnectionLease lease = context.acquire();
        PreparedStatement stmt = null;

        try {
            stmt = createStatement(lease.connection());

            final long startTime = System.currentTimeMillis();
            final R result = action.apply(stmt);

            populateOutParameters(stmt);
            GraphJdbcUtil.handleSqlLog(jdbcSql, startTime);

            return result;
        } catch (final SQLException e) {
            throw new UncheckedSQLException(e);
        } finally {
            GraphJdbcUtil.closeQuietly(stmt);
            lease.close();
        }
    }

    private void runCancellable(final Throwables.Consumer<ResultSet, ? extends Exception> callback, final CancellationToken token) throws Exception {
        token.throwIfCancellationRequested();

        final AtomicBoolean statementCancelled = new AtomicBoolean();
        final ConnectionLease lease = context.acquire();
        CancellationToken.Registration registration = CancellationToken.Registration.EMPTY;
        PreparedStatement stmt = null;
        ResultSet rs = null;

        try {
            stmt = createStatement(lease.connection());

            final PreparedStatement toCancel = stmt;
            registration = token.onCancel(() -> cancelStatement(toCancel, statementCancelled, null));

            final long startTime = System.currentTimeMillis();

            rs = executeForResultSet(stmt);
            token.throwIfCancellationRequested();

            if (rs != null) {
                callback.accept(rs);
            }

            token.throwIfCancellationRequested();

            GraphJdbcUtil.closeQuietly(rs);
            rs = null;

            populateOutParameters(stmt);
            GraphJdbcUtil.handleSqlLog(jdbcSql, startTime);
        } catch (final Exception e) {
            final Exception failure = token.isCancellationRequested() ? toCancellation(e) : e;

            if (stmt != null) {
                cancelStatement(stmt, statementCancelled, failure);
            }

            throw failure instanceof SQLException ? new UncheckedSQLException((SQLException) failure) : failure;
        } finally {
            registration.close();
            GraphJdbcUtil.closeQuietly(rs, stmt, null);
            lease.close();
        }
    }

    private void prepareExecution() {
        assertNotExecuted();

        isExecuted = true;

        if (commandType == CommandType.STORED_PROCEDURE) {
            slots = new ArrayList<>(parameters.size());

            if (returnValue != null) {
                slots.add(returnValue);
            }

            for (final QueryParameter parameter : parameters) {
                if (parameter != returnValue) {
                    slots.add(parameter);
                }
            }

            final StringBuilder sb = new StringBuilder("{");

            if (returnValue != null) {
                sb.append("? = ");
            }

            sb.append("call ").append(commandText).append('(');

            for (int i = 0, n = slots.size() - (returnValue == null ? 0 : 1); i < n; i++) {
                sb.append(i == 0 ? "?" : ", ?");
            }

            jdbcSql = sb.append(")}").toString();
            isCallable = true;
        } else {
            final NamedSql namedSql = NamedSql.parse(commandText);
            final Map<String, QueryParameter> parameterMap = new TreeMap<>(String.CASE_INSENSITIVE_ORDER);

            for (final QueryParameter parameter : parameters) {
                parameterMap.put(parameter.getName(), parameter);
            }

            slots = new ArrayList<>(namedSql.parameterCount());

            for (final String name : namedSql.parameterNames()) {
                final QueryParameter parameter = parameterMap.get(name);

                if (parameter == null) {
                    throw new IllegalArgumentException("No parameter bound for '@" + name + "' in: " + commandText);
                }

                slots.add(parameter);
                isCallable |= parameter.getDirection().isOutput();
            }

            jdbcSql = namedSql.parameterizedSql();
        }
    }

    private PreparedStatement createStatement(final Connection conn) throws SQLException {
        GraphJdbcUtil.logSql(jdbcSql);

        final PreparedStatement stmt = isCallable ? conn.prepareCall(jdbcSql) : conn.prepareStatement(jdbcSql);

        try {
            for (int i = 0, n = slots.size(); i < n; i++) {
                final QueryParameter parameter = slots.get(i);

                if (parameter.getDirection().isInput()) {
                    parameter.getDbType().bind(stmt, i + 1, parameter.getValue());
                }

                if (parameter.getDirection().isOutput()) {
                    parameter.getDbType().registerOut((CallableStatement) stmt, i + 1, parameter.getScale());
                }
            }

            if (timeout > 0) {
                stmt.setQueryTimeout(timeout);
            }
        } catch (SQLException | RuntimeException e) {
            GraphJdbcUtil.closeQuietly(stmt);
            throw e;
        }

        return stmt;
    }

    private static ResultSet executeForResultSet(final PreparedStatement stmt) throws SQLException {
        boolean isResultSet = stmt.execute();

        while (true) {
            if (isResultSet) {
                return stmt.getResultSet();
            } else if (stmt.getUpdateCount() == -1) {
                return null;
            }

            isResultSet = stmt.getMoreResults();
        }
    }

    private void populateOutParameters(final PreparedStatement stmt) throws SQLException {
        if (isCallable) {
            final CallableStatement cstmt = (CallableStatement) stmt;
            final Set<QueryParameter> populated = Collections.newSetFromMap(new IdentityHashMap<>());

            for (int i = 0, n = slots.size(); i < n; i++) {
                final QueryParameter parameter = slots.get(i);

                if (parameter.getDirection().isOutput() && populated.add(parameter)) {
                    final Object value = cstmt.getObject(i + 1);
                    parameter.setValue(cstmt.wasNull() ? null : value);
                }
            }
        }

        for (final OutParameter<?> handle : handles.values()) {
            handle.complete();
        }
    }

    private static void cancelStatement(final PreparedStatement stmt, final AtomicBoolean statementCancelled, final Exception failure) {
        if (!statementCancelled.compareAndSet(false, true)) {
            return;
        }

        try {
            stmt.cancel();
        } catch (final SQLException e) {
            if (failure != null) {
                failure.addSuppressed(e);
            } else {
                logger.warn("Failed to cancel statement", e);
            }
        }
    }

    private static Exception toCancellation(final Exception e) {
        if (e instanceof CancellationException) {
            return e;
        }

        final CancellationException ce = new CancellationException("Operation was cancelled");
        ce.initCause(e);
        return ce;
    }

    private static String checkName(final String name) {
        N.checkArgNotEmpty(name, "name");

        final String result = name.charAt(0) == '@' ? name.substring(1) : name;

        N.checkArgNotEmpty(result, "name");

        return result;
    }

    private void assertNotExecuted() {
        if (isExecuted) {
            throw new IllegalStateException("This QueryExecutor has already been executed. Prepare a new one for each execution");
        }
    }

    @Override
    public String toString() {
        return "QueryExecutor{commandType=" + commandType + ", commandText=" + commandText + ", parameters=" + parameters + "}";
    }

    private final class RowIterator<T> extends ObjIterator<T> {
        private final Throwables.Function<ResultSet, ? extends T, SQLException> rowMapper;
        private final CancellationToken token;
        private final AtomicBoolean statementCancelled = new AtomicBoolean();
        private CancellationToken.Registration registration = CancellationToken.Registration.EMPTY;
        private ConnectionLease lease;
        private PreparedStatement stmt;
        private ResultSet rs;
        private long startTime;
        private boolean isOpened = false;
        private boolean hasNext = false;
        private boolean isDone = false;
        private boolean isReleased = false;

        RowIterator(final Throwables.Function<ResultSet, ? extends T, SQLException> rowMapper, final CancellationToken token) {
            this.rowMapper = rowMapper;
            this.token = token;
        }

        @Override
        public boolean hasNext() {
            if (hasNext) {
                return true;
            } else if (isDone) {
                return false;
            }

            if (token.isCancellationRequested()) {
                throw abort(new CancellationException("Streaming query was cancelled"));
            }

            try {
                if (!isOpened) {
                    open();
                }

                hasNext = rs != null && rs.next();
            } catch (final Exception e) {
                throw abort(e);
            }

            if (!hasNext) {
                finish();
            }

            return hasNext;
        }

        @Override
        public T next() {
            if (!hasNext()) {
                throw new NoSuchElementException();
            }

            hasNext = false;

            try {
                return rowMapper.apply(rs);
            } catch (final Exception e) {
                throw abort(e);
            }
        }

        private void open() throws SQLException {
            isOpened = true;
            lease = context.acquire();
            stmt = createStatement(lease.connection());

            final PreparedStatement toCancel = stmt;
            registration = token.onCancel(() -> cancelStatement(toCancel, statementCancelled, null));

            startTime = System.currentTimeMillis();
            rs = executeForResultSet(stmt);
        }

        private void finish() {
            isDone = true;

            try {
                GraphJdbcUtil.closeQuietly(rs);
                rs = null;

                populateOutParameters(stmt);
                GraphJdbcUtil.handleSqlLog(jdbcSql, startTime);
            } catch (final SQLException e) {
                throw new UncheckedSQLException(e);
            } finally {
                release();
            }
        }

        private RuntimeException abort(final Exception e) {
            isDone = true;
            hasNext = false;

            final Exception failure = token.isCancellationRequested() ? toCancellation(e) : e;

            if (stmt != null) {
                cancelStatement(stmt, statementCancelled, failure);
            }

            release();

            if (failure instanceof RuntimeException) {
                return (RuntimeException) failure;
            } else if (failure instanceof SQLException) {
                return new UncheckedSQLException((SQLException) failure);
            } else {
                return new RuntimeException(failure);
            }
        }

        void close() {
            if (!isDone) {
                isDone = true;
                hasNext = false;

                if (stmt != null && rs != null) {
                    cancelStatement(stmt, statementCancelled, null);
                }
            }

            release();
        }

        private void release() {
            if (isReleased) {
                return;
            }

            isReleased = true;

            registration.close();
            GraphJdbcUtil.closeQuietly(rs, stmt, null);
            rs = null;

            if (lease != null) {
                lease.close();
            }
        }
    }
}
