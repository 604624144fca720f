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
import java.util.concurrent.atomic.AtomicLong;

import javax.sql.DataSource;

import com.landawn.abacus.exception.UncheckedSQLException;
import com.landawn.abacus.logging.Logger;
import com.landawn.abacus.logging.LoggerFactory;
import com.landawn.abacus.util.N;

/**
 * A local transaction on one connection, started by {@link ExecutionContext#beginTransaction()}.
 * While it is active, every executor prepared from the same context runs on its connection and never closes it.
 *
 * <pre>{@code
 * try (GraphTransaction tran = context.beginTransaction()) {
 *     crudService.insertNode("Person", alice);
 *     crudService.insertEdgeAsync("FriendOf", "Person", "Person", alice, bob, since).get();
 *
 *     tran.commit();
 * } // rolled back here unless committed
 * }</pre>
 *
 * <p>Do not close the connection yourself. It is restored and released after commit or rollback.</p>
 */
public final class GraphTransaction implements AutoCloseable {

    private static final Logger logger = LoggerFactory.getLogger(GraphTransaction.class);

    private static final AtomicLong idGenerator = new AtomicLong();

    /**
     * Transaction lifecycle.
     */
    public enum Status {
        ACTIVE, COMMITTED, FAILED_COMMIT, ROLLED_BACK, FAILED_ROLLBACK
    }

    private final String id;

    private final ExecutionContext context;

    private final DataSource ds;

    private final Connection conn;

    private final boolean closeConnection;

    private final boolean originalAutoCommit;

    private volatile Status status = Status.ACTIVE;

    GraphTransaction(final ExecutionContext context, final DataSource ds, final Connection conn, final boolean closeConnection) throws SQLException {
        N.checkArgNotNull(conn, "conn");

        id = "graph-tran-" + idGenerator.incrementAndGet() + "_" + System.currentTimeMillis();
        this.context = context;
        this.ds = ds;
        this.conn = conn;
        this.closeConnection = closeConnection;

        originalAutoCommit = conn.getAutoCommit();
        conn.setAutoCommit(false);

        logger.info("Transaction(id={}) started", id);
    }

    public String id() {
        return id;
    }

    public Connection connection() {
        return conn;
    }

    public Status status() {
        return status;
    }

    public boolean isActive() {
        return status == Status.ACTIVE;
    }

    /**
     * Commits the transaction. If the commit fails, the transaction is rolled back and the failure rethrown.
     *
     * @throws UncheckedSQLException if the commit fails
     * @throws IllegalStateException if the transaction is not active
     */
    public synchronized void commit() throws UncheckedSQLException {
        if (status != Status.ACTIVE) {
            throw new IllegalStateException("Transaction(id=" + id + ") is already: " + status + ". It can not be committed");
        }

        logger.info("Committing transaction(id={})", id);

        status = Status.FAILED_COMMIT;

        try {
            conn.commit();

            status = Status.COMMITTED;
        } catch (final SQLException e) {
            throw new UncheckedSQLException("Failed to commit transaction(id=" + id + ")", e);
        } finally {
            if (status == Status.COMMITTED) {
                logger.info("Transaction(id={}) has been committed successfully", id);

                resetAndCloseConnection();
            } else {
                logger.warn("Failed to commit transaction(id={}). It will automatically be rolled back ", id);
                executeRollback();
            }
        }
    }

    /**
     * Rolls back the transaction.
     *
     * @throws UncheckedSQLException if the rollback fails
     * @throws IllegalStateException if the transaction is not active
     */
    public synchronized void rollback() throws UncheckedSQLException {
        if (status != Status.ACTIVE) {
            throw new IllegalStateException("Transaction(id=" + id + ") is already: " + status + ". It can not be rolled back");
        }

        executeRollback();
    }

    /**
     * Rolls back the transaction if it is still active. Does nothing after a commit or rollback.
     *
     * @throws UncheckedSQLException if the rollback fails
     */
    public synchronized void rollbackIfNotCommitted() throws UncheckedSQLException {
        if (status == Status.ACTIVE) {
            executeRollback();
        }
    }

    private void executeRollback() throws UncheckedSQLException {
        logger.warn("Rolling back transaction(id={})", id);

        status = Status.FAILED_ROLLBACK;

        try {
            conn.rollback();

            status = Status.ROLLED_BACK;
        } catch (final SQLException e) {
            throw new UncheckedSQLException(e);
        } finally {
            if (status == Status.ROLLED_BACK) {
                logger.warn("Transaction(id={}) has been rolled back successfully", id);
            } else {
                logger.warn("Failed to roll back transaction(id={})", id);
            }

            resetAndCloseConnection();
        }
    }

    private void resetAndCloseConnection() {
        try {
            conn.setAutoCommit(originalAutoCommit);
        } catch (final SQLException e) {
            logger.warn("Failed to reset connection", e);
        } finally {
            context.detach(this);

            if (closeConnection) {
                GraphJdbcUtil.releaseConnection(conn, ds);
            }
        }
    }

    @Override
    public void close() {
        rollbackIfNotCommitted();
    }

    @Override
    public String toString() {
        return "GraphTransaction{id=" + id + ", status=" + status + "}";
    }
}
