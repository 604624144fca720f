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

import javax.sql.DataSource;

/**
 * A connection held for the duration of one execution.
 * Whether the lease owns the connection is fixed when it is acquired; {@link #close()} releases the connection only if it does.
 */
final class ConnectionLease implements AutoCloseable {

    private final Connection conn;

    private final DataSource ds;

    private final boolean owned;

    private boolean released;

    private ConnectionLease(final Connection conn, final DataSource ds, final boolean owned) {
        this.conn = conn;
        this.ds = ds;
        this.owned = owned;
    }

    /**
     * Opens a connection from {@code ds}. The lease owns it.
     */
    static ConnectionLease open(final DataSource ds) {
        return new ConnectionLease(GraphJdbcUtil.getConnection(ds), ds, true);
    }

    /**
     * Borrows a connection someone else manages. The lease never closes it.
     */
    static ConnectionLease borrow(final Connection conn) {
        return new ConnectionLease(conn, null, false);
    }

    Connection connection() {
        return conn;
    }

    @Override
    public void close() {
        if (released) {
            return;
        }

        released = true;

        if (owned) {
            GraphJdbcUtil.releaseConnection(conn, ds);
        }
    }
}
