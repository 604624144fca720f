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
package com.landawn.graphjdbc.graph;

import com.landawn.abacus.util.N;

/**
 * A node identified by its table and a parameter bag. The {@code $node_id} is resolved on first use and then kept.
 *
 * <pre>{@code
 * final GraphEntityReference alice = GraphEntityReference.of("Person", N.asMap("name", "Alice"));
 *
 * crudService.findConnected(alice, "FriendOf", "Person", Person.class);
 * }</pre>
 */
public final class GraphEntityReference {

    private final String table;

    private final Object parameters;

    private volatile boolean isResolved = false;

    private Object id;

    private GraphEntityReference(final String table, final Object parameters) {
        this.table = table;
        this.parameters = parameters;
    }

    public static GraphEntityReference of(final String table, final Object parameters) {
        N.checkArgNotEmpty(table, "table");

        return new GraphEntityReference(table, parameters);
    }

    public String table() {
        return table;
    }

    public Object parameters() {
        return parameters;
    }

    /**
     * Resolves the node id through {@code service} on the first call and returns the cached value afterwards.
     *
     * @param service resolves the id
     * @return the id, or {@code null} if the node can't be found
     */
    public Object resolveId(final GraphCrudService service) {
        if (!isResolved) {
            synchronized (this) {
                if (!isResolved) {
                    id = service.resolveNodeId(table, parameters);
                    isResolved = true;
                }
            }
        }

        return id;
    }

    public boolean isResolved() {
        return isResolved;
    }

    @Override
    public String toString() {
        return "GraphEntityReference{table=" + table + ", parameters=" + parameters + (isResolved ? ", id=" + id : "") + "}";
    }
}
