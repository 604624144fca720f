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

import java.util.List;

import com.landawn.abacus.util.ContinuableFuture;
import com.landawn.abacus.util.stream.Stream;

/**
 * Create, read, update and delete operations on the node and edge tables of a SQL Server graph database.
 *
 * <p>Parameter bags are {@code Map}s or beans. A node bag that is {@code null} or empty makes the operation return
 * {@code 0}, {@code false}, an empty result or {@code null} without touching the database. So does a {@code null} edge bag.
 * An edge bag may be empty.</p>
 *
 * <p>Edge operations locate their endpoints with {@link #resolveNodeId(String, Object)}.</p>
 */
public interface GraphCrudService {

    /**
     * Returns the {@code $node_id} of the node described by {@code parameters}. If the bag holds a system column
     * ({@code node_id}, {@code edge_id}, {@code from_id}, {@code to_id}, in that priority) its value is returned as is.
     * Otherwise the id is read with {@code SELECT $node_id FROM <table> WHERE ...}.
     *
     * @param table the node table
     * @param parameters the node bag
     * @return the id, or {@code null}
     */
    Object resolveNodeId(String table, Object parameters);

    boolean anyNode(String table, Object parameters);

    boolean anyEdge(String edge, String fromTable, String toTable, Object fromParameters, Object toParameters, Object parameters);

    /**
     * Inserts a node without a column list, so the properties must follow the table's column order.
     */
    int insertNode(String table, Object parameters);

    ContinuableFuture<Integer> insertNodeAsync(String table, Object parameters);

    ContinuableFuture<Integer> insertEdgeAsync(String edge, String fromTable, String toTable, Object fromParameters, Object toParameters,
            Object parameters);

    /**
     * Updates the non-null properties of {@code parameters} on the rows matching {@code whereParameters}.
     */
    ContinuableFuture<Integer> updateNodeAsync(String table, Object parameters, Object whereParameters);

    ContinuableFuture<Integer> updateNodeByNodeIdAsync(String table, Object parameters, Object nodeId);

    ContinuableFuture<Integer> updateEdgeAsync(String edge, String fromTable, String toTable, Object fromParameters, Object toParameters,
            Object parameters, Object whereParameters);

    ContinuableFuture<Integer> deleteByIdAsync(String table, Object id, boolean isNode);

    ContinuableFuture<Integer> deleteEdgeAsync(String edge, String fromTable, String toTable, Object fromParameters, Object toParameters,
            Object parameters);

    ContinuableFuture<Integer> deleteEdgeAsync(String edge, Object parameters, Object fromId, Object toId);

    ContinuableFuture<Integer> deleteNodeAsync(String table, Object parameters);

    <T> List<T> findNodes(String table, Object parameters, Class<T> targetType);

    <T> Stream<T> streamNodes(String table, Object parameters, Class<T> targetType);

    /**
     * Returns the {@code toTable} nodes reached from the {@code fromTable} node through {@code edge}.
     */
    <T> List<T> findConnected(String fromTable, String edge, String toTable, Object fromParameters, Class<T> targetType);
}
