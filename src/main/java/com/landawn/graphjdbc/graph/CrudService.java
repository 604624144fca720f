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

import static com.landawn.graphjdbc.graph.GraphQuerySynthesizer.FROM_ID_PARAM;
import static com.landawn.graphjdbc.graph.GraphQuerySynthesizer.ID_PARAM;
import static com.landawn.graphjdbc.graph.GraphQuerySynthesizer.TO_ID_PARAM;
import static com.landawn.graphjdbc.graph.GraphQuerySynthesizer.WHERE_PARAM_PREFIX;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.Callable;
import java.util.concurrent.Executor;

import javax.sql.DataSource;

import com.landawn.abacus.logging.Logger;
import com.landawn.abacus.logging.LoggerFactory;
import com.landawn.abacus.util.ContinuableFuture;
import com.landawn.abacus.util.ExceptionUtil;
import com.landawn.abacus.util.N;
import com.landawn.abacus.util.stream.Stream;
import com.landawn.graphjdbc.ExecutionContext;
import com.landawn.graphjdbc.GraphJdbcUtil;
import com.landawn.graphjdbc.ParameterBinder;
import com.landawn.graphjdbc.QueryExecutor;
import com.landawn.graphjdbc.ResultMapper;

/**
 * Default {@link GraphCrudService}. Each operation builds its text with {@link GraphQuerySynthesizer}, binds the bags with
 * {@link ParameterBinder} and runs a new {@link QueryExecutor} from the {@link ExecutionContext}.
 *
 * <pre>{@code
 * try (CrudService crudService = new CrudService(ExecutionContext.of(dataSource))) {
 *     crudService.insertNode("Person", N.asLinkedHashMap("name", "Alice", "age", 30));
 *     crudService.insertEdgeAsync("FriendOf", "Person", "Person", N.asMap("name", "Alice"), N.asMap("name", "Bob"), new HashMap<>()).get();
 * }
 * }</pre>
 *
 * <p>Resources passed to {@link #register(AutoCloseable)} are closed by {@link #close()}.</p>
 */
public class CrudService implements GraphCrudService, AutoCloseable {

    private static final Logger logger = LoggerFactory.getLogger(CrudService.class);

    protected final ExecutionContext context;

    protected final Executor executor;

    private final Set<AutoCloseable> resources = new LinkedHashSet<>();

    private volatile boolean isClosed = false;

    public CrudService(final DataSource dataSource) {
        this(ExecutionContext.of(dataSource));
    }

    public CrudService(final ExecutionContext context) {
        this(context, GraphJdbcUtil.defaultAsyncExecutor());
    }

    /**
     * @param context where commands run
     * @param executor runs the {@code *Async} operations
     */
    public CrudService(final ExecutionContext context, final Executor executor) {
        N.checkArgNotNull(context, "context");
        N.checkArgNotNull(executor, "executor");

        this.context = context;
        this.executor = executor;
    }

    public ExecutionContext context() {
        return context;
    }

    protected QueryExecutor prepare(final String sql) {
        assertNotClosed();

        return context.prepare(sql);
    }

    @Override
    public Object resolveNodeId(final String table, final Object parameters) {
        if (GraphQuerySynthesizer.isEmptyBag(parameters)) {
            return null;
        }

        final Map<String, Object> bag = ParameterBinder.toMap(parameters);

        if (GraphQuerySynthesizer.containsSystemColumn(bag)) {
            return GraphQuerySynthesizer.findSystemId(bag);
        }

        return prepare(GraphQuerySynthesizer.nodeIdQuery(table, bag)).addParameters(bag).executeScalar(Object.class);
    }

    public Object resolveNodeId(final GraphEntityReference reference) {
        N.checkArgNotNull(reference, "reference");

        return reference.resolveId(this);
    }

    @Override
    public boolean anyNode(final String table, final Object parameters) {
        if (GraphQuerySynthesizer.isEmptyBag(parameters)) {
            return false;
        }

        final String sql = GraphQuerySynthesizer.existsQuery(table, GraphQuerySynthesizer.buildWhereClause(parameters));

        return prepare(sql).addParameters(parameters).executeScalar(int.class) > 0;
    }

    @Override
    public boolean anyEdge(final String edge, final String fromTable, final String toTable, final Object fromParameters, final Object toParameters,
            final Object parameters) {
        if (parameters == null) {
            return false;
        }

        final Object fromId = resolveNodeId(fromTable, fromParameters);
        final Object toId = resolveNodeId(toTable, toParameters);

        if (fromId == null && toId == null) {
            return false;
        }

        final String sql = GraphQuerySynthesizer.existsQuery(edge, GraphQuerySynthesizer.buildEdgeWhereClause(fromId != null, toId != null, parameters));

        return bindEndpoints(prepare(sql).addParameters(parameters), fromId, toId).executeScalar(int.class) > 0;
    }

    @Override
    public int insertNode(final String table, final Object parameters) {
        if (GraphQuerySynthesizer.isEmptyBag(parameters)) {
            return 0;
        }

        return prepare(GraphQuerySynthesizer.insertNodeQuery(table, parameters, false)).addParameters(parameters).executeNonQuery();
    }

    @Override
    public ContinuableFuture<Integer> insertNodeAsync(final String table, final Object parameters) {
        if (GraphQuerySynthesizer.isEmptyBag(parameters)) {
            return ContinuableFuture.completed(0);
        }

        return async(() -> prepare(GraphQuerySynthesizer.insertNodeQuery(table, parameters, true)).addParameters(parameters).executeNonQuery());
    }

    /**
     * Inserts an edge between the two resolved nodes.
     *
     * @throws IllegalArgumentException through the returned future if either endpoint can't be resolved
     */
    @Override
    public ContinuableFuture<Integer> insertEdgeAsync(final String edge, final String fromTable, final String toTable, final Object fromParameters,
            final Object toParameters, final Object parameters) {
        if (parameters == null) {
            return ContinuableFuture.completed(0);
        }

        return async(() -> {
            final Object fromId = resolveNodeId(fromTable, fromParameters);
            final Object toId = resolveNodeId(toTable, toParameters);

            N.checkArgument(fromId != null, "No node found in '{}' for the 'from' parameters of edge '{}'", fromTable, edge);
            N.checkArgument(toId != null, "No node found in '{}' for the 'to' parameters of edge '{}'", toTable, edge);

            final String sql = GraphQuerySynthesizer.insertEdgeQuery(edge, parameters);

            return bindEndpoints(prepare(sql).addParameters(parameters), fromId, toId).executeNonQuery();
        });
    }

    @Override
    public ContinuableFuture<Integer> updateNodeAsync(final String table, final Object parameters, final Object whereParameters) {
        if (GraphQuerySynthesizer.isEmptyBag(parameters) || GraphQuerySynthesizer.buildAssignments(parameters).isEmpty()) {
            return ContinuableFuture.completed(0);
        }

        return async(() -> {
            final String sql = GraphQuerySynthesizer.updateNodeQuery(table, parameters, whereParameters);

            return bindWhere(prepare(sql).addParameters(parameters), whereParameters).executeNonQuery();
        });
    }

    @Override
    public ContinuableFuture<Integer> updateNodeByNodeIdAsync(final String table, final Object parameters, final Object nodeId) {
        if (GraphQuerySynthesizer.isEmptyBag(parameters) || GraphQuerySynthesizer.buildAssignments(parameters).isEmpty()) {
            return ContinuableFuture.completed(0);
        }

        N.checkArgNotNull(nodeId, "nodeId");

        return async(() -> prepare(GraphQuerySynthesizer.updateNodeByIdQuery(table, parameters)).addParameters(parameters)
                .addParameter(ID_PARAM, nodeId)
                .executeNonQuery());
    }

    /**
     * Updates the edges between the two resolved nodes. Completes with {@code 0} if either endpoint can't be resolved.
     */
    @Override
    public ContinuableFuture<Integer> updateEdgeAsync(final String edge, final String fromTable, final String toTable, final Object fromParameters,
            final Object toParameters, final Object parameters, final Object whereParameters) {
        if (parameters == null || GraphQuerySynthesizer.buildAssignments(parameters).isEmpty()) {
            return ContinuableFuture.completed(0);
        }

        return async(() -> {
            final Object fromId = resolveNodeId(fromTable, fromParameters);
            final Object toId = resolveNodeId(toTable, toParameters);

            if (fromId == null || toId == null) {
                logger.debug("Skipping update of edge '{}': endpoint not found (fromId={}, toId={})", edge, fromId, toId);
                return 0;
            }

            final String sql = GraphQuerySynthesizer.updateEdgeQuery(edge, parameters, whereParameters);

            return bindEndpoints(bindWhere(prepare(sql).addParameters(parameters), whereParameters), fromId, toId).executeNonQuery();
        });
    }

    @Override
    public ContinuableFuture<Integer> deleteByIdAsync(final String table, final Object id, final boolean isNode) {
        N.checkArgNotNull(id, "id");

        return async(() -> prepare(GraphQuerySynthesizer.deleteByIdQuery(table, isNode)).addParameter(ID_PARAM, id).executeNonQuery());
    }

    @Override
    public ContinuableFuture<Integer> deleteEdgeAsync(final String edge, final String fromTable, final String toTable, final Object fromParameters,
            final Object toParameters, final Object parameters) {
        if (parameters == null) {
            return ContinuableFuture.completed(0);
        }

        return async(() -> {
            final Object fromId = resolveNodeId(fromTable, fromParameters);
            final Object toId = resolveNodeId(toTable, toParameters);

            if (fromId == null || toId == null) {
                logger.debug("Skipping delete of edge '{}': endpoint not found (fromId={}, toId={})", edge, fromId, toId);
                return 0;
            }

            return deleteEdge(edge, parameters, fromId, toId);
        });
    }

    /**
     * Deletes the edges matching {@code parameters} and the given endpoints. A {@code null} endpoint is not constrained,
     * but at least one must be given.
     */
    @Override
    public ContinuableFuture<Integer> deleteEdgeAsync(final String edge, final Object parameters, final Object fromId, final Object toId) {
        if (fromId == null && toId == null) {
            return ContinuableFuture.completed(0);
        }

        return async(() -> deleteEdge(edge, parameters, fromId, toId));
    }

    private int deleteEdge(final String edge, final Object parameters, final Object fromId, final Object toId) {
        final String sql = GraphQuerySynthesizer.deleteEdgeQuery(edge, fromId != null, toId != null, parameters);

        return bindEndpoints(prepare(sql).addParameters(parameters), fromId, toId).executeNonQuery();
    }

    @Override
    public ContinuableFuture<Integer> deleteNodeAsync(final String table, final Object parameters) {
        if (GraphQuerySynthesizer.isEmptyBag(parameters)) {
            return ContinuableFuture.completed(0);
        }

        return async(() -> prepare(GraphQuerySynthesizer.deleteNodeQuery(table, parameters)).addParameters(parameters).executeNonQuery());
    }

    @Override
    public <T> List<T> findNodes(final String table, final Object parameters, final Class<T> targetType) {
        N.checkArgNotNull(targetType, "targetType");

        if (GraphQuerySynthesizer.isEmptyBag(parameters)) {
            return new ArrayList<>();
        }

        final ResultMapper<T> mapper = ResultMapper.of(targetType);
        final List<T> result = new ArrayList<>();

        prepare(GraphQuerySynthesizer.selectQuery(table, parameters)).addParameters(parameters).execute(rs -> mapper.forEach(rs, result::add));

        return result;
    }

    @Override
    public <T> Stream<T> streamNodes(final String table, final Object parameters, final Class<T> targetType) {
        N.checkArgNotNull(targetType, "targetType");

        if (GraphQuerySynthesizer.isEmptyBag(parameters)) {
            return Stream.empty();
        }

        return prepare(GraphQuerySynthesizer.selectQuery(table, parameters)).addParameters(parameters).stream(ResultMapper.of(targetType));
    }

    @Override
    public <T> List<T> findConnected(final String fromTable, final String edge, final String toTable, final Object fromParameters,
            final Class<T> targetType) {
        N.checkArgNotNull(targetType, "targetType");

        final Object fromId = resolveNodeId(fromTable, fromParameters);

        if (fromId == null) {
            return new ArrayList<>();
        }

        final ResultMapper<T> mapper = ResultMapper.of(targetType);
        final List<T> result = new ArrayList<>();

        prepare(GraphQuerySynthesizer.connectedNodesQuery(fromTable, edge, toTable)).addParameter(FROM_ID_PARAM, fromId)
                .execute(rs -> mapper.forEach(rs, result::add));

        return result;
    }

    public <T> List<T> findConnected(final GraphEntityReference from, final String edge, final String toTable, final Class<T> targetType) {
        N.checkArgNotNull(from, "from");

        final Object fromId = from.resolveId(this);

        return fromId == null ? new ArrayList<>() : findConnected(from.table(), edge, toTable, N.asMap(GraphQuerySynthesizer.NODE_ID, fromId), targetType);
    }

    /**
     * Registers a resource to be closed by {@link #close()}.
     *
     * @param <R> the resource type
     * @param resource the resource
     * @return {@code resource}
     */
    public <R extends AutoCloseable> R register(final R resource) {
        N.checkArgNotNull(resource, "resource");
        assertNotClosed();

        synchronized (resources) {
            resources.add(resource);
        }

        return resource;
    }

    public boolean isClosed() {
        return isClosed;
    }

    /**
     * Closes every registered resource. All of them are closed even if some fail; the first failure is then rethrown.
     */
    @Override
    public void close() {
        if (isClosed) {
            return;
        }

        isClosed = true;

        final List<AutoCloseable> toClose;

        synchronized (resources) {
            toClose = new ArrayList<>(resources);
            resources.clear();
        }

        Exception failure = null;

        for (final AutoCloseable resource : toClose) {
            try {
                resource.close();
            } catch (final Exception e) {
                logger.warn("Failed to close resource: " + resource, e);

                if (failure == null) {
                    failure = e;
                } else {
                    failure.addSuppressed(e);
                }
            }
        }

        if (failure != null) {
            throw ExceptionUtil.toRuntimeException(failure, true);
        }
    }

    private ContinuableFuture<Integer> async(final Callable<Integer> action) {
        assertNotClosed();

        return ContinuableFuture.call(action, GraphJdbcUtil.sqlLogAware(executor));
    }

    private static QueryExecutor bindEndpoints(final QueryExecutor executor, final Object fromId, final Object toId) {
        if (fromId != null) {
            executor.addParameter(FROM_ID_PARAM, fromId);
        }

        if (toId != null) {
            executor.addParameter(TO_ID_PARAM, toId);
        }

        return executor;
    }

    private static QueryExecutor bindWhere(final QueryExecutor executor, final Object whereParameters) {
        for (final Map.Entry<String, Object> entry : ParameterBinder.toMap(whereParameters).entrySet()) {
            executor.addParameter(WHERE_PARAM_PREFIX + entry.getKey(), entry.getValue());
        }

        return executor;
    }

    private void assertNotClosed() {
        if (isClosed) {
            throw new IllegalStateException("This CrudService has been closed");
        }
    }
}
