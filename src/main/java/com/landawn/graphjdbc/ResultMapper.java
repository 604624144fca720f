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

import java.sql.ResultSet;
import java.sql.ResultSetMetaData;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.NoSuchElementException;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executor;

import com.landawn.abacus.exception.UncheckedSQLException;
import com.landawn.abacus.logging.Logger;
import com.landawn.abacus.logging.LoggerFactory;
import com.landawn.abacus.parser.ParserUtil;
import com.landawn.abacus.parser.ParserUtil.BeanInfo;
import com.landawn.abacus.parser.ParserUtil.PropInfo;
import com.landawn.abacus.util.ContinuableFuture;
import com.landawn.abacus.util.N;
import com.landawn.abacus.util.ObjIterator;
import com.landawn.abacus.util.Strings;
import com.landawn.abacus.util.Throwables;
import com.landawn.abacus.util.Tuple;
import com.landawn.abacus.util.Tuple.Tuple2;
import com.landawn.abacus.util.stream.Stream;

/**
 * Maps the rows of a forward-only {@code ResultSet} to new instances of a bean class.
 *
 * <p>A column is bound to the property whose name equals the column label once underscores are removed, ignoring case:
 * {@code FIRST_NAME} and {@code firstname} both bind to {@code firstName}. Columns without a matching property are ignored.</p>
 *
 * <p>The bindings for a (bean class, column labels) pair are computed once and cached for the life of the process.
 * The cache key is the exact label list, so two result shapes never share bindings.</p>
 *
 * @param <T> the record type
 */
public final class ResultMapper<T> {

    private static final Logger logger = LoggerFactory.getLogger(ResultMapper.class);

    private static final Map<Tuple2<Class<?>, List<String>>, FieldBindingSet> bindingCache = new ConcurrentHashMap<>();

    private static final Map<Class<?>, ResultMapper<?>> mapperPool = new ConcurrentHashMap<>();

    private final Class<T> targetType;

    private final BeanInfo beanInfo;

    private ResultMapper(final Class<T> targetType) {
        this.targetType = targetType;
        beanInfo = ParserUtil.getBeanInfo(targetType);

        if (beanInfo.propInfoList.isEmpty()) {
            throw new IllegalArgumentException("No settable property found in record type: " + targetType.getName());
        }
    }

    /**
     * Returns the mapper for {@code targetType}. The type must have a public no-arg constructor.
     *
     * @param <T> the record type
     * @param targetType the record type
     * @return the shared mapper
     */
    @SuppressWarnings("unchecked")
    public static <T> ResultMapper<T> of(final Class<T> targetType) {
        N.checkArgNotNull(targetType, "targetType");

        return (ResultMapper<T>) mapperPool.computeIfAbsent(targetType, cls -> new ResultMapper<>(cls));
    }

    /**
     * Order-sensitive hash of column names: seed 17, then {@code key = key * 31 + name.hashCode()} with int overflow.
     * Only used to identify a result shape in logs; the binding cache is keyed by the names themselves.
     *
     * @param columnNames column labels in order
     * @return the hash
     */
    public static int computeKey(final List<String> columnNames) {
        int key = 17;

        for (final String columnName : columnNames) {
            key = key * 31 + (columnName == null ? 0 : columnName.hashCode());
        }

        return key;
    }

    static List<String> columnLabels(final ResultSet rs) throws SQLException {
        final ResultSetMetaData metaData = rs.getMetaData();
        final int columnCount = metaData.getColumnCount();
        final List<String> labels = new ArrayList<>(columnCount);

        for (int i = 1; i <= columnCount; i++) {
            labels.add(metaData.getColumnLabel(i));
        }

        return labels;
    }

    static String normalize(final String columnName) {
        return Strings.removeAll(columnName, '_');
    }

    public Class<T> targetType() {
        return targetType;
    }

    /**
     * Returns the cached bindings for {@code columnNames}, computing them on the first request.
     * Concurrent first requests may compute twice; the first one stored wins.
     *
     * @param columnNames column labels in result order
     * @return the bindings
     */
    public FieldBindingSet bindingsFor(final List<String> columnNames) {
        final Tuple2<Class<?>, List<String>> key = Tuple.of(targetType, List.copyOf(columnNames));
        FieldBindingSet bindingSet = bindingCache.get(key);

        if (bindingSet == null) {
            bindingSet = createBindings(key._2);

            final FieldBindingSet existing = bindingCache.putIfAbsent(key, bindingSet);

            if (existing != null) {
                bindingSet = existing;
            }
        }

        return bindingSet;
    }

    public FieldBindingSet bindingsFor(final ResultSet rs) throws SQLException {
        return bindingsFor(columnLabels(rs));
    }

    private FieldBindingSet createBindings(final List<String> columnNames) {
        final List<ColumnBinding> bindings = new ArrayList<>(columnNames.size());

        for (int i = 0, size = columnNames.size(); i < size; i++) {
            final String normalized = normalize(columnNames.get(i));
            PropInfo matched = null;

            for (final PropInfo propInfo : beanInfo.propInfoList) {
                if (propInfo.setMethod != null || propInfo.field != null) {
                    if (propInfo.name.equalsIgnoreCase(normalized)) {
                        matched = propInfo;
                        break;
                    }
                }
            }

            if (matched != null) {
                bindings.add(new ColumnBinding(i + 1, columnNames.get(i), matched));
            }
        }

        if (logger.isDebugEnabled()) {
            logger.debug("Created bindings for {} with columns {} (key={}): {}", targetType.getSimpleName(), columnNames, computeKey(columnNames),
                    bindings);
        }

        return new FieldBindingSet(targetType, columnNames, bindings);
    }

    /**
     * Maps the current row of {@code rs}.
     *
     * @param rs positioned on a row
     * @return a new record
     * @throws SQLException if a column can't be read
     */
    public T map(final ResultSet rs) throws SQLException {
        return map(rs, bindingsFor(rs));
    }

    T map(final ResultSet rs, final FieldBindingSet bindingSet) throws SQLException {
        final T record = N.newInstance(targetType);
        bindingSet.applyTo(rs, record);
        return record;
    }

    /**
     * Returns a row mapper that resolves the bindings on its first row and reuses them for the rest of the same cursor.
     *
     * @return a row mapper for one cursor
     */
    public Throwables.Function<ResultSet, T, SQLException> toRowMapper() {
        return new Throwables.Function<>() {
            private FieldBindingSet bindingSet;

            @Override
            public T apply(final ResultSet rs) throws SQLException {
                if (bindingSet == null) {
                    bindingSet = bindingsFor(rs);
                }

                return map(rs, bindingSet);
            }
        };
    }

    /**
     * Maps every remaining row and passes it to {@code action}.
     *
     * @param <E> exception thrown by {@code action}
     * @param rs the cursor, not closed by this method
     * @param action the row consumer
     * @throws SQLException if the cursor fails
     * @throws E if {@code action} fails
     */
    public <E extends Exception> void forEach(final ResultSet rs, final Throwables.Consumer<? super T, E> action) throws SQLException, E {
        forEach(rs, action, CancellationToken.NONE);
    }

    /**
     * Like {@link #forEach(ResultSet, Throwables.Consumer)}, checking {@code token} before each row.
     *
     * @param <E> exception thrown by {@code action}
     * @param rs the cursor, not closed by this method
     * @param action the row consumer
     * @param token checked before each fetch
     * @throws SQLException if the cursor fails
     * @throws E if {@code action} fails
     * @throws java.util.concurrent.CancellationException if {@code token} is cancelled
     */
    public <E extends Exception> void forEach(final ResultSet rs, final Throwables.Consumer<? super T, E> action, final CancellationToken token)
            throws SQLException, E {
        N.checkArgNotNull(rs, "rs");
        N.checkArgNotNull(action, "action");

        FieldBindingSet bindingSet = null;

        while (true) {
            token.throwIfCancellationRequested();

            if (!rs.next()) {
                break;
            }

            if (bindingSet == null) {
                bindingSet = bindingsFor(rs);
            }

            action.accept(map(rs, bindingSet));
        }
    }

    /**
     * Runs {@link #forEach(ResultSet, Throwables.Consumer, CancellationToken)} on {@code executor}.
     * The caller keeps ownership of {@code rs} and must not close it before the returned future completes.
     *
     * @param rs the cursor
     * @param action the row consumer
     * @param token checked before each fetch
     * @param executor runs the loop
     * @return a future that completes after the last row
     */
    public ContinuableFuture<Void> forEachAsync(final ResultSet rs, final Throwables.Consumer<? super T, ? extends Exception> action,
            final CancellationToken token, final Executor executor) {
        N.checkArgNotNull(executor, "executor");

        return ContinuableFuture.run(() -> forEach(rs, action, token), executor);
    }

    public List<T> list(final ResultSet rs) throws SQLException {
        final List<T> result = new ArrayList<>();

        forEach(rs, result::add);

        return result;
    }

    /**
     * Returns a lazy stream over the remaining rows. The stream reads {@code rs} once and doesn't close it.
     *
     * @param rs the cursor
     * @return a single-use stream
     */
    public Stream<T> stream(final ResultSet rs) {
        N.checkArgNotNull(rs, "rs");

        final Throwables.Function<ResultSet, T, SQLException> rowMapper = toRowMapper();

        return Stream.of(new ObjIterator<T>() {
            private boolean hasNext = false;
            private boolean isDone = false;

            @Override
            public boolean hasNext() {
                if (!hasNext && !isDone) {
                    try {
                        hasNext = rs.next();
                    } catch (final SQLException e) {
                        throw new UncheckedSQLException(e);
                    }

                    isDone = !hasNext;
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
                } catch (final SQLException e) {
                    throw new UncheckedSQLException(e);
                }
            }
        });
    }

    static void clearCache() {
        bindingCache.clear();
    }
}
