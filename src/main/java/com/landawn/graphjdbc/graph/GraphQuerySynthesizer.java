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

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import com.landawn.abacus.util.N;
import com.landawn.abacus.util.Strings;
import com.landawn.graphjdbc.ParameterBinder;

/**
 * Builds the SQL text for node and edge tables of a SQL Server graph database.
 *
 * <p>The system columns {@code node_id}, {@code edge_id}, {@code from_id} and {@code to_id} are written with the {@code $} sigil
 * ({@code $node_id}). Every value is referenced as an {@code @name} placeholder, including resolved node ids, which use the reserved
 * names {@link #FROM_ID_PARAM}, {@link #TO_ID_PARAM} and {@link #ID_PARAM}. Table and column names are written as given.</p>
 *
 * <p>Parameter bags are {@code Map}s or beans, read through {@link ParameterBinder#toMap(Object)}.</p>
 */
public final class GraphQuerySynthesizer {

    public static final String SIGIL = "$";

    public static final String NODE_ID = "node_id";

    public static final String EDGE_ID = "edge_id";

    public static final String FROM_ID = "from_id";

    public static final String TO_ID = "to_id";

    /**
     * Resolution priority for {@link #findSystemId(Map)}.
     */
    static final List<String> SYSTEM_COLUMNS = List.of(NODE_ID, EDGE_ID, FROM_ID, TO_ID);

    public static final String FROM_ID_PARAM = "_from_id";

    public static final String TO_ID_PARAM = "_to_id";

    public static final String ID_PARAM = "_id";

    /**
     * Prefix of the parameters of an UPDATE's WHERE clause, so they don't clash with the SET parameters.
     */
    public static final String WHERE_PARAM_PREFIX = "w_";

    private GraphQuerySynthesizer() {
        // utility class.
    }

    public static boolean isSystemColumn(final String name) {
        for (final String systemColumn : SYSTEM_COLUMNS) {
            if (systemColumn.equalsIgnoreCase(name)) {
                return true;
            }
        }

        return false;
    }

    /**
     * @return {@code "$" + name} for a system column, otherwise {@code name}
     */
    public static String formatColumnName(final String name) {
        return isSystemColumn(name) ? SIGIL + name : name;
    }

    public static boolean containsSystemColumn(final Map<String, Object> bag) {
        if (N.isEmpty(bag)) {
            return false;
        }

        for (final String name : bag.keySet()) {
            if (isSystemColumn(name)) {
                return true;
            }
        }

        return false;
    }

    /**
     * Returns the first system column present in {@code bag}, in the order node_id, edge_id, from_id, to_id.
     *
     * @param bag the parameter bag
     * @return the value, or {@code null} if no system column is present
     */
    public static Object findSystemId(final Map<String, Object> bag) {
        if (N.isEmpty(bag)) {
            return null;
        }

        for (final String systemColumn : SYSTEM_COLUMNS) {
            for (final Map.Entry<String, Object> entry : bag.entrySet()) {
                if (systemColumn.equalsIgnoreCase(entry.getKey())) {
                    return entry.getValue();
                }
            }
        }

        return null;
    }

    /**
     * @return {@code true} if {@code bag} is {@code null} or has no entries/properties
     */
    public static boolean isEmptyBag(final Object bag) {
        return bag == null || ParameterBinder.toMap(bag).isEmpty();
    }

    public static String buildWhereClause(final Object bag) {
        return buildWhereClause(bag, true);
    }

    public static String buildWhereClause(final Object bag, final boolean prependWhere) {
        return buildWhereClause(bag, prependWhere, "");
    }

    /**
     * Builds {@code " WHERE a = @a AND b IS NULL"}: one predicate per property, joined with {@code AND}.
     *
     * @param bag the parameter bag
     * @param prependWhere whether to start with {@code " WHERE "}
     * @param paramPrefix prepended to each placeholder name
     * @return the clause, or {@code ""} for an empty bag
     */
    public static String buildWhereClause(final Object bag, final boolean prependWhere, final String paramPrefix) {
        final Map<String, Object> map = ParameterBinder.toMap(bag);

        if (map.isEmpty()) {
            return "";
        }

        return (prependWhere ? " WHERE " : "") + String.join(" AND ", predicates(map, paramPrefix, false));
    }

    /**
     * Builds the SET list of an UPDATE. Properties with a {@code null} value are skipped.
     *
     * @param bag the parameter bag
     * @return {@code "a = @a , b = @b"}, or {@code ""} if every value is {@code null}
     */
    public static String buildAssignments(final Object bag) {
        return String.join(" , ", predicates(ParameterBinder.toMap(bag), "", true));
    }

    private static List<String> predicates(final Map<String, Object> map, final String paramPrefix, final boolean isAssignment) {
        final List<String> result = new ArrayList<>(map.size());

        for (final Map.Entry<String, Object> entry : map.entrySet()) {
            if (entry.getValue() != null) {
                result.add(formatColumnName(entry.getKey()) + " = @" + paramPrefix + entry.getKey());
            } else if (!isAssignment) {
                result.add(formatColumnName(entry.getKey()) + " IS NULL");
            }
        }

        return result;
    }

    /**
     * Builds the WHERE clause of an edge: the from-id predicate, the to-id predicate, then the predicates of {@code bag}.
     * Absent parts are left out.
     *
     * @param hasFrom whether to constrain {@code $from_id} to {@code @_from_id}
     * @param hasTo whether to constrain {@code $to_id} to {@code @_to_id}
     * @param bag additional predicates
     * @param paramPrefix prepended to the placeholder names of {@code bag}
     * @return the clause, or {@code ""} if neither endpoint is present
     */
    public static String buildEdgeWhereClause(final boolean hasFrom, final boolean hasTo, final Object bag, final String paramPrefix) {
        if (!hasFrom && !hasTo) {
            return "";
        }

        final List<String> parts = new ArrayList<>(3);

        if (hasFrom) {
            parts.add(SIGIL + FROM_ID + " = @" + FROM_ID_PARAM);
        }

        if (hasTo) {
            parts.add(SIGIL + TO_ID + " = @" + TO_ID_PARAM);
        }

        final String bagPart = buildWhereClause(bag, false, paramPrefix);

        if (Strings.isNotEmpty(bagPart)) {
            parts.add(bagPart);
        }

        return " WHERE " + String.join(" AND ", parts);
    }

    public static String buildEdgeWhereClause(final boolean hasFrom, final boolean hasTo, final Object bag) {
        return buildEdgeWhereClause(hasFrom, hasTo, bag, "");
    }

    /**
     * @return {@code "SELECT $node_id FROM <table><where>"}
     */
    public static String nodeIdQuery(final String table, final Object bag) {
        checkTable(table);

        return "SELECT " + SIGIL + NODE_ID + " FROM " + table + buildWhereClause(bag);
    }

    /**
     * @return {@code "SELECT COUNT(*) FROM (SELECT TOP 1 * FROM <table><where>) d"}
     */
    public static String existsQuery(final String table, final String whereClause) {
        checkTable(table);

        return "SELECT COUNT(*) FROM (SELECT TOP 1 * FROM " + table + Strings.nullToEmpty(whereClause) + ") d";
    }

    public static String selectQuery(final String table, final Object bag) {
        checkTable(table);

        return "SELECT * FROM " + table + buildWhereClause(bag);
    }

    /**
     * Inserts a node. Without a column list the values must follow the table's column order.
     *
     * @param table the node table
     * @param bag the values
     * @param withColumns whether to list the columns
     * @return {@code "INSERT INTO t(a,b) VALUES(@a,@b)"} or {@code "INSERT INTO t VALUES(@a,@b)"}
     */
    public static String insertNodeQuery(final String table, final Object bag, final boolean withColumns) {
        checkTable(table);

        final Map<String, Object> map = ParameterBinder.toMap(bag);
        final String values = valueNames(map);

        if (withColumns) {
            return "INSERT INTO " + table + "(" + columnNames(map) + ") VALUES(" + values + ")";
        }

        return "INSERT INTO " + table + " VALUES(" + values + ")";
    }

    /**
     * @return {@code "INSERT INTO e VALUES(@_from_id, @_to_id, @a)"}
     */
    public static String insertEdgeQuery(final String edge, final Object bag) {
        checkTable(edge);

        final String values = valueNames(ParameterBinder.toMap(bag));

        return "INSERT INTO " + edge + " VALUES(@" + FROM_ID_PARAM + ", @" + TO_ID_PARAM + (values.isEmpty() ? "" : ", " + values) + ")";
    }

    /**
     * @return {@code "UPDATE t SET a = @a <where>;"} with the WHERE placeholders prefixed by {@link #WHERE_PARAM_PREFIX}
     */
    public static String updateNodeQuery(final String table, final Object bag, final Object whereBag) {
        checkTable(table);

        return "UPDATE " + table + " SET " + buildAssignments(bag) + buildWhereClause(whereBag, true, WHERE_PARAM_PREFIX) + ";";
    }

    /**
     * @return {@code "UPDATE t SET a = @a WHERE $node_id = @_id;"}
     */
    public static String updateNodeByIdQuery(final String table, final Object bag) {
        checkTable(table);

        return "UPDATE " + table + " SET " + buildAssignments(bag) + " WHERE " + SIGIL + NODE_ID + " = @" + ID_PARAM + ";";
    }

    public static String updateEdgeQuery(final String edge, final Object bag, final Object whereBag) {
        checkTable(edge);

        return "UPDATE " + edge + " SET " + buildAssignments(bag) + buildEdgeWhereClause(true, true, whereBag, WHERE_PARAM_PREFIX) + ";";
    }

    public static String deleteNodeQuery(final String table, final Object bag) {
        checkTable(table);

        return "DELETE FROM " + table + buildWhereClause(bag);
    }

    public static String deleteEdgeQuery(final String edge, final boolean hasFrom, final boolean hasTo, final Object bag) {
        checkTable(edge);

        return "DELETE FROM " + edge + buildEdgeWhereClause(hasFrom, hasTo, bag);
    }

    /**
     * @return {@code "DELETE FROM t WHERE $node_id = @_id"}, or {@code $edge_id} when {@code isNode} is {@code false}
     */
    public static String deleteByIdQuery(final String table, final boolean isNode) {
        checkTable(table);

        return "DELETE FROM " + table + " WHERE " + SIGIL + (isNode ? NODE_ID : EDGE_ID) + " = @" + ID_PARAM;
    }

    /**
     * @return {@code " FROM a, e, b WHERE MATCH(a-(e)->b)"}
     */
    public static String matchClause(final String fromNode, final String edge, final String toNode) {
        checkTable(fromNode);
        checkTable(edge);
        checkTable(toNode);

        return " FROM " + fromNode + ", " + edge + ", " + toNode + " WHERE MATCH(" + fromNode + "-(" + edge + ")->" + toNode + ")";
    }

    /**
     * Selects the columns of {@code toNode} reachable from the {@code fromNode} rows whose {@code $node_id} is {@code @_from_id}.
     */
    public static String connectedNodesQuery(final String fromNode, final String edge, final String toNode) {
        return "SELECT " + toNode + ".*" + matchClause(fromNode, edge, toNode) + " AND " + fromNode + "." + SIGIL + NODE_ID + " = @" + FROM_ID_PARAM;
    }

    private static String columnNames(final Map<String, Object> map) {
        return String.join(",", map.keySet());
    }

    private static String valueNames(final Map<String, Object> map) {
        final List<String> names = new ArrayList<>(map.size());

        for (final String name : map.keySet()) {
            names.add("@" + name);
        }

        return String.join(",", names);
    }

    private static void checkTable(final String table) {
        N.checkArgNotEmpty(table, "table");
    }
}
