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

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.ConcurrentHashMap;

import com.landawn.abacus.util.N;

/**
 * SQL text with {@code @name} placeholders, translated to JDBC {@code ?} markers.
 * Placeholders inside string literals, {@code [quoted]} identifiers and comments are left alone,
 * as are {@code @@} system variables. A name may occur several times.
 *
 * <p>Local variables declared in the same text are not placeholders either. A name counts as declared when it directly
 * follows {@code DECLARE}, or follows a top-level comma of the same declaration, which ends at {@code ;} or the end of the line:</p>
 * <pre>{@code
 * DECLARE @n INT, @t NVARCHAR(20);
 * SELECT @n = COUNT(*) FROM Person WHERE age > @age;   -- only @age becomes '?'
 * }</pre>
 */
public final class NamedSql {

    private static final int CACHE_SIZE = 1024;

    private static final Map<String, NamedSql> cache = new ConcurrentHashMap<>();

    private final String sql;

    private final String parameterizedSql;

    private final List<String> parameterNames;

    private NamedSql(final String sql, final String parameterizedSql, final List<String> parameterNames) {
        this.sql = sql;
        this.parameterizedSql = parameterizedSql;
        this.parameterNames = parameterNames;
    }

    /**
     * Parses {@code sql}. Results are cached by text.
     *
     * @param sql the SQL text
     * @return the parsed form
     */
    public static NamedSql parse(final String sql) {
        N.checkArgNotEmpty(sql, "sql");

        NamedSql result = cache.get(sql);

        if (result == null) {
            result = doParse(sql);

            if (cache.size() < CACHE_SIZE) {
                cache.put(sql, result);
            }
        }

        return result;
    }

    private static NamedSql doParse(final String sql) {
        final int len = sql.length();
        final Set<String> localVariables = declaredVariables(sql);
        final StringBuilder sb = new StringBuilder(len);
        final List<String> names = new ArrayList<>();

        for (int i = 0; i < len; i++) {
            final char ch = sql.charAt(i);
            final int skipTo = skipQuotedOrComment(sql, i);

            if (skipTo > 0) {
                sb.append(sql, i, skipTo);
                i = skipTo - 1;
            } else if (ch == '@' && i + 1 < len && sql.charAt(i + 1) == '@') {
                sb.append("@@");
                i++;
            } else if (ch == '@' && i + 1 < len && isNameStart(sql.charAt(i + 1))) {
                final int end = nameEnd(sql, i + 1);
                final String name = sql.substring(i + 1, end);

                if (localVariables.contains(name)) {
                    sb.append(sql, i, end);
                } else {
                    names.add(name);
                    sb.append('?');
                }

                i = end - 1;
            } else {
                sb.append(ch);
            }
        }

        return new NamedSql(sql, sb.toString(), Collections.unmodifiableList(names));
    }

    private static Set<String> declaredVariables(final String sql) {
        final Set<String> result = new TreeSet<>(String.CASE_INSENSITIVE_ORDER);
        final int len = sql.length();
        boolean inDeclare = false;
        boolean expectName = false;
        int depth = 0;

        for (int i = 0; i < len; i++) {
            final char ch = sql.charAt(i);
            final int skipTo = skipQuotedOrComment(sql, i);

            if (skipTo > 0) {
                i = skipTo - 1;
            } else if (ch == '@' && i + 1 < len && sql.charAt(i + 1) == '@') {
                i++;
            } else if (ch == '@' && i + 1 < len && isNameStart(sql.charAt(i + 1))) {
                final int end = nameEnd(sql, i + 1);

                if (expectName) {
                    result.add(sql.substring(i + 1, end));
                    expectName = false;
                }

                i = end - 1;
            } else if (isNameStart(ch)) {
                final int end = nameEnd(sql, i);

                if ("DECLARE".equalsIgnoreCase(sql.substring(i, end))) {
                    inDeclare = true;
                    expectName = true;
                    depth = 0;
                } else {
                    expectName = false;
                }

                i = end - 1;
            } else if (ch == ';' || ch == '\n') {
                inDeclare = false;
                expectName = false;
            } else if (inDeclare && ch == '(') {
                depth++;
            } else if (inDeclare && ch == ')') {
                depth--;
            } else if (inDeclare && ch == ',' && depth == 0) {
                expectName = true;
            } else if (!Character.isWhitespace(ch)) {
                expectName = false;
            }
        }

        return result;
    }

    /**
     * @return the index after the literal, quoted identifier or comment starting at {@code i}, or -1 if none starts there
     */
    private static int skipQuotedOrComment(final String sql, final int i) {
        final int len = sql.length();
        final char ch = sql.charAt(i);

        if (ch == '\'' || ch == '"' || ch == '[') {
            final int end = sql.indexOf(ch == '[' ? ']' : ch, i + 1);
            return end < 0 ? len : end + 1;
        } else if (ch == '-' && i + 1 < len && sql.charAt(i + 1) == '-') {
            final int end = sql.indexOf('\n', i);
            return end < 0 ? len : end;
        } else if (ch == '/' && i + 1 < len && sql.charAt(i + 1) == '*') {
            final int end = sql.indexOf("*/", i + 2);
            return end < 0 ? len : end + 2;
        }

        return -1;
    }

    private static int nameEnd(final String sql, final int from) {
        int j = from;

        while (j < sql.length() && isNamePart(sql.charAt(j))) {
            j++;
        }

        return j;
    }

    private static boolean isNameStart(final char ch) {
        return Character.isLetter(ch) || ch == '_';
    }

    private static boolean isNamePart(final char ch) {
        return Character.isLetterOrDigit(ch) || ch == '_';
    }

    public String sql() {
        return sql;
    }

    /**
     * @return the text with every placeholder replaced by {@code ?}
     */
    public String parameterizedSql() {
        return parameterizedSql;
    }

    /**
     * @return placeholder names in order of occurrence, one entry per {@code ?}
     */
    public List<String> parameterNames() {
        return parameterNames;
    }

    public int parameterCount() {
        return parameterNames.size();
    }

    @Override
    public String toString() {
        return "NamedSql{sql=" + sql + ", parameterizedSql=" + parameterizedSql + ", parameterNames=" + parameterNames + "}";
    }
}
