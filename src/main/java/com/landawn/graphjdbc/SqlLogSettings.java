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

import com.landawn.abacus.util.Strings;

/**
 * Immutable snapshot of the SQL log switches of one thread.
 * A thread replaces its snapshot instead of mutating it, so a snapshot captured for an async task stays stable.
 */
final class SqlLogSettings {

    static final SqlLogSettings DEFAULT = new SqlLogSettings(false, GraphJdbcUtil.DEFAULT_MIN_EXECUTION_TIME_FOR_SQL_PERF_LOG,
            GraphJdbcUtil.DEFAULT_MAX_SQL_LOG_LENGTH);

    final boolean sqlLogEnabled;

    // negative: perf log off.
    final long minExecutionTimeForSqlPerfLog;

    final int maxSqlLogLength;

    private SqlLogSettings(final boolean sqlLogEnabled, final long minExecutionTimeForSqlPerfLog, final int maxSqlLogLength) {
        this.sqlLogEnabled = sqlLogEnabled;
        this.minExecutionTimeForSqlPerfLog = minExecutionTimeForSqlPerfLog;
        this.maxSqlLogLength = maxSqlLogLength <= 0 ? GraphJdbcUtil.DEFAULT_MAX_SQL_LOG_LENGTH : maxSqlLogLength;
    }

    SqlLogSettings withSqlLog(final boolean enabled, final int maxLength) {
        return new SqlLogSettings(enabled, minExecutionTimeForSqlPerfLog, maxLength);
    }

    SqlLogSettings withPerfLog(final long minExecutionTime, final int maxLength) {
        return new SqlLogSettings(sqlLogEnabled, minExecutionTime, maxLength);
    }

    boolean isSlow(final long elapsedTime) {
        return minExecutionTimeForSqlPerfLog >= 0 && elapsedTime >= minExecutionTimeForSqlPerfLog;
    }

    String abbreviate(final String sql) {
        return sql.length() <= maxSqlLogLength ? sql : Strings.abbreviate(sql, maxSqlLogLength);
    }
}
