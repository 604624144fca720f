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

import java.math.BigDecimal;
import java.sql.CallableStatement;
import java.sql.PreparedStatement;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.sql.Types;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;

import com.landawn.abacus.util.ClassUtil;
import com.landawn.abacus.util.N;

/**
 * The closed set of scalar kinds a {@link QueryParameter} can be declared with.
 * Types outside this set are bound as {@link #STRING} using their {@code toString()} value.
 */
public enum DbType {

    LONG(Types.BIGINT, long.class),

    INT(Types.INTEGER, int.class),

    BYTE(Types.TINYINT, byte.class),

    STRING(Types.NVARCHAR, String.class),

    FLOAT(Types.REAL, float.class),

    DOUBLE(Types.DOUBLE, double.class),

    BOOLEAN(Types.BIT, boolean.class),

    CHAR(Types.NCHAR, char.class),

    DATE_TIME(Types.TIMESTAMP, Timestamp.class),

    DECIMAL(Types.DECIMAL, BigDecimal.class);

    private final int sqlType;

    private final Class<?> javaType;

    DbType(final int sqlType, final Class<?> javaType) {
        this.sqlType = sqlType;
        this.javaType = javaType;
    }

    /**
     * @return the {@code java.sql.Types} code
     */
    public int sqlType() {
        return sqlType;
    }

    public Class<?> javaType() {
        return javaType;
    }

    /**
     * Maps a Java type to its kind. Wrapper types map to the kind of their primitive.
     *
     * @param cls the declared or runtime type of a value
     * @return the kind, or {@code null} if {@code cls} is not one of the supported scalar types
     */
    public static DbType valueOf(final Class<?> cls) {
        if (cls == null) {
            return null;
        }

        final Class<?> type = ClassUtil.isPrimitiveWrapper(cls) ? ClassUtil.unwrap(cls) : cls;

        if (type == long.class) {
            return LONG;
        } else if (type == int.class) {
            return INT;
        } else if (type == byte.class) {
            return BYTE;
        } else if (type == String.class) {
            return STRING;
        } else if (type == float.class) {
            return FLOAT;
        } else if (type == double.class) {
            return DOUBLE;
        } else if (type == boolean.class) {
            return BOOLEAN;
        } else if (type == char.class) {
            return CHAR;
        } else if (java.util.Date.class.isAssignableFrom(type) || type == LocalDateTime.class || type == LocalDate.class
                || type == OffsetDateTime.class) {
            return DATE_TIME;
        } else if (type == BigDecimal.class) {
            return DECIMAL;
        } else {
            return null;
        }
    }

    /**
     * Sets {@code value} at {@code parameterIndex}. {@code null} is bound as SQL NULL of this kind.
     *
     * @param stmt the statement
     * @param parameterIndex 1-based index
     * @param value may be {@code null}
     * @throws SQLException if the driver rejects the value
     */
    public void bind(final PreparedStatement stmt, final int parameterIndex, final Object value) throws SQLException {
        if (value == null) {
            stmt.setNull(parameterIndex, sqlType);
            return;
        }

        switch (this) {
            case LONG:
                stmt.setLong(parameterIndex, N.convert(value, long.class));
                break;

            case INT:
                stmt.setInt(parameterIndex, N.convert(value, int.class));
                break;

            case BYTE:
                stmt.setByte(parameterIndex, N.convert(value, byte.class));
                break;

            case FLOAT:
                stmt.setFloat(parameterIndex, N.convert(value, float.class));
                break;

            case DOUBLE:
                stmt.setDouble(parameterIndex, N.convert(value, double.class));
                break;

            case BOOLEAN:
                stmt.setBoolean(parameterIndex, N.convert(value, boolean.class));
                break;

            case CHAR:
            case STRING:
                stmt.setString(parameterIndex, value.toString());
                break;

            case DATE_TIME:
                stmt.setTimestamp(parameterIndex, toTimestamp(value));
                break;

            case DECIMAL:
                stmt.setBigDecimal(parameterIndex, value instanceof BigDecimal ? (BigDecimal) value : N.convert(value, BigDecimal.class));
                break;

            default:
                throw new IllegalStateException("Unsupported DbType: " + this);
        }
    }

    /**
     * Registers {@code parameterIndex} as an output slot of this kind.
     *
     * @param stmt the callable statement
     * @param parameterIndex 1-based index
     * @param scale only used by {@link #DECIMAL}
     * @throws SQLException if the driver rejects the registration
     */
    public void registerOut(final CallableStatement stmt, final int parameterIndex, final int scale) throws SQLException {
        if (this == DECIMAL && scale > 0) {
            stmt.registerOutParameter(parameterIndex, sqlType, scale);
        } else {
            stmt.registerOutParameter(parameterIndex, sqlType);
        }
    }

    static Timestamp toTimestamp(final Object value) {
        if (value instanceof Timestamp) {
            return (Timestamp) value;
        } else if (value instanceof java.util.Date) {
            return new Timestamp(((java.util.Date) value).getTime());
        } else if (value instanceof LocalDateTime) {
            return Timestamp.valueOf((LocalDateTime) value);
        } else if (value instanceof LocalDate) {
            return Timestamp.valueOf(((LocalDate) value).atStartOfDay());
        } else if (value instanceof OffsetDateTime) {
            return Timestamp.from(((OffsetDateTime) value).toInstant());
        } else {
            return N.convert(value, Timestamp.class);
        }
    }
}
