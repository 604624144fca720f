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

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * One named, typed and directional parameter of a command.
 * The {@code value} of an output parameter is written by {@link QueryExecutor} once execution completes.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public final class QueryParameter {

    private String name;

    private Object value;

    private ParameterDirection direction = ParameterDirection.INPUT;

    private DbType dbType = DbType.STRING;

    /**
     * {@code true} if the value comes from a reference type and may be {@code null}.
     */
    private boolean nullable = true;

    private int size;

    private int precision;

    private int scale;

    /**
     * Creates an input parameter.
     *
     * @param name the parameter name, without the {@code @} prefix
     * @param value may be {@code null}
     * @param dbType the declared kind
     * @param nullable whether {@code value} comes from a nullable type
     * @return a new parameter
     */
    public static QueryParameter input(final String name, final Object value, final DbType dbType, final boolean nullable) {
        return new QueryParameter(name, value, ParameterDirection.INPUT, dbType, nullable, 0, 0, 0);
    }

    public static QueryParameter of(final String name, final Object value, final ParameterDirection direction, final DbType dbType, final int size,
            final int precision, final int scale) {
        return new QueryParameter(name, value, direction, dbType, true, size, precision, scale);
    }
}
