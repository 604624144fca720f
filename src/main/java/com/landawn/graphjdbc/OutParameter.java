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

import com.landawn.abacus.util.ClassUtil;
import com.landawn.abacus.util.N;

/**
 * Typed handle to an output, input/output or return-value parameter.
 * The value can be read only after the owning {@link QueryExecutor} has finished executing.
 *
 * <pre>{@code
 * final OutParameter<Integer> total = OutParameter.of(Integer.class);
 *
 * context.prepare("usp_CountFriends", CommandType.STORED_PROCEDURE)
 *         .addParameter("name", "Alice")
 *         .addOutParameter("total", total)
 *         .executeNonQuery();
 *
 * total.getValue();
 * }</pre>
 *
 * @param <T> the type the raw value is converted to
 */
public final class OutParameter<T> {

    private final Class<T> targetType;

    private QueryParameter parameter;

    private volatile boolean completed;

    private OutParameter(final Class<T> targetType) {
        this.targetType = targetType;
    }

    public static <T> OutParameter<T> of(final Class<T> targetType) {
        N.checkArgNotNull(targetType, "targetType");

        return new OutParameter<>(targetType);
    }

    public Class<T> targetType() {
        return targetType;
    }

    /**
     * @return {@code true} once the owning execution has completed and the value can be read
     */
    public boolean isAvailable() {
        return completed;
    }

    /**
     * Returns the value written by the backend, converted to {@code T}.
     *
     * @return the converted value, or {@code null} for SQL NULL when {@code T} is a reference type
     * @throws IllegalStateException if execution has not completed, or if the value is SQL NULL and {@code T} is primitive
     */
    public T getValue() throws IllegalStateException {
        if (!completed) {
            throw new IllegalStateException("The value of output parameter '" + (parameter == null ? "?" : parameter.getName())
                    + "' is not available until execution completes");
        }

        final Object raw = parameter.getValue();

        if (raw == null) {
            if (ClassUtil.isPrimitiveType(targetType)) {
                throw new IllegalStateException(
                        "Output parameter '" + parameter.getName() + "' is NULL and can't be read as primitive type " + targetType.getName());
            }

            return null;
        }

        return N.convert(raw, targetType);
    }

    void attach(final QueryParameter parameter) {
        if (this.parameter != null) {
            throw new IllegalStateException("Output parameter is already bound to '" + this.parameter.getName() + "'");
        }

        this.parameter = parameter;
    }

    void complete() {
        completed = true;
    }

    DbType dbType() {
        final DbType dbType = DbType.valueOf(targetType);

        return dbType == null ? DbType.STRING : dbType;
    }

    @Override
    public String toString() {
        return "OutParameter{name=" + (parameter == null ? null : parameter.getName()) + ", targetType=" + targetType.getSimpleName() + ", completed="
                + completed + "}";
    }
}
