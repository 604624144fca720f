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
import java.sql.SQLException;
import java.util.List;

/**
 * The bindings from the columns of one result shape to the properties of one record type.
 * Instances are immutable and shared through the cache in {@link ResultMapper}.
 */
public final class FieldBindingSet {

    private final Class<?> targetType;

    private final List<String> columnNames;

    private final List<ColumnBinding> bindings;

    FieldBindingSet(final Class<?> targetType, final List<String> columnNames, final List<ColumnBinding> bindings) {
        this.targetType = targetType;
        this.columnNames = List.copyOf(columnNames);
        this.bindings = List.copyOf(bindings);
    }

    public Class<?> targetType() {
        return targetType;
    }

    public List<String> columnNames() {
        return columnNames;
    }

    /**
     * @return matched columns only, in column order
     */
    public List<ColumnBinding> bindings() {
        return bindings;
    }

    void applyTo(final ResultSet rs, final Object record) throws SQLException {
        for (final ColumnBinding binding : bindings) {
            binding.apply(rs, record);
        }
    }

    @Override
    public String toString() {
        return "FieldBindingSet{targetType=" + targetType.getSimpleName() + ", bindings=" + bindings + "}";
    }
}
