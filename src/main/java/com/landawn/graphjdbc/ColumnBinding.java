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

import com.landawn.abacus.parser.ParserUtil.PropInfo;
import com.landawn.abacus.util.N;

/**
 * Copies one result column into one property of a record.
 */
public final class ColumnBinding {

    private final int columnIndex;

    private final String columnName;

    private final PropInfo propInfo;

    ColumnBinding(final int columnIndex, final String columnName, final PropInfo propInfo) {
        this.columnIndex = columnIndex;
        this.columnName = columnName;
        this.propInfo = propInfo;
    }

    /**
     * @return the 1-based column index
     */
    public int columnIndex() {
        return columnIndex;
    }

    public String columnName() {
        return columnName;
    }

    public String propName() {
        return propInfo.name;
    }

    /**
     * Reads the column from the current row and sets it on {@code record}. SQL NULL sets the default value of the property type.
     *
     * @param rs positioned on a row
     * @param record the target instance
     * @throws SQLException if the column can't be read
     */
    public void apply(final ResultSet rs, final Object record) throws SQLException {
        final Object value = propInfo.dbType.get(rs, columnIndex);

        propInfo.setPropValue(record, value == null ? N.defaultValueOf(propInfo.clazz) : value);
    }

    @Override
    public String toString() {
        return columnIndex + ":" + columnName + "->" + propInfo.name;
    }
}
