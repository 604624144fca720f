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
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import com.landawn.abacus.parser.ParserUtil;
import com.landawn.abacus.parser.ParserUtil.PropInfo;
import com.landawn.abacus.util.Beans;

/**
 * Turns a parameter source into {@link QueryParameter}s.
 * A source is either a {@code Map} of names to values or a bean whose readable properties are the parameters.
 * Bean metadata is resolved once per class by {@link ParserUtil#getBeanInfo(Class)}.
 * Any other object has no readable property and binds nothing.
 */
public final class ParameterBinder {

    private ParameterBinder() {
        // utility class.
    }

    /**
     * Binds every entry or property of {@code source} as an input parameter.
     *
     * @param source a {@code Map}, a bean, or {@code null}
     * @return the parameters in entry or property declaration order; empty for a {@code null} source or one without readable properties
     * @throws IllegalArgumentException if a {@code Map} source contains a {@code null} key
     */
    public static List<QueryParameter> bind(final Object source) {
        if (source == null) {
            return Collections.emptyList();
        }

        final List<QueryParameter> result = new ArrayList<>();

        if (source instanceof Map) {
            for (final Map.Entry<?, ?> entry : ((Map<?, ?>) source).entrySet()) {
                final Object value = entry.getValue();
                result.add(toParameter(nameOf(entry.getKey()), value, value == null ? null : value.getClass()));
            }
        } else {
            for (final PropInfo propInfo : propInfosOf(source)) {
                result.add(toParameter(propInfo.name, propInfo.getPropValue(source), propInfo.clazz));
            }
        }

        return result;
    }

    /**
     * Reads {@code source} as an ordered name to value map.
     *
     * @param source a {@code Map}, a bean, or {@code null}
     * @return an insertion-ordered map; empty for a {@code null} source or one without readable properties
     */
    public static Map<String, Object> toMap(final Object source) {
        final Map<String, Object> result = new LinkedHashMap<>();

        if (source == null) {
            return result;
        }

        if (source instanceof Map) {
            for (final Map.Entry<?, ?> entry : ((Map<?, ?>) source).entrySet()) {
                result.put(nameOf(entry.getKey()), entry.getValue());
            }
        } else {
            for (final PropInfo propInfo : propInfosOf(source)) {
                result.put(propInfo.name, propInfo.getPropValue(source));
            }
        }

        return result;
    }

    /**
     * Creates an input parameter, choosing its kind from {@code declaredType}.
     * Types outside {@link DbType} are bound as a nullable {@link DbType#STRING} holding {@code value.toString()}.
     *
     * @param name the parameter name
     * @param value may be {@code null}
     * @param declaredType the declared type, or {@code null} to treat the value as an untyped string
     * @return the parameter
     */
    public static QueryParameter toParameter(final String name, final Object value, final Class<?> declaredType) {
        final DbType dbType = DbType.valueOf(declaredType);

        if (dbType == null) {
            return QueryParameter.input(name, value == null ? null : value.toString(), DbType.STRING, true);
        }

        return QueryParameter.input(name, value, dbType, !declaredType.isPrimitive());
    }

    private static String nameOf(final Object key) {
        if (key == null) {
            throw new IllegalArgumentException("Parameter map contains a null key");
        }

        return key.toString();
    }

    private static List<PropInfo> propInfosOf(final Object source) {
        final Class<?> cls = source.getClass();

        if (!(Beans.isBeanClass(cls) || Beans.isRecordClass(cls))) {
            return Collections.emptyList();
        }

        return ParserUtil.getBeanInfo(cls).propInfoList;
    }
}
