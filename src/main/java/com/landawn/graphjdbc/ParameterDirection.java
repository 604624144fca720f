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

/**
 * Direction of a {@link QueryParameter}.
 */
public enum ParameterDirection {

    INPUT,

    OUTPUT,

    INPUT_OUTPUT,

    /**
     * The value returned by a stored procedure. Only valid for {@link CommandType#STORED_PROCEDURE}.
     */
    RETURN_VALUE;

    /**
     * Whether the backend writes a value back into parameters of this direction.
     *
     * @return {@code true} for everything but {@link #INPUT}
     */
    public boolean isOutput() {
        return this != INPUT;
    }

    public boolean isInput() {
        return this == INPUT || this == INPUT_OUTPUT;
    }
}
