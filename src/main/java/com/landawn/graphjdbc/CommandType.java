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
 * How the command text of a {@link QueryExecutor} is interpreted.
 */
public enum CommandType {

    /**
     * Free SQL text with {@code @name} placeholders.
     */
    TEXT,

    /**
     * The name of a stored procedure. Parameters are passed by position, in the order they are added.
     */
    STORED_PROCEDURE
}
