/*
 * Licensed to the Apache Software Foundation (ASF) under one
 * or more contributor license agreements.  See the NOTICE file
 * distributed with this work for additional information
 * regarding copyright ownership.  The ASF licenses this file
 * to you under the Apache License, Version 2.0 (the
 * "License"); you may not use this file except in compliance
 * with the License.  You may obtain a copy of the License at
 *
 *   http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing,
 * software distributed under the License is distributed on an
 * "AS IS" BASIS, WITHOUT WARRANTIES OR CONDITIONS OF ANY
 * KIND, either express or implied.  See the License for the
 * specific language governing permissions and limitations
 * under the License.
 */

package io.indextables.segsearch.core;

import io.indextables.segsearch.exception.SchemaException;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Builder for creating schemas.
 * Provides methods to add fields with different capabilities.
 *
 * <pre>{@code
 * Schema schema = new SchemaBuilder()
 *     .addExactField("id", true)
 *     .addTextField("body", false)
 *     .build();
 * }</pre>
 */
public class SchemaBuilder {
    private final Map<String, FieldCapabilities> fields = new LinkedHashMap<>();

    /**
     * Add a full-text searchable field.
     * @param name Field name
     * @param stored Whether the value is returned with hits
     * @return This builder for method chaining
     */
    public SchemaBuilder addTextField(String name, boolean stored) {
        return addField(name, new FieldCapabilities(false, true, stored));
    }

    /**
     * Add a field matched only as a whole value.
     * @param name Field name
     * @param stored Whether the value is returned with hits
     * @return This builder for method chaining
     */
    public SchemaBuilder addExactField(String name, boolean stored) {
        return addField(name, new FieldCapabilities(true, false, stored));
    }

    /**
     * Add a retrieval-only field. It is returned with hits but never matched.
     * @param name Field name
     * @return This builder for method chaining
     */
    public SchemaBuilder addStoredField(String name) {
        return addField(name, FieldCapabilities.STORED);
    }

    /**
     * Add a field with explicit capabilities.
     * @param name Field name
     * @param capabilities Field capabilities
     * @return This builder for method chaining
     * @throws SchemaException if the name is invalid or already declared
     */
    public SchemaBuilder addField(String name, FieldCapabilities capabilities) {
        Schema.validateFieldName(name);
        if (fields.containsKey(name)) {
            throw new SchemaException("Field '" + name + "' is already declared");
        }
        fields.put(name, capabilities);
        return this;
    }

    /**
     * Build the schema.
     * @return A validated, immutable schema
     * @throws SchemaException if no field was added or a field has no capability
     */
    public Schema build() {
        return Schema.of(fields);
    }
}
