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

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;

import io.indextables.segsearch.exception.SchemaException;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Immutable set of named fields and their {@link FieldCapabilities}.
 *
 * <p>A schema is shared by reference between a {@link SegmentBuilder} and
 * every segment derived from it, and it travels inside exported segment
 * bytes. Fields are kept in name order so that equal schemas always
 * serialize to the same JSON.</p>
 *
 * <p>JSON form, as accepted by {@link #fromJson(String)}:</p>
 * <pre>
 * {
 *   "id":   {"exact": true, "stored": true},
 *   "body": {"text": true}
 * }
 * </pre>
 * Missing flags default to false; {@code string} is accepted for {@code exact}.
 */
public final class Schema {
    /** Suffix reserved for the exact-match twin of a field that is also text searchable. */
    public static final String EXACT_SUFFIX = "$exact";

    private static final ObjectMapper MAPPER = new ObjectMapper()
        .enable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);

    private final Map<String, FieldCapabilities> fields;

    private Schema(Map<String, FieldCapabilities> fields) {
        this.fields = Collections.unmodifiableMap(new TreeMap<>(fields));
    }

    /**
     * Create a schema from a field to capabilities mapping.
     * @param fields Field definitions
     * @return A validated schema
     * @throws SchemaException if the mapping is empty, a name is invalid or a field has no capability
     */
    public static Schema of(Map<String, FieldCapabilities> fields) {
        if (fields == null || fields.isEmpty()) {
            throw new SchemaException("Schema must declare at least one field");
        }
        for (Map.Entry<String, FieldCapabilities> entry : fields.entrySet()) {
            validateFieldName(entry.getKey());
            FieldCapabilities capabilities = entry.getValue();
            if (capabilities == null || !capabilities.isAnySet()) {
                throw new SchemaException("Field '" + entry.getKey()
                    + "' must enable at least one of exact, text or stored");
            }
        }
        return new Schema(fields);
    }

    /**
     * Create a schema from its JSON form.
     * @param json JSON object mapping field names to capability objects
     * @return A validated schema
     * @throws SchemaException if the JSON is malformed or describes an invalid schema
     */
    public static Schema fromJson(String json) {
        if (json == null || json.isEmpty()) {
            throw new SchemaException("Schema JSON cannot be null or empty");
        }
        Map<String, FieldCapabilities> parsed;
        try {
            parsed = MAPPER.readValue(json, new TypeReference<LinkedHashMap<String, FieldCapabilities>>() {});
        } catch (JsonProcessingException e) {
            throw new SchemaException("Invalid schema JSON: " + e.getOriginalMessage(), e);
        }
        return of(parsed);
    }

    static void validateFieldName(String name) {
        if (name == null || name.isBlank()) {
            throw new SchemaException("Field names cannot be null or blank");
        }
        if (name.endsWith(EXACT_SUFFIX)) {
            throw new SchemaException("Field name '" + name + "' uses the reserved suffix " + EXACT_SUFFIX);
        }
    }

    /**
     * Serialize this schema to JSON. The output is stable for equal schemas.
     * @return JSON object string
     */
    public String toJson() {
        try {
            return MAPPER.writeValueAsString(fields);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize schema", e);
        }
    }

    /**
     * Get all field names, in name order.
     * @return List of field names
     */
    public List<String> getFieldNames() {
        return new ArrayList<>(fields.keySet());
    }

    /**
     * Get the capabilities of a field.
     * @param fieldName The name of the field
     * @return Capabilities, or null if the field is not declared
     */
    public FieldCapabilities getFieldCapabilities(String fieldName) {
        return fields.get(fieldName);
    }

    /**
     * Check if a field exists in the schema.
     * @param fieldName The name of the field to check
     * @return true if the field exists, false otherwise
     */
    public boolean hasField(String fieldName) {
        return fields.containsKey(fieldName);
    }

    /**
     * Get the number of fields in the schema.
     * @return Number of fields
     */
    public int getFieldCount() {
        return fields.size();
    }

    /**
     * Get the fields whose values are returned with hits.
     * @return Stored field names, in name order
     */
    public List<String> getStoredFieldNames() {
        List<String> names = new ArrayList<>();
        for (Map.Entry<String, FieldCapabilities> entry : fields.entrySet()) {
            if (entry.getValue().isStored()) {
                names.add(entry.getKey());
            }
        }
        return names;
    }

    /**
     * Get the fields a query can match.
     * @return Exact or text searchable field names, in name order
     */
    public List<String> getSearchableFieldNames() {
        List<String> names = new ArrayList<>();
        for (Map.Entry<String, FieldCapabilities> entry : fields.entrySet()) {
            if (entry.getValue().isSearchable()) {
                names.add(entry.getKey());
            }
        }
        return names;
    }

    /**
     * Get all field definitions.
     * @return Unmodifiable name-ordered map
     */
    public Map<String, FieldCapabilities> getFields() {
        return fields;
    }

    /**
     * Get a summary of the schema structure.
     * @return One line per field, e.g. {@code id: EXACT|STORED}
     */
    public String getSchemaSummary() {
        StringBuilder sb = new StringBuilder();
        sb.append("Schema with ").append(fields.size()).append(" field(s)\n");
        for (Map.Entry<String, FieldCapabilities> entry : fields.entrySet()) {
            sb.append("  ").append(entry.getKey()).append(": ").append(entry.getValue()).append('\n');
        }
        return sb.toString();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Schema)) return false;
        return fields.equals(((Schema) o).fields);
    }

    @Override
    public int hashCode() {
        return fields.hashCode();
    }

    @Override
    public String toString() {
        return "Schema" + fields;
    }
}
