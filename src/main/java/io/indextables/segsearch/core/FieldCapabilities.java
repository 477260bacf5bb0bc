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

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

/**
 * Capabilities of one schema field.
 *
 * <ul>
 *   <li><b>exact</b> - indexed as a single untokenized term (JSON alias {@code string})</li>
 *   <li><b>text</b> - tokenized and indexed for full-text search</li>
 *   <li><b>stored</b> - value kept in the segment and returned with hits</li>
 * </ul>
 *
 * A field needs at least one capability. A field that is only {@code stored}
 * is retrievable but never matched by queries.
 */
@JsonPropertyOrder({"exact", "text", "stored"})
@JsonIgnoreProperties({"fast", "indexed"})
public final class FieldCapabilities {
    public static final FieldCapabilities TEXT = new FieldCapabilities(false, true, false);
    public static final FieldCapabilities TEXT_STORED = new FieldCapabilities(false, true, true);
    public static final FieldCapabilities EXACT = new FieldCapabilities(true, false, false);
    public static final FieldCapabilities EXACT_STORED = new FieldCapabilities(true, false, true);
    public static final FieldCapabilities STORED = new FieldCapabilities(false, false, true);

    private final boolean exact;
    private final boolean text;
    private final boolean stored;

    public FieldCapabilities(boolean exact, boolean text, boolean stored) {
        this.exact = exact;
        this.text = text;
        this.stored = stored;
    }

    @JsonCreator
    static FieldCapabilities fromJson(@JsonProperty("exact") @JsonAlias("string") Boolean exact,
                                      @JsonProperty("text") Boolean text,
                                      @JsonProperty("stored") Boolean stored) {
        return new FieldCapabilities(Boolean.TRUE.equals(exact), Boolean.TRUE.equals(text),
            Boolean.TRUE.equals(stored));
    }

    @JsonProperty("exact")
    public boolean isExact() {
        return exact;
    }

    @JsonProperty("text")
    public boolean isText() {
        return text;
    }

    @JsonProperty("stored")
    public boolean isStored() {
        return stored;
    }

    /**
     * Check whether queries can match this field.
     * @return true if the field is exact or text searchable
     */
    @JsonIgnore
    public boolean isSearchable() {
        return exact || text;
    }

    /**
     * Check whether at least one capability is set.
     * @return false when every flag is false
     */
    @JsonIgnore
    public boolean isAnySet() {
        return exact || text || stored;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof FieldCapabilities)) return false;
        FieldCapabilities other = (FieldCapabilities) o;
        return exact == other.exact && text == other.text && stored == other.stored;
    }

    @Override
    public int hashCode() {
        return (exact ? 4 : 0) | (text ? 2 : 0) | (stored ? 1 : 0);
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        if (exact) sb.append("EXACT|");
        if (text) sb.append("TEXT|");
        if (stored) sb.append("STORED|");
        return sb.length() == 0 ? "NONE" : sb.substring(0, sb.length() - 1);
    }
}
