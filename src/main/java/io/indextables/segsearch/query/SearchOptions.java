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

package io.indextables.segsearch.query;

import io.indextables.segsearch.config.SegSearchConfig;
import io.indextables.segsearch.exception.ConfigException;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

/**
 * Options of a {@code SearchIndex.search} call.
 *
 * <pre>{@code
 * SearchOptions options = new SearchOptions()
 *     .withLimit(10)
 *     .withFields("id", "title");
 * }</pre>
 */
public class SearchOptions {
    private Integer limit;
    private List<String> fields;

    /**
     * Cap the number of hits. A limit of 0 returns no hits.
     * @param limit Maximum number of hits, zero or positive
     * @return This options object for chaining
     * @throws ConfigException if the limit is negative
     */
    public SearchOptions withLimit(int limit) {
        if (limit < 0) {
            throw new ConfigException("Search limit must not be negative, got " + limit);
        }
        this.limit = limit;
        return this;
    }

    /**
     * Restrict the stored fields returned with each hit.
     * @param fields Field names; all stored fields are returned if never called
     * @return This options object for chaining
     */
    public SearchOptions withFields(String... fields) {
        if (fields == null) {
            throw new IllegalArgumentException("Fields cannot be null");
        }
        return withFields(Arrays.asList(fields));
    }

    /**
     * Restrict the stored fields returned with each hit.
     * @param fields Field names; all stored fields are returned if never called
     * @return This options object for chaining
     */
    public SearchOptions withFields(List<String> fields) {
        if (fields == null) {
            throw new IllegalArgumentException("Fields cannot be null");
        }
        for (String field : fields) {
            if (field == null) {
                throw new IllegalArgumentException("Field names cannot be null");
            }
        }
        this.fields = Collections.unmodifiableList(new ArrayList<>(fields));
        return this;
    }

    /**
     * Effective hit limit.
     * @return The configured limit, or {@link SegSearchConfig#getDefaultSearchLimit()}
     */
    public int getLimit() {
        return limit != null ? limit : SegSearchConfig.getDefaultSearchLimit();
    }

    /**
     * Requested fields.
     * @return Field names, or null when all stored fields are wanted
     */
    public List<String> getFields() {
        return fields;
    }

    @Override
    public String toString() {
        return "SearchOptions{limit=" + getLimit() + ", fields=" + (fields == null ? "<all stored>" : fields) + "}";
    }
}
