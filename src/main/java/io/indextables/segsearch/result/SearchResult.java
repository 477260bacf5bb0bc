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

package io.indextables.segsearch.result;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Represents the result of a search operation.
 * Hits are in the engine's relevance order; the order of equally scored
 * hits is not specified.
 */
public class SearchResult implements Iterable<SearchResult.Hit> {
    private static final SearchResult EMPTY = new SearchResult(Collections.emptyList());

    private final List<Hit> hits;

    public SearchResult(List<Hit> hits) {
        this.hits = Collections.unmodifiableList(new ArrayList<>(hits));
    }

    /**
     * Create an empty search result with no hits.
     * @return An empty SearchResult
     */
    public static SearchResult empty() {
        return EMPTY;
    }

    /**
     * Get the search hits.
     * @return List of search hits
     */
    public List<Hit> getHits() {
        return hits;
    }

    public int size() {
        return hits.size();
    }

    public boolean isEmpty() {
        return hits.isEmpty();
    }

    /**
     * Get the hits as plain field to value maps.
     * @return One map per hit, in hit order
     */
    public List<Map<String, String>> toMaps() {
        List<Map<String, String>> maps = new ArrayList<>(hits.size());
        for (Hit hit : hits) {
            maps.add(hit.getFields());
        }
        return maps;
    }

    @Override
    public Iterator<Hit> iterator() {
        return hits.iterator();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof SearchResult)) return false;
        return hits.equals(((SearchResult) o).hits);
    }

    @Override
    public int hashCode() {
        return hits.hashCode();
    }

    @Override
    public String toString() {
        return "SearchResult{hits=" + hits + "}";
    }

    /**
     * Represents a single search hit.
     */
    public static class Hit {
        private final float score;
        private final Map<String, String> fields;

        public Hit(float score, Map<String, String> fields) {
            this.score = score;
            this.fields = Collections.unmodifiableMap(new LinkedHashMap<>(fields));
        }

        /**
         * Get the relevance score.
         * @return Score
         */
        public float getScore() {
            return score;
        }

        /**
         * Get the stored field values of this hit.
         * @return Field to value map
         */
        public Map<String, String> getFields() {
            return fields;
        }

        /**
         * Get one stored value.
         * @param field Field name
         * @return Value, or null if absent from this hit
         */
        public String get(String field) {
            return fields.get(field);
        }

        @Override
        public boolean equals(Object o) {
            if (this == o) return true;
            if (!(o instanceof Hit)) return false;
            Hit other = (Hit) o;
            return Float.compare(score, other.score) == 0 && fields.equals(other.fields);
        }

        @Override
        public int hashCode() {
            return 31 * Float.hashCode(score) + fields.hashCode();
        }

        @Override
        public String toString() {
            return "Hit{score=" + score + ", fields=" + fields + "}";
        }
    }
}
