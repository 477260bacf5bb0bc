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

package io.indextables.segsearch.engine;

import java.util.List;
import java.util.Set;

/**
 * Read-only view over a fixed set of segments, used by a {@code SearchIndex}
 * until its registered set changes. Safe for concurrent searches.
 */
public interface EngineView extends AutoCloseable {

    /**
     * Run one query.
     * @param query Query text, interpreted by the engine
     * @param limit Maximum number of hits, positive
     * @param fields Stored fields to load for each hit
     * @return Hits in relevance order
     * @throws io.indextables.segsearch.exception.InvalidQueryException if the query cannot be parsed
     */
    List<EngineHit> search(String query, int limit, Set<String> fields);

    /**
     * Number of documents across all segments of the view.
     * @return Document count
     */
    int getNumDocs();

    @Override
    void close();
}
