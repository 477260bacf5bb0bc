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

import io.indextables.segsearch.core.Schema;

import java.util.List;

/**
 * Capability surface of the embedded search engine: tokenize, index, score
 * and serialize.
 *
 * <p>Schema validation, lifecycle and aggregation live above this interface,
 * so they can be exercised against any implementation. The default binding
 * is discovered through {@link java.util.ServiceLoader}.</p>
 *
 * <p>Implementations must be thread-safe. Writers they return are
 * single-writer; segments they return are immutable and may be searched
 * concurrently.</p>
 */
public interface SearchEngine {

    /**
     * Short engine name, e.g. "lucene".
     * @return Engine name
     */
    String getName();

    /**
     * Engine version, used in diagnostics.
     * @return Version string
     */
    String getVersion();

    /**
     * Open a writer that accumulates documents into a new segment.
     * @param schema Validated schema every document conforms to
     * @param arenaBytes Memory budget for buffered documents
     * @return A new writer
     */
    EngineWriter openWriter(Schema schema, long arenaBytes);

    /**
     * Open a segment from previously exported files.
     * @param schema Schema the files were written with
     * @param files Index files
     * @return An open segment
     * @throws io.indextables.segsearch.exception.CorruptDataException if the files are not a readable index
     */
    EngineSegment openSegment(Schema schema, SegmentFiles files);

    /**
     * Merge segments into one new segment. The inputs are left untouched.
     * @param schema Schema shared by all inputs
     * @param segments Segments to merge, at least one
     * @param arenaBytes Memory budget for the merge
     * @return The merged segment
     */
    EngineSegment merge(Schema schema, List<EngineSegment> segments, long arenaBytes);

    /**
     * Open a searchable view over the union of the given segments. Hits from
     * all segments are ranked together. The view keeps the segments' readers
     * referenced until it is closed.
     * @param schema Schema shared by all segments
     * @param segments Segments to search, at least one
     * @return An open view
     */
    EngineView openView(Schema schema, List<EngineSegment> segments);
}
