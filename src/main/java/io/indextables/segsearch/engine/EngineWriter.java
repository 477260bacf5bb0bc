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

import java.util.Map;

/**
 * Engine-side accumulator behind a {@code SegmentBuilder}.
 */
public interface EngineWriter extends AutoCloseable {

    /**
     * Index one document. Field names have already been checked against the schema.
     * @param document Field name to value
     */
    void addDocument(Map<String, String> document);

    /**
     * Drop every document added so far. The writer stays usable.
     */
    void deleteAll();

    /**
     * Bytes currently buffered by the engine.
     * @return Buffered bytes
     */
    long ramBytesUsed();

    /**
     * Commit the accumulated documents as a single segment. The writer's
     * storage moves into the returned segment and the writer becomes unusable.
     * @return The finished segment
     */
    EngineSegment finish();

    @Override
    void close();
}
