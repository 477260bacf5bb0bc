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

import io.indextables.segsearch.engine.EngineSegment;
import io.indextables.segsearch.engine.SearchEngine;
import io.indextables.segsearch.engine.SegmentFiles;
import io.indextables.segsearch.exception.StateException;
import io.indextables.segsearch.format.SegmentCodec;
import io.indextables.segsearch.lifecycle.ResourceLifecycleManager;

/**
 * Immutable, serializable unit of indexed documents.
 *
 * <p>A segment comes from {@link SegmentBuilder#finalizeSegment()} or from
 * {@link #fromBytes(byte[])}. Both behave the same for searching and
 * exporting, and {@code Segment.fromBytes(s.export()).export()} equals
 * {@code s.export()} byte for byte.</p>
 *
 * <p>Segments are safe to share between any number of {@link SearchIndex}
 * instances and threads. {@link #close()} releases the engine storage;
 * an index still holding a closed segment refuses to search.</p>
 */
public class Segment implements AutoCloseable {
    private static final ResourceLifecycleManager LIFECYCLE = ResourceLifecycleManager.forKind("Segment");

    private final SearchEngine engine;
    private final Schema schema;
    private final ResourceLifecycleManager.Registration<EngineSegment> handle;
    private final String segmentId;
    private final int numDocs;
    private final long sizeInBytes;
    private volatile boolean closed = false;

    Segment(SearchEngine engine, Schema schema, EngineSegment engineSegment) {
        this.engine = engine;
        this.schema = schema;
        this.segmentId = engineSegment.getSegmentId();
        this.numDocs = engineSegment.getNumDocs();
        this.sizeInBytes = engineSegment.getFiles().getTotalBytes();
        this.handle = LIFECYCLE.register(this, engineSegment);
    }

    /**
     * Create a segment from bytes previously returned by {@link #export()}.
     * @param data Exported segment bytes
     * @return A new segment
     * @throws io.indextables.segsearch.exception.CorruptDataException if the bytes are not a valid segment
     * @throws io.indextables.segsearch.exception.UninitializedException if the engine is not initialized
     */
    public static Segment fromBytes(byte[] data) {
        SearchEngine engine = SegSearch.requireEngine();
        SegmentCodec.Decoded decoded = SegmentCodec.decode(data);
        EngineSegment engineSegment = engine.openSegment(decoded.getSchema(), decoded.getFiles());
        return new Segment(engine, decoded.getSchema(), engineSegment);
    }

    /**
     * Serialize this segment. The result depends only on the segment content.
     * @return Exported bytes
     * @throws StateException if the segment has been closed
     */
    public byte[] export() {
        return SegmentCodec.encode(schema, engineSegment().getFiles());
    }

    public Schema getSchema() {
        return schema;
    }

    /**
     * Get the number of documents in the segment.
     * @return Number of documents
     */
    public int getNumDocs() {
        return numDocs;
    }

    /**
     * Get the engine-assigned segment id. Preserved by export and import.
     * @return Segment id
     */
    public String getSegmentId() {
        return segmentId;
    }

    /**
     * Get the size of the segment's index files.
     * @return Total bytes
     */
    public long getSizeInBytes() {
        return sizeInBytes;
    }

    public boolean isClosed() {
        return closed;
    }

    SearchEngine engine() {
        return engine;
    }

    EngineSegment engineSegment() {
        if (closed) {
            throw new StateException("Segment " + segmentId + " has been closed");
        }
        return handle.get();
    }

    SegmentFiles files() {
        return engineSegment().getFiles();
    }

    @Override
    public void close() {
        if (!closed) {
            closed = true;
            handle.release();
        }
    }

    @Override
    public String toString() {
        return String.format("Segment{id=%s, docs=%d, bytes=%d%s}", segmentId, numDocs, sizeInBytes,
            closed ? ", closed" : "");
    }
}
