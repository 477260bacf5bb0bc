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

import io.indextables.segsearch.config.SegSearchConfig;
import io.indextables.segsearch.engine.EngineSegment;
import io.indextables.segsearch.engine.SearchEngine;
import io.indextables.segsearch.exception.ConfigException;
import io.indextables.segsearch.exception.DuplicateSegmentException;
import io.indextables.segsearch.exception.SchemaMismatchException;
import io.indextables.segsearch.exception.StateException;

import java.util.ArrayList;
import java.util.List;
import java.util.logging.Logger;

/**
 * Combines several segments sharing one schema into a single new segment.
 * The input segments are not modified and stay usable.
 *
 * <p>A merger is single use: after {@link #merge()} it accepts no more input.</p>
 */
public class SegmentMerger implements AutoCloseable {
    private static final Logger LOG = Logger.getLogger(SegmentMerger.class.getName());

    private final SearchEngine engine;
    private final long arenaBytes;
    private final List<Segment> segments = new ArrayList<>();
    private Schema schema;
    private boolean merged = false;
    private boolean closed = false;

    public SegmentMerger() {
        this(SegSearchConfig.getDefaultArenaBytes());
    }

    /**
     * @param arenaBytes Memory budget for the merge
     * @throws ConfigException if the budget is out of range
     */
    public SegmentMerger(long arenaBytes) {
        this.engine = SegSearch.requireEngine();
        SegSearchConfig.validateArenaBytes(arenaBytes);
        this.arenaBytes = arenaBytes;
    }

    /**
     * Queue a segment for merging.
     * @param segment Segment to merge
     * @return this merger
     * @throws SchemaMismatchException if its schema differs from the queued segments'
     * @throws DuplicateSegmentException if this instance is already queued
     * @throws StateException if the merge already ran, or the merger or the segment is closed
     */
    public synchronized SegmentMerger addSegment(Segment segment) {
        if (segment == null) {
            throw new IllegalArgumentException("Segment cannot be null");
        }
        ensureUsable();
        if (segment.isClosed()) {
            throw new StateException("Cannot merge closed segment " + segment.getSegmentId());
        }
        for (Segment queued : segments) {
            if (queued == segment) {
                throw new DuplicateSegmentException("Segment " + segment.getSegmentId() + " is already queued");
            }
        }
        if (segment.engine() != engine) {
            throw new ConfigException("Segment " + segment.getSegmentId()
                + " was created by a different engine instance");
        }
        if (schema != null && !schema.equals(segment.getSchema())) {
            throw new SchemaMismatchException("Segment " + segment.getSegmentId()
                + " has schema " + segment.getSchema() + ", merger expects " + schema);
        }
        schema = segment.getSchema();
        segments.add(segment);
        return this;
    }

    public synchronized int getSegmentCount() {
        return segments.size();
    }

    /**
     * Merge the queued segments. A single queued segment is copied.
     * @return A new segment holding every document of the inputs
     * @throws StateException if nothing is queued, the merge already ran, the merger was closed
     *         or an input was closed since
     */
    public synchronized Segment merge() {
        ensureUsable();
        if (segments.isEmpty()) {
            throw new StateException("No segments to merge");
        }
        List<EngineSegment> inputs = new ArrayList<>(segments.size());
        for (Segment segment : segments) {
            inputs.add(segment.engineSegment());
        }
        EngineSegment result = inputs.size() == 1
            ? engine.openSegment(schema, inputs.get(0).getFiles())
            : engine.merge(schema, inputs, arenaBytes);
        merged = true;
        Segment segment = new Segment(engine, schema, result);
        LOG.fine(() -> "Merged " + inputs.size() + " segment(s) into " + segment);
        return segment;
    }

    /**
     * Drop the queued segments. They stay open; the merger accepts no more calls.
     */
    @Override
    public synchronized void close() {
        closed = true;
        segments.clear();
    }

    private void ensureUsable() {
        if (closed) {
            throw new StateException("SegmentMerger has been closed");
        }
        if (merged) {
            throw new StateException("SegmentMerger has already merged");
        }
    }
}
