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

import io.indextables.segsearch.engine.EngineHit;
import io.indextables.segsearch.engine.EngineSegment;
import io.indextables.segsearch.engine.EngineView;
import io.indextables.segsearch.engine.SearchEngine;
import io.indextables.segsearch.engine.SegmentFiles;
import io.indextables.segsearch.exception.ConfigException;
import io.indextables.segsearch.exception.DuplicateSegmentException;
import io.indextables.segsearch.exception.EngineException;
import io.indextables.segsearch.exception.NotRegisteredException;
import io.indextables.segsearch.exception.SchemaMismatchException;
import io.indextables.segsearch.exception.StateException;
import io.indextables.segsearch.lifecycle.ResourceLifecycleManager;
import io.indextables.segsearch.query.SearchOptions;
import io.indextables.segsearch.result.SearchResult;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Queryable union of registered {@link Segment}s.
 *
 * <pre>{@code
 * try (SearchIndex index = new SearchIndex()) {
 *     index.registerSegment(segment);
 *     SearchResult result = index.search("fox", new SearchOptions().withFields("id").withLimit(10));
 * }
 * }</pre>
 *
 * <h3>Membership</h3>
 * Segments are registered by instance. Registering the same instance twice
 * fails with {@link DuplicateSegmentException}; removing an instance that is
 * not registered fails with {@link NotRegisteredException}. All registered
 * segments must share one schema. The index never closes the segments it
 * holds.
 *
 * <h3>Thread Safety</h3>
 * Searches run under the read lock and may proceed concurrently.
 * Registration and removal take the write lock, so they wait for in-flight
 * searches and are seen by every search that starts after them. The engine
 * view over the registered set is rebuilt on every change.
 */
public class SearchIndex implements AutoCloseable {
    private static final Logger LOG = Logger.getLogger(SearchIndex.class.getName());
    private static final ResourceLifecycleManager LIFECYCLE = ResourceLifecycleManager.forKind("SearchIndex");

    private final SearchEngine engine;
    private final ReentrantReadWriteLock lock = new ReentrantReadWriteLock();
    private final List<Segment> segments = new ArrayList<>();
    private Schema schema;
    private ResourceLifecycleManager.Registration<EngineView> view;
    private boolean closed = false;

    /**
     * Create an empty index.
     * @throws io.indextables.segsearch.exception.UninitializedException if the engine is not initialized
     */
    public SearchIndex() {
        this.engine = SegSearch.requireEngine();
    }

    /**
     * Register a segment. Later searches include its documents.
     * @param segment Segment to register
     * @throws DuplicateSegmentException if this instance is already registered
     * @throws SchemaMismatchException if its schema differs from the registered segments'
     * @throws StateException if the index or the segment has been closed
     */
    public void registerSegment(Segment segment) {
        if (segment == null) {
            throw new IllegalArgumentException("Segment cannot be null");
        }
        lock.writeLock().lock();
        try {
            ensureOpen();
            if (segment.isClosed()) {
                throw new StateException("Cannot register closed segment " + segment.getSegmentId());
            }
            if (indexOf(segment) >= 0) {
                throw new DuplicateSegmentException("Segment " + segment.getSegmentId() + " is already registered");
            }
            if (segment.engine() != engine) {
                throw new ConfigException("Segment " + segment.getSegmentId()
                    + " was created by a different engine instance");
            }
            if (schema != null && !schema.equals(segment.getSchema())) {
                throw new SchemaMismatchException("Segment " + segment.getSegmentId()
                    + " has schema " + segment.getSchema() + ", index expects " + schema);
            }
            segments.add(segment);
            try {
                rebuildView(segment.getSchema());
            } catch (RuntimeException e) {
                segments.remove(segments.size() - 1);
                throw e;
            }
            schema = segment.getSchema();
            LOG.fine(() -> "Registered " + segment + ", " + segments.size() + " segment(s) in index");
        } finally {
            lock.writeLock().unlock();
        }
    }

    /**
     * Remove a registered segment. The segment itself stays open.
     * @param segment Segment to remove
     * @throws NotRegisteredException if this instance is not registered
     * @throws StateException if the index has been closed
     */
    public void removeSegment(Segment segment) {
        if (segment == null) {
            throw new IllegalArgumentException("Segment cannot be null");
        }
        lock.writeLock().lock();
        try {
            ensureOpen();
            int position = indexOf(segment);
            if (position < 0) {
                throw new NotRegisteredException("Segment " + segment.getSegmentId() + " is not registered");
            }
            segments.remove(position);
            try {
                rebuildView(schema);
            } catch (RuntimeException e) {
                segments.add(position, segment);
                throw e;
            }
            if (segments.isEmpty()) {
                schema = null;
            }
            LOG.fine(() -> "Removed " + segment + ", " + segments.size() + " segment(s) left in index");
        } finally {
            lock.writeLock().unlock();
        }
    }

    /**
     * Search all registered segments with default options.
     * @param query Query text
     * @return Hits carrying every stored field
     */
    public SearchResult search(String query) {
        return search(query, new SearchOptions());
    }

    /**
     * Search all registered segments.
     *
     * <p>An index without segments, and a limit of 0, give an empty result.
     * With {@code fields} unset every stored field is returned; requested
     * fields that are declared but not stored are absent from hits.</p>
     *
     * @param query Query text, interpreted by the engine
     * @param options Limit and returned fields
     * @return Hits in relevance order
     * @throws SchemaMismatchException if a requested field is not declared in the schema
     * @throws io.indextables.segsearch.exception.InvalidQueryException if the query cannot be parsed
     * @throws StateException if the index or a registered segment has been closed
     */
    public SearchResult search(String query, SearchOptions options) {
        if (query == null) {
            throw new IllegalArgumentException("Query cannot be null");
        }
        SearchOptions effective = options == null ? new SearchOptions() : options;
        lock.readLock().lock();
        try {
            ensureOpen();
            if (segments.isEmpty() || effective.getLimit() == 0) {
                return SearchResult.empty();
            }
            Set<String> fields = resolveFields(effective.getFields());
            for (Segment segment : segments) {
                if (segment.isClosed()) {
                    throw new StateException("Registered segment " + segment.getSegmentId() + " has been closed");
                }
            }
            List<EngineHit> engineHits = view.get().search(query, effective.getLimit(), fields);
            List<SearchResult.Hit> hits = new ArrayList<>(engineHits.size());
            for (EngineHit engineHit : engineHits) {
                hits.add(new SearchResult.Hit(engineHit.getScore(), engineHit.getFields()));
            }
            return new SearchResult(hits);
        } finally {
            lock.readLock().unlock();
        }
    }

    /**
     * Search without blocking the caller. Equivalent to
     * {@link #search(String, SearchOptions)} run on the common pool.
     * @param query Query text
     * @param options Limit and returned fields
     * @return Future completing with the hits
     */
    public CompletableFuture<SearchResult> searchAsync(String query, SearchOptions options) {
        return CompletableFuture.supplyAsync(() -> search(query, options));
    }

    /**
     * Describe the storage of the registered segments.
     * @return Summary, identical for an identical registered set
     */
    public DirectorySummary directorySummary() {
        lock.readLock().lock();
        try {
            ensureOpen();
            List<DirectorySummary.SegmentEntry> entries = new ArrayList<>(segments.size());
            for (Segment segment : segments) {
                SegmentFiles files = segment.files();
                List<DirectorySummary.FileEntry> fileEntries = new ArrayList<>(files.getFileCount());
                for (String name : files.getFileNames()) {
                    fileEntries.add(new DirectorySummary.FileEntry(name, files.getFileLength(name), files.sha1(name)));
                }
                entries.add(new DirectorySummary.SegmentEntry(segment.getSegmentId(), segment.getNumDocs(),
                    files.getTotalBytes(), fileEntries));
            }
            DirectorySummary summary = new DirectorySummary(entries);
            LOG.fine(summary::toString);
            return summary;
        } finally {
            lock.readLock().unlock();
        }
    }

    /**
     * Get the number of registered segments.
     * @return Number of segments
     */
    public int getSegmentCount() {
        lock.readLock().lock();
        try {
            return segments.size();
        } finally {
            lock.readLock().unlock();
        }
    }

    /**
     * Get the total number of documents across registered segments.
     * @return Number of documents
     */
    public int getNumDocs() {
        lock.readLock().lock();
        try {
            int total = 0;
            for (Segment segment : segments) {
                total += segment.getNumDocs();
            }
            return total;
        } finally {
            lock.readLock().unlock();
        }
    }

    /**
     * Get the registered segments, in registration order.
     * @return Snapshot of the registered set
     */
    public List<Segment> getSegments() {
        lock.readLock().lock();
        try {
            return Collections.unmodifiableList(new ArrayList<>(segments));
        } finally {
            lock.readLock().unlock();
        }
    }

    /**
     * Check whether a segment instance is registered.
     * @param segment Segment to look for
     * @return true if registered
     */
    public boolean isRegistered(Segment segment) {
        lock.readLock().lock();
        try {
            return indexOf(segment) >= 0;
        } finally {
            lock.readLock().unlock();
        }
    }

    /**
     * Get the schema shared by the registered segments.
     * @return Schema, or null while no segment is registered
     */
    public Schema getSchema() {
        lock.readLock().lock();
        try {
            return schema;
        } finally {
            lock.readLock().unlock();
        }
    }

    /**
     * Release the engine view and forget every registered segment.
     * The segments stay open.
     */
    @Override
    public void close() {
        lock.writeLock().lock();
        try {
            if (closed) {
                return;
            }
            closed = true;
            segments.clear();
            schema = null;
            releaseView();
        } finally {
            lock.writeLock().unlock();
        }
    }

    private Set<String> resolveFields(List<String> requested) {
        if (requested == null) {
            return new LinkedHashSet<>(schema.getStoredFieldNames());
        }
        Set<String> fields = new LinkedHashSet<>();
        for (String field : requested) {
            if (!schema.hasField(field)) {
                throw new SchemaMismatchException("Field '" + field + "' is not declared in the schema");
            }
            if (schema.getFieldCapabilities(field).isStored()) {
                fields.add(field);
            }
        }
        return fields;
    }

    /**
     * Open a view over the current segments, then release the previous one.
     * If opening fails the previous view stays in place.
     */
    private void rebuildView(Schema viewSchema) {
        ResourceLifecycleManager.Registration<EngineView> next = null;
        if (!segments.isEmpty()) {
            List<EngineSegment> engineSegments = new ArrayList<>(segments.size());
            for (Segment segment : segments) {
                engineSegments.add(segment.engineSegment());
            }
            next = LIFECYCLE.register(this, engine.openView(viewSchema, engineSegments));
        }
        ResourceLifecycleManager.Registration<EngineView> previous = view;
        view = next;
        if (previous != null) {
            try {
                previous.release();
            } catch (EngineException e) {
                LOG.log(Level.WARNING, "Failed to release previous search view", e);
            }
        }
    }

    private void releaseView() {
        if (view != null) {
            ResourceLifecycleManager.Registration<EngineView> current = view;
            view = null;
            current.release();
        }
    }

    private int indexOf(Segment segment) {
        for (int i = 0; i < segments.size(); i++) {
            if (segments.get(i) == segment) {
                return i;
            }
        }
        return -1;
    }

    private void ensureOpen() {
        if (closed) {
            throw new StateException("SearchIndex has been closed");
        }
    }
}
