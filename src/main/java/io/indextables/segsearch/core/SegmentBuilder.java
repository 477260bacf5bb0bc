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
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import io.indextables.segsearch.config.SegSearchConfig;
import io.indextables.segsearch.engine.EngineSegment;
import io.indextables.segsearch.engine.EngineWriter;
import io.indextables.segsearch.engine.SearchEngine;
import io.indextables.segsearch.exception.CapacityException;
import io.indextables.segsearch.exception.SchemaMismatchException;
import io.indextables.segsearch.exception.StateException;
import io.indextables.segsearch.lifecycle.ResourceLifecycleManager;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.logging.Logger;

/**
 * Accumulates documents for one segment within a fixed arena budget.
 *
 * <p>Lifecycle: documents are added (and optionally discarded with
 * {@link #removeDocuments()}) until {@link #finalizeSegment()} compiles them
 * into a {@link Segment}. The engine storage then moves to the segment and
 * this builder only answers accessors.</p>
 *
 * <p>Documents map field names to values. Every key must be declared in the
 * schema; declared fields may be left out and are then absent from that
 * document. The arena budget bounds the cumulative encoded size of the
 * documents (see {@link #encodedSize(Map)}); a document that does not fit
 * is rejected with {@link CapacityException} and consumes nothing.</p>
 *
 * <p>A builder is single-writer. Its methods are synchronized so that
 * {@link #addDocumentsAsync(List)} and caller threads see each other's
 * effects in order.</p>
 */
public class SegmentBuilder implements AutoCloseable {
    private static final Logger LOG = Logger.getLogger(SegmentBuilder.class.getName());
    private static final ResourceLifecycleManager LIFECYCLE = ResourceLifecycleManager.forKind("SegmentBuilder");
    private static final ObjectMapper MAPPER = new ObjectMapper();

    private final SearchEngine engine;
    private final Schema schema;
    private final long arenaBytes;
    private final ResourceLifecycleManager.Registration<EngineWriter> writer;
    private long arenaBytesUsed = 0;
    private int documentCount = 0;
    private boolean finalized = false;
    private boolean closed = false;

    /**
     * Create a builder with the default arena budget
     * ({@link SegSearchConfig#getDefaultArenaBytes()}).
     * @param schema Schema every document must conform to
     */
    public SegmentBuilder(Schema schema) {
        this(schema, SegSearchConfig.getDefaultArenaBytes());
    }

    /**
     * Create a builder.
     * @param schema Schema every document must conform to
     * @param arenaBytes Arena budget in bytes, must be positive
     * @throws io.indextables.segsearch.exception.ConfigException if the budget is out of range
     * @throws io.indextables.segsearch.exception.UninitializedException if the engine is not initialized
     */
    public SegmentBuilder(Schema schema, long arenaBytes) {
        this.engine = SegSearch.requireEngine();
        if (schema == null) {
            throw new IllegalArgumentException("Schema cannot be null");
        }
        SegSearchConfig.validateArenaBytes(arenaBytes);
        this.schema = schema;
        this.arenaBytes = arenaBytes;
        this.writer = LIFECYCLE.register(this, engine.openWriter(schema, arenaBytes));
    }

    /**
     * Encoded size of a document as charged against the arena:
     * for each field, 4 + UTF-8 name bytes + 4 + UTF-8 value bytes.
     * @param document Field name to value
     * @return Size in bytes
     */
    public static long encodedSize(Map<String, String> document) {
        long size = 0;
        for (Map.Entry<String, String> entry : document.entrySet()) {
            size += 4 + entry.getKey().getBytes(StandardCharsets.UTF_8).length;
            size += 4 + entry.getValue().getBytes(StandardCharsets.UTF_8).length;
        }
        return size;
    }

    /**
     * Add a document.
     * @param document Field name to value
     * @return Position of the document in this builder, starting at 0
     * @throws SchemaMismatchException if a key is not declared or a value is null
     * @throws CapacityException if the document does not fit in the remaining arena
     * @throws StateException if the builder was finalized or closed
     */
    public synchronized int addDocument(Map<String, String> document) {
        ensureWritable();
        if (document == null) {
            throw new IllegalArgumentException("Document cannot be null");
        }
        Map<String, String> values = new LinkedHashMap<>();
        for (Map.Entry<String, String> entry : document.entrySet()) {
            String field = entry.getKey();
            if (!schema.hasField(field)) {
                throw new SchemaMismatchException("Field '" + field + "' is not declared in the schema");
            }
            if (entry.getValue() == null) {
                throw new SchemaMismatchException("Field '" + field + "' has a null value");
            }
            values.put(field, entry.getValue());
        }

        long size = encodedSize(values);
        if (size > arenaBytes - arenaBytesUsed) {
            throw new CapacityException(arenaBytes, arenaBytesUsed, size);
        }
        writer.get().addDocument(values);
        arenaBytesUsed += size;
        return documentCount++;
    }

    /**
     * Add a document from a flat JSON object of string values.
     * @param json JSON representation of the document
     * @return Position of the document in this builder
     * @throws SchemaMismatchException if the JSON is malformed, not an object or has non-string values
     */
    public synchronized int addJson(String json) {
        ensureWritable();
        if (json == null) {
            throw new IllegalArgumentException("JSON cannot be null");
        }
        JsonNode root;
        try {
            root = MAPPER.readTree(json);
        } catch (JsonProcessingException e) {
            throw new SchemaMismatchException("Invalid document JSON: " + e.getOriginalMessage(), e);
        }
        if (root == null || !root.isObject()) {
            throw new SchemaMismatchException("Document JSON must be an object");
        }
        Map<String, String> document = new LinkedHashMap<>();
        Iterator<Map.Entry<String, JsonNode>> fields = root.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> field = fields.next();
            if (!field.getValue().isTextual()) {
                throw new SchemaMismatchException("Field '" + field.getKey() + "' must be a string, got "
                    + field.getValue().getNodeType());
            }
            document.put(field.getKey(), field.getValue().textValue());
        }
        return addDocument(document);
    }

    /**
     * Add documents in order. Stops at the first failure; documents added
     * before it are kept.
     * @param documents Documents to add
     * @return Number of documents added
     */
    public synchronized int addDocuments(List<Map<String, String>> documents) {
        if (documents == null) {
            throw new IllegalArgumentException("Documents cannot be null");
        }
        int added = 0;
        for (Map<String, String> document : documents) {
            addDocument(document);
            added++;
        }
        return added;
    }

    /**
     * Add documents without blocking the caller.
     *
     * <p>Cancelling the returned future stops the work before the next
     * document. Documents added before cancellation or failure stay in the
     * builder.</p>
     *
     * @param documents Documents to add
     * @return Future completing with the number of documents added
     */
    public CompletableFuture<Integer> addDocumentsAsync(List<Map<String, String>> documents) {
        if (documents == null) {
            throw new IllegalArgumentException("Documents cannot be null");
        }
        List<Map<String, String>> pending = new ArrayList<>(documents);
        CompletableFuture<Integer> result = new CompletableFuture<>();
        CompletableFuture.runAsync(() -> {
            int added = 0;
            try {
                for (Map<String, String> document : pending) {
                    if (result.isDone()) {
                        LOG.fine("Bulk add stopped after " + added + " of " + pending.size() + " documents");
                        return;
                    }
                    addDocument(document);
                    added++;
                }
                result.complete(added);
            } catch (RuntimeException e) {
                result.completeExceptionally(e);
            }
        });
        return result;
    }

    /**
     * Discard every document added so far and reset the arena usage.
     * @throws StateException if the builder was finalized or closed
     */
    public synchronized void removeDocuments() {
        ensureWritable();
        writer.get().deleteAll();
        LOG.fine(() -> "Discarded " + documentCount + " documents");
        arenaBytesUsed = 0;
        documentCount = 0;
    }

    /**
     * Compile the accumulated documents into a segment. Can only be called once.
     *
     * <p>An engine failure while finishing releases the writer, whose partial
     * output cannot be reused, and leaves the builder finalized.</p>
     *
     * @return The new segment, owning the engine storage of this builder
     * @throws StateException if the builder was already finalized or closed
     * @throws io.indextables.segsearch.exception.EngineException if the engine fails to finish the segment
     */
    public synchronized Segment finalizeSegment() {
        ensureWritable();
        EngineWriter engineWriter = writer.transfer();
        finalized = true;
        EngineSegment engineSegment;
        try {
            engineSegment = engineWriter.finish();
        } catch (RuntimeException e) {
            engineWriter.close();
            throw e;
        }
        LOG.fine(() -> "Finalized builder with " + documentCount + " documents, " + arenaBytesUsed + " arena bytes");
        return new Segment(engine, schema, engineSegment);
    }

    public Schema getSchema() {
        return schema;
    }

    public synchronized int getDocumentCount() {
        return documentCount;
    }

    public long getArenaBytes() {
        return arenaBytes;
    }

    public synchronized long getArenaBytesUsed() {
        return arenaBytesUsed;
    }

    public synchronized long getRemainingArenaBytes() {
        return arenaBytes - arenaBytesUsed;
    }

    public synchronized boolean isFinalized() {
        return finalized;
    }

    /**
     * Release the engine writer. Documents not yet finalized are lost.
     * Has no effect on a segment already produced by this builder.
     */
    @Override
    public synchronized void close() {
        if (!closed) {
            closed = true;
            writer.release();
        }
    }

    private void ensureWritable() {
        if (finalized) {
            throw new StateException("SegmentBuilder has already been finalized");
        }
        if (closed) {
            throw new StateException("SegmentBuilder has been closed");
        }
    }
}
