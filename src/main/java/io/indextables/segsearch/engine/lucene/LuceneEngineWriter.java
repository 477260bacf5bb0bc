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

package io.indextables.segsearch.engine.lucene;

import io.indextables.segsearch.core.Schema;
import io.indextables.segsearch.engine.EngineSegment;
import io.indextables.segsearch.engine.EngineWriter;
import io.indextables.segsearch.exception.EngineException;

import org.apache.lucene.index.IndexWriter;
import org.apache.lucene.index.IndexWriterConfig;
import org.apache.lucene.index.SerialMergeScheduler;
import org.apache.lucene.store.ByteBuffersDirectory;
import org.apache.lucene.util.IOUtils;

import java.io.IOException;
import java.util.Map;
import java.util.logging.Logger;

/**
 * Buffers documents in a Lucene {@link IndexWriter} over a private
 * {@link ByteBuffersDirectory}.
 */
final class LuceneEngineWriter implements EngineWriter {
    private static final Logger LOG = Logger.getLogger(LuceneEngineWriter.class.getName());
    private static final double MIN_RAM_BUFFER_MB = 1.0;
    private static final double MAX_RAM_BUFFER_MB = 1024.0;

    private final Schema schema;
    private final ByteBuffersDirectory directory;
    private IndexWriter writer;
    private boolean finished = false;

    LuceneEngineWriter(Schema schema, long arenaBytes) {
        this.schema = schema;
        this.directory = new ByteBuffersDirectory();
        try {
            this.writer = new IndexWriter(directory, writerConfig(schema, arenaBytes));
        } catch (IOException e) {
            IOUtils.closeWhileHandlingException(directory);
            throw new EngineException("Failed to open index writer", e);
        }
    }

    /**
     * Writer configuration shared by building and merging. Merges run on the
     * calling thread so the output does not depend on scheduling.
     */
    static IndexWriterConfig writerConfig(Schema schema, long arenaBytes) {
        // the arena is enforced by the builder; this only bounds flushing
        double ramBufferMb = Math.max(MIN_RAM_BUFFER_MB, Math.min(arenaBytes / (1024.0 * 1024.0), MAX_RAM_BUFFER_MB));
        return new IndexWriterConfig(LuceneFieldMapper.analyzer(schema))
            .setOpenMode(IndexWriterConfig.OpenMode.CREATE)
            .setRAMBufferSizeMB(ramBufferMb)
            .setMergeScheduler(new SerialMergeScheduler())
            .setCommitOnClose(false);
    }

    @Override
    public void addDocument(Map<String, String> document) {
        ensureOpen();
        try {
            writer.addDocument(LuceneFieldMapper.toDocument(schema, document));
        } catch (IOException e) {
            throw new EngineException("Failed to add document", e);
        }
    }

    @Override
    public void deleteAll() {
        ensureOpen();
        try {
            writer.deleteAll();
        } catch (IOException e) {
            throw new EngineException("Failed to delete documents", e);
        }
    }

    @Override
    public long ramBytesUsed() {
        ensureOpen();
        return writer.ramBytesUsed();
    }

    @Override
    public EngineSegment finish() {
        ensureOpen();
        try {
            writer.commit();
            writer.forceMerge(1);
            writer.commit();
            writer.close();
            writer = null;
            finished = true;
            LuceneEngineSegment segment = LuceneEngineSegment.open(directory);
            LOG.fine(() -> "Finished segment " + segment.getSegmentId() + " with " + segment.getNumDocs() + " docs");
            return segment;
        } catch (IOException e) {
            IOUtils.closeWhileHandlingException(writer, directory);
            writer = null;
            finished = true;
            throw new EngineException("Failed to finish segment", e);
        }
    }

    @Override
    public void close() {
        if (writer == null) {
            if (!finished) {
                IOUtils.closeWhileHandlingException(directory);
            }
            return;
        }
        try {
            writer.rollback();
        } catch (IOException e) {
            throw new EngineException("Failed to close index writer", e);
        } finally {
            writer = null;
            IOUtils.closeWhileHandlingException(directory);
        }
    }

    private void ensureOpen() {
        if (writer == null) {
            throw new IllegalStateException("Engine writer has been closed");
        }
    }
}
