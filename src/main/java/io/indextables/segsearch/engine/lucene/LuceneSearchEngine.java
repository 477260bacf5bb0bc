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
import io.indextables.segsearch.engine.EngineView;
import io.indextables.segsearch.engine.EngineWriter;
import io.indextables.segsearch.engine.SearchEngine;
import io.indextables.segsearch.engine.SegmentFiles;
import io.indextables.segsearch.exception.CorruptDataException;
import io.indextables.segsearch.exception.EngineException;

import org.apache.lucene.index.CodecReader;
import org.apache.lucene.index.FieldInfo;
import org.apache.lucene.index.FieldInfos;
import org.apache.lucene.index.IndexReader;
import org.apache.lucene.index.IndexWriter;
import org.apache.lucene.index.LeafReaderContext;
import org.apache.lucene.index.MultiReader;
import org.apache.lucene.index.SlowCodecReaderWrapper;
import org.apache.lucene.store.ByteBuffersDirectory;
import org.apache.lucene.store.IOContext;
import org.apache.lucene.store.IndexOutput;
import org.apache.lucene.util.IOUtils;
import org.apache.lucene.util.Version;

import java.io.IOException;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.logging.Logger;

/**
 * {@link SearchEngine} backed by Apache Lucene. Every segment is a
 * single-segment Lucene index in its own {@link ByteBuffersDirectory};
 * searches span segments through a {@link MultiReader} so scores are
 * computed over the combined statistics.
 */
public final class LuceneSearchEngine implements SearchEngine {
    private static final Logger LOG = Logger.getLogger(LuceneSearchEngine.class.getName());

    public static final String NAME = "lucene";

    @Override
    public String getName() {
        return NAME;
    }

    @Override
    public String getVersion() {
        return Version.LATEST.toString();
    }

    @Override
    public EngineWriter openWriter(Schema schema, long arenaBytes) {
        return new LuceneEngineWriter(schema, arenaBytes);
    }

    @Override
    public EngineSegment openSegment(Schema schema, SegmentFiles files) {
        ByteBuffersDirectory directory = new ByteBuffersDirectory();
        try {
            for (String name : files.getFileNames()) {
                byte[] data = files.getFile(name);
                try (IndexOutput output = directory.createOutput(name, IOContext.DEFAULT)) {
                    output.writeBytes(data, 0, data.length);
                }
            }
            LuceneEngineSegment segment = LuceneEngineSegment.open(directory);
            try {
                checkFields(schema, segment);
            } catch (CorruptDataException e) {
                segment.close();
                throw e;
            }
            return segment;
        } catch (IOException | RuntimeException e) {
            IOUtils.closeWhileHandlingException(directory);
            if (e instanceof CorruptDataException) {
                throw (CorruptDataException) e;
            }
            throw new CorruptDataException("Segment files are not a readable index: " + e.getMessage(), e);
        }
    }

    /**
     * Every indexed field must be one the schema can produce.
     */
    private static void checkFields(Schema schema, LuceneEngineSegment segment) {
        Set<String> expected = new HashSet<>(schema.getFieldNames());
        expected.addAll(Arrays.asList(LuceneFieldMapper.queryFields(schema)));
        FieldInfos infos = FieldInfos.getMergedFieldInfos(segment.reader());
        for (FieldInfo info : infos) {
            if (!expected.contains(info.name)) {
                throw new CorruptDataException("Segment contains field '" + info.name + "' unknown to its schema");
            }
        }
    }

    @Override
    public EngineSegment merge(Schema schema, List<EngineSegment> segments, long arenaBytes) {
        if (segments == null || segments.isEmpty()) {
            throw new IllegalArgumentException("Segments to merge cannot be null or empty");
        }
        ByteBuffersDirectory directory = new ByteBuffersDirectory();
        try {
            List<CodecReader> readers = new ArrayList<>();
            for (EngineSegment segment : segments) {
                for (LeafReaderContext leaf : unwrap(segment).reader().leaves()) {
                    readers.add(SlowCodecReaderWrapper.wrap(leaf.reader()));
                }
            }
            try (IndexWriter writer = new IndexWriter(directory, LuceneEngineWriter.writerConfig(schema, arenaBytes))) {
                writer.addIndexes(readers.toArray(new CodecReader[0]));
                writer.forceMerge(1);
                writer.commit();
            }
            LuceneEngineSegment merged = LuceneEngineSegment.open(directory);
            LOG.fine(() -> "Merged " + segments.size() + " segments into " + merged.getSegmentId());
            return merged;
        } catch (IOException e) {
            IOUtils.closeWhileHandlingException(directory);
            throw new EngineException("Failed to merge segments", e);
        }
    }

    @Override
    public EngineView openView(Schema schema, List<EngineSegment> segments) {
        if (segments == null || segments.isEmpty()) {
            throw new IllegalArgumentException("Segments cannot be null or empty");
        }
        IndexReader[] readers = new IndexReader[segments.size()];
        for (int i = 0; i < readers.length; i++) {
            readers[i] = unwrap(segments.get(i)).reader();
        }
        try {
            return new LuceneEngineView(schema, new MultiReader(readers, false));
        } catch (IOException e) {
            throw new EngineException("Failed to open a view over " + readers.length + " segments", e);
        }
    }

    private static LuceneEngineSegment unwrap(EngineSegment segment) {
        if (!(segment instanceof LuceneEngineSegment)) {
            throw new IllegalArgumentException("Segment was not produced by the Lucene engine: "
                + (segment == null ? "null" : segment.getClass().getName()));
        }
        return (LuceneEngineSegment) segment;
    }
}
