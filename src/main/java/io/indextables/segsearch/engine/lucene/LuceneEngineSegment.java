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

import io.indextables.segsearch.engine.EngineSegment;
import io.indextables.segsearch.engine.SegmentFiles;
import io.indextables.segsearch.exception.EngineException;

import org.apache.lucene.index.DirectoryReader;
import org.apache.lucene.index.IndexWriter;
import org.apache.lucene.index.SegmentInfos;
import org.apache.lucene.store.Directory;
import org.apache.lucene.store.IOContext;
import org.apache.lucene.store.IndexInput;
import org.apache.lucene.util.IOUtils;
import org.apache.lucene.util.StringHelper;

import java.io.IOException;
import java.util.Map;
import java.util.TreeMap;

/**
 * A committed Lucene index held in its own in-memory directory, with the
 * reader kept open for searching.
 */
final class LuceneEngineSegment implements EngineSegment {
    private final Directory directory;
    private final DirectoryReader reader;
    private final SegmentFiles files;
    private final String segmentId;
    private volatile boolean closed = false;

    private LuceneEngineSegment(Directory directory, DirectoryReader reader, SegmentFiles files, String segmentId) {
        this.directory = directory;
        this.reader = reader;
        this.files = files;
        this.segmentId = segmentId;
    }

    /**
     * Open the latest commit of a directory. On success the segment owns the
     * directory; on failure the caller still does.
     */
    static LuceneEngineSegment open(Directory directory) throws IOException {
        SegmentInfos infos = SegmentInfos.readLatestCommit(directory);
        SegmentFiles files = snapshot(directory);
        DirectoryReader reader = DirectoryReader.open(directory);
        return new LuceneEngineSegment(directory, reader, files, StringHelper.idToString(infos.getId()));
    }

    private static SegmentFiles snapshot(Directory directory) throws IOException {
        Map<String, byte[]> contents = new TreeMap<>();
        for (String name : directory.listAll()) {
            if (IndexWriter.WRITE_LOCK_NAME.equals(name)) {
                continue;
            }
            try (IndexInput input = directory.openInput(name, IOContext.READONCE)) {
                byte[] data = new byte[Math.toIntExact(input.length())];
                input.readBytes(data, 0, data.length);
                contents.put(name, data);
            }
        }
        return new SegmentFiles(contents);
    }

    DirectoryReader reader() {
        if (closed) {
            throw new IllegalStateException("Segment has been closed");
        }
        return reader;
    }

    @Override
    public SegmentFiles getFiles() {
        return files;
    }

    @Override
    public int getNumDocs() {
        return reader.numDocs();
    }

    @Override
    public String getSegmentId() {
        return segmentId;
    }

    @Override
    public synchronized void close() {
        if (closed) {
            return;
        }
        closed = true;
        try {
            IOUtils.close(reader, directory);
        } catch (IOException e) {
            throw new EngineException("Failed to close segment " + segmentId, e);
        }
    }
}
