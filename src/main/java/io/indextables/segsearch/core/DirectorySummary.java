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

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Diagnostic description of the storage behind a {@link SearchIndex}:
 * one entry per registered segment, each listing its files with size and
 * SHA-1. Entries are ordered by segment id and file name, so the summary of
 * a given registered set is always the same.
 */
public final class DirectorySummary {
    private final List<SegmentEntry> segments;
    private final int numDocs;
    private final long totalBytes;

    DirectorySummary(List<SegmentEntry> segments) {
        List<SegmentEntry> sorted = new ArrayList<>(segments);
        sorted.sort((a, b) -> a.segmentId.compareTo(b.segmentId));
        this.segments = Collections.unmodifiableList(sorted);
        int docs = 0;
        long bytes = 0;
        for (SegmentEntry entry : sorted) {
            docs += entry.numDocs;
            bytes += entry.sizeInBytes;
        }
        this.numDocs = docs;
        this.totalBytes = bytes;
    }

    public int getSegmentCount() {
        return segments.size();
    }

    public int getNumDocs() {
        return numDocs;
    }

    public long getTotalBytes() {
        return totalBytes;
    }

    public List<SegmentEntry> getSegments() {
        return segments;
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof DirectorySummary && toString().equals(o.toString());
    }

    @Override
    public int hashCode() {
        return toString().hashCode();
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        sb.append("----- Directory: ").append(segments.size()).append(" segment(s), ")
          .append(numDocs).append(" doc(s), ").append(totalBytes).append(" bytes\n");
        for (SegmentEntry segment : segments) {
            sb.append("  segment ").append(segment.segmentId).append(": ")
              .append(segment.numDocs).append(" doc(s), ").append(segment.sizeInBytes).append(" bytes\n");
            for (FileEntry file : segment.files) {
                sb.append("    file ").append(file.name).append(", ").append(file.sizeInBytes)
                  .append(", ").append(file.sha1).append('\n');
            }
        }
        return sb.toString();
    }

    /**
     * One registered segment.
     */
    public static final class SegmentEntry {
        private final String segmentId;
        private final int numDocs;
        private final long sizeInBytes;
        private final List<FileEntry> files;

        SegmentEntry(String segmentId, int numDocs, long sizeInBytes, List<FileEntry> files) {
            this.segmentId = segmentId;
            this.numDocs = numDocs;
            this.sizeInBytes = sizeInBytes;
            this.files = Collections.unmodifiableList(new ArrayList<>(files));
        }

        public String getSegmentId() { return segmentId; }

        public int getNumDocs() { return numDocs; }

        public long getSizeInBytes() { return sizeInBytes; }

        public List<FileEntry> getFiles() { return files; }
    }

    /**
     * One index file of a segment.
     */
    public static final class FileEntry {
        private final String name;
        private final long sizeInBytes;
        private final String sha1;

        FileEntry(String name, long sizeInBytes, String sha1) {
            this.name = name;
            this.sizeInBytes = sizeInBytes;
            this.sha1 = sha1;
        }

        public String getName() { return name; }

        public long getSizeInBytes() { return sizeInBytes; }

        /** Upper-case hex SHA-1 of the file content. */
        public String getSha1() { return sha1; }
    }
}
