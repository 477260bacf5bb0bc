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

import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.Arrays;
import java.util.Collections;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;

/**
 * Immutable in-memory file set of one segment, keyed by file name in name order.
 */
public final class SegmentFiles {
    private final Map<String, byte[]> files;
    private final long totalBytes;

    public SegmentFiles(Map<String, byte[]> files) {
        if (files == null) {
            throw new IllegalArgumentException("Files cannot be null");
        }
        TreeMap<String, byte[]> copy = new TreeMap<>();
        long total = 0;
        for (Map.Entry<String, byte[]> entry : files.entrySet()) {
            if (entry.getKey() == null || entry.getValue() == null) {
                throw new IllegalArgumentException("File names and contents cannot be null");
            }
            copy.put(entry.getKey(), entry.getValue().clone());
            total += entry.getValue().length;
        }
        this.files = Collections.unmodifiableMap(copy);
        this.totalBytes = total;
    }

    /**
     * File names, in name order.
     * @return Unmodifiable set of names
     */
    public Set<String> getFileNames() {
        return files.keySet();
    }

    /**
     * Get a copy of one file's content.
     * @param name File name
     * @return File bytes, or null if absent
     */
    public byte[] getFile(String name) {
        byte[] data = files.get(name);
        return data == null ? null : data.clone();
    }

    /**
     * Length of one file.
     * @param name File name
     * @return Length in bytes, or -1 if absent
     */
    public long getFileLength(String name) {
        byte[] data = files.get(name);
        return data == null ? -1 : data.length;
    }

    public int getFileCount() {
        return files.size();
    }

    /**
     * Sum of all file lengths.
     * @return Total bytes
     */
    public long getTotalBytes() {
        return totalBytes;
    }

    /**
     * SHA-1 of one file, upper-case hex.
     * @param name File name
     * @return Hex digest, or null if absent
     */
    public String sha1(String name) {
        byte[] data = files.get(name);
        if (data == null) {
            return null;
        }
        try {
            byte[] digest = MessageDigest.getInstance("SHA-1").digest(data);
            StringBuilder sb = new StringBuilder(digest.length * 2);
            for (byte b : digest) {
                sb.append(String.format("%02X", b));
            }
            return sb.toString();
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-1 is not available", e);
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof SegmentFiles)) return false;
        SegmentFiles other = (SegmentFiles) o;
        if (!files.keySet().equals(other.files.keySet())) return false;
        for (Map.Entry<String, byte[]> entry : files.entrySet()) {
            if (!Arrays.equals(entry.getValue(), other.files.get(entry.getKey()))) {
                return false;
            }
        }
        return true;
    }

    @Override
    public int hashCode() {
        int h = 1;
        for (Map.Entry<String, byte[]> entry : files.entrySet()) {
            h = 31 * h + entry.getKey().hashCode();
            h = 31 * h + Arrays.hashCode(entry.getValue());
        }
        return h;
    }

    @Override
    public String toString() {
        return String.format("SegmentFiles{files=%d, bytes=%d}", files.size(), totalBytes);
    }
}
