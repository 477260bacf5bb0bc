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

package io.indextables.segsearch.format;

import io.indextables.segsearch.core.Schema;
import io.indextables.segsearch.engine.SegmentFiles;
import io.indextables.segsearch.exception.CorruptDataException;
import io.indextables.segsearch.exception.SchemaException;

import java.nio.BufferUnderflowException;
import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.nio.charset.StandardCharsets;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.zip.CRC32;

/**
 * Exchange format of an exported segment.
 *
 * Binary Format (big-endian):
 * [Header Magic: 4 bytes] "SGSG"
 * [Format Version: 2 bytes]
 * [Schema JSON Length: 4 bytes][Schema JSON: UTF-8]
 * [File Count: 4 bytes]
 * [File 1: Name Length 2 bytes, Name UTF-8, Data Length 4 bytes, Data]
 * ...
 * [File N]
 * [CRC32: 4 bytes] // over every preceding byte
 * [Footer Magic: 4 bytes] // Same as header magic for validation
 *
 * Files are written in name order, so equal content always encodes to equal bytes.
 */
public final class SegmentCodec {
    public static final int MAGIC_NUMBER = 0x53475347; // "SGSG" in ASCII
    public static final short FORMAT_VERSION = 1;

    private static final int HEADER_SIZE = 4 + 2;
    private static final int FOOTER_SIZE = 4 + 4;
    private static final int MIN_SIZE = HEADER_SIZE + 4 + 4 + FOOTER_SIZE;

    private SegmentCodec() {
    }

    /**
     * Decoded form of an exported segment.
     */
    public static final class Decoded {
        private final Schema schema;
        private final SegmentFiles files;

        Decoded(Schema schema, SegmentFiles files) {
            this.schema = schema;
            this.files = files;
        }

        public Schema getSchema() {
            return schema;
        }

        public SegmentFiles getFiles() {
            return files;
        }
    }

    /**
     * Encode a segment.
     * @param schema Schema the segment was built with
     * @param files Index files of the segment
     * @return Exported bytes
     */
    public static byte[] encode(Schema schema, SegmentFiles files) {
        byte[] schemaBytes = schema.toJson().getBytes(StandardCharsets.UTF_8);
        long size = HEADER_SIZE + 4L + schemaBytes.length + 4 + FOOTER_SIZE;
        for (String name : files.getFileNames()) {
            size += 2 + name.getBytes(StandardCharsets.UTF_8).length + 4 + files.getFileLength(name);
        }
        if (size > Integer.MAX_VALUE - 8) {
            throw new IllegalStateException("Segment too large to export: " + size + " bytes");
        }

        ByteBuffer buffer = ByteBuffer.allocate((int) size).order(ByteOrder.BIG_ENDIAN);
        buffer.putInt(MAGIC_NUMBER);
        buffer.putShort(FORMAT_VERSION);
        buffer.putInt(schemaBytes.length);
        buffer.put(schemaBytes);
        buffer.putInt(files.getFileCount());
        for (String name : files.getFileNames()) {
            byte[] nameBytes = name.getBytes(StandardCharsets.UTF_8);
            if (nameBytes.length > 65535) {
                throw new IllegalStateException("File name too long: " + name);
            }
            buffer.putShort((short) nameBytes.length);
            buffer.put(nameBytes);
            byte[] data = files.getFile(name);
            buffer.putInt(data.length);
            buffer.put(data);
        }

        CRC32 crc = new CRC32();
        crc.update(buffer.array(), 0, buffer.position());
        buffer.putInt((int) crc.getValue());
        buffer.putInt(MAGIC_NUMBER);
        return buffer.array();
    }

    /**
     * Decode exported bytes.
     * @param data Bytes produced by {@link #encode}
     * @return Schema and files
     * @throws CorruptDataException on wrong magic, unknown version, truncation,
     *         trailing bytes, checksum mismatch or an invalid schema
     */
    public static Decoded decode(byte[] data) {
        if (data == null) {
            throw new IllegalArgumentException("Segment data cannot be null");
        }
        if (data.length < MIN_SIZE) {
            throw new CorruptDataException("Segment data truncated: " + data.length + " bytes");
        }
        ByteBuffer buffer = ByteBuffer.wrap(data).order(ByteOrder.BIG_ENDIAN);
        if (buffer.getInt(0) != MAGIC_NUMBER) {
            throw new CorruptDataException(String.format("Not a segment: bad header magic 0x%08X", buffer.getInt(0)));
        }
        short version = buffer.getShort(4);
        if (version != FORMAT_VERSION) {
            throw new CorruptDataException("Unsupported segment format version " + version
                + " (expected " + FORMAT_VERSION + ")");
        }
        int footerMagic = buffer.getInt(data.length - 4);
        if (footerMagic != MAGIC_NUMBER) {
            throw new CorruptDataException("Segment data truncated or damaged: bad footer magic");
        }
        int bodyLength = data.length - FOOTER_SIZE;
        CRC32 crc = new CRC32();
        crc.update(data, 0, bodyLength);
        int expectedCrc = buffer.getInt(bodyLength);
        if ((int) crc.getValue() != expectedCrc) {
            throw new CorruptDataException(String.format("Checksum mismatch: stored 0x%08X, computed 0x%08X",
                expectedCrc, (int) crc.getValue()));
        }

        ByteBuffer body = ByteBuffer.wrap(data, 0, bodyLength).order(ByteOrder.BIG_ENDIAN);
        body.position(HEADER_SIZE);
        try {
            Schema schema = Schema.fromJson(new String(readBlock(body, body.getInt()), StandardCharsets.UTF_8));
            int fileCount = body.getInt();
            if (fileCount < 0) {
                throw new CorruptDataException("Negative file count " + fileCount);
            }
            Map<String, byte[]> files = new LinkedHashMap<>();
            for (int i = 0; i < fileCount; i++) {
                String name = new String(readBlock(body, Short.toUnsignedInt(body.getShort())), StandardCharsets.UTF_8);
                byte[] content = readBlock(body, body.getInt());
                if (files.put(name, content) != null) {
                    throw new CorruptDataException("Duplicate file '" + name + "' in segment data");
                }
            }
            if (body.hasRemaining()) {
                throw new CorruptDataException(body.remaining() + " unexpected bytes after the last file");
            }
            return new Decoded(schema, new SegmentFiles(files));
        } catch (BufferUnderflowException e) {
            throw new CorruptDataException("Segment data truncated", e);
        } catch (SchemaException e) {
            throw new CorruptDataException("Segment carries an invalid schema: " + e.getMessage(), e);
        }
    }

    private static byte[] readBlock(ByteBuffer buffer, int length) {
        if (length < 0 || length > buffer.remaining()) {
            throw new CorruptDataException("Block length " + length + " exceeds remaining " + buffer.remaining() + " bytes");
        }
        byte[] block = new byte[length];
        buffer.get(block);
        return block;
    }
}
