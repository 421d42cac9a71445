/*
 * Copyright 2024 mdzhigarov
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package io.github.mdzhigarov.jzipbuilder;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.util.Objects;
import java.util.zip.CRC32;
import java.util.zip.CheckedInputStream;
import java.util.zip.Deflater;
import java.util.zip.DeflaterInputStream;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * An entry waiting to be compressed. Turned into a {@link FileRecord} by a worker.
 */
final class ZipJob {

    private static final Logger logger = LoggerFactory.getLogger(ZipJob.class);

    private static final int DEFAULT_BUFFER_SIZE = 8192;
    /** Upper bound for the payload buffer allocated up front. */
    private static final long MAX_PREALLOCATION = 64L * 1024 * 1024;
    /** Largest payload a byte array can hold. */
    static final long MAX_PAYLOAD_SIZE = Integer.MAX_VALUE - 8;

    private final String archivePath;
    private final DataOrigin origin;
    private final CompressionLevel compressionLevel;
    private final CompressionType compressionType;
    private final Integer externalAttributes;
    private final ExtraFields extraFields;
    private final String comment;
    private final long maxPayloadSize;

    ZipJob(String archivePath, DataOrigin origin, EntryOptions options) {
        this(archivePath, origin, options, MAX_PAYLOAD_SIZE);
    }

    ZipJob(String archivePath, DataOrigin origin, EntryOptions options, long maxPayloadSize) {
        this.archivePath = Objects.requireNonNull(archivePath, "archivePath");
        this.origin = Objects.requireNonNull(origin, "origin");
        this.compressionLevel = options.getCompressionLevel();
        this.compressionType = options.getCompressionType();
        this.externalAttributes = options.getExternalAttributes();
        this.extraFields = options.getExtraFields();
        this.comment = options.getComment();
        this.maxPayloadSize = maxPayloadSize;
    }

    String getArchivePath() {
        return archivePath;
    }

    DataOrigin getOrigin() {
        return origin;
    }

    CompressionType getCompressionType() {
        return compressionType;
    }

    CompressionLevel getCompressionLevel() {
        return compressionLevel;
    }

    /**
     * Reads the whole source through a CRC-32 accumulator and the compressor.
     *
     * @return The finished record
     * @throws IOException if the source cannot be read or the entry does not fit into 32-bit sizes
     */
    FileRecord toFileRecord() throws IOException {
        int attributes = externalAttributes != null ? externalAttributes : origin.defaultAttributes();
        ExtraFields fields = extraFields != null ? extraFields : origin.defaultExtraFields();

        long sizeHint = origin.sizeHint();
        if (sizeHint > ArchiveCapacityException.MAX_U32) {
            throw new ArchiveCapacityException("Entry '" + archivePath + "' has " + sizeHint
                    + " bytes, ZIP64 would be required");
        }
        if (compressionType == CompressionType.STORED && sizeHint > maxPayloadSize) {
            throw new ArchiveCapacityException("Entry '" + archivePath + "' has " + sizeHint
                    + " bytes, more than the " + maxPayloadSize + " bytes an in-memory payload can hold");
        }
        PayloadBuffer payload = new PayloadBuffer(initialCapacity(sizeHint), maxPayloadSize, archivePath);
        CRC32 crc = new CRC32();
        long uncompressedSize;

        try (InputStream source = origin.open();
             CheckedInputStream checked = new CheckedInputStream(source, crc)) {
            if (compressionType == CompressionType.DEFLATE) {
                Deflater deflater = compressionLevel.newDeflater();
                try {
                    DeflaterInputStream deflating = new DeflaterInputStream(checked, deflater);
                    deflating.transferTo(payload);
                    uncompressedSize = deflater.getBytesRead();
                } finally {
                    deflater.end();
                }
            } else {
                uncompressedSize = checked.transferTo(payload);
            }
        }

        ArchiveCapacityException.checkU32(uncompressedSize, "Uncompressed size of '" + archivePath + "'");
        ArchiveCapacityException.checkU32(payload.size(), "Compressed size of '" + archivePath + "'");

        FileRecord record = new FileRecord(compressionType, crc.getValue(), uncompressedSize,
                payload.toByteArray(), archivePath, attributes, fields, comment);
        logger.debug("Compressed {} from {}: {} -> {} bytes", archivePath, origin, uncompressedSize,
                record.getCompressedSize());
        return record;
    }

    private int initialCapacity(long sizeHint) {
        if (sizeHint < 0) {
            return DEFAULT_BUFFER_SIZE;
        }
        long capacity = compressionType == CompressionType.STORED ? sizeHint : sizeHint / 2;
        return (int) Math.max(DEFAULT_BUFFER_SIZE, Math.min(capacity, MAX_PREALLOCATION));
    }

    /**
     * Collects the payload and fails once it would outgrow a byte array.
     */
    private static final class PayloadBuffer extends OutputStream {
        private final ByteArrayOutputStream buffer;
        private final long limit;
        private final String archivePath;

        PayloadBuffer(int initialCapacity, long limit, String archivePath) {
            this.buffer = new ByteArrayOutputStream(initialCapacity);
            this.limit = limit;
            this.archivePath = archivePath;
        }

        @Override
        public void write(int b) throws IOException {
            ensureRoom(1);
            buffer.write(b);
        }

        @Override
        public void write(byte[] b, int off, int len) throws IOException {
            ensureRoom(len);
            buffer.write(b, off, len);
        }

        private void ensureRoom(int len) throws ArchiveCapacityException {
            if ((long) buffer.size() + len > limit) {
                throw new ArchiveCapacityException("Payload of '" + archivePath + "' exceeds "
                        + limit + " bytes, the most an in-memory payload can hold");
            }
        }

        int size() {
            return buffer.size();
        }

        byte[] toByteArray() {
            return buffer.toByteArray();
        }
    }

    @Override
    public String toString() {
        return "ZipJob{archivePath='" + archivePath + "', origin=" + origin + ", type=" + compressionType
                + ", level=" + compressionLevel.getValue() + "}";
    }
}
