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

import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.nio.charset.StandardCharsets;

/**
 * A compressed and checksummed entry, ready to be written.
 * Holds everything needed for its local file header, payload and central directory entry.
 */
final class FileRecord {

    static final int LOCAL_FILE_HEADER_SIGNATURE = 0x04034b50; // "PK\003\004"
    static final int CENTRAL_DIRECTORY_SIGNATURE = 0x02014b50; // "PK\001\002"
    static final int LOCAL_FILE_HEADER_SIZE = 30;
    static final int CENTRAL_DIRECTORY_HEADER_SIZE = 46;
    static final int VERSION_NEEDED_TO_EXTRACT = 20;
    /** Bit 11: file name and comment are UTF-8. */
    static final int GENERAL_PURPOSE_FLAGS = 1 << 11;

    private final CompressionType compressionType;
    private final long crc32;
    private final long uncompressedSize;
    private final byte[] data;
    private final String name;
    private final long externalAttributes;
    private final ExtraFields extraFields;
    private final String comment;

    FileRecord(CompressionType compressionType, long crc32, long uncompressedSize, byte[] data,
               String name, int attributes, ExtraFields extraFields, String comment) {
        this.compressionType = compressionType;
        this.crc32 = crc32;
        this.uncompressedSize = uncompressedSize;
        this.data = data;
        this.name = name;
        this.externalAttributes = packAttributes(attributes);
        this.extraFields = extraFields;
        this.comment = comment;
    }

    /**
     * Creates the record of a directory: stored, empty, CRC 0, name ending with '/'.
     */
    static FileRecord directory(String name, int attributes, ExtraFields extraFields, String comment) {
        return new FileRecord(CompressionType.STORED, 0, 0, new byte[0],
                directoryName(name), attributes, extraFields, comment);
    }

    static String directoryName(String name) {
        if (name.endsWith("/") || name.endsWith("\\")) {
            return name;
        }
        return name + "/";
    }

    /** Platform attributes go into the high 16 bits of the 32-bit external attributes field. */
    static long packAttributes(int attributes) {
        return ((long) (attributes & 0xFFFF)) << 16;
    }

    CompressionType getCompressionType() {
        return compressionType;
    }

    /**
     * @return The CRC-32 of the uncompressed data
     */
    long getCrc32() {
        return crc32;
    }

    long getUncompressedSize() {
        return uncompressedSize;
    }

    long getCompressedSize() {
        return data.length;
    }

    /**
     * @return The payload as written after the local header
     */
    byte[] getData() {
        return data;
    }

    String getName() {
        return name;
    }

    /**
     * @return The packed 32-bit external attributes
     */
    long getExternalAttributes() {
        return externalAttributes;
    }

    ExtraFields getExtraFields() {
        return extraFields;
    }

    String getComment() {
        return comment;
    }

    boolean isDirectory() {
        return name.endsWith("/") || name.endsWith("\\");
    }

    /**
     * Writes the local file header followed by the payload.
     */
    void writeLocalFileHeaderAndData(ZipOutput out) throws IOException {
        byte[] nameBytes = name.getBytes(StandardCharsets.UTF_8);
        byte[] extra = extraFields.toBytes(false);
        int nameLength = ArchiveCapacityException.checkU16(nameBytes.length, "File name length of '" + name + "'");

        ByteBuffer header = ByteBuffer.allocate(LOCAL_FILE_HEADER_SIZE + nameBytes.length + extra.length)
                .order(ByteOrder.LITTLE_ENDIAN);
        header.putInt(LOCAL_FILE_HEADER_SIGNATURE);
        header.putShort((short) VERSION_NEEDED_TO_EXTRACT);
        header.putShort((short) GENERAL_PURPOSE_FLAGS);
        header.putShort((short) compressionType.getMethod());
        header.putShort((short) 0); // last mod time, carried by extra fields instead
        header.putShort((short) 0); // last mod date
        header.putInt((int) crc32);
        header.putInt((int) ArchiveCapacityException.checkU32(data.length, "Compressed size of '" + name + "'"));
        header.putInt((int) ArchiveCapacityException.checkU32(uncompressedSize, "Uncompressed size of '" + name + "'"));
        header.putShort((short) nameLength);
        header.putShort((short) extra.length);
        header.put(nameBytes);
        header.put(extra);
        header.flip();

        out.write(header);
        out.write(ByteBuffer.wrap(data));
    }

    /**
     * Writes the central directory entry pointing at a local header written at the given offset.
     */
    void writeCentralDirectoryEntry(ZipOutput out, long localHeaderOffset, int versionMadeBy) throws IOException {
        byte[] nameBytes = name.getBytes(StandardCharsets.UTF_8);
        byte[] extra = extraFields.toBytes(true);
        byte[] commentBytes = comment == null ? new byte[0] : comment.getBytes(StandardCharsets.UTF_8);
        int nameLength = ArchiveCapacityException.checkU16(nameBytes.length, "File name length of '" + name + "'");
        int commentLength = ArchiveCapacityException.checkU16(commentBytes.length, "Comment length of '" + name + "'");

        ByteBuffer header = ByteBuffer.allocate(
                        CENTRAL_DIRECTORY_HEADER_SIZE + nameBytes.length + extra.length + commentBytes.length)
                .order(ByteOrder.LITTLE_ENDIAN);
        header.putInt(CENTRAL_DIRECTORY_SIGNATURE);
        header.putShort((short) versionMadeBy);
        header.putShort((short) VERSION_NEEDED_TO_EXTRACT);
        header.putShort((short) GENERAL_PURPOSE_FLAGS);
        header.putShort((short) compressionType.getMethod());
        header.putShort((short) 0); // last mod time
        header.putShort((short) 0); // last mod date
        header.putInt((int) crc32);
        header.putInt((int) ArchiveCapacityException.checkU32(data.length, "Compressed size of '" + name + "'"));
        header.putInt((int) ArchiveCapacityException.checkU32(uncompressedSize, "Uncompressed size of '" + name + "'"));
        header.putShort((short) nameLength);
        header.putShort((short) extra.length);
        header.putShort((short) commentLength);
        header.putShort((short) 0); // disk number start
        header.putShort((short) 0); // internal attributes
        header.putInt((int) externalAttributes);
        header.putInt((int) ArchiveCapacityException.checkU32(localHeaderOffset, "Local header offset of '" + name + "'"));
        header.put(nameBytes);
        header.put(extra);
        header.put(commentBytes);
        header.flip();

        out.write(header);
    }

    @Override
    public String toString() {
        return String.format("FileRecord{name='%s', type=%s, crc32=%08x, compressedSize=%d, uncompressedSize=%d}",
                name, compressionType, crc32, data.length, uncompressedSize);
    }
}
