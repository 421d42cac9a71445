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
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * The ordered records of an archive and the code laying them out as a ZIP file:
 * local headers with payloads, then the central directory, then the end of central directory record.
 * <p>
 * Not thread-safe. The owning archive serializes access.
 */
final class ArchiveContents {

    private static final Logger logger = LoggerFactory.getLogger(ArchiveContents.class);

    static final int EOCD_SIGNATURE = 0x06054b50; // "PK\005\006"
    static final int EOCD_SIZE = 22;

    private final List<FileRecord> records = new ArrayList<>();

    void add(FileRecord record) {
        records.add(record);
    }

    void addAll(Collection<FileRecord> produced) {
        records.addAll(produced);
    }

    int size() {
        return records.size();
    }

    List<FileRecord> snapshot() {
        return new ArrayList<>(records);
    }

    /**
     * Writes the complete archive.
     *
     * @param out The sink, positioned where the archive starts
     * @param versionMadeBy The "version made by" value for central directory entries
     * @throws ArchiveCapacityException if the archive needs ZIP64
     * @throws IOException if the sink fails
     */
    void writeTo(ZipOutput out, int versionMadeBy) throws IOException {
        int entryCount = ArchiveCapacityException.checkU16(records.size(), "Entry count");
        long[] offsets = new long[entryCount];

        for (int i = 0; i < entryCount; i++) {
            FileRecord record = records.get(i);
            offsets[i] = ArchiveCapacityException.checkU32(out.position(),
                    "Local header offset of '" + record.getName() + "'");
            logger.debug("Local header for {} at offset {}: crc={}, compressed size={}, uncompressed size={}",
                    record.getName(), offsets[i], Long.toHexString(record.getCrc32()),
                    record.getCompressedSize(), record.getUncompressedSize());
            record.writeLocalFileHeaderAndData(out);
        }

        long centralDirOffset = ArchiveCapacityException.checkU32(out.position(), "Central directory offset");
        for (int i = 0; i < entryCount; i++) {
            records.get(i).writeCentralDirectoryEntry(out, offsets[i], versionMadeBy);
        }
        long centralDirSize = ArchiveCapacityException.checkU32(out.position() - centralDirOffset,
                "Central directory size");

        logger.debug("Central directory at offset {}, size {} bytes, {} entries",
                centralDirOffset, centralDirSize, entryCount);
        writeEndOfCentralDirectory(out, entryCount, centralDirSize, centralDirOffset);
    }

    private static void writeEndOfCentralDirectory(ZipOutput out, int entryCount, long centralDirSize,
                                                   long centralDirOffset) throws IOException {
        ByteBuffer eocd = ByteBuffer.allocate(EOCD_SIZE).order(ByteOrder.LITTLE_ENDIAN);
        eocd.putInt(EOCD_SIGNATURE);
        eocd.putShort((short) 0); // number of this disk
        eocd.putShort((short) 0); // disk where the central directory starts
        eocd.putShort((short) entryCount); // entries on this disk
        eocd.putShort((short) entryCount); // total entries
        eocd.putInt((int) centralDirSize);
        eocd.putInt((int) centralDirOffset);
        eocd.putShort((short) 0); // archive comment length
        eocd.flip();
        out.write(eocd);
    }
}
