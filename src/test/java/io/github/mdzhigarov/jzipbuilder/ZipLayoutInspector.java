package io.github.mdzhigarov.jzipbuilder;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.zip.DataFormatException;
import java.util.zip.Inflater;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Parses the structure of a written archive byte by byte: end of central directory record,
 * central directory entries and local file headers.
 */
class ZipLayoutInspector {
    private static final Logger logger = LoggerFactory.getLogger(ZipLayoutInspector.class);

    private static final int EOCD_SIGNATURE = 0x06054b50;
    private static final int CENTRAL_DIRECTORY_SIGNATURE = 0x02014b50;
    private static final int LOCAL_FILE_HEADER_SIGNATURE = 0x04034b50;
    private static final int EOCD_SIZE = 22;

    private final byte[] zip;
    private final long eocdOffset;
    private final int entriesOnDisk;
    private final int totalEntries;
    private final long centralDirSize;
    private final long centralDirOffset;
    private final List<CentralDirectoryEntry> entries;

    private ZipLayoutInspector(byte[] zip) {
        this.zip = zip;
        this.eocdOffset = findEndOfCentralDirectory(zip);

        ByteBuffer buffer = ByteBuffer.wrap(zip, (int) eocdOffset, EOCD_SIZE).order(ByteOrder.LITTLE_ENDIAN);
        buffer.getInt(); // Skip signature
        int diskNumber = buffer.getShort() & 0xFFFF;
        int centralDirDisk = buffer.getShort() & 0xFFFF;
        if (diskNumber != 0 || centralDirDisk != 0) {
            throw new IllegalStateException("Unexpected disk numbers: " + diskNumber + ", " + centralDirDisk);
        }
        this.entriesOnDisk = buffer.getShort() & 0xFFFF;
        this.totalEntries = buffer.getShort() & 0xFFFF;
        this.centralDirSize = buffer.getInt() & 0xFFFFFFFFL;
        this.centralDirOffset = buffer.getInt() & 0xFFFFFFFFL;
        int commentLength = buffer.getShort() & 0xFFFF;
        if (commentLength != 0) {
            throw new IllegalStateException("Unexpected archive comment of length " + commentLength);
        }
        logger.debug("EOCD parsed - Total entries: {}, Central dir size: {}, Central dir offset: {}",
                totalEntries, centralDirSize, centralDirOffset);
        this.entries = parseCentralDirectoryEntries();
    }

    static ZipLayoutInspector parse(byte[] zip) {
        return new ZipLayoutInspector(zip);
    }

    private static long findEndOfCentralDirectory(byte[] data) {
        for (int i = data.length - EOCD_SIZE; i >= 0; i--) {
            int signature = ((data[i] & 0xFF)
                    | ((data[i + 1] & 0xFF) << 8)
                    | ((data[i + 2] & 0xFF) << 16)
                    | ((data[i + 3] & 0xFF) << 24));
            if (signature == EOCD_SIGNATURE) {
                return i;
            }
        }
        throw new IllegalStateException("Could not find End of Central Directory record");
    }

    private List<CentralDirectoryEntry> parseCentralDirectoryEntries() {
        List<CentralDirectoryEntry> parsed = new ArrayList<>();
        ByteBuffer buffer = ByteBuffer.wrap(zip).order(ByteOrder.LITTLE_ENDIAN);
        buffer.position((int) centralDirOffset);

        while (buffer.position() < eocdOffset) {
            int signature = buffer.getInt();
            if (signature != CENTRAL_DIRECTORY_SIGNATURE) {
                throw new IllegalStateException("Invalid central directory signature at "
                        + (buffer.position() - 4) + ": 0x" + Integer.toHexString(signature));
            }
            int versionMadeBy = buffer.getShort() & 0xFFFF;
            int versionNeeded = buffer.getShort() & 0xFFFF;
            int flags = buffer.getShort() & 0xFFFF;
            int compressionMethod = buffer.getShort() & 0xFFFF;
            int lastModTime = buffer.getShort() & 0xFFFF;
            int lastModDate = buffer.getShort() & 0xFFFF;
            long crc32 = buffer.getInt() & 0xFFFFFFFFL;
            long compressedSize = buffer.getInt() & 0xFFFFFFFFL;
            long uncompressedSize = buffer.getInt() & 0xFFFFFFFFL;
            int fileNameLength = buffer.getShort() & 0xFFFF;
            int extraFieldLength = buffer.getShort() & 0xFFFF;
            int fileCommentLength = buffer.getShort() & 0xFFFF;
            int diskNumber = buffer.getShort() & 0xFFFF;
            int internalAttributes = buffer.getShort() & 0xFFFF;
            long externalAttributes = buffer.getInt() & 0xFFFFFFFFL;
            long localHeaderOffset = buffer.getInt() & 0xFFFFFFFFL;

            byte[] fileNameBytes = new byte[fileNameLength];
            buffer.get(fileNameBytes);
            byte[] extra = new byte[extraFieldLength];
            buffer.get(extra);
            byte[] comment = new byte[fileCommentLength];
            buffer.get(comment);

            if (lastModTime != 0 || lastModDate != 0 || diskNumber != 0 || internalAttributes != 0) {
                throw new IllegalStateException("Unexpected non-zero reserved fields for "
                        + new String(fileNameBytes, StandardCharsets.UTF_8));
            }

            parsed.add(new CentralDirectoryEntry(new String(fileNameBytes, StandardCharsets.UTF_8),
                    versionMadeBy, versionNeeded, flags, compressionMethod, crc32, compressedSize,
                    uncompressedSize, externalAttributes, localHeaderOffset, extra,
                    fileCommentLength == 0 ? null : new String(comment, StandardCharsets.UTF_8)));
        }
        if (buffer.position() != eocdOffset) {
            throw new IllegalStateException("Central directory overruns the EOCD record");
        }
        return Collections.unmodifiableList(parsed);
    }

    int getEntriesOnDisk() {
        return entriesOnDisk;
    }

    int getTotalEntries() {
        return totalEntries;
    }

    long getCentralDirectorySize() {
        return centralDirSize;
    }

    long getCentralDirectoryOffset() {
        return centralDirOffset;
    }

    /**
     * @return The number of bytes between the declared central directory start and the EOCD record
     */
    long getActualCentralDirectorySpan() {
        return eocdOffset - centralDirOffset;
    }

    long getEndOfCentralDirectoryOffset() {
        return eocdOffset;
    }

    List<CentralDirectoryEntry> getEntries() {
        return entries;
    }

    CentralDirectoryEntry entry(String name) {
        return entries.stream()
                .filter(e -> e.getName().equals(name))
                .findFirst()
                .orElseThrow(() -> new AssertionError("No entry named " + name));
    }

    LocalHeader localHeader(CentralDirectoryEntry entry) {
        ByteBuffer buffer = ByteBuffer.wrap(zip).order(ByteOrder.LITTLE_ENDIAN);
        buffer.position((int) entry.getLocalHeaderOffset());
        int signature = buffer.getInt();
        if (signature != LOCAL_FILE_HEADER_SIGNATURE) {
            throw new IllegalStateException("Invalid local file header signature for " + entry.getName());
        }
        int versionNeeded = buffer.getShort() & 0xFFFF;
        int flags = buffer.getShort() & 0xFFFF;
        int compressionMethod = buffer.getShort() & 0xFFFF;
        int lastModTime = buffer.getShort() & 0xFFFF;
        int lastModDate = buffer.getShort() & 0xFFFF;
        long crc32 = buffer.getInt() & 0xFFFFFFFFL;
        long compressedSize = buffer.getInt() & 0xFFFFFFFFL;
        long uncompressedSize = buffer.getInt() & 0xFFFFFFFFL;
        int fileNameLength = buffer.getShort() & 0xFFFF;
        int extraFieldLength = buffer.getShort() & 0xFFFF;
        byte[] fileNameBytes = new byte[fileNameLength];
        buffer.get(fileNameBytes);
        byte[] extra = new byte[extraFieldLength];
        buffer.get(extra);
        return new LocalHeader(new String(fileNameBytes, StandardCharsets.UTF_8), versionNeeded, flags,
                compressionMethod, lastModTime, lastModDate, crc32, compressedSize, uncompressedSize, extra,
                buffer.position());
    }

    /**
     * @return The raw payload stored after the entry's local header
     */
    byte[] payload(CentralDirectoryEntry entry) {
        LocalHeader header = localHeader(entry);
        byte[] data = new byte[(int) header.getCompressedSize()];
        System.arraycopy(zip, (int) header.getDataOffset(), data, 0, data.length);
        return data;
    }

    /**
     * @return The entry's uncompressed contents
     */
    byte[] contents(CentralDirectoryEntry entry) throws IOException {
        byte[] payload = payload(entry);
        if (entry.getCompressionMethod() == 0) {
            return payload;
        }
        Inflater inflater = new Inflater(true);
        try {
            inflater.setInput(payload);
            ByteArrayOutputStream out = new ByteArrayOutputStream();
            byte[] chunk = new byte[8192];
            while (!inflater.finished()) {
                int n = inflater.inflate(chunk);
                if (n == 0 && (inflater.needsInput() || inflater.needsDictionary())) {
                    throw new IOException("Truncated deflate stream for " + entry.getName());
                }
                out.write(chunk, 0, n);
            }
            return out.toByteArray();
        } catch (DataFormatException e) {
            throw new IOException("Corrupt deflate stream for " + entry.getName(), e);
        } finally {
            inflater.end();
        }
    }

    /**
     * A parsed central directory entry.
     */
    static class CentralDirectoryEntry {
        private final String name;
        private final int versionMadeBy;
        private final int versionNeeded;
        private final int flags;
        private final int compressionMethod;
        private final long crc32;
        private final long compressedSize;
        private final long uncompressedSize;
        private final long externalAttributes;
        private final long localHeaderOffset;
        private final byte[] extra;
        private final String comment;

        CentralDirectoryEntry(String name, int versionMadeBy, int versionNeeded, int flags, int compressionMethod,
                              long crc32, long compressedSize, long uncompressedSize, long externalAttributes,
                              long localHeaderOffset, byte[] extra, String comment) {
            this.name = name;
            this.versionMadeBy = versionMadeBy;
            this.versionNeeded = versionNeeded;
            this.flags = flags;
            this.compressionMethod = compressionMethod;
            this.crc32 = crc32;
            this.compressedSize = compressedSize;
            this.uncompressedSize = uncompressedSize;
            this.externalAttributes = externalAttributes;
            this.localHeaderOffset = localHeaderOffset;
            this.extra = extra;
            this.comment = comment;
        }

        String getName() {
            return name;
        }

        int getVersionMadeBy() {
            return versionMadeBy;
        }

        int getVersionNeeded() {
            return versionNeeded;
        }

        int getFlags() {
            return flags;
        }

        int getCompressionMethod() {
            return compressionMethod;
        }

        long getCrc32() {
            return crc32;
        }

        long getCompressedSize() {
            return compressedSize;
        }

        long getUncompressedSize() {
            return uncompressedSize;
        }

        long getExternalAttributes() {
            return externalAttributes;
        }

        long getLocalHeaderOffset() {
            return localHeaderOffset;
        }

        byte[] getExtra() {
            return extra;
        }

        String getComment() {
            return comment;
        }

        @Override
        public String toString() {
            return String.format("CentralDirectoryEntry{name='%s', offset=%d, compressedSize=%d, uncompressedSize=%d, compressionMethod=%d}",
                    name, localHeaderOffset, compressedSize, uncompressedSize, compressionMethod);
        }
    }

    /**
     * A parsed local file header.
     */
    static class LocalHeader {
        private final String name;
        private final int versionNeeded;
        private final int flags;
        private final int compressionMethod;
        private final int lastModTime;
        private final int lastModDate;
        private final long crc32;
        private final long compressedSize;
        private final long uncompressedSize;
        private final byte[] extra;
        private final long dataOffset;

        LocalHeader(String name, int versionNeeded, int flags, int compressionMethod, int lastModTime,
                    int lastModDate, long crc32, long compressedSize, long uncompressedSize, byte[] extra,
                    long dataOffset) {
            this.name = name;
            this.versionNeeded = versionNeeded;
            this.flags = flags;
            this.compressionMethod = compressionMethod;
            this.lastModTime = lastModTime;
            this.lastModDate = lastModDate;
            this.crc32 = crc32;
            this.compressedSize = compressedSize;
            this.uncompressedSize = uncompressedSize;
            this.extra = extra;
            this.dataOffset = dataOffset;
        }

        String getName() {
            return name;
        }

        int getVersionNeeded() {
            return versionNeeded;
        }

        int getFlags() {
            return flags;
        }

        int getCompressionMethod() {
            return compressionMethod;
        }

        int getLastModTime() {
            return lastModTime;
        }

        int getLastModDate() {
            return lastModDate;
        }

        long getCrc32() {
            return crc32;
        }

        long getCompressedSize() {
            return compressedSize;
        }

        long getUncompressedSize() {
            return uncompressedSize;
        }

        byte[] getExtra() {
            return extra;
        }

        long getDataOffset() {
            return dataOffset;
        }
    }
}
