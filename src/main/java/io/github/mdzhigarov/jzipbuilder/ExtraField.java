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

import java.nio.ByteBuffer;
import java.nio.file.attribute.FileTime;
import java.util.Objects;
import java.util.concurrent.TimeUnit;

/**
 * Metadata block attached to an entry, written as {header id, data length, data}.
 * <p>
 * Only filesystem properties are modelled: NTFS timestamps, the Info-ZIP extended timestamp
 * and the Info-ZIP Unix ownership field. A field may encode differently in the local header
 * and in the central directory, so every size is computed for a given placement.
 */
public abstract class ExtraField {

    /** Size of the header id and data length prefix of every field. */
    static final int HEADER_SIZE = 4;

    ExtraField() {
    }

    /**
     * @return The 16-bit header id identifying the field type
     */
    public abstract int getHeaderId();

    /**
     * Returns the length of the data that follows the 4-byte field header.
     *
     * @param central {@code true} for the central directory copy, {@code false} for the local header
     * @return The data length in bytes
     */
    public abstract int dataLength(boolean central);

    /**
     * Returns the full encoded size including the 4-byte field header.
     */
    public final int encodedLength(boolean central) {
        return HEADER_SIZE + dataLength(central);
    }

    /**
     * Writes the field, header included, at the buffer's position. The buffer must be little-endian.
     */
    final void writeTo(ByteBuffer buffer, boolean central) {
        buffer.putShort((short) getHeaderId());
        buffer.putShort((short) dataLength(central));
        writeData(buffer, central);
    }

    abstract void writeData(ByteBuffer buffer, boolean central);

    /**
     * Creates an NTFS timestamp field from raw NTFS tick values (100 ns units since 1601-01-01).
     */
    public static Ntfs ntfs(long mtime, long atime, long ctime) {
        return new Ntfs(mtime, atime, ctime);
    }

    /**
     * Creates an extended timestamp field. Any of the times may be {@code null} when unknown.
     *
     * @param modifyTime Modification time in seconds since the epoch
     * @param accessTime Access time in seconds since the epoch
     * @param createTime Creation time in seconds since the epoch
     */
    public static ExtendedTimestamp extendedTimestamp(Integer modifyTime, Integer accessTime, Integer createTime) {
        return new ExtendedTimestamp(modifyTime, accessTime, createTime);
    }

    /**
     * Creates a Unix ownership field.
     */
    public static UnixOwnership unixOwnership(int uid, int gid) {
        return new UnixOwnership(uid, gid);
    }

    /**
     * NTFS file times (header id 0x000A). 32 bytes of data in both placements.
     */
    public static final class Ntfs extends ExtraField {
        static final int HEADER_ID = 0x000A;
        private static final int DATA_LENGTH = 32;
        private static final int TIMES_TAG = 1;
        private static final int TIMES_TAG_SIZE = 24;
        /** NTFS ticks between 1601-01-01 and 1970-01-01. */
        private static final long EPOCH_OFFSET_TICKS = 116_444_736_000_000_000L;

        private final long mtime;
        private final long atime;
        private final long ctime;

        private Ntfs(long mtime, long atime, long ctime) {
            this.mtime = mtime;
            this.atime = atime;
            this.ctime = ctime;
        }

        /**
         * Converts a file time to NTFS ticks.
         */
        public static long toNtfsTicks(FileTime time) {
            return time.to(TimeUnit.MICROSECONDS) * 10 + EPOCH_OFFSET_TICKS;
        }

        public long getModifyTime() {
            return mtime;
        }

        public long getAccessTime() {
            return atime;
        }

        public long getCreateTime() {
            return ctime;
        }

        @Override
        public int getHeaderId() {
            return HEADER_ID;
        }

        @Override
        public int dataLength(boolean central) {
            return DATA_LENGTH;
        }

        @Override
        void writeData(ByteBuffer buffer, boolean central) {
            buffer.putInt(0); // reserved
            buffer.putShort((short) TIMES_TAG);
            buffer.putShort((short) TIMES_TAG_SIZE);
            buffer.putLong(mtime);
            buffer.putLong(atime);
            buffer.putLong(ctime);
        }

        @Override
        public boolean equals(Object o) {
            if (this == o) {
                return true;
            }
            if (!(o instanceof Ntfs)) {
                return false;
            }
            Ntfs other = (Ntfs) o;
            return mtime == other.mtime && atime == other.atime && ctime == other.ctime;
        }

        @Override
        public int hashCode() {
            return Objects.hash(mtime, atime, ctime);
        }

        @Override
        public String toString() {
            return String.format("Ntfs{mtime=%d, atime=%d, ctime=%d}", mtime, atime, ctime);
        }
    }

    /**
     * Info-ZIP extended timestamp (header id 0x5455).
     * <p>
     * The central directory copy keeps the flags byte but carries the modification time only.
     */
    public static final class ExtendedTimestamp extends ExtraField {
        static final int HEADER_ID = 0x5455;
        static final int MODIFY_TIME_PRESENT = 1;
        static final int ACCESS_TIME_PRESENT = 1 << 1;
        static final int CREATE_TIME_PRESENT = 1 << 2;

        private final Integer modifyTime;
        private final Integer accessTime;
        private final Integer createTime;

        private ExtendedTimestamp(Integer modifyTime, Integer accessTime, Integer createTime) {
            this.modifyTime = modifyTime;
            this.accessTime = accessTime;
            this.createTime = createTime;
        }

        public Integer getModifyTime() {
            return modifyTime;
        }

        public Integer getAccessTime() {
            return accessTime;
        }

        public Integer getCreateTime() {
            return createTime;
        }

        int flags() {
            int flags = 0;
            if (modifyTime != null) {
                flags |= MODIFY_TIME_PRESENT;
            }
            if (accessTime != null) {
                flags |= ACCESS_TIME_PRESENT;
            }
            if (createTime != null) {
                flags |= CREATE_TIME_PRESENT;
            }
            return flags;
        }

        @Override
        public int getHeaderId() {
            return HEADER_ID;
        }

        @Override
        public int dataLength(boolean central) {
            int length = 1 + sizeOf(modifyTime);
            if (!central) {
                length += sizeOf(accessTime) + sizeOf(createTime);
            }
            return length;
        }

        private static int sizeOf(Integer time) {
            return time == null ? 0 : Integer.BYTES;
        }

        @Override
        void writeData(ByteBuffer buffer, boolean central) {
            buffer.put((byte) flags());
            if (modifyTime != null) {
                buffer.putInt(modifyTime);
            }
            if (central) {
                return;
            }
            if (accessTime != null) {
                buffer.putInt(accessTime);
            }
            if (createTime != null) {
                buffer.putInt(createTime);
            }
        }

        @Override
        public boolean equals(Object o) {
            if (this == o) {
                return true;
            }
            if (!(o instanceof ExtendedTimestamp)) {
                return false;
            }
            ExtendedTimestamp other = (ExtendedTimestamp) o;
            return Objects.equals(modifyTime, other.modifyTime)
                    && Objects.equals(accessTime, other.accessTime)
                    && Objects.equals(createTime, other.createTime);
        }

        @Override
        public int hashCode() {
            return Objects.hash(modifyTime, accessTime, createTime);
        }

        @Override
        public String toString() {
            return String.format("ExtendedTimestamp{modifyTime=%s, accessTime=%s, createTime=%s}",
                    modifyTime, accessTime, createTime);
        }
    }

    /**
     * Info-ZIP Unix ownership, version 1 (header id 0x7875). Both ids are written as 4 bytes.
     */
    public static final class UnixOwnership extends ExtraField {
        static final int HEADER_ID = 0x7875;
        private static final int VERSION = 1;
        private static final int DATA_LENGTH = 11;

        private final int uid;
        private final int gid;

        private UnixOwnership(int uid, int gid) {
            this.uid = uid;
            this.gid = gid;
        }

        public int getUid() {
            return uid;
        }

        public int getGid() {
            return gid;
        }

        @Override
        public int getHeaderId() {
            return HEADER_ID;
        }

        @Override
        public int dataLength(boolean central) {
            return DATA_LENGTH;
        }

        @Override
        void writeData(ByteBuffer buffer, boolean central) {
            buffer.put((byte) VERSION);
            buffer.put((byte) Integer.BYTES);
            buffer.putInt(uid);
            buffer.put((byte) Integer.BYTES);
            buffer.putInt(gid);
        }

        @Override
        public boolean equals(Object o) {
            if (this == o) {
                return true;
            }
            if (!(o instanceof UnixOwnership)) {
                return false;
            }
            UnixOwnership other = (UnixOwnership) o;
            return uid == other.uid && gid == other.gid;
        }

        @Override
        public int hashCode() {
            return Objects.hash(uid, gid);
        }

        @Override
        public String toString() {
            return "UnixOwnership{uid=" + uid + ", gid=" + gid + "}";
        }
    }
}
