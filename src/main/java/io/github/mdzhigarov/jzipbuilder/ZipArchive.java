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
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.ByteBuffer;
import java.nio.channels.SeekableByteChannel;
import java.nio.file.Path;

/**
 * Builds a ZIP archive from files, in-memory data, streams and directory entries.
 * <p>
 * Files are queued and compressed in parallel by {@link #compress()}, or implicitly by
 * {@link #write(SeekableByteChannel)}. Directories are added immediately, in registration order.
 * The order of compressed files in the written archive is not guaranteed to match the order in
 * which they were added.
 * <p>
 * Registration methods may be called from several threads.
 */
public interface ZipArchive {

    /**
     * Queues a file read from the filesystem when the archive is compressed.
     * Its attributes and timestamps are taken from the file's metadata.
     *
     * @param fsPath The file to read
     * @param archiveName The name of the entry inside the archive (e.g., "docs/readme.txt")
     */
    default void addFile(Path fsPath, String archiveName) {
        addFile(fsPath, archiveName, EntryOptions.defaults());
    }

    /**
     * Queues a file read from the filesystem when the archive is compressed.
     * Attributes and extra fields set in the options replace the ones read from the file.
     *
     * @param fsPath The file to read
     * @param archiveName The name of the entry inside the archive
     * @param options Compression and metadata settings for the entry
     */
    void addFile(Path fsPath, String archiveName, EntryOptions options);

    default void addFileFromBytes(byte[] data, String archiveName) {
        addFileFromBytes(data, archiveName, EntryOptions.defaults());
    }

    /**
     * Queues in-memory data. The array must not be modified until it has been compressed.
     *
     * @param data The entry contents
     * @param archiveName The name of the entry inside the archive
     * @param options Compression and metadata settings for the entry
     */
    void addFileFromBytes(byte[] data, String archiveName, EntryOptions options);

    default void addFileFromBuffer(ByteBuffer data, String archiveName) {
        addFileFromBuffer(data, archiveName, EntryOptions.defaults());
    }

    /**
     * Queues the remaining bytes of a buffer. The buffer's position and limit are captured now,
     * its contents are read when the archive is compressed.
     *
     * @param data The entry contents, from position to limit
     * @param archiveName The name of the entry inside the archive
     * @param options Compression and metadata settings for the entry
     */
    void addFileFromBuffer(ByteBuffer data, String archiveName, EntryOptions options);

    default void addFileFromStream(InputStream stream, String archiveName) {
        addFileFromStream(stream, archiveName, EntryOptions.defaults());
    }

    /**
     * Queues a stream of unknown length. It is read to its end and closed when the archive is compressed.
     *
     * @param stream The entry contents
     * @param archiveName The name of the entry inside the archive
     * @param options Compression and metadata settings for the entry
     */
    void addFileFromStream(InputStream stream, String archiveName, EntryOptions options);

    default void addDirectory(String archiveName) {
        addDirectory(archiveName, EntryOptions.defaults());
    }

    /**
     * Adds a directory entry right away. A trailing '/' is appended to the name if missing.
     * Compression settings in the options are ignored, directories are always stored.
     *
     * @param archiveName The name of the directory inside the archive
     * @param options Attributes, extra fields and comment for the entry
     */
    void addDirectory(String archiveName, EntryOptions options);

    /**
     * Adds a directory entry right away, with attributes and extra fields read from an existing directory.
     *
     * @param fsPath The directory whose metadata is used
     * @param archiveName The name of the directory inside the archive
     * @throws IOException if the metadata cannot be read
     */
    void addDirectoryFromFilesystem(Path fsPath, String archiveName) throws IOException;

    /**
     * Compresses all queued files using one worker per available processor.
     *
     * @return The number of queued files processed
     * @throws IOException if a file could not be read or compressed
     */
    default int compress() throws IOException {
        return compress(defaultThreadCount());
    }

    /**
     * Compresses all files queued at the time of the call. Files queued while the pass runs are
     * left for the next pass. Blocks until every file of the pass has been processed.
     *
     * @param threads The number of workers, at least 1
     * @return The number of queued files processed
     * @throws EntryCompressionException if a file could not be read or compressed; the archive is
     *         failed afterwards
     * @throws ZipArchiveException if an earlier pass failed
     * @throws IOException if a file could not be read or compressed
     */
    int compress(int threads) throws IOException;

    default void write(SeekableByteChannel channel) throws IOException {
        write(channel, defaultThreadCount());
    }

    /**
     * Compresses pending files, then writes the archive starting at the channel's position.
     *
     * @param channel The destination
     * @param threads The number of workers for the implicit compression pass
     * @throws ZipArchiveException if an earlier pass failed
     * @throws IOException if compression or writing fails
     */
    void write(SeekableByteChannel channel, int threads) throws IOException;

    default void write(OutputStream stream) throws IOException {
        write(stream, defaultThreadCount());
    }

    /**
     * Compresses pending files, then writes the archive to a stream. Offsets are relative to the
     * first byte written. The stream is flushed but not closed.
     *
     * @param stream The destination
     * @param threads The number of workers for the implicit compression pass
     * @throws ZipArchiveException if an earlier pass failed
     * @throws IOException if compression or writing fails
     */
    void write(OutputStream stream, int threads) throws IOException;

    /**
     * @return The number of files waiting to be compressed
     */
    int pendingJobCount();

    /**
     * @return {@code true} once a compression pass has failed; the archive can then no longer be
     *         extended, compressed or written
     */
    boolean isFailed();

    /**
     * @return The number of entries ready to be written
     */
    int recordCount();

    /**
     * @return The number of available processors, at least 1
     */
    static int defaultThreadCount() {
        return Math.max(1, Runtime.getRuntime().availableProcessors());
    }

    /**
     * Creates an archive that aborts a compression pass on the first failing entry.
     */
    static ZipArchive newArchive() {
        return new ParallelZipArchive(FailurePolicy.ABORT);
    }

    /**
     * Creates an archive with the given handling of failing entries.
     */
    static ZipArchive newArchive(FailurePolicy failurePolicy) {
        return new ParallelZipArchive(failurePolicy);
    }
}
