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
import java.nio.file.Files;
import java.nio.file.NotDirectoryException;
import java.nio.file.Path;
import java.util.List;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Implementation of ZipArchive that compresses queued files on a pool of worker threads.
 * <p>
 * Two structures are shared: the job queue, guarded by its own lock, and the archive contents,
 * guarded by this object's contents monitor. Directories are appended to the contents when
 * registered, compressed files once every worker of a pass has finished.
 * <p>
 * A pass that fails loses the files it had drained, so the archive is marked failed: further
 * registrations throw {@link IllegalStateException}, {@code compress} and {@code write} throw a
 * {@link ZipArchiveException} caused by the original failure.
 */
public class ParallelZipArchive implements ZipArchive {

    private static final Logger logger = LoggerFactory.getLogger(ParallelZipArchive.class);

    private final JobQueue jobs = new JobQueue();
    private final ArchiveContents contents = new ArchiveContents();
    private final FailurePolicy failurePolicy;
    private volatile IOException failure;

    public ParallelZipArchive(FailurePolicy failurePolicy) {
        this.failurePolicy = Objects.requireNonNull(failurePolicy, "failurePolicy");
    }

    @Override
    public void addFile(Path fsPath, String archiveName, EntryOptions options) {
        enqueue(archiveName, DataOrigin.filesystem(fsPath), options);
    }

    @Override
    public void addFileFromBytes(byte[] data, String archiveName, EntryOptions options) {
        Objects.requireNonNull(data, "data");
        enqueue(archiveName, DataOrigin.buffer(ByteBuffer.wrap(data)), options);
    }

    @Override
    public void addFileFromBuffer(ByteBuffer data, String archiveName, EntryOptions options) {
        enqueue(archiveName, DataOrigin.buffer(data), options);
    }

    @Override
    public void addFileFromStream(InputStream stream, String archiveName, EntryOptions options) {
        enqueue(archiveName, DataOrigin.stream(stream), options);
    }

    private void enqueue(String archiveName, DataOrigin origin, EntryOptions options) {
        Objects.requireNonNull(options, "options");
        checkNotFailed();
        ZipJob job = new ZipJob(archiveName, origin, options);
        jobs.add(job);
        logger.debug("Queued {}", job);
    }

    @Override
    public void addDirectory(String archiveName, EntryOptions options) {
        Objects.requireNonNull(archiveName, "archiveName");
        Objects.requireNonNull(options, "options");
        int attributes = options.getExternalAttributes() != null
                ? options.getExternalAttributes()
                : Platform.current().defaultDirectoryAttributes();
        ExtraFields extraFields = options.getExtraFields() != null ? options.getExtraFields() : ExtraFields.empty();
        appendDirectory(FileRecord.directory(archiveName, attributes, extraFields, options.getComment()));
    }

    @Override
    public void addDirectoryFromFilesystem(Path fsPath, String archiveName) throws IOException {
        Objects.requireNonNull(fsPath, "fsPath");
        Objects.requireNonNull(archiveName, "archiveName");
        if (!Files.isDirectory(fsPath)) {
            throw new NotDirectoryException(fsPath.toString());
        }
        int attributes = FilesystemMetadata.attributes(fsPath);
        ExtraFields extraFields = FilesystemMetadata.extraFields(fsPath);
        appendDirectory(FileRecord.directory(archiveName, attributes, extraFields, null));
    }

    private void appendDirectory(FileRecord record) {
        checkNotFailed();
        synchronized (contents) {
            contents.add(record);
        }
        logger.debug("Added directory {}", record.getName());
    }

    @Override
    public int compress(int threads) throws IOException {
        CompressionWorkerPool pool = new CompressionWorkerPool(threads, failurePolicy);
        rethrowFailure();
        JobQueue batch = jobs.drain();
        int jobCount = batch.size();
        if (jobCount == 0) {
            logger.debug("Nothing to compress");
            return 0;
        }

        long start = System.nanoTime();
        List<FileRecord> records;
        try {
            records = pool.process(batch);
        } catch (IOException e) {
            failure = e;
            logger.error("Compression pass failed, {} queued files were not archived", jobCount);
            throw e;
        }
        synchronized (contents) {
            contents.addAll(records);
        }
        logger.info("Compressed {} of {} queued files with {} threads in {} ms",
                records.size(), jobCount, threads, (System.nanoTime() - start) / 1_000_000);
        return jobCount;
    }

    @Override
    public void write(SeekableByteChannel channel, int threads) throws IOException {
        Objects.requireNonNull(channel, "channel");
        compressPending(threads);
        writeContents(ZipOutput.of(channel));
    }

    @Override
    public void write(OutputStream stream, int threads) throws IOException {
        Objects.requireNonNull(stream, "stream");
        compressPending(threads);
        writeContents(ZipOutput.of(stream));
        stream.flush();
    }

    private void compressPending(int threads) throws IOException {
        if (threads < 1) {
            throw new IllegalArgumentException("Thread count must be at least 1: " + threads);
        }
        rethrowFailure();
        if (!jobs.isEmpty()) {
            compress(threads);
        }
    }

    private void writeContents(ZipOutput out) throws IOException {
        long start = out.position();
        synchronized (contents) {
            contents.writeTo(out, Platform.current().versionMadeBy());
            logger.info("Wrote archive with {} entries, {} bytes", contents.size(), out.position() - start);
        }
    }

    private void checkNotFailed() {
        if (failure != null) {
            throw new IllegalStateException("Archive is unusable after a failed compression pass", failure);
        }
    }

    private void rethrowFailure() throws ZipArchiveException {
        IOException cause = failure;
        if (cause != null) {
            throw new ZipArchiveException("Archive is unusable after a failed compression pass: "
                    + cause.getMessage(), cause);
        }
    }

    @Override
    public boolean isFailed() {
        return failure != null;
    }

    @Override
    public int pendingJobCount() {
        return jobs.size();
    }

    @Override
    public int recordCount() {
        synchronized (contents) {
            return contents.size();
        }
    }

    /**
     * @return A copy of the records in the order they will be written
     */
    List<FileRecord> records() {
        synchronized (contents) {
            return contents.snapshot();
        }
    }
}
