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

import java.io.InterruptedIOException;
import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Runs one compression pass: a fixed number of workers drain a batch of jobs, each worker
 * popping one job at a time and compressing it outside the queue lock.
 * <p>
 * The records come back in no particular order.
 */
final class CompressionWorkerPool {

    private static final Logger logger = LoggerFactory.getLogger(CompressionWorkerPool.class);

    private static final AtomicInteger POOL_COUNTER = new AtomicInteger();

    private final int threads;
    private final FailurePolicy failurePolicy;

    CompressionWorkerPool(int threads, FailurePolicy failurePolicy) {
        if (threads < 1) {
            throw new IllegalArgumentException("Thread count must be at least 1: " + threads);
        }
        this.threads = threads;
        this.failurePolicy = failurePolicy;
    }

    /**
     * Processes every job of the batch exactly once and blocks until all workers are done.
     *
     * @param batch The drained jobs of this pass
     * @return One record per successfully processed job
     * @throws EntryCompressionException if a job fails and the policy is {@link FailurePolicy#ABORT}
     * @throws InterruptedIOException if the calling thread is interrupted while waiting
     */
    List<FileRecord> process(JobQueue batch) throws IOException {
        int jobCount = batch.size();
        if (jobCount == 0) {
            return new ArrayList<>();
        }
        int workers = Math.min(threads, jobCount);
        logger.debug("Compressing {} jobs with {} workers", jobCount, workers);

        AtomicReference<EntryCompressionException> failure = new AtomicReference<>();
        ExecutorService executor = Executors.newFixedThreadPool(workers, new WorkerThreadFactory());
        try {
            List<CompletableFuture<List<FileRecord>>> futures = new ArrayList<>(workers);
            for (int i = 0; i < workers; i++) {
                futures.add(CompletableFuture.supplyAsync(() -> runWorker(batch, failure), executor));
            }
            CompletableFuture.allOf(futures.toArray(new CompletableFuture[0])).get();

            EntryCompressionException error = failure.get();
            if (error != null) {
                throw error;
            }
            List<FileRecord> records = new ArrayList<>(jobCount);
            for (CompletableFuture<List<FileRecord>> future : futures) {
                records.addAll(future.join());
            }
            return records;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            InterruptedIOException interrupted = new InterruptedIOException("Interrupted while compressing");
            interrupted.initCause(e);
            throw interrupted;
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof Error) {
                throw (Error) cause;
            }
            throw new ZipArchiveException("Compression worker failed unexpectedly", cause);
        } finally {
            executor.shutdownNow();
        }
    }

    private List<FileRecord> runWorker(JobQueue batch, AtomicReference<EntryCompressionException> failure) {
        List<FileRecord> produced = new ArrayList<>();
        while (failure.get() == null && !Thread.currentThread().isInterrupted()) {
            ZipJob job = batch.poll();
            if (job == null) {
                break;
            }
            try {
                produced.add(job.toFileRecord());
            } catch (IOException | RuntimeException e) {
                if (failurePolicy == FailurePolicy.SKIP_FAILED) {
                    logger.warn("Skipping entry {}: {}", job.getArchivePath(), e.getMessage(), e);
                    continue;
                }
                logger.error("Failed to compress entry {}", job.getArchivePath(), e);
                failure.compareAndSet(null, new EntryCompressionException(job.getArchivePath(), e));
                break;
            }
        }
        return produced;
    }

    /**
     * Daemon threads named after their pool.
     */
    private static final class WorkerThreadFactory implements ThreadFactory {
        private final int poolId = POOL_COUNTER.incrementAndGet();
        private final AtomicInteger threadCounter = new AtomicInteger();

        @Override
        public Thread newThread(Runnable runnable) {
            Thread thread = new Thread(runnable,
                    "jzipbuilder-" + poolId + "-worker-" + threadCounter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        }
    }
}
