package io.github.mdzhigarov.jzipbuilder;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.DisplayName;
import static org.junit.jupiter.api.Assertions.*;

import java.nio.ByteBuffer;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Unit tests for JobQueue.
 */
class JobQueueTest {

    private static ZipJob job(int n) {
        return new ZipJob("file" + n + ".txt",
                DataOrigin.buffer(ByteBuffer.wrap(TestDataGenerator.numberedContent(n))), EntryOptions.defaults());
    }

    @Test
    @DisplayName("Should hand out jobs in insertion order")
    void shouldPollInInsertionOrder() {
        // Given
        JobQueue queue = new JobQueue();
        queue.add(job(1));
        queue.add(job(2));

        // Then
        assertEquals(2, queue.size());
        assertEquals("file1.txt", queue.poll().getArchivePath());
        assertEquals("file2.txt", queue.poll().getArchivePath());
        assertNull(queue.poll());
        assertTrue(queue.isEmpty());
    }

    @Test
    @DisplayName("Should move every job into the drained queue")
    void shouldDrainAllJobs() {
        // Given
        JobQueue queue = new JobQueue();
        for (int i = 0; i < 5; i++) {
            queue.add(job(i));
        }

        // When
        JobQueue batch = queue.drain();
        queue.add(job(99));

        // Then
        assertEquals(5, batch.size());
        assertEquals(1, queue.size());
        assertEquals("file0.txt", batch.poll().getArchivePath());
        assertEquals("file99.txt", queue.poll().getArchivePath());
    }

    @Test
    @DisplayName("Should give every job to exactly one of many concurrent pollers")
    void shouldNotDuplicateJobsUnderConcurrentPolls() throws Exception {
        // Given
        int jobCount = 10_000;
        JobQueue queue = new JobQueue();
        for (int i = 0; i < jobCount; i++) {
            queue.add(job(i));
        }
        Set<String> seen = ConcurrentHashMap.newKeySet();
        AtomicInteger polled = new AtomicInteger();
        CountDownLatch start = new CountDownLatch(1);
        ExecutorService executor = Executors.newFixedThreadPool(8);

        // When
        try {
            List<Future<?>> futures = new ArrayList<>();
            for (int t = 0; t < 8; t++) {
                futures.add(executor.submit(() -> {
                    start.await();
                    ZipJob next;
                    while ((next = queue.poll()) != null) {
                        seen.add(next.getArchivePath());
                        polled.incrementAndGet();
                    }
                    return null;
                }));
            }
            start.countDown();
            for (Future<?> future : futures) {
                future.get();
            }
        } finally {
            executor.shutdownNow();
        }

        // Then
        assertEquals(jobCount, polled.get());
        assertEquals(jobCount, seen.size());
        assertTrue(queue.isEmpty());
    }

    @Test
    @DisplayName("Should not lose jobs added concurrently")
    void shouldAcceptConcurrentAdds() throws Exception {
        // Given
        JobQueue queue = new JobQueue();
        ExecutorService executor = Executors.newFixedThreadPool(8);

        // When
        try {
            List<Future<?>> futures = new ArrayList<>();
            for (int t = 0; t < 8; t++) {
                int base = t * 1000;
                futures.add(executor.submit(() -> {
                    for (int i = 0; i < 1000; i++) {
                        queue.add(job(base + i));
                    }
                }));
            }
            for (Future<?> future : futures) {
                future.get();
            }
        } finally {
            executor.shutdownNow();
        }

        // Then
        assertEquals(8000, queue.size());
    }
}
