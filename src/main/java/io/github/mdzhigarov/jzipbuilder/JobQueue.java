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

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Pending jobs behind a single lock. The lock is held only to push or pop, never while compressing.
 */
final class JobQueue {

    private final ReentrantLock lock = new ReentrantLock();
    private final Deque<ZipJob> jobs;

    JobQueue() {
        this(new ArrayDeque<>());
    }

    private JobQueue(Deque<ZipJob> jobs) {
        this.jobs = jobs;
    }

    void add(ZipJob job) {
        lock.lock();
        try {
            jobs.addLast(job);
        } finally {
            lock.unlock();
        }
    }

    /**
     * @return The next job, or {@code null} when the queue is empty
     */
    ZipJob poll() {
        lock.lock();
        try {
            return jobs.pollFirst();
        } finally {
            lock.unlock();
        }
    }

    /**
     * Moves every queued job into a new queue in one step. Jobs added afterwards stay here.
     */
    JobQueue drain() {
        lock.lock();
        try {
            JobQueue batch = new JobQueue(new ArrayDeque<>(jobs));
            jobs.clear();
            return batch;
        } finally {
            lock.unlock();
        }
    }

    int size() {
        lock.lock();
        try {
            return jobs.size();
        } finally {
            lock.unlock();
        }
    }

    boolean isEmpty() {
        return size() == 0;
    }
}
