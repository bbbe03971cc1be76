/*
 * Copyright DataStax, Inc.
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 * http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package io.nosqlbench.progress.exec;

import java.util.concurrent.atomic.AtomicLong;

/**
 * Counters of the tasks that went through a {@link ProgressTrackingExecutor}.
 * All counters are updated atomically and can be read while tasks run.
 */
public final class TaskStatistics {
    private final AtomicLong submitted = new AtomicLong(0);
    private final AtomicLong completed = new AtomicLong(0);
    private final AtomicLong failed = new AtomicLong(0);

    public long getSubmitted() {
        return submitted.get();
    }

    public long getCompleted() {
        return completed.get();
    }

    public long getFailed() {
        return failed.get();
    }

    /**
     * Returns the number of tasks submitted but not finished yet, queued or running.
     *
     * @return pending task count
     */
    public long getPending() {
        return submitted.get() - completed.get() - failed.get();
    }

    /**
     * Returns the fraction of submitted tasks that completed normally.
     *
     * @return a value between 0.0 and 1.0, or 0.0 if nothing was submitted
     */
    public double getCompletionRate() {
        long total = submitted.get();
        return total > 0 ? (double) completed.get() / total : 0.0;
    }

    public boolean isComplete() {
        return getPending() == 0;
    }

    void incrementSubmitted() {
        submitted.incrementAndGet();
    }

    void incrementCompleted() {
        completed.incrementAndGet();
    }

    void incrementFailed() {
        failed.incrementAndGet();
    }

    @Override
    public String toString() {
        return String.format(
            "TaskStatistics[submitted=%d, completed=%d, failed=%d, pending=%d, completion=%.1f%%]",
            submitted.get(), completed.get(), failed.get(), getPending(), getCompletionRate() * 100
        );
    }
}
