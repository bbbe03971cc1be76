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

import io.nosqlbench.progress.ConcurrentProgressLog;

import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.ExecutorService;

/**
 * Factory for {@link ProgressTrackingExecutor}s, which count one item on a
 * {@link ConcurrentProgressLog} for each task they complete.
 *
 * <pre>{@code
 * ConcurrentProgressLogger cpl = ConcurrentProgressLogger.create(
 *     ProgressLogConfig.defaults().withItemName("file"));
 * cpl.start("Converting files...");
 * try (ProgressTrackingExecutor executor = ProgressExecutors.wrap(Executors.newFixedThreadPool(8), cpl)
 *         .countFailures(true)
 *         .build()) {
 *     files.forEach(f -> executor.submit(() -> convert(f)));
 * }
 * cpl.done();
 * }</pre>
 *
 * @see ProgressTrackingExecutor
 * @since 4.0.0
 */
public final class ProgressExecutors {

    public static final Duration DEFAULT_AWAIT_TIMEOUT = Duration.ofMinutes(1);

    private ProgressExecutors() {
    }

    /**
     * Creates a builder for an executor that submits its tasks to {@code executor} and reports
     * them to {@code progress}.
     *
     * @param executor the executor service to wrap
     * @param progress the logger that receives one update per task
     * @return a builder for configuring the tracking executor
     * @throws NullPointerException if executor or progress is null
     */
    public static Builder wrap(ExecutorService executor, ConcurrentProgressLog progress) {
        return new Builder(executor, progress);
    }

    public static final class Builder {
        private final ExecutorService executor;
        private final ConcurrentProgressLog progress;
        private boolean countFailures;
        private Duration awaitTimeout = DEFAULT_AWAIT_TIMEOUT;

        Builder(ExecutorService executor, ConcurrentProgressLog progress) {
            this.executor = Objects.requireNonNull(executor, "executor");
            this.progress = Objects.requireNonNull(progress, "progress");
        }

        /**
         * Sets whether tasks that throw are counted as processed items too. Defaults to false.
         *
         * @param countFailures true to count failed tasks
         * @return this builder
         */
        public Builder countFailures(boolean countFailures) {
            this.countFailures = countFailures;
            return this;
        }

        /**
         * Sets how long {@link ProgressTrackingExecutor#close()} waits for running tasks before
         * flushing worker buffers.
         *
         * @param awaitTimeout a non-negative duration
         * @return this builder
         */
        public Builder awaitTimeout(Duration awaitTimeout) {
            Objects.requireNonNull(awaitTimeout, "awaitTimeout");
            if (awaitTimeout.isNegative()) {
                throw new IllegalArgumentException("awaitTimeout must not be negative, got: " + awaitTimeout);
            }
            this.awaitTimeout = awaitTimeout;
            return this;
        }

        public ProgressTrackingExecutor build() {
            return new ProgressTrackingExecutor(executor, progress, countFailures, awaitTimeout);
        }
    }
}
