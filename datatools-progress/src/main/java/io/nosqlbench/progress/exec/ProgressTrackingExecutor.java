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
import io.nosqlbench.progress.PerThreadProgress;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.time.Duration;
import java.util.Collection;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.stream.Collectors;

/**
 * {@link ExecutorService} decorator that reports every completed task as one item on a
 * {@link ConcurrentProgressLog}. Each worker thread counts through its own handle, so tasks
 * only contend on the shared logger when a handle merges.
 *
 * <p>The worker handles are flushed once, as soon as the wrapped executor is seen terminated:
 * by {@link #awaitTermination(long, TimeUnit)} or {@link #isTerminated()} returning true after
 * a {@link #shutdown()}, or by {@link #close()}, which shuts down and waits itself. When the
 * wait of {@code close()} times out the handles are left alone, since their threads may still
 * be using them, and a warning is logged.</p>
 *
 * <p>Task results and exceptions reach the caller unchanged through the returned futures.</p>
 *
 * @see ProgressExecutors
 * @since 4.0.0
 */
public final class ProgressTrackingExecutor implements ExecutorService, AutoCloseable {

    private static final Logger logger = LogManager.getLogger(ProgressTrackingExecutor.class);

    private final ExecutorService delegate;
    private final ConcurrentProgressLog progress;
    private final PerThreadProgress perThread;
    private final TaskStatistics statistics = new TaskStatistics();
    private final boolean countFailures;
    private final Duration awaitTimeout;
    private final AtomicBoolean flushed = new AtomicBoolean();
    private volatile boolean closed = false;

    ProgressTrackingExecutor(ExecutorService delegate, ConcurrentProgressLog progress,
                             boolean countFailures, Duration awaitTimeout) {
        this.delegate = Objects.requireNonNull(delegate, "delegate");
        this.progress = Objects.requireNonNull(progress, "progress");
        this.perThread = progress.perThread();
        this.countFailures = countFailures;
        this.awaitTimeout = Objects.requireNonNull(awaitTimeout, "awaitTimeout");
    }

    public ConcurrentProgressLog getProgress() {
        return progress;
    }

    public TaskStatistics getStatistics() {
        return statistics;
    }

    @Override
    public <T> Future<T> submit(Callable<T> task) {
        checkNotClosed();
        return delegate.submit(track(task));
    }

    @Override
    public <T> Future<T> submit(Runnable task, T result) {
        Objects.requireNonNull(task, "task");
        return submit(Executors.callable(task, result));
    }

    @Override
    public Future<?> submit(Runnable task) {
        Objects.requireNonNull(task, "task");
        return submit(Executors.callable(task, null));
    }

    @Override
    public <T> List<Future<T>> invokeAll(Collection<? extends Callable<T>> tasks) throws InterruptedException {
        checkNotClosed();
        return delegate.invokeAll(trackAll(tasks));
    }

    @Override
    public <T> List<Future<T>> invokeAll(Collection<? extends Callable<T>> tasks, long timeout, TimeUnit unit)
        throws InterruptedException {
        checkNotClosed();
        return delegate.invokeAll(trackAll(tasks), timeout, unit);
    }

    @Override
    public <T> T invokeAny(Collection<? extends Callable<T>> tasks) throws InterruptedException, ExecutionException {
        checkNotClosed();
        return delegate.invokeAny(trackAll(tasks));
    }

    @Override
    public <T> T invokeAny(Collection<? extends Callable<T>> tasks, long timeout, TimeUnit unit)
        throws InterruptedException, ExecutionException, TimeoutException {
        checkNotClosed();
        return delegate.invokeAny(trackAll(tasks), timeout, unit);
    }

    @Override
    public void execute(Runnable command) {
        submit(command);
    }

    @Override
    public void shutdown() {
        delegate.shutdown();
    }

    @Override
    public List<Runnable> shutdownNow() {
        return delegate.shutdownNow();
    }

    @Override
    public boolean isShutdown() {
        return delegate.isShutdown();
    }

    @Override
    public boolean isTerminated() {
        boolean terminated = delegate.isTerminated();
        if (terminated) {
            flushWorkers();
        }
        return terminated;
    }

    @Override
    public boolean awaitTermination(long timeout, TimeUnit unit) throws InterruptedException {
        boolean terminated = delegate.awaitTermination(timeout, unit);
        if (terminated) {
            flushWorkers();
        }
        return terminated;
    }

    /**
     * Shuts down the wrapped executor, waits up to the configured timeout for its tasks, then
     * flushes every worker handle into the progress logger.
     */
    @Override
    public void close() {
        if (closed) {
            return;
        }
        closed = true;
        delegate.shutdown();

        boolean terminated;
        try {
            terminated = delegate.awaitTermination(awaitTimeout.toNanos(), TimeUnit.NANOSECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            logger.warn("Interrupted while waiting for tasks; {} not flushed", statistics, e);
            return;
        }

        if (terminated) {
            flushWorkers();
        } else {
            logger.warn("Tasks still running after {}; worker progress not flushed: {}", awaitTimeout, statistics);
        }
    }

    /** Only called once no task can run anymore. */
    private void flushWorkers() {
        if (flushed.compareAndSet(false, true)) {
            perThread.close();
        }
    }

    private <T> Callable<T> track(Callable<T> task) {
        Objects.requireNonNull(task, "task");
        statistics.incrementSubmitted();
        return () -> {
            T result;
            try {
                result = task.call();
            } catch (Exception e) {
                statistics.incrementFailed();
                if (countFailures) {
                    perThread.get().update();
                }
                throw e;
            }
            statistics.incrementCompleted();
            perThread.get().update();
            return result;
        };
    }

    private <T> List<Callable<T>> trackAll(Collection<? extends Callable<T>> tasks) {
        Objects.requireNonNull(tasks, "tasks");
        return tasks.stream().map(this::track).collect(Collectors.toList());
    }

    private void checkNotClosed() {
        if (closed) {
            throw new IllegalStateException("ProgressTrackingExecutor has been closed");
        }
    }
}
