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

package io.nosqlbench.progress;

import io.nosqlbench.progress.format.ProgressTimeUnit;
import io.nosqlbench.progress.support.MemorySample;
import org.apache.logging.log4j.Level;

import java.time.Duration;
import java.util.Objects;
import java.util.Optional;

/**
 * Thread-safe progress logger made of handles that share one {@link ProgressLogger}.
 *
 * <p>Each handle counts into a private buffer without synchronization. The buffer is merged
 * into the shared logger, under a monitor shared by all handles, when it reaches the merge
 * threshold, when {@link #lightUpdate()} samples a merge, and on {@link #flush()} or
 * {@link #close()}. The shared logger then applies its own throttle, so at most one line per
 * interval is written however many workers report.</p>
 *
 * <pre>{@code
 * ConcurrentProgressLogger cpl = ConcurrentProgressLogger.create(
 *     ProgressLogConfig.defaults().withItemName("vector").withExpectedUpdates(n));
 * cpl.start("Indexing vectors...");
 * List<Future<?>> futures = new ArrayList<>();
 * for (List<Vector> slice : slices) {
 *     ConcurrentProgressLog handle = cpl.spawn();
 *     futures.add(pool.submit(() -> {
 *         try (handle) {
 *             slice.forEach(v -> { index(v); handle.update(); });
 *         }
 *     }));
 * }
 * // wait for futures
 * cpl.done();
 * }</pre>
 *
 * <h2>Memory Sampling</h2>
 * <p>Memory is never sampled while the monitor is held. A handle samples before entering it,
 * and only when the shared logger is due to write a line.</p>
 *
 * <h2>Thread Safety</h2>
 * <p>A single handle must be used by one thread at a time; spawn one handle per worker.
 * Handles may be passed between threads with the usual happens-before guarantees.</p>
 *
 * @see ConcurrentProgressLog
 * @see PerThreadProgress
 * @since 4.0.0
 */
public final class ConcurrentProgressLogger implements ConcurrentProgressLog {

    /** Default number of buffered items that forces a merge. */
    public static final int DEFAULT_THRESHOLD = ProgressLogConfig.DEFAULT_MERGE_THRESHOLD;

    /** Default mask of {@link #lightUpdate()}: a merge every 1024 calls. */
    public static final int LIGHT_UPDATE_MASK = ProgressLogConfig.DEFAULT_HANDLE_LIGHT_UPDATE_MASK;

    private static final class Shared {
        private final Object lock = new Object();
        private final ProgressLogger inner;

        private Shared(ProgressLogger inner) {
            this.inner = inner;
        }

        // only when a line is about to be written
        private MemorySample presample(long nanoTime) {
            return inner.isDisplayingMemory() && inner.isLogDue(nanoTime) ? inner.sampleMemory() : null;
        }
    }

    private final Shared shared;
    private long localCount;
    private long lightUpdateCalls;
    private int threshold;
    private int lightUpdateMask;

    private ConcurrentProgressLogger(Shared shared, int threshold, int lightUpdateMask) {
        this.shared = shared;
        this.threshold = threshold;
        this.lightUpdateMask = lightUpdateMask;
    }

    /**
     * Wraps a logger that is not used directly anymore. The merge threshold and the handle
     * sampling mask come from the logger's configuration.
     *
     * @param inner the logger that will hold the shared state
     * @return the first handle
     */
    public static ConcurrentProgressLogger wrap(ProgressLogger inner) {
        Objects.requireNonNull(inner, "inner");
        ProgressLogConfig config = inner.getConfig();
        return new ConcurrentProgressLogger(new Shared(inner), config.getMergeThreshold(),
            config.getHandleLightUpdateMask());
    }

    public static ConcurrentProgressLogger wrap(ProgressLogger inner, int threshold) {
        return wrap(inner).threshold(threshold);
    }

    public static ConcurrentProgressLogger create(ProgressLogConfig config) {
        return wrap(new ProgressLogger(config));
    }

    public static ConcurrentProgressLogger create() {
        return create(ProgressLogConfig.defaults());
    }

    /**
     * Sets the number of buffered items that forces this handle to merge. Spawned handles
     * inherit it.
     *
     * @param threshold at least 1
     * @return this handle
     */
    public ConcurrentProgressLogger threshold(int threshold) {
        if (threshold < 1) {
            throw new IllegalArgumentException("threshold must be at least 1, got: " + threshold);
        }
        this.threshold = threshold;
        return this;
    }

    /**
     * Sets how often {@link #lightUpdate()} merges on this handle: once every {@code mask + 1} calls.
     * Spawned handles inherit it.
     *
     * @param lightUpdateMask a value of the form {@code 2^k - 1}
     * @return this handle
     */
    public ConcurrentProgressLogger lightUpdateMask(int lightUpdateMask) {
        ProgressLogConfig.checkMask(lightUpdateMask, "lightUpdateMask");
        this.lightUpdateMask = lightUpdateMask;
        return this;
    }

    public int getThreshold() {
        return threshold;
    }

    @Override
    public ConcurrentProgressLogger spawn() {
        return new ConcurrentProgressLogger(shared, threshold, lightUpdateMask);
    }

    @Override
    public void update() {
        if (++localCount >= threshold) {
            merge();
        }
    }

    @Override
    public void updateWithCount(long count) {
        checkCount(count);
        if (count >= threshold - localCount) {
            if (count > Long.MAX_VALUE - localCount) {
                // merge the buffer on its own so the sum cannot wrap
                merge();
            }
            localCount += count;
            merge();
        } else {
            localCount += count;
        }
    }

    @Override
    public void lightUpdate() {
        localCount++;
        if ((lightUpdateCalls++ & lightUpdateMask) == 0 || localCount >= threshold) {
            merge();
        }
    }

    @Override
    public void updateAndDisplay() {
        localCount++;
        ProgressLogger inner = shared.inner;
        long now = inner.clock().nanoTime();
        MemorySample sample = inner.sampleMemory();
        synchronized (shared.lock) {
            inner.mergeAndLog(localCount, now, sample);
        }
        localCount = 0;
    }

    @Override
    public void flush() {
        merge();
    }

    @Override
    public void close() {
        flush();
    }

    @Override
    public void log(long nanoTime) {
        MemorySample sample = shared.inner.sampleMemory();
        synchronized (shared.lock) {
            shared.inner.log(nanoTime, sample);
        }
    }

    @Override
    public void logIf() {
        long now = shared.inner.clock().nanoTime();
        MemorySample sample = shared.presample(now);
        synchronized (shared.lock) {
            shared.inner.merge(0, now, sample);
        }
    }

    /**
     * Starts a new epoch on the shared logger. Items buffered in this handle belong to the
     * previous epoch and are discarded.
     */
    @Override
    public void start(String message) {
        localCount = 0;
        lightUpdateCalls = 0;
        synchronized (shared.lock) {
            shared.inner.start(message);
        }
    }

    @Override
    public void stop() {
        stop(null);
    }

    /**
     * Stops the shared logger after adding the items buffered in this handle. Other handles
     * must be flushed before.
     */
    @Override
    public void stop(String message) {
        synchronized (shared.lock) {
            shared.inner.addCount(localCount);
            shared.inner.stop(message);
        }
        localCount = 0;
    }

    /**
     * Completes the shared logger after adding the items buffered in this handle. Other
     * handles must be flushed before.
     */
    @Override
    public void done() {
        ProgressLogger inner = shared.inner;
        long now = inner.clock().nanoTime();
        MemorySample sample = inner.sampleMemory();
        synchronized (shared.lock) {
            inner.addCount(localCount);
            inner.finish(now, sample);
        }
        localCount = 0;
    }

    /**
     * Completes the shared logger with an explicit total. Items buffered in this handle are
     * discarded.
     */
    @Override
    public void doneWithCount(long count) {
        checkCount(count);
        localCount = 0;
        ProgressLogger inner = shared.inner;
        long now = inner.clock().nanoTime();
        MemorySample sample = inner.sampleMemory();
        synchronized (shared.lock) {
            inner.finishWithCount(count, now, sample);
        }
    }

    @Override
    public void refresh() {
        MemorySample sample = shared.inner.sampleMemory();
        synchronized (shared.lock) {
            shared.inner.applyMemorySample(sample);
        }
    }

    @Override
    public void info(String format, Object... args) {
        synchronized (shared.lock) {
            shared.inner.info(format, args);
        }
    }

    @Override
    public ConcurrentProgressLogger displayMemory(boolean displayMemory) {
        synchronized (shared.lock) {
            shared.inner.displayMemory(displayMemory);
        }
        return this;
    }

    @Override
    public ConcurrentProgressLogger itemName(String itemName) {
        synchronized (shared.lock) {
            shared.inner.itemName(itemName);
        }
        return this;
    }

    @Override
    public ConcurrentProgressLogger logInterval(Duration logInterval) {
        synchronized (shared.lock) {
            shared.inner.logInterval(logInterval);
        }
        return this;
    }

    @Override
    public ConcurrentProgressLogger expectedUpdates(Long expectedUpdates) {
        synchronized (shared.lock) {
            shared.inner.expectedUpdates(expectedUpdates);
        }
        return this;
    }

    @Override
    public ConcurrentProgressLogger timeUnit(ProgressTimeUnit timeUnit) {
        synchronized (shared.lock) {
            shared.inner.timeUnit(timeUnit);
        }
        return this;
    }

    @Override
    public ConcurrentProgressLogger localSpeed(boolean localSpeed) {
        synchronized (shared.lock) {
            shared.inner.localSpeed(localSpeed);
        }
        return this;
    }

    @Override
    public ConcurrentProgressLogger logTarget(String logTarget) {
        synchronized (shared.lock) {
            shared.inner.logTarget(logTarget);
        }
        return this;
    }

    @Override
    public ConcurrentProgressLogger logLevel(Level logLevel) {
        synchronized (shared.lock) {
            shared.inner.logLevel(logLevel);
        }
        return this;
    }

    /**
     * Returns the shared count. Items still buffered in handles are not included.
     */
    @Override
    public long count() {
        synchronized (shared.lock) {
            return shared.inner.count();
        }
    }

    @Override
    public ProgressState state() {
        synchronized (shared.lock) {
            return shared.inner.state();
        }
    }

    @Override
    public Optional<Duration> elapsed() {
        synchronized (shared.lock) {
            return shared.inner.elapsed();
        }
    }

    public ProgressLogConfig getConfig() {
        synchronized (shared.lock) {
            return shared.inner.getConfig();
        }
    }

    /**
     * Creates an independent concurrent logger, not started, with the same configuration and
     * the same handle settings as this one.
     */
    @Override
    public ConcurrentProgressLogger cloneConfig() {
        ProgressLogger copy;
        synchronized (shared.lock) {
            copy = shared.inner.cloneConfig();
        }
        return new ConcurrentProgressLogger(new Shared(copy), threshold, lightUpdateMask);
    }

    @Override
    public String toString() {
        synchronized (shared.lock) {
            return shared.inner.toString();
        }
    }

    long localCount() {
        return localCount;
    }

    private void merge() {
        ProgressLogger inner = shared.inner;
        long now = inner.clock().nanoTime();
        MemorySample sample = shared.presample(now);
        synchronized (shared.lock) {
            inner.merge(localCount, now, sample);
        }
        localCount = 0;
    }

    private static void checkCount(long count) {
        if (count < 0) {
            throw new IllegalArgumentException("count must not be negative, got: " + count);
        }
    }
}
