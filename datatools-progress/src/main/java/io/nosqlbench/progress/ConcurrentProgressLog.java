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

/**
 * A {@link ProgressLog} whose handles can be handed to concurrent workers. Each handle buffers
 * its own count and merges it into shared state only from time to time; {@link #spawn()}
 * creates another handle on the same shared state.
 *
 * <p>A handle must be {@linkplain #close() closed} (or {@linkplain #flush() flushed}) when its
 * worker is done, or its buffered count is never reported. Try-with-resources is the usual way:</p>
 * <pre>{@code
 * try (ConcurrentProgressLog handle = cpl.spawn()) {
 *     for (Item item : slice) {
 *         process(item);
 *         handle.update();
 *     }
 * }
 * }</pre>
 *
 * @see ConcurrentProgressLogger
 * @see PerThreadProgress
 * @since 4.0.0
 */
public interface ConcurrentProgressLog extends ProgressLog, AutoCloseable {

    /**
     * Returns the shared concurrent logger that does nothing.
     *
     * @return the no-op logger
     */
    static ConcurrentProgressLog disabled() {
        return NoopProgressLogger.getInstance();
    }

    /**
     * Returns the given logger, or the no-op logger when it is null.
     *
     * @param log a logger, possibly null
     * @return {@code log}, or the no-op logger
     */
    static ConcurrentProgressLog ofNullable(ConcurrentProgressLog log) {
        return log != null ? log : NoopProgressLogger.getInstance();
    }

    /**
     * Creates a new handle with an empty buffer on the same shared state.
     *
     * @return a new handle for another worker
     */
    ConcurrentProgressLog spawn();

    /**
     * Merges the buffered count into the shared state right away and checks there whether it is
     * time to log, even when nothing is buffered.
     */
    void flush();

    /**
     * Flushes this handle. A closed handle may still be used; closing again flushes again.
     */
    @Override
    void close();

    /**
     * Creates a per-thread view that lazily spawns one handle for each thread that asks.
     *
     * @return a new per-thread view over this logger
     */
    default PerThreadProgress perThread() {
        return new PerThreadProgress(this);
    }
}
