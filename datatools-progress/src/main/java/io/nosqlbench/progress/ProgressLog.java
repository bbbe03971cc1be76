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
import org.apache.logging.log4j.Level;

import java.time.Duration;
import java.util.Optional;

/**
 * Capability of reporting progress on a long-running, item-processing activity. Implementations
 * count processed items and, at most once per configured log interval, emit a status line with
 * the count, the elapsed time, the speed and, when the expected number of items is known, the
 * percentage done and the estimated time to completion.
 *
 * <p>Code that reports progress should accept a {@code ProgressLog} so that callers can pass a
 * {@link ProgressLogger}, a handle of a {@link ConcurrentProgressLogger}, or the
 * {@linkplain #disabled() no-op logger} through the same signature:</p>
 * <pre>{@code
 * void smash(List<Pumpkin> pumpkins, ProgressLog pl) {
 *     pl.itemName("pumpkin").expectedUpdates((long) pumpkins.size());
 *     pl.start("Smashing pumpkins...");
 *     for (Pumpkin p : pumpkins) {
 *         p.smash();
 *         pl.update();
 *     }
 *     pl.done();
 * }
 *
 * smash(pumpkins, new ProgressLogger());
 * smash(pumpkins, ProgressLog.disabled());
 * }</pre>
 *
 * <p>Configuration setters return the logger itself for chaining. Implementations narrow the
 * return type, so chaining on a concrete type keeps that type.</p>
 *
 * @see ProgressLogger
 * @see ConcurrentProgressLogger
 * @see NoopProgressLogger
 * @since 4.0.0
 */
public interface ProgressLog {

    /**
     * Returns the shared logger that does nothing.
     *
     * @return the no-op logger
     */
    static ProgressLog disabled() {
        return NoopProgressLogger.getInstance();
    }

    /**
     * Returns the given logger, or the no-op logger when it is null. The choice is made once,
     * here, instead of on every update.
     *
     * @param log a logger, possibly null
     * @return {@code log}, or the no-op logger
     */
    static ProgressLog ofNullable(ProgressLog log) {
        return log != null ? log : NoopProgressLogger.getInstance();
    }

    /**
     * Forces a progress line, assuming {@code nanoTime} is the current time. Low-level; normal
     * code calls the update methods.
     *
     * @param nanoTime the current reading of the logger's clock
     */
    void log(long nanoTime);

    /**
     * Emits a progress line if the log interval has elapsed since the last one. Low-level;
     * normal code calls the update methods.
     */
    void logIf();

    /**
     * Sets whether progress lines include memory usage.
     *
     * @param displayMemory true to append memory figures
     * @return this logger
     */
    ProgressLog displayMemory(boolean displayMemory);

    /**
     * Sets the name of one item, such as {@code "pumpkin"}. The plural is derived from it.
     *
     * @param itemName the singular item name
     * @return this logger
     */
    ProgressLog itemName(String itemName);

    /**
     * Sets the minimum time between two progress lines.
     *
     * @param logInterval the throttle interval; zero logs on every check
     * @return this logger
     */
    ProgressLog logInterval(Duration logInterval);

    /**
     * Sets the number of items the activity is expected to process, enabling the percentage
     * done and the time to completion.
     *
     * @param expectedUpdates the expected total, or null if unknown
     * @return this logger
     */
    ProgressLog expectedUpdates(Long expectedUpdates);

    /**
     * Fixes the unit used for speeds and per-item times. With a fixed unit, counts are not
     * thousands-separated, which keeps the output easy to parse.
     *
     * @param timeUnit the unit, or null to choose readable units automatically
     * @return this logger
     */
    ProgressLog timeUnit(ProgressTimeUnit timeUnit);

    /**
     * Sets whether running progress lines also show the speed achieved since the previous line.
     *
     * @param localSpeed true to show the local speed
     * @return this logger
     */
    ProgressLog localSpeed(boolean localSpeed);

    /**
     * Sets the Log4j logger name progress lines are written to.
     *
     * @param logTarget the logger name
     * @return this logger
     */
    ProgressLog logTarget(String logTarget);

    /**
     * Sets the severity progress lines are written at.
     *
     * @param logLevel the level
     * @return this logger
     */
    ProgressLog logLevel(Level logLevel);

    /**
     * Starts a new epoch: resets the count and the timers, and emits {@code message} unless it is
     * empty.
     *
     * @param message the message announcing the activity
     */
    void start(String message);

    /**
     * Counts one item and emits a progress line if it is time to.
     */
    void update();

    /**
     * Counts {@code count} items and emits a progress line if it is time to.
     *
     * @param count the number of items processed, not negative
     */
    void updateWithCount(long count);

    /**
     * Counts one item, checking whether it is time to log only once every so many calls. Meant
     * for activities so short that reading the clock on every item would dominate their cost.
     */
    void lightUpdate();

    /**
     * Counts one item and forces a progress line.
     */
    void updateAndDisplay();

    /**
     * Stops the logger, fixing the final time.
     */
    void stop();

    /**
     * Stops the logger, fixing the final time, and emits {@code message} unless it is empty.
     *
     * @param message the closing message
     */
    void stop(String message);

    /**
     * Stops the logger, emits {@code Completed.} and then the final statistics.
     */
    void done();

    /**
     * Sets the count, stops the logger, emits {@code Completed.} and then the final statistics.
     * Useful when per-item updates were skipped or approximate and only the exact total is known
     * at the end, or when the logger is used as a plain timer.
     *
     * @param count the exact number of items processed, not negative
     */
    void doneWithCount(long count);

    /**
     * Returns the number of items counted in the current epoch.
     *
     * @return the item count
     */
    long count();

    /**
     * Returns the lifecycle state.
     *
     * @return the current state
     */
    ProgressState state();

    /**
     * Returns the time elapsed since {@link #start(String)}, up to now while running or up to the
     * stop time once stopped.
     *
     * @return the elapsed time, or empty if the logger was never started
     */
    Optional<Duration> elapsed();

    /**
     * Refreshes memory figures, if memory display is enabled. Rendering a logger with
     * {@code toString()} never samples, so call this first when displaying a logger manually.
     */
    void refresh();

    /**
     * Emits an arbitrary message to the logger's target at its level.
     *
     * @param format the message, with Log4j {@code {}} placeholders
     * @param args the placeholder values
     */
    void info(String format, Object... args);

    /**
     * Returns a new logger with the same configuration and all counters reset, as before
     * {@link #start(String)}.
     *
     * @return an unstarted logger configured like this one
     */
    ProgressLog cloneConfig();
}
