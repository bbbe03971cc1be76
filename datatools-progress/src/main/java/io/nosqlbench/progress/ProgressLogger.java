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

import io.nosqlbench.progress.format.Plurals;
import io.nosqlbench.progress.format.ProgressFormat;
import io.nosqlbench.progress.format.ProgressTimeUnit;
import io.nosqlbench.progress.support.MemorySample;
import io.nosqlbench.progress.support.MemorySampler;
import io.nosqlbench.progress.support.ProgressClock;
import org.apache.logging.log4j.Level;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.time.Duration;
import java.util.Locale;
import java.util.Objects;
import java.util.Optional;

/**
 * Single-threaded progress logger. Counts items and, at most once per log interval, writes a
 * status line to the Log4j 2 logger named by the configured target:
 * <pre>
 * 1,234,567 items, 2m 5s, 9.88k items/s, 101.25 μs/item; 41.15% done, 2m 59s to end
 * </pre>
 *
 * <h2>Throttling</h2>
 * <p>Every {@link #update()} reads the clock and compares it with the time the next line is
 * due. When the work per item is so small that reading the clock matters, {@link #lightUpdate()}
 * reads it only once every {@code lightUpdateMask + 1} calls, starting with the first one.</p>
 *
 * <h2>Lifecycle</h2>
 * <p>A logger is {@linkplain ProgressState#FRESH fresh} until {@link #start(String)}, which
 * begins a new epoch and may be called again at any time. Updates are counted only while the
 * logger is {@linkplain ProgressState#RUNNING running}; updates outside an epoch are ignored
 * and reported once per epoch with a warning on this class's logger.</p>
 *
 * <h2>Thread Safety</h2>
 * <p>Instances are not thread-safe. Share progress across threads with
 * {@link ConcurrentProgressLogger}.</p>
 *
 * @see ProgressLogConfig
 * @see ConcurrentProgressLogger
 * @since 4.0.0
 */
public class ProgressLogger implements ProgressLog {

    private static final Logger logger = LogManager.getLogger(ProgressLogger.class);

    private final ProgressClock clock;
    private final MemorySampler memorySampler;

    private ProgressLogConfig config;
    private int lightUpdateMask;
    private volatile boolean displayMemory;

    private ProgressState state = ProgressState.FRESH;
    private long startTime;
    private long stopTime;
    private long lastLogTime;
    private volatile long nextLogTime;
    private long count;
    private long lastCount;
    private long lightUpdateCalls;
    private MemorySample memorySample;
    private boolean ignoredUpdateReported;

    /**
     * Creates a logger with the default configuration.
     */
    public ProgressLogger() {
        this(ProgressLogConfig.defaults());
    }

    public ProgressLogger(ProgressLogConfig config) {
        this(config, ProgressClock.SYSTEM, MemorySampler.jvm());
    }

    /**
     * Creates a logger reading time and memory from the given sources.
     *
     * @param config the initial configuration
     * @param clock the time source
     * @param memorySampler the memory source, used only when memory display is enabled
     */
    public ProgressLogger(ProgressLogConfig config, ProgressClock clock, MemorySampler memorySampler) {
        this.clock = Objects.requireNonNull(clock, "clock");
        this.memorySampler = Objects.requireNonNull(memorySampler, "memorySampler");
        config(config);
    }

    /**
     * Replaces the whole configuration. Changing the interval of a running logger moves the
     * time the next line is due.
     *
     * @param config the new configuration
     * @return this logger
     */
    public ProgressLogger config(ProgressLogConfig config) {
        ProgressLogConfig previous = this.config;
        this.config = Objects.requireNonNull(config, "config");
        this.lightUpdateMask = config.getLightUpdateMask();
        this.displayMemory = config.isDisplayMemory();
        if (previous != null && state == ProgressState.RUNNING
            && previous.getLogIntervalNanos() != config.getLogIntervalNanos()) {
            nextLogTime = lastLogTime + config.getLogIntervalNanos();
        }
        return this;
    }

    public ProgressLogConfig getConfig() {
        return config;
    }

    @Override
    public ProgressLogger displayMemory(boolean displayMemory) {
        return config(config.withDisplayMemory(displayMemory));
    }

    @Override
    public ProgressLogger itemName(String itemName) {
        return config(config.withItemName(itemName));
    }

    @Override
    public ProgressLogger logInterval(Duration logInterval) {
        return config(config.withLogInterval(logInterval));
    }

    @Override
    public ProgressLogger expectedUpdates(Long expectedUpdates) {
        return config(config.withExpectedUpdates(expectedUpdates));
    }

    @Override
    public ProgressLogger timeUnit(ProgressTimeUnit timeUnit) {
        return config(config.withTimeUnit(timeUnit));
    }

    @Override
    public ProgressLogger localSpeed(boolean localSpeed) {
        return config(config.withLocalSpeed(localSpeed));
    }

    @Override
    public ProgressLogger logTarget(String logTarget) {
        return config(config.withLogTarget(logTarget));
    }

    @Override
    public ProgressLogger logLevel(Level logLevel) {
        return config(config.withLogLevel(logLevel));
    }

    /**
     * Sets how often {@link #lightUpdate()} reads the clock: once every {@code mask + 1} calls.
     *
     * @param lightUpdateMask a value of the form {@code 2^k - 1}
     * @return this logger
     */
    public ProgressLogger lightUpdateMask(int lightUpdateMask) {
        return config(config.withLightUpdateMask(lightUpdateMask));
    }

    @Override
    public void log(long nanoTime) {
        log(nanoTime, sampleMemory());
    }

    @Override
    public void logIf() {
        if (state == ProgressState.RUNNING) {
            long now = clock.nanoTime();
            if (isLogDue(now)) {
                log(now);
            }
        }
    }

    @Override
    public void start(String message) {
        long now = clock.nanoTime();
        state = ProgressState.RUNNING;
        count = 0;
        lastCount = 0;
        lightUpdateCalls = 0;
        ignoredUpdateReported = false;
        memorySample = null;
        startTime = now;
        stopTime = 0;
        lastLogTime = now;
        nextLogTime = now + config.getLogIntervalNanos();
        if (message != null && !message.isEmpty()) {
            emit(message);
        }
    }

    @Override
    public void update() {
        if (accepting()) {
            count++;
            long now = clock.nanoTime();
            if (isLogDue(now)) {
                log(now);
            }
        }
    }

    @Override
    public void updateWithCount(long count) {
        checkCount(count);
        if (accepting()) {
            this.count = saturatedAdd(this.count, count);
            long now = clock.nanoTime();
            if (isLogDue(now)) {
                log(now);
            }
        }
    }

    /**
     * Adds {@code count} items using a timestamp the caller already read from this logger's
     * clock, saving a clock read on hot paths.
     *
     * @param count number of items processed
     * @param nanoTime current reading of the clock
     */
    public void updateWithCountAndTime(long count, long nanoTime) {
        checkCount(count);
        if (accepting()) {
            this.count = saturatedAdd(this.count, count);
            if (isLogDue(nanoTime)) {
                log(nanoTime);
            }
        }
    }

    @Override
    public void lightUpdate() {
        if (accepting()) {
            count++;
            if ((lightUpdateCalls++ & lightUpdateMask) == 0) {
                long now = clock.nanoTime();
                if (isLogDue(now)) {
                    log(now);
                }
            }
        }
    }

    @Override
    public void updateAndDisplay() {
        if (accepting()) {
            count++;
            log(clock.nanoTime());
        }
    }

    @Override
    public void stop() {
        stop(null);
    }

    @Override
    public void stop(String message) {
        if (state != ProgressState.RUNNING) {
            return;
        }
        stopAt(clock.nanoTime());
        if (message != null && !message.isEmpty()) {
            emit(message);
        }
    }

    @Override
    public void done() {
        finish(clock.nanoTime(), sampleMemory());
    }

    @Override
    public void doneWithCount(long count) {
        checkCount(count);
        finishWithCount(count, clock.nanoTime(), sampleMemory());
    }

    @Override
    public long count() {
        return count;
    }

    @Override
    public ProgressState state() {
        return state;
    }

    @Override
    public Optional<Duration> elapsed() {
        switch (state) {
            case RUNNING:
                return Optional.of(Duration.ofNanos(clock.nanoTime() - startTime));
            case STOPPED:
                return Optional.of(Duration.ofNanos(stopTime - startTime));
            default:
                return Optional.empty();
        }
    }

    @Override
    public void refresh() {
        applyMemorySample(sampleMemory());
    }

    @Override
    public void info(String format, Object... args) {
        Logger output = config.getOutput();
        Level level = config.getLogLevel();
        if (output.isEnabled(level)) {
            output.log(level, format, args);
        }
    }

    @Override
    public ProgressLogger cloneConfig() {
        return new ProgressLogger(config, clock, memorySampler);
    }

    /**
     * Renders the current status line without emitting it or sampling memory.
     */
    @Override
    public String toString() {
        return render(clock.nanoTime());
    }

    ProgressClock clock() {
        return clock;
    }

    /**
     * True when a line is due at {@code nanoTime}. Safe to call without holding the lock of
     * a concurrent wrapper.
     */
    boolean isLogDue(long nanoTime) {
        return nanoTime - nextLogTime >= 0;
    }

    boolean isDisplayingMemory() {
        return displayMemory;
    }

    MemorySample sampleMemory() {
        return displayMemory ? memorySampler.sample() : null;
    }

    void applyMemorySample(MemorySample sample) {
        if (sample != null) {
            memorySample = sample;
        }
    }

    /**
     * Adds a merged count and logs if due. A null sample keeps the previous one, so memory is
     * never read here.
     */
    void merge(long pending, long nanoTime, MemorySample sample) {
        if (pending > 0 && !accepting()) {
            return;
        }
        if (state != ProgressState.RUNNING) {
            return;
        }
        count = saturatedAdd(count, pending);
        if (isLogDue(nanoTime)) {
            log(nanoTime, sample);
        }
    }

    /**
     * Adds a merged count and logs unconditionally.
     */
    void mergeAndLog(long pending, long nanoTime, MemorySample sample) {
        if (accepting()) {
            count = saturatedAdd(count, pending);
            log(nanoTime, sample);
        }
    }

    void addCount(long pending) {
        if (pending > 0 && accepting()) {
            count = saturatedAdd(count, pending);
        }
    }

    void finish(long nanoTime, MemorySample sample) {
        if (state == ProgressState.FRESH) {
            reportIgnored();
            return;
        }
        if (state == ProgressState.RUNNING) {
            stopAt(nanoTime);
        }
        emit("Completed.");
        log(nanoTime, sample);
    }

    /**
     * Sets the final count, starting an epoch of zero length when none was started, and
     * completes it.
     */
    void finishWithCount(long count, long nanoTime, MemorySample sample) {
        if (state == ProgressState.FRESH) {
            startTime = nanoTime;
            state = ProgressState.RUNNING;
        }
        this.count = count;
        finish(nanoTime, sample);
    }

    void log(long nanoTime, MemorySample sample) {
        applyMemorySample(sample);
        emit(render(nanoTime));
        lastCount = count;
        lastLogTime = nanoTime;
        nextLogTime = nanoTime + config.getLogIntervalNanos();
    }

    private void stopAt(long nanoTime) {
        stopTime = nanoTime;
        state = ProgressState.STOPPED;
        ignoredUpdateReported = false;
    }

    private boolean accepting() {
        if (state == ProgressState.RUNNING) {
            return true;
        }
        reportIgnored();
        return false;
    }

    private void reportIgnored() {
        if (!ignoredUpdateReported) {
            ignoredUpdateReported = true;
            logger.warn("Ignoring progress on {} logger for {}; updates count only between start() and stop()",
                state.name().toLowerCase(Locale.ROOT), config.getPluralItemName());
        }
    }

    private void emit(String line) {
        Logger output = config.getOutput();
        Level level = config.getLogLevel();
        if (output.isEnabled(level)) {
            output.log(level, line);
        }
    }

    /** Counts are never negative, so an overflowing sum saturates at {@code Long.MAX_VALUE}. */
    private static long saturatedAdd(long count, long more) {
        long sum = count + more;
        return sum < 0 ? Long.MAX_VALUE : sum;
    }

    private static void checkCount(long count) {
        if (count < 0) {
            throw new IllegalArgumentException("count must not be negative, got: " + count);
        }
    }

    private String render(long nanoTime) {
        if (state == ProgressState.FRESH) {
            return "ProgressLogger not started";
        }

        StringBuilder line = new StringBuilder(128);
        if (state == ProgressState.STOPPED) {
            long elapsedNanos = stopTime - startTime;
            line.append("Elapsed: ").append(ProgressFormat.prettyPrint(elapsedNanos / 1_000_000L));
            if (count != 0) {
                line.append(" [").append(items(count));
                appendSpeed(line, count, elapsedNanos, ", ");
                line.append(']');
            }
        } else {
            long elapsedNanos = nanoTime - startTime;
            line.append(items(count)).append(", ")
                .append(ProgressFormat.prettyPrint(elapsedNanos / 1_000_000L));
            appendSpeed(line, count, elapsedNanos, ", ");
            appendCompletion(line, elapsedNanos);
            if (config.isLocalSpeed()) {
                long localCount = count - lastCount;
                long localNanos = nanoTime - lastLogTime;
                if (localCount > 0 && localNanos > 0) {
                    line.append(" [");
                    appendSpeed(line, localCount, localNanos, "");
                    line.append(']');
                }
            }
        }

        if (displayMemory && memorySample != null) {
            line.append("; ").append(memorySample.describe());
        }
        return line.toString();
    }

    private String items(long n) {
        return ProgressFormat.formatCount(n, config.getTimeUnit() == null) + " "
            + Plurals.forCount(config.getItemName(), config.getPluralItemName(), n);
    }

    // rate is undefined without both items and elapsed time
    private void appendSpeed(StringBuilder line, long n, long nanos, String separator) {
        if (n > 0 && nanos > 0) {
            double secondsPerItem = nanos / 1e9 / n;
            line.append(separator).append(ProgressFormat.formatSpeed(secondsPerItem, config.getTimeUnit(),
                config.getItemName(), config.getPluralItemName()));
        }
    }

    private void appendCompletion(StringBuilder line, long elapsedNanos) {
        Long expected = config.getExpectedUpdates();
        if (expected == null || expected <= 0) {
            return;
        }
        line.append(String.format(Locale.ROOT, "; %.2f%% done", 100.0 * count / expected));
        if (count > 0 && elapsedNanos > 0 && expected > count) {
            double remainingNanos = (double) (expected - count) * elapsedNanos / count;
            line.append(", ").append(ProgressFormat.prettyPrint((long) (remainingNanos / 1e6))).append(" to end");
        }
    }
}
