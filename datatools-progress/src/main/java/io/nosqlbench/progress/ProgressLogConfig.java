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
import io.nosqlbench.progress.format.ProgressTimeUnit;
import org.apache.logging.log4j.Level;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.time.Duration;
import java.util.Locale;
import java.util.Objects;
import java.util.Properties;

/**
 * Immutable configuration of a progress logger. A {@link ProgressLogger} holds one value and
 * replaces it whenever a setter is called, so a configuration can be shared, compared and reused
 * as a template for new loggers.
 *
 * <p>The plural item name is derived when the value is built and cached with it; it is never
 * stale with respect to {@link #getItemName()}.</p>
 *
 * <h2>Property keys</h2>
 * <p>{@link #fromProperties(Properties)} and {@link #fromSystemProperties()} recognize:</p>
 * <ul>
 *   <li>{@code nb.progress.item} - item name</li>
 *   <li>{@code nb.progress.interval} - log interval ({@code 500ms}, {@code 10s}, {@code PT1M})</li>
 *   <li>{@code nb.progress.expected} - expected number of updates</li>
 *   <li>{@code nb.progress.timeunit} - fixed display unit ({@code ms}, {@code s}, {@code minutes}, ...)</li>
 *   <li>{@code nb.progress.localspeed} - show the speed over the last interval</li>
 *   <li>{@code nb.progress.memory} - show memory usage</li>
 *   <li>{@code nb.progress.target} - Log4j logger name</li>
 *   <li>{@code nb.progress.level} - Log4j level</li>
 *   <li>{@code nb.progress.lightmask} - sampling mask of {@code lightUpdate}</li>
 *   <li>{@code nb.progress.threshold} - merge threshold of concurrent handles</li>
 *   <li>{@code nb.progress.handlemask} - sampling mask of {@code lightUpdate} on concurrent handles</li>
 * </ul>
 *
 * @see ProgressLogger
 * @see ConcurrentProgressLogger
 * @since 4.0.0
 */
public final class ProgressLogConfig {

    public static final String DEFAULT_ITEM_NAME = "item";
    public static final Duration DEFAULT_LOG_INTERVAL = Duration.ofSeconds(10);
    public static final String DEFAULT_LOG_TARGET = ProgressLogger.class.getName();
    public static final int DEFAULT_LIGHT_UPDATE_MASK = (1 << 20) - 1;
    public static final int DEFAULT_MERGE_THRESHOLD = 1 << 15;
    public static final int DEFAULT_HANDLE_LIGHT_UPDATE_MASK = (1 << 10) - 1;

    public static final String PROPERTY_PREFIX = "nb.progress.";
    public static final String ITEM_PROPERTY = PROPERTY_PREFIX + "item";
    public static final String INTERVAL_PROPERTY = PROPERTY_PREFIX + "interval";
    public static final String EXPECTED_PROPERTY = PROPERTY_PREFIX + "expected";
    public static final String TIME_UNIT_PROPERTY = PROPERTY_PREFIX + "timeunit";
    public static final String LOCAL_SPEED_PROPERTY = PROPERTY_PREFIX + "localspeed";
    public static final String MEMORY_PROPERTY = PROPERTY_PREFIX + "memory";
    public static final String TARGET_PROPERTY = PROPERTY_PREFIX + "target";
    public static final String LEVEL_PROPERTY = PROPERTY_PREFIX + "level";
    public static final String LIGHT_MASK_PROPERTY = PROPERTY_PREFIX + "lightmask";
    public static final String THRESHOLD_PROPERTY = PROPERTY_PREFIX + "threshold";
    public static final String HANDLE_MASK_PROPERTY = PROPERTY_PREFIX + "handlemask";

    private static final long MAX_INTERVAL_NANOS = Long.MAX_VALUE >> 2;

    private static final ProgressLogConfig DEFAULTS = new Builder().build();

    private final String itemName;
    private final String pluralItemName;
    private final Duration logInterval;
    private final long logIntervalNanos;
    private final Long expectedUpdates;
    private final ProgressTimeUnit timeUnit;
    private final boolean localSpeed;
    private final boolean displayMemory;
    private final String logTarget;
    private final Level logLevel;
    private final int lightUpdateMask;
    private final int mergeThreshold;
    private final int handleLightUpdateMask;
    private final Logger output;

    private ProgressLogConfig(Builder builder) {
        this.itemName = builder.itemName;
        this.pluralItemName = builder.pluralItemName != null
            ? builder.pluralItemName
            : Plurals.pluralize(builder.itemName);
        this.logInterval = builder.logInterval;
        this.logIntervalNanos = saturatedNanos(builder.logInterval);
        this.expectedUpdates = builder.expectedUpdates;
        this.timeUnit = builder.timeUnit;
        this.localSpeed = builder.localSpeed;
        this.displayMemory = builder.displayMemory;
        this.logTarget = builder.logTarget;
        this.logLevel = builder.logLevel;
        this.lightUpdateMask = builder.lightUpdateMask;
        this.mergeThreshold = builder.mergeThreshold;
        this.handleLightUpdateMask = builder.handleLightUpdateMask;
        this.output = builder.output != null ? builder.output : LogManager.getLogger(builder.logTarget);
    }

    /**
     * Returns the default configuration.
     *
     * @return the defaults
     */
    public static ProgressLogConfig defaults() {
        return DEFAULTS;
    }

    /**
     * Creates a builder initialized with the defaults.
     *
     * @return a new builder
     */
    public static Builder builder() {
        return new Builder();
    }

    /**
     * Creates a builder initialized with this configuration.
     *
     * @return a new builder
     */
    public Builder toBuilder() {
        return new Builder(this);
    }

    /**
     * Reads a configuration from system properties; absent keys keep their defaults.
     *
     * @return the configuration
     * @throws IllegalArgumentException if a property value is malformed
     */
    public static ProgressLogConfig fromSystemProperties() {
        return fromProperties(System.getProperties());
    }

    /**
     * Reads a configuration from the given properties; absent keys keep their defaults.
     *
     * @param properties the properties to read the {@code nb.progress.*} keys from
     * @return the configuration
     * @throws IllegalArgumentException if a property value is malformed
     */
    public static ProgressLogConfig fromProperties(Properties properties) {
        Objects.requireNonNull(properties, "properties");
        Builder builder = builder();

        String value = properties.getProperty(ITEM_PROPERTY);
        if (value != null) {
            builder.itemName(value.trim());
        }
        value = properties.getProperty(INTERVAL_PROPERTY);
        if (value != null) {
            try {
                builder.logInterval(ProgressTimeUnit.parseDuration(value));
            } catch (IllegalArgumentException e) {
                throw invalid(INTERVAL_PROPERTY, value, e);
            }
        }
        value = properties.getProperty(EXPECTED_PROPERTY);
        if (value != null) {
            long expected = parseLong(EXPECTED_PROPERTY, value);
            apply(EXPECTED_PROPERTY, value, () -> builder.expectedUpdates(expected));
        }
        value = properties.getProperty(TIME_UNIT_PROPERTY);
        if (value != null) {
            ProgressTimeUnit unit = ProgressTimeUnit.valueOfSuffix(value);
            if (unit == null) {
                throw invalid(TIME_UNIT_PROPERTY, value, null);
            }
            builder.timeUnit(unit);
        }
        value = properties.getProperty(LOCAL_SPEED_PROPERTY);
        if (value != null) {
            builder.localSpeed(parseBoolean(LOCAL_SPEED_PROPERTY, value));
        }
        value = properties.getProperty(MEMORY_PROPERTY);
        if (value != null) {
            builder.displayMemory(parseBoolean(MEMORY_PROPERTY, value));
        }
        value = properties.getProperty(TARGET_PROPERTY);
        if (value != null) {
            builder.logTarget(value.trim());
        }
        value = properties.getProperty(LEVEL_PROPERTY);
        if (value != null) {
            Level level = Level.getLevel(value.trim().toUpperCase(Locale.ROOT));
            if (level == null) {
                throw invalid(LEVEL_PROPERTY, value, null);
            }
            builder.logLevel(level);
        }
        value = properties.getProperty(LIGHT_MASK_PROPERTY);
        if (value != null) {
            int mask = parseInt(LIGHT_MASK_PROPERTY, value);
            apply(LIGHT_MASK_PROPERTY, value, () -> builder.lightUpdateMask(mask));
        }
        value = properties.getProperty(THRESHOLD_PROPERTY);
        if (value != null) {
            int threshold = parseInt(THRESHOLD_PROPERTY, value);
            apply(THRESHOLD_PROPERTY, value, () -> builder.mergeThreshold(threshold));
        }
        value = properties.getProperty(HANDLE_MASK_PROPERTY);
        if (value != null) {
            int mask = parseInt(HANDLE_MASK_PROPERTY, value);
            apply(HANDLE_MASK_PROPERTY, value, () -> builder.handleLightUpdateMask(mask));
        }

        return builder.build();
    }

    public ProgressLogConfig withItemName(String itemName) {
        return toBuilder().itemName(itemName).build();
    }

    public ProgressLogConfig withLogInterval(Duration logInterval) {
        return toBuilder().logInterval(logInterval).build();
    }

    public ProgressLogConfig withExpectedUpdates(Long expectedUpdates) {
        return toBuilder().expectedUpdates(expectedUpdates).build();
    }

    public ProgressLogConfig withTimeUnit(ProgressTimeUnit timeUnit) {
        return toBuilder().timeUnit(timeUnit).build();
    }

    public ProgressLogConfig withLocalSpeed(boolean localSpeed) {
        return toBuilder().localSpeed(localSpeed).build();
    }

    public ProgressLogConfig withDisplayMemory(boolean displayMemory) {
        return toBuilder().displayMemory(displayMemory).build();
    }

    public ProgressLogConfig withLogTarget(String logTarget) {
        return toBuilder().logTarget(logTarget).build();
    }

    public ProgressLogConfig withLogLevel(Level logLevel) {
        return toBuilder().logLevel(logLevel).build();
    }

    public ProgressLogConfig withLightUpdateMask(int lightUpdateMask) {
        return toBuilder().lightUpdateMask(lightUpdateMask).build();
    }

    public ProgressLogConfig withMergeThreshold(int mergeThreshold) {
        return toBuilder().mergeThreshold(mergeThreshold).build();
    }

    public ProgressLogConfig withHandleLightUpdateMask(int handleLightUpdateMask) {
        return toBuilder().handleLightUpdateMask(handleLightUpdateMask).build();
    }

    public String getItemName() {
        return itemName;
    }

    /**
     * Returns the plural of the item name, computed once when this value was built.
     *
     * @return the plural item name
     */
    public String getPluralItemName() {
        return pluralItemName;
    }

    public Duration getLogInterval() {
        return logInterval;
    }

    long getLogIntervalNanos() {
        return logIntervalNanos;
    }

    /**
     * Returns the expected number of updates.
     *
     * @return the expected total, or null if unknown
     */
    public Long getExpectedUpdates() {
        return expectedUpdates;
    }

    /**
     * Returns the fixed display unit.
     *
     * @return the unit, or null when units are chosen automatically
     */
    public ProgressTimeUnit getTimeUnit() {
        return timeUnit;
    }

    public boolean isLocalSpeed() {
        return localSpeed;
    }

    public boolean isDisplayMemory() {
        return displayMemory;
    }

    public String getLogTarget() {
        return logTarget;
    }

    public Level getLogLevel() {
        return logLevel;
    }

    public int getLightUpdateMask() {
        return lightUpdateMask;
    }

    public int getMergeThreshold() {
        return mergeThreshold;
    }

    public int getHandleLightUpdateMask() {
        return handleLightUpdateMask;
    }

    Logger getOutput() {
        return output;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof ProgressLogConfig)) {
            return false;
        }
        ProgressLogConfig that = (ProgressLogConfig) o;
        return localSpeed == that.localSpeed
            && displayMemory == that.displayMemory
            && lightUpdateMask == that.lightUpdateMask
            && mergeThreshold == that.mergeThreshold
            && handleLightUpdateMask == that.handleLightUpdateMask
            && itemName.equals(that.itemName)
            && pluralItemName.equals(that.pluralItemName)
            && logInterval.equals(that.logInterval)
            && Objects.equals(expectedUpdates, that.expectedUpdates)
            && timeUnit == that.timeUnit
            && logTarget.equals(that.logTarget)
            && logLevel.equals(that.logLevel);
    }

    @Override
    public int hashCode() {
        return Objects.hash(itemName, logInterval, expectedUpdates, timeUnit, localSpeed, displayMemory,
            logTarget, logLevel, lightUpdateMask, mergeThreshold, handleLightUpdateMask);
    }

    @Override
    public String toString() {
        return "ProgressLogConfig[item=" + itemName
            + ", interval=" + logInterval
            + ", expected=" + expectedUpdates
            + ", timeUnit=" + timeUnit
            + ", localSpeed=" + localSpeed
            + ", memory=" + displayMemory
            + ", target=" + logTarget
            + ", level=" + logLevel
            + ", lightMask=" + lightUpdateMask
            + ", threshold=" + mergeThreshold
            + ", handleMask=" + handleLightUpdateMask + "]";
    }

    static void checkMask(int mask, String name) {
        if (mask < 0 || (mask & (mask + 1)) != 0) {
            throw new IllegalArgumentException(name + " must be of the form 2^k - 1, got: " + mask);
        }
    }

    // deadlines are compared by subtraction, so intervals stay well below 2^63 ns
    private static long saturatedNanos(Duration duration) {
        try {
            return Math.min(duration.toNanos(), MAX_INTERVAL_NANOS);
        } catch (ArithmeticException e) {
            return MAX_INTERVAL_NANOS;
        }
    }

    private static IllegalArgumentException invalid(String key, String value, Throwable cause) {
        return new IllegalArgumentException("Invalid value for " + key + ": '" + value + "'", cause);
    }

    private static void apply(String key, String value, Runnable setter) {
        try {
            setter.run();
        } catch (IllegalArgumentException e) {
            throw invalid(key, value, e);
        }
    }

    private static long parseLong(String key, String value) {
        try {
            return Long.parseLong(value.trim().replace("_", ""));
        } catch (NumberFormatException e) {
            throw invalid(key, value, e);
        }
    }

    private static int parseInt(String key, String value) {
        try {
            return Integer.parseInt(value.trim().replace("_", ""));
        } catch (NumberFormatException e) {
            throw invalid(key, value, e);
        }
    }

    private static boolean parseBoolean(String key, String value) {
        switch (value.trim().toLowerCase(Locale.ROOT)) {
            case "true":
            case "yes":
            case "on":
                return true;
            case "false":
            case "no":
            case "off":
                return false;
            default:
                throw invalid(key, value, null);
        }
    }

    /**
     * Builder for {@link ProgressLogConfig} values. Every setter validates its argument.
     */
    public static final class Builder {
        private String itemName = DEFAULT_ITEM_NAME;
        private String pluralItemName;
        private Duration logInterval = DEFAULT_LOG_INTERVAL;
        private Long expectedUpdates;
        private ProgressTimeUnit timeUnit;
        private boolean localSpeed;
        private boolean displayMemory;
        private String logTarget = DEFAULT_LOG_TARGET;
        private Level logLevel = Level.INFO;
        private int lightUpdateMask = DEFAULT_LIGHT_UPDATE_MASK;
        private int mergeThreshold = DEFAULT_MERGE_THRESHOLD;
        private int handleLightUpdateMask = DEFAULT_HANDLE_LIGHT_UPDATE_MASK;
        private Logger output;

        Builder() {
        }

        Builder(ProgressLogConfig config) {
            this.itemName = config.itemName;
            this.pluralItemName = config.pluralItemName;
            this.logInterval = config.logInterval;
            this.expectedUpdates = config.expectedUpdates;
            this.timeUnit = config.timeUnit;
            this.localSpeed = config.localSpeed;
            this.displayMemory = config.displayMemory;
            this.logTarget = config.logTarget;
            this.logLevel = config.logLevel;
            this.lightUpdateMask = config.lightUpdateMask;
            this.mergeThreshold = config.mergeThreshold;
            this.handleLightUpdateMask = config.handleLightUpdateMask;
            this.output = config.output;
        }

        public Builder itemName(String itemName) {
            String name = Objects.requireNonNull(itemName, "itemName");
            if (!name.equals(this.itemName)) {
                this.itemName = name;
                this.pluralItemName = null;
            }
            return this;
        }

        public Builder logInterval(Duration logInterval) {
            Objects.requireNonNull(logInterval, "logInterval");
            if (logInterval.isNegative()) {
                throw new IllegalArgumentException("logInterval must not be negative, got: " + logInterval);
            }
            this.logInterval = logInterval;
            return this;
        }

        public Builder expectedUpdates(Long expectedUpdates) {
            if (expectedUpdates != null && expectedUpdates < 0) {
                throw new IllegalArgumentException("expectedUpdates must not be negative, got: " + expectedUpdates);
            }
            this.expectedUpdates = expectedUpdates;
            return this;
        }

        public Builder timeUnit(ProgressTimeUnit timeUnit) {
            this.timeUnit = timeUnit;
            return this;
        }

        public Builder localSpeed(boolean localSpeed) {
            this.localSpeed = localSpeed;
            return this;
        }

        public Builder displayMemory(boolean displayMemory) {
            this.displayMemory = displayMemory;
            return this;
        }

        public Builder logTarget(String logTarget) {
            String target = Objects.requireNonNull(logTarget, "logTarget");
            if (!target.equals(this.logTarget)) {
                this.logTarget = target;
                this.output = null;
            }
            return this;
        }

        public Builder logLevel(Level logLevel) {
            this.logLevel = Objects.requireNonNull(logLevel, "logLevel");
            return this;
        }

        public Builder lightUpdateMask(int lightUpdateMask) {
            checkMask(lightUpdateMask, "lightUpdateMask");
            this.lightUpdateMask = lightUpdateMask;
            return this;
        }

        public Builder mergeThreshold(int mergeThreshold) {
            if (mergeThreshold < 1) {
                throw new IllegalArgumentException("mergeThreshold must be at least 1, got: " + mergeThreshold);
            }
            this.mergeThreshold = mergeThreshold;
            return this;
        }

        public Builder handleLightUpdateMask(int handleLightUpdateMask) {
            checkMask(handleLightUpdateMask, "handleLightUpdateMask");
            this.handleLightUpdateMask = handleLightUpdateMask;
            return this;
        }

        public ProgressLogConfig build() {
            return new ProgressLogConfig(this);
        }
    }
}
