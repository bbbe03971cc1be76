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

package io.nosqlbench.progress.format;

import java.time.Duration;
import java.time.format.DateTimeParseException;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Time units used to display speeds and per-item timings on progress lines, and to parse
 * interval settings such as {@code 500ms} or {@code 10s}.
 *
 * <p>When a logger has no fixed unit configured, {@link #niceSpeedUnit(double)} and
 * {@link #niceTimeUnit(double)} pick the unit that keeps displayed figures readable.</p>
 */
public enum ProgressTimeUnit {
    /** Nanosecond (1 nanosecond) */
    NANOSECONDS("ns", "nanoseconds", 1L),
    /** Microsecond (1,000 nanoseconds) */
    MICROSECONDS("μs", "microseconds", 1_000L),
    /** Millisecond (1,000,000 nanoseconds) */
    MILLISECONDS("ms", "milliseconds", 1_000_000L),
    /** Second (1,000,000,000 nanoseconds) */
    SECONDS("s", "seconds", 1_000_000_000L),
    /** Minute (60 seconds) */
    MINUTES("m", "minutes", 60_000_000_000L),
    /** Hour (3,600 seconds) */
    HOURS("h", "hours", 3_600_000_000_000L),
    /** Day (86,400 seconds) */
    DAYS("d", "days", 86_400_000_000_000L);

    private static final Pattern durationPattern = Pattern.compile(
        " *(?<number>[0-9]+(\\.[0-9]+)?) *(?<unit>[^ 0-9]+?)? *");

    private final String label;
    private final String longName;
    private final long nanos;

    ProgressTimeUnit(String label, String longName, long nanos) {
        this.label = label;
        this.longName = longName;
        this.nanos = nanos;
    }

    /**
     * Returns the short label used on progress lines, such as {@code ms} or {@code h}.
     *
     * @return the display label
     */
    public String getLabel() {
        return label;
    }

    /**
     * Returns the spelled-out name, such as {@code milliseconds}.
     *
     * @return the long name
     */
    public String getLongName() {
        return longName;
    }

    /**
     * Returns the length of this unit in nanoseconds.
     *
     * @return nanoseconds per unit
     */
    public long getNanos() {
        return nanos;
    }

    /**
     * Returns the length of this unit in seconds.
     *
     * @return seconds per unit
     */
    public double asSeconds() {
        return nanos / 1.0e9;
    }

    /**
     * Chooses the largest unit not exceeding the given time, for displaying time per item.
     *
     * @param seconds a time in seconds
     * @return the unit to display {@code seconds} in
     */
    public static ProgressTimeUnit niceTimeUnit(double seconds) {
        ProgressTimeUnit[] units = values();
        for (int i = units.length - 1; i >= 0; i--) {
            if (seconds >= units[i].asSeconds()) {
                return units[i];
            }
        }
        return NANOSECONDS;
    }

    /**
     * Chooses the unit for displaying items per unit of time: the smallest unit, starting at
     * seconds, in which at least one item is processed.
     *
     * @param secondsPerItem time taken by one item, in seconds
     * @return the unit to express the speed in
     */
    public static ProgressTimeUnit niceSpeedUnit(double secondsPerItem) {
        for (ProgressTimeUnit unit : values()) {
            if (unit.compareTo(SECONDS) >= 0 && secondsPerItem <= unit.asSeconds()) {
                return unit;
            }
        }
        return DAYS;
    }

    /**
     * Get the unit matching a label, constant name or long name, ignoring case. The label
     * {@code us} is accepted for microseconds.
     *
     * @param text the string provided by the user
     * @return the matching unit, or null when none matches
     */
    public static ProgressTimeUnit valueOfSuffix(String text) {
        if (text == null) {
            return null;
        }
        String trimmed = text.trim();
        if (trimmed.equalsIgnoreCase("us")) {
            return MICROSECONDS;
        }
        for (ProgressTimeUnit unit : values()) {
            if (unit.label.equals(trimmed)
                || unit.name().equalsIgnoreCase(trimmed)
                || unit.longName.equalsIgnoreCase(trimmed)) {
                return unit;
            }
        }
        for (ProgressTimeUnit unit : values()) {
            if (unit.label.equalsIgnoreCase(trimmed)) {
                return unit;
            }
        }
        return null;
    }

    /**
     * Parses an interval setting. Accepts a number with an optional unit suffix
     * ({@code 250ms}, {@code 10s}, {@code 1.5m}; a bare number means milliseconds) or an
     * ISO-8601 duration such as {@code PT10S}.
     *
     * @param text the interval to parse
     * @return the parsed duration
     * @throws IllegalArgumentException if the value or its unit cannot be recognized
     */
    public static Duration parseDuration(String text) {
        if (text == null || text.isBlank()) {
            throw new IllegalArgumentException("Empty duration");
        }
        String trimmed = text.trim();
        if (trimmed.startsWith("P") || trimmed.startsWith("p")) {
            try {
                return Duration.parse(trimmed);
            } catch (DateTimeParseException e) {
                throw new IllegalArgumentException("Unable to parse duration:" + text, e);
            }
        }

        Matcher m = durationPattern.matcher(trimmed);
        if (!m.matches()) {
            throw new IllegalArgumentException("Unable to parse duration:" + text);
        }
        double base = Double.parseDouble(m.group("number"));
        String unitpart = m.group("unit");
        ProgressTimeUnit unit = MILLISECONDS;
        if (unitpart != null) {
            unit = valueOfSuffix(unitpart);
            if (unit == null) {
                throw new IllegalArgumentException("Unable to recognize duration unit:" + unitpart);
            }
        }
        return Duration.ofNanos(Math.round(base * unit.nanos));
    }
}
