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

import java.util.Locale;

/**
 * Rendering helpers for the figures that appear on progress lines: elapsed times,
 * item counts, speeds and byte quantities. All output is locale-independent except for
 * the thousands separator of grouped counts, which is always a comma.
 */
public final class ProgressFormat {

    private static final String[] SCALE_UNITS = {"", "k", "M", "G", "T", "P", "E", "Z", "Y"};
    private static final ProgressTimeUnit[] PRETTY_UNITS = {
        ProgressTimeUnit.DAYS, ProgressTimeUnit.HOURS, ProgressTimeUnit.MINUTES
    };

    private ProgressFormat() {
    }

    /**
     * Renders a duration for humans. Durations under one second are shown in milliseconds
     * ({@code 950ms}); longer ones as days, hours and minutes when non-zero, followed by
     * seconds ({@code 1m 5s}, {@code 2d 3h 0s}).
     *
     * @param milliseconds the duration in milliseconds; negative values render as zero
     * @return the rendered duration
     */
    public static String prettyPrint(long milliseconds) {
        if (milliseconds < 1000) {
            return Math.max(0, milliseconds) + "ms";
        }

        StringBuilder result = new StringBuilder();
        long seconds = milliseconds / 1000;
        for (ProgressTimeUnit unit : PRETTY_UNITS) {
            long toSeconds = unit.getNanos() / ProgressTimeUnit.SECONDS.getNanos();
            if (seconds >= toSeconds) {
                result.append(seconds / toSeconds).append(unit.getLabel()).append(' ');
                seconds %= toSeconds;
            }
        }
        return result.append(seconds).append('s').toString();
    }

    /**
     * Scales a value by powers of 1000 and renders it with two decimals and an SI prefix,
     * e.g. {@code 1.00k} or {@code 1.23G}.
     *
     * @param value the value to render
     * @return the scaled value with its prefix
     */
    public static String humanize(double value) {
        int unit = 0;
        while (value >= 1000.0 && unit < SCALE_UNITS.length - 1) {
            value /= 1000.0;
            unit++;
        }
        return String.format(Locale.ROOT, "%.2f%s", value, SCALE_UNITS[unit]);
    }

    /**
     * Renders an item count.
     *
     * @param count the count
     * @param grouped whether to separate thousands, which is disabled when the output must be parsed
     * @return the rendered count
     */
    public static String formatCount(long count, boolean grouped) {
        return grouped ? String.format(Locale.US, "%,d", count) : Long.toString(count);
    }

    /**
     * Renders a processing speed as both items per unit of time and time per item, e.g.
     * {@code 102.83 items/s, 9.72 ms/item}.
     *
     * @param secondsPerItem average time taken by one item; must be positive and finite
     * @param fixedUnit the unit to use for both figures, or null to choose readable units
     * @param itemName singular item name
     * @param pluralItemName plural item name
     * @return the rendered speed
     */
    public static String formatSpeed(double secondsPerItem,
                                     ProgressTimeUnit fixedUnit,
                                     String itemName,
                                     String pluralItemName) {
        double itemsPerSecond = 1.0 / secondsPerItem;
        ProgressTimeUnit speedUnit = fixedUnit != null ? fixedUnit : ProgressTimeUnit.niceSpeedUnit(secondsPerItem);
        ProgressTimeUnit timingUnit = fixedUnit != null ? fixedUnit : ProgressTimeUnit.niceTimeUnit(secondsPerItem);

        return String.format(Locale.ROOT, "%.2f %s/%s, %.2f %s/%s",
            itemsPerSecond * speedUnit.asSeconds(),
            pluralItemName,
            speedUnit.getLabel(),
            secondsPerItem / timingUnit.asSeconds(),
            timingUnit.getLabel(),
            itemName);
    }
}
