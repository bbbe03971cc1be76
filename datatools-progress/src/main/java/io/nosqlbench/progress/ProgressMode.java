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

import java.util.Locale;

/**
 * Progress output modes for the {@code nb.progress.mode} system property. The mode decides
 * whether progress code gets a real logger or {@link NoopProgressLogger}:
 * <pre>{@code
 * ProgressLog pl = ProgressMode.fromSystemProperties().create(ProgressLogConfig.fromSystemProperties());
 * }</pre>
 */
public enum ProgressMode {
    /**
     * Progress lines are written to the configured Log4j 2 target.
     */
    LOG("log"),

    /**
     * All progress output is discarded.
     */
    OFF("off");

    public static final String MODE_PROPERTY = ProgressLogConfig.PROPERTY_PREFIX + "mode";

    private final String propertyValue;

    ProgressMode(String propertyValue) {
        this.propertyValue = propertyValue;
    }

    /**
     * Returns the value of {@code nb.progress.mode} that selects this mode.
     *
     * @return the property value string ("log" or "off")
     */
    public String getPropertyValue() {
        return propertyValue;
    }

    /**
     * Parses a mode, ignoring case and surrounding whitespace.
     *
     * <p>Supported values and aliases:</p>
     * <ul>
     *   <li><strong>LOG:</strong> "log", "logger", "text", "on", "true"</li>
     *   <li><strong>OFF:</strong> "off", "none", "disable", "disabled", "false"</li>
     * </ul>
     *
     * @param value the string value to parse (may be null)
     * @return the corresponding mode, or null if the input is null
     * @throws IllegalArgumentException if the value is not recognized
     */
    public static ProgressMode fromString(String value) {
        if (value == null) {
            return null;
        }
        String normalized = value.trim().toLowerCase(Locale.ROOT);
        switch (normalized) {
            case "log":
            case "logger":
            case "text":
            case "on":
            case "true":
                return LOG;
            case "off":
            case "none":
            case "disable":
            case "disabled":
            case "false":
                return OFF;
            default:
                throw new IllegalArgumentException(
                    "Unrecognized progress mode '" + value + "'. Expected one of: log, off.");
        }
    }

    /**
     * Reads {@code nb.progress.mode}, defaulting to {@link #LOG}.
     *
     * @return the selected mode
     * @throws IllegalArgumentException if the property holds an unknown value
     */
    public static ProgressMode fromSystemProperties() {
        ProgressMode mode = fromString(System.getProperty(MODE_PROPERTY));
        return mode != null ? mode : LOG;
    }

    public ProgressLog create(ProgressLogConfig config) {
        return this == OFF ? NoopProgressLogger.getInstance() : new ProgressLogger(config);
    }

    public ConcurrentProgressLog createConcurrent(ProgressLogConfig config) {
        return this == OFF ? NoopProgressLogger.getInstance() : ConcurrentProgressLogger.create(config);
    }

    @Override
    public String toString() {
        return propertyValue;
    }
}
