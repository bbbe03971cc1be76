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

package io.nosqlbench.progress.support;

/**
 * Source of monotonic timestamps for progress loggers. Timestamps are nanosecond readings
 * in the style of {@link System#nanoTime()}: only differences between two readings are meaningful,
 * and readings never go backward.
 *
 * <p>Loggers read the clock at most once per throttle check, so an implementation may be
 * comparatively expensive without affecting the per-item cost of {@code lightUpdate()}.</p>
 *
 * @since 4.0.0
 */
@FunctionalInterface
public interface ProgressClock {

    /**
     * The system monotonic clock.
     */
    ProgressClock SYSTEM = System::nanoTime;

    /**
     * Returns the current monotonic timestamp in nanoseconds.
     *
     * @return the current reading
     */
    long nanoTime();
}
