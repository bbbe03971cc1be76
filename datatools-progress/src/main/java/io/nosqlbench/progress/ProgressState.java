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
 * Lifecycle states of a progress logger. A logger is created {@link #FRESH}, enters
 * {@link #RUNNING} on {@code start}, and {@link #STOPPED} on {@code stop} or {@code done}.
 * Calling {@code start} again from {@link #STOPPED} begins a new epoch with all counters reset.
 *
 * @see ProgressLog#state()
 */
public enum ProgressState {
    /**
     * Created but never started. Updates are ignored.
     */
    FRESH,

    /**
     * Started and counting. Updates accumulate and trigger throttled progress lines.
     */
    RUNNING,

    /**
     * Stopped; the stop time is fixed and updates are ignored until the next start.
     */
    STOPPED
}
