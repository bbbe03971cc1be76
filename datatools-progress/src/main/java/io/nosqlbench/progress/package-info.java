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

/**
 * Time-throttled progress logging for long-running, item-processing work.
 *
 * <p>A progress logger counts processed items and writes a status line at most once per
 * log interval, however fast items are processed. Lines go to a Log4j 2 logger.</p>
 *
 * <h2>Key Classes</h2>
 * <ul>
 *   <li>{@link io.nosqlbench.progress.ProgressLog} - Capability accepted by code that reports progress</li>
 *   <li>{@link io.nosqlbench.progress.ProgressLogger} - Single-threaded logger</li>
 *   <li>{@link io.nosqlbench.progress.ConcurrentProgressLogger} - Buffered handles over one shared logger</li>
 *   <li>{@link io.nosqlbench.progress.NoopProgressLogger} - Logger that discards everything</li>
 *   <li>{@link io.nosqlbench.progress.ProgressLogConfig} - Immutable configuration, readable from properties</li>
 *   <li>{@link io.nosqlbench.progress.ProgressMode} - Selects a real or no-op logger from {@code nb.progress.mode}</li>
 * </ul>
 *
 * <h2>Quick Start</h2>
 * <pre>{@code
 * ProgressLogger pl = new ProgressLogger()
 *     .itemName("record")
 *     .expectedUpdates(total)
 *     .logInterval(Duration.ofSeconds(5));
 * pl.start("Loading records...");
 * for (Record r : records) {
 *     load(r);
 *     pl.lightUpdate();
 * }
 * pl.done();
 * }</pre>
 *
 * @since 4.0.0
 */
package io.nosqlbench.progress;
