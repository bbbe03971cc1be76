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
 * ExecutorService wrappers that report completed tasks to a progress logger.
 *
 * <h2>Key Classes</h2>
 * <ul>
 *   <li>{@link io.nosqlbench.progress.exec.ProgressExecutors} - Factory for tracking executors</li>
 *   <li>{@link io.nosqlbench.progress.exec.ProgressTrackingExecutor} - ExecutorService counting one item per task</li>
 *   <li>{@link io.nosqlbench.progress.exec.TaskStatistics} - Thread-safe task counters</li>
 * </ul>
 *
 * @see io.nosqlbench.progress.ConcurrentProgressLogger
 * @see io.nosqlbench.progress.PerThreadProgress
 * @since 4.0.0
 */
package io.nosqlbench.progress.exec;
