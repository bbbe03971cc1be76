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
 * Samples memory usage for display on progress lines.
 *
 * <p>A logger invokes its sampler at most once per emitted line, and only when memory display
 * is enabled. Concurrent loggers invoke it before taking their shared lock, so implementations
 * may block or contend with other samplers without lengthening the critical section.</p>
 *
 * @see JvmMemorySampler
 * @since 4.0.0
 */
@FunctionalInterface
public interface MemorySampler {

    /**
     * Takes a fresh memory sample.
     *
     * @return the current memory usage
     */
    MemorySample sample();

    /**
     * Returns the default sampler backed by the platform management beans.
     *
     * @return the JVM memory sampler
     */
    static MemorySampler jvm() {
        return JvmMemorySampler.getInstance();
    }
}
