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

import io.nosqlbench.progress.format.ProgressFormat;

/**
 * Snapshot of memory usage taken when a progress line is about to be emitted.
 * Values that the running JVM cannot report are {@code -1} and are displayed as {@code N/A}.
 *
 * @param heapUsedBytes bytes currently used in the heap
 * @param heapCommittedBytes bytes committed to the heap
 * @param heapMaxBytes maximum heap size
 * @param physicalFreeBytes free physical memory of the host
 * @param physicalTotalBytes total physical memory of the host
 */
public record MemorySample(
    long heapUsedBytes,
    long heapCommittedBytes,
    long heapMaxBytes,
    long physicalFreeBytes,
    long physicalTotalBytes
) {

    /**
     * Renders this sample as the suffix appended to progress lines, for example
     * {@code heap used/committed/max 12.40MB/64.00MB/4.29GB, phys free/total 3.10GB/16.00GB}.
     *
     * @return the formatted memory summary
     */
    public String describe() {
        return "heap used/committed/max "
            + bytes(heapUsedBytes) + "/" + bytes(heapCommittedBytes) + "/" + bytes(heapMaxBytes)
            + ", phys free/total "
            + bytes(physicalFreeBytes) + "/" + bytes(physicalTotalBytes);
    }

    private static String bytes(long value) {
        return value < 0 ? "N/A" : ProgressFormat.humanize(value) + "B";
    }

    @Override
    public String toString() {
        return "MemorySample[" + describe() + "]";
    }
}
