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

import java.lang.management.ManagementFactory;
import java.lang.management.MemoryMXBean;
import java.lang.management.MemoryUsage;
import java.lang.management.OperatingSystemMXBean;

/**
 * {@link MemorySampler} backed by the platform {@link MemoryMXBean} for heap figures and,
 * when the JVM exposes it, {@code com.sun.management.OperatingSystemMXBean} for host memory.
 */
public final class JvmMemorySampler implements MemorySampler {

    private static final JvmMemorySampler INSTANCE = new JvmMemorySampler();

    private final MemoryMXBean memoryMXBean;
    private final OperatingSystemMXBean osMXBean;

    private JvmMemorySampler() {
        this.memoryMXBean = ManagementFactory.getMemoryMXBean();
        this.osMXBean = ManagementFactory.getOperatingSystemMXBean();
    }

    /**
     * Returns the shared sampler instance.
     *
     * @return the singleton sampler
     */
    public static JvmMemorySampler getInstance() {
        return INSTANCE;
    }

    @Override
    public MemorySample sample() {
        MemoryUsage heapUsage = memoryMXBean.getHeapMemoryUsage();
        long max = heapUsage.getMax();
        if (max <= 0) {
            // Max not defined, use committed as fallback
            max = heapUsage.getCommitted();
        }

        long free = -1;
        long total = -1;
        if (osMXBean instanceof com.sun.management.OperatingSystemMXBean) {
            com.sun.management.OperatingSystemMXBean hostBean = (com.sun.management.OperatingSystemMXBean) osMXBean;
            free = hostBean.getFreeMemorySize();
            total = hostBean.getTotalMemorySize();
        }

        return new MemorySample(heapUsage.getUsed(), heapUsage.getCommitted(), max, free, total);
    }
}
