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

package io.nosqlbench.progress.examples;

import io.nosqlbench.progress.ConcurrentProgressLogger;
import io.nosqlbench.progress.ProgressLogConfig;
import io.nosqlbench.progress.exec.ProgressExecutors;
import io.nosqlbench.progress.exec.ProgressTrackingExecutor;

import java.time.Duration;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadLocalRandom;

/**
 * Counts tasks of a fixed pool, one item per task.
 */
public class ExecutorExample {

    public static void main(String[] args) {
        run(2_000, 5);
    }

    static long run(int tasks, int maxTaskMillis) {
        ConcurrentProgressLogger cpl = ConcurrentProgressLogger.create(ProgressLogConfig.builder()
            .logTarget(SingleThreadedExample.TARGET)
            .itemName("task")
            .logInterval(Duration.ofSeconds(1))
            .expectedUpdates((long) tasks)
            .mergeThreshold(16)
            .build());

        cpl.start("Running " + tasks + " tasks on 8 threads...");
        try (ProgressTrackingExecutor executor = ProgressExecutors.wrap(Executors.newFixedThreadPool(8), cpl).build()) {
            for (int i = 0; i < tasks; i++) {
                executor.submit(() -> {
                    Thread.sleep(ThreadLocalRandom.current().nextInt(maxTaskMillis + 1));
                    return null;
                });
            }
        }
        cpl.done();
        return cpl.count();
    }
}
