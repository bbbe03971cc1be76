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

import io.nosqlbench.progress.ConcurrentProgressLog;
import io.nosqlbench.progress.ConcurrentProgressLogger;
import io.nosqlbench.progress.PerThreadProgress;
import io.nosqlbench.progress.ProgressLogConfig;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.stream.LongStream;

/**
 * Smashes pumpkins from many threads, once with one handle per raw thread and once with a
 * parallel stream and per-thread handles.
 */
public class ConcurrentExample {

    public static void main(String[] args) throws InterruptedException {
        long perThread = args.length > 0 ? Long.parseLong(args[0]) : 100_000_000L;
        run(Runtime.getRuntime().availableProcessors(), perThread);
    }

    static long run(int threads, long perThread) throws InterruptedException {
        ProgressLogConfig config = ProgressLogConfig.builder()
            .logTarget(SingleThreadedExample.TARGET)
            .itemName("pumpkin")
            .logInterval(Duration.ofSeconds(2))
            .expectedUpdates(threads * perThread)
            .build();

        ConcurrentProgressLogger cpl = ConcurrentProgressLogger.create(config);
        cpl.start("Smashing " + threads * perThread + " pumpkins (with raw threads)...");
        List<Thread> workers = new ArrayList<>();
        for (int t = 0; t < threads; t++) {
            ConcurrentProgressLog handle = cpl.spawn();
            Thread worker = new Thread(() -> {
                try (handle) {
                    for (long i = 0; i < perThread; i++) {
                        handle.lightUpdate();
                    }
                }
            }, "smasher-" + t);
            workers.add(worker);
            worker.start();
        }
        for (Thread worker : workers) {
            worker.join();
        }
        cpl.done();
        long total = cpl.count();

        ConcurrentProgressLogger streamed = cpl.cloneConfig()
            .displayMemory(true)
            .localSpeed(true);
        streamed.start("Smashing pumpkins (with a parallel stream)...");
        try (PerThreadProgress progress = streamed.perThread()) {
            LongStream.range(0, threads * perThread)
                .parallel()
                .forEach(i -> progress.get().lightUpdate());
        }
        streamed.done();
        return total + streamed.count();
    }
}
