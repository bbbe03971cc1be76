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

import io.nosqlbench.progress.support.MemorySample;
import io.nosqlbench.progress.support.MemorySampler;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.RepeatedTest;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.TestInfo;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.stream.IntStream;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.*;

public class ConcurrentProgressLoggerTest {

    private SimulatedClock clock;
    private CapturingAppender output;
    private ProgressLogConfig config;
    private final AtomicInteger samples = new AtomicInteger();
    private final MemorySampler sampler = () -> {
        samples.incrementAndGet();
        return new MemorySample(1, 2, 3, 4, 5);
    };

    @BeforeEach
    public void setUp(TestInfo info) {
        String target = "test.progress.ConcurrentProgressLoggerTest." + info.getTestMethod().orElseThrow().getName();
        output = CapturingAppender.attach(target);
        clock = new SimulatedClock();
        config = ProgressLogConfig.builder().logTarget(target).build();
    }

    @AfterEach
    public void tearDown() {
        output.detach();
    }

    private ConcurrentProgressLogger newLogger(ProgressLogConfig cfg) {
        return ConcurrentProgressLogger.wrap(new ProgressLogger(cfg, clock, sampler));
    }

    @RepeatedTest(20)
    public void fourHandlesCountExactly() throws Exception {
        ConcurrentProgressLogger cpl = newLogger(config).threshold(7);
        cpl.start("Starting");

        List<Thread> threads = new ArrayList<>();
        for (int t = 0; t < 4; t++) {
            ConcurrentProgressLog handle = cpl.spawn();
            Thread thread = new Thread(() -> {
                try (handle) {
                    for (int i = 0; i < 1000; i++) {
                        handle.update();
                    }
                }
            });
            threads.add(thread);
            thread.start();
        }
        for (Thread thread : threads) {
            thread.join(TimeUnit.SECONDS.toMillis(30));
            assertFalse(thread.isAlive());
        }

        assertEquals(4000, cpl.count());
    }

    @RepeatedTest(10)
    public void mixedUpdatesFromPoolCountExactly() throws Exception {
        ConcurrentProgressLogger cpl = newLogger(config.withLogInterval(Duration.ZERO))
            .threshold(16)
            .lightUpdateMask(7);
        cpl.start(null);

        ExecutorService pool = Executors.newFixedThreadPool(8);
        try {
            List<Future<?>> futures = new ArrayList<>();
            for (int t = 0; t < 16; t++) {
                ConcurrentProgressLog handle = cpl.spawn();
                futures.add(pool.submit(() -> {
                    try (handle) {
                        for (int i = 0; i < 3000; i++) {
                            switch (i % 3) {
                                case 0:
                                    handle.update();
                                    break;
                                case 1:
                                    handle.updateWithCount(3);
                                    break;
                                default:
                                    handle.lightUpdate();
                                    break;
                            }
                        }
                    }
                }));
            }
            for (Future<?> future : futures) {
                future.get(30, TimeUnit.SECONDS);
            }
        } finally {
            pool.shutdownNow();
        }

        // per handle: 1000 * 1 + 1000 * 3 + 1000 * 1
        assertEquals(16 * 5000, cpl.count());
    }

    @Test
    public void bufferedUpdatesStayLocalBelowThreshold() {
        ConcurrentProgressLogger cpl = newLogger(config).threshold(4);
        cpl.start(null);
        for (int i = 0; i < 3; i++) {
            cpl.update();
        }
        assertEquals(0, cpl.count());
        assertEquals(3, cpl.localCount());

        cpl.update();
        assertEquals(4, cpl.count());
        assertEquals(0, cpl.localCount());
    }

    @Test
    public void flushMergesBufferAndRunsThrottle() {
        ConcurrentProgressLogger cpl = newLogger(config).threshold(1000);
        cpl.start("Starting");
        ConcurrentProgressLogger handle = cpl.spawn();
        for (int i = 0; i < 10; i++) {
            handle.update();
        }
        clock.advance(Duration.ofSeconds(10));

        handle.flush();
        assertEquals(10, cpl.count());
        assertEquals(0, handle.localCount());
        assertEquals(2, output.size());

        clock.advance(Duration.ofSeconds(10));
        handle.flush();
        assertEquals(10, cpl.count());
        assertEquals(3, output.size());
    }

    @Test
    public void lightUpdateMergesEachBufferOnce() {
        ConcurrentProgressLogger cpl = newLogger(config).threshold(1_000_000).lightUpdateMask(3);
        cpl.start(null);

        long[] expectedShared = {1, 1, 1, 1, 5, 5, 5, 5, 9, 9};
        for (int i = 0; i < 10; i++) {
            cpl.lightUpdate();
            assertEquals(expectedShared[i], cpl.count(), "after call " + i);
        }
        assertEquals(1, cpl.localCount());

        cpl.flush();
        assertEquals(10, cpl.count());
        assertEquals(0, cpl.localCount());
    }

    @Test
    public void updateWithCountMergesWhenThresholdReached() {
        ConcurrentProgressLogger cpl = newLogger(config).threshold(100);
        cpl.start(null);
        cpl.updateWithCount(60);
        assertEquals(0, cpl.count());
        cpl.updateWithCount(40);
        assertEquals(100, cpl.count());
        assertEquals(0, cpl.localCount());
        assertThrows(IllegalArgumentException.class, () -> cpl.updateWithCount(-2));
    }

    @Test
    public void hugeCountMergesBufferSeparately() {
        ConcurrentProgressLogger cpl = newLogger(config).threshold(100);
        cpl.start(null);
        cpl.updateWithCount(5);
        cpl.updateWithCount(Long.MAX_VALUE - 1);

        assertEquals(Long.MAX_VALUE, cpl.count());
        assertEquals(0, cpl.localCount());
    }

    @Test
    public void closeFlushesHandle() {
        ConcurrentProgressLogger cpl = newLogger(config);
        cpl.start(null);
        try (ConcurrentProgressLog handle = cpl.spawn()) {
            handle.update();
            handle.update();
            handle.update();
        }
        assertEquals(3, cpl.count());
    }

    @Test
    public void doneIncludesLocalBuffer() {
        ConcurrentProgressLogger cpl = newLogger(config);
        cpl.start("Starting");
        clock.advance(Duration.ofSeconds(1));
        for (int i = 0; i < 5; i++) {
            cpl.update();
        }
        cpl.done();

        assertEquals(5, cpl.count());
        assertEquals(0, cpl.localCount());
        assertEquals(ProgressState.STOPPED, cpl.state());
        assertEquals(List.of(
            "Starting",
            "Completed.",
            "Elapsed: 1s [5 items, 5.00 items/s, 200.00 ms/item]"
        ), output.messages());
    }

    @Test
    public void stopIncludesLocalBuffer() {
        ConcurrentProgressLogger cpl = newLogger(config);
        cpl.start(null);
        cpl.updateWithCount(7);
        cpl.stop("Stopped");
        assertEquals(7, cpl.count());
        assertEquals(ProgressState.STOPPED, cpl.state());
    }

    @Test
    public void doneWithCountReplacesTotal() {
        ConcurrentProgressLogger cpl = newLogger(config);
        cpl.start(null);
        cpl.update();
        cpl.doneWithCount(250);
        assertEquals(250, cpl.count());
        assertEquals(0, cpl.localCount());
    }

    @Test
    public void startDiscardsPreviousEpochBuffer() {
        ConcurrentProgressLogger cpl = newLogger(config);
        cpl.start(null);
        cpl.updateWithCount(3);
        cpl.start("again");
        assertEquals(0, cpl.localCount());
        assertEquals(0, cpl.count());
    }

    @Test
    public void updateAndDisplayForcesLine() {
        ConcurrentProgressLogger cpl = newLogger(config);
        cpl.start(null);
        cpl.update();
        cpl.updateAndDisplay();
        assertEquals(2, cpl.count());
        assertEquals(List.of("2 items, 0ms"), output.messages());
    }

    @Test
    public void spawnedHandlesShareState() {
        ConcurrentProgressLogger cpl = newLogger(config).threshold(1);
        ConcurrentProgressLogger handle = cpl.spawn();
        assertEquals(1, handle.getThreshold());

        cpl.start(null);
        handle.update();
        assertEquals(1, cpl.count());

        handle.itemName("row");
        assertEquals("rows", cpl.getConfig().getPluralItemName());
    }

    @Test
    public void cloneConfigIsIndependent() {
        ConcurrentProgressLogger cpl = newLogger(config.withItemName("page")).threshold(1);
        cpl.start(null);
        cpl.update();

        ConcurrentProgressLogger clone = cpl.cloneConfig();
        assertEquals(ProgressState.FRESH, clone.state());
        assertEquals(0, clone.count());
        assertEquals(cpl.getConfig(), clone.getConfig());

        clone.start(null);
        clone.update();
        assertEquals(1, cpl.count());
        assertEquals(1, clone.count());
    }

    @Test
    public void memoryIsSampledOnlyForEmittedLines() {
        ConcurrentProgressLogger cpl = newLogger(config.withDisplayMemory(true)).threshold(1);
        cpl.start(null);
        for (int i = 0; i < 100; i++) {
            clock.advance(Duration.ofSeconds(1));
            cpl.update();
        }

        assertEquals(10, output.size());
        assertEquals(output.size(), samples.get());
        assertThat(output.messages()).allMatch(line -> line.contains("heap used/committed/max"));
    }

    @Test
    public void perThreadHandlesWithParallelStream() {
        ConcurrentProgressLogger cpl = newLogger(config).threshold(64);
        cpl.start(null);

        PerThreadProgress progress = cpl.perThread();
        try (progress) {
            IntStream.range(0, 10_000).parallel().forEach(i -> progress.get().update());
            assertThat(progress.handleCount()).isBetween(1, Runtime.getRuntime().availableProcessors() + 1);
        }

        assertEquals(10_000, cpl.count());
        assertThrows(IllegalStateException.class, progress::get);
    }

    @Test
    public void updatesBeforeStartAreIgnored() {
        ConcurrentProgressLogger cpl = newLogger(config).threshold(1);
        cpl.update();
        cpl.flush();
        assertEquals(0, cpl.count());
        assertEquals(ProgressState.FRESH, cpl.state());
    }

    @Test
    public void rejectsInvalidHandleSettings() {
        ConcurrentProgressLogger cpl = newLogger(config);
        assertThrows(IllegalArgumentException.class, () -> cpl.threshold(0));
        assertThrows(IllegalArgumentException.class, () -> cpl.lightUpdateMask(6));
    }

    @Test
    public void defaultsComeFromConfig() {
        ConcurrentProgressLogger cpl = newLogger(config.withMergeThreshold(123));
        assertEquals(123, cpl.getThreshold());
        assertEquals(ConcurrentProgressLogger.DEFAULT_THRESHOLD,
            newLogger(config).getThreshold());
    }
}
