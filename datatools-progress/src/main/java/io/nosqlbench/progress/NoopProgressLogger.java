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

import io.nosqlbench.progress.format.ProgressTimeUnit;
import org.apache.logging.log4j.Level;

import java.time.Duration;
import java.util.Optional;

/**
 * A progress logger that discards everything. Code written against {@link ProgressLog} or
 * {@link ConcurrentProgressLog} runs unchanged with this instance when progress output is
 * not wanted.
 *
 * <p>This logger:
 * <ul>
 *   <li>is a stateless singleton, safe to share between threads</li>
 *   <li>reports a count of zero and a {@link ProgressState#FRESH} state</li>
 *   <li>returns itself from {@link #spawn()} and {@link #cloneConfig()}</li>
 * </ul>
 *
 * <pre>{@code
 * ProgressLog pl = verbose ? new ProgressLogger() : ProgressLog.disabled();
 * }</pre>
 *
 * @see ProgressLog#disabled()
 * @see ProgressMode#OFF
 * @since 4.0.0
 */
public final class NoopProgressLogger implements ConcurrentProgressLog {

    private static final NoopProgressLogger INSTANCE = new NoopProgressLogger();

    private NoopProgressLogger() {
    }

    public static NoopProgressLogger getInstance() {
        return INSTANCE;
    }

    @Override
    public void log(long nanoTime) {
    }

    @Override
    public void logIf() {
    }

    @Override
    public NoopProgressLogger displayMemory(boolean displayMemory) {
        return this;
    }

    @Override
    public NoopProgressLogger itemName(String itemName) {
        return this;
    }

    @Override
    public NoopProgressLogger logInterval(Duration logInterval) {
        return this;
    }

    @Override
    public NoopProgressLogger expectedUpdates(Long expectedUpdates) {
        return this;
    }

    @Override
    public NoopProgressLogger timeUnit(ProgressTimeUnit timeUnit) {
        return this;
    }

    @Override
    public NoopProgressLogger localSpeed(boolean localSpeed) {
        return this;
    }

    @Override
    public NoopProgressLogger logTarget(String logTarget) {
        return this;
    }

    @Override
    public NoopProgressLogger logLevel(Level logLevel) {
        return this;
    }

    @Override
    public void start(String message) {
    }

    @Override
    public void update() {
    }

    @Override
    public void updateWithCount(long count) {
    }

    @Override
    public void lightUpdate() {
    }

    @Override
    public void updateAndDisplay() {
    }

    @Override
    public void stop() {
    }

    @Override
    public void stop(String message) {
    }

    @Override
    public void done() {
    }

    @Override
    public void doneWithCount(long count) {
    }

    @Override
    public long count() {
        return 0;
    }

    @Override
    public ProgressState state() {
        return ProgressState.FRESH;
    }

    @Override
    public Optional<Duration> elapsed() {
        return Optional.empty();
    }

    @Override
    public void refresh() {
    }

    @Override
    public void info(String format, Object... args) {
    }

    @Override
    public NoopProgressLogger cloneConfig() {
        return this;
    }

    @Override
    public NoopProgressLogger spawn() {
        return this;
    }

    @Override
    public void flush() {
    }

    @Override
    public void close() {
    }

    @Override
    public String toString() {
        return "NoopProgressLogger";
    }
}
