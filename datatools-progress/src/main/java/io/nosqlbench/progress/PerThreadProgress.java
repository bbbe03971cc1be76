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

import java.util.Objects;
import java.util.Queue;
import java.util.concurrent.ConcurrentLinkedQueue;

/**
 * Hands out one handle of a {@link ConcurrentProgressLog} per thread, spawning it the first
 * time a thread asks. Meant for parallel streams and pools, where the worker threads are not
 * known in advance:
 * <pre>{@code
 * try (PerThreadProgress progress = cpl.perThread()) {
 *     items.parallelStream().forEach(item -> {
 *         process(item);
 *         progress.get().update();
 *     });
 * }
 * cpl.done();
 * }</pre>
 *
 * <p>{@link #close()} flushes every handle this view created. It must be called once the
 * parallel work is over, since a handle is not safe to flush while its thread still uses it.</p>
 */
public final class PerThreadProgress implements AutoCloseable {

    private final ConcurrentProgressLog parent;
    private final Queue<Slot> slots = new ConcurrentLinkedQueue<>();
    private final ThreadLocal<Slot> local;
    private volatile boolean closed;

    public PerThreadProgress(ConcurrentProgressLog parent) {
        this.parent = Objects.requireNonNull(parent, "parent");
        this.local = ThreadLocal.withInitial(this::register);
    }

    /**
     * Returns the handle of the calling thread.
     *
     * @return the handle, spawned on first use
     * @throws IllegalStateException if this view was closed
     */
    public ConcurrentProgressLog get() {
        if (closed) {
            throw new IllegalStateException("PerThreadProgress is closed");
        }
        ConcurrentProgressLog handle = local.get().handle;
        if (handle == null) {
            throw new IllegalStateException("PerThreadProgress is closed");
        }
        return handle;
    }

    public int handleCount() {
        return slots.size();
    }

    private Slot register() {
        Slot slot = new Slot(parent.spawn());
        slots.add(slot);
        return slot;
    }

    /**
     * Flushes and releases every handle. Pool threads outliving this view keep only an empty
     * slot in their thread-local map, not the handle or the logger behind it.
     */
    @Override
    public void close() {
        closed = true;
        Slot slot;
        while ((slot = slots.poll()) != null) {
            ConcurrentProgressLog handle = slot.handle;
            slot.handle = null;
            if (handle != null) {
                handle.close();
            }
        }
        local.remove();
    }

    private static final class Slot {
        private volatile ConcurrentProgressLog handle;

        private Slot(ConcurrentProgressLog handle) {
            this.handle = handle;
        }
    }
}
