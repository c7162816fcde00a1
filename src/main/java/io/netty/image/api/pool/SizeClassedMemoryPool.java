/*
 * Copyright 2021 The Netty Project
 *
 * The Netty Project licenses this file to you under the Apache License,
 * version 2.0 (the "License"); you may not use this file except in compliance
 * with the License. You may obtain a copy of the License at:
 *
 *   https://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS, WITHOUT
 * WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied. See the
 * License for the specific language governing permissions and limitations
 * under the License.
 */
package io.netty.image.api.pool;

import io.netty.image.api.MemoryManager;
import io.netty.image.api.ResourceDisposeFailedException;
import io.netty.util.internal.SystemPropertyUtil;
import io.netty.util.internal.logging.InternalLogger;
import io.netty.util.internal.logging.InternalLoggerFactory;

import java.lang.invoke.VarHandle;
import java.nio.ByteBuffer;
import java.util.ArrayList;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.atomic.AtomicInteger;

import static io.netty.image.api.internal.Statics.findVarHandle;
import static java.lang.invoke.MethodHandles.lookup;

/**
 * A {@link MemoryManager} that caches released storage, keyed by its exact size, and hands it out again for later
 * allocations of the same size. Storage that the pool does not want to keep is released to the underlying manager.
 * <p>
 * Storage handed out by the pool is not cleared; its contents are whatever the previous user left behind.
 * <p>
 * This class is thread-safe.
 */
public class SizeClassedMemoryPool implements MemoryManager, AutoCloseable {
    private static final InternalLogger logger = InternalLoggerFactory.getInstance(SizeClassedMemoryPool.class);
    private static final int DEFAULT_MAX_CACHED_PER_SIZE_CLASS =
            Math.max(SystemPropertyUtil.getInt("io.netty.image.pool.maxCachedPerSizeClass", 64), 0);
    private static final VarHandle CLOSE = findVarHandle(
            lookup(), SizeClassedMemoryPool.class, "closed", boolean.class);
    private final MemoryManager manager;
    private final int maxCachedPerSizeClass;
    private final ConcurrentHashMap<Integer, SizeClass> pool;
    @SuppressWarnings("unused")
    private volatile boolean closed;

    public SizeClassedMemoryPool(MemoryManager manager) {
        this(manager, DEFAULT_MAX_CACHED_PER_SIZE_CLASS);
    }

    public SizeClassedMemoryPool(MemoryManager manager, int maxCachedPerSizeClass) {
        if (manager == null) {
            throw new NullPointerException("manager");
        }
        if (maxCachedPerSizeClass < 0) {
            throw new IllegalArgumentException(
                    "Max cached per size class cannot be negative, but was " + maxCachedPerSizeClass + '.');
        }
        this.manager = manager;
        this.maxCachedPerSizeClass = maxCachedPerSizeClass;
        pool = new ConcurrentHashMap<>();
    }

    @Override
    public boolean isNative() {
        return manager.isNative();
    }

    @Override
    public ByteBuffer allocate(int size) {
        if (closed) {
            throw new IllegalStateException("This memory pool is closed.");
        }
        SizeClass sizeClass = getSizeClass(size);
        ByteBuffer memory = sizeClass.queue.poll();
        if (memory != null) {
            sizeClass.count.decrementAndGet();
            return memory.clear();
        }
        return manager.allocate(size);
    }

    @Override
    public void release(ByteBuffer memory) {
        if (closed) {
            manager.release(memory);
            return;
        }
        SizeClass sizeClass = getSizeClass(memory.capacity());
        if (sizeClass.count.incrementAndGet() > maxCachedPerSizeClass) {
            sizeClass.count.decrementAndGet();
            manager.release(memory);
            return;
        }
        sizeClass.queue.offer(memory);
        if (closed) {
            ByteBuffer cached;
            while ((cached = sizeClass.queue.poll()) != null) {
                manager.release(cached);
            }
        }
    }

    /**
     * Count the pieces of storage currently cached for the given size.
     */
    public int cachedCount(int size) {
        SizeClass sizeClass = pool.get(size);
        return sizeClass == null? 0 : sizeClass.queue.size();
    }

    /**
     * Release all cached storage to the underlying memory manager.
     * Storage released to this pool after it has been closed goes straight to the underlying manager.
     *
     * @throws ResourceDisposeFailedException if the underlying manager failed to release some of the storage.
     */
    @Override
    public void close() {
        if (CLOSE.compareAndSet(this, false, true)) {
            var capturedExceptions = new ArrayList<Exception>(4);
            pool.forEach((size, sizeClass) -> {
                ByteBuffer memory;
                int discarded = 0;
                while ((memory = sizeClass.queue.poll()) != null) {
                    try {
                        manager.release(memory);
                        discarded++;
                    } catch (Exception e) {
                        capturedExceptions.add(e);
                    }
                }
                if (discarded > 0) {
                    logger.debug("Released {} cached storage blocks of {} bytes.", discarded, size);
                }
            });
            if (!capturedExceptions.isEmpty()) {
                var exception = new ResourceDisposeFailedException();
                capturedExceptions.forEach(exception::addSuppressed);
                throw exception;
            }
        }
    }

    private SizeClass getSizeClass(int size) {
        return pool.computeIfAbsent(size, k -> new SizeClass());
    }

    @Override
    public String toString() {
        return "SizeClassedMemoryPool(" + manager + ')';
    }

    private static final class SizeClass {
        final ConcurrentLinkedQueue<ByteBuffer> queue = new ConcurrentLinkedQueue<>();
        final AtomicInteger count = new AtomicInteger();
    }
}
