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
package io.netty.image.api;

import io.netty.image.api.pool.SizeClassedMemoryPool;
import io.netty.util.internal.PlatformDependent;

import java.nio.ByteBuffer;

/**
 * The source of pixel storage for image buffers.
 * <p>
 * A memory manager supplies the default allocate and release functions of an {@link ImageAllocator}. Either function
 * can later be replaced through {@link ImageAllocator#configureAllocator(java.util.function.IntFunction,
 * java.util.function.Consumer)}.
 * <p>
 * Memory managers only ever deal with pixel storage. The image buffer objects themselves are ordinary Java objects.
 */
public interface MemoryManager {
    /**
     * A memory manager that hands out storage backed by {@code byte[]} arrays.
     */
    static MemoryManager heap() {
        return new HeapMemoryManager();
    }

    /**
     * A memory manager that hands out direct (native) storage, and frees it eagerly when released.
     */
    static MemoryManager direct() {
        return new DirectMemoryManager();
    }

    /**
     * A memory manager that keeps released storage around, and reuses it for later allocations of the same size.
     *
     * @param manager The memory manager that allocates the storage when the pool has none cached.
     */
    static MemoryManager pooled(MemoryManager manager) {
        return new SizeClassedMemoryPool(manager);
    }

    /**
     * Check if this memory manager allocates storage outside of the Java heap.
     */
    boolean isNative();

    /**
     * Allocate storage of exactly the given number of bytes.
     * The contents of the returned storage are unspecified.
     *
     * @param size The number of bytes to allocate.
     * @return The new storage, or {@code null} if the request cannot be satisfied.
     */
    ByteBuffer allocate(int size);

    /**
     * Release storage previously obtained from {@link #allocate(int)}.
     * The storage must not be accessed after this call.
     *
     * @param memory The storage to release.
     */
    void release(ByteBuffer memory);

    class HeapMemoryManager implements MemoryManager {
        @Override
        public boolean isNative() {
            return false;
        }

        @Override
        public ByteBuffer allocate(int size) {
            return ByteBuffer.wrap(new byte[size]);
        }

        @Override
        public void release(ByteBuffer memory) {
            // Heap storage is reclaimed by the garbage collector.
        }

        @Override
        public String toString() {
            return "HeapMemoryManager";
        }
    }

    /**
     * Allocates direct storage, and frees it as soon as it is released, without waiting for the garbage collector.
     * Every {@link ByteBuffer} view of released storage is left dangling and must not be accessed.
     */
    class DirectMemoryManager implements MemoryManager {
        @Override
        public boolean isNative() {
            return true;
        }

        @Override
        public ByteBuffer allocate(int size) {
            return ByteBuffer.allocateDirect(size);
        }

        @Override
        public void release(ByteBuffer memory) {
            if (memory.isDirect()) {
                PlatformDependent.freeDirectBuffer(memory);
            }
        }

        @Override
        public String toString() {
            return "DirectMemoryManager";
        }
    }
}
