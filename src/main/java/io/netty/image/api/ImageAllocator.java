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

import io.netty.image.api.internal.Statics;

import java.nio.ByteBuffer;
import java.util.function.Consumer;
import java.util.function.IntFunction;

/**
 * Interface for {@link ImageBuffer} allocators.
 * <p>
 * An allocator holds a pair of functions, one that allocates pixel storage and one that releases it. All pixel storage
 * of the image buffers created by an allocator goes through these functions, including the storage allocated when an
 * image buffer is later resized. The functions start out as those of the allocator's {@link MemoryManager}, and can be
 * replaced with {@link #configureAllocator(IntFunction, Consumer)}.
 */
public interface ImageAllocator extends AutoCloseable {
    /**
     * Check that the given geometry is valid for a new image buffer, or throw an {@link InvalidGeometryException}.
     *
     * @param width The width in pixels; must be positive.
     * @param height The height in pixels; must be positive.
     * @param depth The bits per pixel; must be one of 1, 2, 4, 8, 16, 24 or 32.
     * @throws InvalidGeometryException if the geometry is invalid, or if the storage would be too big (over ~2 GB).
     */
    static void checkGeometry(int width, int height, int depth) {
        if (!Statics.isLegalDepth(depth)) {
            throw new InvalidGeometryException("Depth must be one of {1, 2, 4, 8, 16, 24, 32}, but was " + depth + '.');
        }
        if (width <= 0) {
            throw new InvalidGeometryException("Width must be positive, but was " + width + '.');
        }
        if (height <= 0) {
            throw new InvalidGeometryException("Height must be positive, but was " + height + '.');
        }
        long size = Statics.computeStride(width, depth) * height;
        if (size > Statics.MAX_STORAGE_SIZE) {
            throw new InvalidGeometryException("Image storage cannot be greater than " + Statics.MAX_STORAGE_SIZE +
                                               " bytes, but " + width + 'x' + height + 'x' + depth +
                                               " would need " + size + '.');
        }
    }

    /**
     * Create a header-only image buffer; one with geometry but no pixel storage.
     *
     * @return The new image buffer, with a handle count of one and an {@link InputFormat#UNKNOWN} input format.
     * @throws InvalidGeometryException if the geometry is invalid.
     */
    ImageBuffer createHeader(int width, int height, int depth);

    /**
     * Create an image buffer with pixel storage whose contents are unspecified.
     * This includes the padding bits at the end of each row. Use {@link #create(int, int, int)} when the contents
     * must be known.
     *
     * @return The new image buffer.
     * @throws InvalidGeometryException if the geometry is invalid.
     * @throws AllocationFailedException if the storage cannot be allocated. Nothing is left allocated in that case.
     */
    ImageBuffer createUninitialized(int width, int height, int depth);

    /**
     * Create an image buffer with pixel storage that is filled with zeros.
     *
     * @return The new image buffer.
     * @throws InvalidGeometryException if the geometry is invalid.
     * @throws AllocationFailedException if the storage cannot be allocated. Nothing is left allocated in that case.
     */
    ImageBuffer create(int width, int height, int depth);

    /**
     * Create a zero-filled image buffer with the geometry of the given one, and copies of its palette, resolution,
     * text and input format. The pixels are not copied.
     *
     * @throws NullPointerException if the source is {@code null}.
     */
    ImageBuffer createTemplate(ImageBuffer source);

    /**
     * Like {@link #createTemplate(ImageBuffer)}, but the contents of the storage are unspecified.
     *
     * @throws NullPointerException if the source is {@code null}.
     */
    ImageBuffer createTemplateUninitialized(ImageBuffer source);

    /**
     * Replace the functions used to allocate and release pixel storage.
     * <p>
     * Either argument can be {@code null}, in which case the corresponding function is left unchanged.
     * <p>
     * This method is meant to be called once, before any image buffers are created. The two functions are not
     * replaced atomically with respect to concurrent allocation or release.
     *
     * @param allocate The function that allocates storage of exactly the given size, or returns {@code null} if it
     *                 cannot.
     * @param release The function that releases storage obtained from the allocate function.
     * @return This allocator.
     */
    ImageAllocator configureAllocator(IntFunction<ByteBuffer> allocate, Consumer<ByteBuffer> release);

    /**
     * Close this allocator, freeing all of its internal resources. It is not specified if the allocator can still be
     * used after this method has been called on it.
     */
    @Override
    default void close() {
    }

    /**
     * The process-wide allocator, backed by heap memory. Closing it has no effect.
     */
    static ImageAllocator global() {
        return ManagedImageAllocator.GLOBAL;
    }

    static ImageAllocator heap() {
        return withMemoryManager(MemoryManager.heap());
    }

    static ImageAllocator direct() {
        return withMemoryManager(MemoryManager.direct());
    }

    static ImageAllocator pooledHeap() {
        return withMemoryManager(MemoryManager.pooled(MemoryManager.heap()));
    }

    static ImageAllocator pooledDirect() {
        return withMemoryManager(MemoryManager.pooled(MemoryManager.direct()));
    }

    /**
     * Create an allocator whose allocate and release functions are those of the given memory manager.
     * Closing the allocator closes the memory manager, if it is {@link AutoCloseable}.
     */
    static ImageAllocator withMemoryManager(MemoryManager manager) {
        return new ManagedImageAllocator(manager, true);
    }
}
