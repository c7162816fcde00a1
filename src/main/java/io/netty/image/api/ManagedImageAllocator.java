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
import io.netty.util.internal.logging.InternalLogger;
import io.netty.util.internal.logging.InternalLoggerFactory;

import java.nio.ByteBuffer;
import java.util.function.Consumer;
import java.util.function.IntFunction;

import static io.netty.util.internal.ObjectUtil.checkNotNull;

class ManagedImageAllocator implements ImageAllocator, AllocatorControl {
    private static final InternalLogger logger = InternalLoggerFactory.getInstance(ManagedImageAllocator.class);
    static final ManagedImageAllocator GLOBAL = new ManagedImageAllocator(MemoryManager.heap(), false);

    private final MemoryManager manager;
    private final boolean closeable;
    private volatile IntFunction<ByteBuffer> allocateFunction;
    private volatile Consumer<ByteBuffer> releaseFunction;

    ManagedImageAllocator(MemoryManager manager, boolean closeable) {
        this.manager = checkNotNull(manager, "manager");
        this.closeable = closeable;
        allocateFunction = manager::allocate;
        releaseFunction = manager::release;
    }

    @Override
    public ImageBuffer createHeader(int width, int height, int depth) {
        ImageAllocator.checkGeometry(width, height, depth);
        int stride = (int) Statics.computeStride(width, depth);
        return new DefaultImageBuffer(this, width, height, depth, stride);
    }

    @Override
    public ImageBuffer createUninitialized(int width, int height, int depth) {
        ImageBuffer image = createHeader(width, height, depth);
        ByteBuffer storage;
        try {
            storage = allocateStorage(image.stride() * height);
        } catch (AllocationFailedException e) {
            image.close();
            throw e;
        }
        return image.data(storage);
    }

    @Override
    public ImageBuffer create(int width, int height, int depth) {
        ImageBuffer image = createUninitialized(width, height, depth);
        Statics.zero(image.data());
        return image;
    }

    @Override
    public ImageBuffer createTemplate(ImageBuffer source) {
        ImageBuffer image = createTemplateUninitialized(source);
        Statics.zero(image.data());
        return image;
    }

    @Override
    public ImageBuffer createTemplateUninitialized(ImageBuffer source) {
        checkNotNull(source, "source");
        ImageBuffer image = createUninitialized(source.width(), source.height(), source.depth());
        return image.copyResolution(source)
                    .copyPalette(source)
                    .copyText(source)
                    .copyInputFormat(source);
    }

    @Override
    public ImageAllocator configureAllocator(IntFunction<ByteBuffer> allocate, Consumer<ByteBuffer> release) {
        if (allocate != null) {
            allocateFunction = allocate;
        }
        if (release != null) {
            releaseFunction = release;
        }
        if (logger.isDebugEnabled()) {
            logger.debug("{} reconfigured; allocate function replaced: {}, release function replaced: {}",
                         this, allocate != null, release != null);
        }
        return this;
    }

    @Override
    public ImageAllocator getAllocator() {
        return this;
    }

    @Override
    public ByteBuffer allocateStorage(int size) {
        ByteBuffer storage;
        try {
            storage = allocateFunction.apply(size);
        } catch (OutOfMemoryError | RuntimeException e) {
            throw new AllocationFailedException("Failed to allocate " + size + " bytes of pixel storage.", e);
        }
        if (storage == null) {
            throw new AllocationFailedException("Failed to allocate " + size + " bytes of pixel storage.");
        }
        if (storage.capacity() != size) {
            releaseFunction.accept(storage);
            throw new AllocationFailedException(
                    "Allocate function returned " + storage.capacity() + " bytes, but " + size + " were requested.");
        }
        return storage;
    }

    @Override
    public void releaseStorage(ByteBuffer storage) {
        releaseFunction.accept(storage);
    }

    @Override
    public void close() {
        if (closeable && manager instanceof AutoCloseable) {
            try {
                ((AutoCloseable) manager).close();
            } catch (RuntimeException e) {
                throw e;
            } catch (Exception e) {
                throw new IllegalStateException("Failed to close " + manager + '.', e);
            }
        }
    }

    @Override
    public String toString() {
        return "ManagedImageAllocator(" + manager + ')';
    }
}
