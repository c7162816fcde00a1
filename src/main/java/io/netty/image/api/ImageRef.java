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

import io.netty.util.internal.logging.InternalLogger;
import io.netty.util.internal.logging.InternalLoggerFactory;

import java.lang.invoke.VarHandle;

import static io.netty.image.api.internal.Statics.findVarHandle;
import static java.lang.invoke.MethodHandles.lookup;

/**
 * A mutable slot holding a single handle to an {@linkplain ImageBuffer image buffer}, or nothing.
 * <p>
 * Destroying the slot closes the handle it holds, and always leaves the slot empty, so that a stale handle cannot be
 * closed twice through the same slot.
 * <p>
 * The slot is read and written with volatile semantics, but the image buffer it holds is still thread-confined.
 */
public final class ImageRef implements AutoCloseable {
    private static final InternalLogger logger = InternalLoggerFactory.getInstance(ImageRef.class);
    private static final VarHandle IMAGE = findVarHandle(lookup(), ImageRef.class, "image", ImageBuffer.class);
    @SuppressWarnings("unused")
    private volatile ImageBuffer image; // Accessed via VarHandle

    /**
     * Create an empty slot.
     */
    public ImageRef() {
    }

    /**
     * Create a slot that takes over the given handle. The handle count is not changed; the slot now owns the
     * caller's handle.
     *
     * @param image The handle to take over, or {@code null} for an empty slot.
     */
    public ImageRef(ImageBuffer image) {
        IMAGE.setVolatile(this, image);
    }

    /**
     * Create a slot holding a new handle to the given image buffer.
     * This increments the handle count of the buffer.
     *
     * @param image The buffer to reference.
     * @return A new slot holding a new handle.
     */
    public static ImageRef cloneOf(ImageBuffer image) {
        if (image == null) {
            throw new NullPointerException("image");
        }
        return new ImageRef(image.acquire());
    }

    /**
     * Close the handle held in the given slot, and empty the slot.
     * A {@code null} slot is logged and ignored.
     */
    public static void destroy(ImageRef slot) {
        if (slot == null) {
            logger.warn("Cannot destroy an image buffer through a null slot.");
            return;
        }
        slot.destroy();
    }

    /**
     * Access the image buffer in this slot.
     *
     * @return The buffer held by the slot, or {@code null} if the slot is empty.
     */
    public ImageBuffer get() {
        return (ImageBuffer) IMAGE.getVolatile(this);
    }

    public boolean isEmpty() {
        return get() == null;
    }

    /**
     * Put the given handle in this slot, and close the handle previously held, if any.
     * The slot takes over the given handle without changing its handle count.
     * <p>
     * The previous handle is closed even when it refers to the same image buffer as the replacement, so the slot
     * always accounts for exactly one handle. To put the image already held back into the slot, pass a newly
     * {@linkplain ImageBuffer#acquire() acquired} handle.
     *
     * @param replacement The new handle, or {@code null} to just empty the slot.
     */
    public void replace(ImageBuffer replacement) {
        var previous = (ImageBuffer) IMAGE.getAndSet(this, replacement);
        if (previous != null) {
            previous.close();
        }
    }

    /**
     * Remove the handle from this slot without closing it. The caller becomes responsible for closing it.
     *
     * @return The handle that was held, or {@code null} if the slot was empty.
     */
    public ImageBuffer take() {
        return (ImageBuffer) IMAGE.getAndSet(this, null);
    }

    /**
     * Close the handle held in this slot, and empty the slot.
     * The slot is emptied even if closing the handle throws.
     * Destroying an empty slot is logged and otherwise has no effect.
     */
    public void destroy() {
        var previous = take();
        if (previous == null) {
            logger.warn("Cannot destroy an empty image buffer slot.");
            return;
        }
        previous.close();
    }

    /**
     * Close the handle held in this slot, if any. Unlike {@link #destroy()}, an empty slot is not logged.
     */
    @Override
    public void close() {
        var previous = take();
        if (previous != null) {
            previous.close();
        }
    }

    @Override
    public String toString() {
        return "ImageRef[" + get() + ']';
    }
}
