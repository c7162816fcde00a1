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

import java.io.IOException;
import java.nio.ByteBuffer;

import static io.netty.util.internal.ObjectUtil.checkNotNull;

/**
 * A reference counted raster image: geometry, pixel storage, and side metadata.
 *
 * <h3>Creating an image buffer</h3>
 *
 * Image buffers are created by an {@link ImageAllocator}, which also supplies the functions that allocate and release
 * the pixel storage:
 * <pre>{@code
 *     try (ImageBuffer image = ImageAllocator.heap().create(100, 50, 1)) {
 *         // ...
 *     }
 * }</pre>
 *
 * <h3>Geometry and storage</h3>
 *
 * An image has a width and a height in pixels, and a bit depth that is one of 1, 2, 4, 8, 16, 24 or 32.
 * Pixels are packed into rows of {@linkplain #stride() stride} bytes, where each row is padded to a whole number of
 * 32-bit words: {@code stride = ceil(width * depth / 32) * 4}.
 * The {@linkplain #data() storage} is a {@link ByteBuffer} of exactly {@code stride * height} bytes, or absent, in
 * which case the image buffer is said to be <em>header-only</em>.
 * Any change to the geometry that leaves the storage with the wrong size releases the storage, so a present storage
 * always has the right size.
 * <p>
 * This class does not interpret pixel content. Algorithms read and write the storage directly, using the stride to
 * find the start of each row. The position and limit of the storage are not used by the image buffer itself.
 *
 * <h3>Handles and life cycle</h3>
 *
 * Image buffers are shared by handle, not by copying. A new image buffer has one handle. {@link #acquire()} creates
 * another handle to the same object, which is the cheap way to share an image. {@link #close()} gives a handle back.
 * When the last handle is closed, the storage is released through the allocator, the palette is disposed, and the
 * image buffer becomes inaccessible: every method except {@link #isAccessible()}, {@link #countHandles()} and
 * {@link #toString()} then throws {@link IllegalStateException}.
 * <p>
 * All mutations are visible through every handle. This includes the in-place resize performed by
 * {@link #copyInto(ImageBuffer)}.
 * <p>
 * {@link ImageRef} is a mutable slot holding a handle, and is the recommended way to keep a handle in a field.
 *
 * <h3>Thread-safety</h3>
 *
 * Image buffers are not thread-safe. The handle count, the geometry, the storage and the metadata are updated with
 * plain reads and writes. Sharing an image buffer across threads requires external synchronization, or transferring
 * it with {@link #send()}.
 */
public interface ImageBuffer extends Rc<ImageBuffer> {
    /**
     * Check if the two image buffers have the same width, height and depth.
     * An image buffer is always size-equal to itself.
     *
     * @throws NullPointerException if either image buffer is {@code null}.
     */
    static boolean sizesEqual(ImageBuffer a, ImageBuffer b) {
        checkNotNull(a, "a");
        checkNotNull(b, "b");
        return a.sizeEquals(b);
    }

    /**
     * The allocator that created this image buffer. Storage for this image buffer is allocated and released through
     * it.
     */
    ImageAllocator allocator();

    /**
     * The width in pixels.
     */
    int width();

    /**
     * Set the width in pixels, and recompute the stride.
     * The storage is released if it no longer has the right size.
     *
     * @param width The new width.
     * @return This image buffer.
     * @throws InvalidValueException if the width is negative, in which case the width is set to zero first.
     */
    ImageBuffer width(int width);

    /**
     * The height in pixels.
     */
    int height();

    /**
     * Set the height in pixels.
     * The storage is released if it no longer has the right size.
     *
     * @param height The new height.
     * @return This image buffer.
     * @throws InvalidValueException if the height is negative, in which case the height is set to zero first.
     */
    ImageBuffer height(int height);

    /**
     * The number of bits per pixel.
     */
    int depth();

    /**
     * Set the number of bits per pixel, and recompute the stride.
     * The storage is released if it no longer has the right size.
     *
     * @param depth The new depth; one of 1, 2, 4, 8, 16, 24 or 32.
     * @return This image buffer.
     * @throws InvalidValueException if the depth is not legal. The depth is not changed.
     */
    ImageBuffer depth(int depth);

    /**
     * The width, height and depth of this image buffer.
     */
    ImageDimensions dimensions();

    /**
     * The number of bytes in each row of pixels.
     */
    int stride();

    /**
     * Override the number of bytes in each row of pixels.
     * <p>
     * This is a low-level operation for callers that manage the storage themselves. The storage is released if it no
     * longer has the right size; install new storage with {@link #data(ByteBuffer)}.
     *
     * @param stride The new stride, a non-negative multiple of four.
     * @return This image buffer.
     * @throws InvalidValueException if the stride is negative or not a multiple of four.
     */
    ImageBuffer stride(int stride);

    /**
     * The number of 32-bit words in each row of pixels.
     */
    int wordsPerLine();

    /**
     * The pixel storage, or {@code null} if this image buffer is header-only.
     * <p>
     * The returned buffer is the storage itself, not a copy. It belongs to this image buffer, and must not be used
     * after the last handle is closed, or after the storage is replaced or released by a geometry change or a resize.
     * <p>
     * <strong>Note:</strong> storage from a {@linkplain MemoryManager#direct() direct} memory manager is freed as soon
     * as it is released. Reading or writing a direct buffer obtained from this method after that point accesses freed
     * native memory, which can corrupt data or crash the JVM. Pooled storage is not freed but handed to the next image
     * of the same size. Acquire a handle for as long as the storage is needed.
     *
     * @return The storage, or {@code null} if this image buffer is header-only.
     */
    ByteBuffer data();

    /**
     * Install new pixel storage. The previous storage, if any and if different, is released through the allocator.
     * <p>
     * The image buffer takes ownership of the given storage, and will release it through the allocator's release
     * function.
     *
     * @param storage Storage of exactly {@code stride * height} bytes, or {@code null} to make this image buffer
     *                header-only.
     * @return This image buffer.
     * @throws InvalidValueException if the storage has the wrong capacity.
     */
    ImageBuffer data(ByteBuffer storage);

    /**
     * Add the given delta to the handle count, without creating or closing any handles.
     * This is a low-level operation; use {@link #acquire()} and {@link #close()} to share and release image buffers.
     *
     * @param delta The amount to add.
     * @return This image buffer.
     * @throws InvalidValueException if the handle count would drop below one.
     */
    ImageBuffer changeHandleCount(int delta);

    /**
     * The horizontal resolution, in pixels per inch, or zero if unknown.
     */
    int xResolution();

    /**
     * Set the horizontal resolution.
     *
     * @throws InvalidValueException if the resolution is negative.
     */
    ImageBuffer xResolution(int resolution);

    /**
     * The vertical resolution, in pixels per inch, or zero if unknown.
     */
    int yResolution();

    /**
     * Set the vertical resolution.
     *
     * @throws InvalidValueException if the resolution is negative.
     */
    ImageBuffer yResolution(int resolution);

    /**
     * Copy both resolutions from the given image buffer.
     */
    ImageBuffer copyResolution(ImageBuffer source);

    /**
     * Multiply both resolutions by the given factors, rounding to the nearest integer.
     * Nothing happens if either resolution is zero.
     *
     * @throws InvalidValueException if a factor is negative or not finite.
     */
    ImageBuffer scaleResolution(float xScale, float yScale);

    /**
     * The format this image was decoded from.
     */
    InputFormat inputFormat();

    ImageBuffer inputFormat(InputFormat format);

    ImageBuffer copyInputFormat(ImageBuffer source);

    /**
     * The text annotation, or {@code null} if there is none.
     */
    String text();

    /**
     * Replace the text annotation.
     *
     * @param text The new text, or {@code null} to remove it.
     */
    ImageBuffer text(String text);

    /**
     * Append to the text annotation. Either the existing or the added text can be {@code null}.
     */
    ImageBuffer addText(String text);

    ImageBuffer copyText(ImageBuffer source);

    /**
     * The palette, or {@code null} if this image has none.
     * The palette remains owned by this image buffer.
     */
    Palette palette();

    /**
     * Install a palette, taking ownership of it. The previous palette, if any and if different, is disposed.
     *
     * @param palette The new palette, or {@code null} to remove the palette.
     * @return This image buffer.
     * @throws InvalidValueException if the palette is already owned by another image buffer.
     */
    ImageBuffer palette(Palette palette);

    /**
     * Install a copy of the palette of the given image buffer, or remove the palette if the source has none.
     */
    ImageBuffer copyPalette(ImageBuffer source);

    /**
     * Dispose of the palette, if there is one.
     */
    ImageBuffer destroyPalette();

    /**
     * Check if the given image buffer has the same width, height and depth as this one.
     *
     * @throws NullPointerException if the other image buffer is {@code null}.
     */
    boolean sizeEquals(ImageBuffer other);

    /**
     * Create a new, independent image buffer with the same geometry, metadata and pixels as this one.
     * The copy is created by the allocator of this image buffer, and has a handle count of one.
     *
     * @return The new image buffer.
     * @throws IllegalStateException if this image buffer is header-only.
     * @throws AllocationFailedException if storage for the copy cannot be allocated.
     */
    ImageBuffer copy();

    /**
     * Make the given image buffer a copy of this one, and return it.
     * <p>
     * If the destination is this image buffer, nothing happens.
     * Otherwise the destination is first {@linkplain #resizeImageData(ImageBuffer) resized} to the geometry of this
     * image buffer, then the palette, resolution, input format, text and pixels are copied over.
     * <p>
     * <strong>Note:</strong> the destination is mutated in place. Every handle to the destination observes the new
     * geometry and contents. The handle count of the destination does not change.
     *
     * @param destination The image buffer to copy into.
     * @return The destination.
     * @throws NullPointerException if the destination is {@code null}.
     * @throws IllegalStateException if this image buffer is header-only.
     * @throws AllocationFailedException if the destination needs new storage and it cannot be allocated, in which case
     * the destination is not changed.
     */
    ImageBuffer copyInto(ImageBuffer destination);

    /**
     * Give this image buffer the geometry of the given one, with new, uninitialized storage of the matching size.
     * Nothing happens if the two are already size-equal with the same stride, and this image buffer has storage.
     * <p>
     * The new storage is allocated before the old storage is released, so if the allocation fails this image buffer
     * is left unchanged.
     *
     * @return This image buffer.
     * @throws AllocationFailedException if the new storage cannot be allocated.
     */
    ImageBuffer resizeImageData(ImageBuffer source);

    /**
     * Write a human-readable description of this image buffer to the given output.
     *
     * @param out The output to write to.
     * @param label A label identifying the image buffer in the output.
     * @throws IOException if writing to the output fails.
     */
    void describe(Appendable out, String label) throws IOException;
}
