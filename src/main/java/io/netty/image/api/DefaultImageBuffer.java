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

import io.netty.image.api.internal.RcSupport;
import io.netty.image.api.internal.Statics;
import io.netty.util.internal.logging.InternalLogger;
import io.netty.util.internal.logging.InternalLoggerFactory;

import java.io.IOException;
import java.nio.ByteBuffer;

import static io.netty.image.api.internal.Statics.bufferIsClosed;
import static io.netty.util.internal.ObjectUtil.checkNotNull;

class DefaultImageBuffer extends RcSupport<ImageBuffer, DefaultImageBuffer> implements ImageBuffer {
    private static final InternalLogger logger = InternalLoggerFactory.getInstance(DefaultImageBuffer.class);
    static final Drop<DefaultImageBuffer> RELEASE_OWNED = new Drop<DefaultImageBuffer>() {
        @Override
        public void drop(DefaultImageBuffer image) {
            image.releaseOwned();
        }

        @Override
        public String toString() {
            return "RELEASE_OWNED";
        }
    };

    private final AllocatorControl control;
    private int width;
    private int height;
    private int depth;
    private int stride;
    private ByteBuffer storage;
    private Palette palette;
    private int xResolution;
    private int yResolution;
    private InputFormat inputFormat;
    private String text;

    DefaultImageBuffer(AllocatorControl control, int width, int height, int depth, int stride) {
        this(control, width, height, depth, stride, RELEASE_OWNED);
    }

    private DefaultImageBuffer(AllocatorControl control, int width, int height, int depth, int stride,
                               Drop<DefaultImageBuffer> drop) {
        super(drop);
        this.control = control;
        this.width = width;
        this.height = height;
        this.depth = depth;
        this.stride = stride;
        inputFormat = InputFormat.UNKNOWN;
    }

    @Override
    public ImageAllocator allocator() {
        checkAccessible();
        return control.getAllocator();
    }

    @Override
    public int width() {
        checkAccessible();
        return width;
    }

    @Override
    public ImageBuffer width(int width) {
        checkAccessible();
        if (width < 0) {
            changeGeometry(0, height, depth);
            throw new InvalidValueException("Width must not be negative, but was " + width + '.');
        }
        changeGeometry(width, height, depth);
        return this;
    }

    @Override
    public int height() {
        checkAccessible();
        return height;
    }

    @Override
    public ImageBuffer height(int height) {
        checkAccessible();
        if (height < 0) {
            changeGeometry(width, 0, depth);
            throw new InvalidValueException("Height must not be negative, but was " + height + '.');
        }
        changeGeometry(width, height, depth);
        return this;
    }

    @Override
    public int depth() {
        checkAccessible();
        return depth;
    }

    @Override
    public ImageBuffer depth(int depth) {
        checkAccessible();
        if (!Statics.isLegalDepth(depth)) {
            throw new InvalidValueException("Depth must be one of {1, 2, 4, 8, 16, 24, 32}, but was " + depth + '.');
        }
        changeGeometry(width, height, depth);
        return this;
    }

    @Override
    public ImageDimensions dimensions() {
        checkAccessible();
        return new ImageDimensions(width, height, depth);
    }

    @Override
    public int stride() {
        checkAccessible();
        return stride;
    }

    @Override
    public ImageBuffer stride(int stride) {
        checkAccessible();
        if (stride < 0 || stride % 4 != 0) {
            throw new InvalidValueException("Stride must be a non-negative multiple of 4, but was " + stride + '.');
        }
        this.stride = stride;
        releaseMismatchedStorage();
        return this;
    }

    @Override
    public int wordsPerLine() {
        checkAccessible();
        return stride / 4;
    }

    @Override
    public ByteBuffer data() {
        checkAccessible();
        return storage;
    }

    @Override
    public ImageBuffer data(ByteBuffer storage) {
        checkAccessible();
        if (storage == this.storage) {
            return this;
        }
        if (storage != null && storage.capacity() != storageSize()) {
            throw new InvalidValueException("Storage must have a capacity of " + storageSize() + " bytes, but had " +
                                            storage.capacity() + '.');
        }
        ByteBuffer previous = this.storage;
        this.storage = storage;
        touch(storage == null? "storage released" : previous == null? "storage attached" : "storage replaced", null);
        if (previous != null) {
            control.releaseStorage(previous);
        }
        return this;
    }

    @Override
    public ImageBuffer changeHandleCount(int delta) {
        unsafeChangeHandles(delta);
        return this;
    }

    @Override
    public int xResolution() {
        checkAccessible();
        return xResolution;
    }

    @Override
    public ImageBuffer xResolution(int resolution) {
        checkAccessible();
        xResolution = checkResolution(resolution);
        return this;
    }

    @Override
    public int yResolution() {
        checkAccessible();
        return yResolution;
    }

    @Override
    public ImageBuffer yResolution(int resolution) {
        checkAccessible();
        yResolution = checkResolution(resolution);
        return this;
    }

    @Override
    public ImageBuffer copyResolution(ImageBuffer source) {
        checkAccessible();
        checkNotNull(source, "source");
        xResolution = source.xResolution();
        yResolution = source.yResolution();
        return this;
    }

    @Override
    public ImageBuffer scaleResolution(float xScale, float yScale) {
        checkAccessible();
        checkScale(xScale, "x");
        checkScale(yScale, "y");
        if (xResolution != 0 && yResolution != 0) {
            xResolution = scale(xResolution, xScale);
            yResolution = scale(yResolution, yScale);
        }
        return this;
    }

    @Override
    public InputFormat inputFormat() {
        checkAccessible();
        return inputFormat;
    }

    @Override
    public ImageBuffer inputFormat(InputFormat format) {
        checkAccessible();
        inputFormat = checkNotNull(format, "format");
        return this;
    }

    @Override
    public ImageBuffer copyInputFormat(ImageBuffer source) {
        checkAccessible();
        checkNotNull(source, "source");
        inputFormat = source.inputFormat();
        return this;
    }

    @Override
    public String text() {
        checkAccessible();
        return text;
    }

    @Override
    public ImageBuffer text(String text) {
        checkAccessible();
        this.text = text;
        return this;
    }

    @Override
    public ImageBuffer addText(String text) {
        checkAccessible();
        if (this.text == null) {
            this.text = text;
        } else if (text != null) {
            this.text += text;
        }
        return this;
    }

    @Override
    public ImageBuffer copyText(ImageBuffer source) {
        checkAccessible();
        checkNotNull(source, "source");
        text = source.text();
        return this;
    }

    @Override
    public Palette palette() {
        checkAccessible();
        return palette;
    }

    @Override
    public ImageBuffer palette(Palette palette) {
        checkAccessible();
        if (palette == this.palette) {
            return this;
        }
        if (palette != null) {
            palette.claim(this);
        }
        Palette previous = this.palette;
        this.palette = palette;
        touch("palette replaced by", palette);
        if (previous != null) {
            previous.disposeOwned();
        }
        return this;
    }

    @Override
    public ImageBuffer copyPalette(ImageBuffer source) {
        checkAccessible();
        checkNotNull(source, "source");
        if (source == this) {
            return this;
        }
        Palette sourcePalette = source.palette();
        return palette(sourcePalette == null? null : sourcePalette.copy());
    }

    @Override
    public ImageBuffer destroyPalette() {
        return palette(null);
    }

    @Override
    public boolean sizeEquals(ImageBuffer other) {
        checkAccessible();
        checkNotNull(other, "other");
        if (other == this) {
            return true;
        }
        return width == other.width() && height == other.height() && depth == other.depth();
    }

    @Override
    public ImageBuffer copy() {
        checkAccessible();
        ByteBuffer source = checkHasStorage();
        ImageBuffer copy = control.getAllocator().createTemplateUninitialized(this);
        try {
            if (copy.stride() != stride) {
                copy.resizeImageData(this);
            }
            Statics.copyStorage(source, copy.data(), (int) storageSize());
        } catch (RuntimeException e) {
            copy.close();
            throw e;
        }
        return copy;
    }

    @Override
    public ImageBuffer copyInto(ImageBuffer destination) {
        checkAccessible();
        checkNotNull(destination, "destination");
        if (destination == this) {
            return this;
        }
        ByteBuffer source = checkHasStorage();
        touch("copied into", destination);
        destination.resizeImageData(this)
                   .copyPalette(this)
                   .copyResolution(this)
                   .copyInputFormat(this)
                   .copyText(this);
        Statics.copyStorage(source, destination.data(), (int) storageSize());
        return destination;
    }

    @Override
    public ImageBuffer resizeImageData(ImageBuffer source) {
        checkAccessible();
        checkNotNull(source, "source");
        int newStride = source.stride();
        if (sizeEquals(source) && stride == newStride && storage != null) {
            return this;
        }
        int newWidth = source.width();
        int newHeight = source.height();
        int newDepth = source.depth();
        long newSize = (long) newStride * newHeight;
        if (newSize > Statics.MAX_STORAGE_SIZE) {
            throw new InvalidValueException("Image storage cannot be greater than " + Statics.MAX_STORAGE_SIZE +
                                            " bytes, but " + source + " would need " + newSize + '.');
        }
        ByteBuffer newStorage = control.allocateStorage((int) newSize);
        ByteBuffer previous = storage;
        width = newWidth;
        height = newHeight;
        depth = newDepth;
        stride = newStride;
        storage = newStorage;
        touch("resized to", dimensions());
        if (previous != null) {
            control.releaseStorage(previous);
        }
        if (logger.isDebugEnabled()) {
            logger.debug("Resized {} to {}x{}x{}.", this, newWidth, newHeight, newDepth);
        }
        return this;
    }

    @Override
    public void describe(Appendable out, String label) throws IOException {
        checkNotNull(out, "out");
        checkNotNull(label, "label");
        checkAccessible();
        out.append("  Image Info for ").append(label).append(":\n");
        out.append("    width = ").append(String.valueOf(width))
           .append(", height = ").append(String.valueOf(height))
           .append(", depth = ").append(String.valueOf(depth)).append('\n');
        out.append("    stride = ").append(String.valueOf(stride))
           .append(", data = ").append(describeStorage())
           .append(", handles = ").append(String.valueOf(countHandles())).append('\n');
        if (palette != null) {
            palette.writeTo(out);
        } else {
            out.append("    no palette\n");
        }
    }

    @Override
    protected Owned<DefaultImageBuffer> prepareSend() {
        var control = this.control;
        var width = this.width;
        var height = this.height;
        var depth = this.depth;
        var stride = this.stride;
        var storage = this.storage;
        var palette = this.palette;
        var xResolution = this.xResolution;
        var yResolution = this.yResolution;
        var inputFormat = this.inputFormat;
        var text = this.text;
        return new Owned<DefaultImageBuffer>() {
            @Override
            public DefaultImageBuffer transferOwnership(Drop<DefaultImageBuffer> drop) {
                DefaultImageBuffer copy = new DefaultImageBuffer(control, width, height, depth, stride, drop);
                copy.storage = storage;
                copy.palette = palette;
                if (palette != null) {
                    palette.transferOwnership(copy);
                }
                copy.xResolution = xResolution;
                copy.yResolution = yResolution;
                copy.inputFormat = inputFormat;
                copy.text = text;
                return copy;
            }
        };
    }

    @Override
    public String toString() {
        return "ImageBuffer[" + width + 'x' + height + 'x' + depth + ", stride: " + stride +
               ", handles: " + countHandles() + ']';
    }

    private void releaseOwned() {
        ByteBuffer previous = storage;
        storage = null;
        text = null;
        if (palette != null) {
            Palette previousPalette = palette;
            palette = null;
            previousPalette.disposeOwned();
        }
        if (previous != null) {
            control.releaseStorage(previous);
        }
    }

    private void changeGeometry(int width, int height, int depth) {
        long newStride = Statics.computeStride(width, depth);
        if (newStride > Statics.MAX_STORAGE_SIZE) {
            throw new InvalidValueException("Stride cannot be greater than " + Statics.MAX_STORAGE_SIZE +
                                            " bytes, but " + width + " pixels at depth " + depth +
                                            " would need " + newStride + '.');
        }
        this.width = width;
        this.height = height;
        this.depth = depth;
        stride = (int) newStride;
        releaseMismatchedStorage();
    }

    private void releaseMismatchedStorage() {
        if (storage != null && storage.capacity() != storageSize()) {
            ByteBuffer previous = storage;
            storage = null;
            touch("storage released after geometry change to", dimensions());
            control.releaseStorage(previous);
            if (logger.isDebugEnabled()) {
                logger.debug("Released the storage of {}; it no longer matches the geometry.", this);
            }
        }
    }

    private long storageSize() {
        return (long) stride * height;
    }

    private ByteBuffer checkHasStorage() {
        if (storage == null) {
            throw new IllegalStateException("This image buffer has no pixel storage: " + this + '.');
        }
        return storage;
    }

    private String describeStorage() {
        if (storage == null) {
            return "null";
        }
        return (storage.isDirect()? "direct@" : "heap@") + Integer.toHexString(System.identityHashCode(storage));
    }

    private void checkAccessible() {
        if (!isAccessible()) {
            throw attachTrace(bufferIsClosed());
        }
    }

    private static int checkResolution(int resolution) {
        if (resolution < 0) {
            throw new InvalidValueException("Resolution must not be negative, but was " + resolution + '.');
        }
        return resolution;
    }

    private static void checkScale(float scale, String axis) {
        if (!(scale >= 0) || Float.isInfinite(scale)) {
            throw new InvalidValueException("The " + axis + " scale must be finite and non-negative, but was " +
                                            scale + '.');
        }
    }

    private static int scale(int resolution, float scale) {
        return (int) Math.min(scale * resolution + 0.5, Integer.MAX_VALUE);
    }
}
