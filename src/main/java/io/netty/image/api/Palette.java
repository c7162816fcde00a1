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
import java.util.Arrays;
import java.util.Objects;

/**
 * An indexed colour table, mapping pixel values to RGB colours.
 * <p>
 * A palette holds at most {@code 2^depth} entries, for a palette depth of 1, 2, 4 or 8 bits.
 * <p>
 * Once {@linkplain ImageBuffer#palette(Palette) installed} in an image buffer, the palette is owned by that buffer:
 * it cannot be installed in a second buffer, and it cannot be {@linkplain #dispose() disposed} directly. The buffer
 * disposes of it when the palette is replaced, destroyed, or when the buffer itself is dropped. Use {@link #copy()} to
 * give another buffer the same colours.
 * <p>
 * Like image buffers, palettes are not thread-safe.
 */
public final class Palette {
    private final int depth;
    private int[] entries;
    private int size;
    private Object owner;

    /**
     * Create an empty palette.
     *
     * @param depth The palette depth in bits; one of 1, 2, 4 or 8.
     * @throws InvalidValueException if the depth is not a legal palette depth.
     */
    public Palette(int depth) {
        if (depth != 1 && depth != 2 && depth != 4 && depth != 8) {
            throw new InvalidValueException("Palette depth must be one of {1, 2, 4, 8}, but was " + depth + '.');
        }
        this.depth = depth;
        entries = new int[1 << depth];
    }

    private Palette(Palette source) {
        depth = source.depth;
        entries = source.entries.clone();
        size = source.size;
    }

    public int depth() {
        checkAccessible();
        return depth;
    }

    /**
     * The number of colours this palette can hold.
     */
    public int maxEntries() {
        checkAccessible();
        return entries.length;
    }

    /**
     * The number of colours currently in this palette.
     */
    public int size() {
        checkAccessible();
        return size;
    }

    /**
     * Add a colour to the end of this palette.
     *
     * @return This palette.
     * @throws InvalidValueException if a component is outside {@code [0, 255]}, or if the palette is full.
     */
    public Palette addColor(int red, int green, int blue) {
        checkAccessible();
        int rgb = pack(red, green, blue);
        if (size == entries.length) {
            throw new InvalidValueException("Palette is full; it holds " + size + " colors at depth " + depth + '.');
        }
        entries[size++] = rgb;
        return this;
    }

    /**
     * Replace the colour at the given index.
     *
     * @return This palette.
     * @throws IndexOutOfBoundsException if the index is not in {@code [0, size)}.
     * @throws InvalidValueException if a component is outside {@code [0, 255]}.
     */
    public Palette setColor(int index, int red, int green, int blue) {
        checkAccessible();
        Objects.checkIndex(index, size);
        entries[index] = pack(red, green, blue);
        return this;
    }

    /**
     * The colour at the given index, as {@code 0x00RRGGBB}.
     */
    public int rgb(int index) {
        checkAccessible();
        return entries[Objects.checkIndex(index, size)];
    }

    public int red(int index) {
        return rgb(index) >>> 16 & 0xFF;
    }

    public int green(int index) {
        return rgb(index) >>> 8 & 0xFF;
    }

    public int blue(int index) {
        return rgb(index) & 0xFF;
    }

    /**
     * Create an unowned palette with the same depth and colours as this one.
     */
    public Palette copy() {
        checkAccessible();
        return new Palette(this);
    }

    /**
     * Check if this palette is installed in an image buffer.
     */
    public boolean isOwned() {
        return owner != null;
    }

    /**
     * Check if this palette has been disposed.
     */
    public boolean isDisposed() {
        return entries == null;
    }

    /**
     * Dispose of this palette. Disposed palettes cannot be accessed.
     *
     * @throws IllegalStateException if this palette is owned by an image buffer; use
     * {@link ImageBuffer#destroyPalette()} instead.
     */
    public void dispose() {
        if (owner != null) {
            throw new IllegalStateException("This palette is owned by an image buffer and cannot be disposed directly.");
        }
        entries = null;
        size = 0;
    }

    /**
     * Write a table of the colours in this palette to the given output.
     */
    public void writeTo(Appendable out) throws IOException {
        Objects.requireNonNull(out, "out");
        checkAccessible();
        out.append("    Palette: depth = ").append(String.valueOf(depth)).append(" bpp; ")
           .append(String.valueOf(size)).append(" colors\n");
        out.append("    Color    R-val    G-val    B-val\n");
        out.append("    --------------------------------\n");
        for (int i = 0; i < size; i++) {
            int rgb = entries[i];
            out.append(String.format("    %3d      %3d      %3d      %3d\n",
                    i, rgb >>> 16 & 0xFF, rgb >>> 8 & 0xFF, rgb & 0xFF));
        }
    }

    void claim(Object newOwner) {
        checkAccessible();
        if (owner != null && owner != newOwner) {
            throw new InvalidValueException("This palette is already owned by another image buffer.");
        }
        owner = newOwner;
    }

    void transferOwnership(Object newOwner) {
        owner = newOwner;
    }

    void disposeOwned() {
        owner = null;
        dispose();
    }

    private void checkAccessible() {
        if (entries == null) {
            throw new IllegalStateException("This palette has been disposed.");
        }
    }

    private static int pack(int red, int green, int blue) {
        checkComponent(red, "red");
        checkComponent(green, "green");
        checkComponent(blue, "blue");
        return red << 16 | green << 8 | blue;
    }

    private static void checkComponent(int value, String name) {
        if (value < 0 || value > 255) {
            throw new InvalidValueException("The " + name + " component must be in [0, 255], but was " + value + '.');
        }
    }

    @Override
    public String toString() {
        if (entries == null) {
            return "Palette[disposed]";
        }
        return "Palette[depth: " + depth + ", colors: " + Arrays.toString(Arrays.copyOf(entries, size)) + ']';
    }
}
