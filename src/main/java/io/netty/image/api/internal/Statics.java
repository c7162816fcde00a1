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
package io.netty.image.api.internal;

import java.lang.invoke.MethodHandles.Lookup;
import java.lang.invoke.VarHandle;
import java.nio.ByteBuffer;
import java.util.Arrays;

public interface Statics {
    /**
     * The largest storage, in bytes, that a single image buffer can hold.
     * We use max array size because on-heap storage is backed by byte-arrays.
     */
    int MAX_STORAGE_SIZE = Integer.MAX_VALUE - 8;

    static VarHandle findVarHandle(Lookup lookup, Class<?> recv, String name, Class<?> type) {
        try {
            return lookup.findVarHandle(recv, name, type);
        } catch (Exception e) {
            throw new ExceptionInInitializerError(e);
        }
    }

    /**
     * Check if the given bit depth is one of 1, 2, 4, 8, 16, 24 or 32.
     */
    static boolean isLegalDepth(int depth) {
        switch (depth) {
        case 1:
        case 2:
        case 4:
        case 8:
        case 16:
        case 24:
        case 32:
            return true;
        default:
            return false;
        }
    }

    /**
     * Compute the number of bytes in a row of packed pixels, padded to a whole number of 32-bit words.
     * The result is {@code ceil(width * depth / 32) * 4}.
     */
    static long computeStride(int width, int depth) {
        return ((long) width * depth + 31) / 32 * 4;
    }

    /**
     * Fill every byte of the given storage with zero, ignoring its position and limit.
     */
    static void zero(ByteBuffer storage) {
        storage = storage.duplicate().clear();
        int capacity = storage.capacity();
        if (storage.hasArray()) {
            int offset = storage.arrayOffset();
            Arrays.fill(storage.array(), offset, offset + capacity, (byte) 0);
            return;
        }
        int i = 0;
        for (; i + Long.BYTES <= capacity; i += Long.BYTES) {
            storage.putLong(i, 0L);
        }
        for (; i < capacity; i++) {
            storage.put(i, (byte) 0);
        }
    }

    /**
     * Copy the first {@code length} bytes of {@code src} into {@code dest}, ignoring positions and limits.
     */
    static void copyStorage(ByteBuffer src, ByteBuffer dest, int length) {
        dest.duplicate().clear().put(0, src.duplicate().clear(), 0, length);
    }

    static IllegalStateException bufferIsClosed() {
        return new IllegalStateException("This image buffer is closed.");
    }
}
