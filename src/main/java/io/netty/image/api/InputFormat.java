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

/**
 * The format an image was decoded from. Image buffers that were not decoded from a file report {@link #UNKNOWN}.
 */
public enum InputFormat {
    UNKNOWN,
    BMP,
    JFIF_JPEG,
    PNG,
    TIFF,
    TIFF_PACKBITS,
    TIFF_RLE,
    TIFF_G3,
    TIFF_G4,
    TIFF_LZW,
    TIFF_ZIP,
    PNM,
    PS,
    GIF;

    /**
     * Check if this format is one of the TIFF variants.
     *
     * @return {@code true} if this is {@link #TIFF} or any of its compressed variants.
     */
    public boolean isTiff() {
        return this.compareTo(TIFF) >= 0 && this.compareTo(TIFF_ZIP) <= 0;
    }
}
