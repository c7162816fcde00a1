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

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.io.IOException;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertThrows;

public class PaletteTest {
    @ParameterizedTest
    @ValueSource(ints = { 1, 2, 4, 8 })
    void paletteMustHoldTwoToTheDepthEntries(int depth) {
        Palette palette = new Palette(depth);
        assertThat(palette.depth()).isEqualTo(depth);
        assertThat(palette.maxEntries()).isEqualTo(1 << depth);
        for (int i = 0; i < palette.maxEntries(); i++) {
            palette.addColor(i, i, i);
        }
        assertThat(palette.size()).isEqualTo(1 << depth);
        assertThrows(InvalidValueException.class, () -> palette.addColor(0, 0, 0));
    }

    @ParameterizedTest
    @ValueSource(ints = { 0, 3, 16, 32, -1 })
    void illegalPaletteDepthMustThrow(int depth) {
        assertThrows(InvalidValueException.class, () -> new Palette(depth));
    }

    @Test
    void colorComponentsMustBeInRange() {
        Palette palette = new Palette(8);
        assertThrows(InvalidValueException.class, () -> palette.addColor(256, 0, 0));
        assertThrows(InvalidValueException.class, () -> palette.addColor(0, -1, 0));
        assertThrows(InvalidValueException.class, () -> palette.addColor(0, 0, 1000));
        assertThat(palette.size()).isZero();
    }

    @Test
    void colorAccessors() {
        Palette palette = new Palette(4).addColor(10, 20, 30).addColor(255, 254, 253);
        assertThat(palette.red(0)).isEqualTo(10);
        assertThat(palette.green(0)).isEqualTo(20);
        assertThat(palette.blue(0)).isEqualTo(30);
        assertThat(palette.rgb(1)).isEqualTo(0xFFFEFD);
        palette.setColor(1, 1, 2, 3);
        assertThat(palette.rgb(1)).isEqualTo(0x010203);
        assertThrows(IndexOutOfBoundsException.class, () -> palette.rgb(2));
        assertThrows(IndexOutOfBoundsException.class, () -> palette.setColor(2, 0, 0, 0));
    }

    @Test
    void copyMustBeIndependentAndUnowned() {
        Palette palette = new Palette(2).addColor(1, 1, 1);
        try (ImageBuffer image = ImageAllocator.heap().createHeader(2, 2, 2)) {
            image.palette(palette);
            Palette copy = palette.copy();
            assertThat(copy.isOwned()).isFalse();
            copy.addColor(2, 2, 2);
            assertThat(copy.size()).isEqualTo(2);
            assertThat(palette.size()).isOne();
            copy.dispose();
            assertThat(copy.isDisposed()).isTrue();
            assertThrows(IllegalStateException.class, copy::size);
        }
    }

    @Test
    void writeToMustListTheColors() throws IOException {
        Palette palette = new Palette(1).addColor(0, 0, 0).addColor(255, 255, 255);
        StringBuilder out = new StringBuilder();
        palette.writeTo(out);
        assertThat(out.toString())
                .startsWith("    Palette: depth = 1 bpp; 2 colors\n")
                .contains("      0        0        0        0\n")
                .contains("      1      255      255      255\n");
        assertThat(palette.toString()).contains("depth: 1");
    }
}
