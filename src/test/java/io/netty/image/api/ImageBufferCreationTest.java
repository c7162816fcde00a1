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
import org.junit.jupiter.params.provider.CsvSource;
import org.junit.jupiter.params.provider.MethodSource;

import java.nio.ByteBuffer;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertThrows;

public class ImageBufferCreationTest extends ImageTestSupport {
    @ParameterizedTest
    @MethodSource("allocators")
    void createMustComputeStrideAndZeroStorage(Fixture fixture) {
        int[] widths = { 1, 2, 3, 7, 31, 32, 33, 100 };
        try (ImageAllocator allocator = fixture.createAllocator()) {
            for (int depth : LEGAL_DEPTHS) {
                for (int width : widths) {
                    try (ImageBuffer image = allocator.create(width, 3, depth)) {
                        int stride = expectedStride(width, depth);
                        assertThat(image.width()).isEqualTo(width);
                        assertThat(image.height()).isEqualTo(3);
                        assertThat(image.depth()).isEqualTo(depth);
                        assertThat(image.stride()).as("stride of %dx3x%d", width, depth).isEqualTo(stride);
                        assertThat(image.stride() % 4).isZero();
                        assertThat(image.wordsPerLine()).isEqualTo(stride / 4);
                        assertThat(image.data().capacity()).isEqualTo(stride * 3);
                        assertThat(toByteArray(image)).containsOnly(0);
                        assertThat(image.countHandles()).isOne();
                    }
                }
            }
        }
    }

    @ParameterizedTest
    @CsvSource({
            "1, 1, 4",
            "32, 1, 4",
            "33, 1, 8",
            "100, 1, 16",
            "100, 8, 100",
            "3, 24, 12",
            "5, 32, 20",
    })
    void strideMustBePaddedToWholeWords(int width, int depth, int stride) {
        try (ImageBuffer image = ImageAllocator.heap().createHeader(width, 1, depth)) {
            assertThat(image.stride()).isEqualTo(stride);
        }
    }

    @ParameterizedTest
    @MethodSource("pooledAllocators")
    void createMustZeroReusedStorage(Fixture fixture) {
        try (ImageAllocator allocator = fixture.createAllocator()) {
            ImageBuffer dirty = allocator.create(40, 10, 8);
            fillRandom(dirty, 42);
            dirty.close();
            try (ImageBuffer image = allocator.create(40, 10, 8)) {
                assertThat(toByteArray(image)).containsOnly(0);
            }
        }
    }

    @ParameterizedTest
    @MethodSource("allocators")
    void createHeaderMustNotAllocateStorage(Fixture fixture) {
        try (ImageAllocator allocator = fixture.createAllocator()) {
            AtomicInteger allocations = new AtomicInteger();
            allocator.configureAllocator(size -> {
                allocations.incrementAndGet();
                return ByteBuffer.allocate(size);
            }, null);
            try (ImageBuffer image = allocator.createHeader(10, 20, 8)) {
                assertThat(image.data()).isNull();
                assertThat(image.stride()).isEqualTo(12);
                assertThat(image.countHandles()).isOne();
                assertThat(image.isOwned()).isTrue();
                assertThat(image.inputFormat()).isEqualTo(InputFormat.UNKNOWN);
                assertThat(image.palette()).isNull();
                assertThat(image.text()).isNull();
                assertThat(image.xResolution()).isZero();
                assertThat(image.yResolution()).isZero();
                assertThat(image.allocator()).isSameAs(allocator);
            }
            assertThat(allocations).hasValue(0);
        }
    }

    @ParameterizedTest
    @CsvSource({
            "0, 10, 8",
            "10, 0, 8",
            "10, 10, 3",
            "-1, 10, 8",
            "10, -1, 8",
            "10, 10, 0",
            "10, 10, 64",
            "2147483647, 2, 32",
    })
    void invalidGeometryMustThrowAndAllocateNothing(int width, int height, int depth) {
        List<ByteBuffer> allocated = new ArrayList<>();
        try (ImageAllocator allocator = ImageAllocator.heap()) {
            allocator.configureAllocator(size -> {
                ByteBuffer storage = ByteBuffer.allocate(size);
                allocated.add(storage);
                return storage;
            }, null);
            assertThrows(InvalidGeometryException.class, () -> allocator.create(width, height, depth));
            assertThrows(InvalidGeometryException.class, () -> allocator.createUninitialized(width, height, depth));
            assertThrows(InvalidGeometryException.class, () -> allocator.createHeader(width, height, depth));
        }
        assertThat(allocated).isEmpty();
    }

    @Test
    void invalidGeometryExceptionMustBeAnIllegalArgumentException() {
        var e = assertThrows(IllegalArgumentException.class, () -> ImageAllocator.heap().create(10, 10, 3));
        assertThat(e).isInstanceOf(InvalidGeometryException.class).hasMessageContaining("Depth");
    }

    @Test
    void allocateFunctionReturningNullMustFailCreation() {
        List<ByteBuffer> released = new ArrayList<>();
        try (ImageAllocator allocator = ImageAllocator.heap()) {
            allocator.configureAllocator(size -> null, released::add);
            var e = assertThrows(AllocationFailedException.class, () -> allocator.create(10, 10, 8));
            assertThat(e).hasMessageContaining("120 bytes");
        }
        assertThat(released).isEmpty();
    }

    @Test
    void allocateFunctionThrowingOutOfMemoryErrorMustFailCreation() {
        try (ImageAllocator allocator = ImageAllocator.heap()) {
            allocator.configureAllocator(size -> {
                throw new OutOfMemoryError("Simulated.");
            }, null);
            var e = assertThrows(AllocationFailedException.class, () -> allocator.createUninitialized(10, 10, 8));
            assertThat(e).hasCauseInstanceOf(OutOfMemoryError.class);
        }
    }

    @Test
    void allocateFunctionReturningWrongSizeMustFailCreationAndReleaseIt() {
        ByteBuffer wrong = ByteBuffer.allocate(3);
        List<ByteBuffer> released = new ArrayList<>();
        try (ImageAllocator allocator = ImageAllocator.heap()) {
            allocator.configureAllocator(size -> wrong, released::add);
            assertThrows(AllocationFailedException.class, () -> allocator.create(10, 10, 8));
        }
        assertThat(released).containsExactly(wrong);
    }

    @Test
    void allocateFunctionThrowingMustFailCreation() {
        try (ImageAllocator allocator = ImageAllocator.heap()) {
            allocator.configureAllocator(size -> {
                throw new IllegalArgumentException("Simulated.");
            }, null);
            var e = assertThrows(AllocationFailedException.class, () -> allocator.create(10, 10, 8));
            assertThat(e).hasCauseInstanceOf(IllegalArgumentException.class);
        }
    }

    @ParameterizedTest
    @MethodSource("pooledAllocators")
    void creatingThroughClosedPooledAllocatorMustFailAllocation(Fixture fixture) {
        ImageAllocator allocator = fixture.createAllocator();
        allocator.close();
        var e = assertThrows(AllocationFailedException.class, () -> allocator.create(4, 4, 8));
        assertThat(e).hasCauseInstanceOf(IllegalStateException.class);
        assertThrows(AllocationFailedException.class, () -> allocator.createUninitialized(4, 4, 8));
        try (ImageBuffer header = allocator.createHeader(4, 4, 8)) {
            assertThat(header.data()).isNull();
        }
    }

    @ParameterizedTest
    @MethodSource("allocators")
    void createTemplateMustCopyGeometryAndMetadata(Fixture fixture) {
        try (ImageAllocator allocator = fixture.createAllocator();
             ImageBuffer source = allocator.create(33, 7, 4)) {
            fillRandom(source, 7);
            source.xResolution(300).yResolution(150)
                  .inputFormat(InputFormat.PNG)
                  .text("source")
                  .palette(new Palette(4).addColor(1, 2, 3).addColor(4, 5, 6));

            try (ImageBuffer template = allocator.createTemplate(source)) {
                assertThat(template).isNotSameAs(source);
                assertThat(template.dimensions()).isEqualTo(source.dimensions());
                assertThat(template.stride()).isEqualTo(source.stride());
                assertThat(template.data()).isNotSameAs(source.data());
                assertThat(toByteArray(template)).containsOnly(0);
                assertThat(template.xResolution()).isEqualTo(300);
                assertThat(template.yResolution()).isEqualTo(150);
                assertThat(template.inputFormat()).isEqualTo(InputFormat.PNG);
                assertThat(template.text()).isEqualTo("source");
                assertThat(template.palette()).isNotSameAs(source.palette());
                assertThat(template.palette().size()).isEqualTo(2);
                assertThat(template.palette().rgb(1)).isEqualTo(source.palette().rgb(1));
                assertThat(template.countHandles()).isOne();
            }
            assertThat(source.palette().isDisposed()).isFalse();
            assertThat(source.countHandles()).isOne();
        }
    }

    @Test
    void createTemplateUninitializedMustHaveStorageOfTheRightSize() {
        try (ImageAllocator allocator = ImageAllocator.heap();
             ImageBuffer source = allocator.createHeader(17, 5, 2);
             ImageBuffer template = allocator.createTemplateUninitialized(source)) {
            assertThat(source.data()).isNull();
            assertThat(template.data().capacity()).isEqualTo(source.stride() * source.height());
            assertThat(template.palette()).isNull();
        }
    }

    @Test
    void createTemplateOfNullMustThrow() {
        try (ImageAllocator allocator = ImageAllocator.heap()) {
            assertThrows(NullPointerException.class, () -> allocator.createTemplate(null));
            assertThrows(NullPointerException.class, () -> allocator.createTemplateUninitialized(null));
        }
    }

    @Test
    void createTemplateOfClosedImageMustThrow() {
        try (ImageAllocator allocator = ImageAllocator.heap()) {
            ImageBuffer source = allocator.create(4, 4, 8);
            source.close();
            assertThrows(IllegalStateException.class, () -> allocator.createTemplate(source));
        }
    }
}
