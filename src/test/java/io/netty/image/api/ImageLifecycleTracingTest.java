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
import org.junit.jupiter.api.condition.EnabledIfSystemProperty;

import java.util.Arrays;
import java.util.List;
import java.util.stream.Collectors;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertThrows;

/**
 * Runs in its own surefire execution, with {@code io.netty.image.traceLifecycleDepth} set.
 */
@EnabledIfSystemProperty(named = "io.netty.image.traceLifecycleDepth", matches = "[1-9][0-9]*")
class ImageLifecycleTracingTest {
    @Test
    void accessAfterDropMustReportTheImageHistory() {
        try (ImageAllocator allocator = ImageAllocator.heap()) {
            ImageBuffer source = allocator.create(64, 32, 8);
            ImageBuffer destination = allocator.create(8, 8, 1);
            source.copyInto(destination);
            destination.palette(new Palette(2));
            ImageBuffer clone = destination.acquire();
            clone.close();
            destination.close();
            source.close();

            var e = assertThrows(IllegalStateException.class, destination::width);
            List<String> history = messages(e);
            assertThat(history).hasSize(7);
            assertThat(history.get(0)).startsWith("allocate (handles = 1)");
            assertThat(history.get(1)).startsWith("touch: storage attached (handles = 1)");
            assertThat(history.get(2)).startsWith("touch: resized to 64x32x8 (handles = 1)");
            assertThat(history.get(3)).startsWith("touch: palette replaced by Palette[depth: 2");
            assertThat(history.get(4)).startsWith("acquire (handles = 2)");
            assertThat(history.get(5)).startsWith("close (handles = 1)");
            assertThat(history.get(6)).startsWith("drop (handles = 1)");
            assertThat(e.getSuppressed()[2].getStackTrace())
                    .anyMatch(frame -> frame.getClassName().equals(DefaultImageBuffer.class.getName())
                                       && frame.getMethodName().equals("resizeImageData"));

            var sourceTrace = assertThrows(IllegalStateException.class, source::data);
            assertThat(messages(sourceTrace)).anyMatch(message -> message.startsWith("touch: copied into"));
        }
    }

    @Test
    void accessAfterSendMustReportWhereTheImageWent() {
        try (ImageAllocator allocator = ImageAllocator.heap()) {
            ImageBuffer image = allocator.create(4, 4, 8);
            Send<ImageBuffer> send = image.send();

            var pending = assertThrows(IllegalStateException.class, image::height);
            assertThat(messages(pending)).anyMatch(message -> message.endsWith("(sent but not received)"));

            try (ImageBuffer received = send.receive()) {
                assertThat(received.height()).isEqualTo(4);
                var e = assertThrows(IllegalStateException.class, image::height);
                Throwable sent = Arrays.stream(e.getSuppressed())
                                       .filter(point -> point.getMessage().startsWith("send"))
                                       .findFirst().orElseThrow();
                assertThat(sent.getMessage()).doesNotContain("not received");
                assertThat(sent.getSuppressed()).hasSize(1);
                assertThat(sent.getSuppressed()[0].getMessage()).startsWith("received");
            }
        }
    }

    private static List<String> messages(Throwable throwable) {
        return Arrays.stream(throwable.getSuppressed()).map(Throwable::getMessage).collect(Collectors.toList());
    }
}
