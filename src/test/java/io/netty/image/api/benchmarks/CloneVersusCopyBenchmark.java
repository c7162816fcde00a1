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
package io.netty.image.api.benchmarks;

import io.netty.image.api.ImageAllocator;
import io.netty.image.api.ImageBuffer;
import org.openjdk.jmh.annotations.Benchmark;
import org.openjdk.jmh.annotations.BenchmarkMode;
import org.openjdk.jmh.annotations.Fork;
import org.openjdk.jmh.annotations.Measurement;
import org.openjdk.jmh.annotations.Mode;
import org.openjdk.jmh.annotations.OutputTimeUnit;
import org.openjdk.jmh.annotations.Param;
import org.openjdk.jmh.annotations.Scope;
import org.openjdk.jmh.annotations.Setup;
import org.openjdk.jmh.annotations.State;
import org.openjdk.jmh.annotations.TearDown;
import org.openjdk.jmh.annotations.Warmup;

import java.util.concurrent.TimeUnit;

@Warmup(iterations = 10, time = 1)
@Measurement(iterations = 10, time = 1)
@Fork(value = 3, jvmArgsAppend = { "-XX:+UnlockDiagnosticVMOptions", "-XX:+DebugNonSafepoints" })
@BenchmarkMode(Mode.AverageTime)
@OutputTimeUnit(TimeUnit.NANOSECONDS)
@State(Scope.Benchmark)
public class CloneVersusCopyBenchmark {
    @Param({"heap", "pooledHeap", "pooledDirect"})
    public String allocatorName;
    @Param({"64", "1024"})
    public int side;

    private ImageAllocator allocator;
    private ImageBuffer image;

    @Setup
    public void setUp() {
        if ("heap".equals(allocatorName)) {
            allocator = ImageAllocator.heap();
        } else if ("pooledHeap".equals(allocatorName)) {
            allocator = ImageAllocator.pooledHeap();
        } else if ("pooledDirect".equals(allocatorName)) {
            allocator = ImageAllocator.pooledDirect();
        } else {
            throw new IllegalArgumentException("Unsupported allocator: " + allocatorName);
        }
        image = allocator.create(side, side, 8);
    }

    @TearDown
    public void tearDown() {
        image.close();
        allocator.close();
    }

    @Benchmark
    public int cloneAndClose() {
        try (ImageBuffer clone = image.acquire()) {
            return clone.countHandles();
        }
    }

    @Benchmark
    public int copyAndClose() {
        try (ImageBuffer copy = image.copy()) {
            return copy.stride();
        }
    }
}
