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

import java.util.Arrays;
import java.util.EnumSet;
import java.util.function.Supplier;

public final class Fixture implements Supplier<ImageAllocator> {
    private final String name;
    private final Supplier<ImageAllocator> factory;
    private final EnumSet<Properties> properties;

    public Fixture(String name, Supplier<ImageAllocator> factory, Properties... props) {
        this.name = name;
        this.factory = factory;
        properties = EnumSet.copyOf(Arrays.asList(props));
    }

    public ImageAllocator createAllocator() {
        return factory.get();
    }

    @Override
    public ImageAllocator get() {
        return factory.get();
    }

    @Override
    public String toString() {
        return name;
    }

    public boolean isHeap() {
        return properties.contains(Properties.HEAP);
    }

    public boolean isDirect() {
        return properties.contains(Properties.DIRECT);
    }

    public boolean isPooled() {
        return properties.contains(Properties.POOLED);
    }

    public enum Properties {
        HEAP,
        DIRECT,
        POOLED
    }
}
