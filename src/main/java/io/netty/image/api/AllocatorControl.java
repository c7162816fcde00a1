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

import java.nio.ByteBuffer;

/**
 * The link from an image buffer back to the allocator that created it.
 */
interface AllocatorControl {
    /**
     * The allocator that this control belongs to.
     */
    ImageAllocator getAllocator();

    /**
     * Allocate pixel storage through the allocator's allocate function.
     *
     * @param size The number of bytes.
     * @return Storage of exactly the given capacity.
     * @throws AllocationFailedException if the allocate function cannot provide the storage.
     */
    ByteBuffer allocateStorage(int size);

    /**
     * Release pixel storage through the allocator's release function.
     */
    void releaseStorage(ByteBuffer storage);
}
