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
 * An Rc is a reference counted, thread-confined, resource of sorts. Because these resources are thread-confined, the
 * reference counting is NOT atomic. An Rc can only be accessed by one thread at a time - the owner thread that the
 * resource is confined to.
 * <p>
 * Every Rc starts out with a single handle. Each {@link #acquire()} adds a handle to the same object, and each
 * {@link #close()} gives one back. When the last handle is closed, the resource is disposed of, or released, or
 * returned to the pool it came from. The precise action is implemented by the {@link Drop} instance given as an
 * argument to the Rc constructor.
 *
 * @param <I> The concrete subtype.
 */
public interface Rc<I extends Rc<I>> extends AutoCloseable {
    /**
     * Increment the handle count, and return a new handle to this same object.
     * <p>
     * No data is copied. Mutations made through the returned handle are visible through every other handle.
     * <p>
     * Note, this method is not thread-safe because reference counted objects are meant to thread-confined.
     *
     * @return This Rc instance.
     * @throws IllegalStateException If this Rc has already been dropped.
     */
    I acquire();

    /**
     * Decrement the handle count, and dispose of the resource if the last handle is closed.
     * <p>
     * Note, this method is not thread-safe because reference counted objects are meant to be thread-confined.
     *
     * @throws IllegalStateException If this Rc has already been dropped.
     */
    @Override
    void close();

    /**
     * Send this reference counted object instance to another Thread, transferring the ownership to the recipient.
     * <p>
     * Note that the object must be {@linkplain #isOwned() owned} when it's being sent.
     * That is, every handle obtained through {@link #acquire()} must have been closed, and {@link #isOwned()} must
     * return {@code true}.
     * <p>
     * This instance immediately becomes inaccessible, and all attempts at accessing this reference counted object
     * will throw. Calling {@link #close()} will have no effect, so this method is safe to call within a
     * try-with-resources statement.
     *
     * @return A {@link Send} that the recipient thread can {@linkplain Send#receive() receive} the object from.
     * @throws IllegalStateException If this object is not owned.
     */
    Send<I> send();

    /**
     * Check that this reference counted object is owned, which is the case when exactly one handle is live.
     *
     * @return {@code true} if this object can be {@linkplain #send() sent},
     * or {@code false} if calling {@link #send()} would throw an exception.
     */
    boolean isOwned();

    /**
     * Count the number of live handles to this object.
     *
     * @return The number of live handles, or {@code 0} if this object has been dropped or sent.
     */
    int countHandles();

    /**
     * Check if this object is accessible.
     *
     * @return {@code true} if this object is still valid and can be accessed,
     * otherwise {@code false} if, for instance, this object has been dropped, or been {@linkplain #send() sent}
     * elsewhere.
     */
    boolean isAccessible();
}
