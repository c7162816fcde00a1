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

import io.netty.image.api.Drop;
import io.netty.image.api.InvalidValueException;
import io.netty.image.api.Owned;
import io.netty.image.api.Rc;
import io.netty.image.api.Send;

/**
 * Internal support class for reference counted objects.
 * <p>
 * The handle count starts at one when the object is constructed. The object is dropped when the count reaches zero,
 * and is inaccessible from then on.
 *
 * @param <I> The public interface for the reference counted object.
 * @param <T> The concrete implementation of the reference counted object.
 */
public abstract class RcSupport<I extends Rc<I>, T extends RcSupport<I, T>> implements Rc<I> {
    private static final int SENT = -1;
    private int handles; // Inaccessible if zero or negative.
    private final Drop<T> drop;
    private final LifecycleTracer tracer;

    protected RcSupport(Drop<T> drop) {
        this.drop = drop;
        handles = 1;
        tracer = LifecycleTracer.get();
    }

    /**
     * Increment the handle count.
     * <p>
     * Note, this method is not thread-safe because Rc's are meant to thread-confined.
     *
     * @return This Rc instance.
     */
    @Override
    public final I acquire() {
        if (handles <= 0) {
            throw attachTrace(new IllegalStateException("This resource is closed: " + this + '.'));
        }
        if (handles == Integer.MAX_VALUE) {
            throw new IllegalStateException("Cannot acquire more handles; counter would overflow.");
        }
        handles++;
        tracer.record(LifecycleTracer.Event.ACQUIRE, handles, null);
        return self();
    }

    /**
     * Decrement the handle count, and dispose of the resource if the last handle is closed.
     * <p>
     * Note, this method is not thread-safe because Rc's are meant to be thread-confined.
     *
     * @throws IllegalStateException If this Rc has already been dropped.
     */
    @Override
    public final void close() {
        if (handles == SENT) {
            return;
        }
        if (handles == 0) {
            throw attachTrace(new IllegalStateException("Double-free: Resource already closed and dropped."));
        }
        if (handles == 1) {
            tracer.record(LifecycleTracer.Event.DROP, handles, null);
            handles = 0;
            drop.drop(impl());
            return;
        }
        handles--;
        tracer.record(LifecycleTracer.Event.CLOSE, handles, null);
    }

    /**
     * Send this Rc instance to another Thread, transferring the ownership to the recipient. This method can be used
     * when the receiving thread is not known up front.
     * <p>
     * This instance immediately becomes inaccessible, and all attempts at accessing this Rc will throw. Calling {@link
     * #close()} will have no effect, so this method is safe to call within a try-with-resources statement.
     *
     * @throws IllegalStateException if this object has more than one live handle.
     */
    @Override
    public final Send<I> send() {
        if (!isOwned()) {
            throw notSendableException();
        }
        var owned = tracer.recordTransfer(prepareSend(), handles);
        handles = SENT; // Close without dropping. This also ignore future double-free attempts.
        return new OwnershipTransfer<I, T>(owned, drop, getClass().getSimpleName());
    }

    /**
     * Add the given delta to the handle count, without acquiring or dropping anything.
     * This method is unsafe because it makes the handle count disagree with the number of handles callers hold.
     *
     * @param delta The amount to add to the handle count; may be negative.
     * @throws InvalidValueException if the resulting count would be less than one.
     */
    protected final void unsafeChangeHandles(int delta) {
        if (handles <= 0) {
            throw attachTrace(new IllegalStateException("This resource is closed: " + this + '.'));
        }
        long result = (long) handles + delta;
        if (result < 1 || result > Integer.MAX_VALUE) {
            throw new InvalidValueException(
                    "Handle count must stay in [1, " + Integer.MAX_VALUE + "], but would be " + result + '.');
        }
        handles = (int) result;
        touch("handle count changed by", delta);
    }

    /**
     * Record an event of this object's own, such as a change of its contents, in its lifecycle trace.
     * Nothing is recorded unless lifecycle tracing is enabled.
     *
     * @param action What happened.
     * @param subject What it happened with, or {@code null}.
     */
    protected final void touch(String action, Object subject) {
        if (tracer.isRecording()) {
            tracer.record(LifecycleTracer.Event.TOUCH, handles, subject == null? action : action + ' ' + subject);
        }
    }

    protected <E extends Throwable> E attachTrace(E throwable) {
        return tracer.attachTrace(throwable);
    }

    /**
     * Create an {@link IllegalStateException} with a custom message, tailored to this particular {@link Rc} instance,
     * for when the object cannot be sent for some reason.
     * @return An {@link IllegalStateException} to be thrown when this object cannot be sent.
     */
    protected IllegalStateException notSendableException() {
        return new IllegalStateException(
                "Cannot send() a reference counted object with " + countHandles() + " handles: " + this + '.');
    }

    @Override
    public boolean isOwned() {
        return handles == 1;
    }

    @Override
    public int countHandles() {
        return Math.max(handles, 0);
    }

    @Override
    public boolean isAccessible() {
        return handles > 0;
    }

    /**
     * Prepare this instance for ownership transfer. This method is called from {@link #send()} in the sending thread.
     * This method should put this Rc in a deactivated state where it is no longer accessible from the currently
     * owning thread. In this state, the Rc instance should only allow a call to
     * {@link Owned#transferOwnership(Drop)} in the recipient thread.
     *
     * @return This Rc instance in a deactivated state.
     */
    protected abstract Owned<T> prepareSend();

    @SuppressWarnings("unchecked")
    private I self() {
        return (I) this;
    }

    @SuppressWarnings("unchecked")
    private T impl() {
        return (T) this;
    }
}
