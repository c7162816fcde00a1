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
import io.netty.image.api.Owned;
import io.netty.image.api.Rc;
import io.netty.image.api.Send;

import java.lang.invoke.VarHandle;

import static io.netty.image.api.internal.Statics.findVarHandle;
import static java.lang.invoke.MethodHandles.lookup;

/**
 * A {@link Send} that hands the deactivated object over to whichever thread claims it first, by either receiving or
 * discarding it. The pending {@link Owned} is cleared on the claim, so it is not retained afterwards.
 */
final class OwnershipTransfer<I extends Rc<I>, T extends Rc<I>> implements Send<I> {
    private static final VarHandle PENDING = findVarHandle(lookup(), OwnershipTransfer.class, "pending", Owned.class);
    private final Drop<T> drop;
    private final String description;
    private volatile Owned<T> pending; // Claimed via PENDING

    OwnershipTransfer(Owned<T> pending, Drop<T> drop, String description) {
        this.pending = pending;
        this.drop = drop;
        this.description = description;
    }

    @Override
    public I receive() {
        Owned<T> owned = claim();
        if (owned == null) {
            throw new IllegalStateException("This " + description + " has already been received or discarded.");
        }
        return adopt(owned);
    }

    @Override
    public void discard() {
        Owned<T> owned = claim();
        if (owned != null) {
            adopt(owned).close();
        }
    }

    @SuppressWarnings("unchecked")
    private Owned<T> claim() {
        return (Owned<T>) PENDING.getAndSet(this, null);
    }

    @SuppressWarnings("unchecked")
    private I adopt(Owned<T> owned) {
        T received = owned.transferOwnership(drop);
        drop.attach(received);
        return (I) received;
    }

    @Override
    public String toString() {
        return "OwnershipTransfer[" + description + (pending == null? ", claimed]" : ", pending]");
    }
}
