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
import io.netty.util.internal.SystemPropertyUtil;

import java.io.Serial;
import java.util.ArrayDeque;
import java.util.Locale;

/**
 * Keeps a bounded history of what happened to one reference counted object: its allocation, acquires and closes,
 * ownership transfers, its drop, and the touches reported by the object itself, such as an image being resized or
 * getting a new palette. When the object is misused, the history is attached to the exception as suppressed
 * {@link TracePoint} throwables, oldest first.
 * <p>
 * Recording is off unless the {@code io.netty.image.traceLifecycleDepth} system property is a positive number of
 * stack frames to keep per event. At most {@code io.netty.image.maxTracePoints} events are kept per object.
 */
abstract class LifecycleTracer {
    static final int TRACE_DEPTH =
            Math.max(SystemPropertyUtil.getInt("io.netty.image.traceLifecycleDepth", 0), 0);
    static final int MAX_TRACE_POINTS =
            Math.max(Math.min(SystemPropertyUtil.getInt("io.netty.image.maxTracePoints", 50), 1000), 1);

    static LifecycleTracer get() {
        if (TRACE_DEPTH == 0) {
            return Disabled.INSTANCE;
        }
        return new Recording(TRACE_DEPTH, MAX_TRACE_POINTS);
    }

    abstract boolean isRecording();

    abstract void record(Event event, int handles, Object hint);

    /**
     * Record the send, and wrap the owned object so that its receipt is recorded too.
     */
    abstract <T> Owned<T> recordTransfer(Owned<T> owned, int handles);

    abstract <E extends Throwable> E attachTrace(E throwable);

    enum Event {
        ALLOCATE,
        ACQUIRE,
        CLOSE,
        DROP,
        SEND,
        TOUCH
    }

    private static final class Disabled extends LifecycleTracer {
        private static final Disabled INSTANCE = new Disabled();

        @Override
        boolean isRecording() {
            return false;
        }

        @Override
        void record(Event event, int handles, Object hint) {
        }

        @Override
        <T> Owned<T> recordTransfer(Owned<T> owned, int handles) {
            return owned;
        }

        @Override
        <E extends Throwable> E attachTrace(E throwable) {
            return throwable;
        }
    }

    static final class Recording extends LifecycleTracer {
        private static final StackWalker WALKER = StackWalker.getInstance();
        private static final String TRACING_FRAMES = LifecycleTracer.class.getName();

        private final int depth;
        private final int maxTracePoints;
        private final long created;
        private final ArrayDeque<TracePoint> points;

        Recording(int depth, int maxTracePoints) {
            this.depth = depth;
            this.maxTracePoints = maxTracePoints;
            created = System.nanoTime();
            points = new ArrayDeque<>(Math.min(maxTracePoints, 16));
            record(Event.ALLOCATE, 1, null);
        }

        @Override
        boolean isRecording() {
            return true;
        }

        @Override
        void record(Event event, int handles, Object hint) {
            add(new TracePoint(describe(event, handles, hint), capture(), false));
        }

        @Override
        <T> Owned<T> recordTransfer(Owned<T> owned, int handles) {
            TracePoint sent = new TracePoint(describe(Event.SEND, handles, null), capture(), true);
            add(sent);
            return new Owned<T>() {
                @Override
                public T transferOwnership(Drop<T> drop) {
                    sent.receipt = new TracePoint("received" + elapsed(), capture(), false);
                    return owned.transferOwnership(drop);
                }
            };
        }

        @Override
        <E extends Throwable> E attachTrace(E throwable) {
            TracePoint[] snapshot;
            synchronized (points) {
                snapshot = points.toArray(new TracePoint[0]);
            }
            for (TracePoint point : snapshot) {
                throwable.addSuppressed(point.withReceipt());
            }
            return throwable;
        }

        int size() {
            synchronized (points) {
                return points.size();
            }
        }

        private void add(TracePoint point) {
            synchronized (points) {
                if (points.size() == maxTracePoints) {
                    points.pollFirst();
                }
                points.addLast(point);
            }
        }

        private String describe(Event event, int handles, Object hint) {
            StringBuilder message = new StringBuilder(event.name().toLowerCase(Locale.ROOT));
            if (hint != null) {
                message.append(": ").append(hint);
            }
            return message.append(" (handles = ").append(handles).append(')').append(elapsed()).toString();
        }

        private String elapsed() {
            return " at +" + (System.nanoTime() - created) / 1000 + "µs";
        }

        private StackTraceElement[] capture() {
            return WALKER.walk(frames -> frames
                    .dropWhile(frame -> frame.getClassName().startsWith(TRACING_FRAMES))
                    .limit(depth)
                    .map(StackWalker.StackFrame::toStackTraceElement)
                    .toArray(StackTraceElement[]::new));
        }
    }

    /**
     * One recorded event, carrying the stack at the point where it happened.
     */
    static final class TracePoint extends Throwable {
        @Serial
        private static final long serialVersionUID = 3418529640185672017L;

        private final boolean transfer;
        private volatile TracePoint receipt;

        TracePoint(String message, StackTraceElement[] frames, boolean transfer) {
            super(message, null, true, true);
            this.transfer = transfer;
            setStackTrace(frames);
        }

        @Override
        public synchronized Throwable fillInStackTrace() {
            return this;
        }

        TracePoint withReceipt() {
            if (!transfer) {
                return this;
            }
            TracePoint received = receipt;
            if (received == null) {
                return new TracePoint(getMessage() + " (sent but not received)", getStackTrace(), false);
            }
            TracePoint copy = new TracePoint(getMessage(), getStackTrace(), false);
            copy.addSuppressed(received);
            return copy;
        }
    }
}
