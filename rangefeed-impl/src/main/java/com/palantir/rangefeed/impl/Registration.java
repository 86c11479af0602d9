/*
 * (c) Copyright 2024 Palantir Technologies Inc. All rights reserved.
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package com.palantir.rangefeed.impl;

import com.google.common.util.concurrent.ListenableFuture;
import com.google.common.util.concurrent.SettableFuture;
import com.palantir.logsafe.SafeArg;
import com.palantir.logsafe.UnsafeArg;
import com.palantir.logsafe.logger.SafeLogger;
import com.palantir.logsafe.logger.SafeLoggerFactory;
import com.palantir.rangefeed.CatchUpScanner;
import com.palantir.rangefeed.RangeFeedCheckpoint;
import com.palantir.rangefeed.RangeFeedEvent;
import com.palantir.rangefeed.RangeFeedEventSink;
import com.palantir.rangefeed.RangeFeedException;
import com.palantir.rangefeed.RangeFeedValue;
import com.palantir.rangefeed.Span;
import com.palantir.rangefeed.Timestamp;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import javax.annotation.Nullable;

/**
 * A single subscriber. The event loop publishes into a bounded buffer; a dedicated output task runs the catch-up
 * scan and then drains the buffer into the sink, so a slow sink never blocks the loop. A subscriber whose buffer
 * fills up is disconnected.
 */
final class Registration {
    private static final SafeLogger log = SafeLoggerFactory.get(Registration.class);

    private final Span span;
    private final Timestamp startTimestamp;
    private final RangeFeedEventSink sink;
    private final CatchUpScanner catchUpScanner;
    private final RangeFeedMetrics metrics;
    private final int bufferSize;
    private final BlockingQueue<BufferedItem> buffer = new LinkedBlockingQueue<>();
    private final AtomicInteger bufferedEvents = new AtomicInteger();
    private final SettableFuture<RangeFeedException> error = SettableFuture.create();
    private final AtomicBoolean disconnected = new AtomicBoolean(false);

    @Nullable
    private volatile Future<?> outputTask;

    Registration(
            Span span,
            Timestamp startTimestamp,
            RangeFeedEventSink sink,
            CatchUpScanner catchUpScanner,
            int bufferSize,
            RangeFeedMetrics metrics) {
        this.span = span;
        this.startTimestamp = startTimestamp;
        this.sink = sink;
        this.catchUpScanner = catchUpScanner;
        this.metrics = metrics;
        this.bufferSize = bufferSize;
    }

    Span span() {
        return span;
    }

    Timestamp startTimestamp() {
        return startTimestamp;
    }

    /**
     * Completes with the terminal error of this subscription, exactly once.
     */
    ListenableFuture<RangeFeedException> error() {
        return error;
    }

    boolean isDisconnected() {
        return disconnected.get();
    }

    void startOutput(ExecutorService executor) {
        Future<?> task = executor.submit(this::runOutputLoop);
        outputTask = task;
        if (isDisconnected()) {
            task.cancel(true);
        }
    }

    void publishValue(RangeFeedValue value) {
        if (!span.containsKey(value.key()) || value.timestamp().isBefore(startTimestamp)) {
            return;
        }
        if (enqueue(BufferedItem.event(value))) {
            metrics.markValuePublished();
        }
    }

    void publishCheckpoint(Timestamp resolvedTimestamp) {
        if (resolvedTimestamp.isBefore(startTimestamp)) {
            return;
        }
        if (enqueue(BufferedItem.event(RangeFeedCheckpoint.of(span, resolvedTimestamp)))) {
            metrics.markCheckpointPublished();
        }
    }

    /**
     * Returns a future that completes once every event published before this call has been handed to the sink,
     * or once this registration is disconnected.
     */
    ListenableFuture<Void> sync() {
        SettableFuture<Void> marker = SettableFuture.create();
        if (!enqueue(BufferedItem.syncMarker(marker)) || isDisconnected()) {
            marker.set(null);
        }
        return marker;
    }

    /**
     * Disconnects the subscriber if its stream has been cancelled.
     *
     * @return whether this registration is disconnected
     */
    boolean checkStream() {
        if (!isDisconnected() && sink.isCancelled()) {
            disconnect(RangeFeedException.of(RangeFeedException.Reason.STREAM_CANCELLED));
        }
        return isDisconnected();
    }

    /**
     * Delivers {@code cause} as the terminal error and stops output. Only the first call has any effect.
     */
    void disconnect(RangeFeedException cause) {
        if (!disconnected.compareAndSet(false, true)) {
            return;
        }
        log.info(
                "Disconnecting rangefeed registration",
                SafeArg.of("reason", cause.reason()),
                UnsafeArg.of("span", span));
        metrics.markDisconnect();
        error.set(cause);
        Future<?> task = outputTask;
        if (task != null) {
            task.cancel(true);
        }
        releaseSyncMarkers();
    }

    /**
     * Only events count towards the buffer's capacity. Sync markers are always accepted.
     */
    private boolean enqueue(BufferedItem item) {
        if (isDisconnected()) {
            return false;
        }
        if (item.event != null) {
            // Enqueues happen only on the event loop thread.
            if (bufferedEvents.get() >= bufferSize) {
                disconnect(RangeFeedException.of(RangeFeedException.Reason.BUFFER_OVERFLOW));
                return false;
            }
            bufferedEvents.incrementAndGet();
        }
        buffer.add(item);
        return true;
    }

    private void runOutputLoop() {
        try {
            catchUpScanner.scan(span, startTimestamp, this::sendCatchUpValue);
        } catch (SendFailedException e) {
            disconnect(RangeFeedException.of(RangeFeedException.Reason.SEND_FAILED, e.getCause()));
            return;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return;
        } catch (Exception e) {
            disconnect(RangeFeedException.of(RangeFeedException.Reason.CATCH_UP_SCAN_FAILED, e));
            return;
        }

        while (!isDisconnected()) {
            BufferedItem item;
            try {
                item = buffer.take();
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                return;
            }
            if (item.syncMarker != null) {
                item.syncMarker.set(null);
                continue;
            }
            bufferedEvents.decrementAndGet();
            try {
                sink.send(item.event);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                return;
            } catch (Exception e) {
                disconnect(RangeFeedException.of(RangeFeedException.Reason.SEND_FAILED, e));
                return;
            }
        }
    }

    private void sendCatchUpValue(RangeFeedValue value) {
        try {
            sink.send(value);
        } catch (Exception e) {
            throw new SendFailedException(e);
        }
    }

    private void releaseSyncMarkers() {
        List<BufferedItem> remaining = new ArrayList<>();
        buffer.drainTo(remaining);
        for (BufferedItem item : remaining) {
            if (item.syncMarker != null) {
                item.syncMarker.set(null);
            }
        }
    }

    private static final class BufferedItem {
        @Nullable
        private final RangeFeedEvent event;

        @Nullable
        private final SettableFuture<Void> syncMarker;

        private BufferedItem(@Nullable RangeFeedEvent event, @Nullable SettableFuture<Void> syncMarker) {
            this.event = event;
            this.syncMarker = syncMarker;
        }

        static BufferedItem event(RangeFeedEvent event) {
            return new BufferedItem(event, null);
        }

        static BufferedItem syncMarker(SettableFuture<Void> marker) {
            return new BufferedItem(null, marker);
        }
    }

    private static final class SendFailedException extends RuntimeException {
        SendFailedException(Exception cause) {
            super(cause);
        }
    }
}
