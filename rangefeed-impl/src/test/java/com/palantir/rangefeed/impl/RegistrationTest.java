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

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;

import com.codahale.metrics.MetricRegistry;
import com.google.common.util.concurrent.ListenableFuture;
import com.palantir.rangefeed.CatchUpScanner;
import com.palantir.rangefeed.Key;
import com.palantir.rangefeed.RangeFeedCheckpoint;
import com.palantir.rangefeed.RangeFeedEventSink;
import com.palantir.rangefeed.RangeFeedException;
import com.palantir.rangefeed.RangeFeedValue;
import com.palantir.rangefeed.Span;
import com.palantir.rangefeed.Timestamp;
import java.io.IOException;
import java.time.Duration;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

public final class RegistrationTest {
    private static final Span SPAN = Span.of("a", "m");
    private static final Duration TIMEOUT = Duration.ofSeconds(5);

    private final ExecutorService executor = Executors.newCachedThreadPool();
    private final MetricRegistry metricRegistry = new MetricRegistry();
    private final RangeFeedMetrics metrics = RangeFeedMetrics.create(metricRegistry, SPAN);
    private final TestStream stream = new TestStream();

    @AfterEach
    public void after() {
        executor.shutdownNow();
    }

    @Test
    public void deliversMatchingValuesAndCheckpointsInOrder() throws Exception {
        Registration registration = registration(ts(1), CatchUpScanner.NO_HISTORY, 16);
        registration.startOutput(executor);

        registration.publishValue(value("c", 6));
        registration.publishValue(value("s", 6));
        registration.publishCheckpoint(ts(7));
        registration.sync().get();

        assertThat(stream.events())
                .containsExactly(value("c", 6), RangeFeedCheckpoint.of(SPAN, ts(7)));
        assertThat(metricRegistry.meter(MetricRegistry.name(Processor.class, "valuesPublished")).getCount())
                .isEqualTo(1);
    }

    @Test
    public void skipsEventsBeforeStartTimestamp() throws Exception {
        Registration registration = registration(ts(10), CatchUpScanner.NO_HISTORY, 16);
        registration.startOutput(executor);

        registration.publishValue(value("c", 9));
        registration.publishCheckpoint(ts(9));
        registration.publishValue(value("c", 10));
        registration.publishCheckpoint(ts(10));
        registration.sync().get();

        assertThat(stream.events()).containsExactly(value("c", 10), RangeFeedCheckpoint.of(SPAN, ts(10)));
    }

    @Test
    public void catchUpScanIsDeliveredBeforeBufferedLiveEvents() throws Exception {
        CountDownLatch scanStarted = new CountDownLatch(1);
        CountDownLatch releaseScan = new CountDownLatch(1);
        CatchUpScanner scanner = (span, start, consumer) -> {
            scanStarted.countDown();
            releaseScan.await();
            consumer.accept(value("b", 2));
            consumer.accept(value("d", 3));
        };
        Registration registration = registration(ts(1), scanner, 16);
        registration.startOutput(executor);
        scanStarted.await();

        registration.publishValue(value("e", 4));
        registration.publishCheckpoint(ts(4));
        ListenableFuture<Void> synced = registration.sync();
        assertThat(synced).isNotDone();

        releaseScan.countDown();
        synced.get();
        assertThat(stream.events())
                .containsExactly(value("b", 2), value("d", 3), value("e", 4), RangeFeedCheckpoint.of(SPAN, ts(4)));
    }

    @Test
    public void overflowingBufferDisconnectsWithOverflowError() throws Exception {
        Registration registration = registration(ts(1), CatchUpScanner.NO_HISTORY, 2);

        registration.publishValue(value("c", 2));
        registration.publishValue(value("c", 3));
        assertThat(registration.isDisconnected()).isFalse();

        registration.publishValue(value("c", 4));
        assertThat(registration.isDisconnected()).isTrue();
        assertThat(registration.error().get().reason()).isEqualTo(RangeFeedException.Reason.BUFFER_OVERFLOW);
        assertThat(metricRegistry.counter(MetricRegistry.name(Processor.class, "disconnects")).getCount())
                .isEqualTo(1);
    }

    @Test
    public void syncMarkersDoNotTakeBufferCapacity() throws Exception {
        Registration registration = registration(ts(1), CatchUpScanner.NO_HISTORY, 2);

        registration.publishValue(value("c", 2));
        registration.publishValue(value("c", 3));
        ListenableFuture<Void> firstSync = registration.sync();
        ListenableFuture<Void> secondSync = registration.sync();
        assertThat(registration.isDisconnected()).isFalse();
        assertThat(firstSync).isNotDone();

        registration.startOutput(executor);
        assertThat(secondSync).succeedsWithin(TIMEOUT);
        assertThat(firstSync).isDone();
        assertThat(stream.events()).containsExactly(value("c", 2), value("c", 3));

        registration.publishValue(value("c", 4));
        registration.publishValue(value("c", 5));
        registration.sync().get();
        assertThat(registration.isDisconnected()).isFalse();
        assertThat(stream.events()).hasSize(4);
    }

    @Test
    public void failingSinkDisconnectsWithSendFailure() throws Exception {
        RangeFeedEventSink sink = mock(RangeFeedEventSink.class);
        IOException failure = new IOException("broken pipe");
        doThrow(failure).when(sink).send(any());
        Registration registration =
                new Registration(SPAN, ts(1), sink, CatchUpScanner.NO_HISTORY, 16, metrics);
        registration.startOutput(executor);

        registration.publishValue(value("c", 2));

        RangeFeedException error = registration.error().get();
        assertThat(error.reason()).isEqualTo(RangeFeedException.Reason.SEND_FAILED);
        assertThat(error).hasCause(failure);
    }

    @Test
    public void failingCatchUpScanDisconnects() throws Exception {
        IllegalStateException failure = new IllegalStateException("scan failed");
        Registration registration = registration(
                ts(1),
                (span, start, consumer) -> {
                    throw failure;
                },
                16);
        registration.startOutput(executor);

        RangeFeedException error = registration.error().get();
        assertThat(error.reason()).isEqualTo(RangeFeedException.Reason.CATCH_UP_SCAN_FAILED);
        assertThat(error).hasCause(failure);
    }

    @Test
    public void disconnectDeliversOnlyTheFirstError() throws Exception {
        Registration registration = registration(ts(1), CatchUpScanner.NO_HISTORY, 16);
        registration.startOutput(executor);

        RangeFeedException first = RangeFeedException.processorStopped();
        registration.disconnect(first);
        registration.disconnect(RangeFeedException.of(RangeFeedException.Reason.STREAM_CANCELLED));

        assertThat(registration.error().get()).isSameAs(first);
    }

    @Test
    public void cancelledStreamIsDisconnectedOnCheck() throws Exception {
        Registration registration = registration(ts(1), CatchUpScanner.NO_HISTORY, 16);
        assertThat(registration.checkStream()).isFalse();

        stream.cancel();
        assertThat(registration.checkStream()).isTrue();
        assertThat(registration.error().get().reason()).isEqualTo(RangeFeedException.Reason.STREAM_CANCELLED);
    }

    @Test
    public void syncCompletesWhenDisconnected() {
        Registration registration = registration(ts(1), CatchUpScanner.NO_HISTORY, 16);
        ListenableFuture<Void> pending = registration.sync();
        assertThat(pending).isNotDone();

        registration.disconnect(RangeFeedException.processorStopped());
        assertThat(pending).succeedsWithin(TIMEOUT);
        assertThat(registration.sync()).isDone();
    }

    @Test
    public void publishingAfterDisconnectIsIgnored() {
        Registration registration = registration(ts(1), CatchUpScanner.NO_HISTORY, 16);
        registration.startOutput(executor);
        registration.disconnect(RangeFeedException.processorStopped());

        registration.publishValue(value("c", 2));
        assertThat(stream.events()).isEmpty();
    }

    private Registration registration(Timestamp start, CatchUpScanner scanner, int bufferSize) {
        return new Registration(SPAN, start, stream, scanner, bufferSize, metrics);
    }

    private static RangeFeedValue value(String key, long wallTime) {
        return RangeFeedValue.of(Key.of(key), new byte[] {(byte) wallTime}, ts(wallTime));
    }

    private static Timestamp ts(long wallTime) {
        return Timestamp.ofWallTime(wallTime);
    }
}
