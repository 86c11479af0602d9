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

import com.codahale.metrics.MetricRegistry;
import com.google.common.annotations.VisibleForTesting;
import com.google.common.collect.ImmutableList;
import com.google.common.util.concurrent.FutureCallback;
import com.google.common.util.concurrent.Futures;
import com.google.common.util.concurrent.ListenableFuture;
import com.google.common.util.concurrent.SettableFuture;
import com.lmax.disruptor.BlockingWaitStrategy;
import com.lmax.disruptor.EventTranslatorOneArg;
import com.lmax.disruptor.ExceptionHandler;
import com.lmax.disruptor.RingBuffer;
import com.lmax.disruptor.TimeoutException;
import com.lmax.disruptor.dsl.Disruptor;
import com.lmax.disruptor.dsl.ProducerType;
import com.palantir.logsafe.Preconditions;
import com.palantir.logsafe.SafeArg;
import com.palantir.logsafe.UnsafeArg;
import com.palantir.logsafe.exceptions.SafeIllegalArgumentException;
import com.palantir.logsafe.exceptions.SafeIllegalStateException;
import com.palantir.logsafe.logger.SafeLogger;
import com.palantir.logsafe.logger.SafeLoggerFactory;
import com.palantir.rangefeed.AbortIntentOp;
import com.palantir.rangefeed.CatchUpScanner;
import com.palantir.rangefeed.CommitIntentOp;
import com.palantir.rangefeed.IntentPusher;
import com.palantir.rangefeed.LogicalOp;
import com.palantir.rangefeed.PushedTransaction;
import com.palantir.rangefeed.RangeFeedEventSink;
import com.palantir.rangefeed.RangeFeedException;
import com.palantir.rangefeed.RangeFeedValue;
import com.palantir.rangefeed.Span;
import com.palantir.rangefeed.Timestamp;
import com.palantir.rangefeed.TrackedIntent;
import com.palantir.rangefeed.UpdateIntentOp;
import com.palantir.rangefeed.WriteIntentOp;
import com.palantir.rangefeed.WriteValueOp;
import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;
import java.util.concurrent.locks.LockSupport;
import javax.annotation.Nullable;
import javax.annotation.concurrent.ThreadSafe;

/**
 * Streams the logical operations applied to a range to every registered subscriber, together with checkpoints of
 * the range's resolved timestamp.
 *
 * All processor state is owned by a single event loop thread consuming a bounded ring buffer. Public methods only
 * publish messages onto the ring buffer, so they are safe to call from any thread, including concurrently with
 * {@link #stop()}.
 */
@ThreadSafe
public final class Processor {
    private static final SafeLogger log = SafeLoggerFactory.get(Processor.class);

    private static final long PUBLISH_BACKOFF_NANOS = TimeUnit.MICROSECONDS.toNanos(100);

    private static final EventTranslatorOneArg<MessageSlot, ProcessorMessage> TRANSLATOR =
            (slot, sequence, message) -> slot.message = message;

    enum State {
        UNSTARTED,
        RUNNING,
        STOPPED
    }

    private final Span span;
    private final Clock clock;
    private final ProcessorConfig config;
    private final CatchUpScanner catchUpScanner;
    private final IntentPusher intentPusher;
    private final RangeFeedMetrics metrics;

    private final Disruptor<MessageSlot> disruptor;
    private final RingBuffer<MessageSlot> ringBuffer;
    private final ScheduledExecutorService ticker;
    private final ExecutorService outputExecutor;

    private final AtomicReference<State> state = new AtomicReference<>(State.UNSTARTED);
    private final AtomicBoolean stopRequested = new AtomicBoolean(false);
    private final SettableFuture<Void> terminated = SettableFuture.create();

    // Confined to the event loop thread.
    private final Registry registry = new Registry();
    private final ResolvedTimestamp resolvedTimestamp = new ResolvedTimestamp();
    private final ProcessorMessage.Visitor<Void> runningHandler = new RunningHandler();
    private final ProcessorMessage.Visitor<Void> stoppedHandler = new StoppedHandler();
    private boolean pushInFlight = false;

    private Processor(Builder builder) {
        this.span = builder.span;
        this.clock = builder.clock;
        this.config = builder.config;
        this.catchUpScanner = builder.catchUpScanner;
        this.intentPusher = builder.intentPusher;
        this.metrics = RangeFeedMetrics.create(builder.metricRegistry, builder.span);

        this.disruptor = new Disruptor<>(
                MessageSlot::new,
                config.ringBufferSize(),
                new NamedThreadFactory("rangefeed-processor", true),
                ProducerType.MULTI,
                new BlockingWaitStrategy());
        this.disruptor.setDefaultExceptionHandler(LoggingExceptionHandler.INSTANCE);
        this.disruptor.handleEventsWith((slot, sequence, endOfBatch) -> handle(slot.consume()));
        this.ringBuffer = disruptor.getRingBuffer();
        this.ticker = Executors.newSingleThreadScheduledExecutor(
                new NamedThreadFactory("rangefeed-processor-ticker", true));
        this.outputExecutor = Executors.newCachedThreadPool(new NamedThreadFactory("rangefeed-registration", true));
    }

    public static Builder builder(Span span) {
        return new Builder(span);
    }

    public Span span() {
        return span;
    }

    /**
     * Starts the event loop. The processor is stopped when {@code stopper} stops.
     *
     * @throws SafeIllegalStateException if this processor was already started or stopped
     */
    public synchronized void start(Stopper stopper) {
        if (state.get() != State.UNSTARTED) {
            throw new SafeIllegalStateException(
                    "A rangefeed processor can only be started once", SafeArg.of("state", state.get()));
        }
        disruptor.start();
        state.set(State.RUNNING);

        long checkStreamsNanos = config.checkStreamsInterval().toNanos();
        ticker.scheduleWithFixedDelay(
                () -> publishTick(ProcessorMessage.Tick.CHECK_STREAMS),
                checkStreamsNanos,
                checkStreamsNanos,
                TimeUnit.NANOSECONDS);
        if (config.pushIntentsEnabled()) {
            long pushIntentsNanos = config.pushIntentsInterval().toNanos();
            ticker.scheduleWithFixedDelay(
                    () -> publishTick(ProcessorMessage.Tick.PUSH_INTENTS),
                    pushIntentsNanos,
                    pushIntentsNanos,
                    TimeUnit.NANOSECONDS);
        }
        log.info(
                "Started rangefeed processor",
                UnsafeArg.of("span", span),
                SafeArg.of("ringBufferSize", config.ringBufferSize()));
        stopper.addCloser(this::stop);
    }

    /**
     * Registers a subscriber for the keys of {@code registrationSpan} that lie within this processor's span,
     * starting at {@code startTimestamp}. Events are delivered to {@code sink} once the catch-up scan has finished.
     *
     * @return a future completing with the subscription's terminal error, exactly once
     * @throws SafeIllegalStateException if the processor has not been started
     * @throws SafeIllegalArgumentException if {@code registrationSpan} does not overlap this processor's span
     */
    public ListenableFuture<RangeFeedException> register(
            Span registrationSpan, Timestamp startTimestamp, RangeFeedEventSink sink) {
        if (state.get() == State.UNSTARTED) {
            throw new SafeIllegalStateException("Cannot register with a rangefeed processor that was never started");
        }
        Span clipped = registrationSpan
                .intersect(span)
                .orElseThrow(() -> new SafeIllegalArgumentException(
                        "Registration span does not overlap the processor's span",
                        UnsafeArg.of("registrationSpan", registrationSpan),
                        UnsafeArg.of("processorSpan", span)));
        Registration registration = new Registration(
                clipped, startTimestamp, sink, catchUpScanner, config.registrationBufferSize(), metrics);
        if (!publish(ProcessorMessage.Register.of(registration)) || state.get() == State.STOPPED) {
            registration.disconnect(RangeFeedException.processorStopped());
        }
        return registration.error();
    }

    /**
     * Hands a batch of logical operations, already in timestamp order, to the event loop. Ignored unless the
     * processor is running.
     */
    public void consumeLogicalOps(LogicalOp... ops) {
        consumeLogicalOps(ImmutableList.copyOf(ops));
    }

    public void consumeLogicalOps(List<LogicalOp> ops) {
        if (ops.isEmpty() || !isRunning()) {
            return;
        }
        publish(ProcessorMessage.ConsumeOps.of(ops));
    }

    /**
     * Informs the processor that no new writes can be proposed at or below {@code closedTimestamp}. Ignored unless
     * the processor is running.
     */
    public void forwardClosedTimestamp(Timestamp closedTimestamp) {
        if (!isRunning()) {
            return;
        }
        publish(ProcessorMessage.ForwardClosedTimestamp.of(closedTimestamp));
    }

    /**
     * The number of live registrations, or zero if the processor is not running.
     */
    public int len() {
        if (!isRunning()) {
            return 0;
        }
        SettableFuture<Integer> result = SettableFuture.create();
        if (!publish(ProcessorMessage.Len.of(result)) || state.get() == State.STOPPED) {
            result.set(0);
        }
        return Futures.getUnchecked(result);
    }

    /**
     * The number of transactions with outstanding intents, or zero if the processor is not running.
     */
    public int intentQueueLength() {
        if (!isRunning()) {
            return 0;
        }
        SettableFuture<Integer> result = SettableFuture.create();
        if (!publish(ProcessorMessage.IntentCount.of(result)) || state.get() == State.STOPPED) {
            result.set(0);
        }
        return Futures.getUnchecked(result);
    }

    /**
     * Stops the processor, disconnecting every registration with a "processor stopped" error. Idempotent.
     */
    public void stop() {
        stopInternal(Optional.empty());
    }

    /**
     * Stops the processor, delivering {@code cause} to every registration. Idempotent; only the first stop takes
     * effect.
     */
    public void stopWithError(Throwable cause) {
        stopInternal(Optional.of(cause));
    }

    /**
     * Completes once the event loop thread has exited.
     */
    public ListenableFuture<Void> terminated() {
        return terminated;
    }

    /**
     * Blocks until every message published before this call has been processed and every registration has handed
     * the events it had buffered to its sink.
     */
    @VisibleForTesting
    void syncEventQueue() {
        if (!isRunning()) {
            return;
        }
        SettableFuture<Void> done = SettableFuture.create();
        if (!publish(ProcessorMessage.Sync.of(done)) || state.get() == State.STOPPED) {
            done.set(null);
        }
        Futures.getUnchecked(done);
    }

    @VisibleForTesting
    State state() {
        return state.get();
    }

    private boolean isRunning() {
        return state.get() == State.RUNNING;
    }

    private void stopInternal(Optional<Throwable> cause) {
        if (!stopRequested.compareAndSet(false, true)) {
            return;
        }
        synchronized (this) {
            if (state.get() == State.UNSTARTED) {
                state.set(State.STOPPED);
                ticker.shutdownNow();
                outputExecutor.shutdown();
                metrics.unregisterGauges();
                terminated.set(null);
                return;
            }
        }
        publish(ProcessorMessage.Stop.of(cause));
    }

    /**
     * Publishes onto the ring buffer, backing off while it is full.
     *
     * @return false if the processor stopped before the message could be published
     */
    private boolean publish(ProcessorMessage message) {
        while (isRunning()) {
            if (ringBuffer.tryPublishEvent(TRANSLATOR, message)) {
                return true;
            }
            LockSupport.parkNanos(PUBLISH_BACKOFF_NANOS);
        }
        return false;
    }

    private void publishTick(ProcessorMessage.Tick tick) {
        // Ticks are periodic, so one dropped while the ring buffer is full is not missed.
        if (isRunning()) {
            ringBuffer.tryPublishEvent(TRANSLATOR, tick);
        }
    }

    private void handle(ProcessorMessage message) {
        try {
            if (isRunning()) {
                message.accept(runningHandler);
                metrics.updateSnapshot(registry.size(), resolvedTimestamp.intentCount());
            } else {
                message.accept(stoppedHandler);
            }
        } catch (RuntimeException e) {
            log.error(
                    "Failed to handle a rangefeed processor message",
                    SafeArg.of("messageType", message.getClass().getSimpleName()),
                    e);
            message.abandon(e);
        }
    }

    private void publishCheckpoint() {
        registry.publishCheckpoint(resolvedTimestamp.get());
    }

    private void pushOldIntents() {
        if (pushInFlight) {
            return;
        }
        Timestamp threshold = toTimestamp(clock.instant().minus(config.pushIntentsAge()));
        List<TrackedIntent> oldIntents = resolvedTimestamp.intentsOlderThan(threshold);
        if (oldIntents.isEmpty()) {
            return;
        }
        ListenableFuture<List<PushedTransaction>> pushed;
        try {
            pushed = Futures.withTimeout(
                    intentPusher.push(oldIntents),
                    config.pushIntentsTimeout().toNanos(),
                    TimeUnit.NANOSECONDS,
                    ticker);
        } catch (RuntimeException e) {
            log.warn("Failed to push old intents", SafeArg.of("intents", oldIntents.size()), e);
            return;
        }
        pushInFlight = true;
        Futures.addCallback(
                pushed,
                new FutureCallback<List<PushedTransaction>>() {
                    @Override
                    public void onSuccess(List<PushedTransaction> results) {
                        publish(ProcessorMessage.PushResults.of(results));
                    }

                    @Override
                    public void onFailure(Throwable throwable) {
                        log.warn("Failed to push old intents", SafeArg.of("intents", oldIntents.size()), throwable);
                        publish(ProcessorMessage.PushResults.of(ImmutableList.of()));
                    }
                },
                this::executePushCallback);
    }

    private void executePushCallback(Runnable callback) {
        try {
            outputExecutor.execute(callback);
        } catch (RejectedExecutionException e) {
            log.debug("Dropping intent push results after the processor stopped", e);
        }
    }

    private void terminate() {
        try {
            disruptor.shutdown(config.shutdownTimeout().toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            log.warn(
                    "Rangefeed processor event loop did not drain in time; halting it",
                    SafeArg.of("shutdownTimeout", config.shutdownTimeout()),
                    e);
            disruptor.halt();
        }
        outputExecutor.shutdown();
        metrics.unregisterGauges();
        terminated.set(null);
    }

    private static Timestamp toTimestamp(Instant instant) {
        long nanos = TimeUnit.SECONDS.toNanos(instant.getEpochSecond()) + instant.getNano();
        return Timestamp.ofWallTime(Math.max(0, nanos));
    }

    private final class RunningHandler implements ProcessorMessage.Visitor<Void> {
        private final LogicalOp.Visitor<Optional<RangeFeedValue>> valueExtractor = new ValueExtractor();

        @Override
        public Void visit(ProcessorMessage.ConsumeOps message) {
            metrics.markLogicalOps(message.ops().size());
            for (LogicalOp op : message.ops()) {
                boolean advanced = resolvedTimestamp.consumeLogicalOp(op);
                op.accept(valueExtractor).ifPresent(registry::publishValue);
                if (advanced) {
                    publishCheckpoint();
                }
            }
            return null;
        }

        @Override
        public Void visit(ProcessorMessage.ForwardClosedTimestamp message) {
            if (resolvedTimestamp.forwardClosedTimestamp(message.closedTimestamp())) {
                publishCheckpoint();
            }
            return null;
        }

        @Override
        public Void visit(ProcessorMessage.Register message) {
            Registration registration = message.registration();
            if (registration.isDisconnected()) {
                return null;
            }
            registry.register(registration);
            registration.startOutput(outputExecutor);
            log.debug(
                    "Added rangefeed registration",
                    UnsafeArg.of("span", registration.span()),
                    SafeArg.of("startTimestamp", registration.startTimestamp()));
            return null;
        }

        @Override
        public Void visit(ProcessorMessage.Tick tick) {
            switch (tick) {
                case CHECK_STREAMS:
                    registry.checkStreams();
                    break;
                case PUSH_INTENTS:
                    pushOldIntents();
                    break;
            }
            return null;
        }

        @Override
        public Void visit(ProcessorMessage.PushResults message) {
            pushInFlight = false;
            boolean advanced = false;
            for (PushedTransaction result : message.results()) {
                if (result.status() == PushedTransaction.Status.PENDING) {
                    advanced |= resolvedTimestamp.forwardPushedTransaction(result.txnId(), result.timestamp());
                } else {
                    log.debug(
                            "Pushed transaction resolved; awaiting its resolution in the operation log",
                            SafeArg.of("txnId", result.txnId()),
                            SafeArg.of("status", result.status()));
                }
            }
            if (advanced) {
                publishCheckpoint();
            }
            return null;
        }

        @Override
        public Void visit(ProcessorMessage.Sync message) {
            message.done().setFuture(registry.sync());
            return null;
        }

        @Override
        public Void visit(ProcessorMessage.Len message) {
            registry.removeDisconnected();
            message.result().set(registry.size());
            return null;
        }

        @Override
        public Void visit(ProcessorMessage.IntentCount message) {
            message.result().set(resolvedTimestamp.intentCount());
            return null;
        }

        @Override
        public Void visit(ProcessorMessage.Stop message) {
            RangeFeedException cause = message.cause()
                    .map(Processor::toRangeFeedException)
                    .orElseGet(RangeFeedException::processorStopped);
            int disconnected = registry.size();
            registry.disconnectAll(cause);
            ticker.shutdownNow();
            state.set(State.STOPPED);
            log.info(
                    "Stopped rangefeed processor",
                    UnsafeArg.of("span", span),
                    SafeArg.of("reason", cause.reason()),
                    SafeArg.of("disconnectedRegistrations", disconnected));
            outputExecutor.execute(Processor.this::terminate);
            return null;
        }
    }

    /**
     * Drains whatever is left on the ring buffer after the processor stopped, releasing anyone waiting on it.
     */
    private final class StoppedHandler implements ProcessorMessage.Visitor<Void> {
        @Override
        public Void visit(ProcessorMessage.ConsumeOps message) {
            return null;
        }

        @Override
        public Void visit(ProcessorMessage.ForwardClosedTimestamp message) {
            return null;
        }

        @Override
        public Void visit(ProcessorMessage.Register message) {
            message.registration().disconnect(RangeFeedException.processorStopped());
            return null;
        }

        @Override
        public Void visit(ProcessorMessage.Tick tick) {
            return null;
        }

        @Override
        public Void visit(ProcessorMessage.PushResults message) {
            return null;
        }

        @Override
        public Void visit(ProcessorMessage.Sync message) {
            message.done().set(null);
            return null;
        }

        @Override
        public Void visit(ProcessorMessage.Len message) {
            message.result().set(0);
            return null;
        }

        @Override
        public Void visit(ProcessorMessage.IntentCount message) {
            message.result().set(0);
            return null;
        }

        @Override
        public Void visit(ProcessorMessage.Stop message) {
            return null;
        }
    }

    private static RangeFeedException toRangeFeedException(Throwable cause) {
        if (cause instanceof RangeFeedException) {
            return (RangeFeedException) cause;
        }
        return RangeFeedException.of(RangeFeedException.Reason.PROCESSOR_FAILED, cause);
    }

    /**
     * Extracts the value a logical op makes visible, if any.
     */
    private static final class ValueExtractor implements LogicalOp.Visitor<Optional<RangeFeedValue>> {
        @Override
        public Optional<RangeFeedValue> visit(WriteValueOp op) {
            return Optional.of(RangeFeedValue.of(op.key(), op.value(), op.timestamp()));
        }

        @Override
        public Optional<RangeFeedValue> visit(WriteIntentOp op) {
            return Optional.empty();
        }

        @Override
        public Optional<RangeFeedValue> visit(UpdateIntentOp op) {
            return Optional.empty();
        }

        @Override
        public Optional<RangeFeedValue> visit(CommitIntentOp op) {
            return Optional.of(RangeFeedValue.of(op.key(), op.value(), op.timestamp()));
        }

        @Override
        public Optional<RangeFeedValue> visit(AbortIntentOp op) {
            return Optional.empty();
        }
    }

    private static final class MessageSlot {
        @Nullable
        private ProcessorMessage message;

        /**
         * Hands out the message and clears the slot, so the message is not retained until the slot is reused.
         */
        ProcessorMessage consume() {
            ProcessorMessage result = message;
            message = null;
            return result;
        }
    }

    private enum LoggingExceptionHandler implements ExceptionHandler<MessageSlot> {
        INSTANCE;

        @Override
        public void handleEventException(Throwable ex, long sequence, MessageSlot event) {
            log.error("Rangefeed processor event loop failed", SafeArg.of("sequence", sequence), ex);
        }

        @Override
        public void handleOnStartException(Throwable ex) {
            log.error("Rangefeed processor event loop failed to start", ex);
        }

        @Override
        public void handleOnShutdownException(Throwable ex) {
            log.error("Rangefeed processor event loop failed to shut down", ex);
        }
    }

    public static final class Builder {
        private final Span span;
        private Clock clock = Clock.systemUTC();
        private ProcessorConfig config = ProcessorConfig.defaultConfig();
        private CatchUpScanner catchUpScanner = CatchUpScanner.NO_HISTORY;
        private IntentPusher intentPusher = IntentPusher.NO_OP;
        private MetricRegistry metricRegistry = new MetricRegistry();

        private Builder(Span span) {
            this.span = span;
        }

        public Builder clock(Clock value) {
            this.clock = value;
            return this;
        }

        public Builder config(ProcessorConfig value) {
            this.config = value;
            return this;
        }

        public Builder catchUpScanner(CatchUpScanner value) {
            this.catchUpScanner = value;
            return this;
        }

        public Builder intentPusher(IntentPusher value) {
            this.intentPusher = value;
            return this;
        }

        public Builder metricRegistry(MetricRegistry value) {
            this.metricRegistry = value;
            return this;
        }

        public Processor build() {
            Preconditions.checkNotNull(span, "span");
            return new Processor(this);
        }
    }
}
