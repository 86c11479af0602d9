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

import com.google.common.util.concurrent.SettableFuture;
import com.palantir.rangefeed.LogicalOp;
import com.palantir.rangefeed.PushedTransaction;
import com.palantir.rangefeed.Timestamp;
import java.util.List;
import java.util.Optional;
import org.immutables.value.Value;

/**
 * A request to the processor's event loop. Producers publish these onto the ring buffer; only the loop thread
 * acts on them.
 */
interface ProcessorMessage {

    <T> T accept(Visitor<T> visitor);

    /**
     * Called if handling this message failed, so that a caller waiting on it is released.
     */
    default void abandon(Throwable failure) {}

    interface Visitor<T> {
        T visit(ConsumeOps message);

        T visit(ForwardClosedTimestamp message);

        T visit(Register message);

        T visit(Tick tick);

        T visit(PushResults message);

        T visit(Sync message);

        T visit(Len message);

        T visit(IntentCount message);

        T visit(Stop message);
    }

    enum Tick implements ProcessorMessage {
        CHECK_STREAMS,
        PUSH_INTENTS;

        @Override
        public <T> T accept(Visitor<T> visitor) {
            return visitor.visit(this);
        }
    }

    @Value.Immutable
    interface ConsumeOps extends ProcessorMessage {
        @Value.Parameter
        List<LogicalOp> ops();

        static ConsumeOps of(List<LogicalOp> ops) {
            return ImmutableConsumeOps.of(ops);
        }

        @Override
        default <T> T accept(Visitor<T> visitor) {
            return visitor.visit(this);
        }
    }

    @Value.Immutable
    interface ForwardClosedTimestamp extends ProcessorMessage {
        @Value.Parameter
        Timestamp closedTimestamp();

        static ForwardClosedTimestamp of(Timestamp closedTimestamp) {
            return ImmutableForwardClosedTimestamp.of(closedTimestamp);
        }

        @Override
        default <T> T accept(Visitor<T> visitor) {
            return visitor.visit(this);
        }
    }

    @Value.Immutable
    interface Register extends ProcessorMessage {
        @Value.Parameter
        Registration registration();

        static Register of(Registration registration) {
            return ImmutableRegister.of(registration);
        }

        @Override
        default <T> T accept(Visitor<T> visitor) {
            return visitor.visit(this);
        }
    }

    @Value.Immutable
    interface PushResults extends ProcessorMessage {
        @Value.Parameter
        List<PushedTransaction> results();

        static PushResults of(List<PushedTransaction> results) {
            return ImmutablePushResults.of(results);
        }

        @Override
        default <T> T accept(Visitor<T> visitor) {
            return visitor.visit(this);
        }
    }

    @Value.Immutable
    interface Sync extends ProcessorMessage {
        @Value.Parameter
        SettableFuture<Void> done();

        static Sync of(SettableFuture<Void> done) {
            return ImmutableSync.of(done);
        }

        @Override
        default <T> T accept(Visitor<T> visitor) {
            return visitor.visit(this);
        }

        @Override
        default void abandon(Throwable failure) {
            done().setException(failure);
        }
    }

    @Value.Immutable
    interface Len extends ProcessorMessage {
        @Value.Parameter
        SettableFuture<Integer> result();

        static Len of(SettableFuture<Integer> result) {
            return ImmutableLen.of(result);
        }

        @Override
        default <T> T accept(Visitor<T> visitor) {
            return visitor.visit(this);
        }

        @Override
        default void abandon(Throwable failure) {
            result().setException(failure);
        }
    }

    @Value.Immutable
    interface IntentCount extends ProcessorMessage {
        @Value.Parameter
        SettableFuture<Integer> result();

        static IntentCount of(SettableFuture<Integer> result) {
            return ImmutableIntentCount.of(result);
        }

        @Override
        default <T> T accept(Visitor<T> visitor) {
            return visitor.visit(this);
        }

        @Override
        default void abandon(Throwable failure) {
            result().setException(failure);
        }
    }

    @Value.Immutable
    interface Stop extends ProcessorMessage {
        @Value.Parameter
        Optional<Throwable> cause();

        static Stop of(Optional<Throwable> cause) {
            return ImmutableStop.of(cause);
        }

        @Override
        default <T> T accept(Visitor<T> visitor) {
            return visitor.visit(this);
        }
    }
}
