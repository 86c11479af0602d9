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

import com.google.errorprone.annotations.CanIgnoreReturnValue;
import com.palantir.logsafe.SafeArg;
import com.palantir.logsafe.logger.SafeLogger;
import com.palantir.logsafe.logger.SafeLoggerFactory;
import com.palantir.rangefeed.AbortIntentOp;
import com.palantir.rangefeed.CommitIntentOp;
import com.palantir.rangefeed.LogicalOp;
import com.palantir.rangefeed.Timestamp;
import com.palantir.rangefeed.TrackedIntent;
import com.palantir.rangefeed.UpdateIntentOp;
import com.palantir.rangefeed.WriteIntentOp;
import com.palantir.rangefeed.WriteValueOp;
import java.util.List;
import java.util.UUID;
import javax.annotation.concurrent.NotThreadSafe;

/**
 * Derives the resolved timestamp of the range from the closed timestamp and the outstanding intents.
 *
 * The resolved timestamp is the closed timestamp when no intents are outstanding, and otherwise the smaller of
 * the closed timestamp and the timestamp immediately preceding the oldest outstanding intent. It never moves
 * backwards.
 */
@NotThreadSafe
final class ResolvedTimestamp {
    private static final SafeLogger log = SafeLoggerFactory.get(ResolvedTimestamp.class);

    private final IntentQueue intentQueue = new IntentQueue();
    private final LogicalOp.Visitor<Timestamp> intentTracker = new IntentTracker();

    private Timestamp closedTimestamp = Timestamp.ZERO;
    private Timestamp resolvedTimestamp = Timestamp.ZERO;

    /**
     * @return whether the resolved timestamp advanced
     */
    @CanIgnoreReturnValue
    boolean forwardClosedTimestamp(Timestamp timestamp) {
        closedTimestamp = closedTimestamp.forward(timestamp);
        return recompute();
    }

    /**
     * @return whether the resolved timestamp advanced
     */
    @CanIgnoreReturnValue
    boolean consumeLogicalOp(LogicalOp op) {
        Timestamp opTimestamp = op.accept(intentTracker);
        if (opTimestamp != null && !opTimestamp.isAfter(resolvedTimestamp)) {
            log.warn(
                    "Observed a logical op at or below the resolved timestamp",
                    SafeArg.of("opTimestamp", opTimestamp),
                    SafeArg.of("resolvedTimestamp", resolvedTimestamp));
        }
        return recompute();
    }

    /**
     * Applies a timestamp that a still-pending transaction was pushed to.
     *
     * @return whether the resolved timestamp advanced
     */
    boolean forwardPushedTransaction(UUID txnId, Timestamp pushedTo) {
        if (!intentQueue.forwardIfTracked(txnId, pushedTo)) {
            return false;
        }
        return recompute();
    }

    Timestamp get() {
        return resolvedTimestamp;
    }

    Timestamp closedTimestamp() {
        return closedTimestamp;
    }

    int intentCount() {
        return intentQueue.len();
    }

    List<TrackedIntent> intentsOlderThan(Timestamp threshold) {
        return intentQueue.olderThan(threshold);
    }

    private boolean recompute() {
        Timestamp candidate = intentQueue
                .oldestTimestamp()
                .map(oldest -> Timestamp.min(closedTimestamp, floorPrev(oldest)))
                .orElse(closedTimestamp);
        if (candidate.isAfter(resolvedTimestamp)) {
            resolvedTimestamp = candidate;
            return true;
        }
        return false;
    }

    private static Timestamp floorPrev(Timestamp timestamp) {
        return timestamp.isZero() ? Timestamp.ZERO : timestamp.prev();
    }

    /**
     * Routes intent lifecycle ops into the queue, returning the timestamp the op was written at, if it has one.
     */
    private final class IntentTracker implements LogicalOp.Visitor<Timestamp> {
        @Override
        public Timestamp visit(WriteValueOp op) {
            return op.timestamp();
        }

        @Override
        public Timestamp visit(WriteIntentOp op) {
            intentQueue.add(op.txnId(), op.timestamp());
            return op.timestamp();
        }

        @Override
        public Timestamp visit(UpdateIntentOp op) {
            intentQueue.update(op.txnId(), op.timestamp());
            return op.timestamp();
        }

        @Override
        public Timestamp visit(CommitIntentOp op) {
            intentQueue.commit(op.txnId(), op.timestamp());
            return op.timestamp();
        }

        @Override
        public Timestamp visit(AbortIntentOp op) {
            intentQueue.remove(op.txnId());
            return null;
        }
    }
}
