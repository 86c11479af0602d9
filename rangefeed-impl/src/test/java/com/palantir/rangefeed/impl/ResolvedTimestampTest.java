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

import com.palantir.rangefeed.AbortIntentOp;
import com.palantir.rangefeed.CommitIntentOp;
import com.palantir.rangefeed.Key;
import com.palantir.rangefeed.LogicalOp;
import com.palantir.rangefeed.Timestamp;
import com.palantir.rangefeed.UpdateIntentOp;
import com.palantir.rangefeed.WriteIntentOp;
import com.palantir.rangefeed.WriteValueOp;
import java.util.ArrayList;
import java.util.List;
import java.util.Random;
import java.util.UUID;
import org.junit.jupiter.api.Test;

public final class ResolvedTimestampTest {
    private static final byte[] VALUE = {1};
    private static final UUID TXN_1 = UUID.randomUUID();
    private static final UUID TXN_2 = UUID.randomUUID();

    private final ResolvedTimestamp resolvedTimestamp = new ResolvedTimestamp();

    @Test
    public void followsClosedTimestampWithoutIntents() {
        assertThat(resolvedTimestamp.forwardClosedTimestamp(ts(5))).isTrue();
        assertThat(resolvedTimestamp.get()).isEqualTo(ts(5));
        assertThat(resolvedTimestamp.closedTimestamp()).isEqualTo(ts(5));
    }

    @Test
    public void closedTimestampNeverRegresses() {
        resolvedTimestamp.forwardClosedTimestamp(ts(10));
        assertThat(resolvedTimestamp.forwardClosedTimestamp(ts(4))).isFalse();
        assertThat(resolvedTimestamp.closedTimestamp()).isEqualTo(ts(10));
        assertThat(resolvedTimestamp.get()).isEqualTo(ts(10));
    }

    @Test
    public void oldestIntentHoldsBackResolvedTimestamp() {
        resolvedTimestamp.consumeLogicalOp(WriteIntentOp.of(TXN_1, ts(10)));
        assertThat(resolvedTimestamp.forwardClosedTimestamp(ts(15))).isTrue();
        assertThat(resolvedTimestamp.get()).isEqualTo(ts(9));
    }

    @Test
    public void updatingTheOldestIntentAdvancesResolvedTimestamp() {
        resolvedTimestamp.consumeLogicalOp(WriteIntentOp.of(TXN_1, ts(10)));
        resolvedTimestamp.forwardClosedTimestamp(ts(15));

        assertThat(resolvedTimestamp.consumeLogicalOp(UpdateIntentOp.of(TXN_1, ts(12))))
                .isTrue();
        assertThat(resolvedTimestamp.get()).isEqualTo(ts(11));
    }

    @Test
    public void committingTheLastIntentReleasesResolvedTimestampToClosedTimestamp() {
        resolvedTimestamp.consumeLogicalOp(WriteIntentOp.of(TXN_1, ts(10)));
        resolvedTimestamp.forwardClosedTimestamp(ts(15));

        assertThat(resolvedTimestamp.consumeLogicalOp(CommitIntentOp.of(TXN_1, Key.of("e"), ts(13), VALUE)))
                .isTrue();
        assertThat(resolvedTimestamp.get()).isEqualTo(ts(15));
        assertThat(resolvedTimestamp.intentCount()).isZero();
    }

    @Test
    public void writeThenAbortLeavesNoIntents() {
        resolvedTimestamp.consumeLogicalOp(WriteIntentOp.of(TXN_1, ts(6)));
        resolvedTimestamp.consumeLogicalOp(AbortIntentOp.of(TXN_1));
        assertThat(resolvedTimestamp.intentCount()).isZero();
    }

    @Test
    public void valueWritesDoNotMoveResolvedTimestamp() {
        resolvedTimestamp.forwardClosedTimestamp(ts(5));
        assertThat(resolvedTimestamp.consumeLogicalOp(WriteValueOp.of(Key.of("c"), ts(6), VALUE)))
                .isFalse();
        assertThat(resolvedTimestamp.get()).isEqualTo(ts(5));
    }

    @Test
    public void resolvedTimestampNeverRegressesWhenAnOlderIntentAppears() {
        resolvedTimestamp.forwardClosedTimestamp(ts(20));
        assertThat(resolvedTimestamp.consumeLogicalOp(WriteIntentOp.of(TXN_1, ts(8))))
                .isFalse();
        assertThat(resolvedTimestamp.get()).isEqualTo(ts(20));
    }

    @Test
    public void resolvedTimestampWaitsForEveryOutstandingTransaction() {
        resolvedTimestamp.consumeLogicalOp(WriteIntentOp.of(TXN_1, ts(10)));
        resolvedTimestamp.consumeLogicalOp(WriteIntentOp.of(TXN_2, ts(12)));
        resolvedTimestamp.forwardClosedTimestamp(ts(30));
        assertThat(resolvedTimestamp.get()).isEqualTo(ts(9));

        resolvedTimestamp.consumeLogicalOp(AbortIntentOp.of(TXN_1));
        assertThat(resolvedTimestamp.get()).isEqualTo(ts(11));

        resolvedTimestamp.consumeLogicalOp(CommitIntentOp.of(TXN_2, Key.of("k"), ts(14), VALUE));
        assertThat(resolvedTimestamp.get()).isEqualTo(ts(30));
    }

    @Test
    public void pushedPendingTransactionAdvancesResolvedTimestamp() {
        resolvedTimestamp.consumeLogicalOp(WriteIntentOp.of(TXN_1, ts(10)));
        resolvedTimestamp.forwardClosedTimestamp(ts(30));

        assertThat(resolvedTimestamp.forwardPushedTransaction(TXN_1, ts(25))).isTrue();
        assertThat(resolvedTimestamp.get()).isEqualTo(ts(24));
        assertThat(resolvedTimestamp.forwardPushedTransaction(TXN_2, ts(40))).isFalse();
    }

    @Test
    public void resolvedTimestampIsMonotonicAndBoundedByClosedTimestampUnderRandomInput() {
        Random random = new Random(0xC0FFEE);
        for (int trial = 0; trial < 50; trial++) {
            ResolvedTimestamp tracker = new ResolvedTimestamp();
            List<UUID> outstanding = new ArrayList<>();
            Timestamp previousResolved = tracker.get();
            Timestamp previousClosed = tracker.closedTimestamp();

            for (int step = 0; step < 500; step++) {
                int choice = random.nextInt(6);
                if (choice == 0) {
                    tracker.forwardClosedTimestamp(ts(random.nextInt(1000)));
                } else {
                    tracker.consumeLogicalOp(randomOp(random, outstanding));
                }

                assertThat(tracker.closedTimestamp()).isGreaterThanOrEqualTo(previousClosed);
                assertThat(tracker.get()).isGreaterThanOrEqualTo(previousResolved);
                assertThat(tracker.get()).isLessThanOrEqualTo(tracker.closedTimestamp());
                previousClosed = tracker.closedTimestamp();
                previousResolved = tracker.get();
            }
        }
    }

    private static LogicalOp randomOp(Random random, List<UUID> outstanding) {
        Timestamp timestamp = ts(1 + random.nextInt(1000));
        if (outstanding.isEmpty() || random.nextInt(3) == 0) {
            UUID txnId = UUID.randomUUID();
            outstanding.add(txnId);
            return WriteIntentOp.of(txnId, timestamp);
        }
        UUID txnId = outstanding.get(random.nextInt(outstanding.size()));
        switch (random.nextInt(4)) {
            case 0:
                return UpdateIntentOp.of(txnId, timestamp);
            case 1:
                outstanding.remove(txnId);
                return AbortIntentOp.of(txnId);
            case 2:
                outstanding.remove(txnId);
                return CommitIntentOp.of(txnId, Key.of("k"), timestamp, VALUE);
            default:
                return WriteValueOp.of(Key.of("v"), timestamp, VALUE);
        }
    }

    private static Timestamp ts(long wallTime) {
        return Timestamp.ofWallTime(wallTime);
    }
}
