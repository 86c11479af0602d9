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

import com.google.common.collect.ImmutableList;
import com.google.common.collect.Ordering;
import com.google.common.collect.TreeMultimap;
import com.palantir.logsafe.SafeArg;
import com.palantir.logsafe.logger.SafeLogger;
import com.palantir.logsafe.logger.SafeLoggerFactory;
import com.palantir.rangefeed.Timestamp;
import com.palantir.rangefeed.TrackedIntent;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import javax.annotation.concurrent.NotThreadSafe;

/**
 * Outstanding transactions with intents in the range, indexed by their earliest known timestamp. A transaction
 * holding intents on several keys is a single entry whose reference count is the number of unresolved intents.
 */
@NotThreadSafe
final class IntentQueue {
    private static final SafeLogger log = SafeLoggerFactory.get(IntentQueue.class);

    private final Map<UUID, Entry> entries = new HashMap<>();
    private final TreeMultimap<Timestamp, UUID> byTimestamp = TreeMultimap.create(Ordering.natural(), Ordering.natural());

    /**
     * Records an intent written by {@code txnId}. A transaction already tracked gains a reference and its
     * timestamp is forwarded to {@code timestamp} if that is later.
     */
    void add(UUID txnId, Timestamp timestamp) {
        Entry entry = entries.get(txnId);
        if (entry == null) {
            entries.put(txnId, new Entry(timestamp));
            byTimestamp.put(timestamp, txnId);
            return;
        }
        entry.refCount++;
        forward(txnId, entry, timestamp);
    }

    /**
     * Forwards the timestamp of {@code txnId} without adding a reference. An untracked transaction is added.
     */
    void update(UUID txnId, Timestamp timestamp) {
        Entry entry = entries.get(txnId);
        if (entry == null) {
            log.debug("Update for an untracked transaction; tracking it", SafeArg.of("txnId", txnId));
            add(txnId, timestamp);
            return;
        }
        forward(txnId, entry, timestamp);
    }

    /**
     * Applies a timestamp learned out of band, only if {@code txnId} is still tracked.
     *
     * @return whether the transaction was tracked
     */
    boolean forwardIfTracked(UUID txnId, Timestamp timestamp) {
        Entry entry = entries.get(txnId);
        if (entry == null) {
            return false;
        }
        forward(txnId, entry, timestamp);
        return true;
    }

    /**
     * Resolves one intent of {@code txnId}. Once the transaction commits, its commit timestamp replaces any
     * timestamp derived from earlier updates for the intents that remain.
     */
    void commit(UUID txnId, Timestamp commitTimestamp) {
        Entry entry = decrement(txnId);
        if (entry != null && !entry.timestamp.equals(commitTimestamp)) {
            reindex(txnId, entry, commitTimestamp);
        }
    }

    /**
     * Resolves one intent of {@code txnId} without a timestamp, as for an abort.
     */
    void remove(UUID txnId) {
        decrement(txnId);
    }

    Optional<Timestamp> oldestTimestamp() {
        return byTimestamp.isEmpty() ? Optional.empty() : Optional.of(byTimestamp.keySet().first());
    }

    /**
     * Transactions whose timestamp is strictly before {@code threshold}, oldest first.
     */
    List<TrackedIntent> olderThan(Timestamp threshold) {
        ImmutableList.Builder<TrackedIntent> result = ImmutableList.builder();
        byTimestamp.asMap().headMap(threshold, false).forEach((timestamp, txnIds) -> {
            for (UUID txnId : txnIds) {
                result.add(TrackedIntent.of(txnId, timestamp));
            }
        });
        return result.build();
    }

    int len() {
        return entries.size();
    }

    private Entry decrement(UUID txnId) {
        Entry entry = entries.get(txnId);
        if (entry == null) {
            log.debug("Resolution for an untracked transaction; ignoring", SafeArg.of("txnId", txnId));
            return null;
        }
        entry.refCount--;
        if (entry.refCount <= 0) {
            entries.remove(txnId);
            byTimestamp.remove(entry.timestamp, txnId);
            return null;
        }
        return entry;
    }

    private void forward(UUID txnId, Entry entry, Timestamp timestamp) {
        if (timestamp.isAfter(entry.timestamp)) {
            reindex(txnId, entry, timestamp);
        }
    }

    private void reindex(UUID txnId, Entry entry, Timestamp timestamp) {
        byTimestamp.remove(entry.timestamp, txnId);
        entry.timestamp = timestamp;
        byTimestamp.put(timestamp, txnId);
    }

    private static final class Entry {
        private Timestamp timestamp;
        private int refCount = 1;

        private Entry(Timestamp timestamp) {
            this.timestamp = timestamp;
        }
    }
}
