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

package com.palantir.rangefeed;

import java.util.UUID;
import org.immutables.value.Value;

/**
 * The outcome of pushing a single transaction.
 */
@Value.Immutable
public interface PushedTransaction {
    enum Status {
        PENDING,
        COMMITTED,
        ABORTED
    }

    @Value.Parameter
    UUID txnId();

    @Value.Parameter
    Status status();

    /**
     * For a pending transaction, the timestamp it was pushed to; otherwise the timestamp it resolved at.
     */
    @Value.Parameter
    Timestamp timestamp();

    static PushedTransaction of(UUID txnId, Status status, Timestamp timestamp) {
        return ImmutablePushedTransaction.of(txnId, status, timestamp);
    }

    static PushedTransaction pending(UUID txnId, Timestamp pushedTo) {
        return of(txnId, Status.PENDING, pushedTo);
    }
}
