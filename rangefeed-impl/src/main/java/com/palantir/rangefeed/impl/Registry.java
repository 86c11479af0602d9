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

import com.google.common.util.concurrent.Futures;
import com.google.common.util.concurrent.ListenableFuture;
import com.google.common.util.concurrent.MoreExecutors;
import com.palantir.rangefeed.RangeFeedException;
import com.palantir.rangefeed.RangeFeedValue;
import com.palantir.rangefeed.Timestamp;
import java.util.ArrayList;
import java.util.List;
import javax.annotation.concurrent.NotThreadSafe;

/**
 * The live registrations of a processor. Only the event loop touches this.
 */
@NotThreadSafe
final class Registry {
    private final List<Registration> registrations = new ArrayList<>();

    void register(Registration registration) {
        registrations.add(registration);
    }

    void publishValue(RangeFeedValue value) {
        for (Registration registration : registrations) {
            registration.publishValue(value);
        }
    }

    void publishCheckpoint(Timestamp resolvedTimestamp) {
        for (Registration registration : registrations) {
            registration.publishCheckpoint(resolvedTimestamp);
        }
    }

    /**
     * Disconnects registrations whose stream was cancelled and drops every disconnected registration.
     */
    void checkStreams() {
        registrations.removeIf(Registration::checkStream);
    }

    void removeDisconnected() {
        registrations.removeIf(Registration::isDisconnected);
    }

    void disconnectAll(RangeFeedException cause) {
        for (Registration registration : registrations) {
            registration.disconnect(cause);
        }
        registrations.clear();
    }

    ListenableFuture<Void> sync() {
        List<ListenableFuture<Void>> markers = new ArrayList<>(registrations.size());
        for (Registration registration : registrations) {
            markers.add(registration.sync());
        }
        return Futures.whenAllComplete(markers).call(() -> null, MoreExecutors.directExecutor());
    }

    int size() {
        return registrations.size();
    }
}
