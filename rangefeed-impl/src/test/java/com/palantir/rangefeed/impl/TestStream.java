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
import com.palantir.rangefeed.RangeFeedEvent;
import com.palantir.rangefeed.RangeFeedEventSink;
import java.util.ArrayList;
import java.util.List;
import javax.annotation.concurrent.GuardedBy;

/**
 * Records every event it is sent, and can be cancelled like a real subscriber stream.
 */
final class TestStream implements RangeFeedEventSink {
    @GuardedBy("this")
    private final List<RangeFeedEvent> events = new ArrayList<>();

    private volatile boolean cancelled = false;

    @Override
    public synchronized void send(RangeFeedEvent event) {
        events.add(event);
    }

    @Override
    public boolean isCancelled() {
        return cancelled;
    }

    void cancel() {
        cancelled = true;
    }

    /**
     * Returns the events received since the last call.
     */
    synchronized List<RangeFeedEvent> drain() {
        List<RangeFeedEvent> result = ImmutableList.copyOf(events);
        events.clear();
        return result;
    }

    synchronized List<RangeFeedEvent> events() {
        return ImmutableList.copyOf(events);
    }
}
