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

/**
 * The outbound stream of a single subscriber, implemented by the transport layer.
 *
 * Calls to {@link #send(RangeFeedEvent)} for one sink are made from a single thread at a time and may block;
 * they never happen on the processor's event loop.
 */
public interface RangeFeedEventSink {

    /**
     * Delivers an event to the subscriber. Throwing terminates the subscription with a send failure.
     */
    void send(RangeFeedEvent event) throws Exception;

    /**
     * Whether the subscriber has gone away. Polled periodically; a cancelled sink is disconnected.
     */
    boolean isCancelled();
}
