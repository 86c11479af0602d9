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

import org.immutables.value.Value;

/**
 * Every committed value in {@link #span()} with a timestamp at or below {@link #resolvedTimestamp()} has been
 * delivered to the subscriber.
 */
@Value.Immutable
public interface RangeFeedCheckpoint extends RangeFeedEvent {

    @Value.Parameter
    Span span();

    @Value.Parameter
    Timestamp resolvedTimestamp();

    static RangeFeedCheckpoint of(Span span, Timestamp resolvedTimestamp) {
        return ImmutableRangeFeedCheckpoint.of(span, resolvedTimestamp);
    }

    @Override
    default <T> T accept(Visitor<T> visitor) {
        return visitor.visit(this);
    }
}
