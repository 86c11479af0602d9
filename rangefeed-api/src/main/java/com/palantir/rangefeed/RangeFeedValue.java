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

import com.palantir.logsafe.Unsafe;
import org.immutables.value.Value;

@Unsafe
@Value.Immutable
public abstract class RangeFeedValue implements RangeFeedEvent {

    @Value.Parameter
    public abstract Key key();

    @Value.Parameter
    public abstract byte[] value();

    @Value.Parameter
    public abstract Timestamp timestamp();

    public static RangeFeedValue of(Key key, byte[] value, Timestamp timestamp) {
        return ImmutableRangeFeedValue.of(key, value, timestamp);
    }

    @Override
    public <T> T accept(Visitor<T> visitor) {
        return visitor.visit(this);
    }
}
