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
 * A transaction laid down a provisional write in the range.
 */
@Value.Immutable
public interface WriteIntentOp extends LogicalOp {

    @Value.Parameter
    UUID txnId();

    @Value.Parameter
    Timestamp timestamp();

    static WriteIntentOp of(UUID txnId, Timestamp timestamp) {
        return ImmutableWriteIntentOp.of(txnId, timestamp);
    }

    @Override
    default <T> T accept(Visitor<T> visitor) {
        return visitor.visit(this);
    }
}
