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

import java.util.function.Consumer;

/**
 * Reads the committed history of a span so that a new subscriber sees every value from its start timestamp up
 * to the point at which it begins receiving live events.
 */
public interface CatchUpScanner {
    CatchUpScanner NO_HISTORY = (span, startTimestamp, consumer) -> {};

    /**
     * Passes every committed value in {@code span} with a timestamp at or above {@code startTimestamp} to
     * {@code consumer}, returning once the scan is complete.
     */
    void scan(Span span, Timestamp startTimestamp, Consumer<RangeFeedValue> consumer) throws Exception;
}
