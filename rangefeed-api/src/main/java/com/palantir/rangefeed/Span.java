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

import com.palantir.logsafe.Preconditions;
import com.palantir.logsafe.Unsafe;
import com.palantir.logsafe.UnsafeArg;
import java.util.Optional;
import org.immutables.value.Value;

/**
 * A half-open key range {@code [key, endKey)}. An empty end key denotes the single key {@code key}.
 */
@Unsafe
@Value.Immutable
public abstract class Span {

    @Value.Parameter
    public abstract Key key();

    @Value.Parameter
    public abstract Key endKey();

    @Value.Check
    protected void check() {
        Preconditions.checkArgument(
                endKey().isEmpty() || key().compareTo(endKey()) < 0,
                "Span start must sort before its end",
                UnsafeArg.of("key", key()),
                UnsafeArg.of("endKey", endKey()));
    }

    public static Span of(Key key, Key endKey) {
        return ImmutableSpan.of(key, endKey);
    }

    public static Span of(String key, String endKey) {
        return of(Key.of(key), Key.of(endKey));
    }

    public static Span singleKey(Key key) {
        return of(key, Key.MIN);
    }

    /**
     * Exclusive upper bound of the keys covered by this span.
     */
    public Key exclusiveEnd() {
        return endKey().isEmpty() ? key().next() : endKey();
    }

    public boolean containsKey(Key candidate) {
        return key().compareTo(candidate) <= 0 && candidate.compareTo(exclusiveEnd()) < 0;
    }

    public boolean contains(Span other) {
        return key().compareTo(other.key()) <= 0 && other.exclusiveEnd().compareTo(exclusiveEnd()) <= 0;
    }

    public boolean overlaps(Span other) {
        return key().compareTo(other.exclusiveEnd()) < 0 && other.key().compareTo(exclusiveEnd()) < 0;
    }

    /**
     * Returns the keys covered by both spans, or empty if they are disjoint. A span contained in the other is
     * returned as given.
     */
    public Optional<Span> intersect(Span other) {
        if (!overlaps(other)) {
            return Optional.empty();
        }
        if (contains(other)) {
            return Optional.of(other);
        }
        if (other.contains(this)) {
            return Optional.of(this);
        }
        Key start = key().compareTo(other.key()) >= 0 ? key() : other.key();
        Key end = exclusiveEnd().compareTo(other.exclusiveEnd()) <= 0 ? exclusiveEnd() : other.exclusiveEnd();
        return Optional.of(of(start, end));
    }

    @Override
    public String toString() {
        if (endKey().isEmpty()) {
            return key().toString();
        }
        return "[" + key() + ", " + endKey() + ")";
    }
}
