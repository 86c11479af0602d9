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

import com.google.common.collect.ComparisonChain;
import com.palantir.logsafe.Preconditions;
import com.palantir.logsafe.SafeArg;
import org.immutables.value.Value;

/**
 * A hybrid-logical timestamp: a wall clock reading in nanoseconds plus a logical counter that orders events
 * sharing the same wall time.
 */
@Value.Immutable
public abstract class Timestamp implements Comparable<Timestamp> {
    public static final Timestamp ZERO = of(0, 0);

    @Value.Parameter
    public abstract long wallTime();

    @Value.Parameter
    public abstract int logical();

    @Value.Check
    protected void check() {
        Preconditions.checkArgument(
                wallTime() >= 0 && logical() >= 0,
                "Timestamp components must be non-negative",
                SafeArg.of("wallTime", wallTime()),
                SafeArg.of("logical", logical()));
    }

    public static Timestamp of(long wallTime, int logical) {
        return ImmutableTimestamp.of(wallTime, logical);
    }

    public static Timestamp ofWallTime(long wallTime) {
        return of(wallTime, 0);
    }

    public boolean isZero() {
        return wallTime() == 0 && logical() == 0;
    }

    public boolean isBefore(Timestamp other) {
        return compareTo(other) < 0;
    }

    public boolean isAfter(Timestamp other) {
        return compareTo(other) > 0;
    }

    public Timestamp next() {
        return of(wallTime(), logical() + 1);
    }

    /**
     * Returns the greatest timestamp strictly below this one on the wall-time grid: the logical component is
     * decremented when positive, otherwise the wall time is decremented and the logical component stays zero.
     */
    public Timestamp prev() {
        if (logical() > 0) {
            return of(wallTime(), logical() - 1);
        }
        Preconditions.checkState(wallTime() > 0, "The zero timestamp has no predecessor");
        return of(wallTime() - 1, 0);
    }

    public Timestamp forward(Timestamp other) {
        return other.isAfter(this) ? other : this;
    }

    public static Timestamp min(Timestamp first, Timestamp second) {
        return first.compareTo(second) <= 0 ? first : second;
    }

    @Override
    public int compareTo(Timestamp other) {
        return ComparisonChain.start()
                .compare(wallTime(), other.wallTime())
                .compare(logical(), other.logical())
                .result();
    }

    @Override
    public String toString() {
        return wallTime() + "," + logical();
    }
}
