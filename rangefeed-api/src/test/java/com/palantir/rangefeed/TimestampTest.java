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

import static com.palantir.logsafe.testing.Assertions.assertThatLoggableExceptionThrownBy;
import static org.assertj.core.api.Assertions.assertThat;

import com.palantir.logsafe.exceptions.SafeIllegalArgumentException;
import com.palantir.logsafe.exceptions.SafeIllegalStateException;
import org.junit.jupiter.api.Test;

public final class TimestampTest {

    @Test
    public void ordersByWallTimeThenLogical() {
        assertThat(Timestamp.of(1, 5)).isLessThan(Timestamp.of(2, 0));
        assertThat(Timestamp.of(2, 0)).isLessThan(Timestamp.of(2, 1));
        assertThat(Timestamp.of(3, 3)).isEqualByComparingTo(Timestamp.of(3, 3));
        assertThat(Timestamp.ZERO).isLessThan(Timestamp.of(0, 1));
    }

    @Test
    public void prevDecrementsLogicalWhenPositive() {
        assertThat(Timestamp.of(10, 3).prev()).isEqualTo(Timestamp.of(10, 2));
    }

    @Test
    public void prevFloorsToPreviousWallTimeWhenLogicalIsZero() {
        assertThat(Timestamp.ofWallTime(10).prev()).isEqualTo(Timestamp.ofWallTime(9));
        assertThat(Timestamp.of(0, 1).prev()).isEqualTo(Timestamp.ZERO);
    }

    @Test
    public void zeroHasNoPredecessor() {
        assertThatLoggableExceptionThrownBy(Timestamp.ZERO::prev)
                .isInstanceOf(SafeIllegalStateException.class)
                .hasLogMessage("The zero timestamp has no predecessor");
    }

    @Test
    public void nextIncrementsLogical() {
        assertThat(Timestamp.ofWallTime(4).next()).isEqualTo(Timestamp.of(4, 1));
    }

    @Test
    public void forwardKeepsTheLaterTimestamp() {
        Timestamp early = Timestamp.ofWallTime(5);
        Timestamp late = Timestamp.of(5, 1);
        assertThat(early.forward(late)).isEqualTo(late);
        assertThat(late.forward(early)).isEqualTo(late);
        assertThat(Timestamp.min(early, late)).isEqualTo(early);
    }

    @Test
    public void rejectsNegativeComponents() {
        assertThatLoggableExceptionThrownBy(() -> Timestamp.of(-1, 0))
                .isInstanceOf(SafeIllegalArgumentException.class)
                .hasLogMessage("Timestamp components must be non-negative");
    }
}
