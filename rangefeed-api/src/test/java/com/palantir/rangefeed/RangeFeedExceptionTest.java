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

import com.palantir.logsafe.SafeArg;
import org.junit.jupiter.api.Test;

public final class RangeFeedExceptionTest {

    @Test
    public void carriesReasonAsSafeArg() {
        assertThatLoggableExceptionThrownBy(() -> {
                    throw RangeFeedException.of(RangeFeedException.Reason.BUFFER_OVERFLOW);
                })
                .hasLogMessage("The subscriber fell too far behind and its buffer overflowed")
                .hasExactlyArgs(SafeArg.of("reason", RangeFeedException.Reason.BUFFER_OVERFLOW));
    }

    @Test
    public void retainsCause() {
        IllegalStateException cause = new IllegalStateException("boom");
        RangeFeedException exception = RangeFeedException.of(RangeFeedException.Reason.PROCESSOR_FAILED, cause);
        assertThat(exception).hasCause(cause);
        assertThat(exception.reason()).isEqualTo(RangeFeedException.Reason.PROCESSOR_FAILED);
    }

    @Test
    public void processorStoppedHasNoCause() {
        assertThat(RangeFeedException.processorStopped().reason())
                .isEqualTo(RangeFeedException.Reason.PROCESSOR_STOPPED);
        assertThat(RangeFeedException.processorStopped()).hasNoCause();
    }
}
