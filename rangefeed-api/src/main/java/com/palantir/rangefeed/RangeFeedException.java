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

import com.palantir.logsafe.Arg;
import com.palantir.logsafe.Safe;
import com.palantir.logsafe.SafeArg;
import com.palantir.logsafe.SafeLoggable;
import java.util.List;
import javax.annotation.Nullable;

/**
 * The terminal error of a subscription. Every subscriber receives exactly one.
 */
public final class RangeFeedException extends RuntimeException implements SafeLoggable {

    public enum Reason {
        PROCESSOR_STOPPED("The rangefeed processor was stopped"),
        PROCESSOR_FAILED("The rangefeed processor was stopped with an error"),
        STREAM_CANCELLED("The subscriber cancelled its stream"),
        BUFFER_OVERFLOW("The subscriber fell too far behind and its buffer overflowed"),
        SEND_FAILED("Sending an event to the subscriber failed"),
        CATCH_UP_SCAN_FAILED("The catch-up scan for the subscriber failed");

        private final String message;

        Reason(@Safe String message) {
            this.message = message;
        }
    }

    private final Reason reason;

    private RangeFeedException(Reason reason, @Nullable Throwable cause) {
        super(reason.message, cause);
        this.reason = reason;
    }

    public static RangeFeedException of(Reason reason) {
        return new RangeFeedException(reason, null);
    }

    public static RangeFeedException of(Reason reason, Throwable cause) {
        return new RangeFeedException(reason, cause);
    }

    public static RangeFeedException processorStopped() {
        return of(Reason.PROCESSOR_STOPPED);
    }

    public Reason reason() {
        return reason;
    }

    @Override
    @Safe
    public String getLogMessage() {
        return reason.message;
    }

    @Override
    public List<Arg<?>> getArgs() {
        return List.of(SafeArg.of("reason", reason));
    }
}
