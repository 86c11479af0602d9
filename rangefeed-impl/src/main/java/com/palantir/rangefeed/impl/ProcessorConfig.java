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

package com.palantir.rangefeed.impl;

import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import com.fasterxml.jackson.databind.annotation.JsonSerialize;
import com.google.common.math.IntMath;
import com.palantir.logsafe.Preconditions;
import com.palantir.logsafe.SafeArg;
import java.time.Duration;
import org.immutables.value.Value;

@JsonDeserialize(as = ImmutableProcessorConfig.class)
@JsonSerialize(as = ImmutableProcessorConfig.class)
@Value.Immutable
public abstract class ProcessorConfig {
    private static final int MAX_EVENT_CHANNEL_CAPACITY = 1 << 24;

    /**
     * Number of inbound messages that may be queued for the event loop before producers stall. Rounded up to the
     * next power of two.
     */
    @Value.Default
    public int eventChannelCapacity() {
        return 4096;
    }

    /**
     * Number of events buffered per subscriber. A subscriber that falls further behind is disconnected.
     */
    @Value.Default
    public int registrationBufferSize() {
        return 4096;
    }

    /**
     * How often subscriber streams are checked for cancellation.
     */
    @Value.Default
    public Duration checkStreamsInterval() {
        return Duration.ofSeconds(1);
    }

    /**
     * How often old intents are pushed. Zero disables pushing.
     */
    @Value.Default
    public Duration pushIntentsInterval() {
        return Duration.ofMillis(250);
    }

    /**
     * Intents older than this, relative to the processor's clock, are pushed.
     */
    @Value.Default
    public Duration pushIntentsAge() {
        return Duration.ofSeconds(10);
    }

    /**
     * How long a push may take before it is abandoned and the next push is allowed.
     */
    @Value.Default
    public Duration pushIntentsTimeout() {
        return Duration.ofSeconds(10);
    }

    @Value.Default
    public Duration shutdownTimeout() {
        return Duration.ofSeconds(10);
    }

    public int ringBufferSize() {
        return IntMath.ceilingPowerOfTwo(eventChannelCapacity());
    }

    public boolean pushIntentsEnabled() {
        return !pushIntentsInterval().isZero();
    }

    @Value.Check
    protected void check() {
        Preconditions.checkArgument(
                eventChannelCapacity() > 0 && eventChannelCapacity() <= MAX_EVENT_CHANNEL_CAPACITY,
                "Event channel capacity must be positive and at most 2^24",
                SafeArg.of("eventChannelCapacity", eventChannelCapacity()));
        Preconditions.checkArgument(
                registrationBufferSize() > 0,
                "Registration buffer size must be positive",
                SafeArg.of("registrationBufferSize", registrationBufferSize()));
        Preconditions.checkArgument(
                !checkStreamsInterval().isNegative() && !checkStreamsInterval().isZero(),
                "Stream check interval must be positive",
                SafeArg.of("checkStreamsInterval", checkStreamsInterval()));
        Preconditions.checkArgument(
                !pushIntentsInterval().isNegative() && !pushIntentsAge().isNegative(),
                "Intent push settings must not be negative",
                SafeArg.of("pushIntentsInterval", pushIntentsInterval()),
                SafeArg.of("pushIntentsAge", pushIntentsAge()));
        Preconditions.checkArgument(
                !pushIntentsTimeout().isNegative() && !pushIntentsTimeout().isZero(),
                "Intent push timeout must be positive",
                SafeArg.of("pushIntentsTimeout", pushIntentsTimeout()));
        Preconditions.checkArgument(
                !shutdownTimeout().isNegative(),
                "Shutdown timeout must not be negative",
                SafeArg.of("shutdownTimeout", shutdownTimeout()));
    }

    public static ProcessorConfig defaultConfig() {
        return ImmutableProcessorConfig.builder().build();
    }

    public static ImmutableProcessorConfig.Builder builder() {
        return ImmutableProcessorConfig.builder();
    }
}
