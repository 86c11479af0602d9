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

import com.palantir.logsafe.SafeArg;
import com.palantir.logsafe.logger.SafeLogger;
import com.palantir.logsafe.logger.SafeLoggerFactory;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicLong;

/**
 * A {@link ThreadFactory} producing threads named <i>prefix</i>-<i>sequence_number</i>, where the sequence
 * number counts up from zero, which log any exception that escapes them.
 */
final class NamedThreadFactory implements ThreadFactory {
    private static final SafeLogger log = SafeLoggerFactory.get(NamedThreadFactory.class);

    private final String prefix;
    private final boolean isDaemon;
    private final AtomicLong count = new AtomicLong();
    private final ThreadFactory threadFactory = Executors.defaultThreadFactory();

    NamedThreadFactory(String prefix, boolean isDaemon) {
        this.prefix = prefix;
        this.isDaemon = isDaemon;
    }

    @Override
    public Thread newThread(Runnable runnable) {
        Thread thread = threadFactory.newThread(runnable);
        thread.setName(prefix + "-" + count.getAndIncrement());
        thread.setDaemon(isDaemon);
        thread.setUncaughtExceptionHandler((failed, throwable) -> log.error(
                "Uncaught exception in rangefeed thread", SafeArg.of("threadName", failed.getName()), throwable));
        return thread;
    }
}
