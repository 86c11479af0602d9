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

import com.google.common.collect.ImmutableList;
import com.google.common.util.concurrent.ListenableFuture;
import com.google.common.util.concurrent.SettableFuture;
import com.palantir.logsafe.logger.SafeLogger;
import com.palantir.logsafe.logger.SafeLoggerFactory;
import java.util.ArrayList;
import java.util.List;
import javax.annotation.concurrent.GuardedBy;
import javax.annotation.concurrent.ThreadSafe;

/**
 * Lifecycle owner for a group of components. Stopping runs every registered closer exactly once; closers added
 * after the stop has begun run immediately.
 */
@ThreadSafe
public final class Stopper {
    private static final SafeLogger log = SafeLoggerFactory.get(Stopper.class);

    private final SettableFuture<Void> stopped = SettableFuture.create();

    @GuardedBy("this")
    private final List<Runnable> closers = new ArrayList<>();

    @GuardedBy("this")
    private boolean stopping = false;

    public void addCloser(Runnable closer) {
        synchronized (this) {
            if (!stopping) {
                closers.add(closer);
                return;
            }
        }
        runCloser(closer);
    }

    public void stop() {
        List<Runnable> toRun;
        synchronized (this) {
            if (stopping) {
                return;
            }
            stopping = true;
            toRun = ImmutableList.copyOf(closers);
            closers.clear();
        }
        toRun.forEach(Stopper::runCloser);
        stopped.set(null);
    }

    public synchronized boolean isStopping() {
        return stopping;
    }

    /**
     * Completes once every closer registered before {@link #stop()} was called has run.
     */
    public ListenableFuture<Void> stopped() {
        return stopped;
    }

    private static void runCloser(Runnable closer) {
        try {
            closer.run();
        } catch (RuntimeException e) {
            log.warn("Closer failed while stopping", e);
        }
    }
}
