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

import com.google.common.util.concurrent.Futures;
import com.google.common.util.concurrent.ListenableFuture;
import java.util.List;

/**
 * Attempts to move old transactions along so that their intents stop holding back the resolved timestamp.
 * Results are advisory: a transaction is only considered resolved once its commit or abort is observed in the
 * logical operation log.
 */
public interface IntentPusher {
    IntentPusher NO_OP = intents -> Futures.immediateFuture(List.of());

    ListenableFuture<List<PushedTransaction>> push(List<TrackedIntent> intents);
}
