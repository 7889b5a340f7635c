/*
 * Copyright 2021 Netflix, Inc.
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

package com.netflix.convergence.engine.orchestrator;

import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Cooperative cancellation of a reconciliation pass. Checked before each manager starts and before each action is
 * issued. An action already sent to the store is never interrupted.
 */
public final class CancellationSignal {

    private final AtomicBoolean cancelled = new AtomicBoolean();

    private CancellationSignal() {
    }

    public void cancel() {
        cancelled.set(true);
    }

    public boolean isCancelled() {
        return cancelled.get();
    }

    @Override
    public String toString() {
        return "CancellationSignal{cancelled=" + cancelled.get() + '}';
    }

    public static CancellationSignal newSignal() {
        return new CancellationSignal();
    }
}
