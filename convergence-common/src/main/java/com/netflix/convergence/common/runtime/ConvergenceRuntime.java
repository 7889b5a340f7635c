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


package com.netflix.convergence.common.runtime;

import com.netflix.spectator.api.Clock;
import com.netflix.spectator.api.Registry;

/**
 * Process-level services shared by all reconciliation components. Passed explicitly to every component
 * that needs it, so tests can substitute a manual clock or an isolated metrics registry.
 */
public interface ConvergenceRuntime {

    /**
     * Spectator registry all engine metrics are registered with.
     */
    Registry getRegistry();

    /**
     * The registry clock. Pass deadlines and durations are measured with it, so meters and timeouts agree.
     */
    Clock getClock();
}
