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

import com.netflix.convergence.common.runtime.internal.DefaultConvergenceRuntime;
import com.netflix.spectator.api.DefaultRegistry;
import com.netflix.spectator.api.ManualClock;
import com.netflix.spectator.api.Registry;

public final class ConvergenceRuntimes {

    private ConvergenceRuntimes() {
    }

    public static ConvergenceRuntime internal() {
        return new DefaultConvergenceRuntime(new DefaultRegistry());
    }

    public static ConvergenceRuntime internal(Registry registry) {
        return new DefaultConvergenceRuntime(registry);
    }

    public static ConvergenceRuntime test(ManualClock clock) {
        return new DefaultConvergenceRuntime(new DefaultRegistry(clock));
    }
}
