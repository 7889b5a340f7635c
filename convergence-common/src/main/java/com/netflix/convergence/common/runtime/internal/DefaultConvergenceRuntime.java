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


package com.netflix.convergence.common.runtime.internal;

import javax.inject.Inject;
import javax.inject.Singleton;

import com.netflix.convergence.common.runtime.ConvergenceRuntime;
import com.netflix.spectator.api.Clock;
import com.netflix.spectator.api.Registry;

@Singleton
public class DefaultConvergenceRuntime implements ConvergenceRuntime {

    private final Registry registry;

    @Inject
    public DefaultConvergenceRuntime(Registry registry) {
        this.registry = registry;
    }

    @Override
    public Registry getRegistry() {
        return registry;
    }

    @Override
    public Clock getClock() {
        return registry.clock();
    }
}
