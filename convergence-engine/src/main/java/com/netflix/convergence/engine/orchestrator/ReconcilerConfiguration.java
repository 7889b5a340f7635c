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

import com.netflix.archaius.api.annotations.Configuration;
import com.netflix.archaius.api.annotations.DefaultValue;

@Configuration(prefix = "convergence.reconciler")
public interface ReconcilerConfiguration {

    /**
     * @return maximum number of resource managers evaluated at the same time. With the default of 1 managers run
     * one after another, in registration order.
     */
    @DefaultValue("1")
    int getManagerConcurrency();

    /**
     * @return if true, actions are computed and reported as attempted, but never sent to the store
     */
    @DefaultValue("false")
    boolean isDryRunEnabled();

    /**
     * @return time after which a pass stops starting new managers and actions, and completes as cancelled
     */
    @DefaultValue("60000")
    long getPassTimeoutMs();
}
