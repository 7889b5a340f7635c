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

import java.util.List;

import com.netflix.convergence.api.model.ReconciliationTarget;
import com.netflix.convergence.api.service.ResourceManager;
import reactor.core.publisher.Mono;

/**
 * Runs reconciliation passes over a fixed list of resource managers. A pass never throws: every failure, including
 * a configuration defect, is reported in the returned {@link ReconciliationOutcome}.
 *
 * @param <S> desired-state type
 */
public interface ReconciliationOrchestrator<S> {

    /**
     * Registered managers, in registration order.
     */
    List<ResourceManager<S>> getManagers();

    default ReconciliationOutcome reconcile(ReconciliationTarget<S> target) {
        return reconcile(target, CancellationSignal.newSignal());
    }

    /**
     * Runs one full pass, blocking the calling thread until it completes.
     */
    ReconciliationOutcome reconcile(ReconciliationTarget<S> target, CancellationSignal cancellation);

    /**
     * Runs one full pass off the caller thread. Disposing the subscription cancels the pass, with the
     * same semantics as {@link CancellationSignal#cancel()}.
     */
    Mono<ReconciliationOutcome> reconcileAsync(ReconciliationTarget<S> target);

    void shutdown();
}
