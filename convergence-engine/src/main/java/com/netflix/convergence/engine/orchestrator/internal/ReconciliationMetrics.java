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

package com.netflix.convergence.engine.orchestrator.internal;

import java.util.concurrent.TimeUnit;

import com.netflix.convergence.api.model.ReconcileAction;
import com.netflix.convergence.common.runtime.ConvergenceRuntime;
import com.netflix.convergence.engine.orchestrator.ReconciliationError;
import com.netflix.convergence.engine.orchestrator.ReconciliationOutcome;
import com.netflix.spectator.api.Clock;
import com.netflix.spectator.api.Id;
import com.netflix.spectator.api.Registry;
import com.netflix.spectator.api.patterns.PolledMeter;

class ReconciliationMetrics {

    static final String ROOT_NAME = "convergence.reconciler.";
    static final String PASSES = ROOT_NAME + "passes";
    static final String ACTIONS = ROOT_NAME + "actions";
    static final String ERRORS = ROOT_NAME + "errors";
    static final String SINCE_LAST_PASS = ROOT_NAME + "sinceLastPass";

    private final Registry registry;
    private final Clock clock;

    private final Id passesId;
    private final Id actionsId;
    private final Id errorsId;
    private final Id sinceLastPassId;

    private volatile long lastPassTimestamp;

    ReconciliationMetrics(ConvergenceRuntime runtime) {
        this.registry = runtime.getRegistry();
        this.clock = runtime.getClock();
        this.lastPassTimestamp = clock.wallTime();

        this.passesId = registry.createId(PASSES);
        this.actionsId = registry.createId(ACTIONS);
        this.errorsId = registry.createId(ERRORS);
        this.sinceLastPassId = registry.createId(SINCE_LAST_PASS);

        PolledMeter.using(registry).withId(sinceLastPassId).monitorValue(this, self -> self.clock.wallTime() - self.lastPassTimestamp);
    }

    void shutdown() {
        PolledMeter.remove(registry, sinceLastPassId);
    }

    void passCompleted(ReconciliationOutcome outcome, long executionTimeNs) {
        registry.timer(passesId.withTag("status", outcome.getStatus().name())).record(executionTimeNs, TimeUnit.NANOSECONDS);
        lastPassTimestamp = clock.wallTime();
    }

    void actionApplied(String managerName, ReconcileAction action) {
        actionCounter(managerName, action, "applied");
    }

    void actionSkipped(String managerName, ReconcileAction action) {
        actionCounter(managerName, action, "dryRun");
    }

    void actionFailed(String managerName, ReconcileAction action) {
        actionCounter(managerName, action, "failed");
    }

    void error(ReconciliationError error) {
        registry.counter(errorsId
                .withTag("manager", error.getManagerName())
                .withTag("kind", error.getKind().name())
        ).increment();
    }

    private void actionCounter(String managerName, ReconcileAction action, String result) {
        registry.counter(actionsId
                .withTag("manager", managerName)
                .withTag("kind", action.getKind().name())
                .withTag("objectType", action.getType().getName())
                .withTag("result", result)
        ).increment();
    }
}
