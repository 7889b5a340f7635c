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
import java.util.Objects;
import java.util.Optional;

import com.google.common.collect.ImmutableList;
import com.netflix.convergence.api.model.ObjectIdentity;

/**
 * Aggregated result of one reconciliation pass over all registered resource managers. Manager results are listed
 * in manager registration order, regardless of how the managers were scheduled.
 */
public final class ReconciliationOutcome {

    public enum Status {
        /**
         * Every manager ran, and every planned action was applied.
         */
        Completed,

        /**
         * Every manager ran, but at least one manager or action failed.
         */
        CompletedWithErrors,

        /**
         * The pass was cancelled, or ran past its timeout. Some managers or actions were not attempted.
         */
        Cancelled,

        /**
         * A configuration defect stopped the pass. No further managers were started.
         */
        Aborted
    }

    private final ObjectIdentity target;
    private final Status status;
    private final List<ManagerResult> managerResults;
    private final List<ReconciliationError> errors;
    private final int attemptedCount;
    private final int appliedCount;
    private final long durationMs;

    private ReconciliationOutcome(ObjectIdentity target,
                                  Status status,
                                  List<ManagerResult> managerResults,
                                  List<ReconciliationError> errors,
                                  int attemptedCount,
                                  int appliedCount,
                                  long durationMs) {
        this.target = target;
        this.status = status;
        this.managerResults = managerResults;
        this.errors = errors;
        this.attemptedCount = attemptedCount;
        this.appliedCount = appliedCount;
        this.durationMs = durationMs;
    }

    public ObjectIdentity getTarget() {
        return target;
    }

    public Status getStatus() {
        return status;
    }

    public List<ManagerResult> getManagerResults() {
        return managerResults;
    }

    public Optional<ManagerResult> findManagerResult(String managerName) {
        return managerResults.stream().filter(r -> r.getManagerName().equals(managerName)).findFirst();
    }

    /**
     * All errors of the pass, grouped by manager in registration order.
     */
    public List<ReconciliationError> getErrors() {
        return errors;
    }

    public int getAttemptedCount() {
        return attemptedCount;
    }

    public int getAppliedCount() {
        return appliedCount;
    }

    public long getDurationMs() {
        return durationMs;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        ReconciliationOutcome that = (ReconciliationOutcome) o;
        return attemptedCount == that.attemptedCount &&
                appliedCount == that.appliedCount &&
                durationMs == that.durationMs &&
                Objects.equals(target, that.target) &&
                status == that.status &&
                Objects.equals(managerResults, that.managerResults) &&
                Objects.equals(errors, that.errors);
    }

    @Override
    public int hashCode() {
        return Objects.hash(target, status, managerResults, errors, attemptedCount, appliedCount, durationMs);
    }

    @Override
    public String toString() {
        return "ReconciliationOutcome{" +
                "target=" + target +
                ", status=" + status +
                ", attempted=" + attemptedCount +
                ", applied=" + appliedCount +
                ", durationMs=" + durationMs +
                ", managerResults=" + managerResults +
                '}';
    }

    public static ReconciliationOutcome of(ObjectIdentity target, List<ManagerResult> managerResults, long durationMs) {
        ImmutableList.Builder<ReconciliationError> errors = ImmutableList.builder();
        int attempted = 0;
        int applied = 0;
        boolean aborted = false;
        boolean cancelled = false;
        for (ManagerResult result : managerResults) {
            errors.addAll(result.getErrors());
            attempted += result.getAttemptedActions().size();
            applied += result.getAppliedActions().size();
            aborted |= result.getState() == ManagerResult.State.Aborted;
            cancelled |= result.getState() == ManagerResult.State.Cancelled || result.getState() == ManagerResult.State.Skipped;
        }
        List<ReconciliationError> allErrors = errors.build();

        Status status;
        if (aborted) {
            status = Status.Aborted;
        } else if (cancelled) {
            status = Status.Cancelled;
        } else if (!allErrors.isEmpty()) {
            status = Status.CompletedWithErrors;
        } else {
            status = Status.Completed;
        }
        return new ReconciliationOutcome(target, status, ImmutableList.copyOf(managerResults), allErrors, attempted, applied, durationMs);
    }
}
