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

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import com.netflix.convergence.api.model.ReconcileAction;

/**
 * What happened to one resource manager within a reconciliation pass.
 */
public final class ManagerResult {

    public enum State {
        /**
         * All planned actions were attempted. Some of them may have failed.
         */
        Completed,

        /**
         * No actions were planned, because the required or deployed objects could not be computed.
         */
        Failed,

        /**
         * The pass was cancelled before all planned actions were attempted.
         */
        Cancelled,

        /**
         * The manager never ran, because the pass was cancelled or aborted earlier.
         */
        Skipped,

        /**
         * The manager hit a configuration defect, which aborted the pass.
         */
        Aborted
    }

    private final String managerName;
    private final State state;
    private final List<ReconcileAction> plannedActions;
    private final List<ReconcileAction> attemptedActions;
    private final List<ReconcileAction> appliedActions;
    private final List<ReconciliationError> errors;

    private ManagerResult(String managerName,
                          State state,
                          List<ReconcileAction> plannedActions,
                          List<ReconcileAction> attemptedActions,
                          List<ReconcileAction> appliedActions,
                          List<ReconciliationError> errors) {
        this.managerName = managerName;
        this.state = state;
        this.plannedActions = plannedActions;
        this.attemptedActions = attemptedActions;
        this.appliedActions = appliedActions;
        this.errors = errors;
    }

    public String getManagerName() {
        return managerName;
    }

    public State getState() {
        return state;
    }

    /**
     * Actions the diff engine produced for this manager, in execution order.
     */
    public List<ReconcileAction> getPlannedActions() {
        return plannedActions;
    }

    public List<ReconcileAction> getAttemptedActions() {
        return attemptedActions;
    }

    public List<ReconcileAction> getAppliedActions() {
        return appliedActions;
    }

    public List<ReconciliationError> getErrors() {
        return errors;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        ManagerResult that = (ManagerResult) o;
        return Objects.equals(managerName, that.managerName) &&
                state == that.state &&
                Objects.equals(plannedActions, that.plannedActions) &&
                Objects.equals(attemptedActions, that.attemptedActions) &&
                Objects.equals(appliedActions, that.appliedActions) &&
                Objects.equals(errors, that.errors);
    }

    @Override
    public int hashCode() {
        return Objects.hash(managerName, state, plannedActions, attemptedActions, appliedActions, errors);
    }

    @Override
    public String toString() {
        return "ManagerResult{" +
                "managerName='" + managerName + '\'' +
                ", state=" + state +
                ", plannedActions=" + plannedActions +
                ", attempted=" + attemptedActions.size() +
                ", applied=" + appliedActions.size() +
                ", errors=" + errors +
                '}';
    }

    public static ManagerResult skipped(String managerName) {
        return newBuilder(managerName).withState(State.Skipped).build();
    }

    public static ManagerResult failed(String managerName, ReconciliationError error) {
        return newBuilder(managerName).withState(State.Failed).withError(error).build();
    }

    public static ManagerResult aborted(String managerName, ReconciliationError error) {
        return newBuilder(managerName).withState(State.Aborted).withError(error).build();
    }

    public static Builder newBuilder(String managerName) {
        return new Builder(managerName);
    }

    public static final class Builder {

        private final String managerName;
        private State state;
        private List<ReconcileAction> plannedActions = Collections.emptyList();
        private final List<ReconcileAction> attemptedActions = new ArrayList<>();
        private final List<ReconcileAction> appliedActions = new ArrayList<>();
        private final List<ReconciliationError> errors = new ArrayList<>();

        private Builder(String managerName) {
            this.managerName = managerName;
        }

        public Builder withState(State state) {
            this.state = state;
            return this;
        }

        public Builder withPlannedActions(List<ReconcileAction> plannedActions) {
            this.plannedActions = plannedActions;
            return this;
        }

        public Builder withAttempted(ReconcileAction action) {
            attemptedActions.add(action);
            return this;
        }

        public Builder withApplied(ReconcileAction action) {
            appliedActions.add(action);
            return this;
        }

        public Builder withError(ReconciliationError error) {
            errors.add(error);
            return this;
        }

        public ManagerResult build() {
            Preconditions.checkNotNull(managerName, "manager name not set");
            Preconditions.checkNotNull(state, "state not set");
            return new ManagerResult(
                    managerName,
                    state,
                    ImmutableList.copyOf(plannedActions),
                    ImmutableList.copyOf(attemptedActions),
                    ImmutableList.copyOf(appliedActions),
                    ImmutableList.copyOf(errors)
            );
        }
    }
}
