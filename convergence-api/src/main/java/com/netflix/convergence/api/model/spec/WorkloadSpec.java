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

package com.netflix.convergence.api.model.spec;

import java.util.Objects;

/**
 * Desired-state descriptor of a workload, with one section per resource category. Each section carries its own
 * feature toggle.
 */
public final class WorkloadSpec {

    private final PersistenceSpec persistence;
    private final NetworkingSpec networking;

    private WorkloadSpec(PersistenceSpec persistence, NetworkingSpec networking) {
        this.persistence = persistence;
        this.networking = networking;
    }

    public PersistenceSpec getPersistence() {
        return persistence;
    }

    public NetworkingSpec getNetworking() {
        return networking;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        WorkloadSpec that = (WorkloadSpec) o;
        return Objects.equals(persistence, that.persistence) && Objects.equals(networking, that.networking);
    }

    @Override
    public int hashCode() {
        return Objects.hash(persistence, networking);
    }

    @Override
    public String toString() {
        return "WorkloadSpec{" +
                "persistence=" + persistence +
                ", networking=" + networking +
                '}';
    }

    public Builder toBuilder() {
        return newBuilder().withPersistence(persistence).withNetworking(networking);
    }

    public static Builder newBuilder() {
        return new Builder();
    }

    public static final class Builder {

        private PersistenceSpec persistence;
        private NetworkingSpec networking;

        private Builder() {
        }

        public Builder withPersistence(PersistenceSpec persistence) {
            this.persistence = persistence;
            return this;
        }

        public Builder withNetworking(NetworkingSpec networking) {
            this.networking = networking;
            return this;
        }

        public WorkloadSpec build() {
            return new WorkloadSpec(
                    persistence == null ? PersistenceSpec.disabled() : persistence,
                    networking == null ? NetworkingSpec.disabled() : networking
            );
        }
    }
}
