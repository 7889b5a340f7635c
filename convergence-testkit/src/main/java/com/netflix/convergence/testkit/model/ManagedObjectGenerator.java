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

package com.netflix.convergence.testkit.model;

import java.util.Collections;
import java.util.Map;

import com.netflix.convergence.api.model.ManagedObject;
import com.netflix.convergence.api.model.ReconciliationTarget;
import com.netflix.convergence.api.model.network.ServiceEndpoint;
import com.netflix.convergence.api.model.network.ServiceEndpoints;
import com.netflix.convergence.api.model.spec.NetworkingSpec;
import com.netflix.convergence.api.model.spec.PersistenceSpec;
import com.netflix.convergence.api.model.spec.WorkloadSpec;
import com.netflix.convergence.api.model.storage.StorageClaim;
import com.netflix.convergence.api.model.storage.StorageClaims;

/**
 * Factory methods for managed objects and reconciliation targets used across test suites.
 */
public final class ManagedObjectGenerator {

    public static final String NAMESPACE = "test";
    public static final String NAME = "nexus";

    private ManagedObjectGenerator() {
    }

    public static ManagedObject<StorageClaim> storageClaim(String name, String capacity) {
        return storageClaim(NAMESPACE, name, capacity, Collections.emptyMap());
    }

    public static ManagedObject<StorageClaim> storageClaim(String namespace, String name, String capacity, Map<String, String> labels) {
        return ManagedObject.newBuilder(StorageClaims.STORAGE_CLAIM)
                .withIdentity(namespace, name)
                .withLabels(labels)
                .withPayload(StorageClaim.newBuilder().withCapacity(capacity).build())
                .build();
    }

    public static ManagedObject<ServiceEndpoint> serviceEndpoint(String name, int port) {
        return serviceEndpoint(NAMESPACE, name, port, Collections.emptyMap());
    }

    public static ManagedObject<ServiceEndpoint> serviceEndpoint(String namespace, String name, int port, Map<String, String> labels) {
        return ManagedObject.newBuilder(ServiceEndpoints.SERVICE_ENDPOINT)
                .withIdentity(namespace, name)
                .withLabels(labels)
                .withPayload(ServiceEndpoint.newBuilder()
                        .withPort(port)
                        .withSelector(Collections.singletonMap("app", name))
                        .build()
                )
                .build();
    }

    public static ReconciliationTarget<WorkloadSpec> workload(boolean persistent, boolean exposed) {
        WorkloadSpec spec = WorkloadSpec.newBuilder()
                .withPersistence(PersistenceSpec.newBuilder()
                        .withPersistent(persistent)
                        .withVolumeSize("10Gi")
                        .build()
                )
                .withNetworking(NetworkingSpec.newBuilder()
                        .withExposed(exposed)
                        .build()
                )
                .build();
        return ReconciliationTarget.of(NAMESPACE, NAME, spec);
    }
}
