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

package com.netflix.convergence.engine.manager.networking;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import javax.inject.Inject;
import javax.inject.Singleton;

import com.google.common.collect.ImmutableMap;
import com.netflix.convergence.api.model.ComparatorOverrides;
import com.netflix.convergence.api.model.ManagedObject;
import com.netflix.convergence.api.model.ObjectTypeDescriptor;
import com.netflix.convergence.api.model.OwnershipScope;
import com.netflix.convergence.api.model.ReconciliationTarget;
import com.netflix.convergence.api.model.network.ServiceEndpoint;
import com.netflix.convergence.api.model.network.ServiceEndpoints;
import com.netflix.convergence.api.model.spec.NetworkingSpec;
import com.netflix.convergence.api.model.spec.WorkloadSpec;
import com.netflix.convergence.api.service.ResourceManager;
import com.netflix.convergence.api.service.ResourceStore;
import com.netflix.convergence.common.util.CollectionsExt;
import com.netflix.convergence.engine.manager.ManagerLabels;

/**
 * Exposes the workload through a service endpoint named after it, while networking is enabled.
 */
@Singleton
public class NetworkingManager implements ResourceManager<WorkloadSpec> {

    public static final String NAME = "networking";

    public static final String SELECTOR_APP = "app";

    private static final ComparatorOverrides COMPARATORS = ComparatorOverrides.of(
            ServiceEndpoints.SERVICE_ENDPOINT,
            NetworkingManager::isSameEndpoint
    );

    private final ResourceStore store;

    @Inject
    public NetworkingManager(ResourceStore store) {
        this.store = store;
    }

    @Override
    public String getName() {
        return NAME;
    }

    @Override
    public List<ObjectTypeDescriptor<?>> getObjectTypes() {
        return Collections.singletonList(ServiceEndpoints.DESCRIPTOR);
    }

    @Override
    public OwnershipScope getOwnershipScope(ReconciliationTarget<WorkloadSpec> target) {
        return ManagerLabels.ownershipScope(target);
    }

    @Override
    public List<ManagedObject<?>> getRequiredObjects(ReconciliationTarget<WorkloadSpec> target) {
        NetworkingSpec networking = target.getSpec().getNetworking();
        if (!networking.isExposed()) {
            return Collections.emptyList();
        }
        ManagedObject<ServiceEndpoint> endpoint = ManagedObject.newBuilder(ServiceEndpoints.SERVICE_ENDPOINT)
                .withIdentity(target.getIdentity())
                .withLabels(ManagerLabels.ownerLabels(target))
                .withPayload(ServiceEndpoint.newBuilder()
                        .withExposureType(networking.getExposureType())
                        .withPort(networking.getPort())
                        .withTargetPort(networking.getPort())
                        .withSelector(ImmutableMap.of(SELECTOR_APP, target.getName()))
                        .build()
                )
                .build();
        return Collections.singletonList(endpoint);
    }

    @Override
    public List<ManagedObject<?>> getDeployedObjects(ReconciliationTarget<WorkloadSpec> target) {
        return new ArrayList<>(store.list(ServiceEndpoints.SERVICE_ENDPOINT, target.getNamespace(), ManagerLabels.ownerLabels(target)));
    }

    @Override
    public ComparatorOverrides getCustomComparators() {
        return COMPARATORS;
    }

    /**
     * Selector entries added to the deployed endpoint by other tooling do not count as a difference. The cluster IP
     * is assigned by the store and never compared.
     */
    static boolean isSameEndpoint(ServiceEndpoint desired, ServiceEndpoint deployed) {
        return Objects.equals(desired.getExposureType(), deployed.getExposureType())
                && desired.getPort() == deployed.getPort()
                && desired.getTargetPort() == deployed.getTargetPort()
                && CollectionsExt.containsAll(deployed.getSelector(), desired.getSelector());
    }
}
