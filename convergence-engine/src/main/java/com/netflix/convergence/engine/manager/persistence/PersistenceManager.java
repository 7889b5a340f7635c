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

package com.netflix.convergence.engine.manager.persistence;

import java.util.Collections;
import java.util.List;
import javax.inject.Inject;
import javax.inject.Singleton;

import com.netflix.convergence.api.model.ManagedObject;
import com.netflix.convergence.api.model.ObjectTypeDescriptor;
import com.netflix.convergence.api.model.OwnershipScope;
import com.netflix.convergence.api.model.ReconciliationTarget;
import com.netflix.convergence.api.model.spec.PersistenceSpec;
import com.netflix.convergence.api.model.spec.WorkloadSpec;
import com.netflix.convergence.api.model.storage.StorageClaim;
import com.netflix.convergence.api.model.storage.StorageClaims;
import com.netflix.convergence.api.service.ResourceManager;
import com.netflix.convergence.api.service.ResourceStore;
import com.netflix.convergence.api.service.ResourceStoreException;
import com.netflix.convergence.engine.manager.ManagerLabels;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Keeps a single storage claim, named after the workload, in place while persistence is enabled.
 */
@Singleton
public class PersistenceManager implements ResourceManager<WorkloadSpec> {

    public static final String NAME = "persistence";

    private static final Logger logger = LoggerFactory.getLogger(PersistenceManager.class);

    private final ResourceStore store;

    @Inject
    public PersistenceManager(ResourceStore store) {
        this.store = store;
    }

    @Override
    public String getName() {
        return NAME;
    }

    @Override
    public List<ObjectTypeDescriptor<?>> getObjectTypes() {
        return Collections.singletonList(StorageClaims.DESCRIPTOR);
    }

    /**
     * The claim is addressed by the target identity, so a claim found there is owned even before it carries the
     * owner labels.
     */
    @Override
    public OwnershipScope getOwnershipScope(ReconciliationTarget<WorkloadSpec> target) {
        return ManagerLabels.ownershipScope(target).withOwnedIdentity(target.getIdentity());
    }

    @Override
    public List<ManagedObject<?>> getRequiredObjects(ReconciliationTarget<WorkloadSpec> target) {
        PersistenceSpec persistence = target.getSpec().getPersistence();
        if (!persistence.isPersistent()) {
            return Collections.emptyList();
        }
        ManagedObject<StorageClaim> claim = ManagedObject.newBuilder(StorageClaims.STORAGE_CLAIM)
                .withIdentity(target.getIdentity())
                .withLabels(ManagerLabels.ownerLabels(target))
                .withPayload(StorageClaim.newBuilder()
                        .withCapacity(persistence.getVolumeSize())
                        .withStorageClassName(persistence.getStorageClass())
                        .withAccessModes(Collections.singletonList(StorageClaim.ACCESS_MODE_READ_WRITE_ONCE))
                        .build()
                )
                .build();
        return Collections.singletonList(claim);
    }

    @Override
    public List<ManagedObject<?>> getDeployedObjects(ReconciliationTarget<WorkloadSpec> target) {
        try {
            return Collections.singletonList(store.get(StorageClaims.STORAGE_CLAIM, target.getIdentity()));
        } catch (ResourceStoreException e) {
            if (!ResourceStoreException.isNotFound(e)) {
                throw e;
            }
            logger.debug("No storage claim deployed for {}", target.getIdentity());
            return Collections.emptyList();
        }
    }
}
