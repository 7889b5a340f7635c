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

import java.util.List;

import com.netflix.convergence.api.model.ManagedObject;
import com.netflix.convergence.api.model.ObjectIdentity;
import com.netflix.convergence.api.model.OwnershipScope;
import com.netflix.convergence.api.model.ReconciliationTarget;
import com.netflix.convergence.api.model.spec.PersistenceSpec;
import com.netflix.convergence.api.model.spec.WorkloadSpec;
import com.netflix.convergence.api.model.storage.StorageClaim;
import com.netflix.convergence.api.model.storage.StorageClaims;
import com.netflix.convergence.api.service.ResourceStore;
import com.netflix.convergence.api.service.ResourceStoreException;
import com.netflix.convergence.engine.manager.ManagerLabels;
import com.netflix.convergence.testkit.store.InMemoryResourceStore;
import org.junit.Test;

import static com.netflix.convergence.testkit.model.ManagedObjectGenerator.NAME;
import static com.netflix.convergence.testkit.model.ManagedObjectGenerator.NAMESPACE;
import static com.netflix.convergence.testkit.model.ManagedObjectGenerator.storageClaim;
import static com.netflix.convergence.testkit.model.ManagedObjectGenerator.workload;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.catchThrowable;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verifyNoInteractions;

public class PersistenceManagerTest {

    private final InMemoryResourceStore store = new InMemoryResourceStore();

    private final PersistenceManager manager = new PersistenceManager(store);

    @Test
    public void testNoClaimRequiredWithoutPersistence() {
        assertThat(manager.getRequiredObjects(workload(false, false))).isEmpty();
    }

    @Test
    public void testOneClaimRequiredWithPersistence() {
        List<ManagedObject<?>> required = manager.getRequiredObjects(workload(true, false));

        assertThat(required).hasSize(1);
        ManagedObject<StorageClaim> claim = required.get(0).as(StorageClaims.STORAGE_CLAIM);
        assertThat(claim.getIdentity().getNamespace()).isEqualTo(NAMESPACE);
        assertThat(claim.getIdentity().getName()).isEqualTo(NAME);
        assertThat(claim.getPayload().getCapacity()).isEqualTo("10Gi");
        assertThat(claim.getPayload().getAccessModes()).containsExactly(StorageClaim.ACCESS_MODE_READ_WRITE_ONCE);
        assertThat(claim.getLabels()).containsAllEntriesOf(ManagerLabels.ownerLabels(workload(true, false)));
    }

    @Test
    public void testStorageClassIsPassedThrough() {
        ReconciliationTarget<WorkloadSpec> target = ReconciliationTarget.of(NAMESPACE, NAME, WorkloadSpec.newBuilder()
                .withPersistence(PersistenceSpec.newBuilder()
                        .withPersistent(true)
                        .withVolumeSize("50Gi")
                        .withStorageClass("fast")
                        .build()
                )
                .build()
        );

        StorageClaim claim = manager.getRequiredObjects(target).get(0).as(StorageClaims.STORAGE_CLAIM).getPayload();
        assertThat(claim.getCapacity()).isEqualTo("50Gi");
        assertThat(claim.getStorageClassName()).isEqualTo("fast");
    }

    @Test
    public void testNoDeployedClaim() {
        List<ManagedObject<?>> deployed = manager.getDeployedObjects(workload(true, false));
        assertThat(deployed).isEmpty();
    }

    @Test
    public void testDeployedClaim() {
        store.add(storageClaim(NAME, "10Gi"));

        List<ManagedObject<?>> deployed = manager.getDeployedObjects(workload(true, false));

        assertThat(deployed).hasSize(1);
        assertThat(deployed.get(0).getType()).isEqualTo(StorageClaims.STORAGE_CLAIM);
    }

    @Test
    public void testStoreFailureOtherThanNotFoundPropagates() {
        store.add(storageClaim(NAME, "10Gi"));
        store.failNextRequest(ResourceStoreException.internal("mock 500", null));

        Throwable error = catchThrowable(() -> manager.getDeployedObjects(workload(true, false)));

        assertThat(error).isInstanceOf(ResourceStoreException.class);
        assertThat(error.getMessage()).contains("mock 500");
    }

    @Test
    public void testRequiredObjectsDoNotTouchStore() {
        ResourceStore mockStore = mock(ResourceStore.class);
        PersistenceManager isolated = new PersistenceManager(mockStore);
        assertThat(isolated.getRequiredObjects(workload(true, false))).hasSize(1);
        verifyNoInteractions(mockStore);
    }

    @Test
    public void testNoCustomComparators() {
        assertThat(manager.getCustomComparators().isEmpty()).isTrue();
        assertThat(manager.getCustomComparator(StorageClaims.STORAGE_CLAIM)).isEmpty();
    }

    @Test
    public void testOwnershipScope() {
        OwnershipScope scope = manager.getOwnershipScope(workload(true, false));
        assertThat(scope.getNamespace()).isEqualTo(NAMESPACE);
        assertThat(scope.getOwnerLabels()).isEqualTo(ManagerLabels.ownerLabels(workload(true, false)));
        assertThat(scope.getOwnedIdentities()).containsExactly(ObjectIdentity.of(NAMESPACE, NAME));
        assertThat(scope.owns(storageClaim(NAME, "10Gi"))).isTrue();
        assertThat(scope.owns(storageClaim("foreign", "10Gi"))).isFalse();
        assertThat(manager.getObjectTypes()).containsExactly(StorageClaims.DESCRIPTOR);
    }
}
