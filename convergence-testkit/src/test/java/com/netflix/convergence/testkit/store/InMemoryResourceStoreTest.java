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

package com.netflix.convergence.testkit.store;

import com.google.common.collect.ImmutableMap;
import com.netflix.convergence.api.model.ManagedObject;
import com.netflix.convergence.api.model.ObjectIdentity;
import com.netflix.convergence.api.model.network.ServiceEndpoint;
import com.netflix.convergence.api.model.network.ServiceEndpoints;
import com.netflix.convergence.api.model.storage.StorageClaim;
import com.netflix.convergence.api.model.storage.StorageClaims;
import com.netflix.convergence.api.service.ResourceStoreException;
import com.netflix.convergence.api.service.ResourceStoreException.ErrorCode;
import org.junit.Test;

import static com.netflix.convergence.testkit.model.ManagedObjectGenerator.NAMESPACE;
import static com.netflix.convergence.testkit.model.ManagedObjectGenerator.serviceEndpoint;
import static com.netflix.convergence.testkit.model.ManagedObjectGenerator.storageClaim;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.catchThrowable;

public class InMemoryResourceStoreTest {

    private final InMemoryResourceStore store = new InMemoryResourceStore();

    @Test
    public void testCreateGetUpdateDelete() {
        ManagedObject<StorageClaim> claim = storageClaim("data", "10Gi");
        store.create(claim);
        assertThat(store.get(StorageClaims.STORAGE_CLAIM, claim.getIdentity())).isEqualTo(claim);

        ManagedObject<StorageClaim> resized = claim.withPayload(claim.getPayload().toBuilder().withCapacity("20Gi").build());
        store.update(resized);
        assertThat(store.get(StorageClaims.STORAGE_CLAIM, claim.getIdentity()).getPayload().getCapacity()).isEqualTo("20Gi");

        store.delete(StorageClaims.STORAGE_CLAIM, claim.getIdentity());
        assertThat(store.getAll()).isEmpty();
        assertThat(store.getMutationCount()).isEqualTo(3);
    }

    @Test
    public void testSameIdentityWithDifferentTypesCoexist() {
        store.create(storageClaim("data", "10Gi"));
        store.create(serviceEndpoint("data", 8081));

        assertThat(store.getAll()).extracting(o -> o.getType().getName())
                .containsExactly(ServiceEndpoints.SERVICE_ENDPOINT.getName(), StorageClaims.STORAGE_CLAIM.getName());
    }

    @Test
    public void testErrorCodes() {
        ObjectIdentity missing = ObjectIdentity.of(NAMESPACE, "missing");
        assertErrorCode(catchThrowable(() -> store.get(StorageClaims.STORAGE_CLAIM, missing)), ErrorCode.NotFound);
        assertErrorCode(catchThrowable(() -> store.delete(StorageClaims.STORAGE_CLAIM, missing)), ErrorCode.NotFound);
        assertErrorCode(catchThrowable(() -> store.update(storageClaim("missing", "1Gi"))), ErrorCode.NotFound);

        store.create(storageClaim("data", "10Gi"));
        assertErrorCode(catchThrowable(() -> store.create(storageClaim("data", "10Gi"))), ErrorCode.AlreadyExists);
    }

    @Test
    public void testListFiltersByNamespaceAndLabels() {
        store.add(serviceEndpoint(NAMESPACE, "b", 8081, ImmutableMap.of("owner", "me")));
        store.add(serviceEndpoint(NAMESPACE, "a", 8081, ImmutableMap.of("owner", "me", "extra", "x")));
        store.add(serviceEndpoint(NAMESPACE, "c", 8081, ImmutableMap.of("owner", "you")));
        store.add(serviceEndpoint("other", "d", 8081, ImmutableMap.of("owner", "me")));

        assertThat(store.list(ServiceEndpoints.SERVICE_ENDPOINT, NAMESPACE, ImmutableMap.of("owner", "me")))
                .extracting(o -> o.getIdentity().getName())
                .containsExactly("a", "b");
        assertThat(store.list(ServiceEndpoints.SERVICE_ENDPOINT, NAMESPACE, ImmutableMap.of())).hasSize(3);
    }

    @Test
    public void testCreateHookPopulatesServerFields() {
        store.withCreateHook(ServiceEndpoints.SERVICE_ENDPOINT, endpoint -> endpoint.toBuilder().withClusterIp("10.0.0.1").build());

        ManagedObject<ServiceEndpoint> created = store.create(serviceEndpoint("web", 8081));

        assertThat(created.getPayload().getClusterIp()).isEqualTo("10.0.0.1");
        assertThat(store.get(ServiceEndpoints.SERVICE_ENDPOINT, created.getIdentity()).getPayload().getClusterIp()).isEqualTo("10.0.0.1");
    }

    @Test
    public void testInjectedFailures() {
        store.add(storageClaim("data", "10Gi"));

        store.failNextRequest(ResourceStoreException.internal("mock 500", null));
        assertErrorCode(catchThrowable(() -> store.get(StorageClaims.STORAGE_CLAIM, ObjectIdentity.of(NAMESPACE, "data"))), ErrorCode.Internal);
        assertThat(store.get(StorageClaims.STORAGE_CLAIM, ObjectIdentity.of(NAMESPACE, "data"))).isNotNull();

        store.failRequests(StorageClaims.STORAGE_CLAIM, ResourceStoreException.unavailable("down", null));
        assertErrorCode(catchThrowable(() -> store.list(StorageClaims.STORAGE_CLAIM, NAMESPACE, ImmutableMap.of())), ErrorCode.Unavailable);
        assertThat(store.list(ServiceEndpoints.SERVICE_ENDPOINT, NAMESPACE, ImmutableMap.of())).isEmpty();

        store.clearFailures();
        assertThat(store.list(StorageClaims.STORAGE_CLAIM, NAMESPACE, ImmutableMap.of())).hasSize(1);
    }

    private static void assertErrorCode(Throwable error, ErrorCode expected) {
        assertThat(error).isInstanceOf(ResourceStoreException.class);
        assertThat(((ResourceStoreException) error).getErrorCode()).isEqualTo(expected);
    }
}
