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

package com.netflix.convergence.engine.registry;

import java.util.Arrays;

import com.netflix.convergence.api.model.ComparatorOverrides;
import com.netflix.convergence.api.model.ObjectComparator;
import com.netflix.convergence.api.model.ObjectTypeDescriptor;
import com.netflix.convergence.api.model.network.ServiceEndpoints;
import com.netflix.convergence.api.model.storage.StorageClaim;
import com.netflix.convergence.api.model.storage.StorageClaims;
import com.netflix.convergence.api.service.ReconcilerException;
import org.junit.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.catchThrowable;

public class ComparatorRegistryTest {

    private static final StorageClaim SMALL = StorageClaim.newBuilder().withCapacity("1Gi").build();
    private static final StorageClaim LARGE = StorageClaim.newBuilder().withCapacity("10Gi").build();

    @Test
    public void testRegisteredTypeResolvesToDefaultComparator() {
        ComparatorRegistry registry = ComparatorRegistry.newBuilder()
                .register(StorageClaims.DESCRIPTOR)
                .build();

        ObjectComparator<StorageClaim> comparator = registry.resolveComparator(StorageClaims.STORAGE_CLAIM, ComparatorOverrides.empty());
        assertThat(comparator.isEqual(SMALL, SMALL)).isTrue();
        assertThat(comparator.isEqual(SMALL, LARGE)).isFalse();
        assertThat(registry.isRegistered(StorageClaims.STORAGE_CLAIM)).isTrue();
        assertThat(registry.isRegistered(ServiceEndpoints.SERVICE_ENDPOINT)).isFalse();
    }

    @Test
    public void testOverrideTakesPrecedence() {
        ComparatorRegistry registry = ComparatorRegistry.newBuilder()
                .register(StorageClaims.DESCRIPTOR)
                .build();

        ComparatorOverrides overrides = ComparatorOverrides.of(StorageClaims.STORAGE_CLAIM, (desired, deployed) -> true);
        assertThat(registry.resolveComparator(StorageClaims.STORAGE_CLAIM, overrides).isEqual(SMALL, LARGE)).isTrue();
    }

    @Test
    public void testUnregisteredTypeLookupFails() {
        ComparatorRegistry registry = ComparatorRegistry.newBuilder()
                .register(StorageClaims.DESCRIPTOR)
                .build();

        Throwable error = catchThrowable(() -> registry.getDescriptor(ServiceEndpoints.SERVICE_ENDPOINT));
        assertThat(ReconcilerException.hasErrorCode(error, ReconcilerException.ErrorCode.UnregisteredObjectType)).isTrue();

        // An override does not make a type known.
        ComparatorOverrides overrides = ComparatorOverrides.of(ServiceEndpoints.SERVICE_ENDPOINT, (desired, deployed) -> true);
        error = catchThrowable(() -> registry.resolveComparator(ServiceEndpoints.SERVICE_ENDPOINT, overrides));
        assertThat(ReconcilerException.hasErrorCode(error, ReconcilerException.ErrorCode.UnregisteredObjectType)).isTrue();
    }

    @Test
    public void testSameDescriptorMayBeRegisteredTwice() {
        ComparatorRegistry registry = ComparatorRegistry.newBuilder()
                .registerAll(Arrays.asList(StorageClaims.DESCRIPTOR, ServiceEndpoints.DESCRIPTOR))
                .register(StorageClaims.DESCRIPTOR)
                .build();
        assertThat(registry.getObjectTypes()).containsExactly(StorageClaims.STORAGE_CLAIM, ServiceEndpoints.SERVICE_ENDPOINT);
    }

    @Test
    public void testConflictingDescriptorsAreRejected() {
        ObjectTypeDescriptor<StorageClaim> other = ObjectTypeDescriptor.newBuilder(StorageClaims.STORAGE_CLAIM)
                .withComparator((desired, deployed) -> true)
                .build();

        Throwable error = catchThrowable(() -> ComparatorRegistry.newBuilder()
                .register(StorageClaims.DESCRIPTOR)
                .register(other)
        );
        assertThat(ReconcilerException.hasErrorCode(error, ReconcilerException.ErrorCode.ConflictingObjectType)).isTrue();
    }
}
