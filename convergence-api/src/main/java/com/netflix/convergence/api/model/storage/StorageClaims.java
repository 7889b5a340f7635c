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

package com.netflix.convergence.api.model.storage;

import com.netflix.convergence.api.model.ControlledField;
import com.netflix.convergence.api.model.ObjectType;
import com.netflix.convergence.api.model.ObjectTypeDescriptor;

public final class StorageClaims {

    public static final ObjectType<StorageClaim> STORAGE_CLAIM = ObjectType.of("StorageClaim", StorageClaim.class);

    public static final ControlledField<StorageClaim, String> CAPACITY = ControlledField.of(
            "capacity", StorageClaim::getCapacity, StorageClaim::withCapacity
    );

    /**
     * Capacity is the only compared field. The backing store does not allow resizing a provisioned claim, so the
     * type is not updatable and a capacity mismatch never produces an update.
     */
    public static final ObjectTypeDescriptor<StorageClaim> DESCRIPTOR = ObjectTypeDescriptor.newBuilder(STORAGE_CLAIM)
            .withControlledField(CAPACITY)
            .withUpdatable(false)
            .build();

    private StorageClaims() {
    }
}
