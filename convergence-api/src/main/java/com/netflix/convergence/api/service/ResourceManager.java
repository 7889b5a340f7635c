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

package com.netflix.convergence.api.service;

import java.util.List;
import java.util.Optional;

import com.netflix.convergence.api.model.ComparatorOverrides;
import com.netflix.convergence.api.model.ManagedObject;
import com.netflix.convergence.api.model.ObjectComparator;
import com.netflix.convergence.api.model.ObjectType;
import com.netflix.convergence.api.model.ObjectTypeDescriptor;
import com.netflix.convergence.api.model.OwnershipScope;
import com.netflix.convergence.api.model.ReconciliationTarget;

/**
 * Plugs one object category (storage, networking, ...) into the reconciliation engine. Implementations hold the
 * category policy and are read-only: they observe the backing store but never change it.
 *
 * @param <S> desired-state type
 */
public interface ResourceManager<S> {

    /**
     * Stable name, used to attribute metrics and errors.
     */
    String getName();

    /**
     * Descriptors of every object type this manager produces. Registered with the engine when the manager is.
     */
    List<ObjectTypeDescriptor<?>> getObjectTypes();

    /**
     * Namespace and labels of the objects this manager exclusively owns for the given target.
     */
    OwnershipScope getOwnershipScope(ReconciliationTarget<S> target);

    /**
     * Desired objects, computed from the desired state only. A category disabled in the desired state yields an
     * empty list.
     */
    List<ManagedObject<?>> getRequiredObjects(ReconciliationTarget<S> target);

    /**
     * Deployed objects of this category owned by the target. A missing object is absent from the result; any other
     * store failure propagates as {@link ResourceStoreException}.
     */
    List<ManagedObject<?>> getDeployedObjects(ReconciliationTarget<S> target);

    /**
     * Comparator overrides. Empty means the engine defaults apply to every type.
     */
    default ComparatorOverrides getCustomComparators() {
        return ComparatorOverrides.empty();
    }

    default <P> Optional<ObjectComparator<P>> getCustomComparator(ObjectType<P> type) {
        return getCustomComparators().find(type);
    }
}
