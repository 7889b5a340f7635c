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

package com.netflix.convergence.engine.diff;

import java.util.List;

import com.netflix.convergence.api.model.ComparatorOverrides;
import com.netflix.convergence.api.model.ManagedObject;
import com.netflix.convergence.api.model.OwnershipScope;
import com.netflix.convergence.api.model.ReconcileAction;
import com.netflix.convergence.api.service.ReconcilerException;

/**
 * Computes the minimal set of actions converging the deployed objects to the desired ones.
 */
public interface DiffEngine {

    /**
     * Returns all creates, followed by all updates, followed by all deletes. Within each group actions are ordered
     * by object identity and then by type name, so the same input always yields the same list. Deployed objects
     * outside of the ownership scope are ignored.
     *
     * @throws ReconcilerException if an object type is not registered, or if either set holds the same identity twice
     */
    List<ReconcileAction> diff(List<ManagedObject<?>> desired,
                               List<ManagedObject<?>> deployed,
                               OwnershipScope scope,
                               ComparatorOverrides overrides);
}
