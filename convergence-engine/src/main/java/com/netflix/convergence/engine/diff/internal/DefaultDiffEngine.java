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

package com.netflix.convergence.engine.diff.internal;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.SortedMap;
import java.util.TreeMap;

import com.netflix.convergence.api.model.ComparatorOverrides;
import com.netflix.convergence.api.model.ManagedObject;
import com.netflix.convergence.api.model.ObjectComparator;
import com.netflix.convergence.api.model.ObjectType;
import com.netflix.convergence.api.model.ObjectTypeDescriptor;
import com.netflix.convergence.api.model.OwnershipScope;
import com.netflix.convergence.api.model.ReconcileAction;
import com.netflix.convergence.api.service.ReconcilerException;
import com.netflix.convergence.common.util.CollectionsExt;
import com.netflix.convergence.engine.diff.DiffEngine;
import com.netflix.convergence.engine.registry.ComparatorRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public class DefaultDiffEngine implements DiffEngine {

    private static final Logger logger = LoggerFactory.getLogger(DefaultDiffEngine.class);

    private final ComparatorRegistry registry;

    public DefaultDiffEngine(ComparatorRegistry registry) {
        this.registry = registry;
    }

    @Override
    public List<ReconcileAction> diff(List<ManagedObject<?>> desired,
                                      List<ManagedObject<?>> deployed,
                                      OwnershipScope scope,
                                      ComparatorOverrides overrides) {
        SortedMap<ObjectKey, ManagedObject<?>> desiredIndex = index("desired", desired);
        SortedMap<ObjectKey, ManagedObject<?>> deployedIndex = index("deployed", ownedBy(scope, deployed));

        List<ReconcileAction> creates = new ArrayList<>();
        List<ReconcileAction> updates = new ArrayList<>();
        List<ReconcileAction> deletes = new ArrayList<>();

        for (Map.Entry<ObjectKey, ManagedObject<?>> entry : desiredIndex.entrySet()) {
            ManagedObject<?> current = deployedIndex.get(entry.getKey());
            if (current == null) {
                creates.add(ReconcileAction.create(scope.claim(entry.getValue())));
            } else {
                compare(entry.getValue(), current, scope, overrides).ifPresent(updates::add);
            }
        }
        for (ObjectKey key : deployedIndex.keySet()) {
            if (!desiredIndex.containsKey(key)) {
                deletes.add(ReconcileAction.delete(key.getType(), key.getIdentity()));
            }
        }

        List<ReconcileAction> actions = new ArrayList<>(creates.size() + updates.size() + deletes.size());
        actions.addAll(creates);
        actions.addAll(updates);
        actions.addAll(deletes);
        return actions;
    }

    private SortedMap<ObjectKey, ManagedObject<?>> index(String setName, List<ManagedObject<?>> objects) {
        SortedMap<ObjectKey, ManagedObject<?>> result = new TreeMap<>();
        for (ManagedObject<?> object : CollectionsExt.nonNull(objects)) {
            registry.getDescriptor(object.getType());
            if (result.put(ObjectKey.of(object), object) != null) {
                throw ReconcilerException.duplicateIdentity(setName, object.getType(), object.getIdentity());
            }
        }
        return result;
    }

    private List<ManagedObject<?>> ownedBy(OwnershipScope scope, List<ManagedObject<?>> deployed) {
        List<ManagedObject<?>> owned = new ArrayList<>();
        for (ManagedObject<?> object : CollectionsExt.nonNull(deployed)) {
            if (scope.owns(object)) {
                owned.add(object);
            } else {
                logger.debug("Ignoring deployed object outside of {}: {} {}", scope, object.getType(), object.getIdentity());
            }
        }
        return owned;
    }

    private <P> Optional<ReconcileAction> compare(ManagedObject<P> desired,
                                                  ManagedObject<?> deployedObject,
                                                  OwnershipScope scope,
                                                  ComparatorOverrides overrides) {
        ObjectType<P> type = desired.getType();
        ManagedObject<P> deployed = deployedObject.as(type);
        ObjectComparator<P> comparator = registry.resolveComparator(type, overrides);
        if (comparator.isEqual(desired.getPayload(), deployed.getPayload())) {
            return Optional.empty();
        }

        ObjectTypeDescriptor<P> descriptor = registry.getDescriptor(type);
        if (!descriptor.isUpdatable()) {
            logger.warn("Deployed {} {} differs from the desired state, but the type is not updatable: changedFields={}",
                    type, desired.getIdentity(), descriptor.findDifferences(desired.getPayload(), deployed.getPayload()));
            return Optional.empty();
        }

        P merged = descriptor.merge(desired.getPayload(), deployed.getPayload());
        if (merged.equals(deployed.getPayload())) {
            // Comparator override reports a difference outside of the controlled fields.
            logger.debug("No controlled field of {} {} differs, skipping update", type, desired.getIdentity());
            return Optional.empty();
        }

        ManagedObject<P> updated = deployed.toBuilder()
                .withLabels(CollectionsExt.merge(deployed.getLabels(), desired.getLabels()))
                .withPayload(merged)
                .build();
        return Optional.of(ReconcileAction.update(desired.getIdentity(), scope.claim(updated)));
    }
}
