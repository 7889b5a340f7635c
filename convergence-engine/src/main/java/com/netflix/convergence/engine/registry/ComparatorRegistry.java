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

import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

import com.google.common.collect.ImmutableMap;
import com.netflix.convergence.api.model.ComparatorOverrides;
import com.netflix.convergence.api.model.ObjectComparator;
import com.netflix.convergence.api.model.ObjectType;
import com.netflix.convergence.api.model.ObjectTypeDescriptor;
import com.netflix.convergence.api.service.ReconcilerException;

/**
 * Object type descriptors known to a reconciliation engine. Built once, before the first pass, and read-only
 * afterwards, so concurrently running managers can share it without synchronization.
 */
public class ComparatorRegistry {

    private final Map<ObjectType<?>, ObjectTypeDescriptor<?>> descriptors;

    private ComparatorRegistry(Map<ObjectType<?>, ObjectTypeDescriptor<?>> descriptors) {
        this.descriptors = descriptors;
    }

    public Set<ObjectType<?>> getObjectTypes() {
        return descriptors.keySet();
    }

    public boolean isRegistered(ObjectType<?> type) {
        return descriptors.containsKey(type);
    }

    /**
     * @throws ReconcilerException if the type was never registered
     */
    @SuppressWarnings("unchecked")
    public <P> ObjectTypeDescriptor<P> getDescriptor(ObjectType<P> type) {
        ObjectTypeDescriptor<?> descriptor = descriptors.get(type);
        if (descriptor == null) {
            throw ReconcilerException.unregisteredObjectType(type);
        }
        return (ObjectTypeDescriptor<P>) descriptor;
    }

    /**
     * Manager override if present, otherwise the engine default for the type. An override does not exempt a type
     * from registration.
     */
    public <P> ObjectComparator<P> resolveComparator(ObjectType<P> type, ComparatorOverrides overrides) {
        ObjectTypeDescriptor<P> descriptor = getDescriptor(type);
        return overrides.find(type).orElse(descriptor.getDefaultComparator());
    }

    @Override
    public String toString() {
        return "ComparatorRegistry{types=" + descriptors.keySet() + '}';
    }

    public static Builder newBuilder() {
        return new Builder();
    }

    public static final class Builder {

        private final Map<ObjectType<?>, ObjectTypeDescriptor<?>> descriptors = new LinkedHashMap<>();

        private Builder() {
        }

        /**
         * Registering the same descriptor twice is a no-op. Managers sharing a type may each declare it.
         */
        public Builder register(ObjectTypeDescriptor<?> descriptor) {
            ObjectTypeDescriptor<?> previous = descriptors.get(descriptor.getType());
            if (previous == null) {
                descriptors.put(descriptor.getType(), descriptor);
            } else if (previous != descriptor) {
                throw ReconcilerException.conflictingObjectType(descriptor.getType());
            }
            return this;
        }

        public Builder registerAll(Collection<ObjectTypeDescriptor<?>> descriptors) {
            descriptors.forEach(this::register);
            return this;
        }

        public ComparatorRegistry build() {
            return new ComparatorRegistry(ImmutableMap.copyOf(descriptors));
        }
    }
}
