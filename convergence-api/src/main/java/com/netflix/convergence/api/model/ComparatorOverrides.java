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

package com.netflix.convergence.api.model;

import java.util.HashMap;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

import com.google.common.collect.ImmutableMap;

/**
 * Per-type comparator overrides supplied by a resource manager. An empty instance means engine defaults apply to
 * every type the manager produces.
 */
public final class ComparatorOverrides {

    private static final ComparatorOverrides EMPTY = new ComparatorOverrides(ImmutableMap.of());

    private final Map<ObjectType<?>, ObjectComparator<?>> comparators;

    private ComparatorOverrides(Map<ObjectType<?>, ObjectComparator<?>> comparators) {
        this.comparators = comparators;
    }

    @SuppressWarnings("unchecked")
    public <P> Optional<ObjectComparator<P>> find(ObjectType<P> type) {
        return Optional.ofNullable((ObjectComparator<P>) comparators.get(type));
    }

    public Set<ObjectType<?>> getTypes() {
        return comparators.keySet();
    }

    public boolean isEmpty() {
        return comparators.isEmpty();
    }

    @Override
    public String toString() {
        return "ComparatorOverrides{types=" + comparators.keySet() + '}';
    }

    public static ComparatorOverrides empty() {
        return EMPTY;
    }

    public static <P> ComparatorOverrides of(ObjectType<P> type, ObjectComparator<P> comparator) {
        return newBuilder().with(type, comparator).build();
    }

    public static Builder newBuilder() {
        return new Builder();
    }

    public static final class Builder {

        private final Map<ObjectType<?>, ObjectComparator<?>> comparators = new HashMap<>();

        private Builder() {
        }

        public <P> Builder with(ObjectType<P> type, ObjectComparator<P> comparator) {
            comparators.put(type, comparator);
            return this;
        }

        public ComparatorOverrides build() {
            return comparators.isEmpty() ? EMPTY : new ComparatorOverrides(ImmutableMap.copyOf(comparators));
        }
    }
}
