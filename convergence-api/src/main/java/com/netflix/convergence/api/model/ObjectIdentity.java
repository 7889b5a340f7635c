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

import java.util.Comparator;
import java.util.Objects;

import com.google.common.base.Preconditions;

/**
 * Stable identity of a managed object. Unique within a (namespace, type) pair, and expected to stay the same
 * across reconciliation passes.
 */
public final class ObjectIdentity implements Comparable<ObjectIdentity> {

    private static final Comparator<ObjectIdentity> COMPARATOR = Comparator
            .comparing(ObjectIdentity::getNamespace)
            .thenComparing(ObjectIdentity::getName);

    private final String namespace;
    private final String name;

    private ObjectIdentity(String namespace, String name) {
        this.namespace = namespace;
        this.name = name;
    }

    public String getNamespace() {
        return namespace;
    }

    public String getName() {
        return name;
    }

    @Override
    public int compareTo(ObjectIdentity other) {
        return COMPARATOR.compare(this, other);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        ObjectIdentity that = (ObjectIdentity) o;
        return Objects.equals(namespace, that.namespace) && Objects.equals(name, that.name);
    }

    @Override
    public int hashCode() {
        return Objects.hash(namespace, name);
    }

    @Override
    public String toString() {
        return namespace + '/' + name;
    }

    public static ObjectIdentity of(String namespace, String name) {
        Preconditions.checkArgument(namespace != null && !namespace.isEmpty(), "namespace not set");
        Preconditions.checkArgument(name != null && !name.isEmpty(), "name not set");
        return new ObjectIdentity(namespace, name);
    }
}
