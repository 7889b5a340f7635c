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

import java.util.Comparator;
import java.util.Objects;

import com.netflix.convergence.api.model.ManagedObject;
import com.netflix.convergence.api.model.ObjectIdentity;
import com.netflix.convergence.api.model.ObjectType;

/**
 * Type and identity pair. Two objects with the same key denote the same store object.
 */
final class ObjectKey implements Comparable<ObjectKey> {

    private static final Comparator<ObjectKey> ORDER = Comparator
            .comparing(ObjectKey::getIdentity)
            .thenComparing(key -> key.getType().getName());

    private final ObjectType<?> type;
    private final ObjectIdentity identity;

    private ObjectKey(ObjectType<?> type, ObjectIdentity identity) {
        this.type = type;
        this.identity = identity;
    }

    ObjectType<?> getType() {
        return type;
    }

    ObjectIdentity getIdentity() {
        return identity;
    }

    @Override
    public int compareTo(ObjectKey other) {
        return ORDER.compare(this, other);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        ObjectKey objectKey = (ObjectKey) o;
        return Objects.equals(type, objectKey.type) && Objects.equals(identity, objectKey.identity);
    }

    @Override
    public int hashCode() {
        return Objects.hash(type, identity);
    }

    @Override
    public String toString() {
        return type + " " + identity;
    }

    static ObjectKey of(ManagedObject<?> object) {
        return new ObjectKey(object.getType(), object.getIdentity());
    }
}
