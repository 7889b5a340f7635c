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

import java.util.Objects;

import com.google.common.base.Preconditions;

/**
 * Type tag of a managed object. Pairs a stable name with the payload class, so registries can be keyed by
 * {@link ObjectType} and hand back correctly typed comparators and descriptors.
 */
public final class ObjectType<P> {

    private final String name;
    private final Class<P> payloadType;

    private ObjectType(String name, Class<P> payloadType) {
        this.name = name;
        this.payloadType = payloadType;
    }

    public String getName() {
        return name;
    }

    public Class<P> getPayloadType() {
        return payloadType;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        ObjectType<?> that = (ObjectType<?>) o;
        return Objects.equals(name, that.name) && Objects.equals(payloadType, that.payloadType);
    }

    @Override
    public int hashCode() {
        return Objects.hash(name, payloadType);
    }

    @Override
    public String toString() {
        return name;
    }

    public static <P> ObjectType<P> of(String name, Class<P> payloadType) {
        Preconditions.checkArgument(name != null && !name.isEmpty(), "object type name not set");
        Preconditions.checkNotNull(payloadType, "payload type not set");
        return new ObjectType<>(name, payloadType);
    }
}
