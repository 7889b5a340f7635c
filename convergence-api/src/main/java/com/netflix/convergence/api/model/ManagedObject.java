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

import java.util.Collections;
import java.util.Map;
import java.util.Objects;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableMap;

/**
 * An object under management: a type tag, a stable identity, ownership labels and an opaque payload holding
 * either the desired or the observed content. Instances are created fresh on each reconciliation pass.
 */
public final class ManagedObject<P> {

    private final ObjectType<P> type;
    private final ObjectIdentity identity;
    private final Map<String, String> labels;
    private final P payload;

    private ManagedObject(ObjectType<P> type, ObjectIdentity identity, Map<String, String> labels, P payload) {
        this.type = type;
        this.identity = identity;
        this.labels = labels;
        this.payload = payload;
    }

    public ObjectType<P> getType() {
        return type;
    }

    public ObjectIdentity getIdentity() {
        return identity;
    }

    public Map<String, String> getLabels() {
        return labels;
    }

    public P getPayload() {
        return payload;
    }

    /**
     * Narrows an object of unknown payload type, after checking its type tag.
     */
    @SuppressWarnings("unchecked")
    public <T> ManagedObject<T> as(ObjectType<T> expectedType) {
        Preconditions.checkArgument(type.equals(expectedType), "Expected object of type %s, got %s", expectedType, type);
        return (ManagedObject<T>) this;
    }

    public ManagedObject<P> withPayload(P newPayload) {
        return toBuilder().withPayload(newPayload).build();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        ManagedObject<?> that = (ManagedObject<?>) o;
        return Objects.equals(type, that.type) &&
                Objects.equals(identity, that.identity) &&
                Objects.equals(labels, that.labels) &&
                Objects.equals(payload, that.payload);
    }

    @Override
    public int hashCode() {
        return Objects.hash(type, identity, labels, payload);
    }

    @Override
    public String toString() {
        return "ManagedObject{" +
                "type=" + type +
                ", identity=" + identity +
                ", labels=" + labels +
                ", payload=" + payload +
                '}';
    }

    public Builder<P> toBuilder() {
        return ManagedObject.newBuilder(type)
                .withIdentity(identity)
                .withLabels(labels)
                .withPayload(payload);
    }

    public static <P> Builder<P> newBuilder(ObjectType<P> type) {
        return new Builder<>(type);
    }

    public static final class Builder<P> {

        private final ObjectType<P> type;
        private ObjectIdentity identity;
        private Map<String, String> labels = Collections.emptyMap();
        private P payload;

        private Builder(ObjectType<P> type) {
            this.type = type;
        }

        public Builder<P> withIdentity(ObjectIdentity identity) {
            this.identity = identity;
            return this;
        }

        public Builder<P> withIdentity(String namespace, String name) {
            return withIdentity(ObjectIdentity.of(namespace, name));
        }

        public Builder<P> withLabels(Map<String, String> labels) {
            this.labels = labels;
            return this;
        }

        public Builder<P> withPayload(P payload) {
            this.payload = payload;
            return this;
        }

        public ManagedObject<P> build() {
            Preconditions.checkNotNull(type, "object type not set");
            Preconditions.checkNotNull(identity, "identity not set");
            Preconditions.checkNotNull(payload, "payload not set");
            Preconditions.checkArgument(type.getPayloadType().isInstance(payload), "%s payload expected, got %s",
                    type, payload.getClass().getSimpleName());
            return new ManagedObject<>(type, identity, labels == null ? Collections.emptyMap() : ImmutableMap.copyOf(labels), payload);
        }
    }
}
