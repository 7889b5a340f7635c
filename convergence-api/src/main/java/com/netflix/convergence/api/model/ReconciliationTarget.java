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
 * The owner being reconciled: its stable identity and the read-only desired state handed to every
 * resource manager.
 */
public final class ReconciliationTarget<S> {

    private final ObjectIdentity identity;
    private final S spec;

    private ReconciliationTarget(ObjectIdentity identity, S spec) {
        this.identity = identity;
        this.spec = spec;
    }

    public ObjectIdentity getIdentity() {
        return identity;
    }

    public String getNamespace() {
        return identity.getNamespace();
    }

    public String getName() {
        return identity.getName();
    }

    public S getSpec() {
        return spec;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        ReconciliationTarget<?> that = (ReconciliationTarget<?>) o;
        return Objects.equals(identity, that.identity) && Objects.equals(spec, that.spec);
    }

    @Override
    public int hashCode() {
        return Objects.hash(identity, spec);
    }

    @Override
    public String toString() {
        return "ReconciliationTarget{" +
                "identity=" + identity +
                ", spec=" + spec +
                '}';
    }

    public static <S> ReconciliationTarget<S> of(String namespace, String name, S spec) {
        return of(ObjectIdentity.of(namespace, name), spec);
    }

    public static <S> ReconciliationTarget<S> of(ObjectIdentity identity, S spec) {
        Preconditions.checkNotNull(identity, "identity not set");
        Preconditions.checkNotNull(spec, "spec not set");
        return new ReconciliationTarget<>(identity, spec);
    }
}
