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
import java.util.Set;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSet;
import com.netflix.convergence.common.util.CollectionsExt;

/**
 * The namespace and owner labels a resource manager declares ownership over. The engine never updates or deletes
 * a deployed object outside of this scope.
 * <p>
 * Objects a manager looks up by their exact identity are owned regardless of their labels. The next create or update
 * stamps the owner labels on them.
 */
public final class OwnershipScope {

    private final String namespace;
    private final Map<String, String> ownerLabels;
    private final Set<ObjectIdentity> ownedIdentities;

    private OwnershipScope(String namespace, Map<String, String> ownerLabels, Set<ObjectIdentity> ownedIdentities) {
        this.namespace = namespace;
        this.ownerLabels = ownerLabels;
        this.ownedIdentities = ownedIdentities;
    }

    public String getNamespace() {
        return namespace;
    }

    public Map<String, String> getOwnerLabels() {
        return ownerLabels;
    }

    public Set<ObjectIdentity> getOwnedIdentities() {
        return ownedIdentities;
    }

    public boolean owns(ManagedObject<?> object) {
        if (!namespace.equals(object.getIdentity().getNamespace())) {
            return false;
        }
        return ownedIdentities.contains(object.getIdentity()) || CollectionsExt.containsAll(object.getLabels(), ownerLabels);
    }

    /**
     * Returns a scope that additionally owns the given identity, whatever labels the deployed object carries.
     */
    public OwnershipScope withOwnedIdentity(ObjectIdentity identity) {
        Preconditions.checkArgument(namespace.equals(identity.getNamespace()), "identity %s outside of namespace %s", identity, namespace);
        return new OwnershipScope(namespace, ownerLabels, ImmutableSet.<ObjectIdentity>builder().addAll(ownedIdentities).add(identity).build());
    }

    /**
     * Returns a copy of the object carrying the owner labels, so it is recognized as owned on subsequent passes.
     */
    public <P> ManagedObject<P> claim(ManagedObject<P> object) {
        if (CollectionsExt.containsAll(object.getLabels(), ownerLabels)) {
            return object;
        }
        return object.toBuilder().withLabels(CollectionsExt.merge(object.getLabels(), ownerLabels)).build();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        OwnershipScope that = (OwnershipScope) o;
        return Objects.equals(namespace, that.namespace)
                && Objects.equals(ownerLabels, that.ownerLabels)
                && Objects.equals(ownedIdentities, that.ownedIdentities);
    }

    @Override
    public int hashCode() {
        return Objects.hash(namespace, ownerLabels, ownedIdentities);
    }

    @Override
    public String toString() {
        return "OwnershipScope{" +
                "namespace='" + namespace + '\'' +
                ", ownerLabels=" + ownerLabels +
                ", ownedIdentities=" + ownedIdentities +
                '}';
    }

    public static OwnershipScope namespace(String namespace) {
        return of(namespace, Collections.emptyMap());
    }

    public static OwnershipScope of(String namespace, Map<String, String> ownerLabels) {
        Preconditions.checkArgument(namespace != null && !namespace.isEmpty(), "namespace not set");
        return new OwnershipScope(namespace, ImmutableMap.copyOf(CollectionsExt.nonNull(ownerLabels)), ImmutableSet.of());
    }
}
