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

package com.netflix.convergence.api.service;

import java.util.List;
import java.util.Map;

import com.netflix.convergence.api.model.ManagedObject;
import com.netflix.convergence.api.model.ObjectIdentity;
import com.netflix.convergence.api.model.ObjectType;

/**
 * Capability-typed access to the backing store holding deployed objects, addressed by (namespace, type, name).
 * All operations throw {@link ResourceStoreException}; absence of a single object is reported with
 * {@link ResourceStoreException.ErrorCode#NotFound}, so callers can tell it apart from real failures.
 */
public interface ResourceStore {

    <P> ManagedObject<P> get(ObjectType<P> type, ObjectIdentity identity);

    /**
     * Returns all objects of the given type in the namespace carrying every label of the selector. An empty selector
     * matches all objects in the namespace.
     */
    <P> List<ManagedObject<P>> list(ObjectType<P> type, String namespace, Map<String, String> labelSelector);

    <P> ManagedObject<P> create(ManagedObject<P> object);

    <P> ManagedObject<P> update(ManagedObject<P> object);

    void delete(ObjectType<?> type, ObjectIdentity identity);
}
