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

package com.netflix.convergence.testkit.store;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.UnaryOperator;

import com.netflix.convergence.api.model.ManagedObject;
import com.netflix.convergence.api.model.ObjectIdentity;
import com.netflix.convergence.api.model.ObjectType;
import com.netflix.convergence.api.service.ResourceStore;
import com.netflix.convergence.api.service.ResourceStoreException;
import com.netflix.convergence.common.util.CollectionsExt;

/**
 * {@link ResourceStore} keeping objects in memory. Errors can be injected for a single request, or permanently for
 * all requests touching an object type, to simulate backend outages.
 */
public class InMemoryResourceStore implements ResourceStore {

    private final ConcurrentMap<Key, ManagedObject<?>> objects = new ConcurrentHashMap<>();
    private final Map<ObjectType<?>, UnaryOperator<?>> createHooks = new HashMap<>();
    private final ConcurrentMap<ObjectType<?>, RuntimeException> typeFailures = new ConcurrentHashMap<>();
    private final AtomicReference<RuntimeException> nextRequestFailure = new AtomicReference<>();
    private final AtomicInteger mutationCounter = new AtomicInteger();

    /**
     * Registers a function applied to every created object of the given type, to populate server-owned fields.
     */
    public <P> InMemoryResourceStore withCreateHook(ObjectType<P> type, UnaryOperator<P> hook) {
        createHooks.put(type, hook);
        return this;
    }

    /**
     * The next request, whatever it is, fails with the given error.
     */
    public void failNextRequest(RuntimeException error) {
        nextRequestFailure.set(error);
    }

    /**
     * All requests touching the given type fail with the given error, until {@link #clearFailures()} is called.
     */
    public void failRequests(ObjectType<?> type, RuntimeException error) {
        typeFailures.put(type, error);
    }

    public void clearFailures() {
        nextRequestFailure.set(null);
        typeFailures.clear();
    }

    /**
     * Adds the object directly, bypassing error injection and hooks.
     */
    public <P> void add(ManagedObject<P> object) {
        objects.put(Key.of(object.getType(), object.getIdentity()), object);
    }

    public List<ManagedObject<?>> getAll() {
        List<ManagedObject<?>> result = new ArrayList<>(objects.values());
        result.sort(Comparator.<ManagedObject<?>, ObjectIdentity>comparing(ManagedObject::getIdentity)
                .thenComparing(o -> o.getType().getName()));
        return result;
    }

    public int getMutationCount() {
        return mutationCounter.get();
    }

    @Override
    public <P> ManagedObject<P> get(ObjectType<P> type, ObjectIdentity identity) {
        checkFailures(type);
        ManagedObject<P> object = find(type, identity);
        if (object == null) {
            throw ResourceStoreException.notFound(type, identity);
        }
        return object;
    }

    @Override
    public <P> List<ManagedObject<P>> list(ObjectType<P> type, String namespace, Map<String, String> labelSelector) {
        checkFailures(type);
        List<ManagedObject<P>> result = new ArrayList<>();
        objects.forEach((key, object) -> {
            if (key.type.equals(type)
                    && key.identity.getNamespace().equals(namespace)
                    && CollectionsExt.containsAll(object.getLabels(), labelSelector)) {
                result.add(cast(type, object));
            }
        });
        result.sort(Comparator.comparing(ManagedObject::getIdentity));
        return result;
    }

    @Override
    public <P> ManagedObject<P> create(ManagedObject<P> object) {
        checkFailures(object.getType());
        ManagedObject<P> created = applyCreateHook(object);
        if (objects.putIfAbsent(Key.of(object.getType(), object.getIdentity()), created) != null) {
            throw ResourceStoreException.alreadyExists(object.getType(), object.getIdentity());
        }
        mutationCounter.incrementAndGet();
        return created;
    }

    @Override
    public <P> ManagedObject<P> update(ManagedObject<P> object) {
        checkFailures(object.getType());
        Key key = Key.of(object.getType(), object.getIdentity());
        if (objects.replace(key, object) == null) {
            throw ResourceStoreException.notFound(object.getType(), object.getIdentity());
        }
        mutationCounter.incrementAndGet();
        return object;
    }

    @Override
    public void delete(ObjectType<?> type, ObjectIdentity identity) {
        checkFailures(type);
        if (objects.remove(Key.of(type, identity)) == null) {
            throw ResourceStoreException.notFound(type, identity);
        }
        mutationCounter.incrementAndGet();
    }

    private <P> ManagedObject<P> find(ObjectType<P> type, ObjectIdentity identity) {
        ManagedObject<?> object = objects.get(Key.of(type, identity));
        return object == null ? null : cast(type, object);
    }

    @SuppressWarnings("unchecked")
    private <P> ManagedObject<P> applyCreateHook(ManagedObject<P> object) {
        UnaryOperator<P> hook = (UnaryOperator<P>) createHooks.get(object.getType());
        return hook == null ? object : object.withPayload(hook.apply(object.getPayload()));
    }

    private void checkFailures(ObjectType<?> type) {
        RuntimeException oneTime = nextRequestFailure.getAndSet(null);
        if (oneTime != null) {
            throw oneTime;
        }
        RuntimeException typeFailure = typeFailures.get(type);
        if (typeFailure != null) {
            throw typeFailure;
        }
    }

    private static <P> ManagedObject<P> cast(ObjectType<P> type, ManagedObject<?> object) {
        return object.as(type);
    }

    private static final class Key {

        private final ObjectType<?> type;
        private final ObjectIdentity identity;

        private Key(ObjectType<?> type, ObjectIdentity identity) {
            this.type = type;
            this.identity = identity;
        }

        private static Key of(ObjectType<?> type, ObjectIdentity identity) {
            return new Key(type, identity);
        }

        @Override
        public boolean equals(Object o) {
            if (this == o) {
                return true;
            }
            if (o == null || getClass() != o.getClass()) {
                return false;
            }
            Key key = (Key) o;
            return Objects.equals(type, key.type) && Objects.equals(identity, key.identity);
        }

        @Override
        public int hashCode() {
            return Objects.hash(type, identity);
        }
    }
}
