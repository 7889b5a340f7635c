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
import java.util.Optional;

/**
 * A single convergence step produced by the diff engine: {@code Create(object)}, {@code Update(identity, object)}
 * or {@code Delete(identity)}. Create and update actions carry the full object to write; delete carries only the
 * type and identity.
 */
public final class ReconcileAction {

    private final ActionKind kind;
    private final ObjectType<?> type;
    private final ObjectIdentity identity;
    private final Optional<ManagedObject<?>> object;

    private ReconcileAction(ActionKind kind, ObjectType<?> type, ObjectIdentity identity, Optional<ManagedObject<?>> object) {
        this.kind = kind;
        this.type = type;
        this.identity = identity;
        this.object = object;
    }

    public ActionKind getKind() {
        return kind;
    }

    public ObjectType<?> getType() {
        return type;
    }

    public ObjectIdentity getIdentity() {
        return identity;
    }

    /**
     * Object to write. Present for create and update actions, empty for delete.
     */
    public Optional<ManagedObject<?>> getObject() {
        return object;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        ReconcileAction that = (ReconcileAction) o;
        return kind == that.kind &&
                Objects.equals(type, that.type) &&
                Objects.equals(identity, that.identity) &&
                Objects.equals(object, that.object);
    }

    @Override
    public int hashCode() {
        return Objects.hash(kind, type, identity, object);
    }

    @Override
    public String toString() {
        return kind + "(" + type + ' ' + identity + ')';
    }

    public static ReconcileAction create(ManagedObject<?> object) {
        return new ReconcileAction(ActionKind.Create, object.getType(), object.getIdentity(), Optional.of(object));
    }

    public static ReconcileAction update(ObjectIdentity identity, ManagedObject<?> object) {
        return new ReconcileAction(ActionKind.Update, object.getType(), identity, Optional.of(object));
    }

    public static ReconcileAction delete(ObjectType<?> type, ObjectIdentity identity) {
        return new ReconcileAction(ActionKind.Delete, type, identity, Optional.empty());
    }
}
