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

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;

import com.google.common.base.Preconditions;

/**
 * Engine-level defaults for one object type: the allow-list of manager-controlled fields, the default comparator
 * and whether an existing object of this type may be updated in place.
 */
public final class ObjectTypeDescriptor<P> {

    private final ObjectType<P> type;
    private final List<ControlledField<P, ?>> controlledFields;
    private final Optional<ObjectComparator<P>> explicitComparator;
    private final boolean updatable;
    private final ObjectComparator<P> defaultComparator;

    private ObjectTypeDescriptor(ObjectType<P> type,
                                 List<ControlledField<P, ?>> controlledFields,
                                 Optional<ObjectComparator<P>> explicitComparator,
                                 boolean updatable) {
        this.type = type;
        this.controlledFields = controlledFields;
        this.explicitComparator = explicitComparator;
        this.updatable = updatable;
        this.defaultComparator = explicitComparator.orElse(this::compareControlledFields);
    }

    public ObjectType<P> getType() {
        return type;
    }

    /**
     * If false, an unequal deployed object is reported as drift but never updated. Presence alone drives
     * create and delete decisions for such types.
     */
    public boolean isUpdatable() {
        return updatable;
    }

    /**
     * The explicitly configured comparator or, if none, field-by-field equality over the controlled fields.
     */
    public ObjectComparator<P> getDefaultComparator() {
        return defaultComparator;
    }

    /**
     * Controlled fields of the desired payload merged over the deployed one. Every other field keeps its deployed
     * value.
     */
    public P merge(P desired, P deployed) {
        P result = deployed;
        for (ControlledField<P, ?> field : controlledFields) {
            result = field.copy(desired, result);
        }
        return result;
    }

    /**
     * Names of the controlled fields whose values differ between the two payloads.
     */
    public List<String> findDifferences(P desired, P deployed) {
        List<String> differences = new ArrayList<>();
        for (ControlledField<P, ?> field : controlledFields) {
            if (!field.isEqual(desired, deployed)) {
                differences.add(field.getName());
            }
        }
        return differences;
    }

    private boolean compareControlledFields(P desired, P deployed) {
        for (ControlledField<P, ?> field : controlledFields) {
            if (!field.isEqual(desired, deployed)) {
                return false;
            }
        }
        return true;
    }

    @Override
    public String toString() {
        return "ObjectTypeDescriptor{" +
                "type=" + type +
                ", controlledFields=" + controlledFields +
                ", explicitComparator=" + explicitComparator.isPresent() +
                ", updatable=" + updatable +
                '}';
    }

    public static <P> Builder<P> newBuilder(ObjectType<P> type) {
        return new Builder<>(type);
    }

    public static final class Builder<P> {

        private final ObjectType<P> type;
        private final List<ControlledField<P, ?>> controlledFields = new ArrayList<>();
        private ObjectComparator<P> comparator;
        private boolean updatable = true;

        private Builder(ObjectType<P> type) {
            this.type = type;
        }

        public Builder<P> withControlledField(ControlledField<P, ?> field) {
            this.controlledFields.add(field);
            return this;
        }

        public Builder<P> withComparator(ObjectComparator<P> comparator) {
            this.comparator = comparator;
            return this;
        }

        public Builder<P> withUpdatable(boolean updatable) {
            this.updatable = updatable;
            return this;
        }

        public ObjectTypeDescriptor<P> build() {
            Preconditions.checkNotNull(type, "object type not set");
            Preconditions.checkState(!controlledFields.isEmpty() || comparator != null,
                    "object type %s must declare controlled fields or an explicit comparator", type);
            return new ObjectTypeDescriptor<>(
                    type,
                    Collections.unmodifiableList(new ArrayList<>(controlledFields)),
                    Optional.ofNullable(comparator),
                    updatable
            );
        }
    }
}
