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
import java.util.function.BiFunction;
import java.util.function.Function;

/**
 * A payload field whose value is decided by the resource manager. Fields not declared as controlled are owned
 * by the backing store (generated identifiers, status, timestamps), and are neither compared nor overwritten.
 */
public final class ControlledField<P, V> {

    private final String name;
    private final Function<P, V> getter;
    private final BiFunction<P, V, P> setter;

    private ControlledField(String name, Function<P, V> getter, BiFunction<P, V, P> setter) {
        this.name = name;
        this.getter = getter;
        this.setter = setter;
    }

    public String getName() {
        return name;
    }

    public boolean isEqual(P first, P second) {
        return Objects.equals(getter.apply(first), getter.apply(second));
    }

    /**
     * Returns a copy of the target with this field's value taken from the source.
     */
    public P copy(P source, P target) {
        return setter.apply(target, getter.apply(source));
    }

    @Override
    public String toString() {
        return name;
    }

    /**
     * @param setter returns a copy of the payload with the new field value; payloads are never mutated in place
     */
    public static <P, V> ControlledField<P, V> of(String name, Function<P, V> getter, BiFunction<P, V, P> setter) {
        return new ControlledField<>(name, getter, setter);
    }
}
