/*
 * Copyright 2018 Netflix, Inc.
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

package com.netflix.convergence.common.util;

import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * A set of additional collections related functions.
 */
public final class CollectionsExt {

    private CollectionsExt() {
    }

    public static <K, V> boolean isNullOrEmpty(Map<K, V> map) {
        return map == null || map.isEmpty();
    }

    public static <T> List<T> nonNull(List<T> collection) {
        return collection == null ? Collections.emptyList() : collection;
    }

    public static <K, V> Map<K, V> nonNull(Map<K, V> map) {
        return map == null ? Collections.emptyMap() : map;
    }

    @SafeVarargs
    public static <K, V> Map<K, V> merge(Map<K, V>... maps) {
        if (maps.length == 0) {
            return Collections.emptyMap();
        }
        if (maps.length == 1) {
            return maps[0];
        }
        Map<K, V> result = new HashMap<>(maps[0]);
        for (int i = 1; i < maps.length; i++) {
            result.putAll(maps[i]);
        }
        return result;
    }

    /**
     * Returns true if all entries of the subset are present with equal values in the superset.
     */
    public static <K, V> boolean containsAll(Map<K, V> superset, Map<K, V> subset) {
        if (isNullOrEmpty(subset)) {
            return true;
        }
        if (isNullOrEmpty(superset)) {
            return false;
        }
        for (Map.Entry<K, V> entry : subset.entrySet()) {
            V value = superset.get(entry.getKey());
            if (value == null || !value.equals(entry.getValue())) {
                return false;
            }
        }
        return true;
    }
}
