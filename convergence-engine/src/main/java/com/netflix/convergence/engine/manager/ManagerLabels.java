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

package com.netflix.convergence.engine.manager;

import java.util.Map;

import com.google.common.collect.ImmutableMap;
import com.netflix.convergence.api.model.OwnershipScope;
import com.netflix.convergence.api.model.ReconciliationTarget;

/**
 * Labels marking objects created on behalf of a reconciliation target.
 */
public final class ManagerLabels {

    public static final String LABEL_MANAGED_BY = "app.kubernetes.io/managed-by";
    public static final String LABEL_INSTANCE = "app.kubernetes.io/instance";

    public static final String MANAGED_BY_VALUE = "convergence";

    private ManagerLabels() {
    }

    public static Map<String, String> ownerLabels(ReconciliationTarget<?> target) {
        return ImmutableMap.of(
                LABEL_MANAGED_BY, MANAGED_BY_VALUE,
                LABEL_INSTANCE, target.getName()
        );
    }

    public static OwnershipScope ownershipScope(ReconciliationTarget<?> target) {
        return OwnershipScope.of(target.getNamespace(), ownerLabels(target));
    }
}
