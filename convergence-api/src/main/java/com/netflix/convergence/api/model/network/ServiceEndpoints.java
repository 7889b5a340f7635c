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

package com.netflix.convergence.api.model.network;

import java.util.Map;

import com.netflix.convergence.api.model.ControlledField;
import com.netflix.convergence.api.model.ObjectType;
import com.netflix.convergence.api.model.ObjectTypeDescriptor;

public final class ServiceEndpoints {

    public static final ObjectType<ServiceEndpoint> SERVICE_ENDPOINT = ObjectType.of("ServiceEndpoint", ServiceEndpoint.class);

    public static final ControlledField<ServiceEndpoint, String> EXPOSURE_TYPE = ControlledField.of(
            "exposureType", ServiceEndpoint::getExposureType, ServiceEndpoint::withExposureType
    );

    public static final ControlledField<ServiceEndpoint, Integer> PORT = ControlledField.of(
            "port", ServiceEndpoint::getPort, ServiceEndpoint::withPort
    );

    public static final ControlledField<ServiceEndpoint, Integer> TARGET_PORT = ControlledField.of(
            "targetPort", ServiceEndpoint::getTargetPort, ServiceEndpoint::withTargetPort
    );

    public static final ControlledField<ServiceEndpoint, Map<String, String>> SELECTOR = ControlledField.of(
            "selector", ServiceEndpoint::getSelector, ServiceEndpoint::withSelector
    );

    /**
     * Cluster IP is assigned by the store, and is not a controlled field.
     */
    public static final ObjectTypeDescriptor<ServiceEndpoint> DESCRIPTOR = ObjectTypeDescriptor.newBuilder(SERVICE_ENDPOINT)
            .withControlledField(EXPOSURE_TYPE)
            .withControlledField(PORT)
            .withControlledField(TARGET_PORT)
            .withControlledField(SELECTOR)
            .build();

    private ServiceEndpoints() {
    }
}
