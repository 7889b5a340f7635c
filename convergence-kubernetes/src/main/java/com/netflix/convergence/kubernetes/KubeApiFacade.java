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

package com.netflix.convergence.kubernetes;

import java.util.List;
import java.util.Map;

import io.kubernetes.client.openapi.models.V1PersistentVolumeClaim;
import io.kubernetes.client.openapi.models.V1Service;

/**
 * {@link KubeApiFacade} encapsulates the namespaced Kube API calls the resource store needs. Unlike CoreV1Api it is
 * an interface with a small surface, so it is easy to mock in the test code.
 */
public interface KubeApiFacade {

    // Persistent volume claims

    V1PersistentVolumeClaim readNamespacedPersistentVolumeClaim(String namespace, String name) throws KubeApiException;

    List<V1PersistentVolumeClaim> listNamespacedPersistentVolumeClaims(String namespace, Map<String, String> labelSelector) throws KubeApiException;

    V1PersistentVolumeClaim createNamespacedPersistentVolumeClaim(String namespace, V1PersistentVolumeClaim claim) throws KubeApiException;

    V1PersistentVolumeClaim replaceNamespacedPersistentVolumeClaim(String namespace, V1PersistentVolumeClaim claim) throws KubeApiException;

    void deleteNamespacedPersistentVolumeClaim(String namespace, String name) throws KubeApiException;

    // Services

    V1Service readNamespacedService(String namespace, String name) throws KubeApiException;

    List<V1Service> listNamespacedServices(String namespace, Map<String, String> labelSelector) throws KubeApiException;

    V1Service createNamespacedService(String namespace, V1Service service) throws KubeApiException;

    V1Service replaceNamespacedService(String namespace, V1Service service) throws KubeApiException;

    void deleteNamespacedService(String namespace, String name) throws KubeApiException;
}
