/*
 * Copyright 2020 Netflix, Inc.
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
import java.util.stream.Collectors;
import javax.inject.Inject;
import javax.inject.Singleton;

import com.netflix.convergence.common.util.CollectionsExt;
import io.kubernetes.client.openapi.ApiClient;
import io.kubernetes.client.openapi.ApiException;
import io.kubernetes.client.openapi.apis.CoreV1Api;
import io.kubernetes.client.openapi.models.V1PersistentVolumeClaim;
import io.kubernetes.client.openapi.models.V1Service;

@Singleton
public class DefaultKubeApiFacade implements KubeApiFacade {

    public static final String BACKGROUND = "Background";

    private final CoreV1Api coreV1Api;

    @Inject
    public DefaultKubeApiFacade(ApiClient apiClient) {
        this(new CoreV1Api(apiClient));
    }

    public DefaultKubeApiFacade(CoreV1Api coreV1Api) {
        this.coreV1Api = coreV1Api;
    }

    @Override
    public V1PersistentVolumeClaim readNamespacedPersistentVolumeClaim(String namespace, String name) throws KubeApiException {
        try {
            return coreV1Api.readNamespacedPersistentVolumeClaim(name, namespace, null, null, null);
        } catch (ApiException e) {
            throw new KubeApiException(e);
        }
    }

    @Override
    public List<V1PersistentVolumeClaim> listNamespacedPersistentVolumeClaims(String namespace, Map<String, String> labelSelector) throws KubeApiException {
        try {
            return coreV1Api.listNamespacedPersistentVolumeClaim(
                    namespace,
                    null,
                    null,
                    null,
                    null,
                    toLabelSelector(labelSelector),
                    null,
                    null,
                    null,
                    null,
                    null
            ).getItems();
        } catch (ApiException e) {
            throw new KubeApiException(e);
        }
    }

    @Override
    public V1PersistentVolumeClaim createNamespacedPersistentVolumeClaim(String namespace, V1PersistentVolumeClaim claim) throws KubeApiException {
        try {
            return coreV1Api.createNamespacedPersistentVolumeClaim(namespace, claim, null, null, null);
        } catch (ApiException e) {
            throw new KubeApiException(e);
        }
    }

    @Override
    public V1PersistentVolumeClaim replaceNamespacedPersistentVolumeClaim(String namespace, V1PersistentVolumeClaim claim) throws KubeApiException {
        try {
            return coreV1Api.replaceNamespacedPersistentVolumeClaim(
                    KubeModelConverters.getMetadataName(claim.getMetadata()),
                    namespace,
                    claim,
                    null,
                    null,
                    null
            );
        } catch (ApiException e) {
            throw new KubeApiException(e);
        }
    }

    @Override
    public void deleteNamespacedPersistentVolumeClaim(String namespace, String name) throws KubeApiException {
        try {
            coreV1Api.deleteNamespacedPersistentVolumeClaim(
                    name,
                    namespace,
                    null,
                    null,
                    0,
                    null,
                    null,
                    null
            );
        } catch (ApiException e) {
            throw new KubeApiException(e);
        }
    }

    @Override
    public V1Service readNamespacedService(String namespace, String name) throws KubeApiException {
        try {
            return coreV1Api.readNamespacedService(name, namespace, null, null, null);
        } catch (ApiException e) {
            throw new KubeApiException(e);
        }
    }

    @Override
    public List<V1Service> listNamespacedServices(String namespace, Map<String, String> labelSelector) throws KubeApiException {
        try {
            return coreV1Api.listNamespacedService(
                    namespace,
                    null,
                    null,
                    null,
                    null,
                    toLabelSelector(labelSelector),
                    null,
                    null,
                    null,
                    null,
                    null
            ).getItems();
        } catch (ApiException e) {
            throw new KubeApiException(e);
        }
    }

    @Override
    public V1Service createNamespacedService(String namespace, V1Service service) throws KubeApiException {
        try {
            return coreV1Api.createNamespacedService(namespace, service, null, null, null);
        } catch (ApiException e) {
            throw new KubeApiException(e);
        }
    }

    @Override
    public V1Service replaceNamespacedService(String namespace, V1Service service) throws KubeApiException {
        try {
            return coreV1Api.replaceNamespacedService(
                    KubeModelConverters.getMetadataName(service.getMetadata()),
                    namespace,
                    service,
                    null,
                    null,
                    null
            );
        } catch (ApiException e) {
            throw new KubeApiException(e);
        }
    }

    @Override
    public void deleteNamespacedService(String namespace, String name) throws KubeApiException {
        try {
            coreV1Api.deleteNamespacedService(
                    name,
                    namespace,
                    null,
                    null,
                    0,
                    null,
                    BACKGROUND,
                    null
            );
        } catch (ApiException e) {
            throw new KubeApiException(e);
        }
    }

    /**
     * Equality-based selector in the Kube query notation, for example {@code a=1,b=2}. Null for an empty selector.
     */
    static String toLabelSelector(Map<String, String> labelSelector) {
        if (CollectionsExt.isNullOrEmpty(labelSelector)) {
            return null;
        }
        return labelSelector.entrySet().stream()
                .sorted(Map.Entry.comparingByKey())
                .map(entry -> entry.getKey() + '=' + entry.getValue())
                .collect(Collectors.joining(","));
    }
}
