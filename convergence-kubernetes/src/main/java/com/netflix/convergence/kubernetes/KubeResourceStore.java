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

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.function.Supplier;
import javax.inject.Inject;
import javax.inject.Singleton;

import com.google.common.collect.ImmutableMap;
import com.netflix.convergence.api.model.ManagedObject;
import com.netflix.convergence.api.model.ObjectIdentity;
import com.netflix.convergence.api.model.ObjectType;
import com.netflix.convergence.api.model.network.ServiceEndpoint;
import com.netflix.convergence.api.model.network.ServiceEndpoints;
import com.netflix.convergence.api.model.storage.StorageClaim;
import com.netflix.convergence.api.model.storage.StorageClaims;
import com.netflix.convergence.api.service.ResourceStore;
import com.netflix.convergence.api.service.ResourceStoreException;
import com.netflix.convergence.api.service.ResourceStoreException.ErrorCode;
import io.kubernetes.client.openapi.models.V1PersistentVolumeClaim;
import io.kubernetes.client.openapi.models.V1Service;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * {@link ResourceStore} backed by the Kube API server. Storage claims are persistent volume claims, and service
 * endpoints are services. Kube API errors are translated to {@link ResourceStoreException} with the API server
 * message preserved.
 */
@Singleton
public class KubeResourceStore implements ResourceStore {

    private static final Logger logger = LoggerFactory.getLogger(KubeResourceStore.class);

    private final Map<ObjectType<?>, KubeObjectHandler<?, ?>> handlers;

    @Inject
    public KubeResourceStore(KubeApiFacade kubeApiFacade) {
        this.handlers = ImmutableMap.<ObjectType<?>, KubeObjectHandler<?, ?>>of(
                StorageClaims.STORAGE_CLAIM, new PersistentVolumeClaimHandler(kubeApiFacade),
                ServiceEndpoints.SERVICE_ENDPOINT, new ServiceHandler(kubeApiFacade)
        );
    }

    @Override
    public <P> ManagedObject<P> get(ObjectType<P> type, ObjectIdentity identity) {
        KubeObjectHandler<P, ?> handler = getHandler(type);
        return invoke(type, "get " + identity, () -> handler.get(identity));
    }

    @Override
    public <P> List<ManagedObject<P>> list(ObjectType<P> type, String namespace, Map<String, String> labelSelector) {
        KubeObjectHandler<P, ?> handler = getHandler(type);
        List<ManagedObject<P>> result = invoke(type, "list " + namespace, () -> handler.list(namespace, labelSelector));
        result.sort(Comparator.comparing(ManagedObject::getIdentity));
        return result;
    }

    @Override
    public <P> ManagedObject<P> create(ManagedObject<P> object) {
        KubeObjectHandler<P, ?> handler = getHandler(object.getType());
        ManagedObject<P> created = invoke(object.getType(), "create " + object.getIdentity(), () -> handler.create(object));
        logger.info("Created {} {}", object.getType(), object.getIdentity());
        return created;
    }

    @Override
    public <P> ManagedObject<P> update(ManagedObject<P> object) {
        KubeObjectHandler<P, ?> handler = getHandler(object.getType());
        ManagedObject<P> updated = invoke(object.getType(), "update " + object.getIdentity(), () -> handler.update(object));
        logger.info("Updated {} {}", object.getType(), object.getIdentity());
        return updated;
    }

    @Override
    public void delete(ObjectType<?> type, ObjectIdentity identity) {
        KubeObjectHandler<?, ?> handler = getHandler(type);
        invoke(type, "delete " + identity, () -> {
            handler.delete(identity);
            return null;
        });
        logger.info("Deleted {} {}", type, identity);
    }

    @SuppressWarnings("unchecked")
    private <P> KubeObjectHandler<P, ?> getHandler(ObjectType<P> type) {
        KubeObjectHandler<?, ?> handler = handlers.get(type);
        if (handler == null) {
            throw ResourceStoreException.unsupportedType(type);
        }
        return (KubeObjectHandler<P, ?>) handler;
    }

    private static <T> T invoke(ObjectType<?> type, String operation, Supplier<T> action) {
        try {
            return action.get();
        } catch (KubeApiException e) {
            logger.debug("Kube request failed: type={}, operation={}, errorCode={}", type, operation, e.getErrorCode());
            throw ResourceStoreException.of(toErrorCode(e.getErrorCode()), e.getMessage(), e);
        } catch (IllegalArgumentException e) {
            throw ResourceStoreException.internal(String.format("Cannot convert %s object (%s): %s", type, operation, e.getMessage()), e);
        }
    }

    static ErrorCode toErrorCode(KubeApiException.ErrorCode errorCode) {
        switch (errorCode) {
            case NOT_FOUND:
                return ErrorCode.NotFound;
            case CONFLICT_ALREADY_EXISTS:
                return ErrorCode.AlreadyExists;
            case FORBIDDEN:
                return ErrorCode.Forbidden;
            case UNAVAILABLE:
                return ErrorCode.Unavailable;
            case INTERNAL:
            default:
                return ErrorCode.Internal;
        }
    }

    /**
     * Maps one object type onto one Kube entity type. Updates read the current entity first, and replace it with
     * the managed fields applied, so fields populated by the API server survive.
     */
    private static abstract class KubeObjectHandler<P, K> {

        abstract K read(ObjectIdentity identity);

        abstract List<K> readAll(String namespace, Map<String, String> labelSelector);

        abstract K write(String namespace, K entity);

        abstract K replace(String namespace, K entity);

        abstract void delete(ObjectIdentity identity);

        abstract ManagedObject<P> toManagedObject(K entity);

        abstract K toEntity(ManagedObject<P> object);

        abstract K apply(K current, ManagedObject<P> object);

        ManagedObject<P> get(ObjectIdentity identity) {
            return toManagedObject(read(identity));
        }

        List<ManagedObject<P>> list(String namespace, Map<String, String> labelSelector) {
            List<ManagedObject<P>> result = new ArrayList<>();
            for (K entity : readAll(namespace, labelSelector)) {
                result.add(toManagedObject(entity));
            }
            return result;
        }

        ManagedObject<P> create(ManagedObject<P> object) {
            return toManagedObject(write(object.getIdentity().getNamespace(), toEntity(object)));
        }

        ManagedObject<P> update(ManagedObject<P> object) {
            K current = read(object.getIdentity());
            return toManagedObject(replace(object.getIdentity().getNamespace(), apply(current, object)));
        }
    }

    private static class PersistentVolumeClaimHandler extends KubeObjectHandler<StorageClaim, V1PersistentVolumeClaim> {

        private final KubeApiFacade kubeApiFacade;

        private PersistentVolumeClaimHandler(KubeApiFacade kubeApiFacade) {
            this.kubeApiFacade = kubeApiFacade;
        }

        @Override
        V1PersistentVolumeClaim read(ObjectIdentity identity) {
            return kubeApiFacade.readNamespacedPersistentVolumeClaim(identity.getNamespace(), identity.getName());
        }

        @Override
        List<V1PersistentVolumeClaim> readAll(String namespace, Map<String, String> labelSelector) {
            return kubeApiFacade.listNamespacedPersistentVolumeClaims(namespace, labelSelector);
        }

        @Override
        V1PersistentVolumeClaim write(String namespace, V1PersistentVolumeClaim entity) {
            return kubeApiFacade.createNamespacedPersistentVolumeClaim(namespace, entity);
        }

        @Override
        V1PersistentVolumeClaim replace(String namespace, V1PersistentVolumeClaim entity) {
            return kubeApiFacade.replaceNamespacedPersistentVolumeClaim(namespace, entity);
        }

        @Override
        void delete(ObjectIdentity identity) {
            kubeApiFacade.deleteNamespacedPersistentVolumeClaim(identity.getNamespace(), identity.getName());
        }

        @Override
        ManagedObject<StorageClaim> toManagedObject(V1PersistentVolumeClaim entity) {
            return KubeModelConverters.toStorageClaim(entity);
        }

        @Override
        V1PersistentVolumeClaim toEntity(ManagedObject<StorageClaim> object) {
            return KubeModelConverters.toV1PersistentVolumeClaim(object);
        }

        @Override
        V1PersistentVolumeClaim apply(V1PersistentVolumeClaim current, ManagedObject<StorageClaim> object) {
            return KubeModelConverters.applyStorageClaim(current, object);
        }
    }

    private static class ServiceHandler extends KubeObjectHandler<ServiceEndpoint, V1Service> {

        private final KubeApiFacade kubeApiFacade;

        private ServiceHandler(KubeApiFacade kubeApiFacade) {
            this.kubeApiFacade = kubeApiFacade;
        }

        @Override
        V1Service read(ObjectIdentity identity) {
            return kubeApiFacade.readNamespacedService(identity.getNamespace(), identity.getName());
        }

        @Override
        List<V1Service> readAll(String namespace, Map<String, String> labelSelector) {
            return kubeApiFacade.listNamespacedServices(namespace, labelSelector);
        }

        @Override
        V1Service write(String namespace, V1Service entity) {
            return kubeApiFacade.createNamespacedService(namespace, entity);
        }

        @Override
        V1Service replace(String namespace, V1Service entity) {
            return kubeApiFacade.replaceNamespacedService(namespace, entity);
        }

        @Override
        void delete(ObjectIdentity identity) {
            kubeApiFacade.deleteNamespacedService(identity.getNamespace(), identity.getName());
        }

        @Override
        ManagedObject<ServiceEndpoint> toManagedObject(V1Service entity) {
            return KubeModelConverters.toServiceEndpoint(entity);
        }

        @Override
        V1Service toEntity(ManagedObject<ServiceEndpoint> object) {
            return KubeModelConverters.toV1Service(object);
        }

        @Override
        V1Service apply(V1Service current, ManagedObject<ServiceEndpoint> object) {
            return KubeModelConverters.applyServiceEndpoint(current, object);
        }
    }
}
