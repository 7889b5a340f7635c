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

import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Optional;

import com.google.common.base.Preconditions;
import com.netflix.convergence.api.model.ManagedObject;
import com.netflix.convergence.api.model.network.ServiceEndpoint;
import com.netflix.convergence.api.model.network.ServiceEndpoints;
import com.netflix.convergence.api.model.storage.StorageClaim;
import com.netflix.convergence.api.model.storage.StorageClaims;
import com.netflix.convergence.common.util.CollectionsExt;
import io.kubernetes.client.custom.IntOrString;
import io.kubernetes.client.custom.Quantity;
import io.kubernetes.client.openapi.models.V1ObjectMeta;
import io.kubernetes.client.openapi.models.V1PersistentVolumeClaim;
import io.kubernetes.client.openapi.models.V1PersistentVolumeClaimSpec;
import io.kubernetes.client.openapi.models.V1ResourceRequirements;
import io.kubernetes.client.openapi.models.V1Service;
import io.kubernetes.client.openapi.models.V1ServicePort;
import io.kubernetes.client.openapi.models.V1ServiceSpec;

/**
 * Converters between the managed object model and the Kube entity model.
 */
public final class KubeModelConverters {

    public static final String STORAGE_RESOURCE = "storage";

    public static final String PROTOCOL_TCP = "TCP";

    private KubeModelConverters() {
    }

    public static String getMetadataName(V1ObjectMeta metadata) {
        if (metadata == null) {
            return "";
        }
        return metadata.getName();
    }

    public static ManagedObject<StorageClaim> toStorageClaim(V1PersistentVolumeClaim claim) {
        V1ObjectMeta metadata = claim.getMetadata();
        V1PersistentVolumeClaimSpec spec = claim.getSpec();
        Preconditions.checkArgument(metadata != null && spec != null, "Persistent volume claim without metadata or spec");

        Quantity storage = findStorageRequest(spec.getResources());
        if (storage == null && claim.getStatus() != null && claim.getStatus().getCapacity() != null) {
            storage = claim.getStatus().getCapacity().get(STORAGE_RESOURCE);
        }
        Preconditions.checkArgument(storage != null, "Persistent volume claim %s/%s has no storage request",
                metadata.getNamespace(), metadata.getName());

        return ManagedObject.newBuilder(StorageClaims.STORAGE_CLAIM)
                .withIdentity(metadata.getNamespace(), metadata.getName())
                .withLabels(CollectionsExt.nonNull(metadata.getLabels()))
                .withPayload(StorageClaim.newBuilder()
                        .withCapacity(storage.toSuffixedString())
                        .withStorageClassName(spec.getStorageClassName())
                        .withAccessModes(spec.getAccessModes())
                        .withVolumeName(spec.getVolumeName())
                        .withPhase(claim.getStatus() == null ? null : claim.getStatus().getPhase())
                        .build()
                )
                .build();
    }

    public static V1PersistentVolumeClaim toV1PersistentVolumeClaim(ManagedObject<StorageClaim> object) {
        StorageClaim claim = object.getPayload();
        return new V1PersistentVolumeClaim()
                .metadata(toV1ObjectMeta(object))
                .spec(new V1PersistentVolumeClaimSpec()
                        .accessModes(claim.getAccessModes())
                        .storageClassName(claim.getStorageClassName())
                        .volumeName(claim.getVolumeName())
                        .resources(new V1ResourceRequirements()
                                .requests(Collections.singletonMap(STORAGE_RESOURCE, Quantity.fromString(claim.getCapacity())))
                        )
                );
    }

    /**
     * Copies labels and the requested capacity onto the current claim. Other spec fields of a bound claim are
     * immutable in Kube, so they are kept as read.
     */
    public static V1PersistentVolumeClaim applyStorageClaim(V1PersistentVolumeClaim current, ManagedObject<StorageClaim> object) {
        V1PersistentVolumeClaimSpec spec = current.getSpec() == null ? new V1PersistentVolumeClaimSpec() : current.getSpec();
        V1ResourceRequirements resources = spec.getResources() == null ? new V1ResourceRequirements() : spec.getResources();
        resources.setRequests(CollectionsExt.merge(
                CollectionsExt.nonNull(resources.getRequests()),
                Collections.singletonMap(STORAGE_RESOURCE, Quantity.fromString(object.getPayload().getCapacity()))
        ));
        spec.setResources(resources);
        current.getMetadata().setLabels(new HashMap<>(object.getLabels()));
        return current.spec(spec);
    }

    public static ManagedObject<ServiceEndpoint> toServiceEndpoint(V1Service service) {
        V1ObjectMeta metadata = service.getMetadata();
        V1ServiceSpec spec = service.getSpec();
        Preconditions.checkArgument(metadata != null && spec != null, "Service without metadata or spec");

        List<V1ServicePort> ports = spec.getPorts();
        Preconditions.checkArgument(ports != null && !ports.isEmpty(), "Service %s/%s has no ports",
                metadata.getNamespace(), metadata.getName());
        V1ServicePort port = ports.get(0);

        return ManagedObject.newBuilder(ServiceEndpoints.SERVICE_ENDPOINT)
                .withIdentity(metadata.getNamespace(), metadata.getName())
                .withLabels(CollectionsExt.nonNull(metadata.getLabels()))
                .withPayload(ServiceEndpoint.newBuilder()
                        .withExposureType(spec.getType())
                        .withPort(port.getPort())
                        .withTargetPort(toTargetPort(port))
                        .withSelector(CollectionsExt.nonNull(spec.getSelector()))
                        .withClusterIp(spec.getClusterIP())
                        .build()
                )
                .build();
    }

    public static V1Service toV1Service(ManagedObject<ServiceEndpoint> object) {
        ServiceEndpoint endpoint = object.getPayload();
        return new V1Service()
                .metadata(toV1ObjectMeta(object))
                .spec(new V1ServiceSpec()
                        .type(endpoint.getExposureType())
                        .clusterIP(endpoint.getClusterIp())
                        .selector(new HashMap<>(endpoint.getSelector()))
                        .ports(Collections.singletonList(toV1ServicePort(endpoint)))
                );
    }

    /**
     * Copies labels, exposure type, port and selector onto the current service. The cluster IP and the resource
     * version are kept as read, as Kube rejects a replace that changes the former or omits the latter. A node port
     * already allocated to the same port number is kept unless the service becomes cluster internal.
     */
    public static V1Service applyServiceEndpoint(V1Service current, ManagedObject<ServiceEndpoint> object) {
        ServiceEndpoint endpoint = object.getPayload();
        V1ServiceSpec spec = current.getSpec() == null ? new V1ServiceSpec() : current.getSpec();
        spec.setType(endpoint.getExposureType());
        spec.setSelector(new HashMap<>(endpoint.getSelector()));
        V1ServicePort port = toV1ServicePort(endpoint);
        if (!ServiceEndpoint.EXPOSURE_CLUSTER_IP.equals(endpoint.getExposureType())) {
            findNodePort(spec.getPorts(), endpoint.getPort()).ifPresent(port::setNodePort);
        }
        spec.setPorts(Collections.singletonList(port));
        current.getMetadata().setLabels(new HashMap<>(object.getLabels()));
        return current.spec(spec);
    }

    private static V1ObjectMeta toV1ObjectMeta(ManagedObject<?> object) {
        return new V1ObjectMeta()
                .namespace(object.getIdentity().getNamespace())
                .name(object.getIdentity().getName())
                .labels(new HashMap<>(object.getLabels()));
    }

    private static Optional<Integer> findNodePort(List<V1ServicePort> ports, int portNumber) {
        if (ports == null) {
            return Optional.empty();
        }
        for (V1ServicePort port : ports) {
            if (port.getPort() != null && port.getPort() == portNumber && port.getNodePort() != null) {
                return Optional.of(port.getNodePort());
            }
        }
        return Optional.empty();
    }

    private static V1ServicePort toV1ServicePort(ServiceEndpoint endpoint) {
        return new V1ServicePort()
                .protocol(PROTOCOL_TCP)
                .port(endpoint.getPort())
                .targetPort(new IntOrString(endpoint.getTargetPort()));
    }

    private static Quantity findStorageRequest(V1ResourceRequirements resources) {
        if (resources == null || resources.getRequests() == null) {
            return null;
        }
        return resources.getRequests().get(STORAGE_RESOURCE);
    }

    /**
     * Named target ports cannot be resolved without the pod spec, so they fall back to the service port.
     */
    private static int toTargetPort(V1ServicePort port) {
        IntOrString targetPort = port.getTargetPort();
        if (targetPort == null || !targetPort.isInteger()) {
            return port.getPort();
        }
        return targetPort.getIntValue();
    }
}
