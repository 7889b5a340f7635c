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

import com.google.common.collect.ImmutableMap;
import com.netflix.convergence.api.model.ManagedObject;
import com.netflix.convergence.api.model.network.ServiceEndpoint;
import com.netflix.convergence.api.model.storage.StorageClaim;
import io.kubernetes.client.custom.IntOrString;
import io.kubernetes.client.custom.Quantity;
import io.kubernetes.client.openapi.models.V1ObjectMeta;
import io.kubernetes.client.openapi.models.V1PersistentVolumeClaim;
import io.kubernetes.client.openapi.models.V1PersistentVolumeClaimSpec;
import io.kubernetes.client.openapi.models.V1PersistentVolumeClaimStatus;
import io.kubernetes.client.openapi.models.V1ResourceRequirements;
import io.kubernetes.client.openapi.models.V1Service;
import io.kubernetes.client.openapi.models.V1ServicePort;
import io.kubernetes.client.openapi.models.V1ServiceSpec;
import org.junit.Test;

import static com.netflix.convergence.testkit.model.ManagedObjectGenerator.NAMESPACE;
import static com.netflix.convergence.testkit.model.ManagedObjectGenerator.serviceEndpoint;
import static com.netflix.convergence.testkit.model.ManagedObjectGenerator.storageClaim;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.catchThrowable;

public class KubeModelConvertersTest {

    private static final ImmutableMap<String, String> LABELS = ImmutableMap.of("app.kubernetes.io/managed-by", "convergence");

    @Test
    public void testStorageClaimToPersistentVolumeClaim() {
        V1PersistentVolumeClaim pvc = KubeModelConverters.toV1PersistentVolumeClaim(storageClaim(NAMESPACE, "data", "10Gi", LABELS));

        assertThat(pvc.getMetadata().getNamespace()).isEqualTo(NAMESPACE);
        assertThat(pvc.getMetadata().getName()).isEqualTo("data");
        assertThat(pvc.getMetadata().getLabels()).isEqualTo(LABELS);
        assertThat(pvc.getSpec().getResources().getRequests().get(KubeModelConverters.STORAGE_RESOURCE))
                .isEqualTo(Quantity.fromString("10Gi"));
    }

    @Test
    public void testPersistentVolumeClaimToStorageClaim() {
        V1PersistentVolumeClaim pvc = new V1PersistentVolumeClaim()
                .metadata(new V1ObjectMeta().namespace(NAMESPACE).name("data").labels(LABELS))
                .spec(new V1PersistentVolumeClaimSpec()
                        .accessModes(Collections.singletonList(StorageClaim.ACCESS_MODE_READ_WRITE_ONCE))
                        .storageClassName("fast")
                        .volumeName("pvc-1234")
                        .resources(new V1ResourceRequirements()
                                .requests(Collections.singletonMap("storage", Quantity.fromString("10Gi")))
                        )
                )
                .status(new V1PersistentVolumeClaimStatus().phase("Bound"));

        ManagedObject<StorageClaim> object = KubeModelConverters.toStorageClaim(pvc);

        assertThat(object.getIdentity().toString()).isEqualTo(NAMESPACE + "/data");
        assertThat(object.getLabels()).isEqualTo(LABELS);
        StorageClaim claim = object.getPayload();
        assertThat(claim.getCapacity()).isEqualTo("10Gi");
        assertThat(claim.getStorageClassName()).isEqualTo("fast");
        assertThat(claim.getAccessModes()).containsExactly(StorageClaim.ACCESS_MODE_READ_WRITE_ONCE);
        assertThat(claim.getVolumeName()).isEqualTo("pvc-1234");
        assertThat(claim.getPhase()).isEqualTo("Bound");
    }

    @Test
    public void testClaimWithoutStorageRequestUsesStatusCapacity() {
        V1PersistentVolumeClaim pvc = new V1PersistentVolumeClaim()
                .metadata(new V1ObjectMeta().namespace(NAMESPACE).name("data"))
                .spec(new V1PersistentVolumeClaimSpec())
                .status(new V1PersistentVolumeClaimStatus()
                        .capacity(Collections.singletonMap("storage", Quantity.fromString("5Gi")))
                );

        assertThat(KubeModelConverters.toStorageClaim(pvc).getPayload().getCapacity()).isEqualTo("5Gi");
    }

    @Test
    public void testClaimWithoutAnyCapacityIsRejected() {
        V1PersistentVolumeClaim pvc = new V1PersistentVolumeClaim()
                .metadata(new V1ObjectMeta().namespace(NAMESPACE).name("data"))
                .spec(new V1PersistentVolumeClaimSpec());

        Throwable error = catchThrowable(() -> KubeModelConverters.toStorageClaim(pvc));
        assertThat(error).isInstanceOf(IllegalArgumentException.class).hasMessageContaining("no storage request");
    }

    @Test
    public void testServiceEndpointToService() {
        V1Service service = KubeModelConverters.toV1Service(serviceEndpoint(NAMESPACE, "web", 8081, LABELS));

        V1ServiceSpec spec = service.getSpec();
        assertThat(spec.getType()).isEqualTo(ServiceEndpoint.EXPOSURE_CLUSTER_IP);
        assertThat(spec.getClusterIP()).isNull();
        assertThat(spec.getSelector()).containsEntry("app", "web");
        assertThat(spec.getPorts()).hasSize(1);
        assertThat(spec.getPorts().get(0).getPort()).isEqualTo(8081);
        assertThat(spec.getPorts().get(0).getTargetPort().getIntValue()).isEqualTo(8081);
    }

    @Test
    public void testServiceToServiceEndpoint() {
        V1Service service = new V1Service()
                .metadata(new V1ObjectMeta().namespace(NAMESPACE).name("web").labels(LABELS))
                .spec(new V1ServiceSpec()
                        .type(ServiceEndpoint.EXPOSURE_NODE_PORT)
                        .clusterIP("10.0.0.1")
                        .selector(Collections.singletonMap("app", "web"))
                        .ports(Collections.singletonList(new V1ServicePort().port(80).targetPort(new IntOrString(8080))))
                );

        ServiceEndpoint endpoint = KubeModelConverters.toServiceEndpoint(service).getPayload();

        assertThat(endpoint.getExposureType()).isEqualTo(ServiceEndpoint.EXPOSURE_NODE_PORT);
        assertThat(endpoint.getClusterIp()).isEqualTo("10.0.0.1");
        assertThat(endpoint.getPort()).isEqualTo(80);
        assertThat(endpoint.getTargetPort()).isEqualTo(8080);
        assertThat(endpoint.getSelector()).containsEntry("app", "web");
    }

    @Test
    public void testNamedTargetPortFallsBackToPort() {
        V1Service service = new V1Service()
                .metadata(new V1ObjectMeta().namespace(NAMESPACE).name("web"))
                .spec(new V1ServiceSpec()
                        .ports(Collections.singletonList(new V1ServicePort().port(80).targetPort(new IntOrString("http"))))
                );

        assertThat(KubeModelConverters.toServiceEndpoint(service).getPayload().getTargetPort()).isEqualTo(80);
    }

    @Test
    public void testApplyServiceEndpointKeepsServerFields() {
        V1Service current = new V1Service()
                .metadata(new V1ObjectMeta().namespace(NAMESPACE).name("web").resourceVersion("42"))
                .spec(new V1ServiceSpec()
                        .clusterIP("10.0.0.1")
                        .ports(Collections.singletonList(new V1ServicePort().port(80)))
                );
        ManagedObject<ServiceEndpoint> desired = serviceEndpoint(NAMESPACE, "web", 9000, LABELS);

        V1Service replaced = KubeModelConverters.applyServiceEndpoint(current, desired);

        assertThat(replaced.getMetadata().getResourceVersion()).isEqualTo("42");
        assertThat(replaced.getMetadata().getLabels()).isEqualTo(LABELS);
        assertThat(replaced.getSpec().getClusterIP()).isEqualTo("10.0.0.1");
        assertThat(replaced.getSpec().getPorts().get(0).getPort()).isEqualTo(9000);
    }

    @Test
    public void testApplyServiceEndpointKeepsAllocatedNodePort() {
        V1Service current = new V1Service()
                .metadata(new V1ObjectMeta().namespace(NAMESPACE).name("web").resourceVersion("42"))
                .spec(new V1ServiceSpec()
                        .type(ServiceEndpoint.EXPOSURE_NODE_PORT)
                        .ports(Collections.singletonList(new V1ServicePort().port(8081).targetPort(new IntOrString(8081)).nodePort(30123)))
                );
        ServiceEndpoint nodePortEndpoint = ServiceEndpoint.newBuilder()
                .withExposureType(ServiceEndpoint.EXPOSURE_NODE_PORT)
                .withPort(8081)
                .withTargetPort(9090)
                .build();
        ManagedObject<ServiceEndpoint> desired = serviceEndpoint(NAMESPACE, "web", 8081, LABELS).toBuilder()
                .withPayload(nodePortEndpoint)
                .build();

        V1ServicePort port = KubeModelConverters.applyServiceEndpoint(current, desired).getSpec().getPorts().get(0);

        assertThat(port.getNodePort()).isEqualTo(30123);
        assertThat(port.getTargetPort().getIntValue()).isEqualTo(9090);
    }

    @Test
    public void testApplyServiceEndpointDropsNodePortOfChangedPort() {
        V1Service current = new V1Service()
                .metadata(new V1ObjectMeta().namespace(NAMESPACE).name("web"))
                .spec(new V1ServiceSpec()
                        .type(ServiceEndpoint.EXPOSURE_NODE_PORT)
                        .ports(Collections.singletonList(new V1ServicePort().port(80).nodePort(30123)))
                );
        ManagedObject<ServiceEndpoint> desired = serviceEndpoint(NAMESPACE, "web", 9000, LABELS).toBuilder()
                .withPayload(ServiceEndpoint.newBuilder().withExposureType(ServiceEndpoint.EXPOSURE_NODE_PORT).withPort(9000).build())
                .build();

        assertThat(KubeModelConverters.applyServiceEndpoint(current, desired).getSpec().getPorts().get(0).getNodePort()).isNull();
    }

    @Test
    public void testApplyServiceEndpointDropsNodePortWhenClusterInternal() {
        V1Service current = new V1Service()
                .metadata(new V1ObjectMeta().namespace(NAMESPACE).name("web"))
                .spec(new V1ServiceSpec()
                        .type(ServiceEndpoint.EXPOSURE_NODE_PORT)
                        .ports(Collections.singletonList(new V1ServicePort().port(8081).nodePort(30123)))
                );

        V1Service replaced = KubeModelConverters.applyServiceEndpoint(current, serviceEndpoint(NAMESPACE, "web", 8081, LABELS));

        assertThat(replaced.getSpec().getType()).isEqualTo(ServiceEndpoint.EXPOSURE_CLUSTER_IP);
        assertThat(replaced.getSpec().getPorts().get(0).getNodePort()).isNull();
    }

    @Test
    public void testApplyStorageClaimKeepsOtherRequests() {
        V1PersistentVolumeClaim current = new V1PersistentVolumeClaim()
                .metadata(new V1ObjectMeta().namespace(NAMESPACE).name("data").resourceVersion("7"))
                .spec(new V1PersistentVolumeClaimSpec()
                        .volumeName("pvc-1234")
                        .resources(new V1ResourceRequirements()
                                .requests(ImmutableMap.of("storage", Quantity.fromString("10Gi"), "other", Quantity.fromString("1")))
                        )
                );

        V1PersistentVolumeClaim replaced = KubeModelConverters.applyStorageClaim(current, storageClaim(NAMESPACE, "data", "20Gi", LABELS));

        assertThat(replaced.getMetadata().getResourceVersion()).isEqualTo("7");
        assertThat(replaced.getSpec().getVolumeName()).isEqualTo("pvc-1234");
        assertThat(replaced.getSpec().getResources().getRequests())
                .containsEntry("storage", Quantity.fromString("20Gi"))
                .containsKey("other");
    }
}
