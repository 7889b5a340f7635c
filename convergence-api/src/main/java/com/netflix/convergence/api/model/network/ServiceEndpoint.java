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

import java.util.Collections;
import java.util.Map;
import java.util.Objects;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableMap;

/**
 * Network endpoint exposing a workload. The cluster IP is assigned by the backing store when the endpoint is
 * created and must survive updates.
 */
public final class ServiceEndpoint {

    public static final String EXPOSURE_CLUSTER_IP = "ClusterIP";
    public static final String EXPOSURE_NODE_PORT = "NodePort";
    public static final String EXPOSURE_LOAD_BALANCER = "LoadBalancer";

    private final String exposureType;
    private final int port;
    private final int targetPort;
    private final Map<String, String> selector;
    private final String clusterIp;

    private ServiceEndpoint(String exposureType, int port, int targetPort, Map<String, String> selector, String clusterIp) {
        this.exposureType = exposureType;
        this.port = port;
        this.targetPort = targetPort;
        this.selector = selector;
        this.clusterIp = clusterIp;
    }

    public String getExposureType() {
        return exposureType;
    }

    public int getPort() {
        return port;
    }

    public int getTargetPort() {
        return targetPort;
    }

    public Map<String, String> getSelector() {
        return selector;
    }

    public String getClusterIp() {
        return clusterIp;
    }

    public ServiceEndpoint withExposureType(String newExposureType) {
        return toBuilder().withExposureType(newExposureType).build();
    }

    public ServiceEndpoint withPort(Integer newPort) {
        return toBuilder().withPort(newPort).build();
    }

    public ServiceEndpoint withTargetPort(Integer newTargetPort) {
        return toBuilder().withTargetPort(newTargetPort).build();
    }

    public ServiceEndpoint withSelector(Map<String, String> newSelector) {
        return toBuilder().withSelector(newSelector).build();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        ServiceEndpoint that = (ServiceEndpoint) o;
        return port == that.port &&
                targetPort == that.targetPort &&
                Objects.equals(exposureType, that.exposureType) &&
                Objects.equals(selector, that.selector) &&
                Objects.equals(clusterIp, that.clusterIp);
    }

    @Override
    public int hashCode() {
        return Objects.hash(exposureType, port, targetPort, selector, clusterIp);
    }

    @Override
    public String toString() {
        return "ServiceEndpoint{" +
                "exposureType='" + exposureType + '\'' +
                ", port=" + port +
                ", targetPort=" + targetPort +
                ", selector=" + selector +
                ", clusterIp='" + clusterIp + '\'' +
                '}';
    }

    public Builder toBuilder() {
        return newBuilder()
                .withExposureType(exposureType)
                .withPort(port)
                .withTargetPort(targetPort)
                .withSelector(selector)
                .withClusterIp(clusterIp);
    }

    public static Builder newBuilder() {
        return new Builder();
    }

    public static final class Builder {

        private String exposureType = EXPOSURE_CLUSTER_IP;
        private int port;
        private int targetPort;
        private Map<String, String> selector = Collections.emptyMap();
        private String clusterIp;

        private Builder() {
        }

        public Builder withExposureType(String exposureType) {
            this.exposureType = exposureType;
            return this;
        }

        public Builder withPort(int port) {
            this.port = port;
            return this;
        }

        public Builder withTargetPort(int targetPort) {
            this.targetPort = targetPort;
            return this;
        }

        public Builder withSelector(Map<String, String> selector) {
            this.selector = selector;
            return this;
        }

        public Builder withClusterIp(String clusterIp) {
            this.clusterIp = clusterIp;
            return this;
        }

        public ServiceEndpoint build() {
            Preconditions.checkArgument(port > 0, "port must be positive: %s", port);
            if (targetPort <= 0) {
                targetPort = port;
            }
            return new ServiceEndpoint(
                    exposureType == null ? EXPOSURE_CLUSTER_IP : exposureType,
                    port,
                    targetPort,
                    selector == null ? Collections.emptyMap() : ImmutableMap.copyOf(selector),
                    clusterIp
            );
        }
    }
}
