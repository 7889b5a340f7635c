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

package com.netflix.convergence.api.model.spec;

import java.util.Objects;

import com.google.common.base.Preconditions;
import com.netflix.convergence.api.model.network.ServiceEndpoint;

public final class NetworkingSpec {

    public static final int DEFAULT_PORT = 8081;

    private static final NetworkingSpec DISABLED = newBuilder().withExposed(false).build();

    private final boolean exposed;
    private final String exposureType;
    private final int port;

    private NetworkingSpec(boolean exposed, String exposureType, int port) {
        this.exposed = exposed;
        this.exposureType = exposureType;
        this.port = port;
    }

    public boolean isExposed() {
        return exposed;
    }

    public String getExposureType() {
        return exposureType;
    }

    public int getPort() {
        return port;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        NetworkingSpec that = (NetworkingSpec) o;
        return exposed == that.exposed && port == that.port && Objects.equals(exposureType, that.exposureType);
    }

    @Override
    public int hashCode() {
        return Objects.hash(exposed, exposureType, port);
    }

    @Override
    public String toString() {
        return "NetworkingSpec{" +
                "exposed=" + exposed +
                ", exposureType='" + exposureType + '\'' +
                ", port=" + port +
                '}';
    }

    public static NetworkingSpec disabled() {
        return DISABLED;
    }

    public static Builder newBuilder() {
        return new Builder();
    }

    public static final class Builder {

        private boolean exposed;
        private String exposureType;
        private int port;

        private Builder() {
        }

        public Builder withExposed(boolean exposed) {
            this.exposed = exposed;
            return this;
        }

        public Builder withExposureType(String exposureType) {
            this.exposureType = exposureType;
            return this;
        }

        public Builder withPort(int port) {
            this.port = port;
            return this;
        }

        public NetworkingSpec build() {
            Preconditions.checkArgument(port >= 0, "port cannot be negative: %s", port);
            return new NetworkingSpec(
                    exposed,
                    exposureType == null || exposureType.isEmpty() ? ServiceEndpoint.EXPOSURE_CLUSTER_IP : exposureType,
                    port == 0 ? DEFAULT_PORT : port
            );
        }
    }
}
