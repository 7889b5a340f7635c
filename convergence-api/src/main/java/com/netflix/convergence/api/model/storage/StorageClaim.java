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

package com.netflix.convergence.api.model.storage;

import java.util.Collections;
import java.util.List;
import java.util.Objects;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;

/**
 * Bounded-capacity storage claim. Capacity, storage class and access modes are requested by the manager;
 * volume name and phase are populated by the backing store after provisioning.
 */
public final class StorageClaim {

    public static final String ACCESS_MODE_READ_WRITE_ONCE = "ReadWriteOnce";

    private final String capacity;
    private final String storageClassName;
    private final List<String> accessModes;
    private final String volumeName;
    private final String phase;

    private StorageClaim(String capacity, String storageClassName, List<String> accessModes, String volumeName, String phase) {
        this.capacity = capacity;
        this.storageClassName = storageClassName;
        this.accessModes = accessModes;
        this.volumeName = volumeName;
        this.phase = phase;
    }

    /**
     * Requested capacity in the backing store's quantity notation, for example {@code 10Gi}.
     */
    public String getCapacity() {
        return capacity;
    }

    /**
     * @return null when the store's default storage class applies
     */
    public String getStorageClassName() {
        return storageClassName;
    }

    public List<String> getAccessModes() {
        return accessModes;
    }

    public String getVolumeName() {
        return volumeName;
    }

    public String getPhase() {
        return phase;
    }

    public StorageClaim withCapacity(String newCapacity) {
        return toBuilder().withCapacity(newCapacity).build();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        StorageClaim that = (StorageClaim) o;
        return Objects.equals(capacity, that.capacity) &&
                Objects.equals(storageClassName, that.storageClassName) &&
                Objects.equals(accessModes, that.accessModes) &&
                Objects.equals(volumeName, that.volumeName) &&
                Objects.equals(phase, that.phase);
    }

    @Override
    public int hashCode() {
        return Objects.hash(capacity, storageClassName, accessModes, volumeName, phase);
    }

    @Override
    public String toString() {
        return "StorageClaim{" +
                "capacity='" + capacity + '\'' +
                ", storageClassName='" + storageClassName + '\'' +
                ", accessModes=" + accessModes +
                ", volumeName='" + volumeName + '\'' +
                ", phase='" + phase + '\'' +
                '}';
    }

    public Builder toBuilder() {
        return newBuilder()
                .withCapacity(capacity)
                .withStorageClassName(storageClassName)
                .withAccessModes(accessModes)
                .withVolumeName(volumeName)
                .withPhase(phase);
    }

    public static Builder newBuilder() {
        return new Builder();
    }

    public static final class Builder {

        private String capacity;
        private String storageClassName;
        private List<String> accessModes = Collections.singletonList(ACCESS_MODE_READ_WRITE_ONCE);
        private String volumeName;
        private String phase;

        private Builder() {
        }

        public Builder withCapacity(String capacity) {
            this.capacity = capacity;
            return this;
        }

        public Builder withStorageClassName(String storageClassName) {
            this.storageClassName = storageClassName;
            return this;
        }

        public Builder withAccessModes(List<String> accessModes) {
            this.accessModes = accessModes;
            return this;
        }

        public Builder withVolumeName(String volumeName) {
            this.volumeName = volumeName;
            return this;
        }

        public Builder withPhase(String phase) {
            this.phase = phase;
            return this;
        }

        public StorageClaim build() {
            Preconditions.checkArgument(capacity != null && !capacity.isEmpty(), "capacity not set");
            return new StorageClaim(
                    capacity,
                    storageClassName,
                    accessModes == null ? Collections.emptyList() : ImmutableList.copyOf(accessModes),
                    volumeName,
                    phase
            );
        }
    }
}
