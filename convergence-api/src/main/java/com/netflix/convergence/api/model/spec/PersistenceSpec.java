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

public final class PersistenceSpec {

    public static final String DEFAULT_VOLUME_SIZE = "10Gi";

    private static final PersistenceSpec DISABLED = newBuilder().withPersistent(false).build();

    private final boolean persistent;
    private final String volumeSize;
    private final String storageClass;

    private PersistenceSpec(boolean persistent, String volumeSize, String storageClass) {
        this.persistent = persistent;
        this.volumeSize = volumeSize;
        this.storageClass = storageClass;
    }

    public boolean isPersistent() {
        return persistent;
    }

    public String getVolumeSize() {
        return volumeSize;
    }

    public String getStorageClass() {
        return storageClass;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        PersistenceSpec that = (PersistenceSpec) o;
        return persistent == that.persistent &&
                Objects.equals(volumeSize, that.volumeSize) &&
                Objects.equals(storageClass, that.storageClass);
    }

    @Override
    public int hashCode() {
        return Objects.hash(persistent, volumeSize, storageClass);
    }

    @Override
    public String toString() {
        return "PersistenceSpec{" +
                "persistent=" + persistent +
                ", volumeSize='" + volumeSize + '\'' +
                ", storageClass='" + storageClass + '\'' +
                '}';
    }

    public static PersistenceSpec disabled() {
        return DISABLED;
    }

    public Builder toBuilder() {
        return newBuilder().withPersistent(persistent).withVolumeSize(volumeSize).withStorageClass(storageClass);
    }

    public static Builder newBuilder() {
        return new Builder();
    }

    public static final class Builder {

        private boolean persistent;
        private String volumeSize;
        private String storageClass;

        private Builder() {
        }

        public Builder withPersistent(boolean persistent) {
            this.persistent = persistent;
            return this;
        }

        public Builder withVolumeSize(String volumeSize) {
            this.volumeSize = volumeSize;
            return this;
        }

        public Builder withStorageClass(String storageClass) {
            this.storageClass = storageClass;
            return this;
        }

        public PersistenceSpec build() {
            String size = volumeSize == null || volumeSize.isEmpty() ? DEFAULT_VOLUME_SIZE : volumeSize;
            return new PersistenceSpec(persistent, size, storageClass);
        }
    }
}
