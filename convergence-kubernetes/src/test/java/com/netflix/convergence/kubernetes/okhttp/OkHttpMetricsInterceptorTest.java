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

package com.netflix.convergence.kubernetes.okhttp;

import java.util.Arrays;
import java.util.Collections;

import org.junit.Test;

import static org.assertj.core.api.Assertions.assertThat;

public class OkHttpMetricsInterceptorTest {

    @Test
    public void testResourceOfNamespacedPath() {
        assertThat(OkHttpMetricsInterceptor.toResource(Arrays.asList("api", "v1", "namespaces", "test", "persistentvolumeclaims", "data")))
                .isEqualTo("persistentvolumeclaims");
        assertThat(OkHttpMetricsInterceptor.toResource(Arrays.asList("api", "v1", "namespaces", "test", "services")))
                .isEqualTo("services");
    }

    @Test
    public void testResourceOfOtherPaths() {
        assertThat(OkHttpMetricsInterceptor.toResource(Arrays.asList("api", "v1", "nodes"))).isEqualTo("nodes");
        assertThat(OkHttpMetricsInterceptor.toResource(Collections.emptyList())).isEqualTo(OkHttpMetricsInterceptor.UNKNOWN);
    }
}
