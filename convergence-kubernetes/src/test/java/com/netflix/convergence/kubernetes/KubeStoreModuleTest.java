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

import com.google.inject.Guice;
import com.google.inject.Injector;
import com.netflix.archaius.config.MapConfig;
import com.netflix.convergence.api.service.ResourceStore;
import com.netflix.convergence.common.runtime.ConvergenceRuntime;
import com.netflix.convergence.common.runtime.ConvergenceRuntimes;
import com.netflix.spectator.api.ManualClock;
import org.junit.Test;

import static org.assertj.core.api.Assertions.assertThat;

public class KubeStoreModuleTest {

    @Test
    public void testStoreBinding() {
        ConvergenceRuntime runtime = ConvergenceRuntimes.test(new ManualClock());
        MapConfig config = new MapConfig(Collections.singletonMap("convergence.kube.kubeApiServerUrl", "http://localhost:7001"));

        Injector injector = Guice.createInjector(
                new KubeStoreModule(config),
                binder -> binder.bind(ConvergenceRuntime.class).toInstance(runtime)
        );

        assertThat(injector.getInstance(ResourceStore.class)).isInstanceOf(KubeResourceStore.class);
        assertThat(injector.getInstance(ResourceStore.class)).isSameAs(injector.getInstance(ResourceStore.class));
        assertThat(injector.getInstance(KubeConnectorConfiguration.class).getReadTimeoutMs()).isEqualTo(30_000);
    }
}
