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

import javax.inject.Singleton;

import com.google.inject.AbstractModule;
import com.google.inject.Provides;
import com.netflix.archaius.api.Config;
import com.netflix.convergence.api.service.ResourceStore;
import com.netflix.convergence.common.config.ConfigurationProxies;
import com.netflix.convergence.common.runtime.ConvergenceRuntime;
import io.kubernetes.client.openapi.ApiClient;

/**
 * Binds {@link ResourceStore} to the Kube API server. {@link ConvergenceRuntime} must be bound by the embedding
 * application.
 */
public class KubeStoreModule extends AbstractModule {

    private final Config config;

    public KubeStoreModule(Config config) {
        this.config = config;
    }

    @Override
    protected void configure() {
        bind(KubeApiFacade.class).to(DefaultKubeApiFacade.class);
        bind(ResourceStore.class).to(KubeResourceStore.class);
    }

    @Provides
    @Singleton
    public KubeConnectorConfiguration getKubeConnectorConfiguration() {
        return ConfigurationProxies.from(KubeConnectorConfiguration.class, config);
    }

    @Provides
    @Singleton
    public ApiClient getKubeApiClient(KubeConnectorConfiguration configuration, ConvergenceRuntime runtime) {
        return KubeApiClients.createApiClient(configuration, runtime);
    }
}
