/*
 * Copyright 2022 Netflix, Inc.
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

import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.Collections;
import java.util.concurrent.TimeUnit;

import com.google.common.base.Strings;
import com.netflix.convergence.common.runtime.ConvergenceRuntime;
import com.netflix.convergence.kubernetes.okhttp.OkHttpMetricsInterceptor;
import io.kubernetes.client.openapi.ApiClient;
import io.kubernetes.client.util.Config;
import okhttp3.OkHttpClient;
import okhttp3.Protocol;

public final class KubeApiClients {

    public static final String CLIENT_METRICS_PREFIX = "convergence.kube.client";

    private KubeApiClients() {
    }

    public static ApiClient createApiClient(KubeConnectorConfiguration configuration, ConvergenceRuntime runtime) {
        return createApiClient(
                configuration.getKubeApiServerUrl(),
                configuration.getKubeConfigPath(),
                runtime,
                configuration.getReadTimeoutMs()
        );
    }

    public static ApiClient createApiClient(String kubeApiServerUrl,
                                            String kubeConfigPath,
                                            ConvergenceRuntime runtime,
                                            long readTimeoutMs) {
        ApiClient client;
        if (Strings.isNullOrEmpty(kubeApiServerUrl)) {
            try {
                if (Strings.isNullOrEmpty(kubeConfigPath)) {
                    client = Config.defaultClient();
                } else {
                    client = Config.fromConfig(kubeConfigPath);
                }
            } catch (IOException e) {
                throw new UncheckedIOException("Cannot load the kube client configuration", e);
            }
        } else {
            client = Config.fromUrl(kubeApiServerUrl);
        }

        OkHttpClient httpClient = client.getHttpClient().newBuilder()
                .protocols(Collections.singletonList(Protocol.HTTP_1_1))
                .addInterceptor(new OkHttpMetricsInterceptor(CLIENT_METRICS_PREFIX, runtime.getRegistry(), runtime.getClock()))
                .readTimeout(readTimeoutMs, TimeUnit.MILLISECONDS)
                .build();
        client.setHttpClient(httpClient);
        return client;
    }
}
