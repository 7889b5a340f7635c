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

import com.netflix.archaius.api.annotations.Configuration;
import com.netflix.archaius.api.annotations.DefaultValue;

@Configuration(prefix = "convergence.kube")
public interface KubeConnectorConfiguration {

    /**
     * @return the kube api server url to use. If this is empty, use the kube config path instead.
     */
    @DefaultValue("")
    String getKubeApiServerUrl();

    /**
     * @return the path to the kubeconfig file. If this is empty, the client default lookup applies (the KUBECONFIG
     * variable, then the in-cluster service account).
     */
    @DefaultValue("")
    String getKubeConfigPath();

    @DefaultValue("30000")
    long getReadTimeoutMs();
}
