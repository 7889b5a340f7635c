/*
 * Copyright 2019 Netflix, Inc.
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

import java.io.IOException;
import java.util.List;
import java.util.concurrent.TimeUnit;

import com.netflix.spectator.api.Clock;
import com.netflix.spectator.api.Id;
import com.netflix.spectator.api.Registry;
import okhttp3.Interceptor;
import okhttp3.Request;
import okhttp3.Response;

/**
 * Records latency of every Kube API request, tagged by method, resource kind and response status. Object names
 * are left out of the tags to keep their cardinality bounded.
 */
public class OkHttpMetricsInterceptor implements Interceptor {

    static final String UNKNOWN = "unknown";

    private final Registry registry;
    private final Clock clock;
    private final Id requestId;

    public OkHttpMetricsInterceptor(String metricNamePrefix, Registry registry, Clock clock) {
        this.registry = registry;
        this.clock = clock;
        this.requestId = registry.createId(metricNamePrefix + ".requests");
    }

    @Override
    public Response intercept(Chain chain) throws IOException {
        Request request = chain.request();
        Id id = requestId.withTags(
                "method", request.method(),
                "resource", toResource(request.url().pathSegments())
        );

        long startTimeMs = clock.wallTime();
        try {
            Response response = chain.proceed(request);
            record(id.withTag("status", String.valueOf(response.code())), startTimeMs);
            return response;
        } catch (IOException | RuntimeException e) {
            record(id.withTags("status", "error", "error", e.getClass().getSimpleName()), startTimeMs);
            throw e;
        }
    }

    private void record(Id id, long startTimeMs) {
        registry.timer(id).record(clock.wallTime() - startTimeMs, TimeUnit.MILLISECONDS);
    }

    /**
     * Resource kind of a namespaced path, for example {@code persistentvolumeclaims} in
     * {@code /api/v1/namespaces/default/persistentvolumeclaims/data}.
     */
    static String toResource(List<String> pathSegments) {
        int idx = pathSegments.indexOf("namespaces");
        if (idx >= 0 && idx + 2 < pathSegments.size()) {
            return pathSegments.get(idx + 2);
        }
        if (pathSegments.isEmpty()) {
            return UNKNOWN;
        }
        return pathSegments.get(pathSegments.size() - 1);
    }
}
