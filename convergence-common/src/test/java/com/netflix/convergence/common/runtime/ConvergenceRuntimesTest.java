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


package com.netflix.convergence.common.runtime;

import java.util.concurrent.TimeUnit;

import com.netflix.spectator.api.DefaultRegistry;
import com.netflix.spectator.api.ManualClock;
import com.netflix.spectator.api.Registry;
import org.junit.Test;

import static org.assertj.core.api.Assertions.assertThat;

public class ConvergenceRuntimesTest {

    @Test
    public void testRuntimeClockIsRegistryClock() {
        ManualClock clock = new ManualClock();
        ConvergenceRuntime runtime = ConvergenceRuntimes.test(clock);

        clock.setWallTime(TimeUnit.SECONDS.toMillis(10));

        assertThat(runtime.getClock()).isSameAs(clock);
        assertThat(runtime.getRegistry().clock().wallTime()).isEqualTo(10_000);
    }

    @Test
    public void testInternalRuntimeWithProvidedRegistry() {
        Registry registry = new DefaultRegistry();
        ConvergenceRuntime runtime = ConvergenceRuntimes.internal(registry);

        assertThat(runtime.getRegistry()).isSameAs(registry);
        assertThat(runtime.getClock().wallTime()).isPositive();
    }

    @Test
    public void testInternalRuntimeUsesSystemClock() {
        long before = System.currentTimeMillis();
        assertThat(ConvergenceRuntimes.internal().getClock().wallTime()).isGreaterThanOrEqualTo(before);
    }
}
