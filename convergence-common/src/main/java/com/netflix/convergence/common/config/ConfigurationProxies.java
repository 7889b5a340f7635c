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


package com.netflix.convergence.common.config;

import java.util.Collections;
import java.util.Map;

import com.google.common.base.Preconditions;
import com.netflix.archaius.ConfigProxyFactory;
import com.netflix.archaius.DefaultPropertyFactory;
import com.netflix.archaius.api.Config;
import com.netflix.archaius.api.annotations.Configuration;
import com.netflix.archaius.config.MapConfig;

/**
 * Creates Archaius2 proxies for {@link Configuration} annotated interfaces of the reconciler components.
 */
public final class ConfigurationProxies {

    private ConfigurationProxies() {
    }

    /**
     * A proxy returning the {@code @DefaultValue} of every property.
     */
    public static <C> C defaults(Class<C> configType) {
        return from(configType, new MapConfig(Collections.<String, String>emptyMap()));
    }

    /**
     * A proxy with the given properties overriding the defaults. Each key must be under the prefix of the
     * configuration interface.
     *
     * @throws IllegalArgumentException if a key is outside of the configuration prefix
     */
    public static <C> C withOverrides(Class<C> configType, Map<String, String> overrides) {
        String prefix = getPrefix(configType) + '.';
        for (String key : overrides.keySet()) {
            Preconditions.checkArgument(key.startsWith(prefix), "Property %s is not under the %s prefix of %s",
                    key, prefix, configType.getSimpleName());
        }
        return from(configType, new MapConfig(overrides));
    }

    public static <C> C from(Class<C> configType, Config config) {
        Preconditions.checkNotNull(config, "config is null");
        getPrefix(configType);
        ConfigProxyFactory factory = new ConfigProxyFactory(config, config.getDecoder(), DefaultPropertyFactory.from(config));
        return factory.newProxy(configType);
    }

    private static String getPrefix(Class<?> configType) {
        Configuration annotation = configType.getAnnotation(Configuration.class);
        Preconditions.checkArgument(annotation != null, "%s is not annotated with @Configuration", configType.getName());
        return annotation.prefix();
    }
}
