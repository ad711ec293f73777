/*
 * Copyright Kroxylicious Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.qroxy.proxy.config;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.ServiceLoader;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import io.qroxy.proxy.plugin.Plugin;

/**
 * Discovers plugin implementations with {@link ServiceLoader}. Discovery happens once per plugin interface.
 * An implementation is named by its fully qualified class name and, unless another implementation
 * of the same interface shares it, by its simple class name.
 * Providers lacking a {@link Plugin @Plugin} annotation are ignored.
 */
public class ServiceBasedPluginFactoryRegistry implements PluginFactoryRegistry {

    private static final Logger LOGGER = LoggerFactory.getLogger(ServiceBasedPluginFactoryRegistry.class);

    private final Map<Class<?>, PluginFactory<?>> discovered = new ConcurrentHashMap<>();

    @Override
    @SuppressWarnings("unchecked")
    public <P> PluginFactory<P> pluginFactory(Class<P> pluginInterface) {
        return (PluginFactory<P>) discovered.computeIfAbsent(Objects.requireNonNull(pluginInterface), ServiceBasedPluginFactoryRegistry::discover);
    }

    private static PluginFactory<?> discover(Class<?> pluginInterface) {
        return discoverImplementations(pluginInterface);
    }

    private static <P> PluginFactory<P> discoverImplementations(Class<P> pluginInterface) {
        Map<String, PluginFactory.Implementation<P>> byQualifiedName = new TreeMap<>();
        Map<String, List<PluginFactory.Implementation<P>>> bySimpleName = new TreeMap<>();
        ServiceLoader.load(pluginInterface).stream().forEach(provider -> {
            Class<? extends P> type = provider.type();
            Plugin plugin = type.getAnnotation(Plugin.class);
            if (plugin == null) {
                LOGGER.warn("Ignoring {} provider {} as it is not annotated with @{}", pluginInterface.getSimpleName(), type.getName(),
                        Plugin.class.getSimpleName());
                return;
            }
            var implementation = new PluginFactory.Implementation<P>(type, plugin.configType(), provider);
            byQualifiedName.put(type.getName(), implementation);
            bySimpleName.computeIfAbsent(type.getSimpleName(), name -> new ArrayList<>()).add(implementation);
        });
        Map<String, PluginFactory.Implementation<P>> byName = new HashMap<>(byQualifiedName);
        bySimpleName.forEach((simpleName, implementations) -> {
            if (implementations.size() == 1) {
                byName.putIfAbsent(simpleName, implementations.get(0));
            }
            else {
                LOGGER.warn("{} providers {} share the simple name '{}' and must be referred to by their fully qualified names",
                        pluginInterface.getSimpleName(),
                        implementations.stream().map(implementation -> implementation.type().getName()).toList(),
                        simpleName);
            }
        });
        LOGGER.debug("Discovered {} providers {}", pluginInterface.getSimpleName(), byQualifiedName.keySet());
        return PluginFactory.of(pluginInterface, byName);
    }
}
