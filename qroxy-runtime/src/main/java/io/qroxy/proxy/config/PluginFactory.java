/*
 * Copyright Kroxylicious Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.qroxy.proxy.config;

import java.util.Collections;
import java.util.Map;
import java.util.NavigableMap;
import java.util.Objects;
import java.util.SortedSet;
import java.util.TreeMap;
import java.util.function.Supplier;

import io.qroxy.proxy.plugin.UnknownPluginInstanceException;

/**
 * The implementations of one plugin interface, indexed by the names a configuration can refer to them by.
 * @param <P> the plugin interface
 */
public final class PluginFactory<P> {

    /**
     * An implementation of a plugin interface.
     * @param type the implementation class
     * @param configType the config type declared by its {@link io.qroxy.proxy.plugin.Plugin @Plugin}
     * @param supplier creates a new instance on each call
     * @param <P> the plugin interface
     */
    public record Implementation<P>(Class<? extends P> type,
                                    Class<?> configType,
                                    Supplier<? extends P> supplier) {
        public Implementation {
            Objects.requireNonNull(type);
            Objects.requireNonNull(configType);
            Objects.requireNonNull(supplier);
        }
    }

    private final Class<P> pluginInterface;
    private final NavigableMap<String, Implementation<P>> byName;

    private PluginFactory(Class<P> pluginInterface, NavigableMap<String, Implementation<P>> byName) {
        this.pluginInterface = pluginInterface;
        this.byName = byName;
    }

    /**
     * @param pluginInterface the plugin interface
     * @param byName the implementations, keyed by every name each can be referred to by
     * @return the factory
     * @param <P> the plugin interface
     */
    public static <P> PluginFactory<P> of(Class<P> pluginInterface, Map<String, Implementation<P>> byName) {
        return new PluginFactory<>(Objects.requireNonNull(pluginInterface), new TreeMap<>(byName));
    }

    /**
     * @param name an implementation name
     * @return a new instance of the named implementation
     * @throws UnknownPluginInstanceException if no implementation has that name
     */
    public P pluginInstance(String name) {
        return pluginInterface.cast(lookup(name).supplier().get());
    }

    /**
     * @param name an implementation name
     * @return the config type of the named implementation, {@link Void} if it takes none
     * @throws UnknownPluginInstanceException if no implementation has that name
     */
    public Class<?> configType(String name) {
        return lookup(name).configType();
    }

    /**
     * @return every name an implementation can be referred to by, in order
     */
    public SortedSet<String> names() {
        return Collections.unmodifiableSortedSet(byName.navigableKeySet());
    }

    private Implementation<P> lookup(String name) {
        if (Objects.requireNonNull(name).isEmpty()) {
            throw new IllegalArgumentException("A " + pluginInterface.getSimpleName() + " name must not be empty");
        }
        Implementation<P> implementation = byName.get(name);
        if (implementation == null) {
            throw new UnknownPluginInstanceException("Unknown " + pluginInterface.getName() + " plugin instance for name '" + name + "'. "
                    + "Known names are " + byName.keySet() + ".");
        }
        return implementation;
    }
}
