/*
 * Copyright Kroxylicious Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.qroxy.proxy.config;

/**
 * Resolves a plugin interface, such as {@link io.qroxy.proxy.filter.FilterFactory} or
 * {@link io.qroxy.proxy.classifier.QueryClassifier}, to the implementations available for it.
 */
public interface PluginFactoryRegistry {

    /**
     * @param pluginInterface the plugin interface
     * @return its implementations
     * @param <P> the plugin interface
     */
    <P> PluginFactory<P> pluginFactory(Class<P> pluginInterface);
}
