/*
 * Copyright Kroxylicious Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.qroxy.proxy.filter;

import java.time.Clock;

import io.qroxy.proxy.classifier.QueryClassifier;
import io.qroxy.proxy.plugin.UnknownPluginInstanceException;

/**
 * Context passed to a {@link FilterFactory} by the runtime, giving access to environmental resources.
 */
public interface FilterFactoryContext {

    /**
     * @return the name given to the filter definition in configuration
     */
    String filterName();

    /**
     * @return the name of the service whose chain the filter belongs to
     */
    String serviceName();

    /**
     * The clock filters must use for timestamps and durations.
     * @return the clock
     */
    Clock clock();

    /**
     * @return the classifier configured for the proxy
     */
    QueryClassifier queryClassifier();

    /**
     * Gets a plugin instance for the given plugin type and name
     * @param pluginClass The plugin type
     * @param instanceName The plugin instance name
     * @return The plugin instance
     * @param <P> The plugin manager type
     * @throws UnknownPluginInstanceException the plugin with given instance name is unknown
     */
    <P> P pluginInstance(Class<P> pluginClass, String instanceName);
}
