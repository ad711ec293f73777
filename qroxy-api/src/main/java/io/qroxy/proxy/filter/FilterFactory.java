/*
 * Copyright Kroxylicious Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.qroxy.proxy.filter;

import java.io.PrintWriter;

import io.qroxy.proxy.plugin.PluginConfigurationException;

/**
 * <p>A pluggable source of {@link Filter} instances.</p>
 * <p>FilterFactories are:</p>
 * <ul>
 * <li>{@linkplain java.util.ServiceLoader service} implementations provided by filter authors</li>
 * <li>called by the proxy runtime to {@linkplain #createFilter(FilterCreationContext, Object) create} a filter for each client session</li>
 * </ul>
 *
 * <p>The proxy runtime guarantees that:</p>
 * <ol>
 *     <li>a factory is {@linkplain #initialize(FilterFactoryContext, Object) initialized} once for each filter definition a service uses,
 *     before any attempt to create filters,</li>
 *     <li>the initialization data will eventually be {@linkplain #close(Object) closed} if and only if initialization succeeded,</li>
 *     <li>no attempts to create filters will be made once the initialization data is closed.</li>
 * </ol>
 * <p>Filters for different sessions are created and invoked concurrently, on different threads.
 * The initialization data is shared by all of them, so any mutable state it holds must be thread-safe,
 * for instance atomic counters.</p>
 *
 * @param <C> the type of configuration used to create the {@code Filter}. Use {@link Void} if the {@code Filter} is not configurable.
 * @param <I> The type of the initialization data
 */
public interface FilterFactory<C, I> {

    /**
     * <p>Initializes the factory with the specified configuration.</p>
     *
     * <p>This method validates the config, compiling any patterns it contains,
     * and returns some object (which may be the config, or some other object) which will be passed to
     * {@link #createFilter(FilterCreationContext, Object)}.</p>
     *
     * @param context context
     * @param config configuration
     * @return A state object, specific to the given {@code config}, which will be passed to the other methods of this interface.
     * @throws PluginConfigurationException when the configuration is invalid
     */
    I initialize(FilterFactoryContext context, C config) throws PluginConfigurationException;

    /**
     * Creates the filter for a client session.
     *
     * @param context The runtime context for the filter's creation.
     * @param initializationData The initialization data that was returned from {@link #initialize(FilterFactoryContext, Object)}.
     * @return the Filter instance, which must implement {@link RequestFilter}.
     * @throws SessionCreationException if a resource the session needs cannot be acquired
     */
    Filter createFilter(FilterCreationContext context, I initializationData);

    /**
     * Called by the runtime to release any resources associated with the given {@code initializationData}.
     * @param initializationData The initialization data that was returned from {@link #initialize(FilterFactoryContext, Object)}.
     */
    default void close(I initializationData) {
    }

    /**
     * Writes a description of the state shared by all sessions. Must not modify any state.
     * @param initializationData The initialization data that was returned from {@link #initialize(FilterFactoryContext, Object)}.
     * @param out destination
     */
    default void diagnostics(I initializationData, PrintWriter out) {
    }
}
