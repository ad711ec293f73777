/*
 * Copyright Kroxylicious Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.qroxy.proxy.bootstrap;

import java.io.PrintWriter;
import java.time.Clock;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicBoolean;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import io.qroxy.proxy.classifier.QueryClassifier;
import io.qroxy.proxy.config.NamedFilterDefinition;
import io.qroxy.proxy.config.OnSessionFailure;
import io.qroxy.proxy.config.PluginFactory;
import io.qroxy.proxy.config.PluginFactoryRegistry;
import io.qroxy.proxy.filter.Downstream;
import io.qroxy.proxy.filter.Filter;
import io.qroxy.proxy.filter.FilterCreationContext;
import io.qroxy.proxy.filter.FilterFactory;
import io.qroxy.proxy.filter.FilterFactoryContext;
import io.qroxy.proxy.filter.SessionCreationException;
import io.qroxy.proxy.filter.Upstream;
import io.qroxy.proxy.internal.FilterChain;
import io.qroxy.proxy.internal.NamedFilter;
import io.qroxy.proxy.plugin.PluginConfigurationException;

import edu.umd.cs.findbugs.annotations.Nullable;

/**
 * Abstracts the creation of the filter chain of a service's client sessions, hiding the configuration
 * required for instantiation at the point at which sessions are created.
 * Each filter definition the service uses is initialized once, when this factory is constructed,
 * and its initialization data is shared by the filters of every session.
 */
public class FilterChainFactory implements AutoCloseable {

    private static final Logger LOGGER = LoggerFactory.getLogger(FilterChainFactory.class);

    private record FactoryContext(String filterName,
                                  String serviceName,
                                  Clock clock,
                                  QueryClassifier queryClassifier,
                                  PluginFactoryRegistry pfr)
            implements FilterFactoryContext {

        @Override
        public <P> P pluginInstance(Class<P> pluginClass, String instanceName) {
            return pfr.pluginFactory(pluginClass).pluginInstance(instanceName);
        }
    }

    private record CreationContext(FactoryContext factoryContext,
                                   long sessionId,
                                   @Nullable String clientHost,
                                   @Nullable String user)
            implements FilterCreationContext {

        @Override
        public String filterName() {
            return factoryContext.filterName();
        }

        @Override
        public String serviceName() {
            return factoryContext.serviceName();
        }

        @Override
        public Clock clock() {
            return factoryContext.clock();
        }

        @Override
        public QueryClassifier queryClassifier() {
            return factoryContext.queryClassifier();
        }

        @Override
        public <P> P pluginInstance(Class<P> pluginClass, String instanceName) {
            return factoryContext.pluginInstance(pluginClass, instanceName);
        }
    }

    /**
     * Manages the lifecycle of a filter definition's initialization data, initializing it on construction and closing it in {@link #close()}
     */
    private static final class Wrapper {

        private final FilterFactory<? super Object, ? super Object> filterFactory;
        private final NamedFilterDefinition filterDefinition;
        private final FactoryContext context;
        private final Object initResult;
        private final AtomicBoolean closed = new AtomicBoolean(false);

        private Wrapper(FactoryContext context,
                        NamedFilterDefinition filterDefinition,
                        FilterFactory<? super Object, ? super Object> filterFactory) {
            this.filterFactory = filterFactory;
            this.filterDefinition = filterDefinition;
            this.context = context;
            Object config = filterDefinition.config();
            try {
                initResult = filterFactory.initialize(context, config);
            }
            catch (Exception e) {
                throw new PluginConfigurationException(
                        "Exception initializing filter factory " + filterDefinition.name() + " with config " + config + ": " + e.getMessage(), e);
            }
        }

        Filter create(long sessionId, @Nullable String clientHost, @Nullable String user) {
            if (closed.get()) {
                throw new IllegalStateException("Filter factory " + filterDefinition.name() + " is closed");
            }
            try {
                return Objects.requireNonNull(filterFactory.createFilter(new CreationContext(context, sessionId, clientHost, user), initResult));
            }
            catch (SessionCreationException e) {
                throw e;
            }
            catch (Exception e) {
                throw new SessionCreationException("Exception creating filter " + filterDefinition.name() + " for session " + sessionId + ": " + e.getMessage(), e);
            }
        }

        void diagnostics(PrintWriter out) {
            out.printf("Filter %s (%s)%n", filterDefinition.name(), filterDefinition.type());
            filterFactory.diagnostics(initResult, out);
        }

        void close() {
            if (!this.closed.getAndSet(true)) {
                filterFactory.close(initResult);
            }
        }

        @Override
        public String toString() {
            return "Wrapper[" +
                    "filterFactory=" + filterFactory + ", " +
                    "filterDefinition=" + filterDefinition + ']';
        }
    }

    private final String serviceName;
    private final OnSessionFailure onSessionFailure;
    private final Map<String, Wrapper> initialized;

    /**
     * Initializes the filter definitions of a service.
     * @param serviceName the name of the service
     * @param pfr resolves filter and other plugin names
     * @param clock the clock filters use
     * @param queryClassifier the classifier filters use
     * @param filterDefinitions the service's filters, in chain order
     * @param onSessionFailure what to do when a filter cannot be created for a session
     * @throws PluginConfigurationException if a filter definition cannot be initialized; definitions already initialized are closed
     */
    public FilterChainFactory(String serviceName,
                              PluginFactoryRegistry pfr,
                              Clock clock,
                              QueryClassifier queryClassifier,
                              @Nullable List<NamedFilterDefinition> filterDefinitions,
                              OnSessionFailure onSessionFailure) {
        this.serviceName = Objects.requireNonNull(serviceName);
        this.onSessionFailure = Objects.requireNonNull(onSessionFailure);
        @SuppressWarnings({ "unchecked", "rawtypes" })
        Class<FilterFactory<? super Object, ? super Object>> type = (Class) FilterFactory.class;
        PluginFactory<FilterFactory<? super Object, ? super Object>> pluginFactory = pfr.pluginFactory(type);
        if (filterDefinitions == null || filterDefinitions.isEmpty()) {
            this.initialized = Map.of();
        }
        else {
            this.initialized = new LinkedHashMap<>(filterDefinitions.size());
            try {
                for (var fd : filterDefinitions) {
                    FilterFactory<? super Object, ? super Object> filterFactory = pluginFactory.pluginInstance(fd.type());
                    Class<?> configType = pluginFactory.configType(fd.type());
                    if (fd.config() == null || configType.isInstance(fd.config())) {
                        var context = new FactoryContext(fd.name(), serviceName, clock, queryClassifier, pfr);
                        this.initialized.put(fd.name(), new Wrapper(context, fd, filterFactory));
                    }
                    else {
                        throw new PluginConfigurationException("Filter " + fd.name() + " accepts config of type " +
                                configType.getName() + " but provided with config of type " + fd.config().getClass().getName());
                    }
                }
            }
            catch (Exception e) {
                // close already initialized factories
                close();
                throw e;
            }
        }
    }

    public String serviceName() {
        return serviceName;
    }

    /**
     * @return the names of the service's filters, in chain order
     */
    public List<String> filterNames() {
        return List.copyOf(initialized.keySet());
    }

    /**
     * Creates the filters of a new client session and wires them into a chain.
     * When a filter cannot be created the session is rejected, unless the policy is
     * {@link OnSessionFailure#SKIP_FILTER}, in which case the chain is built without that filter.
     *
     * @param sessionId the id of the session
     * @param clientHost the client address, if known
     * @param user the authenticated user, if known
     * @param router where queries leave the chain
     * @param client where replies leave the chain
     * @return the new chain
     * @throws SessionCreationException if the session is rejected; any filters already created are released without being closed
     */
    public FilterChain createChain(long sessionId,
                                   @Nullable String clientHost,
                                   @Nullable String user,
                                   Downstream router,
                                   Upstream client) {
        List<NamedFilter> created = new ArrayList<>(initialized.size());
        try {
            for (var entry : initialized.entrySet()) {
                try {
                    created.add(new NamedFilter(entry.getKey(), entry.getValue().create(sessionId, clientHost, user)));
                }
                catch (SessionCreationException e) {
                    if (onSessionFailure != OnSessionFailure.SKIP_FILTER) {
                        throw e;
                    }
                    LOGGER.atWarn()
                            .setMessage("Skipping filter '{}' in session {} of service '{}': {}")
                            .addArgument(entry.getKey())
                            .addArgument(sessionId)
                            .addArgument(serviceName)
                            .addArgument(e.getMessage())
                            .setCause(LOGGER.isDebugEnabled() ? e : null)
                            .log();
                }
            }
            return FilterChain.wire(created, router, client);
        }
        catch (RuntimeException e) {
            RuntimeException releaseFailure = FilterChain.releaseAll(created);
            if (releaseFailure != null) {
                e.addSuppressed(releaseFailure);
            }
            throw e;
        }
    }

    /**
     * Writes the diagnostics of each filter definition's shared state.
     * @param out destination
     */
    public void diagnostics(PrintWriter out) {
        for (Wrapper wrapper : initialized.values()) {
            wrapper.diagnostics(out);
        }
    }

    @Override
    public void close() {
        RuntimeException firstThrown = null;
        // Close in reverse order of initialization
        var list = new ArrayList<>(initialized.values());
        for (int i = list.size() - 1; i >= 0; i--) {
            Wrapper wrapper = list.get(i);
            try {
                wrapper.close();
            }
            catch (RuntimeException e) {
                if (firstThrown == null) {
                    firstThrown = e;
                }
                else {
                    firstThrown.addSuppressed(e);
                }
            }
        }
        if (firstThrown != null) {
            throw firstThrown;
        }
    }
}
