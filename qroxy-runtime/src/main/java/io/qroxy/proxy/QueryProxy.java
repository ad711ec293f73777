/*
 * Copyright Kroxylicious Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.qroxy.proxy;

import java.io.PrintWriter;
import java.time.Clock;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicLong;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import io.qroxy.proxy.admin.AdminConsole;
import io.qroxy.proxy.bootstrap.FilterChainFactory;
import io.qroxy.proxy.classifier.QueryClassifier;
import io.qroxy.proxy.config.Configuration;
import io.qroxy.proxy.config.PluginFactoryRegistry;
import io.qroxy.proxy.config.ServiceDefinition;
import io.qroxy.proxy.filter.Downstream;
import io.qroxy.proxy.filter.SessionCreationException;
import io.qroxy.proxy.filter.Upstream;
import io.qroxy.proxy.internal.FilterChain;
import io.qroxy.proxy.session.ClientSession;
import io.qroxy.proxy.session.SessionRegistry;

import edu.umd.cs.findbugs.annotations.Nullable;

/**
 * <p>The proxied services of a configuration, and the client sessions open on them.</p>
 *
 * <p>Constructing a proxy initializes every filter definition of every service. If any of them fails the proxy
 * does not start: definitions already initialized are closed and the failure is thrown.</p>
 */
public final class QueryProxy implements AutoCloseable {

    private static final Logger LOGGER = LoggerFactory.getLogger(QueryProxy.class);

    private final Clock clock;
    private final String queryClassifierName;
    private final Map<String, FilterChainFactory> services;
    private final SessionRegistry<ClientSession> sessions = new SessionRegistry<>();
    private final AtomicLong sessionIds = new AtomicLong();
    private final @Nullable AdminConsole adminConsole;

    public QueryProxy(Configuration configuration, PluginFactoryRegistry pfr, Clock clock) {
        this.clock = Objects.requireNonNull(clock);
        this.queryClassifierName = configuration.queryClassifierName();
        QueryClassifier queryClassifier = pfr.pluginFactory(QueryClassifier.class).pluginInstance(queryClassifierName);
        this.services = new LinkedHashMap<>();
        try {
            for (ServiceDefinition service : configuration.services()) {
                services.put(service.name(), new FilterChainFactory(service.name(),
                        pfr,
                        clock,
                        queryClassifier,
                        configuration.filterDefinitionsFor(service),
                        configuration.sessionFailurePolicy()));
                LOGGER.info("Service '{}' started with filters {}", service.name(), service.filters());
            }
        }
        catch (RuntimeException e) {
            closeServices();
            throw e;
        }
        this.adminConsole = configuration.adminConsole() == null ? null : new AdminConsole(this, configuration.adminConsole().consoleMode());
    }

    public Clock clock() {
        return clock;
    }

    public List<String> serviceNames() {
        return List.copyOf(services.keySet());
    }

    /**
     * @param serviceName a service name
     * @return the names of the service's filters, in chain order
     * @throws IllegalArgumentException if there is no such service
     */
    public List<String> filterNames(String serviceName) {
        return service(serviceName).filterNames();
    }

    /**
     * Opens a client session on a service.
     *
     * @param serviceName the service
     * @param clientHost the client address, if known
     * @param user the authenticated user, if known
     * @param router where the session's queries are routed
     * @param client where the session's replies are delivered
     * @return the session
     * @throws IllegalArgumentException if there is no such service
     * @throws SessionCreationException if the session is rejected because a filter cannot be created
     */
    public ClientSession openSession(String serviceName,
                                     @Nullable String clientHost,
                                     @Nullable String user,
                                     Downstream router,
                                     Upstream client) {
        FilterChainFactory factory = service(serviceName);
        long id = sessionIds.incrementAndGet();
        FilterChain chain = factory.createChain(id, clientHost, user, router, client);
        ClientSession session = new ClientSession(id, serviceName, clientHost, user, clock.instant(), chain, sessions::deregister);
        sessions.register(session);
        LOGGER.atDebug()
                .setMessage("Session {} opened on service '{}' for {}@{}")
                .addArgument(id)
                .addArgument(serviceName)
                .addArgument(user)
                .addArgument(clientHost)
                .log();
        return session;
    }

    /**
     * @return the open client sessions, newest first
     */
    public List<ClientSession> sessions() {
        return sessions.snapshot();
    }

    public Optional<ClientSession> findSession(long id) {
        return sessions.find(session -> session.id() == id);
    }

    public Optional<AdminConsole> adminConsole() {
        return Optional.ofNullable(adminConsole);
    }

    /**
     * Writes the services and the state their filters share.
     * @param out destination
     */
    public void serviceDiagnostics(PrintWriter out) {
        out.printf("Query classifier: %s%n", queryClassifierName);
        for (var entry : services.entrySet()) {
            out.printf("Service %s%n", entry.getKey());
            entry.getValue().diagnostics(out);
        }
    }

    /**
     * Writes the open client sessions and their filters' state.
     * @param out destination
     */
    public void sessionDiagnostics(PrintWriter out) {
        List<ClientSession> snapshot = sessions.snapshot();
        out.printf("%d open session(s)%n", snapshot.size());
        for (ClientSession session : snapshot) {
            session.diagnostics(out);
        }
    }

    /**
     * Closes every open session, then the services in reverse order.
     */
    @Override
    public void close() {
        for (ClientSession session : sessions.snapshot()) {
            session.close();
        }
        closeServices();
    }

    private void closeServices() {
        List<FilterChainFactory> started = new ArrayList<>(services.values());
        for (int i = started.size() - 1; i >= 0; i--) {
            try {
                started.get(i).close();
            }
            catch (RuntimeException e) {
                LOGGER.atWarn()
                        .setMessage("Failure closing service '{}': {}")
                        .addArgument(started.get(i).serviceName())
                        .addArgument(e.getMessage())
                        .setCause(LOGGER.isDebugEnabled() ? e : null)
                        .log();
            }
        }
        services.clear();
    }

    private FilterChainFactory service(String serviceName) {
        FilterChainFactory factory = services.get(serviceName);
        if (factory == null) {
            throw new IllegalArgumentException("Unknown service '" + serviceName + "', known services are " + services.keySet());
        }
        return factory;
    }
}
