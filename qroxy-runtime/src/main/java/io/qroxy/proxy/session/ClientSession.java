/*
 * Copyright Kroxylicious Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.qroxy.proxy.session;

import java.io.PrintWriter;
import java.time.Instant;
import java.util.Objects;
import java.util.function.Consumer;

import io.qroxy.proxy.internal.FilterChain;
import io.qroxy.proxy.query.Query;
import io.qroxy.proxy.query.Reply;

import edu.umd.cs.findbugs.annotations.Nullable;

/**
 * <p>A client connection to a service, with its filter chain.</p>
 *
 * <p>A session is serviced by one worker at a time. {@link #close()} may also be called from another
 * thread, such as the admin console's. If a query or reply is in the chain at that moment, the close is
 * handed to the worker, which performs it as the query or reply leaves the chain. Traffic arriving once a
 * close has been requested is refused. The lock guarding this hand-over is never held while a filter or
 * the router runs. {@link #diagnostics(PrintWriter)} takes no lock.</p>
 */
public final class ClientSession {

    private final long id;
    private final String serviceName;
    private final @Nullable String clientHost;
    private final @Nullable String user;
    private final Instant connectedAt;
    private final FilterChain chain;
    private final Consumer<ClientSession> onClose;
    private final Object lock = new Object();
    private boolean inFlight;
    private boolean closeRequested;
    private volatile boolean closed;

    public ClientSession(long id,
                         String serviceName,
                         @Nullable String clientHost,
                         @Nullable String user,
                         Instant connectedAt,
                         FilterChain chain,
                         Consumer<ClientSession> onClose) {
        this.id = id;
        this.serviceName = Objects.requireNonNull(serviceName);
        this.clientHost = clientHost;
        this.user = user;
        this.connectedAt = Objects.requireNonNull(connectedAt);
        this.chain = Objects.requireNonNull(chain);
        this.onClose = Objects.requireNonNull(onClose);
    }

    public long id() {
        return id;
    }

    public String serviceName() {
        return serviceName;
    }

    public @Nullable String clientHost() {
        return clientHost;
    }

    public @Nullable String user() {
        return user;
    }

    public Instant connectedAt() {
        return connectedAt;
    }

    public boolean isClosed() {
        return closed;
    }

    /**
     * Sends a query from the client through the session's filters to the router.
     * @param query the query
     * @return true if the router accepted the query, false if it did not or the session is closing
     */
    public boolean routeQuery(Query query) {
        if (!enter()) {
            return false;
        }
        try {
            return chain.routeQuery(query);
        }
        finally {
            leave();
        }
    }

    /**
     * Sends a reply from the backend through the session's filters to the client.
     * @param reply the reply
     * @return true if the client accepted the reply, false if it did not or the session is closing
     */
    public boolean clientReply(Reply reply) {
        if (!enter()) {
            return false;
        }
        try {
            return chain.clientReply(reply);
        }
        finally {
            leave();
        }
    }

    private boolean enter() {
        synchronized (lock) {
            if (closeRequested) {
                return false;
            }
            inFlight = true;
            return true;
        }
    }

    private void leave() {
        boolean closeNow;
        synchronized (lock) {
            inFlight = false;
            closeNow = closeRequested;
        }
        if (closeNow) {
            doClose();
        }
    }

    public void diagnostics(PrintWriter out) {
        out.printf("Session %d%n", id);
        out.printf("  Service:        %s%n", serviceName);
        out.printf("  Client:         %s@%s%n", user == null ? "" : user, clientHost == null ? "" : clientHost);
        out.printf("  Connected:      %s%n", connectedAt);
        chain.diagnostics(out);
    }

    /**
     * Ends the session, closing and releasing all its filters, or, if a query or reply is in the chain,
     * arranges for the worker to do so once it leaves. Closing a closed session has no effect.
     */
    public void close() {
        synchronized (lock) {
            if (closeRequested) {
                return;
            }
            closeRequested = true;
            if (inFlight) {
                return;
            }
        }
        doClose();
    }

    private void doClose() {
        try {
            chain.close();
        }
        finally {
            closed = true;
            onClose.accept(this);
        }
    }

    @Override
    public String toString() {
        return "ClientSession[id=" + id + ", service=" + serviceName + "]";
    }
}
