/*
 * Copyright Kroxylicious Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.qroxy.proxy.internal;

import java.io.PrintWriter;
import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import io.qroxy.proxy.filter.Downstream;
import io.qroxy.proxy.filter.ReplyFilter;
import io.qroxy.proxy.filter.RequestFilter;
import io.qroxy.proxy.filter.Upstream;
import io.qroxy.proxy.query.Query;
import io.qroxy.proxy.query.Reply;

import edu.umd.cs.findbugs.annotations.Nullable;

/**
 * <p>The filters of one client session, wired together.</p>
 *
 * <p>Queries enter at the first filter and leave through the router. Replies enter at the last filter that
 * observes replies and pass back through the reply filters in reverse order to the client.</p>
 *
 * <p>A chain is confined to the worker servicing its session.</p>
 */
public final class FilterChain {

    private static final Logger LOGGER = LoggerFactory.getLogger(FilterChain.class);

    private final List<NamedFilter> filters;
    private final Downstream head;
    private final Upstream tail;
    private boolean closed;

    private FilterChain(List<NamedFilter> filters, Downstream head, Upstream tail) {
        this.filters = filters;
        this.head = head;
        this.tail = tail;
    }

    /**
     * Wires filters into a chain. Each filter's downstream and, for a reply filter, upstream is set here.
     * @param filters the filters, in request order
     * @param router where queries leave the chain
     * @param client where replies leave the chain
     * @return the chain
     * @throws IllegalStateException if a filter is not a {@link RequestFilter}
     */
    public static FilterChain wire(List<NamedFilter> filters, Downstream router, Upstream client) {
        Downstream head = router;
        for (int i = filters.size() - 1; i >= 0; i--) {
            NamedFilter named = filters.get(i);
            if (!(named.filter() instanceof RequestFilter requestFilter)) {
                throw new IllegalStateException("Filter '" + named.name() + "' of type " + named.filter().getClass().getName() + " is not a RequestFilter");
            }
            head = new RequestLink(named.name(), requestFilter, head);
        }
        Upstream tail = client;
        for (NamedFilter named : filters) {
            if (named.filter() instanceof ReplyFilter replyFilter) {
                tail = new ReplyLink(named.name(), replyFilter, tail);
            }
        }
        return new FilterChain(List.copyOf(filters), head, tail);
    }

    /**
     * Sends a query from the client through the chain.
     * @param query the query
     * @return true if the query reached the router and the router accepted it
     */
    public boolean routeQuery(Query query) {
        if (closed) {
            throw new IllegalStateException("Filter chain is closed");
        }
        return head.routeQuery(query);
    }

    /**
     * Sends a reply from the backend back through the chain.
     * @param reply the reply
     * @return true if the reply reached the client
     */
    public boolean clientReply(Reply reply) {
        if (closed) {
            throw new IllegalStateException("Filter chain is closed");
        }
        return tail.clientReply(reply);
    }

    public List<NamedFilter> filters() {
        return filters;
    }

    public void diagnostics(PrintWriter out) {
        for (NamedFilter named : filters) {
            out.printf("    Filter %s%n", named.name());
            named.filter().diagnostics(out);
        }
    }

    /**
     * Closes and releases every filter. Failures are logged and do not stop the remaining filters from being closed.
     * Closing a closed chain has no effect.
     */
    public void close() {
        if (closed) {
            return;
        }
        closed = true;
        RuntimeException failure = closeAll(filters);
        if (failure != null) {
            LOGGER.atWarn()
                    .setMessage("Failure closing filters: {}")
                    .addArgument(failure.getMessage())
                    .setCause(LOGGER.isDebugEnabled() ? failure : null)
                    .log();
        }
    }

    /**
     * Runs {@code close()} then {@code release()} on each filter, continuing past failures.
     * @param filters the filters
     * @return the first failure, with any later ones suppressed, or null
     */
    static @Nullable RuntimeException closeAll(List<NamedFilter> filters) {
        RuntimeException firstThrown = null;
        for (NamedFilter named : filters) {
            try {
                named.filter().close();
            }
            catch (RuntimeException e) {
                firstThrown = accumulate(firstThrown, e);
            }
            finally {
                try {
                    named.filter().release();
                }
                catch (RuntimeException e) {
                    firstThrown = accumulate(firstThrown, e);
                }
            }
        }
        return firstThrown;
    }

    /**
     * Runs {@code release()} on each filter of a session that was rejected before it carried any traffic,
     * continuing past failures. The filters are not closed, so no final reporting is done.
     * @param filters the filters
     * @return the first failure, with any later ones suppressed, or null
     */
    public static @Nullable RuntimeException releaseAll(List<NamedFilter> filters) {
        RuntimeException firstThrown = null;
        for (NamedFilter named : filters) {
            try {
                named.filter().release();
            }
            catch (RuntimeException e) {
                firstThrown = accumulate(firstThrown, e);
            }
        }
        return firstThrown;
    }

    private static RuntimeException accumulate(@Nullable RuntimeException firstThrown, RuntimeException e) {
        if (firstThrown == null) {
            return e;
        }
        firstThrown.addSuppressed(e);
        return firstThrown;
    }
}
