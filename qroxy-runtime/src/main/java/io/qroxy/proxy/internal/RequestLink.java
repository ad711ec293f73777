/*
 * Copyright Kroxylicious Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.qroxy.proxy.internal;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import io.qroxy.proxy.filter.Downstream;
import io.qroxy.proxy.filter.RequestFilter;
import io.qroxy.proxy.query.Query;

/**
 * The entry to one request filter of a chain. It checks that each invocation of the filter forwards the query exactly once.
 * A second forward is rejected with {@link IllegalStateException}; an invocation that does not forward is logged and
 * reported as not routed.
 */
final class RequestLink implements Downstream {

    private static final Logger LOGGER = LoggerFactory.getLogger(RequestLink.class);

    private final String filterName;
    private final RequestFilter filter;
    private final Downstream next;
    private boolean invoking;
    private int forwards;

    RequestLink(String filterName, RequestFilter filter, Downstream next) {
        this.filterName = filterName;
        this.filter = filter;
        this.next = next;
        filter.setDownstream(this::forward);
    }

    private boolean forward(Query query) {
        if (!invoking) {
            throw new IllegalStateException("Filter '" + filterName + "' forwarded a query outside of onQuery");
        }
        if (++forwards > 1) {
            throw new IllegalStateException("Filter '" + filterName + "' forwarded a query more than once");
        }
        return next.routeQuery(query);
    }

    @Override
    public boolean routeQuery(Query query) {
        invoking = true;
        forwards = 0;
        boolean result;
        try {
            result = filter.onQuery(query);
        }
        finally {
            invoking = false;
        }
        if (forwards == 0) {
            LOGGER.error("Filter '{}' did not forward {}", filterName, query);
            return false;
        }
        return result;
    }
}
