/*
 * Copyright Kroxylicious Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.qroxy.proxy.internal;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import io.qroxy.proxy.filter.ReplyFilter;
import io.qroxy.proxy.filter.Upstream;
import io.qroxy.proxy.query.Reply;

/**
 * The entry to one reply filter of a chain, checking the same forwarding rule as {@link RequestLink}.
 */
final class ReplyLink implements Upstream {

    private static final Logger LOGGER = LoggerFactory.getLogger(ReplyLink.class);

    private final String filterName;
    private final ReplyFilter filter;
    private final Upstream next;
    private boolean invoking;
    private int forwards;

    ReplyLink(String filterName, ReplyFilter filter, Upstream next) {
        this.filterName = filterName;
        this.filter = filter;
        this.next = next;
        filter.setUpstream(this::forward);
    }

    private boolean forward(Reply reply) {
        if (!invoking) {
            throw new IllegalStateException("Filter '" + filterName + "' forwarded a reply outside of onReply");
        }
        if (++forwards > 1) {
            throw new IllegalStateException("Filter '" + filterName + "' forwarded a reply more than once");
        }
        return next.clientReply(reply);
    }

    @Override
    public boolean clientReply(Reply reply) {
        invoking = true;
        forwards = 0;
        boolean result;
        try {
            result = filter.onReply(reply);
        }
        finally {
            invoking = false;
        }
        if (forwards == 0) {
            LOGGER.error("Filter '{}' did not forward {}", filterName, reply);
            return false;
        }
        return result;
    }
}
