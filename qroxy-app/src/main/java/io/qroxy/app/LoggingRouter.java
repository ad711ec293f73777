/*
 * Copyright Kroxylicious Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.qroxy.app;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import io.qroxy.proxy.filter.Downstream;
import io.qroxy.proxy.query.Query;

/**
 * The end of a replayed chain: accepts every query and logs the routing hints the filters attached to it.
 */
class LoggingRouter implements Downstream {

    private static final Logger LOGGER = LoggerFactory.getLogger(LoggingRouter.class);

    private long routed;

    @Override
    public boolean routeQuery(Query query) {
        routed++;
        LOGGER.atInfo()
                .setMessage("Routing '{}' with hints {}")
                .addArgument(query::sql)
                .addArgument(query::hints)
                .log();
        return true;
    }

    long routed() {
        return routed;
    }
}
