/*
 * Copyright Kroxylicious Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.qroxy.proxy.filter;

import io.qroxy.proxy.query.Query;

/**
 * The next stage toward the backend for a query: either the next filter of the chain or the router.
 */
@FunctionalInterface
public interface Downstream {

    /**
     * @param query the query
     * @return true if the query was accepted for routing
     */
    boolean routeQuery(Query query);
}
