/*
 * Copyright Kroxylicious Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.qroxy.proxy.filter;

import io.qroxy.proxy.query.Query;

/**
 * A filter on the request path.
 */
public interface RequestFilter extends Filter {

    /**
     * Wires the filter to the next stage toward the backend.
     * Called exactly once by the runtime, before any query flows.
     * @param downstream the next stage
     * @throws IllegalStateException if the filter is already wired
     */
    void setDownstream(Downstream downstream);

    /**
     * <p>Handles a query from the client.</p>
     *
     * <p>Each invocation must forward the query, possibly after annotating it, to the
     * {@linkplain #setDownstream(Downstream) downstream} exactly once, and return the downstream's result.
     * The method runs on the worker servicing the session and must not block.</p>
     *
     * @param query the query
     * @return the result of forwarding
     */
    boolean onQuery(Query query);
}
