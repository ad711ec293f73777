/*
 * Copyright Kroxylicious Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.qroxy.sample;

import java.io.PrintWriter;

import io.qroxy.proxy.filter.AbstractRequestFilter;
import io.qroxy.proxy.query.Query;

/**
 * A sample request filter. It counts the statements of its session and forwards every query unchanged.
 */
class QueryCounterFilter extends AbstractRequestFilter {

    private final QueryCounter.Totals totals;
    private volatile long statements;

    QueryCounterFilter(QueryCounter.Totals totals) {
        this.totals = totals;
    }

    /**
     * Counts the query if it is a statement passing the configured pattern, then forwards it.
     *
     * @param query the query
     * @return the result of forwarding
     */
    @Override
    public boolean onQuery(Query query) {
        if (query.isSql() && totals.matcher().passes(query.sql())) {
            statements++;
            totals.count();
        }
        return downstream().routeQuery(query);
    }

    long statements() {
        return statements;
    }

    @Override
    public void diagnostics(PrintWriter out) {
        out.printf("      Statements counted: %d%n", statements);
    }
}
