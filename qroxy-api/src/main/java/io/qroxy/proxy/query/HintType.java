/*
 * Copyright Kroxylicious Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.qroxy.proxy.query;

/**
 * The kinds of routing hint a filter may attach to a {@link Query}.
 */
public enum HintType {
    /** Send the query to the primary server. */
    ROUTE_TO_PRIMARY,
    /** Send the query to a replica. */
    ROUTE_TO_REPLICA,
    /** Send the query to the server named by the hint. */
    ROUTE_TO_NAMED_SERVER,
    /** Send the query to a server that has caught up with the primary. */
    ROUTE_TO_UPTODATE_SERVER,
    /** Send the query to every server. */
    ROUTE_TO_ALL,
    /** A name/value parameter for the router. */
    PARAMETER
}
