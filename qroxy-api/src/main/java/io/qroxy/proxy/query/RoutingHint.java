/*
 * Copyright Kroxylicious Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.qroxy.proxy.query;

import java.util.Objects;

import edu.umd.cs.findbugs.annotations.Nullable;

/**
 * An annotation on a query that influences a later routing decision.
 * Filters attach hints; they never route.
 *
 * @param type the kind of hint
 * @param name the server name for {@link HintType#ROUTE_TO_NAMED_SERVER}, or the parameter name for {@link HintType#PARAMETER}
 * @param value the parameter value for {@link HintType#PARAMETER}
 */
public record RoutingHint(HintType type, @Nullable String name, @Nullable String value) {

    private static final RoutingHint ROUTE_TO_PRIMARY = new RoutingHint(HintType.ROUTE_TO_PRIMARY, null, null);

    public RoutingHint {
        Objects.requireNonNull(type);
    }

    public static RoutingHint routeToPrimary() {
        return ROUTE_TO_PRIMARY;
    }

    public static RoutingHint routeToNamedServer(String server) {
        return new RoutingHint(HintType.ROUTE_TO_NAMED_SERVER, Objects.requireNonNull(server), null);
    }

    public static RoutingHint parameter(String name, String value) {
        return new RoutingHint(HintType.PARAMETER, Objects.requireNonNull(name), Objects.requireNonNull(value));
    }

    @Override
    public String toString() {
        if (name == null) {
            return type.name();
        }
        return type.name() + "(" + name + (value == null ? "" : "=" + value) + ")";
    }
}
