/*
 * Copyright Kroxylicious Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.qroxy.proxy.internal;

import java.util.Objects;

import io.qroxy.proxy.filter.Filter;

/**
 * A filter created for a session, with the name of its definition.
 * @param name the filter definition name
 * @param filter the filter
 */
public record NamedFilter(String name, Filter filter) {
    public NamedFilter {
        Objects.requireNonNull(name);
        Objects.requireNonNull(filter);
    }
}
