/*
 * Copyright Kroxylicious Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.qroxy.proxy.filter;

import java.util.Objects;

import edu.umd.cs.findbugs.annotations.Nullable;

/**
 * Convenience base for a {@link RequestFilter} that holds its wiring.
 */
public abstract class AbstractRequestFilter implements RequestFilter {

    private @Nullable Downstream downstream;

    @Override
    public final void setDownstream(Downstream downstream) {
        if (this.downstream != null) {
            throw new IllegalStateException(getClass().getSimpleName() + " already has a downstream");
        }
        this.downstream = Objects.requireNonNull(downstream);
    }

    /**
     * @return the wired downstream
     * @throws IllegalStateException if the filter has not been wired
     */
    protected final Downstream downstream() {
        if (downstream == null) {
            throw new IllegalStateException(getClass().getSimpleName() + " has no downstream");
        }
        return downstream;
    }
}
