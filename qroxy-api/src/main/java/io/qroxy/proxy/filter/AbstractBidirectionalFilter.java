/*
 * Copyright Kroxylicious Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.qroxy.proxy.filter;

import java.util.Objects;

import edu.umd.cs.findbugs.annotations.Nullable;

/**
 * Convenience base for a filter on both the request and the reply path.
 */
public abstract class AbstractBidirectionalFilter extends AbstractRequestFilter implements ReplyFilter {

    private @Nullable Upstream upstream;

    @Override
    public final void setUpstream(Upstream upstream) {
        if (this.upstream != null) {
            throw new IllegalStateException(getClass().getSimpleName() + " already has an upstream");
        }
        this.upstream = Objects.requireNonNull(upstream);
    }

    /**
     * @return the wired upstream
     * @throws IllegalStateException if the filter has not been wired
     */
    protected final Upstream upstream() {
        if (upstream == null) {
            throw new IllegalStateException(getClass().getSimpleName() + " has no upstream");
        }
        return upstream;
    }
}
