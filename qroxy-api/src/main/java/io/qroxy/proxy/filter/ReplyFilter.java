/*
 * Copyright Kroxylicious Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.qroxy.proxy.filter;

import io.qroxy.proxy.query.Reply;

/**
 * A filter that also observes the reply path. Replies pass through reply filters in the reverse of chain order.
 */
public interface ReplyFilter extends Filter {

    /**
     * Wires the filter to the next stage toward the client.
     * Called exactly once by the runtime, before any reply flows.
     * @param upstream the next stage
     * @throws IllegalStateException if the filter is already wired
     */
    void setUpstream(Upstream upstream);

    /**
     * Handles a reply from the backend. Each invocation must forward the reply to the
     * {@linkplain #setUpstream(Upstream) upstream} exactly once, and return its result.
     * @param reply the reply
     * @return the result of forwarding
     */
    boolean onReply(Reply reply);
}
