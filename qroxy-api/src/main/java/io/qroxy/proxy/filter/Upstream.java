/*
 * Copyright Kroxylicious Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.qroxy.proxy.filter;

import io.qroxy.proxy.query.Reply;

/**
 * The next stage toward the client for a reply: either the previous filter of the chain or the client connection.
 */
@FunctionalInterface
public interface Upstream {

    /**
     * @param reply the reply
     * @return true if the reply was accepted
     */
    boolean clientReply(Reply reply);
}
