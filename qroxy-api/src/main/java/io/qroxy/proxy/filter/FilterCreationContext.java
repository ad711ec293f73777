/*
 * Copyright Kroxylicious Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.qroxy.proxy.filter;

import edu.umd.cs.findbugs.annotations.Nullable;

/**
 * Context for the creation of a {@link Filter} for a client session.
 * See {@link FilterFactory#createFilter(FilterCreationContext, Object)}.
 */
public interface FilterCreationContext extends FilterFactoryContext {

    /**
     * @return the proxy-unique id of the client session
     */
    long sessionId();

    /**
     * @return the address of the client, if known
     */
    @Nullable
    String clientHost();

    /**
     * @return the authenticated user, if known
     */
    @Nullable
    String user();
}
