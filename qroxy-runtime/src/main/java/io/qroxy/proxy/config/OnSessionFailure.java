/*
 * Copyright Kroxylicious Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.qroxy.proxy.config;

/**
 * What the proxy does when a filter cannot be created for a new client session.
 */
public enum OnSessionFailure {
    /** Reject the client connection. */
    REJECT,
    /** Build the session's chain without the failing filter. */
    SKIP_FILTER
}
