/*
 * Copyright Kroxylicious Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.qroxy.proxy.admin;

/**
 * What an admin console permits.
 */
public enum ConsoleMode {
    /** Read-only inspection. */
    USER,
    /** Inspection plus commands that change proxy state, such as closing client sessions. */
    DEVELOPER
}
