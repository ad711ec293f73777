/*
 * Copyright Kroxylicious Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.qroxy.proxy.filter;

import java.util.Objects;

import edu.umd.cs.findbugs.annotations.NonNull;

/**
 * Thrown when a filter cannot be created for a session, for instance because a per-session file cannot be opened.
 * The failure is local to the session.
 */
public class SessionCreationException extends RuntimeException {

    public SessionCreationException(@NonNull
    String message) {
        super(Objects.requireNonNull(message));
    }

    public SessionCreationException(@NonNull
    String message, Throwable cause) {
        super(Objects.requireNonNull(message), cause);
    }
}
