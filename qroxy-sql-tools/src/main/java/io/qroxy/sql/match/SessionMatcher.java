/*
 * Copyright Kroxylicious Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.qroxy.sql.match;

import java.util.Objects;

import edu.umd.cs.findbugs.annotations.Nullable;

/**
 * Restricts a filter to the sessions from one client address and/or of one user.
 * A restriction only excludes a session whose client address or user is known and differs;
 * a session whose address or user is unknown is not excluded by it.
 *
 * @param source the client address sessions must come from, or null for any
 * @param user the user sessions must be authenticated as, or null for any
 */
public record SessionMatcher(@Nullable String source, @Nullable String user) {

    public static final SessionMatcher ANY = new SessionMatcher(null, null);

    /**
     * @param clientHost the client address of the session, if known
     * @param sessionUser the user of the session, if known
     * @return true if the filter should be active for the session
     */
    public boolean admits(@Nullable String clientHost, @Nullable String sessionUser) {
        if (source != null && clientHost != null && !Objects.equals(source, clientHost)) {
            return false;
        }
        return user == null || sessionUser == null || Objects.equals(user, sessionUser);
    }
}
