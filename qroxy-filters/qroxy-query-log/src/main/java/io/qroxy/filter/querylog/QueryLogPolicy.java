/*
 * Copyright Kroxylicious Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.qroxy.filter.querylog;

import java.io.PrintWriter;
import java.nio.file.Path;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;

import io.qroxy.sql.match.SessionMatcher;
import io.qroxy.sql.match.StatementMatcher;

/**
 * The state a {@link QueryLog} definition shares between its sessions.
 */
final class QueryLogPolicy {

    private final String filebase;
    private final SessionMatcher sessionMatcher;
    private final StatementMatcher matcher;
    private final AtomicInteger sessions = new AtomicInteger();
    private final AtomicLong statements = new AtomicLong();

    QueryLogPolicy(String filebase, SessionMatcher sessionMatcher, StatementMatcher matcher) {
        this.filebase = filebase;
        this.sessionMatcher = sessionMatcher;
        this.matcher = matcher;
    }

    SessionMatcher sessionMatcher() {
        return sessionMatcher;
    }

    StatementMatcher matcher() {
        return matcher;
    }

    /**
     * Every session takes an ordinal, whether or not it is logged.
     * @return the log file of the next session
     */
    Path nextLogFile() {
        return Path.of(filebase + "." + sessions.getAndIncrement());
    }

    void recordStatement() {
        statements.incrementAndGet();
    }

    int sessions() {
        return sessions.get();
    }

    long statements() {
        return statements.get();
    }

    void diagnostics(PrintWriter out) {
        out.printf("  Logging to files with basename: %s%n", filebase);
        if (sessionMatcher.source() != null) {
            out.printf("  Limit logging to connections from: %s%n", sessionMatcher.source());
        }
        if (sessionMatcher.user() != null) {
            out.printf("  Limit logging to user: %s%n", sessionMatcher.user());
        }
        matcher.matchPattern().ifPresent(match -> out.printf("  Include queries that match: %s%n", match));
        matcher.excludePattern().ifPresent(exclude -> out.printf("  Exclude queries that match: %s%n", exclude));
        out.printf("  Sessions: %d%n", sessions());
        out.printf("  Statements logged: %d%n", statements());
    }
}
