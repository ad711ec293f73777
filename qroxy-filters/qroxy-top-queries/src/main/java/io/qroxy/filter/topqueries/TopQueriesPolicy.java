/*
 * Copyright Kroxylicious Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.qroxy.filter.topqueries;

import java.io.PrintWriter;
import java.nio.file.Path;
import java.time.Duration;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;

import io.qroxy.sql.match.SessionMatcher;
import io.qroxy.sql.match.StatementMatcher;

/**
 * The state a {@link TopQueries} definition shares between its sessions.
 */
final class TopQueriesPolicy {

    private final String filebase;
    private final int size;
    private final SessionMatcher sessionMatcher;
    private final StatementMatcher matcher;
    private final TopQueriesMetrics metrics;
    private final AtomicInteger sessions = new AtomicInteger();
    private final AtomicLong reports = new AtomicLong();

    TopQueriesPolicy(String filebase, int size, SessionMatcher sessionMatcher, StatementMatcher matcher, TopQueriesMetrics metrics) {
        this.filebase = filebase;
        this.size = size;
        this.sessionMatcher = sessionMatcher;
        this.matcher = matcher;
        this.metrics = metrics;
    }

    String filebase() {
        return filebase;
    }

    int size() {
        return size;
    }

    SessionMatcher sessionMatcher() {
        return sessionMatcher;
    }

    StatementMatcher matcher() {
        return matcher;
    }

    /**
     * Every session takes an ordinal, whether or not it is reported.
     * @return the report file of the next session
     */
    Path nextReportFile() {
        return Path.of(filebase + "." + sessions.getAndIncrement());
    }

    void recordStatement(Duration duration) {
        metrics.statement(duration);
    }

    void recordReport() {
        reports.incrementAndGet();
        metrics.report();
    }

    void recordReportFailure() {
        metrics.reportFailure();
    }

    int sessions() {
        return sessions.get();
    }

    long reports() {
        return reports.get();
    }

    void diagnostics(PrintWriter out) {
        out.printf("  Report size: %d%n", size);
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
        out.printf("  Reports written: %d%n", reports());
    }
}
