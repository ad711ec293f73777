/*
 * Copyright Kroxylicious Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.qroxy.filter.consistentreads;

import java.io.PrintWriter;
import java.time.Duration;
import java.util.concurrent.atomic.AtomicLong;

import io.qroxy.sql.match.StatementMatcher;

/**
 * The state a {@link ConsistentReads} definition shares between its sessions: the validated parameters
 * and the statistics.
 */
final class ConsistentReadsPolicy {

    private final StatementMatcher matcher;
    private final long count;
    private final Duration time;
    private final ConsistentReadsMetrics metrics;
    private final AtomicLong modifications = new AtomicLong();
    private final AtomicLong countHints = new AtomicLong();
    private final AtomicLong timeHints = new AtomicLong();

    ConsistentReadsPolicy(StatementMatcher matcher, long count, Duration time, ConsistentReadsMetrics metrics) {
        this.matcher = matcher;
        this.count = count;
        this.time = time;
        this.metrics = metrics;
    }

    StatementMatcher matcher() {
        return matcher;
    }

    long count() {
        return count;
    }

    Duration time() {
        return time;
    }

    void recordModification() {
        modifications.incrementAndGet();
        metrics.modification();
    }

    void recordCountHint() {
        countHints.incrementAndGet();
        metrics.countHint();
    }

    void recordTimeHint() {
        timeHints.incrementAndGet();
        metrics.timeHint();
    }

    long modifications() {
        return modifications.get();
    }

    long countHints() {
        return countHints.get();
    }

    long timeHints() {
        return timeHints.get();
    }

    void diagnostics(PrintWriter out) {
        out.printf("  Configuration:%n");
        out.printf("    Count: %d%n", count);
        out.printf("    Time: %d seconds%n", time.toSeconds());
        matcher.matchPattern().ifPresent(match -> out.printf("    Match regex: %s%n", match));
        matcher.excludePattern().ifPresent(exclude -> out.printf("    Exclude regex: %s%n", exclude));
        out.printf("  Statistics:%n");
        out.printf("    No. of data modifications: %d%n", modifications());
        out.printf("    No. of hints added based on count: %d%n", countHints());
        out.printf("    No. of hints added based on time: %d%n", timeHints());
    }
}
