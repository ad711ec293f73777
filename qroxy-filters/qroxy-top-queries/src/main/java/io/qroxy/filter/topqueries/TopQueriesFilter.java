/*
 * Copyright Kroxylicious Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.qroxy.filter.topqueries;

import java.io.IOException;
import java.io.PrintWriter;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.List;
import java.util.Locale;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import io.qroxy.proxy.filter.AbstractBidirectionalFilter;
import io.qroxy.proxy.filter.FilterCreationContext;
import io.qroxy.proxy.query.Query;
import io.qroxy.proxy.query.Reply;

import edu.umd.cs.findbugs.annotations.Nullable;

/**
 * The per-session side of {@link TopQueries}. Only one statement is timed at a time: a statement sent
 * before the reply to the previous one replaces it.
 * The worker publishes an immutable {@link Timings} snapshot after each timed statement, which is all
 * that {@link #diagnostics(PrintWriter)} reads when called from another thread.
 */
class TopQueriesFilter extends AbstractBidirectionalFilter {

    private static final Logger LOGGER = LoggerFactory.getLogger(TopQueriesFilter.class);

    /**
     * What the session has timed so far.
     * @param statements the number of statements timed
     * @param ranking the longest of them, longest first
     */
    record Timings(long statements, List<TopQueriesRanking.Entry> ranking) {
        static final Timings NONE = new Timings(0, List.of());
    }

    private final TopQueriesPolicy policy;
    private final Clock clock;
    private final long sessionId;
    private final @Nullable String clientHost;
    private final @Nullable String user;
    private final boolean active;
    private final Path reportFile;
    private final Instant connectedAt;
    private final TopQueriesRanking ranking;
    private @Nullable String pendingSql;
    private @Nullable Instant pendingSince;
    private long statements;
    private Duration total = Duration.ZERO;
    private boolean reported;
    private volatile Timings timings = Timings.NONE;

    TopQueriesFilter(TopQueriesPolicy policy, FilterCreationContext context) {
        this.policy = policy;
        this.clock = context.clock();
        this.sessionId = context.sessionId();
        this.clientHost = context.clientHost();
        this.user = context.user();
        this.active = policy.sessionMatcher().admits(clientHost, user);
        this.reportFile = policy.nextReportFile();
        this.connectedAt = clock.instant();
        this.ranking = new TopQueriesRanking(policy.size());
    }

    @Override
    public boolean onQuery(Query query) {
        if (active && query.isSql()) {
            String sql = query.sql();
            if (sql != null && policy.matcher().passes(sql)) {
                pendingSql = sql;
                pendingSince = clock.instant();
            }
        }
        return downstream().routeQuery(query);
    }

    @Override
    public boolean onReply(Reply reply) {
        if (pendingSql != null && pendingSince != null) {
            Duration duration = Duration.between(pendingSince, clock.instant()).truncatedTo(ChronoUnit.MICROS);
            statements++;
            total = total.plus(duration);
            ranking.offer(duration, pendingSql);
            policy.recordStatement(duration);
            timings = new Timings(statements, List.copyOf(ranking.entries()));
            pendingSql = null;
            pendingSince = null;
        }
        return upstream().clientReply(reply);
    }

    boolean isActive() {
        return active;
    }

    Path reportFile() {
        return reportFile;
    }

    TopQueriesRanking ranking() {
        return ranking;
    }

    Timings timings() {
        return timings;
    }

    TopQueriesReport report() {
        return new TopQueriesReport(policy.size(), ranking.entries(), connectedAt, clock.instant(), clientHost, user, statements, total,
                clock.getZone());
    }

    @Override
    public void close() {
        if (!active || reported) {
            return;
        }
        reported = true;
        try (Writer writer = Files.newBufferedWriter(reportFile, StandardCharsets.UTF_8)) {
            PrintWriter out = new PrintWriter(writer);
            report().writeTo(out);
            if (out.checkError()) {
                throw new IOException("report output failed");
            }
            policy.recordReport();
        }
        catch (IOException e) {
            policy.recordReportFailure();
            LOGGER.atError()
                    .setMessage("Failed to write the top queries report of session {} to '{}': {}")
                    .addArgument(sessionId)
                    .addArgument(reportFile)
                    .addArgument(e.getMessage())
                    .setCause(LOGGER.isDebugEnabled() ? e : null)
                    .log();
        }
    }

    @Override
    public void release() {
        ranking.clear();
        pendingSql = null;
        pendingSince = null;
        timings = new Timings(statements, List.of());
    }

    @Override
    public void diagnostics(PrintWriter out) {
        if (!active) {
            out.printf("      Not reporting this session%n");
            return;
        }
        Timings snapshot = timings;
        out.printf("      Report file: %s%n", reportFile);
        out.printf("      Statements timed: %d%n", snapshot.statements());
        int rank = 1;
        for (TopQueriesRanking.Entry entry : snapshot.ranking()) {
            out.printf(Locale.ROOT, "      %4d | %10.3f |  %s%n", rank++, entry.duration().toMillis() / 1000.0, entry.sql());
        }
    }
}
