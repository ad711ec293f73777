/*
 * Copyright Kroxylicious Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.qroxy.filter.topqueries;

import java.io.PrintWriter;
import java.io.StringWriter;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.time.format.DateTimeFormatter;
import java.util.List;
import java.util.Locale;

import edu.umd.cs.findbugs.annotations.Nullable;

/**
 * The end-of-session report of {@link TopQueries}. Durations are shown to the millisecond, truncated.
 *
 * @param size the configured size of the ranking
 * @param entries the ranked statements, longest first
 * @param sessionStart when the session was created
 * @param sessionEnd when the session was closed
 * @param clientHost the client address, if known
 * @param user the session user, if known
 * @param statements the number of statements timed
 * @param total the sum of the timed durations
 * @param zone the zone the session start is shown in
 */
public record TopQueriesReport(int size,
                               List<TopQueriesRanking.Entry> entries,
                               Instant sessionStart,
                               Instant sessionEnd,
                               @Nullable String clientHost,
                               @Nullable String user,
                               long statements,
                               Duration total,
                               ZoneId zone) {

    // the day of month is space padded, as in asctime(3)
    private static final DateTimeFormatter SESSION_START = DateTimeFormatter.ofPattern("EEE MMM ppd HH:mm:ss yyyy", Locale.ENGLISH);
    private static final String SEPARATOR = "-----+------------+-----------------------------------------------------------------";

    public TopQueriesReport {
        entries = List.copyOf(entries);
    }

    /**
     * Writes the report. Lines end in {@code \n} whatever the platform.
     * @param out destination
     */
    public void writeTo(PrintWriter out) {
        out.printf(Locale.ROOT, "Top %d longest running queries in session.\n", size);
        out.print("==========================================\n\n");
        out.print("Rank | Time (sec) | Query\n");
        out.print(SEPARATOR + "\n");
        int rank = 1;
        for (TopQueriesRanking.Entry entry : entries) {
            out.printf(Locale.ROOT, "%4d | %10.3f |  %s\n", rank++, seconds(entry.duration()), entry.sql());
        }
        out.print(SEPARATOR + "\n");
        out.printf("\n\nSession started %s\n", SESSION_START.format(sessionStart.atZone(zone)));
        if (clientHost != null) {
            out.printf("Connection from %s\n", clientHost);
        }
        if (user != null) {
            out.printf("Username        %s\n", user);
        }
        if (clientHost != null && user != null) {
            out.printf("Client          %s@%s\n", user, clientHost);
        }
        out.printf(Locale.ROOT, "\nTotal of %d statements executed.\n", statements);
        out.printf(Locale.ROOT, "Total statement execution time   %5d.%03d seconds\n", total.toSeconds(), total.toMillisPart());
        out.printf(Locale.ROOT, "Average statement execution time %9.3f seconds\n", seconds(total) / Math.max(statements, 1));
        Duration connection = Duration.between(sessionStart, sessionEnd);
        out.printf(Locale.ROOT, "Total connection time            %5d.%03d seconds\n", connection.toSeconds(), connection.toMillisPart());
        out.flush();
    }

    private static double seconds(Duration duration) {
        return duration.toMillis() / 1000.0;
    }

    /**
     * @return the text of the report
     */
    public String render() {
        StringWriter out = new StringWriter();
        writeTo(new PrintWriter(out));
        return out.toString();
    }
}
