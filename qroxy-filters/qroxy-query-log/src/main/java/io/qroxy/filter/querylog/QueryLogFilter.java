/*
 * Copyright Kroxylicious Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.qroxy.filter.querylog;

import java.io.IOException;
import java.io.PrintWriter;
import java.io.Writer;
import java.nio.file.Path;
import java.time.Clock;
import java.time.format.DateTimeFormatter;
import java.util.Objects;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import io.qroxy.proxy.filter.AbstractRequestFilter;
import io.qroxy.proxy.filter.FilterCreationContext;
import io.qroxy.proxy.query.Query;
import io.qroxy.sql.SqlText;

import edu.umd.cs.findbugs.annotations.Nullable;

/**
 * The per-session side of {@link QueryLog}. A session is only logged if it has a log file.
 */
class QueryLogFilter extends AbstractRequestFilter {

    private static final Logger LOGGER = LoggerFactory.getLogger(QueryLogFilter.class);
    private static final DateTimeFormatter TIMESTAMP = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss");

    private final QueryLogPolicy policy;
    private final Clock clock;
    private final long sessionId;
    private final String client;
    private final Path logFile;
    private volatile @Nullable Writer writer;
    private boolean writeFailed;

    QueryLogFilter(QueryLogPolicy policy, FilterCreationContext context, Path logFile, @Nullable Writer writer) {
        this.policy = policy;
        this.clock = context.clock();
        this.sessionId = context.sessionId();
        this.client = Objects.requireNonNullElse(context.user(), "") + "@" + Objects.requireNonNullElse(context.clientHost(), "");
        this.logFile = logFile;
        this.writer = writer;
    }

    @Override
    public boolean onQuery(Query query) {
        Writer out = writer;
        if (out != null && query.isSql()) {
            String sql = query.sql();
            if (sql != null && policy.matcher().passes(sql)) {
                log(out, sql);
            }
        }
        return downstream().routeQuery(query);
    }

    private void log(Writer out, String sql) {
        String line = TIMESTAMP.format(clock.instant().atZone(clock.getZone())) + "," + client + "," + SqlText.normalize(sql) + "\n";
        try {
            out.write(line);
            out.flush();
            policy.recordStatement();
        }
        catch (IOException e) {
            if (!writeFailed) {
                writeFailed = true;
                LOGGER.atWarn()
                        .setMessage("Failed to write to query log '{}' of session {}: {}")
                        .addArgument(logFile)
                        .addArgument(sessionId)
                        .addArgument(e.getMessage())
                        .setCause(LOGGER.isDebugEnabled() ? e : null)
                        .log();
            }
        }
    }

    boolean isActive() {
        return writer != null;
    }

    Path logFile() {
        return logFile;
    }

    boolean hasWriteFailed() {
        return writeFailed;
    }

    @Override
    public void close() {
        closeWriter();
    }

    @Override
    public void release() {
        closeWriter();
    }

    private void closeWriter() {
        Writer out = writer;
        if (out == null) {
            return;
        }
        try {
            out.close();
        }
        catch (IOException e) {
            LOGGER.atWarn()
                    .setMessage("Failed to close query log '{}' of session {}: {}")
                    .addArgument(logFile)
                    .addArgument(sessionId)
                    .addArgument(e.getMessage())
                    .setCause(LOGGER.isDebugEnabled() ? e : null)
                    .log();
        }
        finally {
            writer = null;
        }
    }

    @Override
    public void diagnostics(PrintWriter out) {
        if (writer == null) {
            out.printf("      Not logging this session%n");
        }
        else {
            out.printf("      Logging to file: %s%n", logFile);
        }
    }
}
