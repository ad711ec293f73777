/*
 * Copyright Kroxylicious Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.qroxy.filter.querylog;

import java.io.BufferedWriter;
import java.io.IOException;
import java.io.PrintWriter;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import io.qroxy.proxy.filter.FilterCreationContext;
import io.qroxy.proxy.filter.FilterFactory;
import io.qroxy.proxy.filter.FilterFactoryContext;
import io.qroxy.proxy.filter.SessionCreationException;
import io.qroxy.proxy.plugin.Plugin;
import io.qroxy.proxy.plugin.PluginConfigurationException;
import io.qroxy.proxy.plugin.Plugins;
import io.qroxy.sql.match.MatchOptions;
import io.qroxy.sql.match.SessionMatcher;
import io.qroxy.sql.match.StatementMatcher;

import edu.umd.cs.findbugs.annotations.Nullable;

/**
 * Logs the statements of each session to a file of its own, named after the {@code filebase} parameter
 * and suffixed with the session's ordinal within the filter definition, starting at 0.
 */
@Plugin(configType = QueryLogConfig.class)
public class QueryLog implements FilterFactory<QueryLogConfig, QueryLogPolicy> {

    @Override
    public QueryLogPolicy initialize(FilterFactoryContext context, @Nullable QueryLogConfig config) {
        QueryLogConfig configuration = Plugins.requireConfig(this, config);
        String filebase = Plugins.requireParameter(this, "filebase", configuration.filebase());
        MatchOptions options = MatchOptions.parse(configuration.options(), option -> {
            throw new PluginConfigurationException("QueryLog does not support option '" + option + "'");
        });
        StatementMatcher matcher = StatementMatcher.compile(configuration.match(), configuration.exclude(), options);
        return new QueryLogPolicy(filebase, new SessionMatcher(configuration.source(), configuration.user()), matcher);
    }

    @Override
    public QueryLogFilter createFilter(FilterCreationContext context, QueryLogPolicy policy) {
        Path logFile = policy.nextLogFile();
        if (!policy.sessionMatcher().admits(context.clientHost(), context.user())) {
            return new QueryLogFilter(policy, context, logFile, null);
        }
        BufferedWriter writer;
        try {
            writer = Files.newBufferedWriter(logFile, StandardCharsets.UTF_8);
        }
        catch (IOException e) {
            throw new SessionCreationException("Failed to open query log '" + logFile + "' for session " + context.sessionId(), e);
        }
        return new QueryLogFilter(policy, context, logFile, writer);
    }

    @Override
    public void diagnostics(QueryLogPolicy policy, PrintWriter out) {
        policy.diagnostics(out);
    }
}
