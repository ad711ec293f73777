/*
 * Copyright Kroxylicious Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.qroxy.filter.topqueries;

import java.io.PrintWriter;

import io.qroxy.proxy.filter.FilterCreationContext;
import io.qroxy.proxy.filter.FilterFactory;
import io.qroxy.proxy.filter.FilterFactoryContext;
import io.qroxy.proxy.plugin.Plugin;
import io.qroxy.proxy.plugin.PluginConfigurationException;
import io.qroxy.proxy.plugin.Plugins;
import io.qroxy.sql.match.MatchOptions;
import io.qroxy.sql.match.SessionMatcher;
import io.qroxy.sql.match.StatementMatcher;

import edu.umd.cs.findbugs.annotations.Nullable;

/**
 * <p>Times the statements of each session, from the statement to its reply, and writes a report of the
 * longest ones when the session closes.</p>
 *
 * <p>Each session reports to its own file, named after the {@code filebase} parameter and suffixed with
 * the session's ordinal within the filter definition, starting at 0.</p>
 */
@Plugin(configType = TopQueriesConfig.class)
public class TopQueries implements FilterFactory<TopQueriesConfig, TopQueriesPolicy> {

    @Override
    public TopQueriesPolicy initialize(FilterFactoryContext context, @Nullable TopQueriesConfig config) {
        TopQueriesConfig configuration = Plugins.requireConfig(this, config);
        String filebase = Plugins.requireParameter(this, "filebase", configuration.filebase());
        int size = (int) Plugins.requireAtLeast(this, "count", configuration.countOrDefault(), 1);
        MatchOptions options = MatchOptions.parse(configuration.options(), option -> {
            throw new PluginConfigurationException("TopQueries does not support option '" + option + "'");
        });
        StatementMatcher matcher = StatementMatcher.compile(configuration.match(), configuration.exclude(), options);
        return new TopQueriesPolicy(filebase, size, new SessionMatcher(configuration.source(), configuration.user()), matcher,
                new TopQueriesMetrics(context.serviceName(), context.filterName()));
    }

    @Override
    public TopQueriesFilter createFilter(FilterCreationContext context, TopQueriesPolicy policy) {
        return new TopQueriesFilter(policy, context);
    }

    @Override
    public void diagnostics(TopQueriesPolicy policy, PrintWriter out) {
        policy.diagnostics(out);
    }
}
