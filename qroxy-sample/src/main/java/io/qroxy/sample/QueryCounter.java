/*
 * Copyright Kroxylicious Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.qroxy.sample;

import java.io.PrintWriter;
import java.util.concurrent.atomic.AtomicLong;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Metrics;

import io.qroxy.proxy.filter.FilterCreationContext;
import io.qroxy.proxy.filter.FilterFactory;
import io.qroxy.proxy.filter.FilterFactoryContext;
import io.qroxy.proxy.plugin.Plugin;
import io.qroxy.sample.config.QueryCounterConfig;
import io.qroxy.sql.match.MatchOptions;
import io.qroxy.sql.match.StatementMatcher;

import edu.umd.cs.findbugs.annotations.Nullable;

/**
 * A sample {@link FilterFactory}, intended to demonstrate how custom filters work with qroxy.<br />
 * <br />
 * The filters it creates count the SQL statements each session sends, and leave every query untouched.
 * The counts are shown in the proxy's diagnostics and recorded through Micrometer.
 */
@Plugin(configType = QueryCounterConfig.class)
public class QueryCounter implements FilterFactory<QueryCounterConfig, QueryCounter.Totals> {

    private static final Logger LOGGER = LoggerFactory.getLogger(QueryCounter.class);

    /**
     * The state shared by the sessions of a filter definition.
     */
    public static final class Totals {
        private final StatementMatcher matcher;
        private final Counter counter;
        private final AtomicLong statements = new AtomicLong();

        Totals(StatementMatcher matcher, Counter counter) {
            this.matcher = matcher;
            this.counter = counter;
        }

        StatementMatcher matcher() {
            return matcher;
        }

        void count() {
            statements.incrementAndGet();
            counter.increment();
        }

        public long statements() {
            return statements.get();
        }
    }

    @Override
    public Totals initialize(FilterFactoryContext context, @Nullable QueryCounterConfig config) {
        QueryCounterConfig configuration = config == null ? QueryCounterConfig.COUNT_ALL : config;
        MatchOptions options = MatchOptions.parse(configuration.options(), option -> LOGGER.atError()
                .setMessage("Unsupported option '{}' for filter '{}', ignoring it")
                .addArgument(option)
                .addArgument(context.filterName())
                .log());
        Counter counter = Counter
                .builder("qroxy_sample_query_counter_statements")
                .description("Statements counted by the QueryCounter sample filter.")
                .tag("service", context.serviceName())
                .tag("filter", context.filterName())
                .register(Metrics.globalRegistry);
        return new Totals(StatementMatcher.compile(configuration.match(), null, options), counter);
    }

    @Override
    public QueryCounterFilter createFilter(FilterCreationContext context, Totals totals) {
        return new QueryCounterFilter(totals);
    }

    @Override
    public void diagnostics(Totals totals, PrintWriter out) {
        totals.matcher().matchPattern().ifPresent(match -> out.printf("  Counting statements that match: %s%n", match));
        out.printf("  Statements counted: %d%n", totals.statements());
    }
}
