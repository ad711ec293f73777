/*
 * Copyright Kroxylicious Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.qroxy.filter.consistentreads;

import java.io.PrintWriter;
import java.time.Duration;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import io.qroxy.proxy.filter.FilterCreationContext;
import io.qroxy.proxy.filter.FilterFactory;
import io.qroxy.proxy.filter.FilterFactoryContext;
import io.qroxy.proxy.plugin.Plugin;
import io.qroxy.proxy.plugin.Plugins;
import io.qroxy.sql.match.MatchOptions;
import io.qroxy.sql.match.StatementMatcher;

import edu.umd.cs.findbugs.annotations.Nullable;

/**
 * <p>Keeps a client's reads consistent with its own writes by routing them to the primary for a while after
 * each write.</p>
 *
 * <p>After a write whose text passes the {@code match} and {@code exclude} patterns, the next {@code count}
 * reads of the session are hinted {@link io.qroxy.proxy.query.HintType#ROUTE_TO_PRIMARY}, and so is every
 * later read arriving less than {@code time} seconds after the write.</p>
 */
@Plugin(configType = ConsistentReadsConfig.class)
public class ConsistentReads implements FilterFactory<ConsistentReadsConfig, ConsistentReadsPolicy> {

    private static final Logger LOGGER = LoggerFactory.getLogger(ConsistentReads.class);

    @Override
    public ConsistentReadsPolicy initialize(FilterFactoryContext context, @Nullable ConsistentReadsConfig config) {
        ConsistentReadsConfig configuration = config == null ? ConsistentReadsConfig.DEFAULTS : config;
        long count = Plugins.requireAtLeast(this, "count", configuration.countOrDefault(), 0);
        long time = Plugins.requireAtLeast(this, "time", configuration.timeOrDefault(), 0);
        MatchOptions options = MatchOptions.parse(configuration.options(), option -> LOGGER.atError()
                .setMessage("Unsupported option '{}' for filter '{}', ignoring it")
                .addArgument(option)
                .addArgument(context.filterName())
                .log());
        StatementMatcher matcher = StatementMatcher.compile(configuration.match(), configuration.exclude(), options);
        return new ConsistentReadsPolicy(matcher, count, Duration.ofSeconds(time), new ConsistentReadsMetrics(context.serviceName(), context.filterName()));
    }

    @Override
    public ConsistentReadsFilter createFilter(FilterCreationContext context, ConsistentReadsPolicy policy) {
        return new ConsistentReadsFilter(policy, context.queryClassifier(), context.clock());
    }

    @Override
    public void diagnostics(ConsistentReadsPolicy policy, PrintWriter out) {
        policy.diagnostics(out);
    }
}
