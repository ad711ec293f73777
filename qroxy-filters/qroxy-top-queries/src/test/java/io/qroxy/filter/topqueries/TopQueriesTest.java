/*
 * Copyright Kroxylicious Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.qroxy.filter.topqueries;

import java.io.PrintWriter;
import java.io.StringWriter;
import java.nio.file.Path;
import java.util.List;
import java.util.concurrent.TimeUnit;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import io.micrometer.core.instrument.Metrics;
import io.micrometer.core.instrument.Timer;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;

import io.qroxy.proxy.config.ConfigParser;
import io.qroxy.proxy.config.Configuration;
import io.qroxy.proxy.filter.FilterFactory;
import io.qroxy.proxy.plugin.PluginConfigurationException;
import io.qroxy.proxy.query.Query;
import io.qroxy.proxy.query.Reply;
import io.qroxy.test.context.MockFilterContext;
import io.qroxy.test.filter.RecordingDownstream;
import io.qroxy.test.filter.RecordingUpstream;
import io.qroxy.test.time.ManualClock;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class TopQueriesTest {

    @TempDir
    Path dir;

    private final TopQueries factory = new TopQueries();
    private final ManualClock clock = new ManualClock(MockFilterContext.DEFAULT_START);
    private final MockFilterContext context = MockFilterContext.builder()
            .withFilterName("slow")
            .withServiceName("reporting")
            .withClock(clock)
            .build();
    private SimpleMeterRegistry registry;

    @BeforeEach
    void setUp() {
        registry = new SimpleMeterRegistry();
        Metrics.addRegistry(registry);
    }

    @AfterEach
    void tearDown() {
        Metrics.removeRegistry(registry);
        registry.close();
    }

    @Test
    void shouldRequireConfig() {
        assertThatThrownBy(() -> factory.initialize(context, null))
                .isInstanceOf(PluginConfigurationException.class)
                .hasMessage("TopQueries requires configuration, but config object is null");
    }

    @Test
    void shouldRequireFilebase() {
        assertThatThrownBy(() -> factory.initialize(context, TopQueriesConfig.forFilebase(" ")))
                .isInstanceOf(PluginConfigurationException.class)
                .hasMessage("TopQueries requires the 'filebase' parameter");
    }

    @ParameterizedTest
    @ValueSource(ints = { 0, -3 })
    void shouldRejectCountBelowOne(int count) {
        var config = new TopQueriesConfig("top", count, null, null, null, null, null);

        assertThatThrownBy(() -> factory.initialize(context, config))
                .isInstanceOf(PluginConfigurationException.class)
                .hasMessage("TopQueries parameter 'count' must be at least 1, but was " + count);
    }

    @Test
    void shouldRejectUnsupportedOption() {
        var config = new TopQueriesConfig("top", null, null, null, "select", null, List.of("extended", "verbose"));

        assertThatThrownBy(() -> factory.initialize(context, config))
                .isInstanceOf(PluginConfigurationException.class)
                .hasMessage("TopQueries does not support option 'verbose'");
    }

    @Test
    void shouldDefaultReportSize() {
        TopQueriesPolicy policy = factory.initialize(context, TopQueriesConfig.forFilebase("top"));

        assertThat(policy.size()).isEqualTo(TopQueriesConfig.DEFAULT_COUNT);
        assertThat(policy.matcher().matchPattern()).isEmpty();
    }

    @Test
    void shouldRecordStatementDurations() {
        TopQueriesPolicy policy = factory.initialize(context, TopQueriesConfig.forFilebase(dir.resolve("top").toString()));
        TopQueriesFilter filter = factory.createFilter(context, policy);
        filter.setDownstream(new RecordingDownstream());
        filter.setUpstream(new RecordingUpstream());

        filter.onQuery(Query.ofSql("select 1"));
        clock.advanceMillis(40);
        filter.onReply(Reply.ok());
        filter.close();

        Timer timer = registry.get(TopQueriesMetrics.STATEMENT_DURATION)
                .tag(TopQueriesMetrics.SERVICE_LABEL, "reporting")
                .tag(TopQueriesMetrics.FILTER_LABEL, "slow")
                .timer();
        assertThat(timer.count()).isEqualTo(1);
        assertThat(timer.totalTime(TimeUnit.MILLISECONDS)).isEqualTo(40.0);
        assertThat(registry.get(TopQueriesMetrics.REPORTS).counter().count()).isEqualTo(1.0);
        assertThat(policy.reports()).isEqualTo(1);
    }

    @Test
    void shouldWriteInstanceDiagnostics() {
        var config = new TopQueriesConfig("/var/log/top", 5, "10.0.0.7", "app", "select", "dual", null);
        TopQueriesPolicy policy = factory.initialize(context, config);
        StringWriter out = new StringWriter();

        factory.diagnostics(policy, new PrintWriter(out, true));

        assertThat(out.toString().lines()).containsExactly(
                "  Report size: 5",
                "  Logging to files with basename: /var/log/top",
                "  Limit logging to connections from: 10.0.0.7",
                "  Limit logging to user: app",
                "  Include queries that match: select",
                "  Exclude queries that match: dual",
                "  Sessions: 0",
                "  Reports written: 0");
    }

    @Test
    void shouldParseStrictly() {
        ConfigParser parser = new ConfigParser();
        Configuration configuration = parser.parseConfiguration("""
                filterDefinitions:
                  - name: slow
                    type: TopQueries
                    config:
                      filebase: /tmp/top
                      count: 3
                services:
                  - name: reporting
                    filters: [slow]
                """);

        assertThat(configuration.filterDefinitions().get(0).config()).isEqualTo(new TopQueriesConfig("/tmp/top", 3, null, null, null, null, null));
        assertThat(parser.pluginFactory(FilterFactory.class).pluginInstance("TopQueries")).isInstanceOf(TopQueries.class);
    }

    @Test
    void shouldRejectUnknownParameter() {
        ConfigParser parser = new ConfigParser();

        assertThatThrownBy(() -> parser.parseConfiguration("""
                filterDefinitions:
                  - name: slow
                    type: TopQueries
                    config:
                      filebase: /tmp/top
                      server: primary-1
                services:
                  - name: reporting
                    filters: [slow]
                """))
                .isInstanceOf(IllegalArgumentException.class)
                .hasStackTraceContaining("Unrecognized field \"server\"");
    }

    @Test
    void shouldRejectMissingFilebase() {
        ConfigParser parser = new ConfigParser();

        assertThatThrownBy(() -> parser.parseConfiguration("""
                filterDefinitions:
                  - name: slow
                    type: TopQueries
                    config:
                      count: 3
                services:
                  - name: reporting
                    filters: [slow]
                """))
                .isInstanceOf(IllegalArgumentException.class)
                .hasStackTraceContaining("Missing required creator property 'filebase'");
    }
}
