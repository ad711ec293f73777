/*
 * Copyright Kroxylicious Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.qroxy.filter.topqueries;

import java.time.Duration;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Timer;

import static io.micrometer.core.instrument.Metrics.globalRegistry;

/**
 * Meters of the {@link TopQueries} filter, tagged with the service and the filter definition.
 */
public class TopQueriesMetrics {

    public static final String SERVICE_LABEL = "service";
    public static final String FILTER_LABEL = "filter";

    // Base Metric Names
    static final String STATEMENT_DURATION = "qroxy_filter_top_queries_statement_duration";
    static final String REPORTS = "qroxy_filter_top_queries_reports";
    static final String REPORT_FAILURES = "qroxy_filter_top_queries_report_failures";

    private final Timer statementDuration;
    private final Counter reports;
    private final Counter reportFailures;

    TopQueriesMetrics(String serviceName, String filterName) {
        statementDuration = Timer
                .builder(STATEMENT_DURATION)
                .description("Time between a timed statement and its reply.")
                .tag(SERVICE_LABEL, serviceName)
                .tag(FILTER_LABEL, filterName)
                .register(globalRegistry);
        reports = counter(REPORTS, "Incremented by each report written.", serviceName, filterName);
        reportFailures = counter(REPORT_FAILURES, "Incremented by each report that could not be written.", serviceName, filterName);
    }

    private static Counter counter(String meterName, String description, String serviceName, String filterName) {
        return Counter
                .builder(meterName)
                .description(description)
                .tag(SERVICE_LABEL, serviceName)
                .tag(FILTER_LABEL, filterName)
                .register(globalRegistry);
    }

    void statement(Duration duration) {
        statementDuration.record(duration);
    }

    void report() {
        reports.increment();
    }

    void reportFailure() {
        reportFailures.increment();
    }
}
