/*
 * Copyright Kroxylicious Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.qroxy.filter.consistentreads;

import io.micrometer.core.instrument.Counter;

import static io.micrometer.core.instrument.Metrics.globalRegistry;

/**
 * Meters of the {@link ConsistentReads} filter, tagged with the service and the filter definition.
 */
public class ConsistentReadsMetrics {

    public static final String SERVICE_LABEL = "service";
    public static final String FILTER_LABEL = "filter";

    // Base Metric Names
    static final String MODIFICATIONS = "qroxy_filter_consistent_reads_modifications";
    static final String COUNT_HINTS = "qroxy_filter_consistent_reads_count_hints";
    static final String TIME_HINTS = "qroxy_filter_consistent_reads_time_hints";

    private final Counter modifications;
    private final Counter countHints;
    private final Counter timeHints;

    ConsistentReadsMetrics(String serviceName, String filterName) {
        modifications = counter(MODIFICATIONS, "Incremented by each write that opens a window.", serviceName, filterName);
        countHints = counter(COUNT_HINTS, "Incremented by each read routed to the primary because of the count.", serviceName, filterName);
        timeHints = counter(TIME_HINTS, "Incremented by each read routed to the primary because of the time.", serviceName, filterName);
    }

    private static Counter counter(String meterName, String description, String serviceName, String filterName) {
        return Counter
                .builder(meterName)
                .description(description)
                .tag(SERVICE_LABEL, serviceName)
                .tag(FILTER_LABEL, filterName)
                .register(globalRegistry);
    }

    void modification() {
        modifications.increment();
    }

    void countHint() {
        countHints.increment();
    }

    void timeHint() {
        timeHints.increment();
    }
}
