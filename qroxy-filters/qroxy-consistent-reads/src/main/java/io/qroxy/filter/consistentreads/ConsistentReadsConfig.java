/*
 * Copyright Kroxylicious Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.qroxy.filter.consistentreads;

import java.util.List;

import io.qroxy.proxy.plugin.LenientParameters;

import edu.umd.cs.findbugs.annotations.Nullable;

/**
 * Configuration for the {@link ConsistentReads} filter. Every parameter is optional.
 * Unknown parameters are logged and ignored.
 *
 * @param match only writes containing a match for this pattern open a window
 * @param exclude writes containing a match for this pattern never open a window
 * @param count the number of reads after a write that are routed to the primary, 0 by default
 * @param time the number of seconds after a write during which reads are routed to the primary, 60 by default
 * @param options pattern options: {@code case}, {@code ignorecase} and {@code extended}
 */
@LenientParameters
public record ConsistentReadsConfig(@Nullable String match,
                                    @Nullable String exclude,
                                    @Nullable Long count,
                                    @Nullable Long time,
                                    @Nullable List<String> options) {

    public static final long DEFAULT_COUNT = 0;
    public static final long DEFAULT_TIME_SECONDS = 60;

    static final ConsistentReadsConfig DEFAULTS = new ConsistentReadsConfig(null, null, null, null, null);

    public long countOrDefault() {
        return count == null ? DEFAULT_COUNT : count;
    }

    public long timeOrDefault() {
        return time == null ? DEFAULT_TIME_SECONDS : time;
    }
}
