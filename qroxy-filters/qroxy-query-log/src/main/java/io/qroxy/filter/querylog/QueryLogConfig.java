/*
 * Copyright Kroxylicious Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.qroxy.filter.querylog;

import java.util.List;

import com.fasterxml.jackson.annotation.JsonProperty;

import edu.umd.cs.findbugs.annotations.Nullable;

/**
 * Configuration for the {@link QueryLog} filter.
 *
 * @param filebase the base name of the log files, each session appending its ordinal
 * @param source only sessions from this client address are logged
 * @param user only sessions of this user are logged
 * @param match only statements containing a match for this pattern are logged
 * @param exclude statements containing a match for this pattern are not logged
 * @param options pattern options: {@code case}, {@code ignorecase} and {@code extended}
 */
public record QueryLogConfig(@JsonProperty(required = true) String filebase,
                             @Nullable String source,
                             @Nullable String user,
                             @Nullable String match,
                             @Nullable String exclude,
                             @Nullable List<String> options) {

    /**
     * @param filebase the base name of the log files
     * @return a configuration logging every statement of every session
     */
    public static QueryLogConfig forFilebase(String filebase) {
        return new QueryLogConfig(filebase, null, null, null, null, null);
    }
}
