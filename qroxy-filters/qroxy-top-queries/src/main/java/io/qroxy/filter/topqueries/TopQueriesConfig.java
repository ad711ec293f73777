/*
 * Copyright Kroxylicious Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.qroxy.filter.topqueries;

import java.util.List;

import com.fasterxml.jackson.annotation.JsonProperty;

import edu.umd.cs.findbugs.annotations.Nullable;

/**
 * Configuration for the {@link TopQueries} filter.
 *
 * @param filebase the base name of the report files, each session appending its ordinal
 * @param count the number of statements the report ranks, 10 by default
 * @param source only sessions from this client address are reported
 * @param user only sessions of this user are reported
 * @param match only statements containing a match for this pattern are timed
 * @param exclude statements containing a match for this pattern are not timed
 * @param options pattern options: {@code case}, {@code ignorecase} and {@code extended}
 */
public record TopQueriesConfig(@JsonProperty(required = true) String filebase,
                               @Nullable Integer count,
                               @Nullable String source,
                               @Nullable String user,
                               @Nullable String match,
                               @Nullable String exclude,
                               @Nullable List<String> options) {

    public static final int DEFAULT_COUNT = 10;

    /**
     * @param filebase the base name of the report files
     * @return a configuration with every other parameter defaulted
     */
    public static TopQueriesConfig forFilebase(String filebase) {
        return new TopQueriesConfig(filebase, null, null, null, null, null, null);
    }

    public int countOrDefault() {
        return count == null ? DEFAULT_COUNT : count;
    }
}
