/*
 * Copyright Kroxylicious Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.qroxy.sample.config;

import java.util.List;

import io.qroxy.proxy.plugin.LenientParameters;

import edu.umd.cs.findbugs.annotations.Nullable;

/**
 * The Jackson configuration object for the sample filter.<br />
 * <br />
 * Both parameters are optional: without a {@code match} pattern every statement is counted.
 * Parameters the filter does not know are logged and ignored.
 *
 * @param match only statements containing a match for this pattern are counted
 * @param options pattern options: {@code case}, {@code ignorecase} and {@code extended}
 */
@LenientParameters
public record QueryCounterConfig(@Nullable String match,
                                 @Nullable List<String> options) {

    public static final QueryCounterConfig COUNT_ALL = new QueryCounterConfig(null, null);
}
