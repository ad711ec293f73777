/*
 * Copyright Kroxylicious Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.qroxy.sql.match;

import java.util.List;
import java.util.Locale;
import java.util.function.Consumer;

import edu.umd.cs.findbugs.annotations.Nullable;

/**
 * Pattern compilation flags, parsed from the {@code options} parameter of a filter.
 * <ul>
 *     <li>{@code case}: match case-sensitively</li>
 *     <li>{@code ignorecase}: match case-insensitively (the default)</li>
 *     <li>{@code extended}: patterns use extended syntax rather than POSIX basic syntax</li>
 * </ul>
 * Options are applied in the order given, so a later option overrides an earlier contradictory one.
 *
 * @param caseSensitive true if patterns are case-sensitive
 * @param extended true if patterns use extended syntax
 */
public record MatchOptions(boolean caseSensitive, boolean extended) {

    public static final MatchOptions DEFAULT = new MatchOptions(false, false);

    /**
     * @param options option names, possibly null
     * @param onUnsupported called with each option name that is not recognised
     * @return the parsed options
     */
    public static MatchOptions parse(@Nullable List<String> options, Consumer<String> onUnsupported) {
        if (options == null) {
            return DEFAULT;
        }
        boolean caseSensitive = false;
        boolean extended = false;
        for (String option : options) {
            switch (option.trim().toLowerCase(Locale.ROOT)) {
                case "case" -> caseSensitive = true;
                case "ignorecase" -> caseSensitive = false;
                case "extended" -> extended = true;
                default -> onUnsupported.accept(option);
            }
        }
        return new MatchOptions(caseSensitive, extended);
    }
}
