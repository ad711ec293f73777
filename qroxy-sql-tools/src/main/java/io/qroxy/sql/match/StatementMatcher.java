/*
 * Copyright Kroxylicious Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.qroxy.sql.match;

import java.util.Optional;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

import io.qroxy.proxy.plugin.PluginConfigurationException;

import edu.umd.cs.findbugs.annotations.Nullable;

/**
 * <p>A compiled include/exclude pair of regular expressions deciding which statements a filter acts on.</p>
 *
 * <p>A statement passes when the include pattern is absent or is found somewhere in the statement,
 * and the exclude pattern is absent or is not found anywhere in it. Patterns are searched for,
 * not matched against the whole statement.</p>
 *
 * <p>Instances are immutable and thread-safe.</p>
 */
public final class StatementMatcher {

    private static final StatementMatcher MATCH_ALL = new StatementMatcher(null, null, null, null);

    private final @Nullable String matchSource;
    private final @Nullable String excludeSource;
    private final @Nullable Pattern match;
    private final @Nullable Pattern exclude;

    private StatementMatcher(@Nullable String matchSource, @Nullable Pattern match, @Nullable String excludeSource, @Nullable Pattern exclude) {
        this.matchSource = matchSource;
        this.match = match;
        this.excludeSource = excludeSource;
        this.exclude = exclude;
    }

    /**
     * @return a matcher every statement passes
     */
    public static StatementMatcher matchAll() {
        return MATCH_ALL;
    }

    /**
     * Compiles a matcher.
     * @param match the include pattern, or null
     * @param exclude the exclude pattern, or null
     * @param options compilation options
     * @return the matcher
     * @throws PluginConfigurationException if either pattern is malformed
     */
    public static StatementMatcher compile(@Nullable String match, @Nullable String exclude, MatchOptions options) {
        if (match == null && exclude == null) {
            return MATCH_ALL;
        }
        return new StatementMatcher(match, compilePattern("match", match, options), exclude, compilePattern("exclude", exclude, options));
    }

    private static @Nullable Pattern compilePattern(String parameter, @Nullable String regex, MatchOptions options) {
        if (regex == null) {
            return null;
        }
        String translated = options.extended() ? regex : BasicRegexTranslator.toJavaRegex(regex);
        try {
            return Pattern.compile(translated, options.caseSensitive() ? 0 : Pattern.CASE_INSENSITIVE);
        }
        catch (PatternSyntaxException e) {
            throw new PluginConfigurationException("Invalid regular expression '" + regex + "' for parameter '" + parameter + "': " + e.getDescription(), e);
        }
    }

    /**
     * @param statement the statement text, or null if the text could not be determined
     * @return true if the statement passes; a null statement never passes
     */
    public boolean passes(@Nullable CharSequence statement) {
        if (statement == null) {
            return false;
        }
        return (match == null || match.matcher(statement).find())
                && (exclude == null || !exclude.matcher(statement).find());
    }

    /**
     * @return the include pattern, as configured
     */
    public Optional<String> matchPattern() {
        return Optional.ofNullable(matchSource);
    }

    /**
     * @return the exclude pattern, as configured
     */
    public Optional<String> excludePattern() {
        return Optional.ofNullable(excludeSource);
    }

    @Override
    public String toString() {
        return "StatementMatcher[match=" + matchPattern().orElse(null) + ", exclude=" + excludePattern().orElse(null) + "]";
    }
}
