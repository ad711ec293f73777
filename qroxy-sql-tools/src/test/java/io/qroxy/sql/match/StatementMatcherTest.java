/*
 * Copyright Kroxylicious Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.qroxy.sql.match;

import java.util.ArrayList;
import java.util.List;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import io.qroxy.proxy.plugin.PluginConfigurationException;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class StatementMatcherTest {

    @Test
    void matchesCaseInsensitivelyByDefault() {
        var matcher = StatementMatcher.compile("select", null, MatchOptions.DEFAULT);
        assertThat(matcher.passes("SELECT 1")).isTrue();
    }

    @Test
    void caseOptionMakesMatchingCaseSensitive() {
        var options = MatchOptions.parse(List.of("case"), unsupported -> {
        });
        var matcher = StatementMatcher.compile("select", null, options);
        assertThat(matcher.passes("SELECT 1")).isFalse();
        assertThat(matcher.passes("select 1")).isTrue();
    }

    @Test
    void laterOptionOverridesEarlier() {
        var options = MatchOptions.parse(List.of("case", "ignorecase"), unsupported -> {
        });
        assertThat(options.caseSensitive()).isFalse();
    }

    @Test
    void searchesRatherThanMatchingWholeStatement() {
        var matcher = StatementMatcher.compile("from t1", null, MatchOptions.DEFAULT);
        assertThat(matcher.passes("select a from t1 where b = 2")).isTrue();
    }

    @ParameterizedTest
    @CsvSource({
            "insert into t1 values (1), true",
            "insert into audit values (1), false",
            "update t1 set a = 1, false"
    })
    void includeAndExclude(String statement, boolean expected) {
        var matcher = StatementMatcher.compile("insert", "audit", MatchOptions.DEFAULT);
        assertThat(matcher.passes(statement)).isEqualTo(expected);
    }

    @Test
    void excludeOnlyPassesEverythingElse() {
        var matcher = StatementMatcher.compile(null, "^set ", MatchOptions.DEFAULT);
        assertThat(matcher.passes("SET autocommit=1")).isFalse();
        assertThat(matcher.passes("select 'set x'")).isTrue();
    }

    @Test
    void absentPatternsPassEverything() {
        var matcher = StatementMatcher.compile(null, null, MatchOptions.DEFAULT);
        assertThat(matcher).isSameAs(StatementMatcher.matchAll());
        assertThat(matcher.passes("anything")).isTrue();
    }

    @Test
    void nullStatementNeverPasses() {
        assertThat(StatementMatcher.matchAll().passes(null)).isFalse();
    }

    @Test
    void basicSyntaxTreatsBareParenthesesAsLiterals() {
        var matcher = StatementMatcher.compile("count(\\*)", null, MatchOptions.DEFAULT);
        assertThat(matcher.passes("select count(*) from t")).isTrue();
    }

    @Test
    void extendedSyntaxTreatsParenthesesAsGroups() {
        var matcher = StatementMatcher.compile("(insert|update) ", null, new MatchOptions(false, true));
        assertThat(matcher.passes("UPDATE t set a = 1")).isTrue();
        assertThat(matcher.passes("select 1")).isFalse();
    }

    @Test
    void malformedPatternIsAConfigurationError() {
        assertThatThrownBy(() -> StatementMatcher.compile("[abc", null, MatchOptions.DEFAULT))
                .isInstanceOf(PluginConfigurationException.class)
                .hasMessageContaining("'match'");
        assertThatThrownBy(() -> StatementMatcher.compile(null, "(x", new MatchOptions(false, true)))
                .isInstanceOf(PluginConfigurationException.class)
                .hasMessageContaining("'exclude'");
    }

    @Test
    void reportsUnsupportedOptions() {
        List<String> unsupported = new ArrayList<>();
        var options = MatchOptions.parse(List.of("extended", "newline"), unsupported::add);
        assertThat(options.extended()).isTrue();
        assertThat(unsupported).containsExactly("newline");
    }

    @Test
    void retainsConfiguredPatternsForDiagnostics() {
        var matcher = StatementMatcher.compile("a(b", "c", MatchOptions.DEFAULT);
        assertThat(matcher.matchPattern()).contains("a(b");
        assertThat(matcher.excludePattern()).contains("c");
    }
}
