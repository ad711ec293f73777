/*
 * Copyright Kroxylicious Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.qroxy.proxy.classifier;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import io.netty.buffer.Unpooled;

import io.qroxy.proxy.query.Query;

import static org.assertj.core.api.Assertions.assertThat;

class KeywordQueryClassifierTest {

    private final KeywordQueryClassifier classifier = new KeywordQueryClassifier();

    @ParameterizedTest
    @CsvSource(delimiter = '|', value = {
            "select * from t                     | SELECT",
            "  SELECT 1                          | SELECT",
            "(select 1) union (select 2)         | SELECT",
            "show tables                         | SELECT",
            "explain select 1                    | SELECT",
            "/* hint */ select 1                 | SELECT",
            "update t set a = 1                  | UPDATE",
            "insert into t values (1)            | INSERT",
            "replace into t values (1)           | INSERT",
            "delete from t                       | DELETE",
            "truncate table t                    | TRUNCATE",
            "alter table t add column c int      | ALTER",
            "create table t (a int)              | CREATE",
            "drop table t                        | DROP",
            "use test                            | CHANGE_DB",
            "load data infile \"x\" into table t | LOAD",
            "grant select on t to u              | GRANT",
            "revoke select on t from u           | REVOKE"
    })
    void shouldClassifyByLeadingKeyword(String sql, QueryOperation expected) {
        assertThat(classifier.classify(Query.ofSql(sql))).isEqualTo(Classification.of(expected));
    }

    @Test
    void shouldSkipLineComments() {
        assertThat(classifier.classify(Query.ofSql("-- comment\n# another\nupdate t set a = 1")))
                .isEqualTo(Classification.of(QueryOperation.UPDATE));
    }

    @ParameterizedTest
    @CsvSource(delimiter = '|', value = {
            "select * from t for update",
            "select * from t lock in share mode",
            "select a into @x from t"
    })
    void lockingOrWritingSelectIsNotAPureRead(String sql) {
        Classification classification = classifier.classify(Query.ofSql(sql));

        assertThat(classification.contains(QueryOperation.SELECT)).isTrue();
        assertThat(classification.contains(QueryOperation.UPDATE)).isTrue();
        assertThat(classification.isPureRead()).isFalse();
    }

    @ParameterizedTest
    @CsvSource(delimiter = '|', value = {
            "set autocommit = 0",
            "begin",
            "''",
            "42"
    })
    void unrecognisedStatementsAreUndefined(String sql) {
        assertThat(classifier.classify(Query.ofSql(sql)).isUndefined()).isTrue();
    }

    @Test
    void nonSqlPacketIsUndefined() {
        Query ping = new Query(Unpooled.wrappedBuffer(new byte[]{ 1, 0, 0, 0, 0x0e }));
        assertThat(classifier.classify(ping)).isEqualTo(Classification.UNDEFINED);
    }

    @Test
    void noopClassifierAlwaysAnswersUndefined() {
        assertThat(new NoopQueryClassifier().classify(Query.ofSql("select 1"))).isEqualTo(Classification.UNDEFINED);
    }
}
