/*
 * Copyright Kroxylicious Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.qroxy.sample;

import org.junit.jupiter.api.Test;

import io.qroxy.proxy.config.ConfigParser;
import io.qroxy.proxy.config.Configuration;
import io.qroxy.proxy.filter.FilterFactory;
import io.qroxy.sample.config.QueryCounterConfig;

import static org.assertj.core.api.Assertions.assertThat;

class QueryCounterTest {

    @Test
    void shouldBeConfigurableFromYaml() {
        ConfigParser parser = new ConfigParser();
        Configuration configuration = parser.parseConfiguration("""
                filterDefinitions:
                  - name: counter
                    type: QueryCounter
                    config:
                      match: select
                      colour: blue
                services:
                  - name: counted
                    filters: [counter]
                """);

        assertThat(configuration.filterDefinitions().get(0).config()).isEqualTo(new QueryCounterConfig("select", null));
        assertThat(parser.pluginFactory(FilterFactory.class).pluginInstance("io.qroxy.sample.QueryCounter")).isInstanceOf(QueryCounter.class);
    }
}
