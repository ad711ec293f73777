/*
 * Copyright Kroxylicious Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.qroxy.proxy.config;

import java.util.HashMap;
import java.util.Map;

import org.junit.jupiter.api.Test;

import io.qroxy.proxy.classifier.KeywordQueryClassifier;
import io.qroxy.proxy.classifier.NoopQueryClassifier;
import io.qroxy.proxy.classifier.QueryClassifier;
import io.qroxy.proxy.plugin.UnknownPluginInstanceException;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class PluginFactoryTest {

    private final PluginFactory<QueryClassifier> factory = PluginFactory.of(QueryClassifier.class, Map.of(
            "noop", new PluginFactory.Implementation<QueryClassifier>(NoopQueryClassifier.class, Void.class, NoopQueryClassifier::new),
            "keyword", new PluginFactory.Implementation<QueryClassifier>(KeywordQueryClassifier.class, String.class, KeywordQueryClassifier::new)));

    @Test
    void shouldCreateInstanceOfNamedImplementation() {
        assertThat(factory.pluginInstance("keyword")).isInstanceOf(KeywordQueryClassifier.class);
        assertThat(factory.pluginInstance("noop")).isNotSameAs(factory.pluginInstance("noop"));
    }

    @Test
    void shouldReportConfigTypeOfNamedImplementation() {
        assertThat(factory.configType("keyword")).isEqualTo(String.class);
        assertThat(factory.configType("noop")).isEqualTo(Void.class);
    }

    @Test
    void shouldListNamesInOrder() {
        assertThat(factory.names()).containsExactly("keyword", "noop");
    }

    @Test
    void shouldListKnownNamesWhenNameIsUnknown() {
        assertThatThrownBy(() -> factory.configType("regex"))
                .isInstanceOf(UnknownPluginInstanceException.class)
                .hasMessage("Unknown io.qroxy.proxy.classifier.QueryClassifier plugin instance for name 'regex'. Known names are [keyword, noop].");
    }

    @Test
    void shouldRejectEmptyName() {
        assertThatThrownBy(() -> factory.pluginInstance(""))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessage("A QueryClassifier name must not be empty");
    }

    @Test
    void shouldNotBeAffectedByChangesToSourceMap() {
        Map<String, PluginFactory.Implementation<QueryClassifier>> byName = new HashMap<>();
        byName.put("noop", new PluginFactory.Implementation<QueryClassifier>(NoopQueryClassifier.class, Void.class, NoopQueryClassifier::new));
        PluginFactory<QueryClassifier> copy = PluginFactory.of(QueryClassifier.class, byName);
        byName.clear();
        assertThat(copy.names()).containsExactly("noop");
    }
}
