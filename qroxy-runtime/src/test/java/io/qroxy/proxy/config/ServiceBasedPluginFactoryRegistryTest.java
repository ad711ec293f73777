/*
 * Copyright Kroxylicious Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.qroxy.proxy.config;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import io.qroxy.proxy.classifier.KeywordQueryClassifier;
import io.qroxy.proxy.classifier.NoopQueryClassifier;
import io.qroxy.proxy.classifier.QueryClassifier;
import io.qroxy.proxy.filter.FilterFactory;
import io.qroxy.proxy.internal.filter.ExampleConfig;
import io.qroxy.proxy.internal.filter.TestFilterFactory;
import io.qroxy.proxy.internal.filter.UnannotatedClassifier;
import io.qroxy.proxy.plugin.UnknownPluginInstanceException;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ServiceBasedPluginFactoryRegistryTest {

    private final ServiceBasedPluginFactoryRegistry registry = new ServiceBasedPluginFactoryRegistry();

    @ParameterizedTest
    @ValueSource(strings = { "NoopQueryClassifier", "io.qroxy.proxy.classifier.NoopQueryClassifier" })
    void shouldResolveBySimpleAndQualifiedName(String name) {
        QueryClassifier classifier = registry.pluginFactory(QueryClassifier.class).pluginInstance(name);
        assertThat(classifier).isInstanceOf(NoopQueryClassifier.class);
    }

    @Test
    void shouldReportConfigType() {
        var factory = registry.pluginFactory(FilterFactory.class);
        assertThat(factory.configType(TestFilterFactory.class.getSimpleName())).isEqualTo(ExampleConfig.class);
        assertThat(registry.pluginFactory(QueryClassifier.class).configType("KeywordQueryClassifier")).isEqualTo(Void.class);
    }

    @Test
    void shouldListRegisteredNames() {
        assertThat(registry.pluginFactory(QueryClassifier.class).names())
                .containsExactly(KeywordQueryClassifier.class.getSimpleName(),
                        NoopQueryClassifier.class.getSimpleName(),
                        KeywordQueryClassifier.class.getName(),
                        NoopQueryClassifier.class.getName());
    }

    @Test
    void shouldIgnoreProviderWithoutPluginAnnotation() {
        var factory = registry.pluginFactory(QueryClassifier.class);
        assertThat(factory.names()).doesNotContain(UnannotatedClassifier.class.getSimpleName(), UnannotatedClassifier.class.getName());
    }

    @Test
    void shouldDiscoverOncePerInterface() {
        assertThat(registry.pluginFactory(QueryClassifier.class)).isSameAs(registry.pluginFactory(QueryClassifier.class));
    }

    @Test
    void shouldListRegisteredFilterNames() {
        assertThat(registry.pluginFactory(FilterFactory.class).names())
                .contains(TestFilterFactory.class.getSimpleName(),
                        TestFilterFactory.class.getName());
    }

    @Test
    void shouldCreateNewInstanceEachTime() {
        var factory = registry.pluginFactory(FilterFactory.class);
        assertThat(factory.pluginInstance("TestFilterFactory")).isNotSameAs(factory.pluginInstance("TestFilterFactory"));
    }

    @Test
    void shouldRejectUnknownInstance() {
        var factory = registry.pluginFactory(QueryClassifier.class);
        assertThatThrownBy(() -> factory.pluginInstance("NoSuchClassifier"))
                .isInstanceOf(UnknownPluginInstanceException.class)
                .hasMessageStartingWith("Unknown io.qroxy.proxy.classifier.QueryClassifier plugin instance for name 'NoSuchClassifier'. ")
                .hasMessageContaining("KeywordQueryClassifier");
        assertThatThrownBy(() -> factory.configType("NoSuchClassifier"))
                .isInstanceOf(UnknownPluginInstanceException.class);
    }

    @Test
    void shouldRejectEmptyName() {
        var factory = registry.pluginFactory(QueryClassifier.class);
        assertThatThrownBy(() -> factory.pluginInstance(""))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
