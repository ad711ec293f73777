/*
 * Copyright Kroxylicious Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.qroxy.proxy.config;

import java.util.Objects;
import java.util.regex.Pattern;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

import io.qroxy.proxy.filter.FilterFactory;
import io.qroxy.proxy.plugin.PluginImplConfig;
import io.qroxy.proxy.plugin.PluginImplName;

import edu.umd.cs.findbugs.annotations.Nullable;

/**
 * A named filter definition
 * @param name The name of the filter definition, referenced from {@link ServiceDefinition#filters()}.
 * @param type The name of the {@link FilterFactory} implementation.
 * @param config The configuration of the filter, bound to the implementation's config type.
 * @see Configuration#filterDefinitions()
 */
public record NamedFilterDefinition(
                                    @JsonProperty(required = true) String name,
                                    @PluginImplName(FilterFactory.class) @JsonProperty(required = true) String type,
                                    @PluginImplConfig(implNameProperty = "type") @Nullable Object config) {

    private static final Pattern NAME_PATTERN = Pattern.compile("[a-z0-9A-Z](?:[a-z0-9A-Z_.-]{0,251}[a-z0-9A-Z])?");

    @JsonCreator
    public NamedFilterDefinition {
        Objects.requireNonNull(name);
        if (!NAME_PATTERN.matcher(name).matches()) {
            throw new IllegalArgumentException("Invalid filter name '" + name + "' (should match '" + NAME_PATTERN.pattern() + "')");
        }
        Objects.requireNonNull(type);
    }
}
