/*
 * Copyright Kroxylicious Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.qroxy.proxy.plugin;

import edu.umd.cs.findbugs.annotations.Nullable;

public class Plugins {
    private Plugins() {
    }

    /**
     * Checks that the given {@code config} is not null, throwing {@link PluginConfigurationException} if it is.
     * @param pluginImpl The plugin consuming the config
     * @param config The possibly null config
     * @return The non-null config
     * @param <C> The type of the config
     */
    public static <C> C requireConfig(Object pluginImpl, @Nullable C config) {
        if (config == null) {
            throw new PluginConfigurationException(pluginImpl.getClass().getSimpleName() + " requires configuration, but config object is null");
        }
        return config;
    }

    /**
     * Checks that a mandatory parameter was given a non-blank value.
     * @param pluginImpl The plugin consuming the config
     * @param parameterName The name of the parameter, as it appears in configuration
     * @param value The possibly null value
     * @return The non-null value
     */
    public static String requireParameter(Object pluginImpl, String parameterName, @Nullable String value) {
        if (value == null || value.isBlank()) {
            throw new PluginConfigurationException(pluginImpl.getClass().getSimpleName() + " requires the '" + parameterName + "' parameter");
        }
        return value;
    }

    /**
     * Checks that a numeric parameter is at least {@code min}.
     * @param pluginImpl The plugin consuming the config
     * @param parameterName The name of the parameter, as it appears in configuration
     * @param value The value
     * @param min The smallest permitted value
     * @return The value
     */
    public static long requireAtLeast(Object pluginImpl, String parameterName, long value, long min) {
        if (value < min) {
            throw new PluginConfigurationException(
                    pluginImpl.getClass().getSimpleName() + " parameter '" + parameterName + "' must be at least " + min + ", but was " + value);
        }
        return value;
    }
}
