/*
 * Copyright Kroxylicious Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.qroxy.proxy.internal.filter;

import java.util.Objects;

import io.qroxy.proxy.filter.Filter;
import io.qroxy.proxy.filter.FilterCreationContext;
import io.qroxy.proxy.filter.FilterFactory;
import io.qroxy.proxy.filter.FilterFactoryContext;
import io.qroxy.proxy.filter.SessionCreationException;
import io.qroxy.proxy.plugin.Plugin;

@Plugin(configType = FlakyConfig.class)
public class FlakyFactory implements FilterFactory<FlakyConfig, FlakyConfig> {

    @Override
    public FlakyConfig initialize(FilterFactoryContext context, FlakyConfig config) {
        Objects.requireNonNull(context);
        Objects.requireNonNull(config);
        if (config.initializeExceptionMsg() != null) {
            throw new RuntimeException(config.initializeExceptionMsg());
        }
        config.onInitialize().accept(config);
        return config;
    }

    @Override
    public Filter createFilter(FilterCreationContext context, FlakyConfig config) {
        if (config.createExceptionMsg() != null) {
            throw new SessionCreationException(config.createExceptionMsg());
        }
        return new TestFilter(context, config);
    }

    @Override
    public void close(FlakyConfig config) {
        config.onClose().accept(config);
        if (config.closeExceptionMsg() != null) {
            throw new RuntimeException(config.closeExceptionMsg());
        }
    }
}
