/*
 * Copyright Kroxylicious Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.qroxy.proxy.config;

import java.util.List;
import java.util.Objects;

import com.fasterxml.jackson.annotation.JsonProperty;

import edu.umd.cs.findbugs.annotations.Nullable;

/**
 * A proxied service: the chain of filters every client session of the service passes through.
 * @param name The name of the service.
 * @param filters The names of the {@link Configuration#filterDefinitions()} making up the chain, in request order.
 */
public record ServiceDefinition(@JsonProperty(required = true) String name,
                                @Nullable List<String> filters) {

    public ServiceDefinition {
        Objects.requireNonNull(name);
        filters = filters == null ? List.of() : List.copyOf(filters);
    }
}
