/*
 * Copyright Kroxylicious Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.qroxy.proxy.config;

import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.function.Function;
import java.util.stream.Collectors;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import io.qroxy.proxy.classifier.NoopQueryClassifier;
import io.qroxy.proxy.classifier.QueryClassifier;
import io.qroxy.proxy.plugin.PluginImplName;

import edu.umd.cs.findbugs.annotations.Nullable;

/**
 * The root of the proxy configuration.
 *
 * @param queryClassifier The name of the {@link QueryClassifier} implementation, {@link NoopQueryClassifier} if absent.
 * @param onSessionFailure What to do when a filter cannot be created for a session, {@link OnSessionFailure#REJECT} if absent.
 * @param filterDefinitions A list of named filter definitions (names must be unique)
 * @param services The proxied services (names must be unique)
 * @param adminConsole The admin console, absent if it is disabled
 */
@JsonPropertyOrder({ "queryClassifier", "onSessionFailure", "filterDefinitions", "services", "adminConsole" })
public record Configuration(
                            @PluginImplName(QueryClassifier.class) @Nullable String queryClassifier,
                            @Nullable OnSessionFailure onSessionFailure,
                            @Nullable List<NamedFilterDefinition> filterDefinitions,
                            @JsonProperty(required = true) List<ServiceDefinition> services,
                            @Nullable AdminConsoleDefinition adminConsole) {

    public Configuration {
        if (services == null || services.isEmpty()) {
            throw new IllegalConfigurationException("At least one service must be defined.");
        }
        var duplicatedServices = duplicates(services.stream().map(ServiceDefinition::name).toList());
        if (!duplicatedServices.isEmpty()) {
            throw new IllegalConfigurationException("'services' contains multiple items with the same names: " + duplicatedServices);
        }

        // Enforce post condition: filterDefinitions have a unique name
        var definitions = Optional.ofNullable(filterDefinitions).orElse(List.of());
        var duplicatedFilters = duplicates(definitions.stream().map(NamedFilterDefinition::name).toList());
        if (!duplicatedFilters.isEmpty()) {
            throw new IllegalConfigurationException("'filterDefinitions' contains multiple items with the same names: " + duplicatedFilters);
        }

        // Enforce post condition: Every filter referenced by a name is defined in the filterDefinitions
        Set<String> defined = definitions.stream().map(NamedFilterDefinition::name).collect(Collectors.toSet());
        Set<String> unused = new HashSet<>(defined);
        for (var service : services) {
            var unknown = service.filters().stream().filter(name -> !defined.contains(name)).toList();
            if (!unknown.isEmpty()) {
                throw new IllegalConfigurationException("'services." + service.name() + ".filters' references filters not defined in 'filterDefinitions': " + unknown);
            }
            service.filters().forEach(unused::remove);
        }
        if (!unused.isEmpty()) {
            throw new IllegalConfigurationException("'filterDefinitions' defines filters which are not used by any service: " + unused.stream().sorted().toList());
        }
    }

    private static List<String> duplicates(List<String> names) {
        return names.stream()
                .filter(name -> Collections.frequency(names, name) > 1)
                .distinct()
                .toList();
    }

    public String queryClassifierName() {
        return queryClassifier == null ? NoopQueryClassifier.class.getSimpleName() : queryClassifier;
    }

    public OnSessionFailure sessionFailurePolicy() {
        return onSessionFailure == null ? OnSessionFailure.REJECT : onSessionFailure;
    }

    /**
     * @param service a service of this configuration
     * @return the definitions of the service's filters, in chain order
     */
    public List<NamedFilterDefinition> filterDefinitionsFor(ServiceDefinition service) {
        Map<String, NamedFilterDefinition> byName = Optional.ofNullable(filterDefinitions).orElse(List.of()).stream()
                .collect(Collectors.toMap(NamedFilterDefinition::name, Function.identity()));
        return service.filters().stream().map(byName::get).toList();
    }
}
