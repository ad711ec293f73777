/*
 * Copyright Kroxylicious Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.qroxy.proxy.config;

import java.lang.reflect.Executable;
import java.lang.reflect.Parameter;

import com.fasterxml.jackson.annotation.JsonTypeInfo;
import com.fasterxml.jackson.databind.DatabindContext;
import com.fasterxml.jackson.databind.JavaType;
import com.fasterxml.jackson.databind.cfg.MapperConfig;
import com.fasterxml.jackson.databind.introspect.AnnotatedMember;
import com.fasterxml.jackson.databind.introspect.AnnotatedParameter;
import com.fasterxml.jackson.databind.introspect.JacksonAnnotationIntrospector;
import com.fasterxml.jackson.databind.jsontype.TypeResolverBuilder;
import com.fasterxml.jackson.databind.jsontype.impl.StdTypeResolverBuilder;
import com.fasterxml.jackson.databind.jsontype.impl.TypeIdResolverBase;

import io.qroxy.proxy.plugin.PluginImplConfig;
import io.qroxy.proxy.plugin.PluginImplName;

import edu.umd.cs.findbugs.annotations.Nullable;

/**
 * Binds a creator parameter annotated {@link PluginImplConfig @PluginImplConfig} to the config type of the
 * plugin implementation named by its {@link PluginImplName @PluginImplName} sibling, which acts as an
 * external type id. Plugin configuration is only ever read.
 */
class PluginAnnotationIntrospector extends JacksonAnnotationIntrospector {

    private final transient PluginFactoryRegistry registry;

    PluginAnnotationIntrospector(PluginFactoryRegistry registry) {
        this.registry = registry;
    }

    @Override
    public @Nullable TypeResolverBuilder<?> findPropertyTypeResolver(MapperConfig<?> config, AnnotatedMember member, JavaType baseType) {
        PluginImplConfig implConfig = member.getAnnotation(PluginImplConfig.class);
        if (implConfig == null) {
            return super.findPropertyTypeResolver(config, member, baseType);
        }
        if (!(member instanceof AnnotatedParameter parameter) || !(parameter.getOwner().getAnnotated() instanceof Executable creator)) {
            throw new PluginDiscoveryException("@" + PluginImplConfig.class.getSimpleName() + " is only supported on creator parameters, but found on " + member);
        }
        String implNameProperty = implConfig.implNameProperty();
        var resolver = new ConfigTypeResolver(baseType, registry.pluginFactory(pluginInterface(creator, implNameProperty, member)));
        return new StdTypeResolverBuilder()
                .init(JsonTypeInfo.Id.CUSTOM, resolver)
                .inclusion(JsonTypeInfo.As.EXTERNAL_PROPERTY)
                .typeProperty(implNameProperty)
                .typeIdVisibility(false);
    }

    private static Class<?> pluginInterface(Executable creator, String implNameProperty, AnnotatedMember member) {
        for (Parameter sibling : creator.getParameters()) {
            PluginImplName implName = sibling.getAnnotation(PluginImplName.class);
            if (implName != null && implNameProperty.equals(sibling.getName())) {
                return implName.value();
            }
        }
        throw new PluginDiscoveryException("Couldn't find a parameter '" + implNameProperty + "' annotated @" + PluginImplName.class.getSimpleName()
                + " as referred to by @" + PluginImplConfig.class.getSimpleName() + " on " + member);
    }

    /**
     * Maps an implementation name to its config type.
     */
    private static final class ConfigTypeResolver extends TypeIdResolverBase {

        private final JavaType baseType;
        private final PluginFactory<?> plugins;

        ConfigTypeResolver(JavaType baseType, PluginFactory<?> plugins) {
            this.baseType = baseType;
            this.plugins = plugins;
        }

        @Override
        public JavaType typeFromId(DatabindContext context, String id) {
            return context.constructSpecializedType(baseType, plugins.configType(id));
        }

        @Override
        public String getDescForKnownTypeIds() {
            return String.join(", ", plugins.names());
        }

        @Override
        public JsonTypeInfo.Id getMechanism() {
            return JsonTypeInfo.Id.CUSTOM;
        }

        @Override
        public String idFromValue(Object value) {
            throw new UnsupportedOperationException("Plugin configuration is not serialized");
        }

        @Override
        public String idFromValueAndType(Object value, Class<?> suggestedType) {
            throw new UnsupportedOperationException("Plugin configuration is not serialized");
        }
    }
}
