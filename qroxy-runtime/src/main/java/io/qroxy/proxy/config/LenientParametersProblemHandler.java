/*
 * Copyright Kroxylicious Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.qroxy.proxy.config;

import java.io.IOException;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.databind.DeserializationContext;
import com.fasterxml.jackson.databind.JsonDeserializer;
import com.fasterxml.jackson.databind.deser.DeserializationProblemHandler;

import io.qroxy.proxy.plugin.LenientParameters;

/**
 * Skips, with an error in the log, unknown parameters of config records annotated
 * {@link LenientParameters @LenientParameters}. Unknown properties of any other type are left to fail deserialization.
 */
class LenientParametersProblemHandler extends DeserializationProblemHandler {

    private static final Logger LOGGER = LoggerFactory.getLogger(LenientParametersProblemHandler.class);

    @Override
    public boolean handleUnknownProperty(DeserializationContext ctxt,
                                         JsonParser p,
                                         JsonDeserializer<?> deserializer,
                                         Object beanOrClass,
                                         String propertyName)
            throws IOException {
        Class<?> type = beanOrClass instanceof Class<?> c ? c : beanOrClass.getClass();
        if (!type.isAnnotationPresent(LenientParameters.class)) {
            return false;
        }
        LOGGER.atError()
                .setMessage("Unexpected parameter '{}' for {} at {}, ignoring it")
                .addArgument(propertyName)
                .addArgument(type::getSimpleName)
                .addArgument(() -> p.currentLocation().offsetDescription())
                .log();
        p.skipChildren();
        return true;
    }
}
