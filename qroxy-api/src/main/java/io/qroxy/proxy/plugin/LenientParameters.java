/*
 * Copyright Kroxylicious Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.qroxy.proxy.plugin;

import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * <p>Marks a config record whose unknown parameters are reported but tolerated.</p>
 *
 * <p>By default the runtime rejects a plugin configuration that names a parameter its config record
 * does not declare. When the config record carries this annotation the runtime logs each unknown
 * parameter at error level and otherwise ignores it.</p>
 */
@Retention(RetentionPolicy.RUNTIME)
@Target(ElementType.TYPE)
public @interface LenientParameters {
}
