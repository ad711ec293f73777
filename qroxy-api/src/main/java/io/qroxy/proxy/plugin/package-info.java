/*
 * Copyright Kroxylicious Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

/**
 * API for defining plugins within configuration.
 *
 * <p>A <em>plugin interface</em> is a Java {@code interface} that can be used in the implementation of
 * a component of the proxy. {@link io.qroxy.proxy.filter.FilterFactory} and
 * {@link io.qroxy.proxy.classifier.QueryClassifier} are the plugin interfaces of qroxy.</p>
 *
 * <p>A <em>plugin implementation</em> provides a concrete behaviour by implementing the plugin interface.
 * Implementations are discovered with {@link java.util.ServiceLoader} and must carry the
 * {@link io.qroxy.proxy.plugin.Plugin @Plugin} annotation naming their config record.
 * They can be referenced in a configuration file by their fully qualified class name, or by their
 * unqualified class name if that is unambiguous.</p>
 *
 * <p>A config record is bound from the configuration file by the runtime. Unknown parameters are
 * rejected unless the record is annotated {@link io.qroxy.proxy.plugin.LenientParameters @LenientParameters}.</p>
 */
package io.qroxy.proxy.plugin;
