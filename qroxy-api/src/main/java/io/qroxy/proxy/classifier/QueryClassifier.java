/*
 * Copyright Kroxylicious Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.qroxy.proxy.classifier;

import io.qroxy.proxy.query.Query;

/**
 * <p>A pluggable capability that determines which operations a query performs.</p>
 *
 * <p>Implementations are {@linkplain java.util.ServiceLoader service} implementations annotated with
 * {@link io.qroxy.proxy.plugin.Plugin @Plugin}. A single classifier instance is shared by every session
 * of the proxy, so implementations must be thread-safe.</p>
 */
public interface QueryClassifier {

    /**
     * Classifies the given query. Implementations should answer {@link Classification#UNDEFINED} rather than
     * throw when the query cannot be interpreted.
     * @param query the query
     * @return the classification
     */
    Classification classify(Query query);
}
