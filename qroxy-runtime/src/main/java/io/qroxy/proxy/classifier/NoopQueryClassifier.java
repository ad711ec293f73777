/*
 * Copyright Kroxylicious Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.qroxy.proxy.classifier;

import io.qroxy.proxy.plugin.Plugin;
import io.qroxy.proxy.query.Query;

/**
 * A classifier that recognises nothing: every query is {@link Classification#UNDEFINED}.
 * Filters that depend on classification therefore treat every query as a write.
 */
@Plugin(configType = Void.class)
public class NoopQueryClassifier implements QueryClassifier {

    @Override
    public Classification classify(Query query) {
        return Classification.UNDEFINED;
    }
}
