/*
 * Copyright Kroxylicious Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.qroxy.proxy.internal.filter;

import io.qroxy.proxy.classifier.Classification;
import io.qroxy.proxy.classifier.QueryClassifier;
import io.qroxy.proxy.query.Query;

/**
 * A service provider without a {@code @Plugin} annotation.
 */
public class UnannotatedClassifier implements QueryClassifier {

    @Override
    public Classification classify(Query query) {
        return Classification.UNDEFINED;
    }
}
