/*
 * Copyright Kroxylicious Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.qroxy.proxy.classifier;

/**
 * The result of classifying a query.
 *
 * @param operations bitmask of {@link QueryOperation} bits; zero when the classifier could not tell
 * @param realQuery true if the statement reads or writes table data
 */
public record Classification(int operations, boolean realQuery) {

    /** The classification of a query the classifier cannot interpret. */
    public static final Classification UNDEFINED = new Classification(0, false);

    public static Classification of(QueryOperation... operations) {
        return new Classification(QueryOperation.mask(operations), true);
    }

    public boolean isUndefined() {
        return operations == 0;
    }

    public boolean contains(QueryOperation operation) {
        return (operations & operation.bit()) != 0;
    }

    /**
     * A classification is a pure read only when it is defined and has no bit other than {@link QueryOperation#SELECT}.
     * Anything else, including an undefined classification, may modify data.
     * @return true if the query only reads
     */
    public boolean isPureRead() {
        return operations != 0 && (operations & ~QueryOperation.SELECT.bit()) == 0;
    }
}
