/*
 * Copyright Kroxylicious Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.qroxy.proxy.classifier;

/**
 * The operations a classifier can recognise in a statement, each with its bit in a {@link Classification} bitmask.
 */
public enum QueryOperation {
    SELECT(1),
    UPDATE(1 << 1),
    INSERT(1 << 2),
    DELETE(1 << 3),
    TRUNCATE(1 << 4),
    ALTER(1 << 5),
    CREATE(1 << 6),
    DROP(1 << 7),
    CHANGE_DB(1 << 8),
    LOAD(1 << 9),
    GRANT(1 << 10),
    REVOKE(1 << 11);

    private final int bit;

    QueryOperation(int bit) {
        this.bit = bit;
    }

    public int bit() {
        return bit;
    }

    /**
     * @param operations the operations
     * @return the bitmask with the bits of all the given operations set
     */
    public static int mask(QueryOperation... operations) {
        int mask = 0;
        for (QueryOperation operation : operations) {
            mask |= operation.bit;
        }
        return mask;
    }
}
