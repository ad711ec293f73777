/*
 * Copyright Kroxylicious Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.qroxy.sql;

import edu.umd.cs.findbugs.annotations.Nullable;

/**
 * Utilities for statement text.
 */
public final class SqlText {

    private SqlText() {
    }

    /**
     * Trims leading and trailing whitespace and collapses every internal run of whitespace,
     * including line breaks, to a single space.
     * @param sql statement text
     * @return the normalized text, empty for a null statement
     */
    public static String normalize(@Nullable CharSequence sql) {
        if (sql == null) {
            return "";
        }
        StringBuilder sb = new StringBuilder(sql.length());
        boolean pendingSpace = false;
        for (int i = 0; i < sql.length(); i++) {
            char c = sql.charAt(i);
            if (Character.isWhitespace(c)) {
                pendingSpace = sb.length() > 0;
            }
            else {
                if (pendingSpace) {
                    sb.append(' ');
                    pendingSpace = false;
                }
                sb.append(c);
            }
        }
        return sb.toString();
    }
}
