/*
 * Copyright Kroxylicious Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.qroxy.sql.match;

import java.util.Map;

/**
 * <p>Translates a POSIX basic regular expression into {@link java.util.regex.Pattern} syntax.</p>
 *
 * <p>In basic syntax {@code \( \) \{ \} \| \+ \?} are operators and the bare characters
 * {@code ( ) { } | + ?} are literals. A {@code *} at the start of the expression or of a group is a literal,
 * {@code ^} is an anchor only at the start of the expression or of a group, and {@code $} only at the end of
 * either. Inside a bracket expression a backslash is literal and {@code [:class:]} names a character class.</p>
 */
final class BasicRegexTranslator {

    private static final Map<String, String> CHARACTER_CLASSES = Map.ofEntries(
            Map.entry("alpha", "\\p{Alpha}"),
            Map.entry("digit", "\\p{Digit}"),
            Map.entry("alnum", "\\p{Alnum}"),
            Map.entry("upper", "\\p{Upper}"),
            Map.entry("lower", "\\p{Lower}"),
            Map.entry("space", "\\s"),
            Map.entry("blank", "\\p{Blank}"),
            Map.entry("punct", "\\p{Punct}"),
            Map.entry("print", "\\p{Print}"),
            Map.entry("graph", "\\p{Graph}"),
            Map.entry("cntrl", "\\p{Cntrl}"),
            Map.entry("xdigit", "\\p{XDigit}"));

    private BasicRegexTranslator() {
    }

    static String toJavaRegex(String basic) {
        StringBuilder out = new StringBuilder(basic.length() + 8);
        int i = 0;
        int n = basic.length();
        // true where a '*' would be literal and '^' an anchor
        boolean atGroupStart = true;
        while (i < n) {
            char c = basic.charAt(i);
            boolean groupStartNext = false;
            if (c == '\\' && i + 1 < n) {
                char next = basic.charAt(i + 1);
                switch (next) {
                    case '(' -> {
                        out.append('(');
                        groupStartNext = true;
                    }
                    case ')', '{', '}', '|', '+', '?' -> {
                        out.append(next);
                        groupStartNext = next == '|';
                    }
                    default -> out.append(c).append(next);
                }
                i += 2;
            }
            else if (c == '[') {
                i = bracketExpression(basic, i, out);
            }
            else {
                switch (c) {
                    case '(', ')', '{', '}', '|', '+', '?' -> out.append('\\').append(c);
                    case '*' -> out.append(atGroupStart ? "\\*" : "*");
                    case '^' -> {
                        out.append(atGroupStart ? "^" : "\\^");
                        groupStartNext = atGroupStart;
                    }
                    case '$' -> out.append(atExpressionEnd(basic, i) ? "$" : "\\$");
                    default -> out.append(c);
                }
                i++;
            }
            atGroupStart = groupStartNext;
        }
        return out.toString();
    }

    private static boolean atExpressionEnd(String basic, int i) {
        return i + 1 == basic.length() || basic.startsWith("\\)", i + 1) || basic.startsWith("\\|", i + 1);
    }

    private static int bracketExpression(String basic, int start, StringBuilder out) {
        int n = basic.length();
        int i = start + 1;
        StringBuilder body = new StringBuilder();
        if (i < n && basic.charAt(i) == '^') {
            body.append('^');
            i++;
        }
        boolean first = true;
        while (i < n) {
            char c = basic.charAt(i);
            if (c == ']' && !first) {
                out.append('[').append(body).append(']');
                return i + 1;
            }
            if (c == '[' && i + 1 < n && basic.charAt(i + 1) == ':') {
                int end = basic.indexOf(":]", i + 2);
                String replacement = end < 0 ? null : CHARACTER_CLASSES.get(basic.substring(i + 2, end));
                if (replacement != null) {
                    body.append(replacement);
                    i = end + 2;
                    first = false;
                    continue;
                }
            }
            if (c == '\\' || c == '[' || c == '&' || c == ']' || (c == '^' && !first)) {
                body.append('\\');
            }
            body.append(c);
            first = false;
            i++;
        }
        // unterminated: leave it for the pattern compiler to reject
        out.append('[').append(body);
        return n;
    }
}
