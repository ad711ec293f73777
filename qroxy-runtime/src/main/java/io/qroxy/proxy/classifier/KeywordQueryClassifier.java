/*
 * Copyright Kroxylicious Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.qroxy.proxy.classifier;

import java.util.Locale;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import io.qroxy.proxy.plugin.Plugin;
import io.qroxy.proxy.query.Query;

/**
 * <p>A classifier that looks only at the leading keyword of a statement, after any comments.</p>
 *
 * <p>{@code SELECT} statements that lock rows ({@code FOR UPDATE}, {@code LOCK IN SHARE MODE}) or write into a
 * table or file ({@code INTO}) are not pure reads. Statements whose leading keyword is not recognised, such as
 * {@code SET} or {@code BEGIN}, are {@link Classification#UNDEFINED}.</p>
 */
@Plugin(configType = Void.class)
public class KeywordQueryClassifier implements QueryClassifier {

    private static final Pattern LEADING = Pattern.compile("\\A(?:\\s+|/\\*.*?\\*/|(?:--|#)[^\\n]*\\n?)*\\(*\\s*([A-Za-z]+)", Pattern.DOTALL);
    private static final Pattern SELECT_MODIFIES = Pattern.compile("\\b(?:FOR\\s+UPDATE|LOCK\\s+IN\\s+SHARE\\s+MODE|INTO)\\b", Pattern.CASE_INSENSITIVE);

    private static final Map<String, QueryOperation> KEYWORDS = Map.ofEntries(
            Map.entry("select", QueryOperation.SELECT),
            Map.entry("show", QueryOperation.SELECT),
            Map.entry("describe", QueryOperation.SELECT),
            Map.entry("desc", QueryOperation.SELECT),
            Map.entry("explain", QueryOperation.SELECT),
            Map.entry("update", QueryOperation.UPDATE),
            Map.entry("insert", QueryOperation.INSERT),
            Map.entry("replace", QueryOperation.INSERT),
            Map.entry("delete", QueryOperation.DELETE),
            Map.entry("truncate", QueryOperation.TRUNCATE),
            Map.entry("alter", QueryOperation.ALTER),
            Map.entry("create", QueryOperation.CREATE),
            Map.entry("drop", QueryOperation.DROP),
            Map.entry("use", QueryOperation.CHANGE_DB),
            Map.entry("load", QueryOperation.LOAD),
            Map.entry("grant", QueryOperation.GRANT),
            Map.entry("revoke", QueryOperation.REVOKE));

    @Override
    public Classification classify(Query query) {
        String sql = query.sql();
        if (sql == null) {
            return Classification.UNDEFINED;
        }
        Matcher matcher = LEADING.matcher(sql);
        if (!matcher.lookingAt()) {
            return Classification.UNDEFINED;
        }
        QueryOperation operation = KEYWORDS.get(matcher.group(1).toLowerCase(Locale.ROOT));
        if (operation == null) {
            return Classification.UNDEFINED;
        }
        if (operation == QueryOperation.SELECT && SELECT_MODIFIES.matcher(sql).find()) {
            return Classification.of(QueryOperation.SELECT, QueryOperation.UPDATE);
        }
        return Classification.of(operation);
    }
}
