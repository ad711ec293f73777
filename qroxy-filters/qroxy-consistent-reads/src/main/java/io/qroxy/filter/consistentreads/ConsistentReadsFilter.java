/*
 * Copyright Kroxylicious Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.qroxy.filter.consistentreads;

import java.io.PrintWriter;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;

import io.qroxy.proxy.classifier.QueryClassifier;
import io.qroxy.proxy.filter.AbstractRequestFilter;
import io.qroxy.proxy.query.Query;
import io.qroxy.proxy.query.RoutingHint;

/**
 * The per-session side of {@link ConsistentReads}. The window is only sampled when a query arrives.
 */
class ConsistentReadsFilter extends AbstractRequestFilter {

    private final ConsistentReadsPolicy policy;
    private final QueryClassifier classifier;
    private final Clock clock;
    private volatile long hintsRemaining;
    private volatile Instant lastWriteAt = Instant.MIN;

    ConsistentReadsFilter(ConsistentReadsPolicy policy, QueryClassifier classifier, Clock clock) {
        this.policy = policy;
        this.classifier = classifier;
        this.clock = clock;
    }

    @Override
    public boolean onQuery(Query query) {
        if (query.isSql()) {
            Instant now = clock.instant();
            // an unclassifiable statement may modify data
            if (!classifier.classify(query).isPureRead()) {
                onWrite(query, now);
            }
            else if (hintsRemaining > 0) {
                query.addHint(RoutingHint.routeToPrimary());
                hintsRemaining--;
                policy.recordCountHint();
            }
            else if (Duration.between(lastWriteAt, now).compareTo(policy.time()) < 0) {
                query.addHint(RoutingHint.routeToPrimary());
                policy.recordTimeHint();
            }
        }
        return downstream().routeQuery(query);
    }

    private void onWrite(Query query, Instant now) {
        if (policy.matcher().passes(query.sql())) {
            hintsRemaining = policy.count();
            lastWriteAt = now;
            policy.recordModification();
        }
    }

    long hintsRemaining() {
        return hintsRemaining;
    }

    @Override
    public void diagnostics(PrintWriter out) {
        out.printf("      Hints remaining: %d%n", hintsRemaining);
        if (!Instant.MIN.equals(lastWriteAt)) {
            out.printf("      Last data modification: %s%n", lastWriteAt);
        }
    }
}
