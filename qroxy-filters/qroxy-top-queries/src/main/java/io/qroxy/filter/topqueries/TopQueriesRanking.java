/*
 * Copyright Kroxylicious Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.qroxy.filter.topqueries;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;

/**
 * The longest statements of a session, longest first. Holds at most {@code capacity} entries.
 * Not thread-safe.
 */
public class TopQueriesRanking {

    private static final Comparator<Entry> LONGEST_FIRST = Comparator.comparing(Entry::duration).reversed();

    /**
     * A ranked statement.
     * @param duration time between the statement and its reply
     * @param sql the statement text
     */
    public record Entry(Duration duration, String sql) {
        public Entry {
            Objects.requireNonNull(duration);
            Objects.requireNonNull(sql);
        }
    }

    private final int capacity;
    private final List<Entry> entries;

    public TopQueriesRanking(int capacity) {
        if (capacity < 1) {
            throw new IllegalArgumentException("capacity must be at least 1, but was " + capacity);
        }
        this.capacity = capacity;
        this.entries = new ArrayList<>(capacity);
    }

    /**
     * Ranks a statement if it is longer than the shortest ranked one, or if the ranking is not full.
     * A statement as long as the shortest ranked one is not ranked.
     *
     * @param duration the statement's duration
     * @param sql the statement text
     * @return true if the statement was ranked
     */
    public boolean offer(Duration duration, String sql) {
        Entry entry = new Entry(duration, sql);
        if (entries.size() < capacity) {
            entries.add(entry);
        }
        else if (duration.compareTo(entries.get(entries.size() - 1).duration()) > 0) {
            entries.set(entries.size() - 1, entry);
        }
        else {
            return false;
        }
        // stable, so equal durations keep their arrival order
        entries.sort(LONGEST_FIRST);
        return true;
    }

    public int capacity() {
        return capacity;
    }

    /**
     * @return the ranked statements, longest first
     */
    public List<Entry> entries() {
        return Collections.unmodifiableList(entries);
    }

    public void clear() {
        entries.clear();
    }
}
