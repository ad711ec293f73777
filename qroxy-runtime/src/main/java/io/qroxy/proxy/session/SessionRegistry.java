/*
 * Copyright Kroxylicious Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.qroxy.proxy.session;

import java.util.Iterator;
import java.util.LinkedList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Predicate;

/**
 * <p>The live sessions of one owner, guarded by a single lock.</p>
 *
 * <p>Registration prepends in constant time and deregistration scans for the session, so
 * {@link #snapshot()} lists sessions newest first. Both hold the lock for their whole duration.
 * Callers needing to do I/O over the sessions take a {@link #snapshot()}, which is copied under the lock,
 * and work on the copy with the lock released.</p>
 *
 * <p>Sessions are compared by identity.</p>
 *
 * @param <S> the session type
 */
public final class SessionRegistry<S> {

    private final Object lock = new Object();
    private final LinkedList<S> sessions = new LinkedList<>();

    /**
     * Adds a session.
     * @param session the session
     */
    public void register(S session) {
        Objects.requireNonNull(session);
        synchronized (lock) {
            sessions.addFirst(session);
        }
    }

    /**
     * Removes a session.
     * @param session the session
     * @return true if the session was registered
     */
    public boolean deregister(S session) {
        synchronized (lock) {
            Iterator<S> iterator = sessions.iterator();
            while (iterator.hasNext()) {
                if (iterator.next() == session) {
                    iterator.remove();
                    return true;
                }
            }
            return false;
        }
    }

    /**
     * @return a copy of the registered sessions, newest first
     */
    public List<S> snapshot() {
        synchronized (lock) {
            return List.copyOf(sessions);
        }
    }

    /**
     * @param predicate a condition
     * @return the newest registered session meeting the condition
     */
    public Optional<S> find(Predicate<? super S> predicate) {
        synchronized (lock) {
            return sessions.stream().filter(predicate).findFirst();
        }
    }

    public boolean contains(S session) {
        synchronized (lock) {
            return sessions.stream().anyMatch(s -> s == session);
        }
    }

    public int size() {
        synchronized (lock) {
            return sessions.size();
        }
    }
}
