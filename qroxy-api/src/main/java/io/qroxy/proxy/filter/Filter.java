/*
 * Copyright Kroxylicious Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.qroxy.proxy.filter;

import java.io.PrintWriter;

/**
 * <p>The per-session part of a filter.</p>
 *
 * <p>A filter instance is created by a {@link FilterFactory} for each client session and must also implement
 * {@link RequestFilter} and optionally {@link ReplyFilter}. A filter instance is only ever invoked by the worker
 * servicing its session, so its fields need no synchronization.</p>
 *
 * <p>When the session ends the runtime calls {@link #close()} and then {@link #release()}, on every path,
 * including when the session ends abnormally. A session rejected while its chain is being created never
 * carried traffic: its filters are only released, so {@link #release()} must also free anything acquired
 * when the filter was created.</p>
 */
public interface Filter {

    /**
     * Ends the session. Any final reporting I/O is done here.
     */
    default void close() {
    }

    /**
     * Releases the in-memory state of the session and anything still held from its creation.
     */
    default void release() {
    }

    /**
     * Writes a description of the session's state. Must not modify any state.
     * This may be called from a thread other than the session's worker, so it must only read state the
     * worker publishes safely, through volatile fields or immutable snapshots.
     * @param out destination
     */
    default void diagnostics(PrintWriter out) {
    }
}
