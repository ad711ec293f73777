/*
 * Copyright Kroxylicious Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.qroxy.proxy.query;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

import io.netty.buffer.ByteBuf;
import io.netty.buffer.CompositeByteBuf;
import io.netty.buffer.Unpooled;

import edu.umd.cs.findbugs.annotations.Nullable;

/**
 * <p>A client request travelling through a filter chain toward the router.</p>
 *
 * <p>The request is a MySQL packet held in a {@link ByteBuf}. When the packet arrived in fragments the
 * buffer is a {@link CompositeByteBuf}; {@link #sql()} consolidates it into a single contiguous buffer
 * before reading the statement text.</p>
 *
 * <p>Filters may annotate a query with {@link RoutingHint}s. Hints accumulate in the order they are added.</p>
 *
 * <p>A query is confined to the worker servicing its connection and is not thread-safe.</p>
 */
public final class Query {

    private ByteBuf buffer;
    private final List<RoutingHint> hints = new ArrayList<>(2);
    private @Nullable String sql;

    public Query(ByteBuf buffer) {
        this.buffer = Objects.requireNonNull(buffer);
    }

    /**
     * Creates a {@code COM_QUERY} packet for the given statement text.
     * @param sql statement text
     * @return the query
     */
    public static Query ofSql(String sql) {
        return new Query(MysqlPackets.comQuery(sql.getBytes(StandardCharsets.UTF_8)));
    }

    /**
     * Creates a query from a packet that arrived in several fragments.
     * @param fragments the fragments, in arrival order
     * @return the query
     */
    public static Query ofFragments(ByteBuf... fragments) {
        return new Query(Unpooled.wrappedBuffer(fragments));
    }

    /**
     * @return the packet, positioned at its header
     */
    public ByteBuf buffer() {
        return buffer;
    }

    /**
     * @return true if the packet is held in a single contiguous buffer
     */
    public boolean isContiguous() {
        return !(buffer instanceof CompositeByteBuf composite) || composite.numComponents() <= 1;
    }

    /**
     * Consolidates a fragmented packet into one contiguous buffer, releasing the fragments.
     * Has no effect on a packet that is already contiguous.
     * @return this query
     */
    public Query makeContiguous() {
        if (!isContiguous()) {
            ByteBuf contiguous = buffer.alloc().heapBuffer(buffer.readableBytes());
            contiguous.writeBytes(buffer, buffer.readerIndex(), buffer.readableBytes());
            buffer.release();
            buffer = contiguous;
        }
        return this;
    }

    /**
     * @return true if the packet is a {@code COM_QUERY} carrying SQL text
     */
    public boolean isSql() {
        return MysqlPackets.isComQuery(buffer);
    }

    /**
     * Returns the statement text of a {@code COM_QUERY} packet, consolidating the packet first if necessary.
     * @return the statement text, or null if this is not a SQL packet
     */
    public @Nullable String sql() {
        if (sql == null && isSql()) {
            makeContiguous();
            int declared = MysqlPackets.payloadLength(buffer) - 1;
            int available = buffer.readableBytes() - MysqlPackets.HEADER_LENGTH - 1;
            int length = Math.max(0, Math.min(declared, available));
            sql = buffer.toString(buffer.readerIndex() + MysqlPackets.HEADER_LENGTH + 1, length, StandardCharsets.UTF_8);
        }
        return sql;
    }

    /**
     * @return the hints attached so far, in the order they were added
     */
    public List<RoutingHint> hints() {
        return Collections.unmodifiableList(hints);
    }

    /**
     * Attaches a hint to this query.
     * @param hint the hint
     * @return this query
     */
    public Query addHint(RoutingHint hint) {
        hints.add(Objects.requireNonNull(hint));
        return this;
    }

    /**
     * @param type a hint type
     * @return true if a hint of the given type has been attached
     */
    public boolean hasHint(HintType type) {
        for (RoutingHint hint : hints) {
            if (hint.type() == type) {
                return true;
            }
        }
        return false;
    }

    /**
     * Releases the packet buffer.
     */
    public void release() {
        buffer.release();
    }

    @Override
    public String toString() {
        return "Query[" + (isSql() ? "sql=" + sql() : "bytes=" + buffer.readableBytes()) + ", hints=" + hints + "]";
    }
}
