/*
 * Copyright Kroxylicious Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.qroxy.proxy.query;

import java.util.Objects;

import io.netty.buffer.ByteBuf;

/**
 * A server response travelling through a filter chain toward the client.
 * Filters treat the content as opaque.
 */
public final class Reply {

    private final ByteBuf buffer;

    public Reply(ByteBuf buffer) {
        this.buffer = Objects.requireNonNull(buffer);
    }

    /**
     * @return an {@code OK} packet, as a server sends on completing a statement
     */
    public static Reply ok() {
        return new Reply(MysqlPackets.ok(1));
    }

    public ByteBuf buffer() {
        return buffer;
    }

    public void release() {
        buffer.release();
    }

    @Override
    public String toString() {
        return "Reply[bytes=" + buffer.readableBytes() + "]";
    }
}
