/*
 * Copyright Kroxylicious Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.qroxy.proxy.query;

import io.netty.buffer.ByteBuf;
import io.netty.buffer.Unpooled;

/**
 * Framing of MySQL client/server protocol packets.
 * A packet is a 3 byte little-endian payload length, a 1 byte sequence id, and the payload.
 */
public final class MysqlPackets {

    public static final int HEADER_LENGTH = 4;
    public static final byte COM_QUERY = 0x03;
    private static final byte OK_HEADER = 0x00;

    private MysqlPackets() {
    }

    /**
     * @param buf a buffer positioned at the start of a packet
     * @return the payload length declared by the packet header
     * @throws IllegalArgumentException if the buffer is shorter than a packet header
     */
    public static int payloadLength(ByteBuf buf) {
        if (buf.readableBytes() < HEADER_LENGTH) {
            throw new IllegalArgumentException("Buffer of " + buf.readableBytes() + " bytes is shorter than a packet header");
        }
        return buf.getUnsignedMediumLE(buf.readerIndex());
    }

    /**
     * @param buf a buffer positioned at the start of a packet
     * @return true if the packet is a {@code COM_QUERY} command
     */
    public static boolean isComQuery(ByteBuf buf) {
        return buf.readableBytes() > HEADER_LENGTH
                && buf.getByte(buf.readerIndex() + HEADER_LENGTH) == COM_QUERY;
    }

    static ByteBuf packet(int sequenceId, byte[] payload) {
        ByteBuf buf = Unpooled.buffer(HEADER_LENGTH + payload.length);
        buf.writeMediumLE(payload.length);
        buf.writeByte(sequenceId);
        buf.writeBytes(payload);
        return buf;
    }

    static ByteBuf comQuery(byte[] statement) {
        byte[] payload = new byte[statement.length + 1];
        payload[0] = COM_QUERY;
        System.arraycopy(statement, 0, payload, 1, statement.length);
        return packet(0, payload);
    }

    static ByteBuf ok(int sequenceId) {
        // header, affected rows, last insert id, status flags (autocommit), warnings
        return packet(sequenceId, new byte[]{ OK_HEADER, 0, 0, 0x02, 0, 0, 0 });
    }
}
