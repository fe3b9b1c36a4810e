package com.questrail.adbemu.protocol.adb.codec.impl;

import com.questrail.adbemu.protocol.adb.codec.AdbPacketEncoder;
import com.questrail.adbemu.protocol.adb.model.AdbPacket;

import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.util.Objects;

/**
 * DefaultAdbPacketEncoder
 * -----------------------------------------------------------------------------
 * Concrete implementation of {@link AdbPacketEncoder}.
 *
 * <p>This is the mechanical inverse of {@link DefaultAdbPacketDecoder}: the
 * caller supplies command, arguments and payload; the encoder derives the
 * length, reserved and checksum words.</p>
 */
public final class DefaultAdbPacketEncoder implements AdbPacketEncoder
{
    @Override
    public byte[] encode(AdbPacket packet)
    {
        Objects.requireNonNull(packet, "packet");

        final int command = packet.command().code();
        final byte[] payload = packet.payload();

        ByteBuffer buf = ByteBuffer.allocate(AdbWireFormat.HEADER_LENGTH + payload.length)
                .order(ByteOrder.LITTLE_ENDIAN);

        buf.putInt(command);
        buf.putInt(packet.arg0());
        buf.putInt(packet.arg1());
        buf.putInt(payload.length);
        buf.putInt(0);
        buf.putInt(AdbWireFormat.checksum(command));
        buf.put(payload);

        return buf.array();
    }
}
