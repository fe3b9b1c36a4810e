package com.questrail.adbemu.protocol.adb.codec.impl;

import com.questrail.adbemu.protocol.adb.codec.AdbPacketDecoder;
import com.questrail.adbemu.protocol.adb.internal.frame.AdbHeader;

import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.util.Optional;

/**
 * DefaultAdbPacketDecoder
 * -----------------------------------------------------------------------------
 * Concrete implementation of {@link AdbPacketDecoder}.
 *
 * <p>Pure field extraction. The checksum and reserved words are carried into
 * the {@link AdbHeader} untouched and never compared against the command.</p>
 */
public final class DefaultAdbPacketDecoder implements AdbPacketDecoder
{
    @Override
    public Optional<AdbHeader> decode(byte[] header)
    {
        if (header == null || header.length != AdbWireFormat.HEADER_LENGTH) {
            // Short or oversized read: framing defect, caller drops the connection.
            return Optional.empty();
        }

        ByteBuffer buf = ByteBuffer.wrap(header).order(ByteOrder.LITTLE_ENDIAN);
        return Optional.of(new AdbHeader(
                buf.getInt(),
                buf.getInt(),
                buf.getInt(),
                buf.getInt(),
                buf.getInt(),
                buf.getInt()
        ));
    }
}
