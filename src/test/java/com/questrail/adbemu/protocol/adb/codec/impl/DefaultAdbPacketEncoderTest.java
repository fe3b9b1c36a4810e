package com.questrail.adbemu.protocol.adb.codec.impl;

import com.questrail.adbemu.protocol.adb.model.AdbCommand;
import com.questrail.adbemu.protocol.adb.model.AdbPacket;

import org.junit.jupiter.api.Test;

import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.nio.charset.StandardCharsets;

import static org.junit.jupiter.api.Assertions.*;

/**
 * DefaultAdbPacketEncoderTest
 * -----------------------------------------------------------------------------
 * Wire-level checks of the 24-byte header produced for outbound packets.
 */
final class DefaultAdbPacketEncoderTest
{
    private final DefaultAdbPacketEncoder encoder = new DefaultAdbPacketEncoder();

    @Test
    void greetingLayoutIsLittleEndianWithDerivedWords()
    {
        byte[] banner = "device::".getBytes(StandardCharsets.US_ASCII);
        byte[] wire = encoder.encode(new AdbPacket(AdbCommand.CNXN, 0x01000001, 4096, banner));

        assertEquals(AdbWireFormat.HEADER_LENGTH + banner.length, wire.length);

        ByteBuffer buf = ByteBuffer.wrap(wire).order(ByteOrder.LITTLE_ENDIAN);
        assertEquals(0x4E584E43, buf.getInt());
        assertEquals(0x01000001, buf.getInt());
        assertEquals(4096, buf.getInt());
        assertEquals(banner.length, buf.getInt());
        assertEquals(0, buf.getInt());
        assertEquals(0x4E584E43 ^ 0xFFFFFFFF, buf.getInt());

        byte[] payload = new byte[banner.length];
        buf.get(payload);
        assertArrayEquals(banner, payload);
    }

    @Test
    void commandBytesAreTheAsciiTag()
    {
        byte[] wire = encoder.encode(AdbPacket.of(AdbCommand.OKAY, 1, 2));

        assertEquals("OKAY", new String(wire, 0, 4, StandardCharsets.US_ASCII));
        assertEquals(AdbWireFormat.HEADER_LENGTH, wire.length);
    }

    @Test
    void checksumIsBitwiseComplementOfCommand()
    {
        for (AdbCommand c : AdbCommand.values()) {
            assertEquals(~c.code(), AdbWireFormat.checksum(c.code()));
        }
    }
}
