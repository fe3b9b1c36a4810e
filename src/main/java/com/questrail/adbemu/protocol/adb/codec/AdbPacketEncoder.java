package com.questrail.adbemu.protocol.adb.codec;

import com.questrail.adbemu.protocol.adb.model.AdbPacket;

/**
 * AdbPacketEncoder
 * -----------------------------------------------------------------------------
 * Byte-level encoder for connection-layer packets.
 *
 * <p>This interface defines the outbound boundary between a structured
 * {@link AdbPacket} and the raw bytes written to a connection. It does NOT
 * decide what to send. It only applies the mechanical header rules:</p>
 * <ul>
 *   <li>six little-endian 32-bit words</li>
 *   <li>data length equal to the payload length</li>
 *   <li>reserved word zero, checksum {@code command ^ 0xFFFFFFFF}</li>
 * </ul>
 */
public interface AdbPacketEncoder
{
    /**
     * Encode a packet into its header followed by its payload.
     *
     * <p>The returned array is ready to be written to a stream transport
     * without further modification.</p>
     */
    byte[] encode(AdbPacket packet);
}
