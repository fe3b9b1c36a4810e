package com.questrail.adbemu.protocol.adb.codec;

import com.questrail.adbemu.protocol.adb.internal.frame.AdbHeader;

import java.util.Optional;

/**
 * AdbPacketDecoder
 * -----------------------------------------------------------------------------
 * Byte-level decoder for connection-layer headers.
 *
 * <p>The decoder is responsible only for extracting the six header fields. It
 * is <strong>not</strong> responsible for:</p>
 * <ul>
 *   <li>validating the checksum (inbound checksums are never checked)</li>
 *   <li>reading the payload that follows the header</li>
 *   <li>interpreting the command</li>
 * </ul>
 *
 * <p>A header that cannot be decoded is a framing defect. The caller treats it
 * exactly like a closed connection.</p>
 */
public interface AdbPacketDecoder
{
    /**
     * Attempt to decode a complete header.
     *
     * @param header exactly {@code 24} bytes read from the connection
     * @return the decoded header, or {@link Optional#empty()} if the input is
     *         not a complete header
     */
    Optional<AdbHeader> decode(byte[] header);
}
