package com.questrail.adbemu.protocol.adb.codec.impl;

/**
 * AdbWireFormat
 * -----------------------------------------------------------------------------
 * Layout constants of the connection-layer header.
 *
 * <pre>
 *   offset  0 : command      (u32, four ASCII characters read little-endian)
 *   offset  4 : arg0         (u32)
 *   offset  8 : arg1         (u32)
 *   offset 12 : data_length  (u32)
 *   offset 16 : reserved     (u32, 0)
 *   offset 20 : checksum     (u32, command ^ 0xFFFFFFFF)
 * </pre>
 *
 * <p>All words are little-endian.</p>
 */
public final class AdbWireFormat
{
    /** Size of the fixed header in bytes. */
    public static final int HEADER_LENGTH = 24;

    /** Protocol version advertised in the connect greeting. */
    public static final int DEFAULT_PROTOCOL_VERSION = 0x01000001;

    /** Maximum payload advertised in the connect greeting. */
    public static final int DEFAULT_MAX_PAYLOAD = 4096;

    private AdbWireFormat() {}

    /**
     * Returns the checksum word for an emulator-originated header.
     */
    public static int checksum(int command)
    {
        return command ^ 0xFFFFFFFF;
    }
}
