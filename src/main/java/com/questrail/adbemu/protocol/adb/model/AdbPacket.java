package com.questrail.adbemu.protocol.adb.model;

import java.util.Objects;

/**
 * AdbPacket
 * -----------------------------------------------------------------------------
 * Immutable outbound connection-layer packet: a typed command, its two
 * arguments and an optional payload.
 *
 * <p>The header's derived fields (payload length, reserved word, checksum) are
 * not stored here; they are produced mechanically by the packet encoder.</p>
 *
 * Immutability is enforced via defensive copying.
 */
public final class AdbPacket
{
    private final AdbCommand command;
    private final int arg0;
    private final int arg1;
    private final byte[] payload;

    public AdbPacket(AdbCommand command, int arg0, int arg1, byte[] payload)
    {
        this.command = Objects.requireNonNull(command, "command");
        this.arg0 = arg0;
        this.arg1 = arg1;
        this.payload = (payload == null) ? new byte[0] : payload.clone();
    }

    public static AdbPacket of(AdbCommand command, int arg0, int arg1)
    {
        return new AdbPacket(command, arg0, arg1, null);
    }

    public AdbCommand command()
    {
        return command;
    }

    public int arg0()
    {
        return arg0;
    }

    public int arg1()
    {
        return arg1;
    }

    /**
     * Returns a copy of the payload bytes (never null).
     */
    public byte[] payload()
    {
        return payload.clone();
    }

    public int payloadLength()
    {
        return payload.length;
    }

    @Override
    public String toString()
    {
        return "AdbPacket[" +
                "command=" + command +
                ", arg0=0x" + Integer.toHexString(arg0) +
                ", arg1=0x" + Integer.toHexString(arg1) +
                ", payloadLength=" + payload.length +
                ']';
    }
}
