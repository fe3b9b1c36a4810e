package com.questrail.adbemu.protocol.adb.internal.frame;

import com.questrail.adbemu.protocol.adb.model.AdbCommand;
import com.questrail.adbemu.protocol.adb.model.WireTags;

import java.util.Optional;

/**
 * AdbHeader
 * -----------------------------------------------------------------------------
 * Decoded representation of the fixed 24-byte connection-layer header.
 *
 * <h2>What this represents</h2>
 * The six little-endian words of a header, extracted but not validated. The
 * emulator never checks inbound checksums, so a header is accepted as-is and
 * only its {@link #dataLength()} drives further reads.
 *
 * <h2>Unsigned fields</h2>
 * All fields are u32 on the wire and stored as Java {@code int}. Use
 * {@link #dataLengthUnsigned()} wherever the length is compared or allocated.
 *
 * @param command    raw command code (see {@link AdbCommand#fromCode(int)})
 * @param arg0       first argument (local id for OPEN)
 * @param arg1       second argument
 * @param dataLength number of payload bytes following the header
 * @param reserved   data check word; always 0 on emulator-originated packets
 * @param checksum   {@code command ^ 0xFFFFFFFF} on emulator-originated packets
 */
public record AdbHeader(
        int command,
        int arg0,
        int arg1,
        int dataLength,
        int reserved,
        int checksum
) {
    public Optional<AdbCommand> commandType() {
        return AdbCommand.fromCode(command);
    }

    public long dataLengthUnsigned() {
        return Integer.toUnsignedLong(dataLength);
    }

    @Override
    public String toString() {
        return "AdbHeader[" +
                "command=" + WireTags.toTag(command) +
                ", arg0=" + Integer.toUnsignedString(arg0) +
                ", arg1=" + Integer.toUnsignedString(arg1) +
                ", dataLength=" + Integer.toUnsignedString(dataLength) +
                ']';
    }
}
