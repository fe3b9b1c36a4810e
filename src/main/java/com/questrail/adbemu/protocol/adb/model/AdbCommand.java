package com.questrail.adbemu.protocol.adb.model;

import java.util.Optional;

/**
 * Connection-layer command carried in the first field of every packet header.
 *
 * <h2>Why this type exists</h2>
 * <p>
 * On the wire a command is a four-character ASCII tag read as a little-endian
 * integer. Comparing raw integers against hand-written hex constants makes it
 * easy to mismatch a tag and its code silently; this enumeration derives every
 * code from its tag through {@link WireTags} so the two can never disagree.
 * </p>
 *
 * <p>
 * Inbound headers may carry codes that are not listed here. Those are kept as
 * raw integers at the frame level and resolved with {@link #fromCode(int)}.
 * </p>
 */
public enum AdbCommand
{
    SYNC("SYNC"),
    CNXN("CNXN"),
    AUTH("AUTH"),
    OPEN("OPEN"),
    OKAY("OKAY"),
    CLSE("CLSE"),
    WRTE("WRTE"),
    STLS("STLS");

    private final String tag;
    private final int code;

    AdbCommand(String tag)
    {
        this.tag = tag;
        this.code = WireTags.toCode(tag);
    }

    /** The four-character ASCII tag, e.g. {@code "OPEN"}. */
    public String tag()
    {
        return tag;
    }

    /** The little-endian integer code transmitted on the wire. */
    public int code()
    {
        return code;
    }

    /**
     * Resolves a wire code to a known command.
     *
     * @return the matching command, or {@link Optional#empty()} for codes this
     *         emulator does not know
     */
    public static Optional<AdbCommand> fromCode(int code)
    {
        for (AdbCommand command : values()) {
            if (command.code == code) {
                return Optional.of(command);
            }
        }
        return Optional.empty();
    }
}
